/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.common.exception;

import java.util.List;

/**
 * Thrown when required configuration is absent or a configured value cannot be used.
 * When raised for missing variables, every missing name is reported, not just the first.
 */
public class ConfigurationException extends ShopBusException {

    private final List<String> missingKeys;

    public ConfigurationException(String message) {
        super("CONFIG_INVALID", message);
        this.missingKeys = List.of();
    }

    private ConfigurationException(String message, List<String> missingKeys) {
        super("CONFIG_MISSING", message);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public static ConfigurationException missing(String scope, List<String> missingKeys) {
        return new ConfigurationException(
                "Missing " + scope + " env vars: " + String.join(", ", missingKeys), missingKeys);
    }

    public List<String> getMissingKeys() { return missingKeys; }
}
