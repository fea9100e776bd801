/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.common.exception;

/**
 * Base exception for all ShopBus errors.
 */
public class ShopBusException extends RuntimeException {
    private final String errorCode;

    public ShopBusException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ShopBusException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
