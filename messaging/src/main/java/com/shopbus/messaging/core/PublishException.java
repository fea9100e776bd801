/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.core;

import com.shopbus.common.exception.ShopBusException;

/**
 * Broker-level failure while connecting or publishing. Never retried locally.
 */
public class PublishException extends ShopBusException {

    public static final String CONNECT_FAILED = "BROKER_CONNECT";
    public static final String PUBLISH_FAILED = "BROKER_PUBLISH";

    public PublishException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
