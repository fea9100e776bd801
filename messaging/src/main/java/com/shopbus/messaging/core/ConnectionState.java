/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.core;

/**
 * Connection lifecycle states for a publisher.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    CLOSED
}
