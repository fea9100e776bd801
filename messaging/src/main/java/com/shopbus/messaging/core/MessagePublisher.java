/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.core;

import java.util.Map;

/**
 * Publishes JSON-encoded messages to a single, pre-configured destination.
 *
 * Implementations connect lazily and are not thread-safe: one instance per thread,
 * or synchronize externally.
 */
public interface MessagePublisher extends AutoCloseable {

    /** Publish a message with no headers. */
    default void publish(Object message) {
        publish(message, Map.of());
    }

    /**
     * Serialize {@code message} to JSON and send it. Blocks until the broker client
     * has written the frame; there is no delivery confirmation.
     *
     * @param headers message headers, may be null
     * @throws PublishException on any broker failure
     */
    void publish(Object message, Map<String, Object> headers);

    /** Open the connection now instead of on first publish. No-op when already connected. */
    void connect();

    boolean isConnected();

    ConnectionState getState();

    PublisherStats getStats();

    /** Release the connection. Safe to call repeatedly. */
    @Override
    void close();

    record PublisherStats(long messagesSent, long messagesErrored, long bytesSent,
                          long connectionsOpened, boolean connected) {}
}
