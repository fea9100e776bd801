/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.core;

import com.shopbus.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base publisher with the lazy connect-before-send flow and statistics tracking.
 * Subclasses implement doConnect(), doPublish(), doDisconnect() and isConnected().
 */
public abstract class AbstractPublisher implements MessagePublisher {

    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected volatile ConnectionState state = ConnectionState.DISCONNECTED;

    private final AtomicLong sentCount = new AtomicLong();
    private final AtomicLong errorCount = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong connectCount = new AtomicLong();

    @Override
    public void connect() {
        if (isConnected()) return;
        if (state == ConnectionState.CONNECTED) {
            log.info("Broker connection lost, reconnecting");
            state = ConnectionState.DISCONNECTED;
            doDisconnect();
        }
        doConnect();
        connectCount.incrementAndGet();
        state = ConnectionState.CONNECTED;
    }

    @Override
    public void publish(Object message, Map<String, Object> headers) {
        byte[] body;
        try {
            connect();
            body = JsonUtil.toJsonBytes(message);
            doPublish(body, headers != null ? headers : Map.of());
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            throw e;
        }
        sentCount.incrementAndGet();
        bytesSent.addAndGet(body.length);
    }

    @Override
    public ConnectionState getState() { return state; }

    @Override
    public PublisherStats getStats() {
        return new PublisherStats(sentCount.get(), errorCount.get(), bytesSent.get(),
                connectCount.get(), isConnected());
    }

    @Override
    public void close() {
        if (state != ConnectionState.CONNECTED) return;
        doDisconnect();
        state = ConnectionState.CLOSED;
    }

    /** Open connection and channel and declare topology. Throws {@link PublishException} on failure. */
    protected abstract void doConnect();

    protected abstract void doPublish(byte[] body, Map<String, Object> headers);

    /** Release broker resources. Must not throw. */
    protected abstract void doDisconnect();
}
