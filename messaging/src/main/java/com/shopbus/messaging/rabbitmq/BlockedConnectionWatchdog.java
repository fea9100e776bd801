/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.rabbitmq;

import com.rabbitmq.client.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Aborts a connection the broker has kept blocked (resource alarm) for longer than the
 * configured timeout, so the next publish reconnects instead of hanging.
 *
 * Callbacks arrive on the client's I/O thread; expiry runs on the supplied scheduler.
 */
class BlockedConnectionWatchdog {

    private static final Logger log = LoggerFactory.getLogger(BlockedConnectionWatchdog.class);

    private final Connection connection;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pending;

    BlockedConnectionWatchdog(Connection connection, Duration timeout, ScheduledExecutorService scheduler) {
        this.connection = connection;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    void install() {
        connection.addBlockedListener(this::onBlocked, this::onUnblocked);
    }

    synchronized void onBlocked(String reason) {
        log.warn("Broker blocked connection: {} (aborting after {}ms)", reason, timeout.toMillis());
        if (pending != null) return;
        pending = scheduler.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void onUnblocked() {
        log.info("Broker unblocked connection");
        cancel();
    }

    synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    synchronized boolean isArmed() {
        return pending != null;
    }

    private void expire() {
        synchronized (this) {
            pending = null;
        }
        log.error("Connection blocked for more than {}ms, aborting", timeout.toMillis());
        connection.abort();
    }
}
