/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.rabbitmq;

import com.fasterxml.jackson.databind.JsonNode;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import com.shopbus.common.util.JsonUtil;
import com.shopbus.messaging.core.AbstractPublisher;
import com.shopbus.messaging.core.PublishException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ publisher using AMQP 0-9-1.
 *
 * <p>Connection parameters are fixed at construction; nothing touches the network until the
 * first {@link #publish} or {@link #connect}. On connect the configured exchange is declared
 * durable. Every message goes to the same exchange and routing key as UTF-8 JSON.</p>
 *
 * <p>Automatic recovery in the client is switched off: a dropped connection is noticed on
 * the next publish and replaced then.</p>
 */
public class RabbitMQPublisher extends AbstractPublisher {

    static final String CONNECTION_NAME = "shopbus-publisher";
    static final String CONTENT_TYPE = "application/json";

    private final AmqpSettings settings;
    private final ConnectionFactory factory;

    private Connection connection;
    private Channel channel;
    private BlockedConnectionWatchdog watchdog;
    private ScheduledExecutorService watchdogExecutor;

    public RabbitMQPublisher(AmqpSettings settings) {
        this(settings, new ConnectionFactory());
    }

    public RabbitMQPublisher(AmqpSettings settings, ConnectionFactory factory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.factory = Objects.requireNonNull(factory, "factory");
        factory.setHost(settings.host());
        factory.setPort(settings.port());
        factory.setVirtualHost(settings.virtualHost());
        factory.setUsername(settings.username());
        factory.setPassword(settings.password());
        factory.setRequestedHeartbeat(settings.heartbeatSeconds());
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        log.debug("RabbitMQ publisher configured: {}", settings);
    }

    public AmqpSettings getSettings() { return settings; }

    @Override
    protected void doConnect() {
        Connection conn = null;
        try {
            conn = factory.newConnection(CONNECTION_NAME);
            Channel ch = conn.createChannel();
            if (ch == null) {
                throw new IOException("No channel available on connection");
            }
            ch.exchangeDeclare(settings.exchange(), settings.exchangeType(), true);
            installWatchdog(conn);
            connection = conn;
            channel = ch;
            log.info("Connected to broker {} vhost={}", settings.host(), settings.virtualHost());
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            if (conn != null) conn.abort();
            throw new PublishException(PublishException.CONNECT_FAILED,
                    "Failed to connect to broker " + settings.host() + ":" + settings.port()
                            + settings.virtualHost() + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void doPublish(byte[] body, Map<String, Object> headers) {
        try {
            AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                    .contentType(CONTENT_TYPE)
                    .contentEncoding("UTF-8")
                    .headers(toFieldTable(headers))
                    .build();
            channel.basicPublish(settings.exchange(), settings.routingKey(), props, body);
        } catch (IOException | RuntimeException e) {
            throw new PublishException(PublishException.PUBLISH_FAILED, "RabbitMQ publish failed", e);
        }
        log.info("Message sent to exchange {} with routing key {}", settings.exchange(), settings.routingKey());
    }

    @Override
    protected void doDisconnect() {
        if (watchdog != null) watchdog.cancel();
        try {
            if (connection != null && connection.isOpen()) connection.close();
        } catch (IOException | ShutdownSignalException e) {
            log.warn("Error closing RabbitMQ publisher", e);
        } finally {
            connection = null;
            channel = null;
            watchdog = null;
        }
    }

    @Override
    public void close() {
        super.close();
        if (watchdogExecutor != null) watchdogExecutor.shutdownNow();
    }

    @Override
    public boolean isConnected() {
        return connection != null && connection.isOpen() && channel != null && channel.isOpen();
    }

    private void installWatchdog(Connection conn) {
        if (settings.blockedConnectionTimeout().isZero()) return;
        if (watchdogExecutor == null || watchdogExecutor.isShutdown()) {
            watchdogExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "amqp-blocked-watchdog");
                t.setDaemon(true);
                return t;
            });
        }
        watchdog = new BlockedConnectionWatchdog(conn, settings.blockedConnectionTimeout(), watchdogExecutor);
        watchdog.install();
    }

    /**
     * Copy headers into an AMQP field table. Values the table cannot encode natively are
     * converted through Jackson: scalars to their text, objects to JSON text.
     */
    static Map<String, Object> toFieldTable(Map<?, ?> headers) {
        Map<String, Object> table = new LinkedHashMap<>();
        headers.forEach((k, v) -> table.put(String.valueOf(k), toFieldValue(v)));
        return table;
    }

    private static Object toFieldValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof Date || value instanceof byte[] || value instanceof LongString) {
            return value;
        }
        if (value instanceof BigDecimal decimal) {
            return isEncodableDecimal(decimal) ? decimal : decimal.toPlainString();
        }
        if (value instanceof Enum<?> e) return e.name();
        if (value instanceof Map<?, ?> map) return toFieldTable(map);
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            for (Object item : items) list.add(toFieldValue(item));
            return list;
        }
        JsonNode node = JsonUtil.mapper().valueToTree(value);
        return node.isTextual() ? node.asText() : node.toString();
    }

    // AMQP decimals are an unsigned 8-bit scale plus a signed 32-bit unscaled value.
    private static boolean isEncodableDecimal(BigDecimal decimal) {
        return decimal.scale() >= 0 && decimal.scale() <= 255
                && decimal.unscaledValue().bitLength() <= 31;
    }
}
