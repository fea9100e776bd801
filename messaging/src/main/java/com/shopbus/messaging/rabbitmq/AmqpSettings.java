/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.rabbitmq;

import com.rabbitmq.client.BuiltinExchangeType;
import com.shopbus.common.config.EnvironmentResolver;
import com.shopbus.common.exception.ConfigurationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable connection and topology parameters for {@link RabbitMQPublisher}.
 *
 * <p>Environment variables:</p>
 * <pre>
 *   AMQP_HOST             required
 *   AMQP_USER             required
 *   AMQP_PASS             required
 *   AMQP_VHOST            default "/"
 *   AMQP_EXCHANGE         default "robot-shop"
 *   AMQP_EXCHANGE_TYPE    default "direct"
 *   AMQP_ROUTING_KEY      default "orders"
 *   AMQP_PORT             default 5672
 *   AMQP_HEARTBEAT        seconds, default 30
 *   AMQP_BLOCKED_TIMEOUT  seconds, default 30, 0 disables
 * </pre>
 */
public record AmqpSettings(String host,
                           int port,
                           String virtualHost,
                           String username,
                           String password,
                           String exchange,
                           String exchangeType,
                           String routingKey,
                           int heartbeatSeconds,
                           Duration blockedConnectionTimeout) {

    public static final String ENV_HOST = "AMQP_HOST";
    public static final String ENV_USER = "AMQP_USER";
    public static final String ENV_PASS = "AMQP_PASS";
    public static final String ENV_VHOST = "AMQP_VHOST";
    public static final String ENV_EXCHANGE = "AMQP_EXCHANGE";
    public static final String ENV_EXCHANGE_TYPE = "AMQP_EXCHANGE_TYPE";
    public static final String ENV_ROUTING_KEY = "AMQP_ROUTING_KEY";
    public static final String ENV_PORT = "AMQP_PORT";
    public static final String ENV_HEARTBEAT = "AMQP_HEARTBEAT";
    public static final String ENV_BLOCKED_TIMEOUT = "AMQP_BLOCKED_TIMEOUT";

    public static final String DEFAULT_VHOST = "/";
    public static final String DEFAULT_EXCHANGE = "robot-shop";
    public static final String DEFAULT_EXCHANGE_TYPE = "direct";
    public static final String DEFAULT_ROUTING_KEY = "orders";
    public static final int DEFAULT_PORT = 5672;
    public static final int DEFAULT_HEARTBEAT_SECONDS = 30;
    public static final int DEFAULT_BLOCKED_TIMEOUT_SECONDS = 30;

    public AmqpSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(virtualHost, "virtualHost");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(exchangeType, "exchangeType");
        Objects.requireNonNull(routingKey, "routingKey");
        Objects.requireNonNull(blockedConnectionTimeout, "blockedConnectionTimeout");
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("AMQP port out of range: " + port);
        }
        if (heartbeatSeconds < 0) {
            throw new ConfigurationException("AMQP heartbeat must not be negative: " + heartbeatSeconds);
        }
        if (blockedConnectionTimeout.isNegative()) {
            throw new ConfigurationException("Blocked connection timeout must not be negative");
        }
        if (!isKnownExchangeType(exchangeType)) {
            throw new ConfigurationException("Unsupported exchange type: " + exchangeType);
        }
    }

    /**
     * Read settings from the given environment. Every missing required variable is
     * reported in a single {@link ConfigurationException}.
     */
    public static AmqpSettings fromEnvironment(EnvironmentResolver env) {
        Map<String, String> required = env.requireAll("RabbitMQ", ENV_HOST, ENV_USER, ENV_PASS);
        return new AmqpSettings(
                required.get(ENV_HOST),
                env.getInt(ENV_PORT, DEFAULT_PORT),
                env.get(ENV_VHOST, DEFAULT_VHOST),
                required.get(ENV_USER),
                required.get(ENV_PASS),
                env.get(ENV_EXCHANGE, DEFAULT_EXCHANGE),
                env.get(ENV_EXCHANGE_TYPE, DEFAULT_EXCHANGE_TYPE),
                env.get(ENV_ROUTING_KEY, DEFAULT_ROUTING_KEY),
                env.getInt(ENV_HEARTBEAT, DEFAULT_HEARTBEAT_SECONDS),
                Duration.ofSeconds(env.getInt(ENV_BLOCKED_TIMEOUT, DEFAULT_BLOCKED_TIMEOUT_SECONDS)));
    }

    // Plugin exchange types (x-delayed-message, x-consistent-hash, ...) are passed through.
    private static boolean isKnownExchangeType(String type) {
        return type.startsWith("x-")
                || Arrays.stream(BuiltinExchangeType.values()).anyMatch(t -> t.getType().equals(type));
    }

    @Override
    public String toString() {
        return "AmqpSettings[host=" + host + ", port=" + port + ", virtualHost=" + virtualHost
                + ", username=" + username + ", password=****, exchange=" + exchange
                + ", exchangeType=" + exchangeType + ", routingKey=" + routingKey
                + ", heartbeatSeconds=" + heartbeatSeconds
                + ", blockedConnectionTimeout=" + blockedConnectionTimeout + "]";
    }
}
