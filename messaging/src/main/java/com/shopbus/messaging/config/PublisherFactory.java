/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.messaging.config;

import com.shopbus.common.config.EnvironmentResolver;
import com.shopbus.messaging.core.MessagePublisher;
import com.shopbus.messaging.rabbitmq.AmqpSettings;
import com.shopbus.messaging.rabbitmq.RabbitMQPublisher;

import java.util.Map;

/**
 * Factory to create MessagePublisher instances from environment-style configuration.
 */
public final class PublisherFactory {

    private PublisherFactory() {}

    /** Build from the process environment. Does not connect. */
    public static MessagePublisher fromSystemEnvironment() {
        return create(AmqpSettings.fromEnvironment(EnvironmentResolver.system()));
    }

    public static MessagePublisher fromEnvironment(Map<String, String> env) {
        return create(AmqpSettings.fromEnvironment(EnvironmentResolver.of(env)));
    }

    public static MessagePublisher create(AmqpSettings settings) {
        return new RabbitMQPublisher(settings);
    }
}
