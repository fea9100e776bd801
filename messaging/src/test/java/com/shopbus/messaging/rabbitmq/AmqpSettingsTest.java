package com.shopbus.messaging.rabbitmq;

import com.shopbus.common.config.EnvironmentResolver;
import com.shopbus.common.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmqpSettingsTest {

    private static Map<String, String> requiredOnly() {
        Map<String, String> env = new HashMap<>();
        env.put("AMQP_HOST", "rabbitmq");
        env.put("AMQP_USER", "guest");
        env.put("AMQP_PASS", "guest-pass");
        return env;
    }

    @Test
    void shouldListAllMissingRequiredVariables() {
        assertThatThrownBy(() -> AmqpSettings.fromEnvironment(EnvironmentResolver.of(Map.of())))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> {
                    assertThat(e.getMissingKeys()).containsExactly("AMQP_HOST", "AMQP_USER", "AMQP_PASS");
                    assertThat(e.getMessage())
                            .isEqualTo("Missing RabbitMQ env vars: AMQP_HOST, AMQP_USER, AMQP_PASS");
                });
    }

    @Test
    void shouldListOnlyTheMissingOnes() {
        Map<String, String> env = requiredOnly();
        env.remove("AMQP_USER");

        assertThatThrownBy(() -> AmqpSettings.fromEnvironment(EnvironmentResolver.of(env)))
                .isInstanceOfSatisfying(ConfigurationException.class, e ->
                        assertThat(e.getMissingKeys()).containsExactly("AMQP_USER"));
    }

    @Test
    void shouldApplyDefaults() {
        AmqpSettings settings = AmqpSettings.fromEnvironment(EnvironmentResolver.of(requiredOnly()));

        assertThat(settings.host()).isEqualTo("rabbitmq");
        assertThat(settings.port()).isEqualTo(5672);
        assertThat(settings.virtualHost()).isEqualTo("/");
        assertThat(settings.exchange()).isEqualTo("robot-shop");
        assertThat(settings.exchangeType()).isEqualTo("direct");
        assertThat(settings.routingKey()).isEqualTo("orders");
        assertThat(settings.heartbeatSeconds()).isEqualTo(30);
        assertThat(settings.blockedConnectionTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldUseConfiguredOverrides() {
        Map<String, String> env = requiredOnly();
        env.put("AMQP_VHOST", "shop");
        env.put("AMQP_EXCHANGE", "payments");
        env.put("AMQP_EXCHANGE_TYPE", "topic");
        env.put("AMQP_ROUTING_KEY", "orders.paid");
        env.put("AMQP_PORT", "5673");
        env.put("AMQP_HEARTBEAT", "10");
        env.put("AMQP_BLOCKED_TIMEOUT", "0");

        AmqpSettings settings = AmqpSettings.fromEnvironment(EnvironmentResolver.of(env));

        assertThat(settings.virtualHost()).isEqualTo("shop");
        assertThat(settings.exchange()).isEqualTo("payments");
        assertThat(settings.exchangeType()).isEqualTo("topic");
        assertThat(settings.routingKey()).isEqualTo("orders.paid");
        assertThat(settings.port()).isEqualTo(5673);
        assertThat(settings.heartbeatSeconds()).isEqualTo(10);
        assertThat(settings.blockedConnectionTimeout()).isZero();
    }

    @Test
    void shouldRejectUnknownExchangeType() {
        Map<String, String> env = requiredOnly();
        env.put("AMQP_EXCHANGE_TYPE", "broadcast");

        assertThatThrownBy(() -> AmqpSettings.fromEnvironment(EnvironmentResolver.of(env)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broadcast");
    }

    @Test
    void shouldAcceptPluginExchangeType() {
        Map<String, String> env = requiredOnly();
        env.put("AMQP_EXCHANGE_TYPE", "x-delayed-message");

        assertThat(AmqpSettings.fromEnvironment(EnvironmentResolver.of(env)).exchangeType())
                .isEqualTo("x-delayed-message");
    }

    @Test
    void shouldRejectOutOfRangePort() {
        Map<String, String> env = requiredOnly();
        env.put("AMQP_PORT", "70000");

        assertThatThrownBy(() -> AmqpSettings.fromEnvironment(EnvironmentResolver.of(env)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void shouldMaskPasswordInToString() {
        AmqpSettings settings = AmqpSettings.fromEnvironment(EnvironmentResolver.of(requiredOnly()));

        assertThat(settings.toString()).doesNotContain("guest-pass").contains("password=****");
    }
}
