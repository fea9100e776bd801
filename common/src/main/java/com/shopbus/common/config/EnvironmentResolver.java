/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.shopbus.common.config;

import com.shopbus.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Reads configuration values from an environment-style lookup.
 *
 * <p>The lookup defaults to the process environment ({@link System#getenv(String)}); tests
 * and embedding code can supply a plain map instead. Blank values are treated as absent,
 * so {@code AMQP_VHOST=""} falls back to its default the same way an unset variable does.</p>
 *
 * <pre>{@code
 *   EnvironmentResolver env = EnvironmentResolver.system();
 *   Map<String, String> creds = env.requireAll("RabbitMQ", "AMQP_HOST", "AMQP_USER", "AMQP_PASS");
 *   String vhost = env.get("AMQP_VHOST", "/");
 * }</pre>
 */
public class EnvironmentResolver {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentResolver.class);

    private final Function<String, String> lookup;

    public EnvironmentResolver(Function<String, String> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /** Resolver backed by the process environment. */
    public static EnvironmentResolver system() {
        return new EnvironmentResolver(System::getenv);
    }

    /** Resolver backed by a fixed map (copied). */
    public static EnvironmentResolver of(Map<String, String> values) {
        Map<String, String> copy = new HashMap<>(values);
        return new EnvironmentResolver(copy::get);
    }

    /**
     * @return the value, or empty when unset or blank
     */
    public Optional<String> get(String key) {
        String val = lookup.apply(key);
        if (val == null || val.isBlank()) return Optional.empty();
        return Optional.of(val);
    }

    public String get(String key, String defaultValue) {
        Optional<String> val = get(key);
        if (val.isEmpty()) {
            log.debug("{} not set, using default: {}", key, defaultValue);
        }
        return val.orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        Optional<String> val = get(key);
        if (val.isEmpty()) return defaultValue;
        try {
            return Integer.parseInt(val.get().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + val.get() + "'");
        }
    }

    /**
     * Look up every key and fail once, naming all the absent ones.
     *
     * @param scope label used in the error message, e.g. "RabbitMQ"
     * @return values keyed by name, in the order requested
     * @throws ConfigurationException if any key is unset or blank
     */
    public Map<String, String> requireAll(String scope, String... keys) {
        Map<String, String> values = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (String key : keys) {
            get(key).ifPresentOrElse(v -> values.put(key, v), () -> missing.add(key));
        }
        if (!missing.isEmpty()) {
            ConfigurationException ex = ConfigurationException.missing(scope, missing);
            log.error(ex.getMessage());
            throw ex;
        }
        return values;
    }
}
