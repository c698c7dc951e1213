/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.client;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Settings of the query engine, read from the {@code engine} section of the configuration.
 */
public class QueryEngineConfig {
    private final String protocolVersion;
    private final int maxAttempts;
    private final Duration initialInterval;
    private final double multiplier;
    private final Duration maxWait;

    public QueryEngineConfig(String protocolVersion, int maxAttempts, Duration initialInterval, double multiplier, Duration maxWait) {
        this.protocolVersion = protocolVersion;
        this.maxAttempts = maxAttempts;
        this.initialInterval = initialInterval;
        this.multiplier = multiplier;
        this.maxWait = maxWait;
    }

    /**
     * Loads the configuration from the classpath, {@code application.conf} over
     * {@code reference.conf}.
     */
    public static QueryEngineConfig load() {
        return fromConfig(ConfigFactory.load());
    }

    public static QueryEngineConfig fromConfig(Config config) {
        return new QueryEngineConfig(
                requireString(config, "engine.protocol_version"),
                requireInt(config, "engine.retry.max_attempts"),
                requireDuration(config, "engine.retry.initial_interval"),
                requireDouble(config, "engine.retry.multiplier"),
                requireDuration(config, "engine.retry.max_wait")
        );
    }

    private static void checkPath(Config config, String path) {
        if (!config.hasPath(path)) {
            throw new MissingConfigException(path + " is missing in configuration");
        }
    }

    private static String requireString(Config config, String path) {
        checkPath(config, path);
        String value = config.getString(path);
        if (value.isBlank()) {
            throw new IllegalArgumentException(path + " is empty or blank");
        }
        return value;
    }

    private static int requireInt(Config config, String path) {
        checkPath(config, path);
        return config.getInt(path);
    }

    private static double requireDouble(Config config, String path) {
        checkPath(config, path);
        return config.getDouble(path);
    }

    private static Duration requireDuration(Config config, String path) {
        checkPath(config, path);
        return config.getDuration(path);
    }

    /**
     * Returns the protocol version sent with requests that do not carry one.
     */
    public String getProtocolVersion() {
        return protocolVersion;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxWait() {
        return maxWait;
    }
}
