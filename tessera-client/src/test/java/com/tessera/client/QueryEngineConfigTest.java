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
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineConfigTest {

    @Test
    public void test_reference_defaults() {
        QueryEngineConfig config = QueryEngineConfig.load();

        assertEquals("2018-12-31", config.getProtocolVersion());
        assertEquals(9, config.getMaxAttempts());
        assertEquals(Duration.ofMillis(10), config.getInitialInterval());
        assertEquals(2.0, config.getMultiplier());
        assertEquals(Duration.ofSeconds(30), config.getMaxWait());
    }

    @Test
    public void test_overrides() {
        Config overrides = ConfigFactory.parseString("engine.retry.max_attempts = 3, engine.protocol_version = \"2020-07-15\"")
                .withFallback(ConfigFactory.defaultReference());

        QueryEngineConfig config = QueryEngineConfig.fromConfig(overrides);

        assertEquals(3, config.getMaxAttempts());
        assertEquals("2020-07-15", config.getProtocolVersion());
    }

    @Test
    public void test_missing_key() {
        Config config = ConfigFactory.parseString("engine.protocol_version = \"2018-12-31\"");
        MissingConfigException e = assertThrows(MissingConfigException.class, () -> QueryEngineConfig.fromConfig(config));
        assertTrue(e.getMessage().contains("engine.retry.max_attempts"));
    }
}
