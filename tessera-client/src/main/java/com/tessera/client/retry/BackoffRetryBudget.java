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

package com.tessera.client.retry;

import com.tessera.client.QueryEngineConfig;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link RetryBudget} allowing up to {@code maxAttempts} attempts per call with exponential backoff
 * between them, as long as the accumulated wait stays under {@code maxWait}.
 */
public class BackoffRetryBudget implements RetryBudget {
    private final int maxAttempts;
    private final Duration maxWait;
    private final IntervalFunction intervalFunction;

    public BackoffRetryBudget(int maxAttempts, Duration initialInterval, double multiplier, Duration maxWait) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be greater than zero");
        }
        this.maxAttempts = maxAttempts;
        this.maxWait = maxWait;
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(initialInterval, multiplier);
    }

    public static BackoffRetryBudget fromConfig(QueryEngineConfig config) {
        return new BackoffRetryBudget(
                config.getMaxAttempts(),
                config.getInitialInterval(),
                config.getMultiplier(),
                config.getMaxWait()
        );
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public Optional<Duration> nextDelay(RetryContext context) {
        // The first attempt is not a retry
        int retry = context.getBudgetedRetries() + 1;
        if (retry >= maxAttempts) {
            return Optional.empty();
        }
        Duration delay = Duration.ofMillis(intervalFunction.apply(retry));
        if (context.getTotalWait().plus(delay).compareTo(maxWait) > 0) {
            return Optional.empty();
        }
        return Optional.of(delay);
    }
}
