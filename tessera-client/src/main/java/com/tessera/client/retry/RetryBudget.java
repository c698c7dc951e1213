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

import java.time.Duration;
import java.util.Optional;

/**
 * Bounds the retries of a logical call and schedules them.
 */
public interface RetryBudget {

    /**
     * Decides whether another budgeted retry may run.
     *
     * @param context retry state of the current call
     * @return the delay before the next attempt, or empty to stop retrying
     */
    Optional<Duration> nextDelay(RetryContext context);
}
