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

import com.tessera.client.transport.DispatchException;

import java.util.Optional;

/**
 * Classifies a failed dispatch. Policies are pure: they inspect the failure and the per-call retry
 * state and return advice, leaving the cache refresh and the retry itself to the orchestrator.
 */
public interface RetryPolicy {

    /**
     * @param failure the failure of the last attempt
     * @param context retry state of the current logical call
     * @return the advice, or empty if this policy does not handle the failure
     */
    Optional<RetryDecision> classify(DispatchException failure, RetryContext context);
}
