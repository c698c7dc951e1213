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
import com.tessera.client.transport.FailureKind;

import java.util.Optional;

/**
 * Handles {@link FailureKind#PARTITION_KEY_RANGE_GONE}: the targeted range was split or merged while
 * the request was in flight. The partition map of the collection is refreshed and the call retried
 * once, re-resolving its target range.
 */
public class PartitionKeyRangeGoneRetryPolicy implements RetryPolicy {

    @Override
    public Optional<RetryDecision> classify(DispatchException failure, RetryContext context) {
        if (failure.getKind() != FailureKind.PARTITION_KEY_RANGE_GONE) {
            return Optional.empty();
        }
        if (context.hasRefreshed(CacheRefresh.PARTITION_KEY_RANGES)) {
            return Optional.empty();
        }
        return Optional.of(RetryDecision.refreshAndRetry(CacheRefresh.PARTITION_KEY_RANGES, true));
    }
}
