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

import com.tessera.client.request.ResourceType;
import com.tessera.client.transport.DispatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link RetryPolicy}. The first policy that claims a failure decides; a failure no
 * policy claims is terminal.
 */
public class RetryPolicyChain {
    private final List<RetryPolicy> policies;

    public RetryPolicyChain(List<RetryPolicy> policies) {
        this.policies = List.copyOf(policies);
    }

    /**
     * Builds the chain used for queries over the given resource type. Partition key range recovery
     * only applies to partitioned resources.
     */
    public static RetryPolicyChain forResourceType(ResourceType resourceType) {
        List<RetryPolicy> policies = new ArrayList<>();
        policies.add(new InvalidPartitionRetryPolicy());
        if (resourceType.isPartitioned()) {
            policies.add(new PartitionKeyRangeGoneRetryPolicy());
        }
        return new RetryPolicyChain(policies);
    }

    public List<RetryPolicy> getPolicies() {
        return policies;
    }

    public Optional<RetryDecision> classify(DispatchException failure, RetryContext context) {
        for (RetryPolicy policy : policies) {
            Optional<RetryDecision> decision = policy.classify(failure, context);
            if (decision.isPresent()) {
                return decision;
            }
        }
        return Optional.empty();
    }
}
