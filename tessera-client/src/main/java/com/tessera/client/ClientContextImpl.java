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

import com.tessera.client.cache.CollectionCache;
import com.tessera.client.cache.PartitionKeyRangeCache;
import com.tessera.client.retry.BackoffRetryBudget;
import com.tessera.client.retry.RetryBudget;
import com.tessera.client.routing.QueryPartitionProvider;
import com.tessera.client.transport.Transport;

import java.util.Objects;

/**
 * The ClientContextImpl class is the default implementation of the ClientContext interface.
 */
public class ClientContextImpl implements ClientContext {
    private final QueryEngineConfig config;
    private final CollectionCache collectionCache;
    private final PartitionKeyRangeCache partitionKeyRangeCache;
    private final QueryPartitionProvider queryPartitionProvider;
    private final Transport transport;
    private final RetryBudget retryBudget;

    public ClientContextImpl(
            QueryEngineConfig config,
            CollectionCache collectionCache,
            PartitionKeyRangeCache partitionKeyRangeCache,
            QueryPartitionProvider queryPartitionProvider,
            Transport transport
    ) {
        this(config, collectionCache, partitionKeyRangeCache, queryPartitionProvider, transport, BackoffRetryBudget.fromConfig(config));
    }

    public ClientContextImpl(
            QueryEngineConfig config,
            CollectionCache collectionCache,
            PartitionKeyRangeCache partitionKeyRangeCache,
            QueryPartitionProvider queryPartitionProvider,
            Transport transport,
            RetryBudget retryBudget
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.collectionCache = Objects.requireNonNull(collectionCache, "collectionCache");
        this.partitionKeyRangeCache = Objects.requireNonNull(partitionKeyRangeCache, "partitionKeyRangeCache");
        this.queryPartitionProvider = Objects.requireNonNull(queryPartitionProvider, "queryPartitionProvider");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.retryBudget = Objects.requireNonNull(retryBudget, "retryBudget");
    }

    @Override
    public QueryEngineConfig getConfig() {
        return config;
    }

    @Override
    public CollectionCache getCollectionCache() {
        return collectionCache;
    }

    @Override
    public PartitionKeyRangeCache getPartitionKeyRangeCache() {
        return partitionKeyRangeCache;
    }

    @Override
    public QueryPartitionProvider getQueryPartitionProvider() {
        return queryPartitionProvider;
    }

    @Override
    public Transport getTransport() {
        return transport;
    }

    @Override
    public RetryBudget getRetryBudget() {
        return retryBudget;
    }
}
