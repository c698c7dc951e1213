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

import com.tessera.client.cache.CachingCollectionCache;
import com.tessera.client.cache.CachingPartitionKeyRangeCache;
import com.tessera.client.retry.BackoffRetryBudget;
import org.junit.jupiter.api.BeforeEach;

import java.time.Duration;

/**
 * Wires an execution environment over an {@link InMemoryCluster} with a partitioned collection
 * {@link #COLLECTION_LINK} whose resource id is {@link #COLLECTION_RID}.
 */
public class BaseQueryEngineTest {
    protected static final String COLLECTION_LINK = "dbs/app/colls/orders";
    protected static final String COLLECTION_RID = "rid-orders";

    protected InMemoryCluster cluster;
    protected FakeQueryPartitionProvider queryPartitionProvider;
    protected RecordingCollectionCache collectionCache;
    protected RecordingPartitionKeyRangeCache partitionKeyRangeCache;
    protected ClientContext context;

    @BeforeEach
    public void setupEngine() {
        cluster = new InMemoryCluster();
        cluster.createCollection(COLLECTION_LINK, COLLECTION_RID, true);
        queryPartitionProvider = new FakeQueryPartitionProvider(cluster);
        collectionCache = new RecordingCollectionCache(new CachingCollectionCache(cluster));
        partitionKeyRangeCache = new RecordingPartitionKeyRangeCache(new CachingPartitionKeyRangeCache(cluster));
        QueryEngineConfig config = QueryEngineConfig.load();
        BackoffRetryBudget retryBudget = new BackoffRetryBudget(config.getMaxAttempts(), Duration.ofMillis(1), 1.0, Duration.ofSeconds(1));
        context = new ClientContextImpl(config, collectionCache, partitionKeyRangeCache, queryPartitionProvider, cluster, retryBudget);
    }
}
