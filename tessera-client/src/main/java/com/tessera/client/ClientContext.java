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
import com.tessera.client.retry.RetryBudget;
import com.tessera.client.routing.QueryPartitionProvider;
import com.tessera.client.transport.Transport;

/**
 * The collaborators shared by every query execution context of a client.
 */
public interface ClientContext {

    /**
     * Retrieves the engine configuration.
     *
     * @return the engine configuration.
     */
    QueryEngineConfig getConfig();

    /**
     * Retrieves the collection cache shared by all queries of this client.
     *
     * @return the collection cache.
     */
    CollectionCache getCollectionCache();

    /**
     * Retrieves the partition map cache shared by all queries of this client.
     *
     * @return the partition key range cache.
     */
    PartitionKeyRangeCache getPartitionKeyRangeCache();

    /**
     * Retrieves the query predicate extractor.
     *
     * @return the query partition provider.
     */
    QueryPartitionProvider getQueryPartitionProvider();

    /**
     * Retrieves the transport that dispatches routed requests.
     *
     * @return the transport.
     */
    Transport getTransport();

    /**
     * Retrieves the budget bounding the retries of a logical call.
     *
     * @return the retry budget.
     */
    RetryBudget getRetryBudget();
}
