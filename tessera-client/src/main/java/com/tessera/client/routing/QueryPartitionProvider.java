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

package com.tessera.client.routing;

import com.tessera.client.request.SqlQuerySpec;

/**
 * Extracts partitioning predicates from a query.
 * <p>
 * The extractor may depend on a platform-specific parser. When it is unavailable the engine
 * sends queries through the gateway instead of routing them itself.
 */
public interface QueryPartitionProvider {

    /**
     * Returns whether the extractor can be used on this platform.
     */
    boolean isAvailable();

    /**
     * Computes the key ranges the query touches.
     *
     * @param querySpec              the query
     * @param partitionKeyDefinition the collection's partition key definition
     * @return the partitioning info of the query
     * @throws com.tessera.client.InputInvalidException if the query cannot be parsed
     */
    QueryPartitioningInfo getPartitioningInfo(SqlQuerySpec querySpec, PartitionKeyDefinition partitionKeyDefinition);
}
