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

import javax.annotation.Nullable;

/**
 * Resolved identity of a collection.
 *
 * @param link         the name-based link the caller addressed, e.g. {@code dbs/app/colls/orders}
 * @param resourceId   the internal id the name currently maps to; changes when a collection is
 *                     deleted and recreated under the same name
 * @param partitionKey the partition key definition, {@code null} for a single-partition collection
 */
public record CollectionDescriptor(String link, String resourceId, @Nullable PartitionKeyDefinition partitionKey) {

    public boolean isPartitioned() {
        return partitionKey != null;
    }
}
