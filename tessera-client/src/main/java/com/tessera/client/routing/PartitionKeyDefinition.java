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

import java.util.List;

/**
 * The document paths whose values form a collection's partition key, e.g. {@code /tenantId}.
 */
public record PartitionKeyDefinition(List<String> paths) {

    public PartitionKeyDefinition {
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("partition key definition requires at least one path");
        }
        paths = List.copyOf(paths);
    }

    public static PartitionKeyDefinition of(String... paths) {
        return new PartitionKeyDefinition(List.of(paths));
    }
}
