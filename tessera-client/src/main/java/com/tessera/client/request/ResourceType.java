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

package com.tessera.client.request;

public enum ResourceType {
    DATABASE(false),
    COLLECTION(false),
    DOCUMENT(true),
    PARTITION_KEY_RANGE(false),
    CONFLICT(true);

    private final boolean partitioned;

    ResourceType(boolean partitioned) {
        this.partitioned = partitioned;
    }

    /**
     * Returns whether resources of this type live inside a partition key range and therefore
     * require partition routing.
     */
    public boolean isPartitioned() {
        return partitioned;
    }
}
