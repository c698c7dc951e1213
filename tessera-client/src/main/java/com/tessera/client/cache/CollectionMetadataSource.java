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

package com.tessera.client.cache;

import com.tessera.client.routing.CollectionDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Authoritative source of collection metadata, read by {@link CachingCollectionCache} on a miss.
 */
public interface CollectionMetadataSource {

    /**
     * Reads the current identity of a collection. The future completes exceptionally with a
     * {@link com.tessera.client.transport.DispatchException} of kind {@code NOT_FOUND} if no
     * collection has that name.
     */
    CompletableFuture<CollectionDescriptor> fetchAsync(String collectionLink);
}
