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

import com.tessera.client.request.QueryRequest;
import com.tessera.client.request.ResourceType;
import com.tessera.client.routing.CollectionDescriptor;
import com.tessera.client.transport.DispatchException;
import com.tessera.client.transport.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingCollectionCacheTest {
    private static final String LINK = "dbs/app/colls/orders";

    private static class CountingSource implements CollectionMetadataSource {
        private final AtomicInteger fetches = new AtomicInteger();
        private volatile String resourceId = "rid-1";

        @Override
        public CompletableFuture<CollectionDescriptor> fetchAsync(String collectionLink) {
            fetches.incrementAndGet();
            if (resourceId == null) {
                return CompletableFuture.failedFuture(new DispatchException(FailureKind.NOT_FOUND, collectionLink));
            }
            return CompletableFuture.completedFuture(new CollectionDescriptor(collectionLink, resourceId, null));
        }
    }

    private QueryRequest request() {
        return new QueryRequest(ResourceType.DOCUMENT, LINK, null, Map.of());
    }

    @Test
    public void test_resolution_is_cached() {
        CountingSource source = new CountingSource();
        CachingCollectionCache cache = new CachingCollectionCache(source);

        assertEquals("rid-1", cache.resolveAsync(request()).join().resourceId());
        source.resourceId = "rid-2";
        assertEquals("rid-1", cache.resolveAsync(request()).join().resourceId());
        assertEquals(1, source.fetches.get());
    }

    @Test
    public void test_force_name_cache_refresh() {
        CountingSource source = new CountingSource();
        CachingCollectionCache cache = new CachingCollectionCache(source);
        cache.resolveAsync(request()).join();

        source.resourceId = "rid-2";
        QueryRequest forced = request();
        forced.setForceNameCacheRefresh(true);

        assertEquals("rid-2", cache.resolveAsync(forced).join().resourceId());
        assertEquals("rid-2", cache.resolveAsync(request()).join().resourceId());
    }

    @Test
    public void test_invalidate() {
        CountingSource source = new CountingSource();
        CachingCollectionCache cache = new CachingCollectionCache(source);
        cache.resolveAsync(request()).join();

        source.resourceId = "rid-2";
        cache.invalidate(LINK);
        cache.invalidate(LINK);

        assertEquals("rid-2", cache.resolveAsync(request()).join().resourceId());
        assertEquals(2, source.fetches.get());
    }

    @Test
    public void test_failed_resolution_is_not_cached() {
        CountingSource source = new CountingSource();
        source.resourceId = null;
        CachingCollectionCache cache = new CachingCollectionCache(source);

        assertTrue(cache.resolveAsync(request()).isCompletedExceptionally());

        source.resourceId = "rid-3";
        assertEquals("rid-3", cache.resolveAsync(request()).join().resourceId());
    }
}
