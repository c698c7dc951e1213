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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.client.cache.CollectionMetadataSource;
import com.tessera.client.cache.PartitionKeyRangeSource;
import com.tessera.client.request.PartitionKeyRangeIdentity;
import com.tessera.client.request.QueryHeaders;
import com.tessera.client.request.QueryRequest;
import com.tessera.client.routing.CollectionDescriptor;
import com.tessera.client.routing.KeyRange;
import com.tessera.client.routing.PartitionKeyDefinition;
import com.tessera.client.routing.PartitionKeyRange;
import com.tessera.client.transport.DispatchException;
import com.tessera.client.transport.FailureKind;
import com.tessera.client.transport.StoreResponse;
import com.tessera.client.transport.Transport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single process stand-in for the database: collection metadata, partition maps and documents,
 * served through the source and transport interfaces.
 * <p>
 * Documents are keyed by {@code epk|id}. The backend continuation of a range is the key of the
 * last document returned, so it stays valid in the children of a split range.
 */
public class InMemoryCluster implements CollectionMetadataSource, PartitionKeyRangeSource, Transport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, CollectionDescriptor> collections = new ConcurrentHashMap<>();
    private final Map<String, List<PartitionKeyRange>> partitionMaps = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<String, ObjectNode>> documents = new ConcurrentHashMap<>();
    private final Map<String, List<KeyRange>> queryRanges = new ConcurrentHashMap<>();
    private final List<QueryRequest> dispatched = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<DispatchException> injectedFailures = new ConcurrentLinkedDeque<>();
    private final AtomicInteger collectionFetches = new AtomicInteger();
    private final AtomicInteger partitionMapFetches = new AtomicInteger();
    private volatile int pageSize = 2;
    private volatile String queryMetrics;

    public void createCollection(String link, String collectionRid, boolean partitioned) {
        PartitionKeyDefinition partitionKey = partitioned ? PartitionKeyDefinition.of("/pk") : null;
        collections.put(link, new CollectionDescriptor(link, collectionRid, partitionKey));
        partitionMaps.put(collectionRid, List.of(new PartitionKeyRange("0", KeyRange.MIN_INCLUSIVE, KeyRange.MAX_EXCLUSIVE)));
        documents.put(collectionRid, new ConcurrentSkipListMap<>());
    }

    /**
     * Deletes the collection behind {@code link} and creates a new, empty one under the same name.
     */
    public void recreateCollection(String link, String newCollectionRid) {
        CollectionDescriptor old = collections.get(link);
        partitionMaps.remove(old.resourceId());
        documents.remove(old.resourceId());
        createCollection(link, newCollectionRid, old.isPartitioned());
    }

    public void setPartitionMap(String collectionRid, List<PartitionKeyRange> ranges) {
        partitionMaps.put(collectionRid, List.copyOf(ranges));
    }

    /**
     * Splits range {@code parentId} at {@code splitPoint} into two new ranges.
     */
    public void split(String collectionRid, String parentId, String splitPoint, String leftId, String rightId) {
        List<PartitionKeyRange> ranges = new ArrayList<>();
        for (PartitionKeyRange range : partitionMaps.get(collectionRid)) {
            if (range.id().equals(parentId)) {
                ranges.add(new PartitionKeyRange(leftId, range.minInclusive(), splitPoint, List.of(parentId)));
                ranges.add(new PartitionKeyRange(rightId, splitPoint, range.maxExclusive(), List.of(parentId)));
            } else {
                ranges.add(range);
            }
        }
        setPartitionMap(collectionRid, ranges);
    }

    public void insert(String collectionRid, String effectivePartitionKey, String id) {
        ObjectNode document = MAPPER.createObjectNode();
        document.put("id", id);
        document.put("epk", effectivePartitionKey);
        documents.get(collectionRid).put(effectivePartitionKey + "|" + id, document);
    }

    /**
     * Restricts the documents a query text matches to the given ranges.
     */
    public void registerQuery(String queryText, List<KeyRange> ranges) {
        queryRanges.put(queryText, List.copyOf(ranges));
    }

    public List<KeyRange> getQueryRanges(String queryText) {
        return queryRanges.getOrDefault(queryText, List.of(KeyRange.FULL));
    }

    public void failNext(DispatchException failure) {
        injectedFailures.add(failure);
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public void setQueryMetrics(String queryMetrics) {
        this.queryMetrics = queryMetrics;
    }

    public List<QueryRequest> getDispatched() {
        return dispatched;
    }

    public int getCollectionFetches() {
        return collectionFetches.get();
    }

    public int getPartitionMapFetches() {
        return partitionMapFetches.get();
    }

    @Override
    public CompletableFuture<CollectionDescriptor> fetchAsync(String collectionLink) {
        collectionFetches.incrementAndGet();
        CollectionDescriptor descriptor = collections.get(collectionLink);
        if (descriptor == null) {
            return CompletableFuture.failedFuture(new DispatchException(FailureKind.NOT_FOUND, "No collection " + collectionLink));
        }
        return CompletableFuture.completedFuture(descriptor);
    }

    @Override
    public CompletableFuture<List<PartitionKeyRange>> fetchRangesAsync(String collectionRid) {
        partitionMapFetches.incrementAndGet();
        return CompletableFuture.completedFuture(partitionMaps.getOrDefault(collectionRid, List.of()));
    }

    @Override
    public CompletableFuture<StoreResponse> sendAsync(QueryRequest request) {
        dispatched.add(request);
        DispatchException injected = injectedFailures.poll();
        if (injected != null) {
            return CompletableFuture.failedFuture(injected);
        }

        CollectionDescriptor collection = collections.get(request.getResourceLink());
        if (collection == null) {
            return CompletableFuture.failedFuture(new DispatchException(FailureKind.NOT_FOUND, "No collection " + request.getResourceLink()));
        }

        KeyRange scope = KeyRange.FULL;
        PartitionKeyRangeIdentity identity = request.getPartitionKeyRangeIdentity();
        if (identity != null) {
            if (!identity.collectionRid().equals(collection.resourceId())) {
                return CompletableFuture.failedFuture(new DispatchException(FailureKind.INVALID_PARTITION,
                        "Collection " + identity.collectionRid() + " no longer exists"));
            }
            PartitionKeyRange range = findRange(collection.resourceId(), identity.partitionKeyRangeId());
            if (range == null) {
                return CompletableFuture.failedFuture(new DispatchException(FailureKind.PARTITION_KEY_RANGE_GONE,
                        "Partition key range " + identity.partitionKeyRangeId() + " is gone"));
            }
            scope = range.toRange();
        }

        List<KeyRange> filters = request.getQuerySpec() == null
                ? List.of(KeyRange.FULL)
                : getQueryRanges(request.getQuerySpec().queryText());
        String partitionKey = request.getHeader(QueryHeaders.PARTITION_KEY);
        if (partitionKey != null) {
            filters = List.of(KeyRange.point(partitionKey));
        }

        String after = request.getHeader(QueryHeaders.CONTINUATION);
        NavigableMap<String, ObjectNode> stored = documents.get(collection.resourceId());
        NavigableMap<String, ObjectNode> candidates = after == null ? stored : stored.tailMap(after, false);

        ArrayNode page = MAPPER.createArrayNode();
        String lastKey = null;
        boolean more = false;
        for (Entry<String, ObjectNode> entry : candidates.entrySet()) {
            String epk = entry.getValue().get("epk").asText();
            if (!scope.contains(epk) || !matches(filters, epk)) {
                continue;
            }
            if (page.size() == pageSize) {
                more = true;
                break;
            }
            page.add(entry.getValue());
            lastKey = entry.getKey();
        }

        Map<String, String> headers = new HashMap<>();
        headers.put(QueryHeaders.REQUEST_CHARGE, "2.5");
        headers.put(QueryHeaders.ACTIVITY_ID, UUID.randomUUID().toString());
        if (more) {
            headers.put(QueryHeaders.CONTINUATION, lastKey);
        }
        if (queryMetrics != null && "true".equals(request.getHeader(QueryHeaders.POPULATE_QUERY_METRICS))) {
            headers.put(QueryHeaders.QUERY_METRICS, queryMetrics);
        }

        ObjectNode body = MAPPER.createObjectNode();
        body.set("Documents", page);
        body.put("_count", page.size());
        try {
            return CompletableFuture.completedFuture(new StoreResponse(headers, MAPPER.writeValueAsBytes(body)));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private PartitionKeyRange findRange(String collectionRid, String id) {
        for (PartitionKeyRange range : partitionMaps.getOrDefault(collectionRid, List.of())) {
            if (range.id().equals(id)) {
                return range;
            }
        }
        return null;
    }

    private boolean matches(List<KeyRange> filters, String epk) {
        for (KeyRange filter : filters) {
            if (filter.contains(epk)) {
                return true;
            }
        }
        return false;
    }
}
