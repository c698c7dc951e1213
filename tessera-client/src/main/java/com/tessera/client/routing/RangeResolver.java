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

import com.tessera.client.InputInvalidException;
import com.tessera.client.cache.PartitionKeyRangeCache;
import com.tessera.client.request.QueryHeaders;
import com.tessera.client.request.SqlQuerySpec;
import com.tessera.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Decides which partition key range a query, or a query continuation, targets next, and computes the
 * composite continuation returned after a page has been read.
 * <p>
 * A continuation refers to the range it was issued for by id and bounds. When that range was split
 * in the meantime, the token is remapped to the child ranges covering the original bounds, visited in
 * ascending key order, each resuming from the parent's backend continuation.
 * <p>
 * Instances are stateless; the provided ranges of a query are cached by the caller.
 */
public class RangeResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(RangeResolver.class);

    private final PartitionKeyRangeCache partitionKeyRangeCache;
    private final ContinuationTokenCodec codec;

    public RangeResolver(PartitionKeyRangeCache partitionKeyRangeCache) {
        this(partitionKeyRangeCache, new ContinuationTokenCodec());
    }

    public RangeResolver(PartitionKeyRangeCache partitionKeyRangeCache, ContinuationTokenCodec codec) {
        this.partitionKeyRangeCache = partitionKeyRangeCache;
        this.codec = codec;
    }

    public ContinuationTokenCodec getCodec() {
        return codec;
    }

    /**
     * Decodes the continuation a request arrived with.
     *
     * @param continuation the {@code Continuation} header value, may be {@code null}
     * @return the supplied continuation, {@link SuppliedContinuation#NONE} if there is none
     * @throws InputInvalidException if the continuation is malformed
     */
    public SuppliedContinuation extractSuppliedContinuation(@Nullable String continuation) {
        if (Utils.isEmpty(continuation)) {
            return SuppliedContinuation.NONE;
        }
        return new SuppliedContinuation(continuation, codec.decode(continuation));
    }

    /**
     * Computes the key ranges a query needs to visit, in ascending key order.
     * <p>
     * A read feed visits the whole key space. A query visits the ranges reported by the predicate
     * extractor; unless they pin the query to a single partition key value, the query must be allowed
     * to run across partitions and must not need a merge pipeline.
     *
     * @param querySpec                 the query, {@code null} for a read feed
     * @param collection                the resolved collection
     * @param enableCrossPartitionQuery value of the {@code EnableCrossPartitionQuery} header
     * @param queryPartitionProvider    the predicate extractor
     * @return a future completing with the provided ranges
     */
    public CompletableFuture<List<KeyRange>> computeProvidedRangesAsync(
            @Nullable SqlQuerySpec querySpec,
            CollectionDescriptor collection,
            boolean enableCrossPartitionQuery,
            QueryPartitionProvider queryPartitionProvider
    ) {
        if (querySpec == null) {
            return CompletableFuture.completedFuture(List.of(KeyRange.FULL));
        }

        QueryPartitioningInfo info = queryPartitionProvider.getPartitioningInfo(querySpec, collection.partitionKey());
        List<KeyRange> sorted = new ArrayList<>(info.providedRanges());
        sorted.sort(Comparator.comparing(KeyRange::min));
        List<KeyRange> providedRanges = List.copyOf(sorted);

        if (providedRanges.isEmpty() || (providedRanges.size() == 1 && providedRanges.get(0).isSingleValue())) {
            return CompletableFuture.completedFuture(providedRanges);
        }

        if (info.queryInfo().requiresPipeline()) {
            return CompletableFuture.failedFuture(new InputInvalidException("query",
                    "Cross partition query with ORDER BY, TOP, aggregates, DISTINCT or GROUP BY is not supported: "
                            + querySpec.queryText()));
        }

        if (enableCrossPartitionQuery) {
            return CompletableFuture.completedFuture(providedRanges);
        }

        // Without cross-partition execution the query must still land on a single partition.
        return partitionKeyRangeCache.getOverlappingRangesAsync(collection.resourceId(), KeyRange.FULL, false)
                .thenApply(ranges -> {
                    Set<String> touched = new HashSet<>();
                    for (PartitionKeyRange range : ranges) {
                        for (KeyRange provided : providedRanges) {
                            if (range.toRange().overlaps(provided)) {
                                touched.add(range.id());
                            }
                        }
                    }
                    if (touched.size() > 1) {
                        throw new InputInvalidException(QueryHeaders.ENABLE_CROSS_PARTITION_QUERY,
                                "Cross partition query is required but disabled, set "
                                        + QueryHeaders.ENABLE_CROSS_PARTITION_QUERY + " to true");
                    }
                    return providedRanges;
                });
    }

    /**
     * Resolves the partition key range to target next.
     *
     * @param providedRanges the query's provided ranges, in ascending key order
     * @param collectionRid  resource id of the collection
     * @param supplied       the decoded continuation of the request
     * @return a future completing with the resolved range info, or empty if the partition map could not
     * be mapped consistently, e.g. the collection was recreated or the map is in transition
     */
    public CompletableFuture<Optional<ResolvedRangeInfo>> resolveTargetAsync(
            List<KeyRange> providedRanges,
            String collectionRid,
            SuppliedContinuation supplied
    ) {
        if (supplied.isEmpty()) {
            // Queries that cannot match anything still go to the first partition.
            String start = providedRanges.isEmpty() ? KeyRange.MIN_INCLUSIVE : providedRanges.get(0).min();
            return partitionKeyRangeCache.tryGetRangeByEffectivePartitionKeyAsync(collectionRid, start)
                    .thenApply(range -> Optional.ofNullable(range).map(r -> new ResolvedRangeInfo(r, List.of())));
        }

        CompositeContinuationToken first = supplied.first();
        return partitionKeyRangeCache.getOverlappingRangesAsync(collectionRid, first.range(), false)
                .thenCompose(ranges -> {
                    if (isSameRange(ranges, first)) {
                        return CompletableFuture.completedFuture(Optional.of(new ResolvedRangeInfo(ranges.get(0), supplied.tokens())));
                    }
                    // Either the collection was resolved incorrectly or the range changed. Both look the
                    // same from here, so read the partition map again.
                    return partitionKeyRangeCache.getOverlappingRangesAsync(collectionRid, first.range(), true)
                            .thenApply(replaced -> remap(collectionRid, supplied.tokens(), replaced));
                });
    }

    private boolean isSameRange(List<PartitionKeyRange> ranges, CompositeContinuationToken token) {
        if (ranges.size() != 1) {
            return false;
        }
        PartitionKeyRange range = ranges.get(0);
        return range.id().equals(token.rangeId()) && range.toRange().equals(token.range());
    }

    private Optional<ResolvedRangeInfo> remap(String collectionRid, List<CompositeContinuationToken> tokens, List<PartitionKeyRange> replaced) {
        CompositeContinuationToken first = tokens.get(0);
        KeyRange bounds = first.range();
        if (replaced.isEmpty()) {
            LOGGER.debug("No partition key range of collection {} overlaps {}", collectionRid, bounds);
            return Optional.empty();
        }

        PartitionKeyRange head = replaced.get(0);
        PartitionKeyRange tail = replaced.get(replaced.size() - 1);
        if (replaced.size() == 1) {
            // Merged into, or re-identified as, a range containing the original bounds
            if (head.minInclusive().compareTo(bounds.min()) > 0 || head.maxExclusive().compareTo(bounds.max()) < 0) {
                return Optional.empty();
            }
            LOGGER.debug("Continuation range {} {} of collection {} now maps to range {}",
                    first.rangeId(), bounds, collectionRid, head.id());
            List<CompositeContinuationToken> remapped = new ArrayList<>();
            remapped.add(CompositeContinuationToken.of(head, first.token()));
            remapped.addAll(tokens.subList(1, tokens.size()));
            return Optional.of(new ResolvedRangeInfo(head, remapped));
        }

        if (!head.minInclusive().equals(bounds.min()) || !tail.maxExclusive().equals(bounds.max())) {
            LOGGER.debug("Partition map of collection {} does not cover {} exactly, map is in transition", collectionRid, bounds);
            return Optional.empty();
        }
        for (int i = 1; i < replaced.size(); i++) {
            if (!replaced.get(i - 1).maxExclusive().equals(replaced.get(i).minInclusive())) {
                return Optional.empty();
            }
        }

        LOGGER.debug("Continuation range {} {} of collection {} was split into {} ranges",
                first.rangeId(), bounds, collectionRid, replaced.size());
        List<CompositeContinuationToken> remapped = new ArrayList<>();
        for (PartitionKeyRange child : replaced) {
            remapped.add(CompositeContinuationToken.of(child, first.token()));
        }
        remapped.addAll(tokens.subList(1, tokens.size()));
        return Optional.of(new ResolvedRangeInfo(head, remapped));
    }

    /**
     * Builds the composite continuation to hand back to the caller after a page was read from
     * {@code resolved.resolvedRange()}.
     * <p>
     * While the backend returns a continuation the query stays on the current range. Once the range is
     * exhausted the query moves on to the next pending token, or to the next range overlapping a
     * provided range, or ends.
     *
     * @param backendContinuation the continuation returned by the partition, empty when exhausted
     * @param providedRanges      the query's provided ranges, in ascending key order
     * @param collectionRid       resource id of the collection
     * @param resolved            the range info the request was routed with
     * @return a future completing with the stitched continuation
     */
    public CompletableFuture<ContinuationStitch> stitchContinuationAsync(
            String backendContinuation,
            List<KeyRange> providedRanges,
            String collectionRid,
            ResolvedRangeInfo resolved
    ) {
        List<CompositeContinuationToken> tokens = resolved.continuationTokens();
        if (tokens.size() > 1) {
            List<CompositeContinuationToken> next = new ArrayList<>(tokens);
            if (Utils.isEmpty(backendContinuation)) {
                next.remove(0);
            } else {
                next.set(0, next.get(0).withToken(backendContinuation));
            }
            return CompletableFuture.completedFuture(ContinuationStitch.of(codec.encode(next)));
        }

        PartitionKeyRange current = resolved.resolvedRange();
        if (!Utils.isEmpty(backendContinuation)) {
            String continuation = codec.encode(List.of(CompositeContinuationToken.of(current, backendContinuation)));
            return CompletableFuture.completedFuture(ContinuationStitch.of(continuation));
        }

        KeyRange nextProvided = null;
        for (KeyRange provided : providedRanges) {
            if (provided.max().compareTo(current.maxExclusive()) > 0
                    || (provided.isSingleValue() && provided.min().compareTo(current.maxExclusive()) >= 0)) {
                nextProvided = provided;
                break;
            }
        }
        if (nextProvided == null) {
            return CompletableFuture.completedFuture(ContinuationStitch.end());
        }

        String start = nextProvided.min().compareTo(current.maxExclusive()) > 0 ? nextProvided.min() : current.maxExclusive();
        return partitionKeyRangeCache.tryGetRangeByEffectivePartitionKeyAsync(collectionRid, start).thenApply(next -> {
            if (next == null) {
                return ContinuationStitch.notStitched();
            }
            return ContinuationStitch.of(codec.encode(List.of(CompositeContinuationToken.of(next, null))));
        });
    }
}
