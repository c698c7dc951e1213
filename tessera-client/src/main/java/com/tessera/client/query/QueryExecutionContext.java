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

package com.tessera.client.query;

import com.tessera.client.ClientContext;
import com.tessera.client.InputInvalidException;
import com.tessera.client.RoutingUnresolvableException;
import com.tessera.client.metrics.ClientSideMetrics;
import com.tessera.client.metrics.DiagnosticsMerger;
import com.tessera.client.metrics.FetchExecutionRangeAccumulator;
import com.tessera.client.metrics.SchedulingStopwatch;
import com.tessera.client.metrics.SchedulingTimeSpan;
import com.tessera.client.request.FeedOptions;
import com.tessera.client.request.FeedResponse;
import com.tessera.client.request.FeedResponseDecoder;
import com.tessera.client.request.PartitionKeyRangeIdentity;
import com.tessera.client.request.QueryHeaders;
import com.tessera.client.request.QueryRequest;
import com.tessera.client.request.ResourceType;
import com.tessera.client.request.SqlQuerySpec;
import com.tessera.client.retry.CacheRefresh;
import com.tessera.client.retry.RetryContext;
import com.tessera.client.retry.RetryDecision;
import com.tessera.client.retry.RetryPolicyChain;
import com.tessera.client.routing.CollectionDescriptor;
import com.tessera.client.routing.KeyRange;
import com.tessera.client.routing.RangeResolver;
import com.tessera.client.routing.ResolvedRangeInfo;
import com.tessera.client.routing.SuppliedContinuation;
import com.tessera.client.transport.DispatchException;
import com.tessera.client.transport.FailureKind;
import com.tessera.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches the pages of one query, one {@link #executeNextAsync()} call per page.
 * <p>
 * Every attempt builds a fresh request, resolves the collection and the partition key range to
 * target, dispatches the request and stitches the backend continuation into the composite
 * continuation handed back with the page. Failures are classified by the {@link RetryPolicyChain};
 * claimed failures refresh the named cache and retry, anything else completes the call.
 * <p>
 * Calls must not overlap. Cancelling the future returned by {@link #executeNextAsync()} stops the
 * call before its next attempt; the outcome of a dispatch still in flight is discarded.
 */
public class QueryExecutionContext {
    static final String SINGLE_PARTITION_KEY_RANGE_ID = "0";
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutionContext.class);

    private final ClientContext context;
    private final ResourceType resourceType;
    private final String resourceLink;
    private final SqlQuerySpec querySpec;
    private final FeedOptions options;
    private final boolean isContinuationExpected;
    private final RangeResolver rangeResolver;
    private final RetryPolicyChain retryPolicyChain;
    private final FeedResponseDecoder decoder = new FeedResponseDecoder();
    private final DiagnosticsMerger diagnosticsMerger = new DiagnosticsMerger();
    private final FetchExecutionRangeAccumulator fetchExecutionRangeAccumulator;
    private final SchedulingStopwatch schedulingStopwatch;
    private final AtomicBoolean inFlight = new AtomicBoolean();
    private volatile ExecutionState state;
    private volatile ExecutionStatus status = ExecutionStatus.IDLE;

    public QueryExecutionContext(
            ClientContext context,
            ResourceType resourceType,
            String resourceLink,
            SqlQuerySpec querySpec,
            FeedOptions options,
            boolean isContinuationExpected,
            FetchExecutionRangeAccumulator fetchExecutionRangeAccumulator,
            SchedulingStopwatch schedulingStopwatch
    ) {
        this.context = context;
        this.resourceType = resourceType;
        this.resourceLink = resourceLink;
        this.querySpec = querySpec;
        this.options = options;
        this.isContinuationExpected = isContinuationExpected;
        this.rangeResolver = new RangeResolver(context.getPartitionKeyRangeCache());
        this.retryPolicyChain = RetryPolicyChain.forResourceType(resourceType);
        this.fetchExecutionRangeAccumulator = fetchExecutionRangeAccumulator;
        this.schedulingStopwatch = schedulingStopwatch;
        this.state = ExecutionState.initial(options.getRequestContinuation());
    }

    /**
     * Creates an execution context for a query, or for a read feed when {@code querySpec} is {@code null}.
     *
     * @param context                the client's shared collaborators
     * @param resourceType           type of the resources read
     * @param resourceLink           name-based link of the collection
     * @param querySpec              the query, {@code null} for a read feed
     * @param options                feed options; the request continuation seeds the cursor
     * @param isContinuationExpected whether the caller intends to resume with continuations
     * @return a new execution context
     */
    public static QueryExecutionContext create(
            ClientContext context,
            ResourceType resourceType,
            String resourceLink,
            @Nullable SqlQuerySpec querySpec,
            FeedOptions options,
            boolean isContinuationExpected
    ) {
        return new QueryExecutionContext(context, resourceType, resourceLink, querySpec, options, isContinuationExpected,
                new FetchExecutionRangeAccumulator(), new SchedulingStopwatch());
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public ExecutionState getExecutionState() {
        return state;
    }

    /**
     * Returns {@code false} once a page was returned without a continuation.
     */
    public boolean hasMoreResults() {
        return !state.isExhausted();
    }

    /**
     * Fetches the next page.
     *
     * @return a future completing with the page, or exceptionally with the failure that ended the call
     * @throws IllegalStateException if a call is already in flight or the query has no more results
     */
    public CompletableFuture<FeedResponse> executeNextAsync() {
        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("Another page fetch is in progress");
        }
        if (state.isExhausted()) {
            inFlight.set(false);
            throw new IllegalStateException("Query has no more results");
        }

        CompletableFuture<FeedResponse> result = new CompletableFuture<>();
        result.whenComplete((page, throwable) -> {
            if (result.isCancelled()) {
                // A late outcome of the cancelled attempt is discarded, so close its metrics here
                schedulingStopwatch.stop();
                fetchExecutionRangeAccumulator.abandonFetchRange();
            }
            inFlight.set(false);
        });

        schedulingStopwatch.ready();
        attempt(result, new RetryContext());
        return result;
    }

    private void attempt(CompletableFuture<FeedResponse> result, RetryContext retryContext) {
        if (result.isDone()) {
            LOGGER.debug("Page fetch of {} was cancelled", resourceLink);
            return;
        }
        retryContext.onAttempt();
        status = ExecutionStatus.DISPATCHING;

        QueryRequest request;
        try {
            request = createRequest(retryContext);
        } catch (InputInvalidException e) {
            fail(result, e);
            return;
        }

        fetchExecutionRangeAccumulator.beginFetchRange();
        schedulingStopwatch.start();
        CompletableFuture<FeedResponse> page;
        try {
            page = executeOnceAsync(request, retryContext);
        } catch (RuntimeException e) {
            page = CompletableFuture.failedFuture(e);
        }
        page.whenComplete((response, throwable) -> {
            if (result.isDone()) {
                LOGGER.debug("Discarding outcome of cancelled page fetch of {}", resourceLink);
                return;
            }
            schedulingStopwatch.stop();
            if (throwable == null) {
                onPage(result, retryContext, request, response);
            } else {
                onFailure(result, retryContext, request, Utils.unwrap(throwable));
            }
        });
    }

    private QueryRequest createRequest(RetryContext retryContext) {
        Map<String, String> headers = new HashMap<>();
        headers.put(QueryHeaders.VERSION, context.getConfig().getProtocolVersion());
        headers.put(QueryHeaders.IS_CONTINUATION_EXPECTED, Boolean.toString(isContinuationExpected));
        if (state.getContinuation() != null) {
            headers.put(QueryHeaders.CONTINUATION, state.getContinuation());
        }
        if (options.getPartitionKey() != null) {
            headers.put(QueryHeaders.PARTITION_KEY, options.getPartitionKey());
        }
        if (options.getEnableCrossPartitionQuery() != null) {
            headers.put(QueryHeaders.ENABLE_CROSS_PARTITION_QUERY, options.getEnableCrossPartitionQuery().toString());
        }
        if (options.getMaxItemCount() != null) {
            headers.put(QueryHeaders.MAX_ITEM_COUNT, options.getMaxItemCount().toString());
        }
        if (options.isPopulateQueryMetrics()) {
            headers.put(QueryHeaders.POPULATE_QUERY_METRICS, Boolean.TRUE.toString());
        }
        headers.putAll(options.getCustomHeaders());

        String enableCrossPartitionQuery = headers.get(QueryHeaders.ENABLE_CROSS_PARTITION_QUERY);
        if (enableCrossPartitionQuery != null && Utils.parseBooleanStrict(enableCrossPartitionQuery) == null) {
            throw new InputInvalidException(QueryHeaders.ENABLE_CROSS_PARTITION_QUERY,
                    "Invalid value for header " + QueryHeaders.ENABLE_CROSS_PARTITION_QUERY + ": " + enableCrossPartitionQuery);
        }

        QueryRequest request = new QueryRequest(resourceType, resourceLink, querySpec, headers);
        request.setForceNameCacheRefresh(retryContext.consumeForceNameCacheRefresh());
        return request;
    }

    private CompletableFuture<FeedResponse> executeOnceAsync(QueryRequest request, RetryContext retryContext) {
        if (request.getHeader(QueryHeaders.PARTITION_KEY) != null || !resourceType.isPartitioned()) {
            return dispatchAsync(request);
        }

        return context.getCollectionCache().resolveAsync(request).thenCompose(collection -> {
            retryContext.setLastCollectionRid(collection.resourceId());
            if (!collection.isPartitioned()) {
                request.routeTo(new PartitionKeyRangeIdentity(collection.resourceId(), SINGLE_PARTITION_KEY_RANGE_ID));
                return dispatchAsync(request);
            }
            if (options.getPartitionKeyRangeId() != null) {
                request.routeTo(new PartitionKeyRangeIdentity(collection.resourceId(), options.getPartitionKeyRangeId()));
                return dispatchAsync(request);
            }
            if (!context.getQueryPartitionProvider().isAvailable()) {
                LOGGER.debug("Query partition provider is unavailable, routing {} through the gateway", resourceLink);
                request.setUseGatewayMode(true);
                return dispatchAsync(request);
            }

            SuppliedContinuation supplied = rangeResolver.extractSuppliedContinuation(request.getHeader(QueryHeaders.CONTINUATION));
            return routeAsync(request, collection, supplied, retryContext)
                    .thenCompose(routing -> dispatchRoutedAsync(request, routing));
        });
    }

    private CompletableFuture<Routing> routeAsync(QueryRequest request, CollectionDescriptor collection,
                                                  SuppliedContinuation supplied, RetryContext retryContext) {
        return resolveAsync(request, collection, supplied).thenCompose(routing -> {
            if (routing.resolved() != null) {
                return CompletableFuture.completedFuture(routing);
            }
            // The name may map to a recreated collection, read it again once
            LOGGER.debug("Could not resolve a partition key range of collection {}, refreshing collection cache", collection.resourceId());
            request.setForceNameCacheRefresh(true);
            return context.getCollectionCache().resolveAsync(request).thenCompose(refreshed -> {
                retryContext.setLastCollectionRid(refreshed.resourceId());
                return resolveAsync(request, refreshed, supplied);
            }).thenApply(retried -> {
                if (retried.resolved() == null) {
                    LOGGER.warn("Partition key range of collection {} is unresolvable, continuation: {}",
                            retried.collection().resourceId(), supplied.raw());
                    throw new RoutingUnresolvableException(retried.collection().resourceId(), supplied.raw());
                }
                return retried;
            });
        });
    }

    private CompletableFuture<Routing> resolveAsync(QueryRequest request, CollectionDescriptor collection, SuppliedContinuation supplied) {
        String collectionRid = collection.resourceId();
        return providedRangesAsync(request, collection)
                .thenCompose(providedRanges -> rangeResolver.resolveTargetAsync(providedRanges, collectionRid, supplied)
                        .thenApply(resolved -> new Routing(collection, providedRanges, resolved.orElse(null))));
    }

    private CompletableFuture<List<KeyRange>> providedRangesAsync(QueryRequest request, CollectionDescriptor collection) {
        List<KeyRange> cached = state.getProvidedRanges(collection.resourceId());
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        boolean enableCrossPartitionQuery = Boolean.TRUE.equals(
                Utils.parseBooleanStrict(request.getHeader(QueryHeaders.ENABLE_CROSS_PARTITION_QUERY)));
        return rangeResolver.computeProvidedRangesAsync(querySpec, collection, enableCrossPartitionQuery,
                context.getQueryPartitionProvider()).thenApply(providedRanges -> {
            state = state.withProvidedRanges(collection.resourceId(), providedRanges);
            return providedRanges;
        });
    }

    private CompletableFuture<FeedResponse> dispatchRoutedAsync(QueryRequest request, Routing routing) {
        String collectionRid = routing.collection().resourceId();
        ResolvedRangeInfo resolved = routing.resolved();
        request.setHeader(QueryHeaders.CONTINUATION, resolved.innerContinuation());
        request.routeTo(new PartitionKeyRangeIdentity(collectionRid, resolved.resolvedRange().id()));
        return dispatchAsync(request).thenCompose(response -> rangeResolver
                .stitchContinuationAsync(response.getContinuation(), routing.providedRanges(), collectionRid, resolved)
                .thenApply(stitch -> {
                    if (!stitch.stitched()) {
                        throw new DispatchException(FailureKind.NOT_FOUND,
                                "Partition map of collection " + collectionRid + " is no longer available");
                    }
                    return response.withContinuation(stitch.continuation());
                }));
    }

    private CompletableFuture<FeedResponse> dispatchAsync(QueryRequest request) {
        return context.getTransport().sendAsync(request).thenApply(decoder::decode);
    }

    private void onPage(CompletableFuture<FeedResponse> result, RetryContext retryContext, QueryRequest request, FeedResponse response) {
        String partitionId = partitionIdOf(request);
        fetchExecutionRangeAccumulator.endFetchRange(partitionId, response.getCount(), retryContext.getRetries());

        Map<String, SchedulingTimeSpan> schedulingTimeSpans = response.getContinuation() == null
                ? Map.of(partitionId, schedulingStopwatch.getElapsedTime())
                : Map.of();
        ClientSideMetrics clientSideMetrics = new ClientSideMetrics(
                retryContext.getRetries(),
                response.getRequestCharge(),
                fetchExecutionRangeAccumulator.getExecutionRanges(),
                schedulingTimeSpans
        );
        FeedResponse page = diagnosticsMerger.merge(response, partitionId,
                response.getHeader(QueryHeaders.QUERY_METRICS), clientSideMetrics);

        state = state.withContinuation(page.getContinuation());
        status = ExecutionStatus.SUCCEEDED;
        result.complete(page);
    }

    private void onFailure(CompletableFuture<FeedResponse> result, RetryContext retryContext, QueryRequest request, Throwable cause) {
        fetchExecutionRangeAccumulator.endFetchRange(partitionIdOf(request), 0, retryContext.getRetries());
        if (!(cause instanceof DispatchException failure)) {
            fail(result, cause);
            return;
        }

        Optional<RetryDecision> decision = retryPolicyChain.classify(failure, retryContext);
        if (decision.isEmpty()) {
            fail(result, failure);
            return;
        }

        Duration delay = Duration.ZERO;
        if (decision.get().consumesBudget()) {
            Optional<Duration> nextDelay = context.getRetryBudget().nextDelay(retryContext);
            if (nextDelay.isEmpty()) {
                LOGGER.debug("Retry budget of {} is exhausted", resourceLink);
                fail(result, failure);
                return;
            }
            delay = nextDelay.get();
            retryContext.onBudgetedRetry(delay);
        }

        CacheRefresh refresh = decision.get().refresh();
        retryContext.markRefreshed(refresh);
        long delayMillis = delay.toMillis();
        applyRefreshAsync(request, refresh, retryContext).whenComplete((ignored, throwable) -> {
            if (throwable != null) {
                LOGGER.warn("Could not refresh {} of {} before retrying", refresh, resourceLink, Utils.unwrap(throwable));
                fail(result, failure);
                return;
            }
            if (result.isDone()) {
                return;
            }
            status = ExecutionStatus.RETRYING;
            LOGGER.debug("Retrying page fetch of {} after {} in {} ms, refreshed {}",
                    resourceLink, failure.getKind(), delayMillis, refresh);
            CompletableFuture.runAsync(() -> attempt(result, retryContext),
                    CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS));
        });
    }

    private CompletableFuture<Void> applyRefreshAsync(QueryRequest request, CacheRefresh refresh, RetryContext retryContext) {
        return switch (refresh) {
            case COLLECTION -> {
                context.getCollectionCache().invalidate(resourceLink);
                retryContext.requestForceNameCacheRefresh();
                yield CompletableFuture.completedFuture(null);
            }
            case PARTITION_KEY_RANGES -> {
                String collectionRid = retryContext.getLastCollectionRid();
                if (collectionRid != null) {
                    context.getPartitionKeyRangeCache().invalidate(collectionRid);
                    yield CompletableFuture.completedFuture(null);
                }
                // Requests dispatched by partition key never resolved their collection
                yield context.getCollectionCache().resolveAsync(request).thenAccept(collection -> {
                    retryContext.setLastCollectionRid(collection.resourceId());
                    context.getPartitionKeyRangeCache().invalidate(collection.resourceId());
                });
            }
        };
    }

    private void fail(CompletableFuture<FeedResponse> result, Throwable cause) {
        LOGGER.trace("Page fetch of {} failed", resourceLink, cause);
        status = ExecutionStatus.EXHAUSTED;
        result.completeExceptionally(cause);
    }

    private String partitionIdOf(QueryRequest request) {
        PartitionKeyRangeIdentity identity = request.getPartitionKeyRangeIdentity();
        return identity == null ? SINGLE_PARTITION_KEY_RANGE_ID : identity.partitionKeyRangeId();
    }

    private record Routing(CollectionDescriptor collection, List<KeyRange> providedRanges, ResolvedRangeInfo resolved) {
    }
}
