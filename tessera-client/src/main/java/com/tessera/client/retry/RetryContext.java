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

package com.tessera.client.retry;

import java.time.Duration;
import java.util.EnumSet;

/**
 * Retry state of one logical "fetch next page" call. Created when the call starts and discarded when
 * it completes; nothing in it carries over to the next page.
 */
public class RetryContext {
    /**
     * Value of {@link #getRetries()} before the first attempt.
     */
    public static final long NOT_YET_RETRIED = -1;

    private final EnumSet<CacheRefresh> refreshed = EnumSet.noneOf(CacheRefresh.class);
    private long retries = NOT_YET_RETRIED;
    private int budgetedRetries;
    private Duration totalWait = Duration.ZERO;
    private String lastCollectionRid;
    private boolean forceNameCacheRefresh;

    /**
     * Records the start of an attempt. The first attempt moves the counter from
     * {@link #NOT_YET_RETRIED} to zero.
     */
    public void onAttempt() {
        retries++;
    }

    /**
     * Returns the number of retries performed so far in this call.
     */
    public long getRetries() {
        return retries;
    }

    public int getBudgetedRetries() {
        return budgetedRetries;
    }

    public Duration getTotalWait() {
        return totalWait;
    }

    /**
     * Records a retry that counts against the retry budget.
     *
     * @param wait the delay before the retry
     */
    public void onBudgetedRetry(Duration wait) {
        budgetedRetries++;
        totalWait = totalWait.plus(wait);
    }

    public boolean hasRefreshed(CacheRefresh cache) {
        return refreshed.contains(cache);
    }

    public void markRefreshed(CacheRefresh cache) {
        refreshed.add(cache);
    }

    public String getLastCollectionRid() {
        return lastCollectionRid;
    }

    public void setLastCollectionRid(String lastCollectionRid) {
        this.lastCollectionRid = lastCollectionRid;
    }

    /**
     * Returns and clears the flag asking the next attempt to bypass the collection cache.
     */
    public boolean consumeForceNameCacheRefresh() {
        boolean value = forceNameCacheRefresh;
        forceNameCacheRefresh = false;
        return value;
    }

    public void requestForceNameCacheRefresh() {
        this.forceNameCacheRefresh = true;
    }
}
