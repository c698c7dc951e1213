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

/**
 * Query features that cannot be evaluated one partition at a time.
 */
public record QueryInfo(boolean hasOrderBy, boolean hasTop, boolean hasAggregates, boolean hasDistinct, boolean hasGroupBy) {
    public static final QueryInfo NONE = new QueryInfo(false, false, false, false, false);

    /**
     * Returns whether results from several partitions would have to be merged by a pipeline
     * rather than concatenated.
     */
    public boolean requiresPipeline() {
        return hasOrderBy || hasTop || hasAggregates || hasDistinct || hasGroupBy;
    }
}
