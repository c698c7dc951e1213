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
 * Outcome of stitching the backend continuation into the composite continuation returned to the
 * caller.
 *
 * @param stitched     {@code false} if the collection's partition map could not be read
 * @param continuation the composite continuation, {@code null} at the end of the query
 */
public record ContinuationStitch(boolean stitched, String continuation) {
    private static final ContinuationStitch NOT_STITCHED = new ContinuationStitch(false, null);
    private static final ContinuationStitch END = new ContinuationStitch(true, null);

    public static ContinuationStitch of(String continuation) {
        return new ContinuationStitch(true, continuation);
    }

    public static ContinuationStitch end() {
        return END;
    }

    public static ContinuationStitch notStitched() {
        return NOT_STITCHED;
    }
}
