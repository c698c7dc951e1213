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

package com.tessera.common.utils;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class Utils {

    public static boolean isEmpty(final CharSequence cs) {
        // Source: https://commons.apache.org/proper/commons-lang/javadocs/api-release/src-html/org/apache/commons/lang3/StringUtils.html#line.3583
        return cs == null || cs.length() == 0;
    }

    /**
     * Parses a boolean the way header values are parsed: only {@code true} and {@code false}
     * are accepted, ignoring case and surrounding whitespace.
     *
     * @param value the raw value
     * @return the parsed boolean, or {@code null} if the value is not a boolean literal
     */
    public static Boolean parseBooleanStrict(final String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return Boolean.TRUE;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return Boolean.FALSE;
        }
        return null;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by
     * {@code CompletableFuture} stages.
     *
     * @param throwable the throwable to unwrap
     * @return the innermost meaningful cause
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
