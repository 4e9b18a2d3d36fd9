/*
 * Copyright (C) The OptionMap Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.timeandspace.optionmap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.jetbrains.annotations.Contract;

/**
 * Prefixes of methods used in this class:
 *   - checkXxx throw a regular unchecked exception, like NPE
 *   - nonNullOrThrowXxx return the argument back if it passes the check
 */
final class Utils {

    /**
     * The difference between this method and {@link java.util.Objects#requireNonNull(Object)} is
     * that this method doesn't return the argument back.
     */
    @Contract("null -> fail")
    static void checkNonNull(@Nullable Object obj) {
        if (obj == null) {
            throw new NullPointerException();
        }
    }

    /**
     * Used for values produced by caller-supplied functions: default functions, fallbacks and
     * mapping functions. The message names the producer, because the stack trace of a null result
     * points to the map and not to the function that returned it.
     */
    @Contract(value = "null, _ -> fail; !null, _ -> param1", pure = true)
    static <T> T nonNullOrThrowNpe(@Nullable T obj, String producer) {
        if (obj == null) {
            throw new NullPointerException(producer + " returned null");
        }
        return obj;
    }

    private Utils() {}
}
