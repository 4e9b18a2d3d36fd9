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

import org.jetbrains.annotations.Contract;

import java.util.function.Supplier;

import static io.timeandspace.optionmap.Utils.checkNonNull;
import static io.timeandspace.optionmap.Utils.nonNullOrThrowNpe;

/**
 * A fallback value for {@link OptionMap#getOrElse(Object, Evaluatable)} and {@link
 * OptionMap#getOrElseUpdate(Object, Evaluatable)}: either a {@linkplain #constant constant} or a
 * {@linkplain #deferred deferred} computation. The map calls {@link #evaluate()} only on a lookup
 * miss, and at most once per call.
 *
 * <p>A deferred {@code Evaluatable} doesn't memoize: every call to {@link #evaluate()} calls the
 * underlying supplier again.
 *
 * @param <T> the type of the value
 */
public abstract class Evaluatable<T> {

    /**
     * Returns an {@code Evaluatable} which always evaluates to the given value.
     *
     * @param value the value, non-null
     * @param <T> the type of the value
     * @return a constant {@code Evaluatable}
     * @throws NullPointerException if the value is null
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> Evaluatable<T> constant(T value) {
        checkNonNull(value);
        return new Constant<>(value);
    }

    /**
     * Returns an {@code Evaluatable} which calls the given supplier each time it is evaluated.
     * Exceptions thrown by the supplier are relayed to the caller of {@link #evaluate()}.
     *
     * @param supplier the computation, must not return null
     * @param <T> the type of the value
     * @return a deferred {@code Evaluatable}
     * @throws NullPointerException if the supplier is null
     */
    @Contract(value = "_ -> new", pure = true)
    public static <T> Evaluatable<T> deferred(Supplier<? extends T> supplier) {
        checkNonNull(supplier);
        return new Deferred<>(supplier);
    }

    private Evaluatable() {}

    /**
     * Produces the value.
     *
     * @return the value, never null
     * @throws NullPointerException if a deferred computation returned null
     */
    public abstract T evaluate();

    public abstract boolean isConstant();

    private static final class Constant<T> extends Evaluatable<T> {
        private final T value;

        Constant(T value) {
            this.value = value;
        }

        @Override
        public T evaluate() {
            return value;
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        public String toString() {
            return "Evaluatable.constant(" + value + ")";
        }
    }

    private static final class Deferred<T> extends Evaluatable<T> {
        private final Supplier<? extends T> supplier;

        Deferred(Supplier<? extends T> supplier) {
            this.supplier = supplier;
        }

        @Override
        public T evaluate() {
            return nonNullOrThrowNpe(supplier.get(), "Fallback supplier");
        }

        @Override
        public boolean isConstant() {
            return false;
        }

        @Override
        public String toString() {
            return "Evaluatable.deferred(" + supplier + ")";
        }
    }
}
