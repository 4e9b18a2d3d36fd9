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

import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static io.timeandspace.optionmap.Utils.checkNonNull;
import static io.timeandspace.optionmap.Utils.nonNullOrThrowNpe;

/**
 * {@link OptionMap} which wraps another map and synthesizes a value with the default function
 * when the wrapped map has no value for a key. Synthesized values are not stored: {@link
 * #containsKey}, {@link #size()}, iteration, {@link #toMap()} and {@link #asMap()} see only the
 * wrapped map's content.
 *
 * <p>Only {@link #get(Object)} and {@link #getValue(Object)} consult the default function. {@link
 * #getOrElse} and {@link #getOrElseUpdate} go to the wrapped map and use their own fallback.
 * {@link #getValue(Object)} never throws {@link KeyNotFoundException}. Exceptions thrown by the
 * default function are relayed to the caller.
 *
 * <p>Wrapping a {@code DefaultingMap} into another one with {@link #defaulting} doesn't change
 * which function produces values: the wrapped layer already fills every miss, so the innermost
 * default function is the effective one.
 *
 * <p>Two {@code DefaultingMap}s are {@linkplain #equals equal} if their wrapped maps are equal;
 * default functions are not compared.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class DefaultingMap<K, V> implements OptionMap<K, V> {

    private final OptionMap<K, V> wrapped;
    private final Function<? super K, ? extends V> defaultFn;

    /** Use {@link OptionMap#withDefault}. */
    DefaultingMap(Function<? super K, ? extends V> defaultFn) {
        this(defaultFn, new BaseMap<>());
    }

    /** Use {@link OptionMap#defaulting}. {@code wrapped} is taken over, not copied. */
    DefaultingMap(Function<? super K, ? extends V> defaultFn, OptionMap<K, V> wrapped) {
        checkNonNull(defaultFn);
        checkNonNull(wrapped);
        this.defaultFn = defaultFn;
        this.wrapped = wrapped;
    }

    @Override
    public final Optional<V> get(K key) {
        return wrapped.get(key).or(() -> Optional.of(applyDefault(key)));
    }

    @Override
    public final V getValue(K key) {
        // get() is never empty here
        return get(key).get();
    }

    private V applyDefault(K key) {
        return nonNullOrThrowNpe(defaultFn.apply(key), "Default function");
    }

    @Override
    public final void set(K key, V value) {
        wrapped.set(key, value);
    }

    @Override
    public final void put(Map.Entry<? extends K, ? extends V> entry) {
        wrapped.put(entry);
    }

    @Override
    public final boolean containsKey(K key) {
        return wrapped.containsKey(key);
    }

    @Override
    public final V getOrElse(K key, Evaluatable<? extends V> orElse) {
        return wrapped.getOrElse(key, orElse);
    }

    @CanIgnoreReturnValue
    @Override
    public final V getOrElseUpdate(K key, Evaluatable<? extends V> orElse) {
        return wrapped.getOrElseUpdate(key, orElse);
    }

    @Override
    public final <K2> OptionMap<K2, V> mapKeys(Function<? super K, ? extends K2> f) {
        return wrapped.mapKeys(f);
    }

    @Override
    public final <V2> OptionMap<K, V2> mapValues(Function<? super V, ? extends V2> f) {
        return wrapped.mapValues(f);
    }

    @Override
    public final boolean sameContent(OptionMap<K, V> other) {
        return wrapped.sameContent(other);
    }

    @Override
    public final Map<K, V> toMap() {
        return wrapped.toMap();
    }

    @Override
    public final Map<K, V> asMap() {
        return wrapped.asMap();
    }

    @Override
    public OptionMap<K, V> defaulting(Function<? super K, ? extends V> defaultFn) {
        return new DefaultingMap<>(defaultFn, this);
    }

    @Override
    public final int size() {
        return wrapped.size();
    }

    @Override
    public final Iterator<Tuple2<K, V>> iterator() {
        return wrapped.iterator();
    }

    @Override
    public int hashCode() {
        return wrapped.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof DefaultingMap)) {
            return false;
        }
        return wrapped.equals(((DefaultingMap<?, ?>) obj).wrapped);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asMap();
    }
}
