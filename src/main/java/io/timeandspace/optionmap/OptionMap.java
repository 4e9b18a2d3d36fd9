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
import org.jetbrains.annotations.Contract;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A mutable map with {@link Optional}-returning lookups. Notable differences from {@link Map}:
 * <ul>
 *     <li>{@link #get(Object)} returns {@link Optional#empty()} for a missing key instead of
 *     {@code null}. {@link #getValue(Object)} is the throwing alternative.</li>
 *     <li>A map could be turned into a {@link DefaultingMap}, which synthesizes values for missing
 *     keys with a default function, see {@link #withDefault} and {@link #defaulting}.</li>
 *     <li>{@link #mapKeys} and {@link #mapValues} derive new maps.</li>
 *     <li>{@link #sameContent} compares stored key-value pairs, ignoring default functions.</li>
 *     <li>The map is an {@link Iterable} of {@link Tuple2} pairs. {@link #asMap()} gives a live
 *     {@link Map} view of the same content.</li>
 *     <li>{@code null} keys and values are prohibited. Methods storing them throw
 *     {@link NullPointerException}.</li>
 * </ul>
 *
 * <p>Iteration order is unspecified.
 *
 * <p>Implementations are not synchronized. If multiple threads access a map concurrently and at
 * least one of them modifies it, access must be synchronized externally, e. g. by synchronizing on
 * some object that naturally encapsulates the map.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface OptionMap<K, V> extends Iterable<Tuple2<K, V>> {

    /**
     * Creates a new empty map.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @return a new empty {@link BaseMap}
     */
    @Contract(value = " -> new", pure = true)
    static <K, V> OptionMap<K, V> empty() {
        return new BaseMap<>();
    }

    @Contract(value = "_, _ -> new", pure = true)
    static <K, V> OptionMap<K, V> of(K k1, V v1) {
        OptionMap<K, V> map = new BaseMap<>();
        map.set(k1, v1);
        return map;
    }

    @Contract(value = "_, _, _, _ -> new", pure = true)
    static <K, V> OptionMap<K, V> of(K k1, V v1, K k2, V v2) {
        OptionMap<K, V> map = new BaseMap<>();
        map.set(k1, v1);
        map.set(k2, v2);
        return map;
    }

    /**
     * Creates a new map holding a copy of every mapping of the given {@link Map}. Later changes to
     * the source map are not reflected in the new map.
     *
     * @param map the source mappings
     * @param <K> the type of keys
     * @param <V> the type of values
     * @return a new {@link BaseMap}
     * @throws NullPointerException if the source map contains a null key or a null value
     */
    @Contract(value = "_ -> new", pure = true)
    static <K, V> OptionMap<K, V> fromMap(Map<? extends K, ? extends V> map) {
        OptionMap<K, V> target = new BaseMap<>();
        map.forEach(target::set);
        return target;
    }

    /**
     * Creates a new empty map that synthesizes values for missing keys with {@code defaultFn}.
     * Synthesized values are not stored.
     *
     * @param defaultFn the function computing a value for a missing key, must not return null
     * @param <K> the type of keys
     * @param <V> the type of values
     * @return a new {@link DefaultingMap} over a new empty {@link BaseMap}
     */
    @Contract(value = "_ -> new", pure = true)
    static <K, V> OptionMap<K, V> withDefault(Function<? super K, ? extends V> defaultFn) {
        return new DefaultingMap<>(defaultFn);
    }

    /**
     * Returns the value mapped to the key wrapped into an {@link Optional}, or {@link
     * Optional#empty()} if there is none. Never throws for a missing key.
     */
    Optional<V> get(K key);

    /**
     * Returns the value mapped to the key.
     *
     * @throws KeyNotFoundException if there is no value for the key (never thrown by a {@link
     * DefaultingMap})
     */
    V getValue(K key);

    /**
     * Maps the key to the value, replacing the previous value if there is one.
     *
     * @throws NullPointerException if the key or the value is null
     */
    void set(K key, V value);

    /** Same as {@code set(entry.getKey(), entry.getValue())}. */
    void put(Map.Entry<? extends K, ? extends V> entry);

    /** Checks if there is a stored value for the key. Default functions are not consulted. */
    boolean containsKey(K key);

    /**
     * Returns the stored value for the key, or evaluates {@code orElse} and returns its result. The
     * map is not modified. {@code orElse} is evaluated only if the key is absent.
     */
    V getOrElse(K key, Evaluatable<? extends V> orElse);

    default V getOrElse(K key, Supplier<? extends V> orElse) {
        return getOrElse(key, Evaluatable.deferred(orElse));
    }

    /**
     * Returns the stored value for the key. If there is none, evaluates {@code orElse} exactly
     * once, stores the result under the key and returns it.
     */
    @CanIgnoreReturnValue
    V getOrElseUpdate(K key, Evaluatable<? extends V> orElse);

    @CanIgnoreReturnValue
    default V getOrElseUpdate(K key, Supplier<? extends V> orElse) {
        return getOrElseUpdate(key, Evaluatable.deferred(orElse));
    }

    /**
     * Returns a new map with the keys of this map transformed by {@code f} and the values
     * unchanged. If {@code f} maps several keys to the same new key, the value of the entry that
     * comes later in the iteration order wins. The result never has a default function.
     */
    <K2> OptionMap<K2, V> mapKeys(Function<? super K, ? extends K2> f);

    /**
     * Returns a new map with the same keys and the values transformed by {@code f}. The result
     * never has a default function.
     */
    <V2> OptionMap<K, V2> mapValues(Function<? super V, ? extends V2> f);

    /**
     * Checks if this map and the other map store the same key-value pairs. Default functions of
     * either map don't take part in the comparison.
     */
    boolean sameContent(OptionMap<K, V> other);

    /** Returns a new {@link java.util.HashMap} with the stored mappings of this map. */
    Map<K, V> toMap();

    /**
     * Returns a live {@link Map} view of the stored mappings of this map. Changes made through the
     * view are visible in this map and vice versa. Default functions are not visible through the
     * view. The view doesn't permit null keys and values.
     */
    Map<K, V> asMap();

    /**
     * Returns a {@link DefaultingMap} over this map. This map is not copied: the returned map
     * takes it over, so this reference shouldn't be used for further updates.
     */
    OptionMap<K, V> defaulting(Function<? super K, ? extends V> defaultFn);

    /** Returns the number of stored mappings. Synthesized default values are not counted. */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /** Returns an iterator over the stored pairs, which doesn't support removal. */
    @Override
    Iterator<Tuple2<K, V>> iterator();

    default Stream<Tuple2<K, V>> stream() {
        return StreamSupport.stream(spliterator(), false);
    }
}
