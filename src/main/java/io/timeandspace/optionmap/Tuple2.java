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

import java.util.Map;

import static io.timeandspace.optionmap.Utils.checkNonNull;

/**
 * An immutable key-value pair. This is the unit that {@link OptionMap#put} accepts and that
 * iteration over an {@link OptionMap} produces.
 *
 * <p>{@code Tuple2} is a {@link Map.Entry}, so it is equal to any other entry with an equal key and
 * an equal value, including entries of {@link java.util.HashMap}. Neither the key nor the value
 * could be {@code null}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class Tuple2<K, V> extends AbstractEntry<K, V> {

    /**
     * Creates a new pair.
     *
     * @param key the key, non-null
     * @param value the value, non-null
     * @param <K> the key type
     * @param <V> the value type
     * @return a new {@code Tuple2}
     * @throws NullPointerException if the key or the value is null
     */
    @Contract(value = "_, _ -> new", pure = true)
    public static <K, V> Tuple2<K, V> of(K key, V value) {
        checkNonNull(key);
        checkNonNull(value);
        return new Tuple2<>(key, value);
    }

    /**
     * Returns the given entry as a {@code Tuple2}: the same object if it already is one, otherwise
     * a new pair holding the entry's key and value.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> Tuple2<K, V> copyOf(Map.Entry<? extends K, ? extends V> entry) {
        if (entry instanceof Tuple2) {
            // Safe because Tuple2 is immutable.
            return (Tuple2<K, V>) entry;
        }
        return of(entry.getKey(), entry.getValue());
    }

    private final K key;
    private final V value;

    private Tuple2(K key, V value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public K getKey() {
        return key;
    }

    @Override
    public V getValue() {
        return value;
    }

    @Override
    public V setValue(V value) {
        throw new UnsupportedOperationException("Tuple2 is immutable, use OptionMap.set()");
    }
}
