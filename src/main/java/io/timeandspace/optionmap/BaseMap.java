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
import org.checkerframework.checker.nullness.qual.MonotonicNonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import static io.timeandspace.optionmap.Utils.checkNonNull;
import static io.timeandspace.optionmap.Utils.nonNullOrThrowNpe;

/**
 * {@link OptionMap} backed by a {@link HashMap} from keys to {@link Tuple2} pairs.
 *
 * <p>{@link #getValue(Object)} throws {@link KeyNotFoundException} for a missing key. Two {@code
 * BaseMap}s are {@linkplain #equals equal} if they have the {@linkplain #sameContent same content}.
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public class BaseMap<K, V> implements OptionMap<K, V> {

    private final HashMap<K, Tuple2<K, V>> storage = new HashMap<>();
    private @MonotonicNonNull MapView<K, V> mapView;

    /** Use {@link OptionMap#empty()}. */
    BaseMap() {}

    @Override
    public final Optional<V> get(K key) {
        @Nullable Tuple2<K, V> tuple = storage.get(key);
        return tuple != null ? Optional.of(tuple.getValue()) : Optional.empty();
    }

    @Override
    public final V getValue(K key) {
        @Nullable Tuple2<K, V> tuple = storage.get(key);
        if (tuple == null) {
            throw new KeyNotFoundException(key);
        }
        return tuple.getValue();
    }

    @Override
    public final void set(K key, V value) {
        storage.put(key, Tuple2.of(key, value));
    }

    @Override
    public final void put(Map.Entry<? extends K, ? extends V> entry) {
        Tuple2<K, V> tuple = Tuple2.copyOf(entry);
        storage.put(tuple.getKey(), tuple);
    }

    @Override
    public final boolean containsKey(K key) {
        return storage.containsKey(key);
    }

    @Override
    public final V getOrElse(K key, Evaluatable<? extends V> orElse) {
        checkNonNull(orElse);
        @Nullable Tuple2<K, V> tuple = storage.get(key);
        return tuple != null ? tuple.getValue() : orElse.evaluate();
    }

    @CanIgnoreReturnValue
    @Override
    public final V getOrElseUpdate(K key, Evaluatable<? extends V> orElse) {
        checkNonNull(key);
        checkNonNull(orElse);
        @Nullable Tuple2<K, V> tuple = storage.get(key);
        if (tuple != null) {
            return tuple.getValue();
        }
        V newValue = orElse.evaluate();
        set(key, newValue);
        return newValue;
    }

    @Override
    public final <K2> OptionMap<K2, V> mapKeys(Function<? super K, ? extends K2> f) {
        checkNonNull(f);
        BaseMap<K2, V> result = new BaseMap<>();
        for (Tuple2<K, V> tuple : storage.values()) {
            K2 mappedKey = nonNullOrThrowNpe(f.apply(tuple.getKey()), "Key mapping function");
            result.set(mappedKey, tuple.getValue());
        }
        return result;
    }

    @Override
    public final <V2> OptionMap<K, V2> mapValues(Function<? super V, ? extends V2> f) {
        checkNonNull(f);
        BaseMap<K, V2> result = new BaseMap<>();
        for (Tuple2<K, V> tuple : storage.values()) {
            V2 mappedValue = nonNullOrThrowNpe(f.apply(tuple.getValue()), "Value mapping function");
            result.set(tuple.getKey(), mappedValue);
        }
        return result;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The other map's content is read through {@link OptionMap#asMap()}, so that a default
     * function of the other map couldn't make a missing key look present.
     */
    @Override
    public final boolean sameContent(OptionMap<K, V> other) {
        //noinspection ObjectEquality: identity comparison is intended
        if (other == this) {
            return true;
        }
        Map<K, V> otherContent = other.asMap();
        if (otherContent.size() != storage.size()) {
            return false;
        }
        for (Tuple2<K, V> tuple : storage.values()) {
            @Nullable V otherValue = otherContent.get(tuple.getKey());
            if (otherValue == null || !otherValue.equals(tuple.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public final Map<K, V> toMap() {
        HashMap<K, V> result = new HashMap<>(storage.size() * 4 / 3 + 1);
        for (Tuple2<K, V> tuple : storage.values()) {
            result.put(tuple.getKey(), tuple.getValue());
        }
        return result;
    }

    @Override
    public final Map<K, V> asMap() {
        @MonotonicNonNull MapView<K, V> view = mapView;
        return view != null ? view : (mapView = new MapView<>(storage));
    }

    @Override
    public OptionMap<K, V> defaulting(Function<? super K, ? extends V> defaultFn) {
        return new DefaultingMap<>(defaultFn, this);
    }

    @Override
    public final int size() {
        return storage.size();
    }

    @Override
    public final Iterator<Tuple2<K, V>> iterator() {
        return Collections.unmodifiableCollection(storage.values()).iterator();
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Tuple2<K, V> tuple : storage.values()) {
            h += tuple.hashCode();
        }
        return h;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof BaseMap)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        BaseMap<K, V> other = (BaseMap<K, V>) obj;
        return sameContent(other);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asMap();
    }

    /**
     * A {@link Map} over the storage of a {@link BaseMap}. The entry set is the only structure
     * {@link AbstractMap} needs, point access methods are overridden to go to the storage directly.
     */
    static final class MapView<K, V> extends AbstractMap<K, V> {
        private final HashMap<K, Tuple2<K, V>> storage;
        private @MonotonicNonNull EntrySet<K, V> entrySet;

        MapView(HashMap<K, Tuple2<K, V>> storage) {
            this.storage = storage;
        }

        @Override
        public int size() {
            return storage.size();
        }

        @Override
        public boolean containsKey(Object key) {
            return storage.containsKey(key);
        }

        @Override
        public @Nullable V get(Object key) {
            @Nullable Tuple2<K, V> tuple = storage.get(key);
            return tuple != null ? tuple.getValue() : null;
        }

        @CanIgnoreReturnValue
        @Override
        public @Nullable V put(K key, V value) {
            @Nullable Tuple2<K, V> previous = storage.put(key, Tuple2.of(key, value));
            return previous != null ? previous.getValue() : null;
        }

        @CanIgnoreReturnValue
        @Override
        public @Nullable V remove(Object key) {
            @Nullable Tuple2<K, V> previous = storage.remove(key);
            return previous != null ? previous.getValue() : null;
        }

        @Override
        public void clear() {
            storage.clear();
        }

        @Override
        public Set<Map.Entry<K, V>> entrySet() {
            @MonotonicNonNull EntrySet<K, V> es = entrySet;
            return es != null ? es : (entrySet = new EntrySet<>(storage));
        }
    }

    static final class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
        private final HashMap<K, Tuple2<K, V>> storage;

        EntrySet(HashMap<K, Tuple2<K, V>> storage) {
            this.storage = storage;
        }

        @Override
        public int size() {
            return storage.size();
        }

        @Override
        public boolean contains(Object o) {
            if (!(o instanceof Map.Entry))
                return false;
            Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
            @Nullable Tuple2<K, V> tuple = storage.get(e.getKey());
            return tuple != null && tuple.getValue().equals(e.getValue());
        }

        @Override
        public boolean remove(Object o) {
            if (contains(o)) {
                storage.remove(((Map.Entry<?, ?>) o).getKey());
                return true;
            }
            return false;
        }

        @Override
        public void clear() {
            storage.clear();
        }

        @Override
        public Iterator<Map.Entry<K, V>> iterator() {
            return new EntryIterator<>(storage);
        }
    }

    static final class EntryIterator<K, V> implements Iterator<Map.Entry<K, V>> {
        private final HashMap<K, Tuple2<K, V>> storage;
        private final Iterator<Tuple2<K, V>> delegate;

        EntryIterator(HashMap<K, Tuple2<K, V>> storage) {
            this.storage = storage;
            this.delegate = storage.values().iterator();
        }

        @Override
        public boolean hasNext() {
            return delegate.hasNext();
        }

        @Override
        public Map.Entry<K, V> next() {
            Tuple2<K, V> tuple = delegate.next();
            return new ViewEntry<>(storage, tuple.getKey(), tuple.getValue());
        }

        @Override
        public void remove() {
            delegate.remove();
        }
    }

    /**
     * Entry of {@link EntrySet}. {@link #setValue} writes through to the storage if the key is
     * still mapped. Replacing the value of an existing key is not a structural modification of the
     * {@link HashMap}, so it is allowed during iteration.
     */
    static final class ViewEntry<K, V> extends AbstractEntry<K, V> {
        private final HashMap<K, Tuple2<K, V>> storage;
        private final K key;
        private V value;

        ViewEntry(HashMap<K, Tuple2<K, V>> storage, K key, V value) {
            this.storage = storage;
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
            Tuple2<K, V> tuple = Tuple2.of(key, value);
            V oldValue = this.value;
            // An entry removed through the iterator stays removed
            storage.replace(key, tuple);
            this.value = value;
            return oldValue;
        }
    }
}
