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

import java.util.Map;

/**
 * {@link Map.Entry} equality, hash code and string form shared by {@link Tuple2} and the entries
 * of {@link OptionMap#asMap()} views. Neither keys nor values are ever null here, so there are no
 * null checks.
 */
abstract class AbstractEntry<K, V> implements Map.Entry<K, V> {

    @Override
    public final int hashCode() {
        return getKey().hashCode() ^ getValue().hashCode();
    }

    @Override
    public final boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Map.Entry))
            return false;
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) obj;
        return getKey().equals(e.getKey()) && getValue().equals(e.getValue());
    }

    @Override
    public final String toString() {
        return getKey() + "=" + getValue();
    }
}
