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

import java.util.NoSuchElementException;

/**
 * Thrown by {@link OptionMap#getValue(Object)} when the map has no mapping for the key. A {@link
 * DefaultingMap} never throws it.
 */
public class KeyNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    private final transient Object key;

    public KeyNotFoundException(Object key) {
        super("Key not found: " + key);
        this.key = key;
    }

    /** Returns the key that was looked up. */
    public Object getKey() {
        return key;
    }
}
