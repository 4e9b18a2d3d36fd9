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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluatableTest {

    @Test
    void testConstant() {
        Evaluatable<String> e = Evaluatable.constant("v");
        assertTrue(e.isConstant());
        assertEquals("v", e.evaluate());
        assertEquals("v", e.evaluate());
        assertThrows(NullPointerException.class, () -> Evaluatable.constant(null));
    }

    @Test
    void testDeferredIsNotMemoized() {
        int[] calls = new int[] {0};
        Evaluatable<Integer> e = Evaluatable.deferred(() -> ++calls[0]);
        assertFalse(e.isConstant());
        assertEquals(0, calls[0]);
        assertEquals(1, e.evaluate());
        assertEquals(2, e.evaluate());
    }

    @Test
    void testDeferredReturningNull() {
        Evaluatable<String> e = Evaluatable.deferred(() -> null);
        assertThrows(NullPointerException.class, e::evaluate);
    }
}
