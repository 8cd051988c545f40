/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.idxmap.core;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class KeyResolverTest {
    private PrimaryStore<String, User> store;
    private IndexRegistry<String, User> registry;

    @BeforeMethod
    public void setup() {
        store = PrimaryStore.<String, User>empty()
            .plus("Bob", new User("Bob", 20))
            .plus("Eve", new User("Eve", 27));
        registry = IndexRegistry.<String, User>empty()
            .withEager("age", User::age, store)
            .withLazy("initial", User::initial);
    }

    @Test
    public void testPrimaryKeyReturnedAsIs() {
        KeyResolver.Resolution<String> resolution = KeyResolver.resolve(FullKey.primary("Nobody"), store, registry);
        assertTrue(resolution.isFound());
        assertEquals(resolution.primaryKey(), "Nobody");
        assertNull(KeyResolver.resolveSoft(FullKey.primary("Nobody"), store, registry));
    }

    @Test
    public void testEagerLookup() {
        assertEquals(KeyResolver.resolve(FullKey.secondary("age", 27), store, registry).primaryKey(), "Eve");
        KeyResolver.Resolution<String> miss = KeyResolver.resolve(FullKey.secondary("age", 99), store, registry);
        assertFalse(miss.isFound());
        assertEquals(miss.status(), KeyResolver.Resolution.Status.NOT_FOUND);
    }

    @Test
    public void testLazyLookup() {
        assertEquals(KeyResolver.resolve(FullKey.secondary("initial", "B"), store, registry).primaryKey(), "Bob");
        assertEquals(KeyResolver.resolve(FullKey.secondary("initial", "Z"), store, registry).status(),
            KeyResolver.Resolution.Status.NOT_FOUND);
    }

    @Test
    public void testUnknownIndex() {
        assertEquals(KeyResolver.resolve(FullKey.secondary("nope", 1), store, registry).status(),
            KeyResolver.Resolution.Status.UNKNOWN_INDEX);
        assertThrows(IndexedCollectionException.UnknownIndexException.class,
            () -> KeyResolver.resolveStrict(FullKey.secondary("nope", 1), store, registry));
        assertThrows(IndexedCollectionException.UnknownIndexException.class,
            () -> KeyResolver.resolveSoft(FullKey.secondary("nope", 1), store, registry));
    }

    @Test
    public void testStrictResolution() {
        assertEquals(KeyResolver.resolveStrict(FullKey.secondary("initial", "E"), store, registry), "Eve");
        assertEquals(KeyResolver.resolveStrict(FullKey.primary("Bob"), store, registry), "Bob");
        assertThrows(IndexedCollectionException.KeyNotFoundException.class,
            () -> KeyResolver.resolveStrict(FullKey.primary("Nobody"), store, registry));
        assertThrows(IndexedCollectionException.KeyNotFoundException.class,
            () -> KeyResolver.resolveStrict(FullKey.secondary("age", 99), store, registry));
    }
}
