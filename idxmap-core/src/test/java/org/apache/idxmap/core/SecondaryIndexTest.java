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
import static org.testng.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.testng.annotations.Test;

public class SecondaryIndexTest {

    @Test
    public void testEagerAndLazyAgreeWithoutConflicts() {
        List<User> values = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            values.add(new User("user" + i, 1000 + i));
        }
        IndexedCollection<String, User> c = IndexedCollection.of(values, User::name)
            .createIndex("eager", User::age)
            .createLazyIndex("lazy", User::age);
        for (int age = 990; age < 1060; age++) {
            assertEquals(c.fetch(FullKey.secondary("eager", age)), c.fetch(FullKey.secondary("lazy", age)));
        }
    }

    @Test
    public void testEarliestStoredValueWinsForDuplicateKeys() {
        User a = new User("Ann", 30);
        User b = new User("Ben", 30);
        User c = new User("Cid", 30);
        IndexedCollection<String, User> users = IndexedCollection.of(List.of(a, b, c), User::name)
            .createIndex("eager", User::age)
            .createLazyIndex("lazy", User::age);

        assertEquals(users.fetchStrict(FullKey.secondary("eager", 30)), a);
        assertEquals(users.fetchStrict(FullKey.secondary("lazy", 30)), a);

        // removing the winner promotes the next value instead of losing the key
        users = users.popStrict("Ann").collection();
        assertEquals(users.fetchStrict(FullKey.secondary("eager", 30)), b);
        assertEquals(users.fetchStrict(FullKey.secondary("lazy", 30)), b);

        // put over an existing key moves the value to the end of storage order
        users = users.put(new User("Ben", 30));
        assertEquals(users.fetchStrict(FullKey.secondary("eager", 30)), c);
        assertEquals(users.fetchStrict(FullKey.secondary("lazy", 30)), c);

        users = users.popStrict(FullKey.secondary("eager", 30)).collection();
        assertEquals(users.fetchStrict(FullKey.secondary("eager", 30)), new User("Ben", 30));
        users = users.popStrict("Ben").collection();
        assertEquals(users.fetch(FullKey.secondary("eager", 30)), Optional.empty());
        assertEquals(users.fetch(FullKey.secondary("lazy", 30)), Optional.empty());
    }

    @Test
    public void testFastUpdateKeepsStoragePosition() {
        IndexedCollection<String, User> users = IndexedCollection.of(
                List.of(new User("Ann", 30), new User("Ben", 30)), User::name)
            .createIndex("eager", User::age)
            .createLazyIndex("lazy", User::age);
        users = users.fastUpdateStrict("Ann", u -> new User("Ann", 30));

        assertEquals(users.fetchStrict(FullKey.secondary("eager", 30)).name(), "Ann");
        assertEquals(users.fetchStrict(FullKey.secondary("lazy", 30)).name(), "Ann");
        assertEquals(users.toList().get(0).name(), "Ann");
    }

    @Test
    public void testNullSecondaryKeysAreNotIndexed() {
        IndexedCollection<String, User> users = IndexedCollection.of(
                List.of(new User("Ann", 30), new User("Ben", 40)), User::name)
            .createIndex("eager", u -> u.age() > 35 ? "senior" : null)
            .createLazyIndex("lazy", u -> u.age() > 35 ? "senior" : null);

        assertEquals(users.fetchStrict(FullKey.secondary("eager", "senior")).name(), "Ben");
        assertEquals(users.fetch(FullKey.secondary("eager", null)), Optional.empty());
        assertEquals(users.fetch(FullKey.secondary("lazy", null)), Optional.empty());

        users = users.updateStrict("Ann", u -> u.withAge(50)).popStrict("Ben").collection();
        assertEquals(users.fetchStrict(FullKey.secondary("eager", "senior")).name(), "Ann");
        assertEquals(users.fetchStrict(FullKey.secondary("lazy", "senior")).name(), "Ann");
    }

    @Test
    public void testIndexConsistencyUnderRandomMutations() {
        Random random = new Random(42);
        IndexedCollection<String, User> users = IndexedCollection.<String, User>empty(User::name)
            .createIndex("age", User::age)
            .createIndex("initial", User::initial)
            .createLazyIndex("lazyAge", User::age);

        for (int i = 0; i < 500; i++) {
            String name = "u" + random.nextInt(40);
            int op = random.nextInt(4);
            if (op == 0) {
                users = users.pop(name).collection();
            } else if (op == 1 && users.fetch(name).isPresent()) {
                String renamed = "u" + random.nextInt(40);
                if (!users.fetch(renamed).isPresent()) {
                    users = users.updateStrict(name, u -> new User(renamed, random.nextInt(1000)));
                }
            } else {
                users = users.put(new User(name, random.nextInt(1000)));
            }
            assertEquals(users.toList().size(), users.size());
        }

        assertFalse(users.isEmpty());
        for (User u : users) {
            assertTrue(users.member(u));
            assertEquals(users.fetchStrict(u.name()), u);
            User byAge = users.fetchStrict(FullKey.secondary("age", u.age()));
            assertEquals(byAge.age(), u.age());
            assertEquals(users.fetchStrict(FullKey.secondary("lazyAge", u.age())), byAge);
            assertEquals(users.fetchStrict(FullKey.secondary("initial", u.initial())).initial(), u.initial());
        }
    }
}
