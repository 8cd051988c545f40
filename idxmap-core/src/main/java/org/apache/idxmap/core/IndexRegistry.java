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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import org.pcollections.TreePMap;

/**
 * Immutable registry of the eager and lazy secondary indices of a collection. Names are unique across both.
 */
final class IndexRegistry<K, V> {
    @SuppressWarnings("rawtypes")
    private static final IndexRegistry EMPTY = new IndexRegistry<Object, Object>(TreePMap.empty(), TreePMap.empty());

    private final TreePMap<String, EagerIndex<K, V>> eager;
    private final TreePMap<String, LazyIndex<K, V>> lazy;

    private IndexRegistry(TreePMap<String, EagerIndex<K, V>> eager, TreePMap<String, LazyIndex<K, V>> lazy) {
        this.eager = eager;
        this.lazy = lazy;
    }

    @SuppressWarnings("unchecked")
    static <K, V> IndexRegistry<K, V> empty() {
        return (IndexRegistry<K, V>) EMPTY;
    }

    boolean contains(String name) {
        return eager.containsKey(name) || lazy.containsKey(name);
    }

    EagerIndex<K, V> eager(String name) {
        return eager.get(name);
    }

    LazyIndex<K, V> lazy(String name) {
        return lazy.get(name);
    }

    boolean hasEagerIndices() {
        return !eager.isEmpty();
    }

    Set<String> eagerNames() {
        return Collections.unmodifiableSet(eager.keySet());
    }

    Set<String> lazyNames() {
        return Collections.unmodifiableSet(lazy.keySet());
    }

    IndexRegistry<K, V> withEager(String name, Function<? super V, ?> indexFn, PrimaryStore<K, V> store) {
        if (contains(name)) {
            throw IndexedCollectionException.indexAlreadyExists(name);
        }
        return new IndexRegistry<>(eager.plus(name, EagerIndex.materialize(name, indexFn, store)), lazy);
    }

    IndexRegistry<K, V> withLazy(String name, Function<? super V, ?> indexFn) {
        if (contains(name)) {
            throw IndexedCollectionException.indexAlreadyExists(name);
        }
        return new IndexRegistry<>(eager, lazy.plus(name, new LazyIndex<>(name, indexFn)));
    }

    IndexRegistry<K, V> without(String name) {
        if (eager.containsKey(name)) {
            return new IndexRegistry<>(eager.minus(name), lazy);
        }
        if (lazy.containsKey(name)) {
            return new IndexRegistry<>(eager, lazy.minus(name));
        }
        throw IndexedCollectionException.unknownIndex(name);
    }

    /**
     * Install the entries of a value into every eager index.
     */
    IndexRegistry<K, V> added(long seq, K primaryKey, V value) {
        if (eager.isEmpty()) {
            return this;
        }
        TreePMap<String, EagerIndex<K, V>> updated = eager;
        for (EagerIndex<K, V> index : eager.values()) {
            updated = updated.plus(index.name(), index.added(seq, primaryKey, value));
        }
        return new IndexRegistry<>(updated, lazy);
    }

    /**
     * Purge the entries of a value from every eager index.
     */
    IndexRegistry<K, V> removed(long seq, V value) {
        if (eager.isEmpty()) {
            return this;
        }
        TreePMap<String, EagerIndex<K, V>> updated = eager;
        for (EagerIndex<K, V> index : eager.values()) {
            updated = updated.plus(index.name(), index.removed(seq, value));
        }
        return new IndexRegistry<>(updated, lazy);
    }

    /**
     * Names of the eager indices whose key differs between the two values.
     */
    List<String> changedEagerKeys(V before, V after) {
        List<String> changed = new ArrayList<>();
        for (EagerIndex<K, V> index : eager.values()) {
            if (!Objects.equals(index.keyOf(before), index.keyOf(after))) {
                changed.add(index.name());
            }
        }
        return changed;
    }
}
