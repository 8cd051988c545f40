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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collector;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.idxmap.sysprops.props.DebugRenderMaxValues;
import org.apache.idxmap.sysprops.props.FastUpdateKeyCheck;

/**
 * Immutable collection of values keyed by a primary key function, with any number of named secondary
 * indices declared at runtime.
 *
 * <p>Eager indices keep a materialized secondary map updated on every mutation. Lazy indices only keep their
 * key function and scan the values on lookup. Values are addressed by {@link FullKey}; the overloads taking a
 * bare {@code K} are shorthands for {@link FullKey#primary(Object)}.
 *
 * <p>Every mutating operation returns a new collection and leaves this one untouched. Structure is shared
 * between versions, so instances may be read from any number of threads.
 *
 * @param <K> the primary key type
 * @param <V> the value type
 */
@Slf4j
public final class IndexedCollection<K, V> implements Iterable<V> {
    private final Function<? super V, ? extends K> primaryFn;
    private final PrimaryStore<K, V> store;
    private final IndexRegistry<K, V> registry;

    private IndexedCollection(Function<? super V, ? extends K> primaryFn,
                              PrimaryStore<K, V> store,
                              IndexRegistry<K, V> registry) {
        this.primaryFn = primaryFn;
        this.store = store;
        this.registry = registry;
    }

    public static <K, V> IndexedCollection<K, V> empty(Function<? super V, ? extends K> primaryFn) {
        Objects.requireNonNull(primaryFn, "primaryFn");
        return new IndexedCollection<>(primaryFn, PrimaryStore.empty(), IndexRegistry.empty());
    }

    /**
     * Create a collection from initial values. Later values overwrite earlier ones with the same primary key.
     */
    public static <K, V> IndexedCollection<K, V> of(Iterable<? extends V> values,
                                                    Function<? super V, ? extends K> primaryFn) {
        return IndexedCollection.<K, V>empty(primaryFn).putAll(values);
    }

    /**
     * A collector putting stream elements into a new collection.
     */
    public static <K, V> Collector<V, ?, IndexedCollection<K, V>> collector(Function<? super V, ? extends K> primaryFn) {
        return IndexedCollection.<K, V>empty(primaryFn).collector();
    }

    /**
     * A collector putting stream elements into this collection, which itself stays unchanged.
     */
    public Collector<V, ?, IndexedCollection<K, V>> collector() {
        return Collector.<V, List<V>, IndexedCollection<K, V>>of(ArrayList::new, List::add,
            (left, right) -> {
                left.addAll(right);
                return left;
            },
            this::putAll);
    }

    /**
     * Start accumulating values on top of this collection.
     */
    public IndexedCollectionBuilder<K, V> into() {
        return new IndexedCollectionBuilder<>(this);
    }

    // ===== INDEX MANAGEMENT =====

    /**
     * Add an eager index, materialized in one pass over the current values.
     *
     * @throws IndexedCollectionException.IndexAlreadyExistsException if the name is taken
     */
    public IndexedCollection<K, V> createIndex(String name, Function<? super V, ?> indexFn) {
        return createIndex(name, indexFn, false);
    }

    /**
     * Add a lazy index, resolved by scanning the values on every lookup.
     *
     * @throws IndexedCollectionException.IndexAlreadyExistsException if the name is taken
     */
    public IndexedCollection<K, V> createLazyIndex(String name, Function<? super V, ?> indexFn) {
        return createIndex(name, indexFn, true);
    }

    public IndexedCollection<K, V> createIndex(String name, Function<? super V, ?> indexFn, boolean lazy) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(indexFn, "indexFn");
        if (lazy) {
            IndexRegistry<K, V> updated = registry.withLazy(name, indexFn);
            log.debug("Lazy index[{}] created", name);
            return new IndexedCollection<>(primaryFn, store, updated);
        }
        IndexRegistry<K, V> updated = registry.withEager(name, indexFn, store);
        log.debug("Eager index[{}] created: values={}, keys={}", name, store.size(), updated.eager(name).keyCount());
        return new IndexedCollection<>(primaryFn, store, updated);
    }

    /**
     * Remove an index of either kind.
     *
     * @throws IndexedCollectionException.UnknownIndexException if no index has the name
     */
    public IndexedCollection<K, V> dropIndex(String name) {
        IndexRegistry<K, V> updated = registry.without(name);
        log.debug("Index[{}] dropped", name);
        return new IndexedCollection<>(primaryFn, store, updated);
    }

    /**
     * Names of the eager indices, sorted.
     */
    public List<String> eagerIndexNames() {
        return List.copyOf(registry.eagerNames());
    }

    /**
     * Names of the lazy indices, sorted.
     */
    public List<String> lazyIndexNames() {
        return List.copyOf(registry.lazyNames());
    }

    public boolean hasIndex(String name) {
        return registry.contains(name);
    }

    // ===== MUTATION =====

    /**
     * Insert or replace a value. A value already stored under the same primary key is removed first together
     * with its secondary entries.
     */
    public IndexedCollection<K, V> put(V value) {
        Objects.requireNonNull(value, "value");
        K primaryKey = primaryKeyOf(value);
        PrimaryStore<K, V> nextStore = store;
        IndexRegistry<K, V> nextRegistry = registry;
        PrimaryStore.Slot<V> existing = store.slot(primaryKey);
        if (existing != null) {
            nextRegistry = nextRegistry.removed(existing.seq(), existing.value());
            nextStore = nextStore.minus(primaryKey);
        }
        long seq = nextStore.nextSeq();
        nextRegistry = nextRegistry.added(seq, primaryKey, value);
        nextStore = nextStore.plus(primaryKey, value);
        return new IndexedCollection<>(primaryFn, nextStore, nextRegistry);
    }

    public IndexedCollection<K, V> putAll(Iterable<? extends V> values) {
        IndexedCollection<K, V> result = this;
        for (V value : values) {
            result = result.put(value);
        }
        return result;
    }

    public Popped<K, V> pop(K key) {
        return pop(FullKey.primary(key), null);
    }

    public Popped<K, V> pop(FullKey<K> key) {
        return pop(key, null);
    }

    public Popped<K, V> pop(K key, V defaultValue) {
        return pop(FullKey.primary(key), defaultValue);
    }

    /**
     * Remove the value addressed by the key. If absent, the default is returned with this collection.
     */
    public Popped<K, V> pop(FullKey<K> key, V defaultValue) {
        K primaryKey = KeyResolver.resolveSoft(key, store, registry);
        if (primaryKey == null) {
            return new Popped<>(defaultValue, this);
        }
        return removeResolved(primaryKey);
    }

    public Popped<K, V> popStrict(K key) {
        return popStrict(FullKey.primary(key));
    }

    /**
     * Remove the value addressed by the key.
     *
     * @throws IndexedCollectionException.KeyNotFoundException if absent
     */
    public Popped<K, V> popStrict(FullKey<K> key) {
        return removeResolved(KeyResolver.resolveStrict(key, store, registry));
    }

    public IndexedCollection<K, V> updateStrict(K key, Function<? super V, ? extends V> transform) {
        return updateStrict(FullKey.primary(key), transform);
    }

    /**
     * Replace the value addressed by the key with its transformation. The transform may change any key, the old
     * value is fully removed before the new one is put.
     *
     * @throws IndexedCollectionException.KeyNotFoundException if absent
     */
    public IndexedCollection<K, V> updateStrict(FullKey<K> key, Function<? super V, ? extends V> transform) {
        Popped<K, V> popped = popStrict(key);
        return popped.collection().put(transform.apply(popped.value()));
    }

    public IndexedCollection<K, V> fastUpdateStrict(K key, Function<? super V, ? extends V> transform) {
        return fastUpdateStrict(FullKey.primary(key), transform);
    }

    /**
     * Replace the value addressed by the key in place, without touching any index. The transform must not change
     * the primary key or any secondary key, otherwise the collection becomes inconsistent. The precondition is
     * only verified when {@link FastUpdateKeyCheck} is enabled.
     *
     * @throws IndexedCollectionException.KeyNotFoundException if absent
     */
    public IndexedCollection<K, V> fastUpdateStrict(FullKey<K> key, Function<? super V, ? extends V> transform) {
        K primaryKey = KeyResolver.resolveStrict(key, store, registry);
        V current = store.get(primaryKey);
        V updated = Objects.requireNonNull(transform.apply(current), "value");
        if (FastUpdateKeyCheck.INSTANCE.get()) {
            K updatedKey = primaryFn.apply(updated);
            if (!primaryKey.equals(updatedKey)) {
                throw new IllegalStateException("Fast update changed primary key: " + primaryKey + " -> " + updatedKey);
            }
            List<String> changed = registry.changedEagerKeys(current, updated);
            if (!changed.isEmpty()) {
                throw new IllegalStateException("Fast update changed keys of indices " + changed);
            }
        }
        return new IndexedCollection<>(primaryFn, store.replaced(primaryKey, updated), registry);
    }

    public <R> Updated<R, K, V> getAndUpdateStrict(K key, Function<? super V, Transition<R, V>> fn) {
        return getAndUpdateStrict(FullKey.primary(key), fn);
    }

    /**
     * Pass the value addressed by the key to the function and apply the returned transition.
     *
     * @throws IndexedCollectionException.KeyNotFoundException if absent
     */
    public <R> Updated<R, K, V> getAndUpdateStrict(FullKey<K> key, Function<? super V, Transition<R, V>> fn) {
        K primaryKey = KeyResolver.resolveStrict(key, store, registry);
        return applyTransition(primaryKey, fn.apply(store.get(primaryKey)));
    }

    public <R> Updated<R, K, V> getAndUpdate(K key, Function<Optional<V>, Transition<R, V>> fn) {
        return getAndUpdate(FullKey.primary(key), fn);
    }

    /**
     * Like {@link #getAndUpdateStrict(FullKey, Function)}, but a missing value is passed as
     * {@link Optional#empty()}. Popping a missing value leaves the collection unchanged.
     */
    public <R> Updated<R, K, V> getAndUpdate(FullKey<K> key, Function<Optional<V>, Transition<R, V>> fn) {
        K primaryKey = KeyResolver.resolveSoft(key, store, registry);
        if (primaryKey == null) {
            Transition<R, V> transition = fn.apply(Optional.empty());
            if (transition.isPop()) {
                return new Updated<>(transition.result(), this);
            }
            return new Updated<>(transition.result(), put(transition.newValue()));
        }
        return applyTransition(primaryKey, fn.apply(Optional.of(store.get(primaryKey))));
    }

    // ===== LOOKUP =====

    public Optional<V> fetch(K key) {
        return fetch(FullKey.primary(key));
    }

    public Optional<V> fetch(FullKey<K> key) {
        K primaryKey = KeyResolver.resolveSoft(key, store, registry);
        return primaryKey == null ? Optional.empty() : Optional.of(store.get(primaryKey));
    }

    public V fetchStrict(K key) {
        return fetchStrict(FullKey.primary(key));
    }

    /**
     * @throws IndexedCollectionException.KeyNotFoundException if absent
     */
    public V fetchStrict(FullKey<K> key) {
        return store.get(KeyResolver.resolveStrict(key, store, registry));
    }

    public V get(K key) {
        return get(FullKey.primary(key), null);
    }

    public V get(FullKey<K> key) {
        return get(key, null);
    }

    public V get(K key, V defaultValue) {
        return get(FullKey.primary(key), defaultValue);
    }

    public V get(FullKey<K> key, V defaultValue) {
        return fetch(key).orElse(defaultValue);
    }

    /**
     * Translate a key of an eager index into a primary key without fetching the value.
     *
     * @throws IndexedCollectionException.UnknownIndexException if no index has the name
     * @throws IndexedCollectionException.LazyIndexUnsupportedException if the index is lazy
     */
    public Optional<K> primaryKey(String indexName, Object secondaryKey) {
        EagerIndex<K, V> index = registry.eager(indexName);
        if (index == null) {
            if (registry.lazy(indexName) != null) {
                throw IndexedCollectionException.lazyIndexUnsupported(indexName);
            }
            throw IndexedCollectionException.unknownIndex(indexName);
        }
        return Optional.ofNullable(index.resolve(secondaryKey));
    }

    /**
     * Whether this exact value is stored: its primary key is present and the stored value equals it.
     */
    public boolean member(V value) {
        if (value == null) {
            return false;
        }
        K primaryKey = primaryFn.apply(value);
        return primaryKey != null && Objects.equals(store.get(primaryKey), value);
    }

    public boolean contains(V value) {
        return member(value);
    }

    public int size() {
        return store.size();
    }

    public boolean isEmpty() {
        return store.size() == 0;
    }

    /**
     * A fresh list of all values in storage order.
     */
    public List<V> toList() {
        return Collections.unmodifiableList(store.values());
    }

    /**
     * A fresh map of primary key to value in storage order.
     */
    public Map<K, V> toMap() {
        return store.toMap();
    }

    public Stream<V> stream() {
        return toList().stream();
    }

    @Override
    public Iterator<V> iterator() {
        return toList().iterator();
    }

    /**
     * Render the values and index names for diagnostics, the output format is not stable.
     */
    @Override
    public String toString() {
        int maxValues = DebugRenderMaxValues.INSTANCE.get();
        List<V> values = store.values();
        StringBuilder sb = new StringBuilder("IndexedCollection<[");
        for (int i = 0; i < values.size() && i < maxValues; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values.get(i));
        }
        if (values.size() > maxValues) {
            sb.append(", ...(").append(values.size() - maxValues).append(" more)");
        }
        sb.append("], indices: [primary=").append(primaryFn)
            .append(", eager=").append(registry.eagerNames())
            .append(", lazy=").append(registry.lazyNames())
            .append("]>");
        return sb.toString();
    }

    private K primaryKeyOf(V value) {
        return Objects.requireNonNull(primaryFn.apply(value), "primary key");
    }

    private Popped<K, V> removeResolved(K primaryKey) {
        PrimaryStore.Slot<V> slot = store.slot(primaryKey);
        IndexRegistry<K, V> nextRegistry = registry.removed(slot.seq(), slot.value());
        return new Popped<>(slot.value(), new IndexedCollection<>(primaryFn, store.minus(primaryKey), nextRegistry));
    }

    private <R> Updated<R, K, V> applyTransition(K primaryKey, Transition<R, V> transition) {
        IndexedCollection<K, V> removed = removeResolved(primaryKey).collection();
        if (transition.isPop()) {
            return new Updated<>(transition.result(), removed);
        }
        return new Updated<>(transition.result(), removed.put(transition.newValue()));
    }
}
