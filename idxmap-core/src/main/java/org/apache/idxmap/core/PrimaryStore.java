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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.TreePMap;

/**
 * Immutable primary key to value mapping, the ground truth for membership and size.
 *
 * <p>Every entry carries a sequence number assigned on insertion. Storage order is ascending sequence order,
 * shared by lazy index scans and eager index buckets so both resolve duplicate secondary keys the same way.
 */
final class PrimaryStore<K, V> {
    @SuppressWarnings("rawtypes")
    private static final PrimaryStore EMPTY =
        new PrimaryStore<Object, Object>(HashTreePMap.empty(), TreePMap.empty(), 0L);

    private final PMap<K, Slot<V>> slots;
    private final TreePMap<Long, K> order;
    private final long nextSeq;

    private PrimaryStore(PMap<K, Slot<V>> slots, TreePMap<Long, K> order, long nextSeq) {
        this.slots = slots;
        this.order = order;
        this.nextSeq = nextSeq;
    }

    @SuppressWarnings("unchecked")
    static <K, V> PrimaryStore<K, V> empty() {
        return (PrimaryStore<K, V>) EMPTY;
    }

    /**
     * A stored value together with its position in storage order.
     */
    record Slot<V>(long seq, V value) {
    }

    int size() {
        return slots.size();
    }

    Slot<V> slot(K key) {
        return slots.get(key);
    }

    V get(K key) {
        Slot<V> slot = slots.get(key);
        return slot == null ? null : slot.value;
    }

    /** The sequence number the next inserted entry gets. */
    long nextSeq() {
        return nextSeq;
    }

    /**
     * Append an entry at the end of storage order. The key must be absent.
     */
    PrimaryStore<K, V> plus(K key, V value) {
        assert !slots.containsKey(key) : "Key must be removed before re-insertion";
        long seq = nextSeq;
        return new PrimaryStore<>(slots.plus(key, new Slot<>(seq, value)), order.plus(seq, key), seq + 1);
    }

    /**
     * Swap the value of a present key keeping its position.
     */
    PrimaryStore<K, V> replaced(K key, V value) {
        Slot<V> slot = slots.get(key);
        assert slot != null : "Key must be present";
        return new PrimaryStore<>(slots.plus(key, new Slot<>(slot.seq, value)), order, nextSeq);
    }

    PrimaryStore<K, V> minus(K key) {
        Slot<V> slot = slots.get(key);
        if (slot == null) {
            return this;
        }
        return new PrimaryStore<>(slots.minus(key), order.minus(slot.seq), nextSeq);
    }

    /** Visit every entry in storage order. */
    void forEach(BiConsumer<K, Slot<V>> consumer) {
        for (K key : order.values()) {
            consumer.accept(key, slots.get(key));
        }
    }

    /**
     * Find the key of the first value in storage order matching the predicate.
     *
     * @return the key or null
     */
    K firstMatch(Predicate<V> predicate) {
        for (K key : order.values()) {
            if (predicate.test(slots.get(key).value)) {
                return key;
            }
        }
        return null;
    }

    List<V> values() {
        List<V> values = new ArrayList<>(slots.size());
        for (K key : order.values()) {
            values.add(slots.get(key).value);
        }
        return values;
    }

    Map<K, V> toMap() {
        Map<K, V> map = new LinkedHashMap<>();
        forEach((key, slot) -> map.put(key, slot.value));
        return Collections.unmodifiableMap(map);
    }
}
