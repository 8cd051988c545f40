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

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.TreePMap;

/**
 * Materialized secondary index mapping each secondary key to the primary key of the value producing it.
 *
 * <p>Values sharing a secondary key are kept in a bucket ordered by their storage sequence, the earliest one
 * resolves. Removing it promotes the next one, so the index never loses track of a stored value.
 */
@Slf4j
final class EagerIndex<K, V> {
    private final String name;
    private final Function<? super V, ?> indexFn;
    private final PMap<Object, TreePMap<Long, K>> buckets;

    private EagerIndex(String name, Function<? super V, ?> indexFn, PMap<Object, TreePMap<Long, K>> buckets) {
        this.name = name;
        this.indexFn = indexFn;
        this.buckets = buckets;
    }

    /**
     * Build the index over the current content of the store in one pass.
     */
    static <K, V> EagerIndex<K, V> materialize(String name, Function<? super V, ?> indexFn, PrimaryStore<K, V> store) {
        Map<Object, TreePMap<Long, K>> buckets = new HashMap<>();
        store.forEach((key, slot) -> {
            Object secondaryKey = indexFn.apply(slot.value());
            if (secondaryKey != null) {
                TreePMap<Long, K> bucket = buckets.get(secondaryKey);
                buckets.put(secondaryKey, bucket == null
                    ? TreePMap.<Long, K>empty().plus(slot.seq(), key) : bucket.plus(slot.seq(), key));
            }
        });
        return new EagerIndex<>(name, indexFn, HashTreePMap.from(buckets));
    }

    String name() {
        return name;
    }

    /** The secondary key of the value, null means the value is not indexed. */
    Object keyOf(V value) {
        return indexFn.apply(value);
    }

    EagerIndex<K, V> added(long seq, K primaryKey, V value) {
        Object secondaryKey = keyOf(value);
        if (secondaryKey == null) {
            return this;
        }
        TreePMap<Long, K> bucket = buckets.get(secondaryKey);
        if (bucket == null) {
            bucket = TreePMap.<Long, K>empty().plus(seq, primaryKey);
        } else {
            bucket = bucket.plus(seq, primaryKey);
            log.trace("Index[{}] key {} shared by {} values", name, secondaryKey, bucket.size());
        }
        return new EagerIndex<>(name, indexFn, buckets.plus(secondaryKey, bucket));
    }

    EagerIndex<K, V> removed(long seq, V value) {
        Object secondaryKey = keyOf(value);
        if (secondaryKey == null) {
            return this;
        }
        TreePMap<Long, K> bucket = buckets.get(secondaryKey);
        if (bucket == null || !bucket.containsKey(seq)) {
            return this;
        }
        bucket = bucket.minus(seq);
        return new EagerIndex<>(name, indexFn,
            bucket.isEmpty() ? buckets.minus(secondaryKey) : buckets.plus(secondaryKey, bucket));
    }

    /**
     * Resolve a secondary key.
     *
     * @return the primary key, or null if nothing is indexed under the key
     */
    K resolve(Object secondaryKey) {
        if (secondaryKey == null) {
            return null;
        }
        TreePMap<Long, K> bucket = buckets.get(secondaryKey);
        return bucket == null ? null : bucket.get(bucket.firstKey());
    }

    /** Number of distinct secondary keys. */
    int keyCount() {
        return buckets.size();
    }
}
