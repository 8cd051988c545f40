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

/**
 * Translates a {@link FullKey} into a primary key.
 */
final class KeyResolver {
    private KeyResolver() {
    }

    /**
     * Outcome of resolving a full key.
     */
    record Resolution<K>(Status status, K primaryKey) {
        enum Status {
            FOUND,
            NOT_FOUND,
            UNKNOWN_INDEX
        }

        @SuppressWarnings("rawtypes")
        private static final Resolution NOT_FOUND = new Resolution<>(Status.NOT_FOUND, null);
        @SuppressWarnings("rawtypes")
        private static final Resolution UNKNOWN_INDEX = new Resolution<>(Status.UNKNOWN_INDEX, null);

        static <K> Resolution<K> found(K primaryKey) {
            return new Resolution<>(Status.FOUND, primaryKey);
        }

        @SuppressWarnings("unchecked")
        static <K> Resolution<K> notFound() {
            return NOT_FOUND;
        }

        @SuppressWarnings("unchecked")
        static <K> Resolution<K> unknownIndex() {
            return UNKNOWN_INDEX;
        }

        boolean isFound() {
            return status == Status.FOUND;
        }
    }

    /**
     * Resolve without failing. A bare primary key is returned as-is, its presence is checked by the store lookup.
     */
    static <K, V> Resolution<K> resolve(FullKey<K> fullKey, PrimaryStore<K, V> store, IndexRegistry<K, V> registry) {
        if (fullKey instanceof FullKey.Primary<K> primary) {
            return Resolution.found(primary.key());
        }
        if (fullKey instanceof FullKey.Secondary<K> secondary) {
            EagerIndex<K, V> eager = registry.eager(secondary.indexName());
            if (eager != null) {
                return toResolution(eager.resolve(secondary.key()));
            }
            LazyIndex<K, V> lazy = registry.lazy(secondary.indexName());
            if (lazy != null) {
                return toResolution(lazy.resolve(secondary.key(), store));
            }
            return Resolution.unknownIndex();
        }
        throw new IllegalStateException("Unsupported key type: " + fullKey.getClass().getName());
    }

    /**
     * Resolve to the primary key of a stored value, or fail.
     *
     * @throws IndexedCollectionException.UnknownIndexException if the index name is unknown
     * @throws IndexedCollectionException.KeyNotFoundException if no value is stored under the key
     */
    static <K, V> K resolveStrict(FullKey<K> fullKey, PrimaryStore<K, V> store, IndexRegistry<K, V> registry) {
        Resolution<K> resolution = resolve(fullKey, store, registry);
        switch (resolution.status()) {
            case FOUND:
                if (store.slot(resolution.primaryKey()) != null) {
                    return resolution.primaryKey();
                }
                throw IndexedCollectionException.keyNotFound(fullKey);
            case UNKNOWN_INDEX:
                throw IndexedCollectionException.unknownIndex(((FullKey.Secondary<K>) fullKey).indexName());
            default:
                throw IndexedCollectionException.keyNotFound(fullKey);
        }
    }

    /**
     * Resolve to the primary key of a stored value, or null if absent. Unknown index names still fail.
     */
    static <K, V> K resolveSoft(FullKey<K> fullKey, PrimaryStore<K, V> store, IndexRegistry<K, V> registry) {
        Resolution<K> resolution = resolve(fullKey, store, registry);
        if (resolution.status() == Resolution.Status.UNKNOWN_INDEX) {
            throw IndexedCollectionException.unknownIndex(((FullKey.Secondary<K>) fullKey).indexName());
        }
        if (resolution.isFound() && store.slot(resolution.primaryKey()) != null) {
            return resolution.primaryKey();
        }
        return null;
    }

    private static <K> Resolution<K> toResolution(K primaryKey) {
        return primaryKey == null ? Resolution.notFound() : Resolution.found(primaryKey);
    }
}
