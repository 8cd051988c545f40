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

import java.util.Objects;

/**
 * Address of a value in an {@link IndexedCollection}: either a bare primary key or a secondary key tagged
 * with the name of the index it belongs to.
 *
 * @param <K> the primary key type
 */
public interface FullKey<K> {

    static <K> FullKey<K> primary(K key) {
        return new Primary<>(key);
    }

    static <K> FullKey<K> secondary(String indexName, Object key) {
        return new Secondary<>(indexName, key);
    }

    /**
     * A primary key, used as-is.
     */
    record Primary<K>(K key) implements FullKey<K> {
        public Primary {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String toString() {
            return String.valueOf(key);
        }
    }

    /**
     * A key of the named secondary index. A {@code null} key never matches anything.
     */
    record Secondary<K>(String indexName, Object key) implements FullKey<K> {
        public Secondary {
            Objects.requireNonNull(indexName, "indexName");
        }

        @Override
        public String toString() {
            return indexName + ":" + key;
        }
    }
}
