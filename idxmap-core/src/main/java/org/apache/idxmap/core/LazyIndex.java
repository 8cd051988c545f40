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
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.idxmap.sysprops.props.LazyIndexScanWarnThreshold;

/**
 * Secondary index holding only its key function, every lookup scans the primary store.
 */
@Slf4j
final class LazyIndex<K, V> {
    private final String name;
    private final Function<? super V, ?> indexFn;

    LazyIndex(String name, Function<? super V, ?> indexFn) {
        this.name = name;
        this.indexFn = indexFn;
    }

    String name() {
        return name;
    }

    /**
     * Resolve a secondary key by scanning the store in storage order, the first match wins.
     *
     * @return the primary key, or null if no value produces the key
     */
    K resolve(Object secondaryKey, PrimaryStore<K, V> store) {
        if (secondaryKey == null) {
            return null;
        }
        int threshold = LazyIndexScanWarnThreshold.INSTANCE.get();
        if (store.size() > threshold) {
            log.warn("Lazy index[{}] scanning {} values, consider an eager index", name, store.size());
        }
        return store.firstMatch(value -> Objects.equals(indexFn.apply(value), secondaryKey));
    }
}
