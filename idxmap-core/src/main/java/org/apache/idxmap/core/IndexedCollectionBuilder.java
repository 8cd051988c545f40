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
 * Accumulates values into a collection through {@link IndexedCollection#put(Object)}.
 *
 * <p>The origin collection is never modified, aborting simply drops the accumulated state. A builder is
 * single use: once built or aborted, any further call fails.
 */
public final class IndexedCollectionBuilder<K, V> {
    private enum State {
        ACCUMULATING,
        BUILT,
        ABORTED
    }

    private final IndexedCollection<K, V> origin;
    private IndexedCollection<K, V> current;
    private State state = State.ACCUMULATING;

    IndexedCollectionBuilder(IndexedCollection<K, V> origin) {
        this.origin = origin;
        this.current = origin;
    }

    public IndexedCollectionBuilder<K, V> add(V value) {
        checkAccumulating();
        current = current.put(value);
        return this;
    }

    public IndexedCollectionBuilder<K, V> addAll(Iterable<? extends V> values) {
        checkAccumulating();
        current = current.putAll(values);
        return this;
    }

    /**
     * Number of values accumulated so far, including those of the origin.
     */
    public int size() {
        checkAccumulating();
        return current.size();
    }

    public IndexedCollection<K, V> build() {
        checkAccumulating();
        state = State.BUILT;
        return current;
    }

    /**
     * Discard the accumulated values.
     *
     * @return the untouched origin collection
     */
    public IndexedCollection<K, V> abort() {
        checkAccumulating();
        state = State.ABORTED;
        current = null;
        return origin;
    }

    private void checkAccumulating() {
        if (state != State.ACCUMULATING) {
            throw new IllegalStateException("Builder already " + state.name().toLowerCase());
        }
    }
}
