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
 * Failures raised by {@link IndexedCollection}. Misuse of index names is always fatal, only plain key absence
 * has a tolerant alternative through the non-strict accessors.
 */
public class IndexedCollectionException extends RuntimeException {
    private IndexedCollectionException(String message) {
        super(message);
    }

    public static IndexAlreadyExistsException indexAlreadyExists(String indexName) {
        return new IndexAlreadyExistsException(indexName);
    }

    public static UnknownIndexException unknownIndex(String indexName) {
        return new UnknownIndexException(indexName);
    }

    public static KeyNotFoundException keyNotFound(FullKey<?> key) {
        return new KeyNotFoundException(key);
    }

    public static LazyIndexUnsupportedException lazyIndexUnsupported(String indexName) {
        return new LazyIndexUnsupportedException(indexName);
    }

    /**
     * The index name is already taken by an eager or a lazy index.
     */
    public static class IndexAlreadyExistsException extends IndexedCollectionException {
        private IndexAlreadyExistsException(String indexName) {
            super("Index already present: " + indexName);
        }
    }

    /**
     * No eager or lazy index is registered under the name.
     */
    public static class UnknownIndexException extends IndexedCollectionException {
        private UnknownIndexException(String indexName) {
            super("Unknown index: " + indexName);
        }
    }

    /**
     * A strict accessor was called with a key that resolves to no value.
     */
    public static class KeyNotFoundException extends IndexedCollectionException {
        private KeyNotFoundException(FullKey<?> key) {
            super("Key not found: " + key);
        }
    }

    /**
     * The operation needs a materialized secondary map, which lazy indices do not have.
     */
    public static class LazyIndexUnsupportedException extends IndexedCollectionException {
        private LazyIndexUnsupportedException(String indexName) {
            super("Operation not supported by lazy index: " + indexName);
        }
    }
}
