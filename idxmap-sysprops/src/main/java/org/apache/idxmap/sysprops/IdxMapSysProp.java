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

package org.apache.idxmap.sysprops;

import lombok.extern.slf4j.Slf4j;
import org.apache.idxmap.sysprops.parser.PropParser;

/**
 * Base of all system properties recognized by IdxMap.
 *
 * <p>Each property is exposed as a singleton named {@code INSTANCE}. The value is read from
 * {@link System#getProperty(String)} on every {@link #get()} call, so tests may flip a property
 * between cases.
 *
 * @param <T> the value type
 * @param <P> the parser type
 */
@Slf4j
public abstract class IdxMapSysProp<T, P extends PropParser<T>> {
    private final String propKey;
    private final T defaultValue;
    private final P parser;

    protected IdxMapSysProp(String propKey, T defaultValue, P parser) {
        this.propKey = propKey;
        this.defaultValue = defaultValue;
        this.parser = parser;
    }

    /**
     * The key used to look up the system property.
     *
     * @return the property key
     */
    public final String propKey() {
        return propKey;
    }

    /**
     * The value used when the property is absent or malformed.
     *
     * @return the default value
     */
    public final T defaultValue() {
        return defaultValue;
    }

    /**
     * Resolve the current value of the property.
     *
     * @return the parsed value, or the default value
     */
    public T get() {
        String value = System.getProperty(propKey);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.parse(value.trim());
        } catch (Throwable e) {
            log.warn("Failed to parse system property {}={}, fallback to default value: {}",
                propKey, value, defaultValue, e);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return propKey + "=" + get();
    }
}
