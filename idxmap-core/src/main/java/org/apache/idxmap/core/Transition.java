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

import lombok.ToString;

/**
 * The decision returned by the function passed to {@code getAndUpdate}: either replace the current value or
 * remove it, together with the result handed back to the caller.
 *
 * @param <R> the result type
 * @param <V> the value type
 */
@ToString
public final class Transition<R, V> {
    private final R result;
    private final V newValue;
    private final boolean pop;

    private Transition(R result, V newValue, boolean pop) {
        this.result = result;
        this.newValue = newValue;
        this.pop = pop;
    }

    /**
     * Replace the current value, the replacement is installed through {@code put}.
     */
    public static <R, V> Transition<R, V> replace(R result, V newValue) {
        return new Transition<>(result, newValue, false);
    }

    /**
     * Remove the current value.
     */
    public static <R, V> Transition<R, V> pop(R result) {
        return new Transition<>(result, null, true);
    }

    public R result() {
        return result;
    }

    public V newValue() {
        return newValue;
    }

    public boolean isPop() {
        return pop;
    }
}
