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

package org.apache.idxmap.sysprops.parser;

/**
 * Parser for integer properties bounded to a closed range.
 */
public final class IntegerParser implements PropParser<Integer> {
    public static final IntegerParser POSITIVE = new IntegerParser(1, Integer.MAX_VALUE);
    public static final IntegerParser NON_NEGATIVE = new IntegerParser(0, Integer.MAX_VALUE);

    private final int lowerBound;
    private final int upperBound;

    private IntegerParser(int lowerBound, int upperBound) {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound");
        }
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static IntegerParser from(int lowerBound, int upperBound) {
        return new IntegerParser(lowerBound, upperBound);
    }

    @Override
    public Integer parse(String value) {
        int parsed = Integer.parseInt(value);
        if (parsed < lowerBound || parsed > upperBound) {
            throw new IllegalArgumentException(
                "Value " + parsed + " out of range [" + lowerBound + ", " + upperBound + "]");
        }
        return parsed;
    }
}
