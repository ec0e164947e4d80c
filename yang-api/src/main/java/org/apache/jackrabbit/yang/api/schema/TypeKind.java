/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.yang.api.schema;

import java.math.BigDecimal;
import java.math.BigInteger;

import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;

/**
 * The built-in YANG types a leaf can have.
 */
public enum TypeKind {

    STRING("string"),
    INT8("int8", Byte.MIN_VALUE, Byte.MAX_VALUE),
    INT16("int16", Short.MIN_VALUE, Short.MAX_VALUE),
    INT32("int32", Integer.MIN_VALUE, Integer.MAX_VALUE),
    INT64("int64", Long.MIN_VALUE, Long.MAX_VALUE),
    UINT8("uint8", 0, 255),
    UINT16("uint16", 0, 65535),
    UINT32("uint32", 0, 4294967295L),
    UINT64("uint64", BigDecimal.ZERO,
            new BigDecimal(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE))),
    DECIMAL64("decimal64"),
    BOOLEAN("boolean"),
    ENUMERATION("enumeration"),
    UNION("union"),
    BINARY("binary"),
    LEAFREF("leafref"),
    EMPTY("empty");

    private final String yangName;

    private final Range<BigDecimal> defaultRange;

    TypeKind(String yangName) {
        this.yangName = yangName;
        this.defaultRange = null;
    }

    TypeKind(String yangName, long min, long max) {
        this(yangName, BigDecimal.valueOf(min), BigDecimal.valueOf(max));
    }

    TypeKind(String yangName, BigDecimal min, BigDecimal max) {
        this.yangName = yangName;
        this.defaultRange = Range.closed(min, max);
    }

    @NotNull
    public String getYangName() {
        return yangName;
    }

    public boolean isInteger() {
        return defaultRange != null;
    }

    /**
     * Whether values of this kind are encoded as JSON strings rather than
     * numbers (RFC 7951, section 6.1).
     */
    public boolean isQuotedNumber() {
        return this == INT64 || this == UINT64 || this == DECIMAL64;
    }

    /**
     * The range implied by the type itself, e.g. {@code [0..255]} for
     * {@code uint8}. {@code null} for non-integer kinds.
     */
    public Range<BigDecimal> getDefaultRange() {
        return defaultRange;
    }

    @Override
    public String toString() {
        return yangName;
    }
}
