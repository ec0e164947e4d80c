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
package org.apache.jackrabbit.yang.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.collect.Maps;
import com.google.common.collect.Range;
import org.apache.jackrabbit.yang.api.YangEnum;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.TypeKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Checks a single leaf value against the restrictions of its type: ranges,
 * lengths, patterns, enumeration names and union members.
 */
public final class ScalarChecks {

    /**
     * Compiled patterns by YANG pattern text. Patterns are shared read-only
     * schema state, the cache is safe for concurrent use.
     */
    private static final ConcurrentMap<String, Pattern> PATTERNS = Maps.newConcurrentMap();

    private ScalarChecks() {
    }

    /**
     * Checks a value in its Java representation.
     *
     * @param type the resolved type of the leaf
     * @param value the value
     * @return a description of the violation, or {@code null} if the value is valid
     */
    @Nullable
    public static String check(@NotNull ScalarType type, @NotNull Object value) {
        TypeKind kind = type.getKind();
        if (kind.isInteger()) {
            BigDecimal number;
            if (value instanceof Long) {
                number = BigDecimal.valueOf((Long) value);
            } else if (value instanceof BigInteger) {
                number = new BigDecimal((BigInteger) value);
            } else {
                return wrongType(type, value);
            }
            return inRanges(type.getEffectiveRanges(), number)
                    ? null : "value " + value + " is outside the ranges " + type.getEffectiveRanges() + " of " + kind;
        }
        switch (kind) {
            case DECIMAL64:
                if (!(value instanceof BigDecimal)) {
                    return wrongType(type, value);
                }
                BigDecimal decimal = (BigDecimal) value;
                if (type.getFractionDigits() > 0
                        && decimal.stripTrailingZeros().scale() > type.getFractionDigits()) {
                    return "value " + decimal.toPlainString() + " has more than "
                            + type.getFractionDigits() + " fraction digits";
                }
                return inRanges(type.getRanges(), decimal)
                        ? null : "value " + decimal.toPlainString() + " is outside the ranges " + type.getRanges();
            case STRING:
                if (!(value instanceof String)) {
                    return wrongType(type, value);
                }
                String string = (String) value;
                int length = string.codePointCount(0, string.length());
                if (!inRanges(type.getLengths(), BigDecimal.valueOf(length))) {
                    return "length " + length + " of \"" + string + "\" is outside the lengths " + type.getLengths();
                }
                for (String pattern : type.getPatterns()) {
                    Pattern compiled;
                    try {
                        compiled = compile(pattern);
                    } catch (PatternSyntaxException e) {
                        return "invalid pattern " + pattern + ": " + e.getDescription();
                    }
                    if (!compiled.matcher(string).matches()) {
                        return "\"" + string + "\" does not match pattern " + pattern;
                    }
                }
                return null;
            case BINARY:
                if (!(value instanceof byte[])) {
                    return wrongType(type, value);
                }
                int size = ((byte[]) value).length;
                return inRanges(type.getLengths(), BigDecimal.valueOf(size))
                        ? null : "binary length " + size + " is outside the lengths " + type.getLengths();
            case BOOLEAN:
            case EMPTY:
                return value instanceof Boolean ? null : wrongType(type, value);
            case ENUMERATION:
                String name;
                if (value instanceof YangEnum) {
                    name = ((YangEnum) value).getYangName();
                } else if (value instanceof String) {
                    name = (String) value;
                } else {
                    return wrongType(type, value);
                }
                return type.getEnumNames().contains(name)
                        ? null : "\"" + name + "\" is not a value of enumeration " + type.getEnumNames();
            case UNION:
                for (ScalarType member : type.getUnionTypes()) {
                    if (member.isLeafref() || check(member, value) == null) {
                        return null;
                    }
                }
                return ScalarCodec.describe(value) + " does not match any member of " + type;
            default:
                return null;
        }
    }

    /**
     * Compiles a YANG pattern. YANG patterns are XML Schema regular
     * expressions: they are implicitly anchored and {@code ^} and {@code $}
     * are ordinary characters.
     *
     * @throws PatternSyntaxException if the pattern is invalid
     */
    @NotNull
    public static Pattern compile(@NotNull String yangPattern) {
        Pattern pattern = PATTERNS.get(yangPattern);
        if (pattern == null) {
            pattern = Pattern.compile("^(?:" + escapeAnchors(yangPattern) + ")$");
            PATTERNS.putIfAbsent(yangPattern, pattern);
        }
        return pattern;
    }

    static String escapeAnchors(String pattern) {
        StringBuilder buff = new StringBuilder(pattern.length() + 4);
        boolean escaped = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '$' || (c == '^' && (i == 0 || pattern.charAt(i - 1) != '['))) {
                buff.append('\\');
            }
            buff.append(c);
        }
        return buff.toString();
    }

    private static boolean inRanges(List<Range<BigDecimal>> ranges, BigDecimal value) {
        if (ranges.isEmpty()) {
            return true;
        }
        for (Range<BigDecimal> range : ranges) {
            if (range.contains(value)) {
                return true;
            }
        }
        return false;
    }

    private static String wrongType(ScalarType type, Object value) {
        return ScalarCodec.describe(value) + " is not a valid " + type + " value";
    }
}
