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

import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;
import static org.apache.jackrabbit.yang.api.YangException.SCHEMA;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import com.google.common.collect.Lists;
import com.google.common.io.BaseEncoding;
import org.apache.jackrabbit.yang.api.YangEnum;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.TypeKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Converts input values to the Java representation generated types use for
 * leaves:
 * <ul>
 *     <li>{@code string}: {@link String}</li>
 *     <li>integers up to 32 bit and {@code int64}: {@link Long}</li>
 *     <li>{@code uint64}: {@link BigInteger}</li>
 *     <li>{@code decimal64}: {@link BigDecimal}</li>
 *     <li>{@code boolean} and {@code empty}: {@link Boolean}</li>
 *     <li>{@code enumeration}: the generated enum, a {@link YangEnum}</li>
 *     <li>{@code binary}: {@code byte[]}</li>
 *     <li>{@code union}: the representation of the first member type the
 *     value converts to</li>
 * </ul>
 * Leafrefs are converted according to the type of the leaf they reference,
 * the caller passes the resolved type.
 */
public final class ScalarCodec {

    private ScalarCodec() {
    }

    /**
     * Converts a value to the representation of {@code type}.
     *
     * @param javaType the Java type of the field, used to look up generated
     *                 enums; may be {@code null} or {@code Object}
     * @param type the resolved scalar type
     * @param value the input: a value of the right representation, a string
     *              in canonical YANG form, or a number
     * @return the converted value
     * @throws YangException (InvalidArgument) if the value cannot be converted
     */
    @NotNull
    public static Object decode(@Nullable Class<?> javaType, @NotNull ScalarType type, @NotNull Object value)
            throws YangException {
        TypeKind kind = type.getKind();
        if (kind.isInteger()) {
            return decodeInteger(kind, value);
        }
        switch (kind) {
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                break;
            case DECIMAL64:
                if (value instanceof BigDecimal) {
                    return value;
                }
                if (value instanceof Number || value instanceof String) {
                    try {
                        return new BigDecimal(value.toString().trim());
                    } catch (NumberFormatException e) {
                        throw mismatch(type, value, e);
                    }
                }
                break;
            case BOOLEAN:
            case EMPTY:
                if (value instanceof Boolean) {
                    return value;
                }
                if ("true".equals(value) || "false".equals(value)) {
                    return Boolean.valueOf((String) value);
                }
                break;
            case ENUMERATION:
                return decodeEnum(javaType, type, value);
            case BINARY:
                if (value instanceof byte[]) {
                    return value;
                }
                if (value instanceof String) {
                    try {
                        return BaseEncoding.base64().decode((String) value);
                    } catch (IllegalArgumentException e) {
                        throw mismatch(type, value, e);
                    }
                }
                break;
            case UNION:
                return decodeUnion(javaType, type, value);
            case LEAFREF:
                throw new YangException(SCHEMA, 30, "unresolved leafref type " + type);
            default:
                break;
        }
        throw mismatch(type, value, null);
    }

    /**
     * Converts each element of a leaf-list value.
     *
     * @throws YangException (InvalidArgument) if the value is not a list or an
     *         element cannot be converted
     */
    @NotNull
    public static List<Object> decodeList(@Nullable Class<?> javaType, @NotNull ScalarType type,
                                          @NotNull Object value) throws YangException {
        if (!(value instanceof List)) {
            throw new YangException(ARGUMENT, 31, "leaf-list of " + type + " expected, got "
                    + value.getClass().getSimpleName() + " " + value);
        }
        List<Object> result = Lists.newArrayList();
        for (Object element : (List<?>) value) {
            if (element == null) {
                throw new YangException(ARGUMENT, 31, "leaf-list element of " + type + " must not be null");
            }
            result.add(decode(javaType, type, element));
        }
        return result;
    }

    /**
     * Returns the zero value of the representation of a leaf type, as used
     * for newly created leaves.
     */
    @Nullable
    public static Object zeroValue(@Nullable Class<?> javaType) {
        if (javaType == null) {
            return null;
        } else if (javaType == String.class) {
            return "";
        } else if (javaType == Long.class) {
            return 0L;
        } else if (javaType == BigInteger.class) {
            return BigInteger.ZERO;
        } else if (javaType == BigDecimal.class) {
            return BigDecimal.ZERO;
        } else if (javaType == Boolean.class) {
            return Boolean.FALSE;
        } else if (javaType == byte[].class) {
            return new byte[0];
        } else if (javaType.isEnum() && javaType.getEnumConstants().length > 0) {
            return javaType.getEnumConstants()[0];
        }
        return null;
    }

    private static Object decodeInteger(TypeKind kind, Object value) throws YangException {
        BigInteger integer;
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            integer = BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigInteger) {
            integer = (BigInteger) value;
        } else if (value instanceof String) {
            try {
                integer = new BigInteger(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new YangException(ARGUMENT, 32, "cannot convert \"" + value + "\" to " + kind, e);
            }
        } else {
            throw new YangException(ARGUMENT, 32, "cannot convert " + describe(value) + " to " + kind);
        }
        if (!kind.getDefaultRange().contains(new BigDecimal(integer))) {
            throw new YangException(ARGUMENT, 33, "value " + integer + " is outside the range of " + kind);
        }
        return kind == TypeKind.UINT64 ? integer : (Object) integer.longValue();
    }

    private static Object decodeEnum(Class<?> javaType, ScalarType type, Object value) throws YangException {
        if (javaType != null && javaType.isEnum()) {
            if (javaType.isInstance(value)) {
                return value;
            }
            if (value instanceof String) {
                for (Object constant : javaType.getEnumConstants()) {
                    if (value.equals(((YangEnum) constant).getYangName())
                            || value.equals(((Enum<?>) constant).name())) {
                        return constant;
                    }
                }
            }
        } else if (value instanceof String && type.getEnumNames().contains(value)) {
            return value;
        } else if (value instanceof YangEnum && type.getEnumNames().contains(((YangEnum) value).getYangName())) {
            return value;
        }
        throw new YangException(ARGUMENT, 34, describe(value) + " is not a value of enumeration "
                + type.getEnumNames());
    }

    private static Object decodeUnion(Class<?> javaType, ScalarType type, Object value) throws YangException {
        for (ScalarType member : type.getUnionTypes()) {
            try {
                Object decoded = decode(javaType, member, value);
                if (ScalarChecks.check(member, decoded) == null) {
                    return decoded;
                }
            } catch (YangException e) {
                // try the next member type
            }
        }
        throw new YangException(ARGUMENT, 35, describe(value) + " does not match any member of " + type);
    }

    private static YangException mismatch(ScalarType type, Object value, Exception cause) {
        return new YangException(ARGUMENT, 36, "cannot convert " + describe(value) + " to " + type, cause);
    }

    static String describe(Object value) {
        return value.getClass().getSimpleName() + " " + value;
    }
}
