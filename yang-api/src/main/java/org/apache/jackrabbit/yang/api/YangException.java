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
package org.apache.jackrabbit.yang.api;

import static java.lang.String.format;

/**
 * Main exception thrown by the tree engine indicating that an operation on
 * a schema typed data tree failed.
 * <p>
 * The message of an exception is prefixed with its source, type and code,
 * e.g. {@code YangPathNotFound0001: could not find path ...}.
 */
public class YangException extends Exception {

    /**
     * Source name for exceptions thrown by the tree engine.
     */
    public static final String YANG = "Yang";

    /**
     * Type name for schema inconsistencies: a field without path metadata,
     * a descriptor lookup failure, a broken leafref expression.
     */
    public static final String SCHEMA = "SchemaMismatch";

    /**
     * Type name for paths that match no schema or data node.
     */
    public static final String NOT_FOUND = "PathNotFound";

    /**
     * Type name for malformed input.
     */
    public static final String ARGUMENT = "InvalidArgument";

    /**
     * Type name for constraint violations reported by validation.
     */
    public static final String CONSTRAINT = "ConstraintViolation";

    /**
     * Type name for wrapped lower level errors.
     */
    public static final String INTERNAL = "Internal";

    /**
     * Serial version UID
     */
    private static final long serialVersionUID = -3815466017125264180L;

    private final String source;

    private final String type;

    private final int code;

    public YangException(
            String source, String type, int code, String message,
            Throwable cause) {
        super(format("%s%s%04d: %s", source, type, code, message), cause);
        this.source = source;
        this.type = type;
        this.code = code;
    }

    public YangException(
            String type, int code, String message, Throwable cause) {
        this(YANG, type, code, message, cause);
    }

    public YangException(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    public boolean isSchemaMismatch() {
        return isOfType(SCHEMA);
    }

    public boolean isPathNotFound() {
        return isOfType(NOT_FOUND);
    }

    public boolean isInvalidArgument() {
        return isOfType(ARGUMENT);
    }

    public boolean isConstraintViolation() {
        return isOfType(CONSTRAINT);
    }

    /**
     * Returns the name of the source of this exception.
     *
     * @return source name
     */
    public String getSource() {
        return source;
    }

    /**
     * Return the name of the type of this exception.
     *
     * @return type name
     */
    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }
}
