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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a call through the status returning entry points: a code and
 * an optional message.
 */
public final class Status {

    public enum Code {
        OK,
        INVALID_ARGUMENT,
        NOT_FOUND,
        INTERNAL
    }

    public static final Status OK = new Status(Code.OK, null);

    private final Code code;

    private final String message;

    private Status(Code code, String message) {
        this.code = code;
        this.message = message;
    }

    @NotNull
    public static Status of(@NotNull Code code, @NotNull String message) {
        return new Status(checkNotNull(code), checkNotNull(message));
    }

    /**
     * Maps an exception to a status: invalid arguments and unmatched paths
     * keep their meaning, everything else is internal.
     */
    @NotNull
    public static Status of(@NotNull YangException e) {
        Code code;
        if (e.isInvalidArgument()) {
            code = Code.INVALID_ARGUMENT;
        } else if (e.isPathNotFound()) {
            code = Code.NOT_FOUND;
        } else {
            code = Code.INTERNAL;
        }
        return new Status(code, e.getMessage());
    }

    @NotNull
    public Code getCode() {
        return code;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    public boolean isOk() {
        return code == Code.OK;
    }

    @Override
    public String toString() {
        return message == null ? code.name() : code + ": " + message;
    }
}
