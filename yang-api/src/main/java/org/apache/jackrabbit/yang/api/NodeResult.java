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
 * Value and status returned by the status based entry points.
 */
public final class NodeResult {

    private final Object value;

    private final Status status;

    public NodeResult(@Nullable Object value, @NotNull Status status) {
        this.value = value;
        this.status = checkNotNull(status);
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @NotNull
    public Status getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return status + " " + value;
    }
}
