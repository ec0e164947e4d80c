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

import java.util.Arrays;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A single leaf level change: set the leaf at {@code path} to {@code value}.
 */
public final class Update {

    private final TreePath path;

    private final Object value;

    public Update(@NotNull TreePath path, @Nullable Object value) {
        this.path = checkNotNull(path);
        this.value = value;
    }

    @NotNull
    public TreePath getPath() {
        return path;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Update)) {
            return false;
        }
        Update that = (Update) other;
        return path.equals(that.path)
                && Arrays.deepEquals(new Object[] {value}, new Object[] {that.value});
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + Arrays.deepHashCode(new Object[] {value});
    }

    @Override
    public String toString() {
        return path + " = " + (value instanceof byte[] ? Scalars.asString(value) : value);
    }
}
