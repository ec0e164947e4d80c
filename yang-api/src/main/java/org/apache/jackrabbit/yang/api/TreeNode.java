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

import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A node matched by a path: the path to it with all list keys filled in,
 * its schema entry and its data.
 */
public final class TreeNode {

    private final TreePath path;

    private final SchemaEntry schema;

    private final Object data;

    public TreeNode(@NotNull TreePath path, @NotNull SchemaEntry schema, @Nullable Object data) {
        this.path = checkNotNull(path);
        this.schema = checkNotNull(schema);
        this.data = data;
    }

    @NotNull
    public TreePath getPath() {
        return path;
    }

    @NotNull
    public SchemaEntry getSchema() {
        return schema;
    }

    /**
     * The matched value: a {@link YangNode}, a list entry map, a scalar, or
     * {@code null} for an unset leaf.
     */
    @Nullable
    public Object getData() {
        return data;
    }

    @Override
    public String toString() {
        return path + " (" + schema + "): " + data;
    }
}
