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

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Static metadata of one field of a generated type.
 * <p>
 * The {@code path} annotation gives the schema path of the field relative to
 * the schema entry of the enclosing type. A compressed schema records two
 * alternatives separated by {@code |}: the canonical path through the elided
 * containers and the compressed alias, e.g. {@code config/name|name}.
 * Shadow paths are schema paths the field may also be addressed by
 * (typically the state counterpart of a config leaf); they are only used
 * when explicitly requested.
 */
public final class FieldDescriptor {

    private final int index;

    private final String name;

    private final FieldKind kind;

    private final String path;

    private final ImmutableList<String> paths;

    private final ImmutableList<String> shadowPaths;

    /**
     * Leaf and leaf-list element type, or the key type of a list.
     */
    private final Class<?> valueType;

    private final NodeType<?> childType;

    FieldDescriptor(int index, String name, FieldKind kind, String path, String shadowPath,
                    Class<?> valueType, NodeType<?> childType) {
        this.index = index;
        this.name = name;
        this.kind = kind;
        this.path = path;
        this.paths = path == null ? ImmutableList.<String>of() : ImmutableList.copyOf(PathUtils.alternatives(path));
        this.shadowPaths = shadowPath == null
                ? ImmutableList.<String>of() : ImmutableList.copyOf(PathUtils.alternatives(shadowPath));
        this.valueType = valueType;
        this.childType = childType;
    }

    public int getIndex() {
        return index;
    }

    /**
     * The Java name of the field.
     */
    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public FieldKind getKind() {
        return kind;
    }

    /**
     * The raw path annotation, {@code null} if the field has none.
     */
    @Nullable
    public String getPath() {
        return path;
    }

    /**
     * The path alternatives, in declaration order. Empty if the field has
     * no path annotation.
     */
    @NotNull
    public List<String> getPaths() {
        return paths;
    }

    @NotNull
    public List<String> getShadowPaths() {
        return shadowPaths;
    }

    @Nullable
    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * The generated type of a container field or of the entries of a list
     * field, {@code null} for leaves.
     */
    @Nullable
    public NodeType<?> getChildType() {
        return childType;
    }

    public boolean isLeaf() {
        return kind == FieldKind.LEAF;
    }

    public boolean isLeafList() {
        return kind == FieldKind.LEAF_LIST;
    }

    public boolean isContainer() {
        return kind == FieldKind.CONTAINER;
    }

    public boolean isList() {
        return kind == FieldKind.LIST;
    }

    public boolean isScalar() {
        return kind == FieldKind.LEAF || kind == FieldKind.LEAF_LIST;
    }

    /**
     * The schema name of the leaf this field stores: the single element
     * alternative if there is one (the key leaf of a compressed list entry),
     * the last element of the first alternative otherwise.
     */
    @NotNull
    public String getLeafName() {
        String last = null;
        for (String alternative : paths) {
            List<String> elements = PathUtils.elements(alternative);
            if (elements.size() == 1) {
                return PathUtils.stripModulePrefix(elements.get(0));
            }
            if (last == null && !elements.isEmpty()) {
                last = elements.get(elements.size() - 1);
            }
        }
        return last == null ? name : PathUtils.stripModulePrefix(last);
    }

    @Override
    public String toString() {
        return name + " (" + kind + ", path=" + path + ")";
    }
}
