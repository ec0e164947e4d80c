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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A node of the schema descriptor tree: the static description of one
 * declaration of a YANG module (container, list, leaf, leaf-list, choice or
 * case).
 * <p>
 * A tree is assembled once through {@link Builder}s and is immutable
 * afterwards. Children are owned by their parent; each entry keeps a
 * non-owning reference to its parent.
 * <pre>
 * SchemaEntry device = SchemaEntry.container("device").fakeRoot()
 *         .child(SchemaEntry.container("interfaces")
 *                 .child(SchemaEntry.list("interface", "name")
 *                         .child(SchemaEntry.leaf("name", ScalarType.string()))))
 *         .build();
 * </pre>
 */
public final class SchemaEntry {

    private final String name;

    private final SchemaKind kind;

    /**
     * Name of the module defining this entry, inherited from the parent
     * if not declared.
     */
    private final String module;

    private final SchemaEntry parent;

    /** Children by name, in declaration order. */
    private final Map<String, SchemaEntry> children;

    private final ImmutableList<String> key;

    private final ScalarType type;

    private final boolean fakeRoot;

    private final int minElements;

    private final int maxElements;

    private SchemaEntry(Builder builder, SchemaEntry parent) {
        this.name = builder.name;
        this.kind = builder.kind;
        this.parent = parent;
        this.module = builder.module != null || parent == null ? builder.module : parent.module;
        this.key = ImmutableList.copyOf(builder.key);
        this.type = builder.type;
        this.fakeRoot = builder.fakeRoot;
        this.minElements = builder.minElements;
        this.maxElements = builder.maxElements;
        Map<String, SchemaEntry> map = Maps.newLinkedHashMap();
        for (Builder child : builder.children) {
            checkArgument(!map.containsKey(child.name),
                    "duplicate child %s of %s", child.name, builder.name);
            map.put(child.name, new SchemaEntry(child, this));
        }
        this.children = Collections.unmodifiableMap(map);
    }

    @NotNull
    public static Builder container(@NotNull String name) {
        return new Builder(name, SchemaKind.CONTAINER);
    }

    @NotNull
    public static Builder list(@NotNull String name, @NotNull String... key) {
        Builder builder = new Builder(name, SchemaKind.LIST);
        builder.key.addAll(ImmutableList.copyOf(key));
        return builder;
    }

    @NotNull
    public static Builder leaf(@NotNull String name, @NotNull ScalarType type) {
        return new Builder(name, SchemaKind.LEAF).type(type);
    }

    @NotNull
    public static Builder leafList(@NotNull String name, @NotNull ScalarType type) {
        return new Builder(name, SchemaKind.LEAF_LIST).type(type);
    }

    @NotNull
    public static Builder choice(@NotNull String name) {
        return new Builder(name, SchemaKind.CHOICE);
    }

    @NotNull
    public static Builder caseOf(@NotNull String name) {
        return new Builder(name, SchemaKind.CASE);
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public SchemaKind getKind() {
        return kind;
    }

    @Nullable
    public String getModule() {
        return module;
    }

    @Nullable
    public SchemaEntry getParent() {
        return parent;
    }

    /**
     * Returns the root of the tree this entry belongs to.
     */
    @NotNull
    public SchemaEntry getRoot() {
        SchemaEntry entry = this;
        while (entry.parent != null) {
            entry = entry.parent;
        }
        return entry;
    }

    @Nullable
    public SchemaEntry getChild(@NotNull String childName) {
        return children.get(childName);
    }

    @NotNull
    public Collection<SchemaEntry> getChildren() {
        return children.values();
    }

    /**
     * The names of the key leaves of a list, in declaration order. Empty
     * for all other kinds and for key-less lists.
     */
    @NotNull
    public List<String> getKey() {
        return key;
    }

    @Nullable
    public ScalarType getType() {
        return type;
    }

    /**
     * Whether this is the synthesized root representing a whole device.
     * It does not appear in data paths.
     */
    public boolean isFakeRoot() {
        return fakeRoot;
    }

    public int getMinElements() {
        return minElements;
    }

    /**
     * @return the maximum number of elements, {@link Integer#MAX_VALUE} if unbounded
     */
    public int getMaxElements() {
        return maxElements;
    }

    public boolean isContainer() {
        return kind == SchemaKind.CONTAINER;
    }

    public boolean isList() {
        return kind == SchemaKind.LIST;
    }

    public boolean isLeaf() {
        return kind == SchemaKind.LEAF;
    }

    public boolean isLeafList() {
        return kind == SchemaKind.LEAF_LIST;
    }

    public boolean isChoiceOrCase() {
        return kind.isChoiceOrCase();
    }

    public boolean isDir() {
        return kind.isDir();
    }

    public boolean isKeyedList() {
        return kind == SchemaKind.LIST && !key.isEmpty();
    }

    /**
     * Returns the data path of this entry: the names from the root, without
     * the fake root, choices and cases. The root itself has path "/".
     */
    @NotNull
    public String getPath() {
        List<String> names = Lists.newArrayList();
        for (SchemaEntry e = this; e != null; e = e.parent) {
            if (e.parent != null && !e.isChoiceOrCase()) {
                names.add(e.name);
            }
        }
        if (names.isEmpty()) {
            return "/";
        }
        StringBuilder buff = new StringBuilder();
        for (String n : Lists.reverse(names)) {
            buff.append('/').append(n);
        }
        return buff.toString();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ENGLISH) + " " + name;
    }

    /**
     * Builder for a schema sub tree.
     */
    public static final class Builder {

        private final String name;
        private final SchemaKind kind;
        private final List<String> key = Lists.newArrayList();
        private final List<Builder> children = Lists.newArrayList();
        private String module;
        private ScalarType type;
        private boolean fakeRoot;
        private int minElements;
        private int maxElements = Integer.MAX_VALUE;

        private Builder(String name, SchemaKind kind) {
            this.name = checkNotNull(name);
            this.kind = kind;
        }

        public Builder module(@NotNull String moduleName) {
            this.module = checkNotNull(moduleName);
            return this;
        }

        public Builder type(@NotNull ScalarType scalarType) {
            checkState(!kind.isDir(), "%s %s cannot have a type", kind, name);
            this.type = checkNotNull(scalarType);
            return this;
        }

        public Builder fakeRoot() {
            checkState(kind == SchemaKind.CONTAINER, "only a container can be a fake root");
            this.fakeRoot = true;
            return this;
        }

        public Builder child(@NotNull Builder... childBuilders) {
            checkState(kind.isDir(), "%s %s cannot have children", kind, name);
            for (Builder child : childBuilders) {
                children.add(checkNotNull(child));
            }
            return this;
        }

        public Builder minElements(int min) {
            checkArgument(min >= 0, "min-elements must not be negative");
            this.minElements = min;
            return this;
        }

        public Builder maxElements(int max) {
            checkArgument(max > 0, "max-elements must be positive");
            this.maxElements = max;
            return this;
        }

        /**
         * Builds the tree rooted at this builder.
         */
        public SchemaEntry build() {
            return new SchemaEntry(this, null);
        }
    }
}
