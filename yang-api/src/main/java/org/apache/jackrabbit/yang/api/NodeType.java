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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The static descriptor table of a generated type: its fields in index
 * order, a factory for empty instances and, for list entry types, the key
 * fields.
 * <p>
 * Generated code declares one table per type:
 * <pre>
 * public static final NodeType&lt;Interface&gt; TYPE = NodeType.builder("Interface", Interface::new)
 *         .leaf("name", "config/name|name", String.class)
 *         .leaf("mtu", "config/mtu", Long.class)
 *         .list("subinterface", "subinterfaces/subinterface", Long.class, Subinterface.TYPE)
 *         .key("name")
 *         .build();
 * </pre>
 *
 * @param <T> the generated type
 */
public final class NodeType<T extends YangNode> {

    private final String name;

    private final Supplier<T> factory;

    private final ImmutableList<FieldDescriptor> fields;

    private final ImmutableMap<String, FieldDescriptor> fieldsByName;

    private final ImmutableList<FieldDescriptor> keyFields;

    private NodeType(Builder<T> builder) {
        this.name = builder.name;
        this.factory = builder.factory;
        this.fields = ImmutableList.copyOf(builder.fields);
        ImmutableMap.Builder<String, FieldDescriptor> byName = ImmutableMap.builder();
        for (FieldDescriptor field : fields) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = byName.build();
        ImmutableList.Builder<FieldDescriptor> keys = ImmutableList.builder();
        for (String keyName : builder.keyNames) {
            FieldDescriptor key = fieldsByName.get(keyName);
            checkArgument(key != null && key.isLeaf(), "key %s of %s is not a leaf field", keyName, name);
            keys.add(key);
        }
        this.keyFields = keys.build();
    }

    @NotNull
    public static <T extends YangNode> Builder<T> builder(@NotNull String name, @NotNull Supplier<T> factory) {
        return new Builder<T>(name, factory);
    }

    @NotNull
    public String getName() {
        return name;
    }

    /**
     * @return a new instance with all fields unset
     */
    @NotNull
    public T newInstance() {
        return factory.get();
    }

    @NotNull
    public List<FieldDescriptor> getFields() {
        return fields;
    }

    @NotNull
    public FieldDescriptor getField(int index) {
        return fields.get(index);
    }

    @Nullable
    public FieldDescriptor getField(@NotNull String fieldName) {
        return fieldsByName.get(fieldName);
    }

    @NotNull
    public List<FieldDescriptor> getKeyFields() {
        return keyFields;
    }

    public boolean isKeyed() {
        return !keyFields.isEmpty();
    }

    /**
     * Computes the map key of a list entry from its key fields: the value of
     * the single key field, or a {@link ListKey} for compound keys.
     *
     * @param entry a list entry of this type
     * @return the map key, {@code null} if a single key field is unset
     */
    @Nullable
    public Object keyOf(@NotNull YangNode entry) {
        checkState(isKeyed(), "%s is not a keyed list entry type", name);
        if (keyFields.size() == 1) {
            return entry.getField(keyFields.get(0).getIndex());
        }
        ListKey.Builder key = ListKey.builder();
        for (FieldDescriptor field : keyFields) {
            key.put(field.getLeafName(), entry.getField(field.getIndex()));
        }
        return key.build();
    }

    /**
     * Splits a map key into its components by key leaf name.
     *
     * @param mapKey a key of a list map holding entries of this type
     * @return the key components, in key order
     */
    @NotNull
    public Map<String, Object> keyComponents(@NotNull Object mapKey) {
        checkState(isKeyed(), "%s is not a keyed list entry type", name);
        Map<String, Object> components = Maps.newLinkedHashMap();
        if (keyFields.size() == 1) {
            components.put(keyFields.get(0).getLeafName(), mapKey);
        } else {
            checkArgument(mapKey instanceof ListKey, "compound key of %s expected, got %s", name, mapKey);
            components.putAll(((ListKey) mapKey).getValues());
        }
        return components;
    }

    /**
     * The key of a list entry as path element key values, by key leaf name.
     * Unset key fields are omitted.
     */
    @NotNull
    public Map<String, String> keyValues(@NotNull YangNode entry) {
        Map<String, String> values = Maps.newLinkedHashMap();
        for (FieldDescriptor field : keyFields) {
            Object value = entry.getField(field.getIndex());
            if (value != null) {
                values.put(field.getLeafName(), Scalars.asString(value));
            }
        }
        return values;
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder<T extends YangNode> {

        private final String name;
        private final Supplier<T> factory;
        private final List<FieldDescriptor> fields = Lists.newArrayList();
        private final List<String> keyNames = Lists.newArrayList();

        private Builder(String name, Supplier<T> factory) {
            this.name = checkNotNull(name);
            this.factory = checkNotNull(factory);
        }

        public Builder<T> leaf(String fieldName, String path, Class<?> valueType) {
            return add(fieldName, FieldKind.LEAF, path, null, valueType, null);
        }

        public Builder<T> leaf(String fieldName, String path, String shadowPath, Class<?> valueType) {
            return add(fieldName, FieldKind.LEAF, path, shadowPath, valueType, null);
        }

        public Builder<T> leafList(String fieldName, String path, Class<?> elementType) {
            return add(fieldName, FieldKind.LEAF_LIST, path, null, elementType, null);
        }

        public Builder<T> container(String fieldName, String path, NodeType<?> childType) {
            return add(fieldName, FieldKind.CONTAINER, path, null, null, checkNotNull(childType));
        }

        public Builder<T> list(String fieldName, String path, Class<?> keyType, NodeType<?> entryType) {
            return add(fieldName, FieldKind.LIST, path, null, keyType, checkNotNull(entryType));
        }

        public Builder<T> key(String... fieldNames) {
            keyNames.addAll(ImmutableList.copyOf(fieldNames));
            return this;
        }

        public NodeType<T> build() {
            return new NodeType<T>(this);
        }

        private Builder<T> add(String fieldName, FieldKind kind, String path, String shadowPath,
                               Class<?> valueType, NodeType<?> childType) {
            fields.add(new FieldDescriptor(fields.size(), checkNotNull(fieldName), kind, path, shadowPath,
                    valueType, childType));
            return this;
        }
    }
}
