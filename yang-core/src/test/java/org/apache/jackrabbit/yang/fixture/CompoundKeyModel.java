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
package org.apache.jackrabbit.yang.fixture;

import static org.apache.jackrabbit.yang.api.schema.SchemaEntry.container;
import static org.apache.jackrabbit.yang.api.schema.SchemaEntry.leaf;
import static org.apache.jackrabbit.yang.api.schema.SchemaEntry.list;

import java.util.Map;

import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.AbstractYangNode;
import org.apache.jackrabbit.yang.api.ListKey;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.api.schema.TypeKind;

/**
 * A root container holding a list with a compound key of three leaves, and
 * a nested leaf {@code outer/inner/leaf-field} in each entry.
 */
public final class CompoundKeyModel {

    public static final SchemaEntry ROOT = container("root").fakeRoot().child(
            list("list", "key1", "key2", "key3").child(
                    leaf("key1", ScalarType.string()),
                    leaf("key2", ScalarType.of(TypeKind.INT32)),
                    leaf("key3", ScalarType.of(TypeKind.INT32)),
                    container("outer").child(
                            container("inner").child(
                                    leaf("leaf-field", ScalarType.of(TypeKind.INT32))))))
            .build();

    private CompoundKeyModel() {
    }

    public static final class Root extends AbstractYangNode {

        public static final NodeType<Root> TYPE = NodeType.builder("Root", Root::new)
                .list("list", "list", ListKey.class, ListEntry.TYPE)
                .build();

        public Root() {
            super(1);
        }

        @Override
        public NodeType<?> getNodeType() {
            return TYPE;
        }

        public Map<ListKey, ListEntry> getList() {
            return get(0);
        }

        public ListEntry addEntry(String key1, long key2, long key3) {
            Map<ListKey, ListEntry> entries = getList();
            if (entries == null) {
                entries = Maps.newLinkedHashMap();
                setField(0, entries);
            }
            ListEntry entry = new ListEntry();
            entry.setField(0, key1);
            entry.setField(1, key2);
            entry.setField(2, key3);
            entries.put((ListKey) ListEntry.TYPE.keyOf(entry), entry);
            return entry;
        }
    }

    public static final class ListEntry extends AbstractYangNode {

        public static final NodeType<ListEntry> TYPE = NodeType.builder("ListEntry", ListEntry::new)
                .leaf("key1", "key1", String.class)
                .leaf("key2", "key2", Long.class)
                .leaf("key3", "key3", Long.class)
                .container("outer", "outer", Outer.TYPE)
                .key("key1", "key2", "key3")
                .build();

        public ListEntry() {
            super(4);
        }

        @Override
        public NodeType<?> getNodeType() {
            return TYPE;
        }

        public Outer getOrCreateOuter() {
            if (get(3) == null) {
                setField(3, new Outer());
            }
            return get(3);
        }
    }

    public static final class Outer extends AbstractYangNode {

        public static final NodeType<Outer> TYPE = NodeType.builder("Outer", Outer::new)
                .container("inner", "inner", Inner.TYPE)
                .build();

        public Outer() {
            super(1);
        }

        @Override
        public NodeType<?> getNodeType() {
            return TYPE;
        }

        public Inner getOrCreateInner() {
            if (get(0) == null) {
                setField(0, new Inner());
            }
            return get(0);
        }
    }

    public static final class Inner extends AbstractYangNode {

        public static final NodeType<Inner> TYPE = NodeType.builder("Inner", Inner::new)
                .leaf("leafField", "leaf-field", Long.class)
                .build();

        public Inner() {
            super(1);
        }

        @Override
        public NodeType<?> getNodeType() {
            return TYPE;
        }

        public Long getLeafField() {
            return get(0);
        }

        public void setLeafField(Long value) {
            setField(0, value);
        }
    }
}
