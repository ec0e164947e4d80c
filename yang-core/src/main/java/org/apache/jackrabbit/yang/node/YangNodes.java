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
package org.apache.jackrabbit.yang.node;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.YangNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Utility methods for generated data trees.
 */
public final class YangNodes {

    private YangNodes() {
    }

    /**
     * Returns a deep copy of a node. Scalars are immutable and shared, except
     * binary values.
     */
    @SuppressWarnings("unchecked")
    @NotNull
    public static <T extends YangNode> T copy(@NotNull T node) {
        YangNode copy = node.getNodeType().newInstance();
        for (FieldDescriptor field : node.getNodeType().getFields()) {
            copy.setField(field.getIndex(), copyValue(node.getField(field.getIndex())));
        }
        return (T) copy;
    }

    /**
     * Returns a deep copy of a field value.
     */
    @Nullable
    public static Object copyValue(@Nullable Object value) {
        if (value instanceof YangNode) {
            return copy((YangNode) value);
        } else if (value instanceof Map) {
            Map<Object, Object> copy = Maps.newLinkedHashMap();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return copy;
        } else if (value instanceof List) {
            List<Object> copy = Lists.newArrayList();
            for (Object element : (List<?>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        } else if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    /**
     * Whether no field of the node is set.
     */
    public static boolean isEmpty(@NotNull YangNode node) {
        for (FieldDescriptor field : node.getNodeType().getFields()) {
            if (node.getField(field.getIndex()) != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the list map stored in a field, cast for modification.
     */
    @SuppressWarnings("unchecked")
    @Nullable
    static Map<Object, Object> listValue(@NotNull YangNode node, @NotNull FieldDescriptor field) {
        return (Map<Object, Object>) node.getField(field.getIndex());
    }
}
