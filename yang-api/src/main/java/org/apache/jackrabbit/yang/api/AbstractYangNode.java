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

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;

import org.jetbrains.annotations.Nullable;

/**
 * Base class of generated types. Stores the field values in an array
 * indexed like the fields of {@link #getNodeType()} and implements value
 * equality over them.
 */
public abstract class AbstractYangNode implements YangNode {

    private final Object[] values;

    protected AbstractYangNode(int fieldCount) {
        this.values = new Object[fieldCount];
    }

    @Nullable
    @Override
    public Object getField(int index) {
        checkElementIndex(index, values.length);
        return values[index];
    }

    @Override
    public void setField(int index, @Nullable Object value) {
        checkElementIndex(index, values.length);
        values[index] = value;
    }

    @SuppressWarnings("unchecked")
    protected <V> V get(int index) {
        return (V) values[index];
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return Arrays.deepEquals(values, ((AbstractYangNode) other).values);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder(getNodeType().getName()).append('{');
        String sep = "";
        for (FieldDescriptor field : getNodeType().getFields()) {
            Object value = values[field.getIndex()];
            if (value != null) {
                buff.append(sep).append(field.getName()).append('=')
                        .append(value instanceof byte[] ? Scalars.asString(value) : value);
                sep = ", ";
            }
        }
        return buff.append('}').toString();
    }
}
