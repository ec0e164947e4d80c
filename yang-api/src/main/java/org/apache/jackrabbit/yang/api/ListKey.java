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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Maps;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The map key of an entry of a list with more than one key leaf. Holds the
 * key values by key leaf name, in key order.
 */
public final class ListKey {

    private final Map<String, Object> values;

    private ListKey(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    @NotNull
    public Map<String, Object> getValues() {
        return values;
    }

    @Nullable
    public Object get(@NotNull String keyName) {
        return values.get(keyName);
    }

    @Override
    public boolean equals(Object other) {
        return this == other
                || (other instanceof ListKey && values.equals(((ListKey) other).values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {

        private final Map<String, Object> values = Maps.newLinkedHashMap();

        private Builder() {
        }

        public Builder put(@NotNull String keyName, @Nullable Object value) {
            values.put(checkNotNull(keyName), value);
            return this;
        }

        public ListKey build() {
            return new ListKey(Maps.newLinkedHashMap(values));
        }
    }
}
