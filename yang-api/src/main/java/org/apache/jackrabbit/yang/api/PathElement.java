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

import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One step of a {@link TreePath}: a name plus, when the step selects an
 * entry of a keyed list, the key values of that entry.
 * <p>
 * Keys are unordered. Two elements are equal iff their names and key maps
 * are equal, so elements can be used as map keys in canonical form.
 */
public final class PathElement {

    private static final Splitter KEY_SEPARATOR = Splitter.onPattern(",(?=\\s*[\\w.:-]+\\s*=)");

    /**
     * Key value matching any entry when wildcards are enabled.
     */
    public static final String WILDCARD = "*";

    private final String name;

    private final ImmutableSortedMap<String, String> keys;

    private PathElement(String name, Map<String, String> keys) {
        this.name = checkNotNull(name);
        this.keys = ImmutableSortedMap.copyOf(keys);
    }

    @NotNull
    public static PathElement of(@NotNull String name) {
        return new PathElement(name, ImmutableSortedMap.<String, String>of());
    }

    @NotNull
    public static PathElement of(@NotNull String name, @NotNull Map<String, String> keys) {
        return new PathElement(name, keys);
    }

    @NotNull
    public static PathElement of(@NotNull String name, @NotNull String key, @NotNull String value) {
        return new PathElement(name, ImmutableSortedMap.of(key, value));
    }

    /**
     * Parses a single element such as {@code interface[name=eth0]} or
     * {@code list[key1=a][key2=b]}. A bracket may also hold several
     * comma separated key values: {@code list[key1=a,key2=b]}. A comma only
     * separates keys when a key name and {@code =} follow it, so values
     * may contain commas.
     *
     * @param element the element text
     * @return the element
     * @throws IllegalArgumentException if the element is malformed
     */
    @NotNull
    public static PathElement parse(@NotNull String element) {
        int bracket = element.indexOf('[');
        if (bracket < 0) {
            return of(element);
        }
        String name = element.substring(0, bracket);
        ImmutableSortedMap.Builder<String, String> keys = ImmutableSortedMap.naturalOrder();
        int pos = bracket;
        while (pos < element.length()) {
            checkArgument(element.charAt(pos) == '[', "Malformed path element [%s]", element);
            int end = element.indexOf(']', pos);
            checkArgument(end > pos, "Unterminated key in path element [%s]", element);
            for (String pair : KEY_SEPARATOR.split(element.substring(pos + 1, end))) {
                int eq = pair.indexOf('=');
                checkArgument(eq > 0, "Malformed key in path element [%s]", element);
                keys.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
            }
            pos = end + 1;
        }
        return new PathElement(name, keys.build());
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public Map<String, String> getKeys() {
        return keys;
    }

    public boolean hasKeys() {
        return !keys.isEmpty();
    }

    @Nullable
    public String getKey(@NotNull String keyName) {
        return keys.get(keyName);
    }

    @NotNull
    public PathElement withName(@NotNull String newName) {
        return new PathElement(newName, keys);
    }

    @NotNull
    public PathElement withoutKeys() {
        return keys.isEmpty() ? this : of(name);
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PathElement)) {
            return false;
        }
        PathElement that = (PathElement) other;
        return name.equals(that.name) && keys.equals(that.keys);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + keys.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder(name);
        for (Map.Entry<String, String> key : keys.entrySet()) {
            buff.append('[').append(key.getKey()).append('=').append(key.getValue()).append(']');
        }
        return buff.toString();
    }
}
