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
package org.apache.jackrabbit.yang.schema;

import static org.apache.jackrabbit.yang.api.YangException.SCHEMA;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves the path annotations of generated fields against the schema
 * tree.
 */
public final class SchemaPaths {

    private SchemaPaths() {
    }

    /**
     * Returns the schema path of a field: its only path, or the first
     * alternative with more than one element if it has several. In a
     * compressed schema the multi element alternative is the canonical route
     * through the elided containers.
     *
     * @param field the field
     * @return the path elements, module prefixes retained
     * @throws YangException (SchemaMismatch) if the field has no path, or no
     *         multi element alternative among several
     */
    @NotNull
    public static List<String> schemaPath(@NotNull FieldDescriptor field) throws YangException {
        List<String> paths = field.getPaths();
        if (paths.isEmpty()) {
            throw new YangException(SCHEMA, 1, "field " + field.getName() + " has no path annotation");
        }
        if (paths.size() == 1) {
            return PathUtils.elements(paths.get(0));
        }
        for (String alternative : paths) {
            List<String> elements = PathUtils.elements(alternative);
            if (elements.size() > 1) {
                return elements;
            }
        }
        throw new YangException(SCHEMA, 2, "field " + field.getName()
                + " has no multi-element path among " + paths);
    }

    /**
     * Returns the {@link #schemaPath schema path} of a field as local names.
     * This is the route of the field in the uncompressed data tree.
     */
    @NotNull
    public static List<String> canonicalDataPath(@NotNull FieldDescriptor field) throws YangException {
        List<String> names = Lists.newArrayList();
        for (String element : schemaPath(field)) {
            names.add(PathUtils.stripModulePrefix(element));
        }
        return names;
    }

    /**
     * Returns all path alternatives of a field as local names.
     *
     * @throws YangException (SchemaMismatch) if the field has no path
     */
    @NotNull
    public static List<List<String>> dataPaths(@NotNull FieldDescriptor field) throws YangException {
        if (field.getPaths().isEmpty()) {
            throw new YangException(SCHEMA, 1, "field " + field.getName() + " has no path annotation");
        }
        return localPaths(field.getPaths());
    }

    /**
     * Returns the shadow path alternatives of a field as local names. Empty
     * if the field has none.
     */
    @NotNull
    public static List<List<String>> shadowDataPaths(@NotNull FieldDescriptor field) {
        return localPaths(field.getShadowPaths());
    }

    /**
     * Returns the shortest path alternative of a field as local names.
     */
    @NotNull
    public static List<String> shortestDataPath(@NotNull FieldDescriptor field) throws YangException {
        List<String> shortest = null;
        for (List<String> path : dataPaths(field)) {
            if (shortest == null || path.size() < shortest.size()) {
                shortest = path;
            }
        }
        return shortest;
    }

    /**
     * Resolves the schema entry of a field of a generated type whose own
     * schema entry is {@code parent}.
     * <p>
     * A first path element equal to the name of a parent container is
     * skipped. The remaining elements are looked up one level at a time,
     * ignoring module prefixes and descending through choices and cases.
     *
     * @param parent the schema entry of the enclosing type
     * @param field the field
     * @return the schema entry of the field, {@code null} if the path does
     *         not exist in the schema
     * @throws YangException (SchemaMismatch) if the field has no usable path
     */
    @Nullable
    public static SchemaEntry childSchema(@NotNull SchemaEntry parent, @NotNull FieldDescriptor field)
            throws YangException {
        List<String> path = schemaPath(field);
        if (parent.isContainer() && path.size() > 1
                && parent.getName().equals(PathUtils.stripModulePrefix(path.get(0)))) {
            path = path.subList(1, path.size());
        }
        SchemaEntry entry = parent;
        for (String element : path) {
            entry = findChild(entry, PathUtils.stripModulePrefix(element));
            if (entry == null) {
                return null;
            }
        }
        return entry;
    }

    /**
     * Same as {@link #childSchema(SchemaEntry, FieldDescriptor)}, failing if
     * the field has no schema entry.
     *
     * @throws YangException (SchemaMismatch) if the lookup fails
     */
    @NotNull
    public static SchemaEntry requireChildSchema(@NotNull SchemaEntry parent, @NotNull FieldDescriptor field)
            throws YangException {
        SchemaEntry entry = childSchema(parent, field);
        if (entry == null) {
            throw new YangException(SCHEMA, 3, "could not find schema for field " + field.getName()
                    + " with path " + field.getPath() + " below " + parent);
        }
        return entry;
    }

    /**
     * Looks up a data child: a direct child, or the first data node with
     * that name below choice and case children.
     *
     * @param parent the parent entry
     * @param name the local name of the child
     * @return the child entry or {@code null}
     */
    @Nullable
    public static SchemaEntry findChild(@NotNull SchemaEntry parent, @NotNull String name) {
        SchemaEntry child = parent.getChild(name);
        if (child != null) {
            return child;
        }
        for (SchemaEntry candidate : parent.getChildren()) {
            if (candidate.isChoiceOrCase()) {
                SchemaEntry nested = findChild(candidate, name);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Returns the data parent of an entry, skipping choices and cases.
     */
    @Nullable
    public static SchemaEntry dataParent(@NotNull SchemaEntry entry) {
        SchemaEntry parent = entry.getParent();
        while (parent != null && parent.isChoiceOrCase()) {
            parent = parent.getParent();
        }
        return parent;
    }

    private static List<List<String>> localPaths(List<String> alternatives) {
        List<List<String>> paths = Lists.newArrayListWithCapacity(alternatives.size());
        for (String alternative : alternatives) {
            paths.add(ImmutableList.copyOf(PathUtils.localElements(alternative)));
        }
        return paths;
    }
}
