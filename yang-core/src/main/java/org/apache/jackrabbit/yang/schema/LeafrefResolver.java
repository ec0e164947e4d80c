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
import java.util.Set;

import com.google.common.collect.Range;
import com.google.common.collect.Sets;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.apache.jackrabbit.yang.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows leafref path expressions through the schema tree to the leaf they
 * reference.
 */
public final class LeafrefResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LeafrefResolver.class);

    /**
     * Maximum number of leafrefs followed in a chain before the chain is
     * reported as broken.
     */
    static final int MAX_HOPS = SystemPropertySupplier.ofInt("yang.leafref.maxHops", 64)
            .loggingTo(LOG).within(Range.atLeast(1)).get();

    private LeafrefResolver() {
    }

    /**
     * Resolves the leaf a leafref leaf ultimately refers to, following chains
     * of leafrefs. Entries whose type is not a leafref are returned as-is.
     *
     * @param entry a schema entry
     * @return the first entry in the chain that is not a leafref
     * @throws YangException (SchemaMismatch) if a path cannot be followed or
     *         the chain is cyclic
     */
    @NotNull
    public static SchemaEntry resolve(@NotNull SchemaEntry entry) throws YangException {
        Set<SchemaEntry> visited = Sets.newIdentityHashSet();
        SchemaEntry current = entry;
        while (isLeafref(current)) {
            if (!visited.add(current) || visited.size() > MAX_HOPS) {
                throw new YangException(SCHEMA, 20, "leafref cycle detected at " + current.getPath()
                        + " while resolving " + entry.getPath());
            }
            String path = current.getType().getLeafrefPath();
            SchemaEntry target = findTarget(current, path);
            if (LOG.isDebugEnabled()) {
                LOG.debug("leafref {} at {} resolved to {}", path, current.getPath(), target.getPath());
            }
            current = target;
        }
        return current;
    }

    /**
     * Follows a single path expression from {@code from}. Predicates are
     * ignored, {@code ..} moves to the data parent, an absolute path starts
     * at the schema root.
     * <p>
     * A compressed fake root may lack the container wrapping a list. If an
     * element is missing below the fake root but the next element is one of
     * its children, the missing element is skipped.
     *
     * @param from the entry the path is relative to
     * @param path the path expression
     * @return the entry the path points to
     * @throws YangException (SchemaMismatch) if the path cannot be followed
     */
    @NotNull
    public static SchemaEntry findTarget(@NotNull SchemaEntry from, @NotNull String path) throws YangException {
        List<String> elements;
        try {
            elements = PathUtils.elements(PathUtils.removePredicates(path));
        } catch (IllegalArgumentException e) {
            throw new YangException(SCHEMA, 21, "malformed leafref path " + path + " at " + from.getPath(), e);
        }
        SchemaEntry current = PathUtils.isAbsolute(path) ? from.getRoot() : from;
        for (int i = 0; i < elements.size(); i++) {
            String element = elements.get(i);
            if (PathUtils.denotesCurrent(element)) {
                continue;
            }
            if (PathUtils.denotesParent(element)) {
                SchemaEntry parent = SchemaPaths.dataParent(current);
                if (parent == null) {
                    throw new YangException(SCHEMA, 22, "parent of " + current + " is nil, leafref path "
                            + path + " at " + from.getPath());
                }
                current = parent;
                continue;
            }
            SchemaEntry child = SchemaPaths.findChild(current, PathUtils.stripModulePrefix(element));
            if (child == null && current.isFakeRoot() && i + 1 < elements.size()) {
                child = SchemaPaths.findChild(current, PathUtils.stripModulePrefix(elements.get(i + 1)));
                if (child != null) {
                    i++;
                }
            }
            if (child == null) {
                throw new YangException(SCHEMA, 23, "schema node " + current.getName() + " has no child "
                        + element + ", leafref path " + path + " at " + from.getPath());
            }
            current = child;
        }
        return current;
    }

    private static boolean isLeafref(SchemaEntry entry) {
        ScalarType type = entry.getType();
        return type != null && type.isLeafref();
    }
}
