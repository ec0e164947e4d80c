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
package org.apache.jackrabbit.yang.diff;

import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Sets;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.Scalars;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.Update;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares two data trees of the same type.
 * <p>
 * {@link #diff} returns the leaf updates that turn the first tree into the
 * second: leaves that are set in the second tree with a different value, and
 * every leaf of a subtree or list entry the second tree introduces, key
 * leaves included. Nodes only present in the first tree are not reported;
 * {@link #deletions} returns their paths.
 * <p>
 * Paths are built from the path annotations of the generated types. A field
 * with several path alternatives yields one update per alternative unless
 * {@link DiffOption#MAP_TO_SINGLE_PATH} is given.
 */
public final class Differ {

    private static final Logger LOG = LoggerFactory.getLogger(Differ.class);

    private Differ() {
    }

    /**
     * Computes the updates turning {@code a} into {@code b}.
     *
     * @param a the old tree, {@code null} for an empty one
     * @param b the new tree
     * @param options the options
     * @return the updates, in no significant order
     * @throws YangException (InvalidArgument) if the trees differ in type;
     *         (SchemaMismatch) if a field has no path annotation
     */
    @NotNull
    public static Set<Update> diff(@Nullable YangNode a, @NotNull YangNode b, DiffOption... options)
            throws YangException {
        checkSameType(a, b);
        EnumSet<DiffOption> opts = toSet(options);
        Set<Update> updates = Sets.newLinkedHashSet();
        diffNode(b.getNodeType(), a, b, TreePath.EMPTY, updates, opts);
        LOG.debug("diff of {} yields {} updates", b.getNodeType(), updates.size());
        return updates;
    }

    /**
     * Returns the paths of the nodes set in {@code a} and unset in {@code b}:
     * leaves, containers, list entries and whole lists. Nodes below a
     * reported node are not reported.
     *
     * @param a the old tree
     * @param b the new tree
     * @param options the options, only {@link DiffOption#MAP_TO_SINGLE_PATH}
     *                is relevant
     * @return the deleted paths
     * @throws YangException (InvalidArgument) if the trees differ in type
     */
    @NotNull
    public static Set<TreePath> deletions(@NotNull YangNode a, @NotNull YangNode b, DiffOption... options)
            throws YangException {
        checkSameType(a, b);
        Set<TreePath> paths = Sets.newLinkedHashSet();
        collectDeletions(a.getNodeType(), a, b, TreePath.EMPTY, paths, toSet(options));
        return paths;
    }

    private static void diffNode(NodeType<?> type, @Nullable YangNode a, YangNode b, TreePath prefix,
                                 Set<Update> updates, EnumSet<DiffOption> opts) throws YangException {
        for (FieldDescriptor field : type.getFields()) {
            Object va = a == null ? null : a.getField(field.getIndex());
            Object vb = b.getField(field.getIndex());
            if (vb == null) {
                continue;
            }
            for (List<String> path : paths(field, opts)) {
                TreePath fieldPath = prefix.concat(TreePath.ofNames(path));
                switch (field.getKind()) {
                    case CONTAINER:
                        diffNode(field.getChildType(), (YangNode) va, (YangNode) vb, fieldPath, updates, opts);
                        break;
                    case LIST:
                        diffList(field, (Map<?, ?>) va, (Map<?, ?>) vb, fieldPath, updates, opts);
                        break;
                    default:
                        if (Scalars.valueEquals(va, vb) || (va == null && opts.contains(DiffOption.IGNORE_ADDITIONS))) {
                            break;
                        }
                        updates.add(new Update(fieldPath, vb));
                        break;
                }
            }
        }
    }

    private static void diffList(FieldDescriptor field, @Nullable Map<?, ?> a, Map<?, ?> b, TreePath listPath,
                                 Set<Update> updates, EnumSet<DiffOption> opts) throws YangException {
        NodeType<?> entryType = field.getChildType();
        for (Map.Entry<?, ?> entry : b.entrySet()) {
            YangNode eb = (YangNode) entry.getValue();
            YangNode ea = a == null ? null : (YangNode) a.get(entry.getKey());
            diffNode(entryType, ea, eb, entryPath(listPath, entryType, eb), updates, opts);
        }
    }

    private static void collectDeletions(NodeType<?> type, YangNode a, YangNode b, TreePath prefix,
                                         Set<TreePath> paths, EnumSet<DiffOption> opts) throws YangException {
        for (FieldDescriptor field : type.getFields()) {
            Object va = a.getField(field.getIndex());
            if (va == null) {
                continue;
            }
            Object vb = b.getField(field.getIndex());
            for (List<String> path : paths(field, opts)) {
                TreePath fieldPath = prefix.concat(TreePath.ofNames(path));
                if (vb == null) {
                    paths.add(fieldPath);
                } else if (field.isContainer()) {
                    collectDeletions(field.getChildType(), (YangNode) va, (YangNode) vb, fieldPath, paths, opts);
                } else if (field.isList()) {
                    NodeType<?> entryType = field.getChildType();
                    Map<?, ?> mb = (Map<?, ?>) vb;
                    for (Map.Entry<?, ?> entry : ((Map<?, ?>) va).entrySet()) {
                        YangNode ea = (YangNode) entry.getValue();
                        TreePath entryPath = entryPath(fieldPath, entryType, ea);
                        YangNode eb = (YangNode) mb.get(entry.getKey());
                        if (eb == null) {
                            paths.add(entryPath);
                        } else {
                            collectDeletions(entryType, ea, eb, entryPath, paths, opts);
                        }
                    }
                }
            }
        }
    }

    /**
     * Replaces the last element of a list field path by the keyed element
     * selecting {@code entry}.
     */
    private static TreePath entryPath(TreePath listPath, NodeType<?> entryType, YangNode entry) {
        return listPath.replaceLast(PathElement.of(listPath.getLast().getName(), entryType.keyValues(entry)));
    }

    private static List<List<String>> paths(FieldDescriptor field, EnumSet<DiffOption> opts) throws YangException {
        if (opts.contains(DiffOption.MAP_TO_SINGLE_PATH)) {
            return Collections.singletonList(SchemaPaths.shortestDataPath(field));
        }
        return SchemaPaths.dataPaths(field);
    }

    private static void checkSameType(@Nullable YangNode a, @NotNull YangNode b) throws YangException {
        if (a != null && a.getNodeType() != b.getNodeType()) {
            throw new YangException(ARGUMENT, 90, "cannot compare " + a.getNodeType() + " with " + b.getNodeType());
        }
    }

    private static EnumSet<DiffOption> toSet(DiffOption... options) {
        EnumSet<DiffOption> opts = EnumSet.noneOf(DiffOption.class);
        opts.addAll(Arrays.asList(options));
        return opts;
    }
}
