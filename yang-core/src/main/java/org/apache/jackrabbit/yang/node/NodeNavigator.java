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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;
import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;
import static org.apache.jackrabbit.yang.api.YangException.NOT_FOUND;
import static org.apache.jackrabbit.yang.api.YangException.SCHEMA;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.NodeShape;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.Scalars;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.commons.TraceContext;
import org.apache.jackrabbit.yang.json.JsonDecoder;
import org.apache.jackrabbit.yang.json.JsonOption;
import org.apache.jackrabbit.yang.schema.LeafrefResolver;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.apache.jackrabbit.yang.value.ScalarCodec;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic access to the nodes of generated data trees by {@link TreePath}.
 * <p>
 * All operations walk the data alongside the schema tree, consuming the
 * path element by element. Fields are matched by their path annotations,
 * so a leaf of a compressed type is reachable through both its canonical
 * path ({@code config/name}) and its compressed alias ({@code name}).
 * <p>
 * Operations fail fast: the first error aborts the call. PathNotFound and
 * InvalidArgument errors name the schema entry, the type and the remaining
 * path.
 */
public final class NodeNavigator {

    private static final Logger LOG = LoggerFactory.getLogger(NodeNavigator.class);

    private NodeNavigator() {
    }

    /**
     * Returns the nodes matching a path.
     *
     * @param schema the schema entry of {@code root}
     * @param root the data tree
     * @param path the path, relative to {@code root}
     * @param options the options
     * @return the matches. A single match unless partial key matches or
     *         wildcards select several list entries. Empty only with
     *         {@link GetNodeOption#TOLERATE_NIL}
     * @throws YangException (InvalidArgument) for a nil root or schema,
     *         a list path element without keys; (PathNotFound) if the path
     *         matches no node; (SchemaMismatch) on inconsistent metadata
     */
    @NotNull
    public static List<TreeNode> getNode(@Nullable SchemaEntry schema, @Nullable Object root,
                                         @NotNull TreePath path, GetNodeOption... options)
            throws YangException {
        EnumSet<GetNodeOption> opts = toSet(GetNodeOption.class, options);
        Retrieval retrieval = new Retrieval(TraceContext.forLogger(LOG));
        retrieval.partialKeyMatch = opts.contains(GetNodeOption.PARTIAL_KEY_MATCH);
        retrieval.handleWildcards = retrieval.partialKeyMatch || opts.contains(GetNodeOption.HANDLE_WILDCARDS);
        retrieval.tolerateNil = opts.contains(GetNodeOption.TOLERATE_NIL);
        return retrieval.start(schema, root, path);
    }

    /**
     * Sets the value of the node at a path.
     * <p>
     * Leaf values are converted to the type of the leaf: strings are parsed,
     * numbers converted, leaf-lists take a {@code List}. Container fields and
     * list entries take a {@link YangNode} of the right type or a JSON value.
     *
     * @param schema the schema entry of {@code root}
     * @param root the data tree
     * @param path the path of the node to set
     * @param value the new value
     * @param options the options
     * @throws YangException (PathNotFound) if a node on the path is unset and
     *         {@link SetNodeOption#INIT_MISSING_ELEMENTS} is not given;
     *         (InvalidArgument) if the value does not fit the node
     */
    public static void setNode(@NotNull SchemaEntry schema, @NotNull YangNode root, @NotNull TreePath path,
                               @Nullable Object value, SetNodeOption... options) throws YangException {
        if (value == null) {
            throw new YangException(ARGUMENT, 40, "cannot set nil value at " + path);
        }
        EnumSet<SetNodeOption> opts = toSet(SetNodeOption.class, options);
        Retrieval retrieval = new Retrieval(TraceContext.forLogger(LOG));
        retrieval.modifyRoot = opts.contains(SetNodeOption.INIT_MISSING_ELEMENTS);
        retrieval.hasValue = true;
        retrieval.value = value;
        if (opts.contains(SetNodeOption.IGNORE_EXTRA_FIELDS)) {
            retrieval.jsonOptions = new JsonOption[] {JsonOption.IGNORE_EXTRA_FIELDS};
        }
        retrieval.start(schema, root, path);
    }

    /**
     * Returns the node at a path, creating unset containers and missing list
     * entries on the way.
     *
     * @return the node; its data is {@code null} if it is an unset leaf
     */
    @NotNull
    public static TreeNode getOrCreateNode(@NotNull SchemaEntry schema, @NotNull YangNode root,
                                           @NotNull TreePath path) throws YangException {
        Retrieval retrieval = new Retrieval(TraceContext.forLogger(LOG));
        retrieval.modifyRoot = true;
        List<TreeNode> nodes = retrieval.start(schema, root, path);
        if (nodes.size() != 1) {
            throw new YangException(ARGUMENT, 41, "path " + path + " matches " + nodes.size() + " nodes");
        }
        return nodes.get(0);
    }

    /**
     * Deletes the node at a path: unsets a leaf or container, removes a list
     * entry, or the whole list if the path element has no keys. Containers
     * and lists left empty are unset. Deleting an absent node is a no-op.
     */
    public static void deleteNode(@NotNull SchemaEntry schema, @NotNull YangNode root, @NotNull TreePath path)
            throws YangException {
        Retrieval retrieval = new Retrieval(TraceContext.forLogger(LOG));
        retrieval.delete = true;
        retrieval.start(schema, root, path);
    }

    /**
     * Creates an empty instance of the type found at a path. Only types are
     * inspected: list path elements select the entry type, their keys are
     * ignored.
     *
     * @param rootType the type the path is relative to
     * @param path the path
     * @return a new instance of the type at the path; for a leaf the zero
     *         value of its Java type, for a leaf-list an empty list
     * @throws YangException (PathNotFound) if no field matches the path
     */
    @NotNull
    public static Object newNode(@NotNull NodeType<?> rootType, @NotNull TreePath path) throws YangException {
        checkNotNull(rootType);
        return newNode(rootType, path.stripAbsoluteMarker(), TraceContext.forLogger(LOG));
    }

    private static Object newNode(NodeType<?> type, TreePath path, TraceContext trace) throws YangException {
        if (path.isEmpty()) {
            return type.newInstance();
        }
        try (TraceContext.Scope scope = trace.enter("type {}, remaining path {}", type.getName(), path)) {
            for (FieldDescriptor field : type.getFields()) {
                for (List<String> fieldPath : SchemaPaths.dataPaths(field)) {
                    if (!path.hasNamePrefix(fieldPath)) {
                        continue;
                    }
                    TreePath remaining = path.skip(fieldPath.size());
                    if (field.isList() || field.isContainer()) {
                        return newNode(field.getChildType(), remaining, trace);
                    }
                    if (!remaining.isEmpty()) {
                        continue;
                    }
                    if (field.isLeafList()) {
                        return Lists.newArrayList();
                    }
                    Object zero = ScalarCodec.zeroValue(field.getValueType());
                    if (zero == null) {
                        throw new YangException(ARGUMENT, 42, "no zero value for leaf " + field.getName()
                                + " of type " + field.getValueType());
                    }
                    return zero;
                }
            }
        }
        throw new YangException(NOT_FOUND, 43, format("could not find path in type %s, remaining path %s",
                type.getName(), path));
    }

    @SafeVarargs
    private static <E extends Enum<E>> EnumSet<E> toSet(Class<E> type, E... options) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (options != null) {
            set.addAll(Arrays.asList(options));
        }
        return set;
    }

    /**
     * State of a single traversal: its options, the value to set and the
     * trace context.
     */
    private static final class Retrieval {

        private final TraceContext trace;

        boolean partialKeyMatch;
        boolean handleWildcards;
        boolean tolerateNil;
        boolean modifyRoot;
        boolean delete;
        boolean hasValue;
        Object value;
        JsonOption[] jsonOptions = new JsonOption[0];

        Retrieval(TraceContext trace) {
            this.trace = trace;
        }

        List<TreeNode> start(SchemaEntry schema, Object root, TreePath path) throws YangException {
            if (schema == null) {
                throw new YangException(ARGUMENT, 44, format("nil schema for data element type %s, remaining path %s",
                        typeName(root), path));
            }
            TreePath remaining = path.stripAbsoluteMarker();
            TreePath traversed = TreePath.EMPTY.withOrigin(path.getOrigin());
            if (remaining.isEmpty()) {
                if (delete || hasValue) {
                    throw new YangException(ARGUMENT, 45, "cannot replace or delete the root node");
                }
                return Collections.singletonList(new TreeNode(traversed, schema, root));
            }
            if (root == null) {
                throw new YangException(ARGUMENT, 46, format("nil data element type %s, remaining path %s",
                        schema.getName(), remaining));
            }
            return retrieve(schema, root, remaining, traversed);
        }

        private List<TreeNode> retrieve(SchemaEntry schema, Object data, TreePath path, TreePath traversed)
                throws YangException {
            if (NodeShape.of(data) != NodeShape.CONTAINER) {
                throw new YangException(ARGUMENT, 47, format("cannot descend into %s value of schema node %s,"
                        + " remaining path %s", typeName(data), schema.getName(), path));
            }
            YangNode node = (YangNode) data;
            NodeType<?> type = node.getNodeType();
            try (TraceContext.Scope scope = trace.enter("container {} ({}), remaining path {}",
                    schema.getName(), type.getName(), path)) {
                for (FieldDescriptor field : type.getFields()) {
                    SchemaEntry fieldSchema = SchemaPaths.requireChildSchema(schema, field);
                    for (List<String> fieldPath : SchemaPaths.dataPaths(field)) {
                        if (!path.hasNamePrefix(fieldPath)) {
                            continue;
                        }
                        trace.trace("field {} matches {}", field.getName(), fieldPath);
                        if (field.isList()) {
                            int listStep = fieldPath.size() - 1;
                            return retrieveList(fieldSchema, node, field, path.skip(listStep),
                                    traversed.concat(TreePath.ofNames(fieldPath.subList(0, listStep))));
                        }
                        TreePath remaining = path.skip(fieldPath.size());
                        TreePath fieldTraversed = traversed.concat(TreePath.ofNames(fieldPath));
                        if (field.isContainer()) {
                            return retrieveChild(fieldSchema, node, field, remaining, fieldTraversed);
                        }
                        if (remaining.isEmpty()) {
                            return retrieveLeaf(LeafrefResolver.resolve(fieldSchema), node, field, fieldTraversed);
                        }
                    }
                }
            }
            throw new YangException(NOT_FOUND, 48, format("could not find path in tree beyond schema node %s,"
                    + " (type %s), remaining path %s", schema.getName(), type.getName(), path));
        }

        private List<TreeNode> retrieveChild(SchemaEntry fieldSchema, YangNode parent, FieldDescriptor field,
                                             TreePath remaining, TreePath traversed) throws YangException {
            int index = field.getIndex();
            Object child = parent.getField(index);
            if (remaining.isEmpty()) {
                if (delete) {
                    parent.setField(index, null);
                    return Collections.emptyList();
                }
                if (hasValue) {
                    child = containerValue(fieldSchema, field.getChildType());
                    parent.setField(index, child);
                }
            }
            if (child == null) {
                if (delete) {
                    return Collections.emptyList();
                }
                if (!modifyRoot) {
                    return absent(fieldSchema, traversed, remaining);
                }
                child = field.getChildType().newInstance();
                parent.setField(index, child);
            }
            if (remaining.isEmpty()) {
                return Collections.singletonList(new TreeNode(traversed, fieldSchema, child));
            }
            List<TreeNode> matches = retrieve(fieldSchema, child, remaining, traversed);
            if (delete && YangNodes.isEmpty((YangNode) child)) {
                parent.setField(index, null);
            }
            return matches;
        }

        private List<TreeNode> retrieveLeaf(SchemaEntry leafSchema, YangNode parent, FieldDescriptor field,
                                            TreePath traversed) throws YangException {
            int index = field.getIndex();
            if (delete) {
                parent.setField(index, null);
                return Collections.emptyList();
            }
            if (hasValue) {
                parent.setField(index, leafValue(leafSchema, field));
            }
            Object data = parent.getField(index);
            if (data == null && !modifyRoot) {
                return absent(leafSchema, traversed, TreePath.EMPTY);
            }
            return Collections.singletonList(new TreeNode(traversed, leafSchema, data));
        }

        private List<TreeNode> retrieveList(SchemaEntry listSchema, YangNode parent, FieldDescriptor field,
                                            TreePath path, TreePath traversed) throws YangException {
            NodeType<?> entryType = field.getChildType();
            PathElement step = path.getFirst();
            TreePath remaining = path.pop();
            try (TraceContext.Scope scope = trace.enter("list {} ({}), element {}",
                    listSchema.getName(), entryType.getName(), step)) {
                if (!listSchema.isKeyedList() || !entryType.isKeyed()) {
                    throw new YangException(ARGUMENT, 49, format("list %s (type %s) has no key, cannot select %s,"
                            + " remaining path %s", listSchema.getName(), entryType.getName(), step, path));
                }
                if (!step.hasKeys()) {
                    if (delete && remaining.isEmpty()) {
                        parent.setField(field.getIndex(), null);
                        return Collections.emptyList();
                    }
                    if (!partialKeyMatch) {
                        throw new YangException(ARGUMENT, 50, format("path element %s of keyed list %s has no key,"
                                + " remaining path %s", step, listSchema.getName(), path));
                    }
                }
                for (String keyName : step.getKeys().keySet()) {
                    if (!listSchema.getKey().contains(keyName)) {
                        throw new YangException(ARGUMENT, 51, format("%s is not a key of list %s, keys are %s",
                                keyName, listSchema.getName(), listSchema.getKey()));
                    }
                }
                Map<Object, Object> entries = YangNodes.listValue(parent, field);
                if (entries == null) {
                    if (delete) {
                        return Collections.emptyList();
                    }
                    if (!modifyRoot) {
                        return absent(listSchema, traversed, path);
                    }
                    entries = Maps.newLinkedHashMap();
                    parent.setField(field.getIndex(), entries);
                }

                List<TreeNode> matches = Lists.newArrayList();
                boolean matched = false;
                Iterator<Map.Entry<Object, Object>> it = entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<Object, Object> e = it.next();
                    Map<String, Object> components = entryType.keyComponents(e.getKey());
                    if (!keyMatches(listSchema, step, components)) {
                        continue;
                    }
                    matched = true;
                    TreePath entryPath = traversed.append(PathElement.of(step.getName(), keyStrings(components)));
                    if (remaining.isEmpty()) {
                        if (delete) {
                            it.remove();
                        } else {
                            if (hasValue) {
                                e.setValue(entryValue(listSchema, entryType, e.getKey()));
                            }
                            matches.add(new TreeNode(entryPath, listSchema, e.getValue()));
                        }
                    } else {
                        YangNode entry = (YangNode) e.getValue();
                        matches.addAll(retrieve(listSchema, entry, remaining, entryPath));
                    }
                    if (!partialKeyMatch) {
                        // without partial matching only the first matching entry is selected
                        break;
                    }
                }

                if (!matched) {
                    if (delete) {
                        return Collections.emptyList();
                    }
                    if (!modifyRoot) {
                        if (tolerateNil) {
                            return Collections.emptyList();
                        }
                        throw new YangException(NOT_FOUND, 52, format("could not find an entry of list %s"
                                + " matching %s, remaining path %s", listSchema.getName(), step, path));
                    }
                    YangNode entry = createEntry(listSchema, entryType, step);
                    Object key = entryType.keyOf(entry);
                    TreePath entryPath = traversed.append(
                            PathElement.of(step.getName(), keyStrings(entryType.keyComponents(key))));
                    if (remaining.isEmpty() && hasValue) {
                        entry = entryValue(listSchema, entryType, key);
                    }
                    entries.put(key, entry);
                    if (remaining.isEmpty()) {
                        matches.add(new TreeNode(entryPath, listSchema, entry));
                    } else {
                        matches.addAll(retrieve(listSchema, entry, remaining, entryPath));
                    }
                }
                if (delete && entries.isEmpty()) {
                    parent.setField(field.getIndex(), null);
                }
                return matches;
            }
        }

        private boolean keyMatches(SchemaEntry listSchema, PathElement step, Map<String, Object> components)
                throws YangException {
            for (String keyName : listSchema.getKey()) {
                String wanted = step.getKey(keyName);
                if (wanted == null) {
                    if (partialKeyMatch) {
                        continue;
                    }
                    throw new YangException(ARGUMENT, 53, format("missing key %s in path element %s of list %s",
                            keyName, step, listSchema.getName()));
                }
                if (handleWildcards && PathElement.WILDCARD.equals(wanted)) {
                    continue;
                }
                Object actual = components.get(keyName);
                if (actual == null || !Scalars.asString(actual).equals(wanted)) {
                    return false;
                }
            }
            return true;
        }

        private YangNode createEntry(SchemaEntry listSchema, NodeType<?> entryType, PathElement step)
                throws YangException {
            YangNode entry = entryType.newInstance();
            for (FieldDescriptor keyField : entryType.getKeyFields()) {
                String raw = step.getKey(keyField.getLeafName());
                if (raw == null || PathElement.WILDCARD.equals(raw)) {
                    throw new YangException(ARGUMENT, 54, format("cannot create entry of list %s from %s,"
                            + " all key values are required", listSchema.getName(), step));
                }
                SchemaEntry keySchema = LeafrefResolver.resolve(SchemaPaths.requireChildSchema(listSchema, keyField));
                entry.setField(keyField.getIndex(),
                        ScalarCodec.decode(keyField.getValueType(), requireType(keySchema), raw));
            }
            trace.trace("created entry {} of list {}", step, listSchema.getName());
            return entry;
        }

        private Object leafValue(SchemaEntry leafSchema, FieldDescriptor field) throws YangException {
            if (value instanceof JsonNode) {
                return JsonDecoder.decodeLeaf(leafSchema, field, (JsonNode) value);
            }
            ScalarType type = requireType(leafSchema);
            if (field.isLeafList()) {
                return ScalarCodec.decodeList(field.getValueType(), type, value);
            }
            return ScalarCodec.decode(field.getValueType(), type, value);
        }

        private YangNode containerValue(SchemaEntry fieldSchema, NodeType<?> type) throws YangException {
            if (value instanceof JsonNode) {
                return JsonDecoder.unmarshal(fieldSchema, type, (JsonNode) value, jsonOptions);
            }
            // the tree owns its nodes, a caller's node may already belong to another tree
            if (value instanceof YangNode && ((YangNode) value).getNodeType() == type) {
                return YangNodes.copy((YangNode) value);
            }
            throw new YangException(ARGUMENT, 55, format("cannot set %s value on node %s of type %s",
                    typeName(value), fieldSchema.getName(), type.getName()));
        }

        private YangNode entryValue(SchemaEntry listSchema, NodeType<?> entryType, Object key) throws YangException {
            YangNode entry = containerValue(listSchema, entryType);
            Object entryKey = entryType.keyOf(entry);
            if (!key.equals(entryKey)) {
                throw new YangException(ARGUMENT, 56, format("key %s of the new entry of list %s does not match"
                        + " the path key %s", entryKey, listSchema.getName(), key));
            }
            return entry;
        }

        private List<TreeNode> absent(SchemaEntry schema, TreePath traversed, TreePath remaining)
                throws YangException {
            if (tolerateNil) {
                return Collections.emptyList();
            }
            throw new YangException(NOT_FOUND, 57, format("nil data at %s (schema node %s), remaining path %s",
                    traversed, schema.getName(), remaining));
        }
    }

    private static Map<String, String> keyStrings(Map<String, Object> components) {
        Map<String, String> keys = Maps.newLinkedHashMap();
        for (Map.Entry<String, Object> component : components.entrySet()) {
            if (component.getValue() != null) {
                keys.put(component.getKey(), Scalars.asString(component.getValue()));
            }
        }
        return keys;
    }

    static ScalarType requireType(SchemaEntry leafSchema) throws YangException {
        ScalarType type = leafSchema.getType();
        if (type == null) {
            throw new YangException(SCHEMA, 58, "schema node " + leafSchema.getPath() + " has no type");
        }
        return type;
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof YangNode) {
            return ((YangNode) value).getNodeType().getName();
        }
        return value.getClass().getSimpleName();
    }
}
