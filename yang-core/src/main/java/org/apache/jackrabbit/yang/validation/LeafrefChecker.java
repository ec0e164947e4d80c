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
package org.apache.jackrabbit.yang.validation;

import static java.lang.String.format;
import static org.apache.jackrabbit.yang.api.YangException.CONSTRAINT;
import static org.apache.jackrabbit.yang.api.YangException.SCHEMA;

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.Scalars;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.apache.jackrabbit.yang.node.GetNodeOption;
import org.apache.jackrabbit.yang.node.NodeNavigator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the values of leafref leaves exist at the target of their
 * path expression.
 * <p>
 * The path expression is evaluated against the data tree: relative paths
 * start at the referencing leaf, {@code ..} moves up one node, and
 * predicates of the form {@code [key = current()/relative/path]} or
 * {@code [key = 'literal']} select list entries. Lists without a predicate
 * match all their entries.
 */
class LeafrefChecker {

    private static final Logger LOG = LoggerFactory.getLogger(LeafrefChecker.class);

    private static final String CURRENT = "current()";

    /**
     * A leafref leaf value found while walking the tree.
     */
    static final class Reference {

        final SchemaEntry schema;

        final TreePath path;

        final Object value;

        Reference(SchemaEntry schema, TreePath path, Object value) {
            this.schema = schema;
            this.path = path;
            this.value = value;
        }
    }

    private final SchemaEntry schemaRoot;

    private final YangNode root;

    LeafrefChecker(SchemaEntry schemaRoot, YangNode root) {
        this.schemaRoot = schemaRoot;
        this.root = root;
    }

    void check(List<Reference> references, List<YangException> errors) {
        for (Reference reference : references) {
            try {
                checkReference(reference);
            } catch (YangException e) {
                errors.add(e);
            }
        }
    }

    private void checkReference(Reference reference) throws YangException {
        String expression = reference.schema.getType().getLeafrefPath();
        TreePath target = targetPath(reference, expression);
        List<TreeNode> matches = NodeNavigator.getNode(schemaRoot, root, target,
                GetNodeOption.PARTIAL_KEY_MATCH, GetNodeOption.HANDLE_WILDCARDS, GetNodeOption.TOLERATE_NIL);
        String wanted = Scalars.asString(reference.value);
        for (TreeNode match : matches) {
            if (contains(match.getData(), wanted)) {
                if (LOG.isTraceEnabled()) {
                    LOG.trace("leafref {} = {} found at {}", reference.path, wanted, match.getPath());
                }
                return;
            }
        }
        throw new YangException(CONSTRAINT, 120, format("%s: leafref value %s has no target at %s (path %s)",
                reference.path, wanted, target, expression));
    }

    private static boolean contains(Object data, String wanted) {
        if (data instanceof List) {
            for (Object element : (List<?>) data) {
                if (wanted.equals(Scalars.asString(element))) {
                    return true;
                }
            }
            return false;
        }
        return data != null && wanted.equals(Scalars.asString(data));
    }

    /**
     * Evaluates a leafref path expression to a data tree path, resolving
     * predicates to key values.
     */
    private TreePath targetPath(Reference reference, String expression) throws YangException {
        List<String> elements;
        try {
            elements = PathUtils.elements(expression);
        } catch (IllegalArgumentException e) {
            throw new YangException(SCHEMA, 121, "malformed leafref path " + expression, e);
        }
        List<PathElement> target = Lists.newArrayList();
        if (!PathUtils.isAbsolute(expression)) {
            target.addAll(reference.path.getElements());
        }
        for (String element : elements) {
            step(target, element, reference);
        }
        return TreePath.of(target);
    }

    private void step(List<PathElement> target, String element, Reference reference) throws YangException {
        if (PathUtils.denotesCurrent(element)) {
            return;
        }
        if (PathUtils.denotesParent(element)) {
            if (target.isEmpty()) {
                throw new YangException(SCHEMA, 122, "leafref path of " + reference.path + " leaves the tree");
            }
            target.remove(target.size() - 1);
            return;
        }
        int bracket = element.indexOf('[');
        if (bracket < 0) {
            target.add(PathElement.of(PathUtils.stripModulePrefix(element)));
            return;
        }
        String name = PathUtils.stripModulePrefix(element.substring(0, bracket));
        Map<String, String> keys = Maps.newLinkedHashMap();
        int pos = bracket;
        while (pos < element.length() && element.charAt(pos) == '[') {
            int end = element.indexOf(']', pos);
            if (end < 0) {
                throw new YangException(SCHEMA, 123, "unbalanced predicate in leafref path element " + element);
            }
            String predicate = element.substring(pos + 1, end);
            int eq = predicate.indexOf('=');
            if (eq < 0) {
                throw new YangException(SCHEMA, 124, "unsupported leafref predicate [" + predicate + "]");
            }
            String key = PathUtils.stripModulePrefix(predicate.substring(0, eq).trim());
            keys.put(key, evaluate(predicate.substring(eq + 1).trim(), reference));
            pos = end + 1;
        }
        target.add(PathElement.of(name, keys));
    }

    /**
     * Evaluates the right hand side of a predicate to the key value it
     * selects.
     */
    private String evaluate(String expression, Reference reference) throws YangException {
        if (expression.length() >= 2 && (expression.charAt(0) == '\'' || expression.charAt(0) == '"')
                && expression.charAt(expression.length() - 1) == expression.charAt(0)) {
            return expression.substring(1, expression.length() - 1);
        }
        if (!expression.startsWith(CURRENT)) {
            throw new YangException(SCHEMA, 124, "unsupported leafref predicate expression " + expression);
        }
        List<PathElement> path = Lists.newArrayList(reference.path.getElements());
        for (String element : PathUtils.elements(expression.substring(CURRENT.length()))) {
            step(path, element, reference);
        }
        TreePath keyPath = TreePath.of(path);
        List<TreeNode> nodes = NodeNavigator.getNode(schemaRoot, root, keyPath, GetNodeOption.TOLERATE_NIL);
        if (nodes.isEmpty() || nodes.get(0).getData() == null) {
            throw new YangException(CONSTRAINT, 125, format("%s: leafref predicate %s refers to unset node %s",
                    reference.path, expression, keyPath));
        }
        return Scalars.asString(nodes.get(0).getData());
    }
}
