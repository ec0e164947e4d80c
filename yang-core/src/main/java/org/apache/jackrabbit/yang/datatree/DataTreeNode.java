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
package org.apache.jackrabbit.yang.datatree;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;
import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A node of a tree indexed by path elements, for building trees from
 * individual path/value pairs.
 * <p>
 * A node is a branch holding children by path element, a leaf holding a
 * scalar value, or a node representing a generated {@link YangNode}, which
 * may hold children as well.
 * <p>
 * Every node has its own read/write lock. Adding a child takes the write
 * lock of the parent only, so disjoint subtrees can be modified
 * concurrently. {@link #find} does not lock; callers that need consistency
 * across several calls hold the {@link #readLock()} themselves.
 */
public final class DataTreeNode {

    private static final Logger LOG = LoggerFactory.getLogger(DataTreeNode.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ConcurrentMap<PathElement, DataTreeNode> subtree = Maps.newConcurrentMap();

    private final YangNode node;

    private final Object leaf;

    private DataTreeNode(@Nullable YangNode node, @Nullable Object leaf) {
        this.node = node;
        this.leaf = leaf;
    }

    /**
     * Creates an empty branch node.
     */
    public DataTreeNode() {
        this(null, null);
    }

    @NotNull
    public static DataTreeNode leaf(@NotNull Object value) {
        return new DataTreeNode(null, checkNotNull(value));
    }

    @NotNull
    public static DataTreeNode forNode(@NotNull YangNode node) {
        return new DataTreeNode(checkNotNull(node), null);
    }

    public boolean isLeaf() {
        return leaf != null;
    }

    public boolean isStruct() {
        return node != null;
    }

    /**
     * A leaf has neither children nor a generated node.
     */
    public boolean isValid() {
        return !isLeaf() || (!isStruct() && subtree.isEmpty());
    }

    @Nullable
    public Object getLeaf() {
        return leaf;
    }

    @Nullable
    public YangNode getNode() {
        return node;
    }

    /**
     * Returns a snapshot of the children.
     */
    @NotNull
    public Map<PathElement, DataTreeNode> getChildren() {
        lock.readLock().lock();
        try {
            return ImmutableMap.copyOf(subtree);
        } finally {
            lock.readLock().unlock();
        }
    }

    @NotNull
    public Lock readLock() {
        return lock.readLock();
    }

    @NotNull
    public Lock writeLock() {
        return lock.writeLock();
    }

    /**
     * Returns the child at a path element. Does not lock.
     */
    @Nullable
    public DataTreeNode find(@NotNull PathElement element) {
        return subtree.get(element);
    }

    /**
     * Adds a child, replacing an existing child at the same element.
     *
     * @param element the path element
     * @param child the child
     * @throws YangException (InvalidArgument) if the element has an empty name
     *         or key name, the child is invalid, or an existing child is a
     *         leaf and the new one is not, or vice versa
     */
    public void addNode(@NotNull PathElement element, @NotNull DataTreeNode child) throws YangException {
        checkElement(element);
        if (!child.isValid()) {
            throw new YangException(ARGUMENT, 130, "cannot add invalid child at " + element);
        }
        lock.writeLock().lock();
        try {
            DataTreeNode existing = subtree.get(element);
            if (existing != null && existing.isLeaf() != child.isLeaf()) {
                throw new YangException(ARGUMENT, 131, format("mismatched types, new isLeaf: %s, existing isLeaf: %s",
                        child.isLeaf(), existing.isLeaf()));
            }
            subtree.put(element, child);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds a child at a path of at least two elements, creating missing
     * intermediate branch nodes.
     *
     * @throws YangException (InvalidArgument) if the path is too short, an
     *         element is invalid, or an intermediate node is a leaf
     */
    public void addAllNodes(@NotNull List<PathElement> path, @NotNull DataTreeNode child) throws YangException {
        if (!child.isValid()) {
            throw new YangException(ARGUMENT, 130, "cannot add invalid child at path " + path);
        }
        if (path.size() < 2) {
            throw new YangException(ARGUMENT, 132, format("invalid length path, got: %d (%s), want: >= 2",
                    path.size(), path));
        }
        DataTreeNode current = this;
        for (PathElement element : path.subList(0, path.size() - 1)) {
            checkElement(element);
            current = current.branch(element);
        }
        current.addNode(path.get(path.size() - 1), child);
    }

    /**
     * Indexes the set fields of a generated node, recursively, under the
     * path alternatives of each field. List entries are added under a path
     * element carrying their key.
     *
     * @throws YangException (SchemaMismatch) if a field has no path
     *         annotation; (InvalidArgument) if the fields conflict with
     *         existing children
     */
    public void addChildren(@NotNull YangNode struct) throws YangException {
        for (FieldDescriptor field : struct.getNodeType().getFields()) {
            Object value = struct.getField(field.getIndex());
            if (value == null) {
                continue;
            }
            List<List<String>> paths = SchemaPaths.dataPaths(field);
            if (field.isList()) {
                NodeType<?> entryType = field.getChildType();
                for (Object entry : ((Map<?, ?>) value).values()) {
                    YangNode entryNode = (YangNode) entry;
                    DataTreeNode child = forNode(entryNode);
                    child.addChildren(entryNode);
                    for (List<String> path : paths) {
                        List<PathElement> elements = elements(path);
                        String listName = elements.get(elements.size() - 1).getName();
                        elements.set(elements.size() - 1, PathElement.of(listName, entryType.keyValues(entryNode)));
                        add(elements, child);
                    }
                }
                continue;
            }
            DataTreeNode child;
            if (field.isContainer()) {
                child = forNode((YangNode) value);
                child.addChildren((YangNode) value);
            } else {
                child = leaf(value);
            }
            for (List<String> path : paths) {
                add(elements(path), child);
            }
        }
    }

    /**
     * Indexes the matches of a {@link org.apache.jackrabbit.yang.node.NodeNavigator}
     * query under their paths. Matches without data are skipped.
     *
     * @throws YangException (InvalidArgument) if a match has an empty path or
     *         conflicts with existing children
     */
    public void addMatches(@NotNull Collection<TreeNode> matches) throws YangException {
        for (TreeNode match : matches) {
            Object data = match.getData();
            if (data == null) {
                continue;
            }
            if (match.getPath().isEmpty()) {
                throw new YangException(ARGUMENT, 133, "cannot add match at the empty path");
            }
            DataTreeNode child;
            if (data instanceof YangNode) {
                child = forNode((YangNode) data);
                child.addChildren((YangNode) data);
            } else {
                child = leaf(data);
            }
            add(match.getPath().getElements(), child);
        }
    }

    private void add(List<PathElement> path, DataTreeNode child) throws YangException {
        if (path.size() == 1) {
            addNode(path.get(0), child);
        } else {
            addAllNodes(path, child);
        }
    }

    /**
     * Returns the branch child at an element, creating it if missing.
     */
    private DataTreeNode branch(PathElement element) throws YangException {
        lock.writeLock().lock();
        try {
            DataTreeNode existing = subtree.get(element);
            if (existing != null) {
                if (existing.isLeaf()) {
                    throw new YangException(ARGUMENT, 134, format("cannot add branch to %s, is a leaf", element));
                }
                return existing;
            }
            DataTreeNode created = new DataTreeNode();
            subtree.put(element, created);
            if (LOG.isTraceEnabled()) {
                LOG.trace("created branch {}", element);
            }
            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void checkElement(PathElement element) throws YangException {
        if (element.getName().isEmpty()) {
            throw new YangException(ARGUMENT, 135, "cannot add invalid path element: nil path element name");
        }
        if (element.getKeys().containsKey("")) {
            throw new YangException(ARGUMENT, 135, "cannot add invalid path element: invalid nil value key name");
        }
    }

    private static List<PathElement> elements(List<String> names) {
        List<PathElement> elements = Lists.newArrayListWithCapacity(names.size());
        for (String name : names) {
            elements.add(PathElement.of(name));
        }
        return elements;
    }

    //------------------------------------------------------------< Object >--

    /**
     * Deep equality: equal leaf values, the same generated node, and equal
     * children.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DataTreeNode)) {
            return false;
        }
        DataTreeNode that = (DataTreeNode) other;
        // lock in a fixed order
        boolean thisFirst = System.identityHashCode(this) <= System.identityHashCode(that);
        Lock first = (thisFirst ? this : that).readLock();
        Lock second = (thisFirst ? that : this).readLock();
        first.lock();
        second.lock();
        try {
            if (node != that.node || !Arrays.deepEquals(new Object[] {leaf}, new Object[] {that.leaf})
                    || subtree.size() != that.subtree.size()) {
                return false;
            }
            for (Map.Entry<PathElement, DataTreeNode> entry : subtree.entrySet()) {
                if (!entry.getValue().equals(that.subtree.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        } finally {
            second.unlock();
            first.unlock();
        }
    }

    @Override
    public int hashCode() {
        return 31 * subtree.keySet().hashCode() + Arrays.deepHashCode(new Object[] {leaf});
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return "leaf " + leaf;
        }
        return (isStruct() ? node.getNodeType().getName() : "branch") + " " + subtree.keySet();
    }
}
