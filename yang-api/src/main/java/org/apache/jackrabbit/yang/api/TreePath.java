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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.jetbrains.annotations.NotNull;

/**
 * A structured path: an ordered sequence of {@link PathElement}s, optionally
 * qualified by an origin. Instances are immutable.
 * <p>
 * A first element with an empty name marks an absolute path. It carries no
 * information for matching and is discarded by {@link #stripAbsoluteMarker()}.
 */
public final class TreePath implements Iterable<PathElement> {

    public static final TreePath EMPTY = new TreePath("", ImmutableList.<PathElement>of());

    private final String origin;

    private final ImmutableList<PathElement> elements;

    private TreePath(String origin, ImmutableList<PathElement> elements) {
        this.origin = checkNotNull(origin);
        this.elements = elements;
    }

    @NotNull
    public static TreePath of(@NotNull PathElement... elements) {
        return new TreePath("", ImmutableList.copyOf(elements));
    }

    @NotNull
    public static TreePath of(@NotNull List<PathElement> elements) {
        return new TreePath("", ImmutableList.copyOf(elements));
    }

    /**
     * Creates a path of key-less elements from plain names.
     */
    @NotNull
    public static TreePath ofNames(@NotNull Iterable<String> names) {
        ImmutableList.Builder<PathElement> builder = ImmutableList.builder();
        for (String name : names) {
            builder.add(PathElement.of(name));
        }
        return new TreePath("", builder.build());
    }

    /**
     * Parses a path such as {@code /interfaces/interface[name=eth0]/config/mtu}.
     * A leading slash is accepted and ignored.
     *
     * @param path the path string
     * @return the parsed path
     * @throws IllegalArgumentException if the path is malformed
     */
    @NotNull
    public static TreePath parse(@NotNull String path) {
        ImmutableList.Builder<PathElement> builder = ImmutableList.builder();
        for (String element : PathUtils.elements(path)) {
            builder.add(PathElement.parse(element));
        }
        return new TreePath("", builder.build());
    }

    @NotNull
    public String getOrigin() {
        return origin;
    }

    @NotNull
    public TreePath withOrigin(@NotNull String newOrigin) {
        return new TreePath(newOrigin, elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @NotNull
    public PathElement getElement(int index) {
        checkElementIndex(index, elements.size());
        return elements.get(index);
    }

    @NotNull
    public List<PathElement> getElements() {
        return elements;
    }

    @NotNull
    public PathElement getFirst() {
        checkState(!elements.isEmpty(), "empty path");
        return elements.get(0);
    }

    @NotNull
    public PathElement getLast() {
        checkState(!elements.isEmpty(), "empty path");
        return elements.get(elements.size() - 1);
    }

    /**
     * Returns this path without its first element.
     */
    @NotNull
    public TreePath pop() {
        return skip(1);
    }

    /**
     * Returns this path without its first {@code n} elements.
     */
    @NotNull
    public TreePath skip(int n) {
        if (n <= 0) {
            return this;
        }
        if (n >= elements.size()) {
            return new TreePath(origin, ImmutableList.<PathElement>of());
        }
        return new TreePath(origin, elements.subList(n, elements.size()));
    }

    /**
     * Returns this path without its last element.
     */
    @NotNull
    public TreePath getParent() {
        if (elements.isEmpty()) {
            return this;
        }
        return new TreePath(origin, elements.subList(0, elements.size() - 1));
    }

    @NotNull
    public TreePath append(@NotNull PathElement element) {
        return new TreePath(origin, ImmutableList.<PathElement>builder()
                .addAll(elements).add(element).build());
    }

    @NotNull
    public TreePath append(@NotNull String name) {
        return append(PathElement.of(name));
    }

    @NotNull
    public TreePath concat(@NotNull TreePath other) {
        return new TreePath(origin, ImmutableList.<PathElement>builder()
                .addAll(elements).addAll(other.elements).build());
    }

    /**
     * Returns a copy of this path with the last element replaced.
     */
    @NotNull
    public TreePath replaceLast(@NotNull PathElement element) {
        checkState(!elements.isEmpty(), "empty path");
        return getParent().append(element);
    }

    /**
     * Discards an empty-named first element (absolute path marker).
     */
    @NotNull
    public TreePath stripAbsoluteMarker() {
        if (!elements.isEmpty() && elements.get(0).getName().isEmpty()) {
            return pop();
        }
        return this;
    }

    /**
     * Whether the element names of this path start with the given names.
     * Keys are not compared.
     *
     * @param names the prefix names
     * @return {@code true} if this path has the given name prefix
     */
    public boolean hasNamePrefix(@NotNull List<String> names) {
        if (names.size() > elements.size()) {
            return false;
        }
        for (int i = 0; i < names.size(); i++) {
            if (!names.get(i).equals(elements.get(i).getName())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Iterator<PathElement> iterator() {
        return elements.iterator();
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TreePath)) {
            return false;
        }
        TreePath that = (TreePath) other;
        return origin.equals(that.origin) && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return 31 * origin.hashCode() + elements.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        if (!origin.isEmpty()) {
            buff.append(origin).append(':');
        }
        for (PathElement element : elements) {
            buff.append('/').append(element);
        }
        if (elements.isEmpty()) {
            buff.append('/');
        }
        return buff.toString();
    }
}
