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
package org.apache.jackrabbit.yang.commons;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.jetbrains.annotations.NotNull;

/**
 * Utility methods to parse schema paths as they appear in field path
 * annotations and leafref path expressions.
 * <p>
 * A schema path is a sequence of names separated by {@code /}. Names may be
 * qualified by a module prefix ({@code oc-if:interface}) and may carry XPath
 * predicates ({@code interface[name=current()/../name]}). Slashes inside
 * predicates do not separate elements. A path annotation may list several
 * alternative paths separated by {@code |}.
 */
public final class PathUtils {

    public static final String ROOT_PATH = "/";

    private static final Splitter ALTERNATIVES = Splitter.on('|').trimResults().omitEmptyStrings();

    private PathUtils() {
        // utility class
    }

    /**
     * @param element The path segment to check for being the current element
     * @return {@code true} if the specified element equals "."; {@code false} otherwise.
     */
    public static boolean denotesCurrent(String element) {
        return ".".equals(element);
    }

    /**
     * @param element The path segment to check for being the parent element
     * @return {@code true} if the specified element equals ".."; {@code false} otherwise.
     */
    public static boolean denotesParent(String element) {
        return "..".equals(element);
    }

    /**
     * Whether the path is absolute (starts with a slash) or not.
     *
     * @param path the path
     * @return true if it starts with a slash
     */
    public static boolean isAbsolute(@NotNull String path) {
        return !path.isEmpty() && path.charAt(0) == '/';
    }

    /**
     * Splits a path annotation into its alternatives, e.g.
     * {@code "config/name|name"} into {@code ["config/name", "name"]}.
     *
     * @param annotation the path annotation
     * @return the non-empty alternatives in declaration order
     */
    @NotNull
    public static List<String> alternatives(@NotNull String annotation) {
        return ImmutableList.copyOf(ALTERNATIVES.split(checkNotNull(annotation)));
    }

    /**
     * Returns the elements of a path. A leading slash is dropped, slashes
     * within {@code [...]} predicates or quoted literals are not treated as
     * separators. The root path ("/") and the empty path ("") have zero
     * elements.
     *
     * @param path the path
     * @return the path elements
     * @throws IllegalArgumentException if brackets or quotes are unbalanced
     */
    @NotNull
    public static List<String> elements(@NotNull String path) {
        List<String> elements = Lists.newArrayList();
        int start = isAbsolute(path) ? 1 : 0;
        int depth = 0;
        char quote = 0;
        StringBuilder current = new StringBuilder();
        for (int i = start; i < path.length(); i++) {
            char c = path.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[') {
                depth++;
            } else if (c == ']') {
                if (--depth < 0) {
                    throw new IllegalArgumentException("Unbalanced ']' in path [" + path + "]");
                }
            } else if (c == '/' && depth == 0) {
                elements.add(current.toString());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (depth != 0 || quote != 0) {
            throw new IllegalArgumentException("Unterminated predicate in path [" + path + "]");
        }
        if (current.length() > 0 || !elements.isEmpty()) {
            elements.add(current.toString());
        }
        return elements;
    }

    /**
     * Removes all {@code [...]} predicates from a path, e.g.
     * {@code /a[k=current()/../b]/c} becomes {@code /a/c}.
     *
     * @param path the path
     * @return the path without predicates
     * @throws IllegalArgumentException if brackets are unbalanced
     */
    @NotNull
    public static String removePredicates(@NotNull String path) {
        StringBuilder buff = new StringBuilder(path.length());
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                if (--depth < 0) {
                    throw new IllegalArgumentException("Unbalanced ']' in path [" + path + "]");
                }
            } else if (depth == 0) {
                buff.append(c);
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unterminated predicate in path [" + path + "]");
        }
        return buff.toString();
    }

    /**
     * Strips the module prefix from a name: {@code oc-if:name} becomes
     * {@code name}. Names without a prefix are returned as-is.
     *
     * @param name the possibly prefixed name
     * @return the local name
     */
    @NotNull
    public static String stripModulePrefix(@NotNull String name) {
        int pos = name.lastIndexOf(':');
        return pos < 0 ? name : name.substring(pos + 1);
    }

    /**
     * Returns the module prefix of a name, or the empty string if the name
     * is not prefixed.
     *
     * @param name the possibly prefixed name
     * @return the prefix
     */
    @NotNull
    public static String getModulePrefix(@NotNull String name) {
        int pos = name.lastIndexOf(':');
        return pos < 0 ? "" : name.substring(0, pos);
    }

    /**
     * Returns the elements of a path with module prefixes stripped from
     * each element.
     *
     * @param path the path
     * @return the local names of the path elements
     */
    @NotNull
    public static List<String> localElements(@NotNull String path) {
        List<String> elements = elements(path);
        List<String> local = Lists.newArrayListWithCapacity(elements.size());
        for (String element : elements) {
            local.add(stripModulePrefix(element));
        }
        return local;
    }

    /**
     * Concatenates path elements to a relative path.
     *
     * @param elements the elements
     * @return the path
     */
    @NotNull
    public static String concat(@NotNull Iterable<String> elements) {
        return String.join("/", elements);
    }
}
