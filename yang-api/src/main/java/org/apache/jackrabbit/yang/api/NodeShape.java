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

import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * The shape of a data value met during a traversal. The generic algorithms
 * switch on the shape rather than on concrete generated types.
 */
public enum NodeShape {

    /** A {@link YangNode}: a container or a single list entry. */
    CONTAINER,

    /** A {@code Map} of list entries by key. */
    LIST,

    /** Anything else: a leaf value or a leaf-list. */
    SCALAR;

    @NotNull
    public static NodeShape of(@NotNull Object value) {
        if (value instanceof YangNode) {
            return CONTAINER;
        } else if (value instanceof Map) {
            return LIST;
        }
        return SCALAR;
    }
}
