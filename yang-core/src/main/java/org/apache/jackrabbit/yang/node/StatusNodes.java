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

import java.util.List;

import org.apache.jackrabbit.yang.api.NodeResult;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.Status;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Status returning variants of {@link NodeNavigator#getNode} and
 * {@link NodeNavigator#newNode}, for callers that report a status code
 * instead of handling exceptions.
 */
public final class StatusNodes {

    private static final Logger LOG = LoggerFactory.getLogger(StatusNodes.class);

    private StatusNodes() {
    }

    /**
     * Returns the single node at a path.
     *
     * @return the node and {@link Status#OK}; or no value and
     *         {@code INVALID_ARGUMENT} for a nil root or a malformed path,
     *         {@code NOT_FOUND} if nothing matches, {@code INTERNAL} for
     *         anything else
     */
    @NotNull
    public static NodeResult getNode(@NotNull SchemaEntry schema, @Nullable Object root, @NotNull TreePath path) {
        if (path.stripAbsoluteMarker().isEmpty()) {
            return new NodeResult(root, Status.OK);
        }
        if (root == null) {
            return new NodeResult(null, Status.of(Status.Code.INVALID_ARGUMENT, "nil root, path " + path));
        }
        try {
            List<TreeNode> nodes = NodeNavigator.getNode(schema, root, path);
            if (nodes.size() != 1) {
                return new NodeResult(null, Status.of(Status.Code.INVALID_ARGUMENT,
                        "path " + path + " matches " + nodes.size() + " nodes"));
            }
            return new NodeResult(nodes.get(0).getData(), Status.OK);
        } catch (YangException e) {
            LOG.debug("getNode {} failed", path, e);
            return new NodeResult(null, Status.of(e));
        } catch (RuntimeException e) {
            LOG.warn("getNode {} failed unexpectedly", path, e);
            return new NodeResult(null, Status.of(Status.Code.INTERNAL, String.valueOf(e.getMessage())));
        }
    }

    /**
     * Creates an empty instance of the type at a path.
     */
    @NotNull
    public static NodeResult newNode(@NotNull NodeType<?> rootType, @NotNull TreePath path) {
        try {
            return new NodeResult(NodeNavigator.newNode(rootType, path), Status.OK);
        } catch (YangException e) {
            LOG.debug("newNode {} failed", path, e);
            return new NodeResult(null, Status.of(e));
        } catch (RuntimeException e) {
            LOG.warn("newNode {} failed unexpectedly", path, e);
            return new NodeResult(null, Status.of(Status.Code.INTERNAL, String.valueOf(e.getMessage())));
        }
    }
}
