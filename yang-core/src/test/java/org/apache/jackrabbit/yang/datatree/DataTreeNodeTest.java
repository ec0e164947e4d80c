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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.Lists;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.fixture.Device;
import org.apache.jackrabbit.yang.fixture.DeviceSchema;
import org.apache.jackrabbit.yang.fixture.Interface;
import org.apache.jackrabbit.yang.node.GetNodeOption;
import org.apache.jackrabbit.yang.node.NodeNavigator;
import org.junit.Test;

public class DataTreeNodeTest {

    private static PathElement element(String name) {
        return PathElement.of(name);
    }

    private static List<PathElement> path(String... names) {
        List<PathElement> path = Lists.newArrayList();
        for (String name : names) {
            path.add(PathElement.of(name));
        }
        return path;
    }

    @Test
    public void addLeaf() throws YangException {
        DataTreeNode root = new DataTreeNode();
        root.addNode(element("eone"), DataTreeNode.leaf("one"));
        assertEquals("one", root.find(element("eone")).getLeaf());

        root.addNode(element("eone"), DataTreeNode.leaf("two"));
        assertEquals("two", root.find(element("eone")).getLeaf());
        assertEquals(1, root.getChildren().size());
    }

    @Test
    public void mismatchedTypes() throws YangException {
        DataTreeNode root = new DataTreeNode();
        root.addNode(element("eone"), DataTreeNode.leaf(1L));
        try {
            root.addNode(element("eone"), DataTreeNode.forNode(new Interface()));
            fail("a leaf must not be replaced by a struct");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
            assertTrue(e.getMessage(), e.getMessage().contains("new isLeaf: false, existing isLeaf: true"));
        }
        assertEquals(1L, root.find(element("eone")).getLeaf());
    }

    @Test
    public void invalidElements() {
        DataTreeNode root = new DataTreeNode();
        try {
            root.addNode(element(""), DataTreeNode.leaf("x"));
            fail("empty element names are invalid");
        } catch (YangException e) {
            assertEquals(135, e.getCode());
        }
        try {
            root.addNode(PathElement.of("list", "", "x"), DataTreeNode.leaf("x"));
            fail("empty key names are invalid");
        } catch (YangException e) {
            assertEquals(135, e.getCode());
        }
    }

    @Test
    public void addAllNodes() throws YangException {
        DataTreeNode root = new DataTreeNode();
        root.addAllNodes(path("a", "b", "c"), DataTreeNode.leaf(42L));
        root.addAllNodes(path("a", "b", "d"), DataTreeNode.leaf(43L));
        DataTreeNode b = root.find(element("a")).find(element("b"));
        assertFalse(b.isLeaf());
        assertFalse(b.isStruct());
        assertEquals(42L, b.find(element("c")).getLeaf());
        assertEquals(43L, b.find(element("d")).getLeaf());

        try {
            root.addAllNodes(path("a"), DataTreeNode.leaf(1L));
            fail("paths need at least two elements");
        } catch (YangException e) {
            assertEquals(132, e.getCode());
        }
        try {
            root.addAllNodes(path("a", "b", "c", "x"), DataTreeNode.leaf(1L));
            fail("a leaf cannot hold children");
        } catch (YangException e) {
            assertEquals(134, e.getCode());
            assertTrue(e.getMessage(), e.getMessage().contains("cannot add branch to c, is a leaf"));
        }
    }

    @Test
    public void addChildren() throws YangException {
        Device device = DeviceSchema.sampleDevice();
        Interface eth0 = device.getInterfaces().get("eth0");
        DataTreeNode root = DataTreeNode.forNode(eth0);
        root.addChildren(eth0);

        assertSame(eth0, root.getNode());
        assertEquals(1500L, root.find(element("config")).find(element("mtu")).getLeaf());
        assertEquals("eth0", root.find(element("name")).getLeaf());
        assertEquals("eth0", root.find(element("config")).find(element("name")).getLeaf());

        DataTreeNode sub = root.find(element("subinterfaces")).find(PathElement.of("subinterface", "index", "0"));
        assertNotNull(sub);
        assertTrue(sub.isStruct());
        assertEquals("untagged", sub.find(element("config")).find(element("description")).getLeaf());
        assertNull(root.find(element("description")));
    }

    @Test
    public void addMatches() throws YangException {
        Device device = DeviceSchema.sampleDevice();
        List<TreeNode> matches = NodeNavigator.getNode(DeviceSchema.ROOT, device,
                TreePath.parse("/interfaces/interface[name=*]/config/mtu"),
                GetNodeOption.PARTIAL_KEY_MATCH, GetNodeOption.TOLERATE_NIL);
        DataTreeNode root = new DataTreeNode();
        root.addMatches(matches);

        DataTreeNode interfaces = root.find(element("interfaces"));
        assertEquals(1, interfaces.getChildren().size());
        DataTreeNode mtu = interfaces.find(PathElement.of("interface", "name", "eth0"))
                .find(element("config")).find(element("mtu"));
        assertEquals(1500L, mtu.getLeaf());

        try {
            root.addMatches(Collections.singletonList(new TreeNode(TreePath.EMPTY, DeviceSchema.ROOT, device)));
            fail("the empty path cannot be indexed");
        } catch (YangException e) {
            assertEquals(133, e.getCode());
        }
    }

    @Test
    public void concurrentAdds() throws Exception {
        final DataTreeNode root = new DataTreeNode();
        final int threads = 8;
        final int leaves = 100;
        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Void>> futures = Lists.newArrayList();
            for (int t = 0; t < threads; t++) {
                final String branch = "t" + t;
                futures.add(executor.submit(new Callable<Void>() {
                    @Override
                    public Void call() throws Exception {
                        start.await();
                        for (int i = 0; i < leaves; i++) {
                            root.addAllNodes(path("shared", branch, "leaf" + i), DataTreeNode.leaf((long) i));
                            root.addAllNodes(path("shared", "common", "leaf" + i), DataTreeNode.leaf((long) i));
                        }
                        return null;
                    }
                }));
            }
            start.countDown();
            for (Future<Void> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        DataTreeNode shared = root.find(element("shared"));
        assertEquals(threads + 1, shared.getChildren().size());
        for (int t = 0; t < threads; t++) {
            assertEquals(leaves, shared.find(element("t" + t)).getChildren().size());
        }
        assertEquals(leaves, shared.find(element("common")).getChildren().size());
    }

    @Test
    public void equality() throws YangException {
        DataTreeNode a = new DataTreeNode();
        a.addAllNodes(path("x", "y"), DataTreeNode.leaf(new byte[] {1, 2}));
        a.addAllNodes(path("x", "z"), DataTreeNode.leaf("z"));
        DataTreeNode b = new DataTreeNode();
        b.addAllNodes(path("x", "z"), DataTreeNode.leaf("z"));
        b.addAllNodes(path("x", "y"), DataTreeNode.leaf(new byte[] {1, 2}));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        b.addAllNodes(path("x", "z"), DataTreeNode.leaf("changed"));
        assertFalse(a.equals(b));
        assertFalse(a.equals(new DataTreeNode()));
    }
}
