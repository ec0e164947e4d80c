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

import static org.apache.jackrabbit.yang.node.GetNodeOption.HANDLE_WILDCARDS;
import static org.apache.jackrabbit.yang.node.GetNodeOption.PARTIAL_KEY_MATCH;
import static org.apache.jackrabbit.yang.node.GetNodeOption.TOLERATE_NIL;
import static org.apache.jackrabbit.yang.node.SetNodeOption.INIT_MISSING_ELEMENTS;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.TreeNode;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.commons.junit.LogCustomizer;
import org.apache.jackrabbit.yang.fixture.Bgp;
import org.apache.jackrabbit.yang.fixture.CompoundKeyModel;
import org.apache.jackrabbit.yang.fixture.Device;
import org.apache.jackrabbit.yang.fixture.DeviceSchema;
import org.apache.jackrabbit.yang.fixture.IfType;
import org.apache.jackrabbit.yang.fixture.Interface;
import org.apache.jackrabbit.yang.fixture.Subinterface;
import org.apache.jackrabbit.yang.json.JsonDecoder;
import org.junit.Before;
import org.junit.Test;

import ch.qos.logback.classic.Level;

public class NodeNavigatorTest {

    private Device device;

    @Before
    public void setup() {
        device = DeviceSchema.sampleDevice();
    }

    private static TreePath path(String path) {
        return TreePath.parse(path);
    }

    private Object get(String path, GetNodeOption... options) throws YangException {
        List<TreeNode> nodes = NodeNavigator.getNode(DeviceSchema.ROOT, device, path(path), options);
        assertEquals(1, nodes.size());
        return nodes.get(0).getData();
    }

    //----------------------------------------------------------< getNode >--

    @Test
    public void compoundKey() throws YangException {
        CompoundKeyModel.Root root = new CompoundKeyModel.Root();
        root.addEntry("forty-two", 42, 43).getOrCreateOuter().getOrCreateInner().setLeafField(1234L);
        root.addEntry("forty-two", 42, 44);

        TreePath path = path("/list[key1=forty-two,key2=42,key3=43]/outer/inner/leaf-field");
        List<TreeNode> nodes = NodeNavigator.getNode(CompoundKeyModel.ROOT, root, path);
        assertEquals(1, nodes.size());
        assertEquals(1234L, nodes.get(0).getData());
        assertEquals(path, nodes.get(0).getPath());
        assertEquals("leaf-field", nodes.get(0).getSchema().getName());
    }

    @Test
    public void compoundKeyBadSegment() {
        CompoundKeyModel.Root root = new CompoundKeyModel.Root();
        root.addEntry("forty-two", 42, 43).getOrCreateOuter().getOrCreateInner().setLeafField(1234L);
        try {
            NodeNavigator.getNode(CompoundKeyModel.ROOT, root,
                    path("/list[key1=forty-two,key2=42,key3=43]/wrong/inner/leaf-field"));
            fail("an unknown path element must not match");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
            assertTrue(e.getMessage(), e.getMessage().contains("schema node list"));
            assertTrue(e.getMessage(), e.getMessage().contains("/wrong/inner/leaf-field"));
        }
    }

    @Test
    public void compressedAndCanonicalPaths() throws YangException {
        assertEquals("eth0", get("/interfaces/interface[name=eth0]/name"));
        assertEquals("eth0", get("/interfaces/interface[name=eth0]/config/name"));
        assertEquals(1500L, get("/interfaces/interface[name=eth0]/config/mtu"));
        assertEquals(64512L, get("/bgp/global/config/as"));
        assertEquals("untagged",
                get("/interfaces/interface[name=eth0]/subinterfaces/subinterface[index=0]/config/description"));
    }

    @Test
    public void containerAndListEntryMatches() throws YangException {
        assertSame(device.getBgp(), get("/bgp"));
        List<TreeNode> nodes = NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=eth1]"));
        assertSame(device.getInterfaces().get("eth1"), nodes.get(0).getData());
        assertTrue(nodes.get(0).getSchema().isList());
    }

    @Test
    public void wildcards() throws YangException {
        List<TreeNode> all = NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=*]/name"), PARTIAL_KEY_MATCH);
        assertEquals(2, all.size());
        assertEquals(path("/interfaces/interface[name=eth0]/name"), all.get(0).getPath());
        assertEquals(path("/interfaces/interface[name=eth1]/name"), all.get(1).getPath());

        List<TreeNode> exact = NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=eth1]/name"), PARTIAL_KEY_MATCH);
        assertEquals(1, exact.size());
        assertEquals("eth1", exact.get(0).getData());

        // without partial matching the first match is selected
        assertEquals("eth0", get("/interfaces/interface[name=*]/name", HANDLE_WILDCARDS));
    }

    @Test
    public void partialKeyMatchWithoutKeys() throws YangException {
        List<TreeNode> nodes = NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface/subinterfaces/subinterface/index"), PARTIAL_KEY_MATCH, TOLERATE_NIL);
        assertEquals(2, nodes.size());
        assertEquals(0L, nodes.get(0).getData());
        assertEquals(1L, nodes.get(1).getData());
    }

    @Test
    public void wildcardIsLiteralWithoutOptions() {
        try {
            NodeNavigator.getNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=*]/name"));
            fail("* must not match without wildcard handling");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
        }
    }

    @Test
    public void tolerateNil() throws YangException {
        assertTrue(NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=eth1]/config/mtu"), TOLERATE_NIL).isEmpty());
        assertTrue(NodeNavigator.getNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=eth9]/config/mtu"), TOLERATE_NIL).isEmpty());
        try {
            get("/interfaces/interface[name=eth1]/config/mtu");
            fail("an unset leaf must not match");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
        }
        try {
            get("/interfaces/interface[name=eth9]/config/mtu");
            fail("a missing entry must not match");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
            assertTrue(e.getMessage(), e.getMessage().contains("interface[name=eth9]"));
        }
    }

    @Test
    public void keyErrors() {
        assertInvalidArgument("/interfaces/interface/name", 50);
        assertInvalidArgument("/interfaces/interface[ifname=eth0]/name", 51);
    }

    @Test
    public void rootAndSchemaErrors() throws YangException {
        try {
            NodeNavigator.getNode(DeviceSchema.ROOT, null, path("/bgp"));
            fail("nil root must fail");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
        }
        try {
            NodeNavigator.getNode(null, device, path("/bgp"));
            fail("nil schema must fail");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
            assertTrue(e.getMessage(), e.getMessage().contains("Device"));
        }
        List<TreeNode> self = NodeNavigator.getNode(DeviceSchema.ROOT, device, TreePath.EMPTY);
        assertSame(device, self.get(0).getData());
        try {
            get("/interfaces/interface[name=eth0]/config/mtu/extra");
            fail("a path below a leaf must not match");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
            assertTrue(e.getMessage(), e.getMessage().contains("Interface"));
        }
    }

    @Test
    public void absoluteMarkerAndOrigin() throws YangException {
        TreePath path = TreePath.of(PathElement.of("")).concat(path("/bgp/global/config/as"))
                .withOrigin("openconfig");
        List<TreeNode> nodes = NodeNavigator.getNode(DeviceSchema.ROOT, device, path);
        assertEquals(64512L, nodes.get(0).getData());
        assertEquals("openconfig", nodes.get(0).getPath().getOrigin());
    }

    @Test
    public void traceLogging() throws YangException {
        LogCustomizer logs = LogCustomizer.forLogger(NodeNavigator.class).enable(Level.TRACE).create();
        logs.starting();
        try {
            get("/bgp/global/config/as");
            List<String> messages = logs.getLogs();
            assertTrue(messages.toString(), messages.get(0).startsWith("container device (Device)"));
            assertTrue(messages.toString(), messages.get(1).startsWith("  field bgp"));
        } finally {
            logs.finished();
        }
    }

    //----------------------------------------------------------< setNode >--

    @Test
    public void getThenSetIsIdempotent() throws YangException {
        for (String p : Arrays.asList(
                "/interfaces/interface[name=eth0]/config/mtu",
                "/interfaces/interface[name=eth0]/name",
                "/interfaces/interface[name=eth0]/config/type",
                "/interfaces/interface[name=eth0]/subinterfaces/subinterface[index=0]",
                "/bgp")) {
            Device copy = YangNodes.copy(device);
            Object value = get(p);
            NodeNavigator.setNode(DeviceSchema.ROOT, device, path(p), value);
            assertEquals(p, copy, device);
        }
    }

    @Test
    public void setConvertsValues() throws YangException {
        Interface eth0 = device.getInterfaces().get("eth0");
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth0]/config/mtu"), "9000");
        assertEquals(Long.valueOf(9000), eth0.getMtu());
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth0]/config/type"),
                "softwareLoopback");
        assertEquals(IfType.SOFTWARE_LOOPBACK, eth0.getType());
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth0]/config/vlan"), "ANY");
        assertEquals("ANY", eth0.getVlan());
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth0]/config/vlan"), 10);
        assertEquals(10L, eth0.getVlan());
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth0]/config/aliases"),
                Arrays.asList("a", "b"));
        assertEquals(Arrays.asList("a", "b"), eth0.getAliases());
        // leafref leaves take the type of their target
        NodeNavigator.setNode(DeviceSchema.ROOT, device,
                path("/bgp/neighbors/neighbor[neighbor-address=192.0.2.1]/config/subinterface"), "1");
        assertEquals(Long.valueOf(1), device.getBgp().getNeighbors().get("192.0.2.1").getSubinterfaceRef());
    }

    @Test
    public void setRejectsBadValues() {
        assertSetFails("/interfaces/interface[name=eth0]/config/mtu", "jumbo");
        assertSetFails("/interfaces/interface[name=eth0]/config/enabled", 1);
        assertSetFails("/interfaces/interface[name=eth0]/config/vlan", "SOME");
        assertSetFails("/bgp", "not a container");
        assertSetFails("/bgp", null);
    }

    @Test
    public void setRejectsIntegersOutsideTheirKind() {
        assertSetFails("/bgp/global/config/as", -5L);
        assertSetFails("/bgp/global/config/as", "4294967296");
        assertSetFails("/interfaces/interface[name=eth0]/config/mtu", 70000);
        try {
            NodeNavigator.setNode(DeviceSchema.ROOT, device,
                    path("/interfaces/interface[name=eth0]/subinterfaces/subinterface[index=-1]/config/description"),
                    "x", INIT_MISSING_ELEMENTS);
            fail("a negative uint32 key must not create an entry");
        } catch (YangException e) {
            assertTrue(e.getMessage(), e.isInvalidArgument());
        }
        assertEquals(2, device.getInterfaces().get("eth0").getSubinterfaces().size());
    }

    @Test
    public void setStoresCopyOfContainer() throws YangException {
        Device other = DeviceSchema.sampleDevice();
        Bgp bgp = other.getBgp();
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/bgp"), bgp);
        assertNotSame(bgp, device.getBgp());
        assertEquals(bgp, device.getBgp());

        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/bgp/global/config/as"), 65001L);
        assertEquals(Long.valueOf(65001), device.getBgp().getAs());
        assertFalse(Long.valueOf(65001).equals(other.getBgp().getAs()));
    }

    @Test
    public void setMissingWithoutInit() {
        try {
            NodeNavigator.setNode(DeviceSchema.ROOT, new Device(),
                    path("/interfaces/interface[name=eth2]/config/mtu"), 1500);
            fail("setting below a missing entry must fail");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
        }
    }

    @Test
    public void initMissingElements() throws YangException {
        Device empty = new Device();
        NodeNavigator.setNode(DeviceSchema.ROOT, empty,
                path("/interfaces/interface[name=eth2]/subinterfaces/subinterface[index=3]/config/description"),
                "tagged", INIT_MISSING_ELEMENTS);
        Interface eth2 = empty.getInterfaces().get("eth2");
        assertEquals("eth2", eth2.getName());
        Subinterface sub = eth2.getSubinterfaces().get(3L);
        assertEquals(Long.valueOf(3), sub.getIndex());
        assertEquals("tagged", sub.getDescription());

        NodeNavigator.setNode(DeviceSchema.ROOT, empty, path("/bgp/global/config/as"), 65000L, INIT_MISSING_ELEMENTS);
        assertEquals(Long.valueOf(65000), empty.getBgp().getAs());
    }

    @Test
    public void initRequiresCompleteKeys() {
        try {
            NodeNavigator.setNode(DeviceSchema.ROOT, new Device(), path("/interfaces/interface[name=*]/config/mtu"),
                    1500, INIT_MISSING_ELEMENTS);
            fail("an entry cannot be created from a wildcard");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
        }
    }

    @Test
    public void setFromJson() throws YangException {
        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/bgp"),
                JsonDecoder.parse("{\"openconfig-bgp:global\": {\"config\": {\"as\": 65001}}}"));
        Bgp bgp = device.getBgp();
        assertEquals(Long.valueOf(65001), bgp.getAs());
        assertNull(bgp.getNeighbors());

        NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth1]"),
                JsonDecoder.parse("{\"name\": \"eth1\", \"config\": {\"name\": \"eth1\", \"mtu\": 9000}}"));
        assertEquals(Long.valueOf(9000), device.getInterfaces().get("eth1").getMtu());
        try {
            NodeNavigator.setNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth1]"),
                    JsonDecoder.parse("{\"name\": \"eth7\"}"));
            fail("an entry with a different key must be rejected");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
        }
    }

    @Test
    public void getOrCreateNode() throws YangException {
        Device empty = new Device();
        TreeNode node = NodeNavigator.getOrCreateNode(DeviceSchema.ROOT, empty,
                path("/bgp/neighbors/neighbor[neighbor-address=198.51.100.7]"));
        assertSame(empty.getBgp().getNeighbors().get("198.51.100.7"), node.getData());
        assertEquals("198.51.100.7", empty.getBgp().getNeighbors().get("198.51.100.7").getNeighborAddress());
    }

    //-------------------------------------------------------< deleteNode >--

    @Test
    public void deleteNode() throws YangException {
        NodeNavigator.deleteNode(DeviceSchema.ROOT, device,
                path("/interfaces/interface[name=eth0]/subinterfaces/subinterface[index=1]"));
        assertEquals(1, device.getInterfaces().get("eth0").getSubinterfaces().size());

        NodeNavigator.deleteNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth1]/config/description"));
        assertNull(device.getInterfaces().get("eth1").getDescription());

        NodeNavigator.deleteNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth1]"));
        assertEquals(1, device.getInterfaces().size());

        // absent nodes
        NodeNavigator.deleteNode(DeviceSchema.ROOT, device, path("/interfaces/interface[name=eth9]"));
        NodeNavigator.deleteNode(DeviceSchema.ROOT, new Device(), path("/bgp/global/config/as"));
    }

    @Test
    public void deletePrunesEmptyContainers() throws YangException {
        NodeNavigator.deleteNode(DeviceSchema.ROOT, device, path("/bgp/neighbors/neighbor"));
        assertNull(device.getBgp().getNeighbors());
        NodeNavigator.deleteNode(DeviceSchema.ROOT, device, path("/bgp/global/config/as"));
        assertNull(device.getBgp());
    }

    //----------------------------------------------------------< newNode >--

    @Test
    public void newNode() throws YangException {
        assertTrue(NodeNavigator.newNode(Device.TYPE, TreePath.EMPTY) instanceof Device);
        Object sub = NodeNavigator.newNode(Device.TYPE,
                path("/interfaces/interface[name=ignored]/subinterfaces/subinterface"));
        assertTrue(sub instanceof Subinterface);
        assertNull(((Subinterface) sub).getIndex());
        assertEquals(0L, NodeNavigator.newNode(Device.TYPE, path("/interfaces/interface/config/mtu")));
        assertEquals(Collections.emptyList(), NodeNavigator.newNode(Device.TYPE,
                path("/interfaces/interface/config/aliases")));
        assertNotNull(NodeNavigator.newNode(Bgp.TYPE, path("/global/config/as")));
        try {
            NodeNavigator.newNode(Device.TYPE, path("/system/config"));
            fail("unknown paths must fail");
        } catch (YangException e) {
            assertTrue(e.isPathNotFound());
        }
    }

    private void assertInvalidArgument(String p, int code) {
        try {
            NodeNavigator.getNode(DeviceSchema.ROOT, device, path(p));
            fail(p + " must be rejected");
        } catch (YangException e) {
            assertTrue(e.isInvalidArgument());
            assertEquals(e.getMessage(), code, e.getCode());
        }
    }

    private void assertSetFails(String p, Object value) {
        try {
            NodeNavigator.setNode(DeviceSchema.ROOT, device, path(p), value);
            fail("setting " + value + " at " + p + " must fail");
        } catch (YangException e) {
            assertTrue(e.getMessage(), e.isInvalidArgument());
        }
    }
}
