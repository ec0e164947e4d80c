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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.fixture.Device;
import org.apache.jackrabbit.yang.fixture.DeviceSchema;
import org.apache.jackrabbit.yang.fixture.Interface;
import org.apache.jackrabbit.yang.fixture.Neighbor;
import org.junit.Test;

public class ValidatorTest {

    private final Device device = DeviceSchema.sampleDevice();

    private final Interface eth0 = device.getInterfaces().get("eth0");

    private final Neighbor neighbor = device.getBgp().getNeighbors().get("192.0.2.1");

    private List<YangException> validate(ValidationOption... options) {
        return Validator.validate(DeviceSchema.ROOT, device, options);
    }

    private static YangException single(List<YangException> errors, int code) {
        assertEquals(errors.toString(), 1, errors.size());
        YangException e = errors.get(0);
        assertEquals(e.getMessage(), code, e.getCode());
        return e;
    }

    @Test
    public void validTree() {
        assertEquals(0, validate().size());
        assertEquals(0, Validator.validate(DeviceSchema.ROOT, new Device()).size());
    }

    @Test
    public void range() {
        eth0.setMtu(20L);
        YangException e = single(validate(), 116);
        assertTrue(e.isConstraintViolation());
        assertTrue(e.getMessage(), e.getMessage().contains("/interfaces/interface[name=eth0]/config/mtu: "));
    }

    @Test
    public void pattern() {
        eth0.setMacAddress("00:11:22:33:44:55");
        assertEquals(0, validate().size());
        eth0.setMacAddress("00-11-22-33-44-55");
        single(validate(), 116);
    }

    @Test
    public void union() {
        eth0.setVlan(10L);
        assertEquals(0, validate().size());
        eth0.setVlan("NONE");
        assertEquals(0, validate().size());
        eth0.setVlan("SOME");
        single(validate(), 116);
        eth0.setVlan(5000L);
        single(validate(), 116);
    }

    @Test
    public void leafLists() {
        eth0.setAliases(Arrays.asList("a", "a"));
        single(validate(), 110);
        eth0.setAliases(Arrays.asList("a", "b", "c", "d"));
        YangException e = single(validate(), 114);
        assertTrue(e.getMessage(), e.getMessage().contains("at most 3"));
    }

    @Test
    public void keyMismatch() {
        Interface wrong = new Interface();
        wrong.setName("eth5");
        device.getInterfaces().put("eth4", wrong);
        YangException e = single(validate(), 112);
        assertTrue(e.getMessage(), e.getMessage().contains("eth4"));
    }

    @Test
    public void danglingLeafref() {
        neighbor.setSubinterfaceRef(5L);
        YangException e = single(validate(), 120);
        assertTrue(e.isConstraintViolation());
        assertTrue(e.getMessage(), e.getMessage().contains(
                "/bgp/neighbors/neighbor[neighbor-address=192.0.2.1]/config/subinterface: leafref value 5"));

        assertEquals(0, validate(ValidationOption.IGNORE_MISSING_DATA).size());
    }

    @Test
    public void leafrefToListKey() {
        neighbor.setInterfaceRef("eth1");
        neighbor.setSubinterfaceRef(null);
        assertEquals(0, validate().size());
        neighbor.setInterfaceRef("eth9");
        single(validate(), 120);
    }

    @Test
    public void leafrefPredicateOnUnsetLeaf() {
        neighbor.setInterfaceRef(null);
        single(validate(), 125);
    }

    @Test
    public void subtreesSkipLeafrefs() {
        neighbor.setSubinterfaceRef(5L);
        assertEquals(0, Validator.validate(DeviceSchema.ROOT.getChild("bgp"), device.getBgp()).size());
    }

    @Test
    public void allViolationsAreReported() {
        eth0.setMtu(20L);
        eth0.setAliases(Arrays.asList("a", "a"));
        neighbor.setSubinterfaceRef(5L);
        List<YangException> errors = validate();
        assertEquals(errors.toString(), 3, errors.size());
    }
}
