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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class TreePathTest {

    @Test
    public void parse() {
        TreePath path = TreePath.parse("/interfaces/interface[name=eth0]/config/mtu");
        assertEquals(4, path.size());
        assertEquals("interfaces", path.getFirst().getName());
        assertEquals("eth0", path.getElement(1).getKey("name"));
        assertEquals("mtu", path.getLast().getName());
        assertEquals("/interfaces/interface[name=eth0]/config/mtu", path.toString());
    }

    @Test
    public void parseCompoundKey() {
        PathElement commaSeparated = PathElement.parse("list[key1=forty-two,key2=42,key3=43]");
        PathElement bracketed = PathElement.parse("list[key3=43][key1=forty-two][key2=42]");
        assertEquals(commaSeparated, bracketed);
        assertEquals(commaSeparated.hashCode(), bracketed.hashCode());
        assertEquals(ImmutableMap.of("key1", "forty-two", "key2", "42", "key3", "43"), bracketed.getKeys());
    }

    @Test
    public void keyValuesWithCommas() {
        assertEquals(ImmutableMap.of("name", "a,b"), PathElement.parse("description[name=a,b]").getKeys());
        assertEquals(ImmutableMap.of("k1", "x, y", "k2", "z"), PathElement.parse("l[k1=x, y,k2=z]").getKeys());
        TreePath path = TreePath.parse("/acl/entry[name=permit a,b]/config");
        assertEquals("permit a,b", path.getElement(1).getKey("name"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void parseMalformedKey() {
        PathElement.parse("list[key1]");
    }

    @Test
    public void keysAreUnordered() {
        PathElement a = PathElement.of("l", ImmutableMap.of("a", "1", "b", "2"));
        PathElement b = PathElement.of("l", ImmutableMap.of("b", "2", "a", "1"));
        assertEquals(a, b);
        assertNotEquals(a, a.withoutKeys());
        assertEquals("l[a=1][b=2]", b.toString());
    }

    @Test
    public void popAndSkip() {
        TreePath path = TreePath.parse("a/b/c");
        assertEquals(TreePath.parse("b/c"), path.pop());
        assertEquals(TreePath.EMPTY, path.skip(3));
        assertEquals(TreePath.EMPTY, path.skip(5));
        assertEquals(path, path.skip(0));
        assertEquals(TreePath.parse("a/b"), path.getParent());
        assertEquals(TreePath.parse("a/b/c/d"), path.append("d"));
        assertEquals(TreePath.parse("a/b/x"), path.replaceLast(PathElement.of("x")));
    }

    @Test
    public void absoluteMarker() {
        TreePath path = TreePath.of(PathElement.of(""), PathElement.of("a"));
        assertEquals(TreePath.parse("a"), path.stripAbsoluteMarker());
        assertEquals(TreePath.parse("a"), TreePath.parse("a").stripAbsoluteMarker());
    }

    @Test
    public void namePrefix() {
        TreePath path = TreePath.parse("config/name");
        assertTrue(path.hasNamePrefix(ImmutableList.of("config")));
        assertTrue(path.hasNamePrefix(ImmutableList.of("config", "name")));
        assertFalse(path.hasNamePrefix(ImmutableList.of("config", "name", "x")));
        assertFalse(path.hasNamePrefix(ImmutableList.of("state")));
    }

    @Test
    public void origin() {
        TreePath path = TreePath.parse("a").withOrigin("openconfig");
        assertEquals("openconfig:/a", path.toString());
        assertNotEquals(TreePath.parse("a"), path);
        assertEquals("openconfig", path.pop().getOrigin());
    }
}
