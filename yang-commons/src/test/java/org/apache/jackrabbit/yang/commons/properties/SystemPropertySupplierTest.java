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
package org.apache.jackrabbit.yang.commons.properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Properties;

import com.google.common.collect.Range;
import org.apache.jackrabbit.yang.commons.junit.LogCustomizer;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

public class SystemPropertySupplierTest {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplierTest.class);

    private static Properties props(String name, String value) {
        Properties p = new Properties();
        p.setProperty(name, value);
        return p;
    }

    @Test
    public void defaultWhenUnset() {
        int hops = SystemPropertySupplier.ofInt("yang.leafref.maxHops", 64)
                .readingFrom(new Properties()).get();
        assertEquals(64, hops);
    }

    @Test
    public void parsedValues() {
        assertEquals(Integer.valueOf(8), SystemPropertySupplier.ofInt("yang.leafref.maxHops", 64)
                .readingFrom(props("yang.leafref.maxHops", " 8 ")).get());
        assertEquals(Long.valueOf(1L << 40), SystemPropertySupplier.ofLong("foo", 5L)
                .readingFrom(props("foo", Long.toString(1L << 40))).get());
        assertEquals(Boolean.TRUE, SystemPropertySupplier.ofBoolean("foo", false)
                .readingFrom(props("foo", "TRUE")).get());
    }

    @Test
    public void malformedValueFallsBack() {
        LogCustomizer logCustomizer = LogCustomizer.forLogger(SystemPropertySupplierTest.class)
                .enable(Level.ERROR).contains("Ignoring malformed value").create();
        logCustomizer.starting();
        try {
            long value = SystemPropertySupplier.ofLong("foo", 5L).loggingTo(LOG)
                    .readingFrom(props("foo", "five")).get();
            assertEquals(5L, value);
            assertEquals(Boolean.FALSE, SystemPropertySupplier.ofBoolean("foo", false).loggingTo(LOG)
                    .readingFrom(props("foo", "yes")).get());
            assertEquals(2, logCustomizer.getLogs().size());
        } finally {
            logCustomizer.finished();
        }
    }

    @Test
    public void valueOutsideRangeFallsBack() {
        LogCustomizer logCustomizer = LogCustomizer.forLogger(SystemPropertySupplierTest.class)
                .enable(Level.ERROR).contains("accepted range").create();
        logCustomizer.starting();
        try {
            int positive = SystemPropertySupplier.ofInt("foo", 123).loggingTo(LOG)
                    .within(Range.atLeast(1)).readingFrom(props("foo", "-1")).get();
            assertEquals(123, positive);
            assertEquals(1, logCustomizer.getLogs().size());
        } finally {
            logCustomizer.finished();
        }
    }

    @Test
    public void defaultOutsideRangeIsRejected() {
        try {
            SystemPropertySupplier.ofInt("foo", 0).within(Range.atLeast(1));
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("foo"));
            return;
        }
        throw new AssertionError("expected IllegalArgumentException");
    }
}
