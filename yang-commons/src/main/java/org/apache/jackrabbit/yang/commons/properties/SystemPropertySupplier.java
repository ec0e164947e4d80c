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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Properties;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.collect.Range;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named engine tunable backed by a system property.
 * <p>
 * A value that does not parse, or that lies outside the accepted range, is
 * logged at ERROR level and the default is used instead. A value differing
 * from the default is logged at INFO level.
 */
public final class SystemPropertySupplier<T extends Comparable<? super T>> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String name;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private Range<T> accepted = Range.all();
    private Properties source;

    private SystemPropertySupplier(String name, T defaultValue, Function<String, T> parser) {
        this.name = checkNotNull(name);
        this.defaultValue = checkNotNull(defaultValue);
        this.parser = parser;
    }

    public static SystemPropertySupplier<Integer> ofInt(@NotNull String name, int defaultValue) {
        return new SystemPropertySupplier<>(name, defaultValue, v -> Ints.tryParse(v.trim()));
    }

    public static SystemPropertySupplier<Long> ofLong(@NotNull String name, long defaultValue) {
        return new SystemPropertySupplier<>(name, defaultValue, v -> Longs.tryParse(v.trim()));
    }

    public static SystemPropertySupplier<Boolean> ofBoolean(@NotNull String name, boolean defaultValue) {
        return new SystemPropertySupplier<>(name, defaultValue, SystemPropertySupplier::parseBoolean);
    }

    /**
     * Logs to the given logger instead of this class's one.
     */
    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    /**
     * Restricts the accepted values. The default must lie within the range.
     */
    public SystemPropertySupplier<T> within(@NotNull Range<T> range) {
        checkArgument(range.contains(defaultValue), "default %s of %s outside %s", defaultValue, name, range);
        this.accepted = range;
        return this;
    }

    /**
     * Reads from the given properties instead of {@link System#getProperties()}.
     */
    SystemPropertySupplier<T> readingFrom(@NotNull Properties properties) {
        this.source = checkNotNull(properties);
        return this;
    }

    @Override
    public T get() {
        String raw = source == null ? System.getProperty(name) : source.getProperty(name);
        if (raw == null) {
            log.trace("{} not set, using {}", name, defaultValue);
            return defaultValue;
        }
        T value = parser.apply(raw);
        if (value == null) {
            log.error("Ignoring malformed value '{}' for {}", raw, name);
            return defaultValue;
        }
        if (!accepted.contains(value)) {
            log.error("Ignoring value '{}' for {}, accepted range is {}", raw, name, accepted);
            return defaultValue;
        }
        if (!value.equals(defaultValue)) {
            log.info("{} set to {}", name, value);
        }
        return value;
    }

    @Nullable
    private static Boolean parseBoolean(String raw) {
        String v = raw.trim();
        if ("true".equalsIgnoreCase(v)) {
            return Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(v)) {
            return Boolean.FALSE;
        }
        return null;
    }
}
