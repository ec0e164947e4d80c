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
package org.apache.jackrabbit.yang.api.schema;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Range;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The type of a leaf or leaf-list: a {@link TypeKind} plus its restrictions.
 * <p>
 * Instances are immutable and created through the static factories and
 * {@link Builder}:
 * <pre>
 * ScalarType mtu = ScalarType.builder(TypeKind.UINT16).range(68, 9216).build();
 * ScalarType ref = ScalarType.leafref("../config/name");
 * </pre>
 */
public final class ScalarType {

    private final TypeKind kind;

    /** Value ranges of numeric types, empty if unrestricted. */
    private final ImmutableList<Range<BigDecimal>> ranges;

    /** Length ranges of string and binary types, empty if unrestricted. */
    private final ImmutableList<Range<BigDecimal>> lengths;

    /** Patterns a string value must match, all of them. */
    private final ImmutableList<String> patterns;

    private final ImmutableSet<String> enumNames;

    private final ImmutableList<ScalarType> unionTypes;

    private final String leafrefPath;

    private final int fractionDigits;

    private ScalarType(Builder builder) {
        this.kind = builder.kind;
        this.ranges = builder.ranges.build();
        this.lengths = builder.lengths.build();
        this.patterns = builder.patterns.build();
        this.enumNames = builder.enumNames.build();
        this.unionTypes = builder.unionTypes.build();
        this.leafrefPath = builder.leafrefPath;
        this.fractionDigits = builder.fractionDigits;
    }

    @NotNull
    public static Builder builder(@NotNull TypeKind kind) {
        return new Builder(kind);
    }

    @NotNull
    public static ScalarType of(@NotNull TypeKind kind) {
        return builder(kind).build();
    }

    @NotNull
    public static ScalarType string() {
        return of(TypeKind.STRING);
    }

    @NotNull
    public static ScalarType leafref(@NotNull String path) {
        return builder(TypeKind.LEAFREF).path(path).build();
    }

    @NotNull
    public static ScalarType enumeration(@NotNull String... names) {
        return builder(TypeKind.ENUMERATION).enumNames(names).build();
    }

    @NotNull
    public static ScalarType union(@NotNull ScalarType... members) {
        return builder(TypeKind.UNION).unionTypes(members).build();
    }

    @NotNull
    public TypeKind getKind() {
        return kind;
    }

    public boolean isLeafref() {
        return kind == TypeKind.LEAFREF;
    }

    @NotNull
    public List<Range<BigDecimal>> getRanges() {
        return ranges;
    }

    /**
     * Returns the declared ranges, or the default range of an integer
     * kind if none are declared.
     */
    @NotNull
    public List<Range<BigDecimal>> getEffectiveRanges() {
        if (ranges.isEmpty() && kind.isInteger()) {
            return ImmutableList.of(kind.getDefaultRange());
        }
        return ranges;
    }

    @NotNull
    public List<Range<BigDecimal>> getLengths() {
        return lengths;
    }

    @NotNull
    public List<String> getPatterns() {
        return patterns;
    }

    @NotNull
    public Set<String> getEnumNames() {
        return enumNames;
    }

    @NotNull
    public List<ScalarType> getUnionTypes() {
        return unionTypes;
    }

    @Nullable
    public String getLeafrefPath() {
        return leafrefPath;
    }

    public int getFractionDigits() {
        return fractionDigits;
    }

    @Override
    public String toString() {
        if (kind == TypeKind.LEAFREF) {
            return "leafref(" + leafrefPath + ")";
        }
        if (kind == TypeKind.UNION) {
            return "union" + unionTypes;
        }
        return kind.toString();
    }

    public static final class Builder {

        private final TypeKind kind;
        private final ImmutableList.Builder<Range<BigDecimal>> ranges = ImmutableList.builder();
        private final ImmutableList.Builder<Range<BigDecimal>> lengths = ImmutableList.builder();
        private final ImmutableList.Builder<String> patterns = ImmutableList.builder();
        private final ImmutableSet.Builder<String> enumNames = ImmutableSet.builder();
        private final ImmutableList.Builder<ScalarType> unionTypes = ImmutableList.builder();
        private String leafrefPath;
        private int fractionDigits;

        private Builder(TypeKind kind) {
            this.kind = checkNotNull(kind);
        }

        public Builder range(long min, long max) {
            return range(BigDecimal.valueOf(min), BigDecimal.valueOf(max));
        }

        public Builder range(BigDecimal min, BigDecimal max) {
            checkArgument(min.compareTo(max) <= 0, "invalid range %s..%s", min, max);
            ranges.add(Range.closed(min, max));
            return this;
        }

        public Builder length(long min, long max) {
            checkArgument(min >= 0 && min <= max, "invalid length %s..%s", min, max);
            lengths.add(Range.closed(BigDecimal.valueOf(min), BigDecimal.valueOf(max)));
            return this;
        }

        public Builder pattern(String pattern) {
            patterns.add(pattern);
            return this;
        }

        public Builder enumNames(String... names) {
            enumNames.add(names);
            return this;
        }

        public Builder unionTypes(ScalarType... members) {
            unionTypes.add(members);
            return this;
        }

        public Builder path(String path) {
            this.leafrefPath = checkNotNull(path);
            return this;
        }

        public Builder fractionDigits(int digits) {
            checkArgument(digits >= 1 && digits <= 18, "fraction-digits must be 1..18, was %s", digits);
            this.fractionDigits = digits;
            return this;
        }

        public ScalarType build() {
            checkState(kind != TypeKind.LEAFREF || leafrefPath != null, "leafref without path");
            ScalarType type = new ScalarType(this);
            checkState(kind != TypeKind.UNION || !type.unionTypes.isEmpty(), "union without member types");
            return type;
        }
    }
}
