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
package org.apache.jackrabbit.yang.merge;

import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;

import com.google.common.collect.Maps;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.node.YangNodes;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges two data trees of the same type.
 * <p>
 * Fields are merged pairwise:
 * <ul>
 *     <li>leaves and leaf-lists: the source value wins if it is set;</li>
 *     <li>containers: merged recursively if both are set, otherwise the set
 *     one is kept;</li>
 *     <li>lists: the union of the entries, entries with the same key are
 *     merged recursively.</li>
 * </ul>
 * Values taken from the source are deep copies, the source is never
 * modified.
 */
public final class Merger {

    private static final Logger LOG = LoggerFactory.getLogger(Merger.class);

    private Merger() {
    }

    /**
     * Returns the merge of two trees, leaving both unchanged.
     *
     * @param dst the tree to merge into
     * @param src the tree to merge from
     * @param options the options
     * @return a new tree
     * @throws YangException (InvalidArgument) if the trees differ in type
     */
    @NotNull
    public static <T extends YangNode> T merge(@NotNull T dst, @NotNull T src, MergeOption... options)
            throws YangException {
        checkSameType(dst, src);
        T result = YangNodes.copy(dst);
        mergeInto(result, src, options);
        return result;
    }

    /**
     * Merges {@code src} into {@code dst}.
     *
     * @param dst the tree to merge into, modified in place
     * @param src the tree to merge from
     * @param options the options
     * @throws YangException (InvalidArgument) if the trees differ in type
     */
    public static void mergeInto(@NotNull YangNode dst, @NotNull YangNode src, MergeOption... options)
            throws YangException {
        checkSameType(dst, src);
        EnumSet<MergeOption> opts = EnumSet.noneOf(MergeOption.class);
        opts.addAll(Arrays.asList(options));
        mergeNode(dst, src, opts);
    }

    private static void mergeNode(YangNode dst, YangNode src, EnumSet<MergeOption> opts) throws YangException {
        for (FieldDescriptor field : src.getNodeType().getFields()) {
            int index = field.getIndex();
            Object vs = src.getField(index);
            if (vs == null) {
                continue;
            }
            Object vd = dst.getField(index);
            switch (field.getKind()) {
                case CONTAINER:
                    if (vd == null) {
                        dst.setField(index, YangNodes.copyValue(vs));
                    } else {
                        mergeNode((YangNode) vd, (YangNode) vs, opts);
                    }
                    break;
                case LIST:
                    mergeList(dst, field, asMap(vd), asMap(vs), opts);
                    break;
                default:
                    dst.setField(index, YangNodes.copyValue(vs));
                    break;
            }
        }
    }

    private static void mergeList(YangNode dst, FieldDescriptor field, Map<Object, Object> vd, Map<Object, Object> vs,
                                  EnumSet<MergeOption> opts) throws YangException {
        if (vs.isEmpty()) {
            if (vd == null && opts.contains(MergeOption.MERGE_EMPTY_MAPS)) {
                dst.setField(field.getIndex(), Maps.newLinkedHashMap());
            }
            return;
        }
        Map<Object, Object> entries = vd;
        if (entries == null) {
            entries = Maps.newLinkedHashMap();
            dst.setField(field.getIndex(), entries);
        }
        for (Map.Entry<Object, Object> entry : vs.entrySet()) {
            Object existing = entries.get(entry.getKey());
            if (existing == null) {
                entries.put(entry.getKey(), YangNodes.copyValue(entry.getValue()));
            } else {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("merging colliding entry {} of {}", entry.getKey(), field.getName());
                }
                mergeNode((YangNode) existing, (YangNode) entry.getValue(), opts);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> asMap(Object value) {
        return (Map<Object, Object>) value;
    }

    private static void checkSameType(YangNode dst, YangNode src) throws YangException {
        if (dst.getNodeType() != src.getNodeType()) {
            throw new YangException(ARGUMENT, 100, "cannot merge " + src.getNodeType().getName()
                    + " into " + dst.getNodeType().getName());
        }
    }
}
