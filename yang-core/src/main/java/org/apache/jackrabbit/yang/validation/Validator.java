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

import static java.lang.String.format;
import static org.apache.jackrabbit.yang.api.YangException.CONSTRAINT;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.PathElement;
import org.apache.jackrabbit.yang.api.Scalars;
import org.apache.jackrabbit.yang.api.TreePath;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.schema.LeafrefResolver;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.apache.jackrabbit.yang.value.ScalarChecks;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a data tree against its schema.
 * <p>
 * Validation does not stop at the first problem: every violation found in
 * the tree is reported. The checks are
 * <ul>
 *     <li>every field has a schema entry;</li>
 *     <li>the key fields of each list entry equal its key in the list;</li>
 *     <li>the number of list and leaf-list elements is within
 *     {@code min-elements} and {@code max-elements};</li>
 *     <li>leaf values satisfy the ranges, lengths, patterns, enumeration
 *     names and union members of their type;</li>
 *     <li>leaf-list elements are unique;</li>
 *     <li>leafref values exist at their target in the tree, if the tree is
 *     validated from the schema root.</li>
 * </ul>
 */
public final class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private Validator() {
    }

    /**
     * Validates a tree.
     *
     * @param schema the schema entry of {@code root}
     * @param root the tree
     * @param options the options
     * @return the violations, empty if the tree is valid. ConstraintViolation
     *         errors for invalid data, SchemaMismatch errors where the tree
     *         does not fit the schema
     */
    @NotNull
    public static List<YangException> validate(@NotNull SchemaEntry schema, @NotNull YangNode root,
                                               ValidationOption... options) {
        List<YangException> errors = Lists.newArrayList();
        List<LeafrefChecker.Reference> references = Lists.newArrayList();
        validateNode(schema, root, TreePath.EMPTY, errors, references);

        boolean ignoreMissing = Arrays.asList(options).contains(ValidationOption.IGNORE_MISSING_DATA);
        if (!ignoreMissing && schema.getParent() == null) {
            new LeafrefChecker(schema, root).check(references, errors);
        } else if (LOG.isDebugEnabled()) {
            LOG.debug("skipping {} leafref checks below {}", references.size(), schema.getName());
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("validation of {} found {} violations", root.getNodeType(), errors.size());
        }
        return errors;
    }

    private static void validateNode(SchemaEntry schema, YangNode node, TreePath path, List<YangException> errors,
                                     List<LeafrefChecker.Reference> references) {
        for (FieldDescriptor field : node.getNodeType().getFields()) {
            SchemaEntry fieldSchema;
            TreePath fieldPath;
            try {
                fieldSchema = SchemaPaths.requireChildSchema(schema, field);
                fieldPath = path.concat(TreePath.ofNames(SchemaPaths.canonicalDataPath(field)));
            } catch (YangException e) {
                errors.add(e);
                continue;
            }
            Object value = node.getField(field.getIndex());
            switch (field.getKind()) {
                case CONTAINER:
                    if (value != null) {
                        validateNode(fieldSchema, (YangNode) value, fieldPath, errors, references);
                    }
                    break;
                case LIST:
                    Map<?, ?> entries = value == null ? Collections.emptyMap() : (Map<?, ?>) value;
                    checkElements(fieldSchema, fieldPath, entries.size(), errors);
                    for (Map.Entry<?, ?> entry : entries.entrySet()) {
                        YangNode child = (YangNode) entry.getValue();
                        NodeType<?> entryType = field.getChildType();
                        TreePath entryPath = fieldPath.replaceLast(
                                PathElement.of(fieldPath.getLast().getName(), entryType.keyValues(child)));
                        checkKey(entryType, entry.getKey(), child, entryPath, errors);
                        validateNode(fieldSchema, child, entryPath, errors, references);
                    }
                    break;
                case LEAF_LIST:
                    List<?> elements = value == null ? Collections.emptyList() : (List<?>) value;
                    checkElements(fieldSchema, fieldPath, elements.size(), errors);
                    Set<String> seen = Sets.newHashSet();
                    for (Object element : elements) {
                        if (!seen.add(Scalars.asString(element))) {
                            errors.add(new YangException(CONSTRAINT, 110, format("%s: duplicate leaf-list value %s",
                                    fieldPath, Scalars.asString(element))));
                        }
                        checkScalar(fieldSchema, fieldPath, element, errors, references);
                    }
                    break;
                default:
                    if (value != null) {
                        checkScalar(fieldSchema, fieldPath, value, errors, references);
                    }
                    break;
            }
        }
    }

    private static void checkKey(NodeType<?> entryType, Object mapKey, YangNode entry, TreePath path,
                                 List<YangException> errors) {
        Map<String, Object> components;
        try {
            components = entryType.keyComponents(mapKey);
        } catch (IllegalArgumentException e) {
            errors.add(new YangException(CONSTRAINT, 111, format("%s: invalid key %s: %s", path, mapKey,
                    e.getMessage()), e));
            return;
        }
        for (FieldDescriptor keyField : entryType.getKeyFields()) {
            Object expected = components.get(keyField.getLeafName());
            Object actual = entry.getField(keyField.getIndex());
            if (!Scalars.valueEquals(expected, actual)) {
                errors.add(new YangException(CONSTRAINT, 112, format("%s: key field %s has value %s,"
                        + " but the entry is stored under key %s", path, keyField.getName(), actual, mapKey)));
            }
        }
    }

    private static void checkElements(SchemaEntry schema, TreePath path, int count, List<YangException> errors) {
        if (count < schema.getMinElements()) {
            errors.add(new YangException(CONSTRAINT, 113, format("%s: %d elements, at least %d required",
                    path, count, schema.getMinElements())));
        }
        if (count > schema.getMaxElements()) {
            errors.add(new YangException(CONSTRAINT, 114, format("%s: %d elements, at most %d allowed",
                    path, count, schema.getMaxElements())));
        }
    }

    private static void checkScalar(SchemaEntry leafSchema, TreePath path, Object value, List<YangException> errors,
                                    List<LeafrefChecker.Reference> references) {
        SchemaEntry resolved;
        try {
            resolved = LeafrefResolver.resolve(leafSchema);
        } catch (YangException e) {
            errors.add(e);
            return;
        }
        ScalarType type = resolved.getType();
        if (type == null) {
            errors.add(new YangException(YangException.SCHEMA, 115, format("%s: schema node %s has no type",
                    path, resolved.getPath())));
            return;
        }
        String violation = ScalarChecks.check(type, value);
        if (violation != null) {
            errors.add(new YangException(CONSTRAINT, 116, format("%s: %s", path, violation)));
        }
        if (leafSchema.getType() != null && leafSchema.getType().isLeafref()) {
            references.add(new LeafrefChecker.Reference(leafSchema, path, value));
        }
    }
}
