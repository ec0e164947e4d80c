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
package org.apache.jackrabbit.yang.json;

import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.io.BaseEncoding;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.Scalars;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.schema.LeafrefResolver;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.apache.jackrabbit.yang.value.ScalarChecks;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Renders data trees as RFC 7951 JSON.
 * <p>
 * A field is written under each of its path alternatives, so a compressed
 * tree renders as the uncompressed document. Shadow paths are written
 * instead of the primary paths with {@link JsonOption#PREFER_SHADOW_PATH}.
 * Unset fields are omitted.
 */
public final class JsonEncoder {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private JsonEncoder() {
    }

    /**
     * Renders a node.
     *
     * @param schema the schema entry of the node
     * @param node the node
     * @param options the options
     * @return the JSON object
     * @throws YangException (SchemaMismatch) if the node does not fit the
     *         schema; (InvalidArgument) if a leaf value cannot be rendered
     */
    @NotNull
    public static ObjectNode encode(@NotNull SchemaEntry schema, @NotNull YangNode node, JsonOption... options)
            throws YangException {
        EnumSet<JsonOption> opts = EnumSet.noneOf(JsonOption.class);
        opts.addAll(Arrays.asList(options));
        ObjectNode json = FACTORY.objectNode();
        encodeInto(schema, node, json, opts);
        return json;
    }

    /**
     * Renders a node as a JSON string.
     */
    @NotNull
    public static String toJson(@NotNull SchemaEntry schema, @NotNull YangNode node, JsonOption... options)
            throws YangException {
        ObjectNode json = encode(schema, node, options);
        try {
            return WRITER.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new YangException(YangException.INTERNAL, 60, "cannot serialize JSON of " + schema, e);
        }
    }

    /**
     * Renders a single leaf value of a resolved type.
     */
    @NotNull
    public static JsonNode encodeScalar(@NotNull ScalarType type, @NotNull Object value) throws YangException {
        switch (type.getKind()) {
            case STRING:
            case ENUMERATION:
                return FACTORY.textNode(Scalars.asString(value));
            case BOOLEAN:
                return FACTORY.booleanNode((Boolean) value);
            case EMPTY:
                return FACTORY.arrayNode().addNull();
            case BINARY:
                return FACTORY.textNode(BaseEncoding.base64().encode((byte[]) value));
            case UNION:
                for (ScalarType member : type.getUnionTypes()) {
                    if (!member.isLeafref() && ScalarChecks.check(member, value) == null) {
                        return encodeScalar(member, value);
                    }
                }
                throw new YangException(ARGUMENT, 61, "value " + Scalars.asString(value)
                        + " matches no member of " + type);
            case LEAFREF:
                throw new YangException(YangException.SCHEMA, 62, "unresolved leafref type " + type);
            default:
                if (type.getKind().isQuotedNumber()) {
                    return FACTORY.textNode(Scalars.asString(value));
                }
                if (value instanceof BigInteger) {
                    return FACTORY.numberNode((BigInteger) value);
                }
                if (value instanceof Number) {
                    return FACTORY.numberNode(((Number) value).longValue());
                }
                throw new YangException(ARGUMENT, 63, "cannot render " + value + " as " + type);
        }
    }

    private static void encodeInto(SchemaEntry schema, YangNode node, ObjectNode json, EnumSet<JsonOption> opts)
            throws YangException {
        for (FieldDescriptor field : node.getNodeType().getFields()) {
            Object value = node.getField(field.getIndex());
            if (value == null) {
                continue;
            }
            SchemaEntry fieldSchema = SchemaPaths.requireChildSchema(schema, field);
            List<List<String>> paths = SchemaPaths.dataPaths(field);
            if (opts.contains(JsonOption.PREFER_SHADOW_PATH) && !field.getShadowPaths().isEmpty()) {
                paths = SchemaPaths.shadowDataPaths(field);
            }
            for (List<String> path : paths) {
                ObjectNode parent = json;
                SchemaEntry entry = schema;
                for (int i = 0; i < path.size(); i++) {
                    SchemaEntry child = entry == null ? null : SchemaPaths.findChild(entry, path.get(i));
                    String name = memberName(child, path.get(i), opts);
                    if (i == path.size() - 1) {
                        parent.set(name, encodeField(fieldSchema, field, value, opts));
                    } else {
                        JsonNode existing = parent.get(name);
                        parent = existing instanceof ObjectNode ? (ObjectNode) existing : parent.putObject(name);
                    }
                    entry = child;
                }
            }
        }
    }

    private static JsonNode encodeField(SchemaEntry fieldSchema, FieldDescriptor field, Object value,
                                        EnumSet<JsonOption> opts) throws YangException {
        switch (field.getKind()) {
            case CONTAINER:
                ObjectNode child = FACTORY.objectNode();
                encodeInto(fieldSchema, (YangNode) value, child, opts);
                return child;
            case LIST:
                ArrayNode entries = FACTORY.arrayNode();
                for (Object entry : ((Map<?, ?>) value).values()) {
                    ObjectNode element = entries.addObject();
                    encodeInto(fieldSchema, (YangNode) entry, element, opts);
                }
                return entries;
            case LEAF_LIST:
                ScalarType elementType = leafType(fieldSchema);
                ArrayNode elements = FACTORY.arrayNode();
                for (Object element : (List<?>) value) {
                    elements.add(encodeScalar(elementType, element));
                }
                return elements;
            default:
                return encodeScalar(leafType(fieldSchema), value);
        }
    }

    private static ScalarType leafType(SchemaEntry leafSchema) throws YangException {
        SchemaEntry resolved = LeafrefResolver.resolve(leafSchema);
        if (resolved.getType() == null) {
            throw new YangException(YangException.SCHEMA, 64, "schema node " + resolved.getPath() + " has no type");
        }
        return resolved.getType();
    }

    private static String memberName(@Nullable SchemaEntry child, String name, EnumSet<JsonOption> opts) {
        if (!opts.contains(JsonOption.PREPEND_MODULE_NAMES) || child == null || child.getModule() == null) {
            return name;
        }
        SchemaEntry dataParent = SchemaPaths.dataParent(child);
        String parentModule = dataParent == null ? null : dataParent.getModule();
        return child.getModule().equals(parentModule) ? name : child.getModule() + ":" + name;
    }
}
