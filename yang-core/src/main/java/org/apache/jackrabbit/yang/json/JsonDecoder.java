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

import static java.lang.String.format;
import static org.apache.jackrabbit.yang.api.YangException.ARGUMENT;

import java.io.IOException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.apache.jackrabbit.yang.api.FieldDescriptor;
import org.apache.jackrabbit.yang.api.NodeType;
import org.apache.jackrabbit.yang.api.YangException;
import org.apache.jackrabbit.yang.api.YangNode;
import org.apache.jackrabbit.yang.api.schema.ScalarType;
import org.apache.jackrabbit.yang.api.schema.SchemaEntry;
import org.apache.jackrabbit.yang.api.schema.TypeKind;
import org.apache.jackrabbit.yang.commons.PathUtils;
import org.apache.jackrabbit.yang.schema.LeafrefResolver;
import org.apache.jackrabbit.yang.schema.SchemaPaths;
import org.apache.jackrabbit.yang.value.ScalarChecks;
import org.apache.jackrabbit.yang.value.ScalarCodec;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads RFC 7951 JSON into data trees.
 * <p>
 * Member names are matched with or without module prefix. Every path
 * alternative of a field is read, so both compressed and uncompressed
 * documents decode. Members that match no field fail the decode unless
 * {@link JsonOption#IGNORE_EXTRA_FIELDS} is given; see {@link JsonOption}
 * for the handling of shadow paths.
 */
public final class JsonDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDecoder.class);

    private static final Joiner SLASH = Joiner.on('/');

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonDecoder() {
    }

    /**
     * Parses a JSON document.
     *
     * @throws YangException (InvalidArgument) if the text is not valid JSON
     */
    @NotNull
    public static JsonNode parse(@NotNull String json) throws YangException {
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new YangException(ARGUMENT, 70, "invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes a JSON object into a new node.
     *
     * @param schema the schema entry of the node
     * @param type the type of the node
     * @param json the JSON object
     * @param options the options
     * @return the node
     * @throws YangException (InvalidArgument) if the document does not fit
     *         the type; (SchemaMismatch) if the type does not fit the schema
     */
    @NotNull
    public static <T extends YangNode> T unmarshal(@NotNull SchemaEntry schema, @NotNull NodeType<T> type,
                                                   @NotNull JsonNode json, JsonOption... options)
            throws YangException {
        T node = type.newInstance();
        unmarshalInto(schema, node, json, options);
        return node;
    }

    /**
     * Decodes a JSON object into an existing node. Fields present in the
     * document replace the values of the node, other fields are kept.
     */
    public static void unmarshalInto(@NotNull SchemaEntry schema, @NotNull YangNode node, @NotNull JsonNode json,
                                     JsonOption... options) throws YangException {
        EnumSet<JsonOption> opts = EnumSet.noneOf(JsonOption.class);
        opts.addAll(Arrays.asList(options));
        decodeInto(schema, node, json, opts);
    }

    /**
     * Decodes the JSON value of a leaf or leaf-list field.
     *
     * @param leafSchema the schema entry of the leaf; leafrefs are resolved
     * @param field the field
     * @param json the value, an array for leaf-lists
     * @return the value in the representation of the field
     * @throws YangException (InvalidArgument) if the value does not fit the type
     */
    @NotNull
    public static Object decodeLeaf(@NotNull SchemaEntry leafSchema, @NotNull FieldDescriptor field,
                                    @NotNull JsonNode json) throws YangException {
        SchemaEntry resolved = LeafrefResolver.resolve(leafSchema);
        ScalarType type = resolved.getType();
        if (type == null) {
            throw new YangException(YangException.SCHEMA, 71, "schema node " + resolved.getPath() + " has no type");
        }
        if (field.isLeafList()) {
            if (!json.isArray()) {
                throw new YangException(ARGUMENT, 72, "array expected for leaf-list " + field.getName()
                        + ", got " + json);
            }
            List<Object> values = Lists.newArrayList();
            for (JsonNode element : json) {
                values.add(decodeScalar(field.getValueType(), type, element));
            }
            return values;
        }
        return decodeScalar(field.getValueType(), type, json);
    }

    private static void decodeInto(SchemaEntry schema, YangNode node, JsonNode json, EnumSet<JsonOption> opts)
            throws YangException {
        if (!json.isObject()) {
            throw new YangException(ARGUMENT, 73, format("JSON object expected for %s, got %s",
                    schema.getName(), json.getNodeType()));
        }
        Set<String> handled = Sets.newHashSet();
        for (FieldDescriptor field : node.getNodeType().getFields()) {
            SchemaEntry fieldSchema = SchemaPaths.requireChildSchema(schema, field);
            List<List<String>> read = SchemaPaths.dataPaths(field);
            List<List<String>> dropped = SchemaPaths.shadowDataPaths(field);
            boolean dropAccepted = opts.contains(JsonOption.ACCEPT_SHADOW_PATHS);
            if (opts.contains(JsonOption.PREFER_SHADOW_PATH) && !dropped.isEmpty()) {
                List<List<String>> primary = read;
                read = dropped;
                dropped = primary;
                dropAccepted = true;
            }
            for (List<String> path : read) {
                JsonNode member = lookup(json, path);
                if (member == null) {
                    continue;
                }
                handled.add(SLASH.join(path));
                if (!member.isNull()) {
                    node.setField(field.getIndex(), decodeField(fieldSchema, field, member, opts));
                }
            }
            for (List<String> path : dropped) {
                if (lookup(json, path) == null) {
                    continue;
                }
                if (!dropAccepted && !opts.contains(JsonOption.IGNORE_EXTRA_FIELDS)) {
                    throw new YangException(ARGUMENT, 74, format("shadow path %s of field %s in %s is not accepted",
                            SLASH.join(path), field.getName(), schema.getName()));
                }
                LOG.trace("dropping {} of field {}", path, field.getName());
                handled.add(SLASH.join(path));
            }
        }
        checkUnknown(schema, json, "", handled, opts);
    }

    private static Object decodeField(SchemaEntry fieldSchema, FieldDescriptor field, JsonNode member,
                                      EnumSet<JsonOption> opts) throws YangException {
        switch (field.getKind()) {
            case CONTAINER:
                YangNode child = field.getChildType().newInstance();
                decodeInto(fieldSchema, child, member, opts);
                return child;
            case LIST:
                if (!member.isArray()) {
                    throw new YangException(ARGUMENT, 75, "array expected for list " + fieldSchema.getName()
                            + ", got " + member.getNodeType());
                }
                NodeType<?> entryType = field.getChildType();
                Map<Object, Object> entries = Maps.newLinkedHashMap();
                for (JsonNode element : member) {
                    YangNode entry = entryType.newInstance();
                    decodeInto(fieldSchema, entry, element, opts);
                    Object key = entryType.keyOf(entry);
                    if (key == null || entryType.keyValues(entry).size() < entryType.getKeyFields().size()) {
                        throw new YangException(ARGUMENT, 76, "entry of list " + fieldSchema.getName()
                                + " has no complete key: " + element);
                    }
                    if (entries.put(key, entry) != null) {
                        throw new YangException(ARGUMENT, 77, "duplicate key " + key + " in list "
                                + fieldSchema.getName());
                    }
                }
                return entries;
            default:
                return decodeLeaf(fieldSchema, field, member);
        }
    }

    private static Object decodeScalar(Class<?> javaType, ScalarType type, JsonNode json) throws YangException {
        if (type.getKind() == TypeKind.EMPTY) {
            if (json.isArray() && json.size() == 1 && json.get(0).isNull()) {
                return Boolean.TRUE;
            }
            throw new YangException(ARGUMENT, 78, "[null] expected for empty leaf, got " + json);
        }
        if (type.getKind() == TypeKind.UNION) {
            for (ScalarType member : type.getUnionTypes()) {
                if (member.isLeafref()) {
                    continue;
                }
                try {
                    Object value = decodeScalar(javaType, member, json);
                    if (ScalarChecks.check(member, value) == null) {
                        return value;
                    }
                } catch (YangException e) {
                    LOG.trace("{} is not a {}", json, member);
                }
            }
            throw new YangException(ARGUMENT, 79, json + " does not match any member of " + type);
        }
        Object value;
        if (json.isTextual()) {
            value = json.textValue();
        } else if (json.isIntegralNumber()) {
            value = json.bigIntegerValue();
        } else if (json.isNumber()) {
            value = json.decimalValue();
        } else if (json.isBoolean()) {
            value = json.booleanValue();
        } else {
            throw new YangException(ARGUMENT, 80, "cannot decode " + json.getNodeType() + " " + json
                    + " as " + type);
        }
        return ScalarCodec.decode(javaType, type, value);
    }

    /**
     * Looks up the member at a path of local names. Member names may carry a
     * module prefix.
     */
    private static JsonNode lookup(JsonNode json, List<String> path) {
        JsonNode current = json;
        for (String name : path) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = member(current, name);
        }
        return current;
    }

    private static JsonNode member(JsonNode object, String localName) {
        JsonNode exact = object.get(localName);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (localName.equals(PathUtils.stripModulePrefix(field.getKey()))) {
                return field.getValue();
            }
        }
        return null;
    }

    private static void checkUnknown(SchemaEntry schema, JsonNode json, String prefix, Set<String> handled,
                                     EnumSet<JsonOption> opts) throws YangException {
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String local = PathUtils.stripModulePrefix(field.getKey());
            String path = prefix.isEmpty() ? local : prefix + "/" + local;
            if (handled.contains(path)) {
                continue;
            }
            if (field.getValue().isObject() && isAncestor(path, handled)) {
                checkUnknown(schema, field.getValue(), path, handled, opts);
            } else if (opts.contains(JsonOption.IGNORE_EXTRA_FIELDS)) {
                LOG.debug("ignoring unknown member {} of {}", path, schema.getName());
            } else {
                throw new YangException(ARGUMENT, 81, format("unknown member %s in JSON of %s",
                        path, schema.getName()));
            }
        }
    }

    private static boolean isAncestor(String path, Set<String> handled) {
        String prefix = path + "/";
        for (String candidate : handled) {
            if (candidate.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
