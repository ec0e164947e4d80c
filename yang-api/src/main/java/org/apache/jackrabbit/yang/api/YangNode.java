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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The capability every generated container and list entry type provides to
 * the generic algorithms: its static field table and access to field values
 * by index.
 * <p>
 * Field values are {@code null} if unset. Depending on
 * {@link FieldDescriptor#getKind()} a value is a scalar, a {@code List} of
 * scalars, a {@code YangNode}, or a {@code Map} from list key to
 * {@code YangNode}.
 */
public interface YangNode {

    @NotNull
    NodeType<?> getNodeType();

    @Nullable
    Object getField(int index);

    void setField(int index, @Nullable Object value);
}
