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
package org.apache.jackrabbit.yang.fixture;

import org.apache.jackrabbit.yang.api.AbstractYangNode;
import org.apache.jackrabbit.yang.api.NodeType;

public final class Subinterface extends AbstractYangNode {

    public static final NodeType<Subinterface> TYPE = NodeType.builder("Subinterface", Subinterface::new)
            .leaf("index", "config/index|index", Long.class)
            .leaf("description", "config/description", String.class)
            .key("index")
            .build();

    public Subinterface() {
        super(2);
    }

    @Override
    public NodeType<?> getNodeType() {
        return TYPE;
    }

    public Long getIndex() {
        return get(0);
    }

    public void setIndex(Long index) {
        setField(0, index);
    }

    public String getDescription() {
        return get(1);
    }

    public void setDescription(String description) {
        setField(1, description);
    }
}
