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

/**
 * Options of {@link JsonEncoder} and {@link JsonDecoder}.
 */
public enum JsonOption {

    /**
     * Members that match no field are dropped instead of failing the decode.
     */
    IGNORE_EXTRA_FIELDS,

    /**
     * Members that match the shadow path of a field are accepted and dropped.
     */
    ACCEPT_SHADOW_PATHS,

    /**
     * Fields that have shadow paths are read from and written to those, their
     * primary paths are ignored.
     */
    PREFER_SHADOW_PATH,

    /**
     * Member names are qualified with the module name where the module
     * differs from the module of the parent node.
     */
    PREPEND_MODULE_NAMES
}
