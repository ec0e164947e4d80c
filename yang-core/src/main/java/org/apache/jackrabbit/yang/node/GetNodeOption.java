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
package org.apache.jackrabbit.yang.node;

/**
 * Options of {@link NodeNavigator#getNode}.
 */
public enum GetNodeOption {

    /**
     * Key values missing from a list path element match any entry, and all
     * matching entries are returned. Implies {@link #HANDLE_WILDCARDS}.
     */
    PARTIAL_KEY_MATCH,

    /**
     * The key value {@code *} matches any entry.
     */
    HANDLE_WILDCARDS,

    /**
     * An unset node on the path, or a list without a matching entry, yields
     * no match instead of a PathNotFound error.
     */
    TOLERATE_NIL
}
