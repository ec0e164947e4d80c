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
package org.apache.jackrabbit.yang.commons;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * TraceContext is a simple wrapper around a slf4j Logger which indents
 * trace statements according to the nesting depth of a recursive
 * traversal.
 * <p>
 * Usage:
 * <ul>
 * <li>TraceContext trace = TraceContext.forLogger(LOG);</li>
 * <li>try (TraceContext.Scope scope = trace.enter("container {}", name)) {</li>
 * <li>.. recursive call passing trace ..</li>
 * <li>}</li>
 * </ul>
 * <p>
 * A context is created per top level call and passed down explicitly. It
 * is not thread-safe and must not be shared between concurrent calls. All
 * methods return quickly if TRACE is not enabled for the delegate.
 */
public final class TraceContext {

    private static final String INDENT = "  ";

    /** The logger to which the trace statements are emitted **/
    private final Logger delegate;

    private int depth;

    private TraceContext(Logger delegate) {
        this.delegate = checkNotNull(delegate, "delegate must not be null");
    }

    @NotNull
    public static TraceContext forLogger(@NotNull Logger delegate) {
        return new TraceContext(delegate);
    }

    public boolean isEnabled() {
        return delegate.isTraceEnabled();
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Emits a trace statement at the current indentation.
     */
    public void trace(String format, Object... args) {
        if (delegate.isTraceEnabled()) {
            delegate.trace(Strings.repeat(INDENT, depth) + format, args);
        }
    }

    /**
     * Emits a trace statement and increments the indentation until the
     * returned scope is closed.
     */
    @NotNull
    public Scope enter(String format, Object... args) {
        trace(format, args);
        depth++;
        return new Scope(depth);
    }

    /**
     * An indentation level. Closing a scope restores the indentation that
     * was current when it was entered.
     */
    public final class Scope implements AutoCloseable {

        private final int level;

        private Scope(int level) {
            this.level = level;
        }

        @Override
        public void close() {
            depth = level - 1;
        }
    }
}
