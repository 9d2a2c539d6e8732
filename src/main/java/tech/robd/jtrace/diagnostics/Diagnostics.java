/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade bound to an owner class. Forwards to DiagnosticsBackend,
              with factories for active/dynamic/noop behavior.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jtrace.diagnostics;

import org.jspecify.annotations.Nullable;

/**
 * Minimal diagnostics facade used by the trace facility for its own housekeeping messages
 * (reconfiguration, sink failures, protocol misuse).
 * <p>
 * Factories control behavior:
 * <ul>
 *   <li>{@link #of(Class)} – quiet instance when debug diagnostics are globally disabled;
 *       warn/error still reach SLF4J.</li>
 *   <li>{@link #dynamic(Class)} – always active instance; backend flag checked per call.</li>
 *   <li>{@link #noop()} – explicit no-op instance, drops every level.</li>
 * </ul>
 */
@FunctionalInterface
public interface Diagnostics {

    /**
     * @return the owner class used to pick the SLF4J logger
     */
    Class<?> owner();

    // 🧩 Section: forwarding
    default void debug(String msg, @Nullable Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    default void info(String msg, @Nullable Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    default void warn(String msg, @Nullable Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    default void error(String msg, @Nullable Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}. When the backend is disabled the
     * instance skips debug/info without touching the backend but keeps warn/error.
     *
     * @param owner the owning class
     * @return active or quiet diagnostics depending on backend state
     */
    static Diagnostics of(Class<?> owner) {
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : new QuietD(owner);
    }

    /**
     * Create a diagnostics instance that always delegates, checking enablement per call.
     *
     * @param owner the owning class
     * @return an active diagnostics instance
     */
    static Diagnostics dynamic(Class<?> owner) {
        return new ActiveD(owner);
    }

    /**
     * @return a diagnostics instance that drops everything
     */
    static Diagnostics noop() {
        return NoOpD.INSTANCE;
    }
    // [/🧩 Section: factories]
}
