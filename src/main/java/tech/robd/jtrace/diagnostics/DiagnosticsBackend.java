/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/diagnostics/DiagnosticsBackend.java
 description: Internal diagnostics backend that forwards to SLF4J (LocationAwareLogger when available).
              Debug/info gated by system property `jtrace.diag`; warn/error always forwarded.
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Internal diagnostics backend that delegates to SLF4J.
 *
 * <p>Debug and info output is switched by the system property {@code jtrace.diag}
 * (default {@code false}) or programmatically via {@link #enable()}/{@link #disable()}.
 * Warn and error output is always forwarded: those levels report sink failures and
 * caller misuse of the trace protocol, and must reach the host's log even when
 * library diagnostics are off.
 *
 * <p>Trace payloads never pass through here; they go to trace sinks only.
 */
public final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQClassName = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * System property to enable debug diagnostics: {@code -Djtrace.diag=true}.
     */
    public static final String DIAGNOSTICS_PROPERTY_NAME = "jtrace.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(
                    System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim()
            );
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
        // no instances
    }

    // 🧩 Section: enablement
    public static void enable() {
        enabled = true;
    }

    public static void disable() {
        enabled = false;
    }

    public static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, @Nullable Object... args) {
        if (!enabled) return; // fast path
        emit(owner, LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void info(Class<?> owner, String msg, @Nullable Object... args) {
        if (!enabled) return; // fast path
        emit(owner, LocationAwareLogger.INFO_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, @Nullable Object... args) {
        emit(owner, LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, @Nullable Object... args) {
        emit(owner, LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void emit(Class<?> owner, int level, String msg, @Nullable Object[] args) {
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
        // 🧩 Point: emitters/location-aware
        if (log instanceof LocationAwareLogger law) {
            law.log(null, FQClassName, level, msg, args, null);
            return;
        }
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> log.debug(msg, args);
            case LocationAwareLogger.INFO_INT -> log.info(msg, args);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, args);
            default -> log.error(msg, args);
        }
    }
    // [/🧩 Section: emitters]
}
