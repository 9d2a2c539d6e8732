/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceSettings.java
 description: Immutable facility settings: strict misuse handling and categories routed to stderr at init.
              Read from system properties `jtrace.strict` / `jtrace.stderr` or built programmatically.
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

package tech.robd.jtrace;

import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/**
 * Settings applied by {@link TraceFacility#init(TraceSettings)}.
 *
 * <ul>
 *   <li>{@code jtrace.strict} – {@code true} turns protocol misuse into {@link TraceMisuseException}.</li>
 *   <li>{@code jtrace.stderr} – comma-separated category names that get a {@code System.err} sink at init.
 *       Unknown names are logged and skipped.</li>
 * </ul>
 */
public final class TraceSettings {

    private static final Diagnostics DIAG = Diagnostics.of(TraceSettings.class);

    public static final String STRICT_PROPERTY_NAME = "jtrace.strict";
    public static final String STDERR_PROPERTY_NAME = "jtrace.stderr";

    private static final TraceSettings DEFAULTS = new Builder().build();

    // 🧩 Section: state
    private final boolean strictMisuse;
    private final Set<Integer> stderrCategories;
    // [/🧩 Section: state]

    private TraceSettings(Builder b) {
        this.strictMisuse = b.strictMisuse;
        this.stderrCategories = Collections.unmodifiableSet(new LinkedHashSet<>(b.stderrCategories));
    }

    // 🧩 Section: factories
    public static TraceSettings defaults() {
        return DEFAULTS;
    }

    public static TraceSettings fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Read settings from {@code props} using the {@code jtrace.*} keys.
     */
    public static TraceSettings fromProperties(Properties props) {
        Builder b = builder();
        b.strictMisuse("true".equalsIgnoreCase(props.getProperty(STRICT_PROPERTY_NAME, "false").trim()));
        b.stderrCategories(props.getProperty(STDERR_PROPERTY_NAME));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }
    // [/🧩 Section: factories]

    // 🧩 Section: accessors
    public boolean strictMisuse() {
        return strictMisuse;
    }

    /**
     * @return category ids to route to {@code System.err}, in the order given
     */
    public Set<Integer> stderrCategories() {
        return stderrCategories;
    }
    // [/🧩 Section: accessors]

    @Override
    public String toString() {
        return "TraceSettings[strict=" + strictMisuse + ", stderr=" + stderrCategories + "]";
    }

    // 🧩 Section: builder
    public static final class Builder {
        private boolean strictMisuse;
        private final Set<Integer> stderrCategories = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder strictMisuse(boolean strict) {
            this.strictMisuse = strict;
            return this;
        }

        public Builder stderrCategory(int category) {
            if (CategoryRegistry.isValid(category)) {
                stderrCategories.add(category);
            } else {
                DIAG.warn("ignoring out-of-range trace category {}", category);
            }
            return this;
        }

        /**
         * Add categories from a comma-separated list of names; blank or {@code null} adds nothing.
         */
        public Builder stderrCategories(@Nullable String names) {
            if (names == null || names.isBlank()) return this;
            for (String raw : names.split(",")) {
                String name = raw.trim();
                if (name.isEmpty()) continue;
                int id = CategoryRegistry.idOf(name);
                if (id < 0) {
                    DIAG.warn("ignoring unknown trace category '{}' in {}", name, STDERR_PROPERTY_NAME);
                    continue;
                }
                stderrCategories.add(id);
            }
            return this;
        }

        public TraceSettings build() {
            return new TraceSettings(this);
        }
    }
    // [/🧩 Section: builder]
}
