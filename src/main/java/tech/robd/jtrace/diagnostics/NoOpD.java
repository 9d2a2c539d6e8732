/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/diagnostics/NoOpD.java
 description: No-op Diagnostics implementation. Singleton enum that drops every level.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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
 * Diagnostics that drop every message, warn and error included.
 * Returned by {@link Diagnostics#noop()}; useful in tests that provoke failures on purpose.
 */
enum NoOpD implements Diagnostics {
    INSTANCE;

    @Override
    public Class<?> owner() {
        return Diagnostics.class;
    }

    @Override
    public void debug(String msg, @Nullable Object... args) {
    }

    @Override
    public void info(String msg, @Nullable Object... args) {
    }

    @Override
    public void warn(String msg, @Nullable Object... args) {
    }

    @Override
    public void error(String msg, @Nullable Object... args) {
    }
}
