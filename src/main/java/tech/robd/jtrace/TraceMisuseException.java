/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceMisuseException.java
 description: Thrown in strict mode when a caller breaks the begin/end protocol.
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

/**
 * Signals a broken begin/end bracket: {@code end} without an open block, {@code end} with a handle
 * other than the active one, {@code end} from a thread that does not hold the block, or a nested
 * {@code begin} on the thread that already holds it.
 *
 * <p>Only thrown when {@link TraceSettings#strictMisuse()} is on; otherwise the same condition is
 * logged and counted. In both cases the lock state is left untouched.</p>
 */
public final class TraceMisuseException extends IllegalStateException {

    // [🧩 Section: api]
    public TraceMisuseException(String message) {
        super(message);
    }

    public static TraceMisuseException forCategory(String what, int category) {
        return new TraceMisuseException(what + " (category " + category + "/"
                + CategoryRegistry.nameOf(category) + ")");
    }
    // [/🧩 Section: api]
}
