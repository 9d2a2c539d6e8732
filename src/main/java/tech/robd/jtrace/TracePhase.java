/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TracePhase.java
 description: Phases reported to an application trace callback.
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

package tech.robd.jtrace;

/**
 * Phase of a trace block as seen by a {@link TraceCallback}.
 *
 * <p>For one block the callback observes {@code BEGIN}, then zero or more {@code DURING},
 * then {@code END}.</p>
 */
public enum TracePhase {
    /** Block opened; buffer holds the channel prefix, possibly empty. */
    BEGIN,
    /** Body chunk; the callback returns the number of bytes it accepted. */
    DURING,
    /** Block closed; buffer holds the channel suffix, possibly empty. */
    END
}
