/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceCallback.java
 description: Application-supplied trace destination invoked per phase of a trace block.
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

import org.jspecify.annotations.Nullable;

/**
 * Application function that receives trace output.
 *
 * <p>Register with {@link TraceFacility#setCallback(int, TraceCallback, Object)}. The facility wraps it
 * in a sink and calls it for every phase of a trace block. The return value only matters for
 * {@link TracePhase#DURING}: returning {@code 0} marks the chunk as not accepted.</p>
 *
 * <p>Calls for one block are made while the facility's exclusive lock is held, so an implementation
 * must not open another trace block from inside the callback.</p>
 */
@FunctionalInterface
public interface TraceCallback {

    /**
     * @param buffer   bytes for this phase; never null, may be empty
     * @param length   number of valid bytes in {@code buffer}
     * @param category category the callback was registered for
     * @param phase    block phase
     * @param userData opaque object passed at registration
     * @return bytes accepted (DURING); ignored for BEGIN/END
     */
    long onTrace(byte[] buffer, int length, int category, TracePhase phase, @Nullable Object userData);
}
