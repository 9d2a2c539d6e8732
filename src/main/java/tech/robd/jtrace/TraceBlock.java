/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceBlock.java
 description: Scoped begin/end bracket for try-with-resources; close() ends the block exactly once.
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
 * A trace block opened by {@link TraceFacility#open(int)}.
 *
 * <pre>{@code
 * try (TraceBlock b = trace.open(CategoryRegistry.TLS)) {
 *     if (b.isEnabled()) {
 *         b.puts("cipher list: " + ciphers);
 *     }
 * }
 * }</pre>
 *
 * <p>Closing releases the facility's exclusive lock on every exit path, exceptions included.
 * Not thread-safe; the block belongs to the thread that opened it.</p>
 */
public final class TraceBlock implements AutoCloseable {

    private final TraceFacility facility;
    private final int category;
    private @Nullable TraceSink sink;

    TraceBlock(TraceFacility facility, int category, @Nullable TraceSink sink) {
        this.facility = facility;
        this.category = category;
        this.sink = sink;
    }

    public int category() {
        return category;
    }

    /**
     * @return the sink for the body, or {@code null} when tracing is disabled or the block is closed
     */
    public @Nullable TraceSink sink() {
        return sink;
    }

    public boolean isEnabled() {
        return sink != null;
    }

    /**
     * Write {@code text} to the block's sink; does nothing when disabled.
     *
     * @return bytes accepted, 0 when disabled, or {@link TraceSink#EOF}
     */
    public int puts(CharSequence text) {
        TraceSink s = sink;
        return s == null ? 0 : s.puts(text);
    }

    @Override
    public void close() {
        TraceSink s = sink;
        if (s == null) return;
        sink = null;
        facility.end(category, s);
    }
}
