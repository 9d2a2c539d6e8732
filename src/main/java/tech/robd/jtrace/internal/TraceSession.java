/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/internal/TraceSession.java
 description: Begin/end protocol for trace blocks: resolves the effective category, holds the process-wide
              exclusive lock for the block, emits prefix/suffix and rejects mismatched end calls.
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

package tech.robd.jtrace.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.jtrace.TraceMisuseException;
import tech.robd.jtrace.TraceSink;
import tech.robd.jtrace.TraceSink.SinkCommand;
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-state machine (idle / open) guarding trace blocks.
 *
 * <p>At most one block is open at any instant across all categories and threads. {@link #begin(int)}
 * blocks until the single exclusive lock is free; the matching {@link #end(int, TraceSink)} releases
 * it. There is no timeout: a thread that never calls {@code end} stalls every other tracer, so call
 * sites should bracket with try/finally or use the scoped block on the facility.</p>
 *
 * <p>Misuse ({@code end} without an open block, with a foreign handle, from a thread that does not
 * hold the block, or a nested {@code begin}) never touches the lock. It is logged at ERROR, counted,
 * and in strict mode thrown as {@link TraceMisuseException}.</p>
 */
public final class TraceSession {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(TraceSession.class);
    // [/🧩 Section: diagnostics]

    private static final String NEWLINE = "\n";

    // 🧩 Section: state
    private final ChannelTable channels;
    private final boolean strictMisuse;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong misuseCount = new AtomicLong();

    // written only by the lock holder
    private volatile @Nullable TraceSink active;
    private volatile int activeCategory = -1;
    // [/🧩 Section: state]

    public TraceSession(ChannelTable channels, boolean strictMisuse) {
        this.channels = Objects.requireNonNull(channels, "channels");
        this.strictMisuse = strictMisuse;
    }

    // 🧩 Section: begin

    /**
     * Open a trace block for {@code category}.
     *
     * @return the sink to write the body to, or {@code null} when tracing is disabled for the
     * category; in that case nothing was locked and {@code end} need not be called
     */
    public @Nullable TraceSink begin(int category) {
        int resolved = channels.resolve(category);
        if (resolved < 0) return null;
        TraceSink sink = channels.sink(resolved);
        if (sink == null) return null;

        if (lock.isHeldByCurrentThread()) {
            misuse("begin while this thread already holds an open trace block", category);
            return null;
        }

        // 🧩 Point: begin/acquire
        lock.lock();
        active = sink;
        activeCategory = resolved;

        // 🧩 Point: begin/prefix
        emitBoundary(sink, channels.mode(resolved), SinkCommand.BEGIN, channels.prefix(resolved), resolved);
        return sink;
    }
    // [/🧩 Section: begin]

    // 🧩 Section: end

    /**
     * Close the block opened by {@link #begin(int)}. A {@code null} handle is the disabled path and
     * does nothing.
     */
    public void end(int category, @Nullable TraceSink handle) {
        int resolved = channels.resolve(category);
        String suffix = resolved < 0 ? null : channels.suffix(resolved);
        ChannelTable.Mode mode = resolved < 0 ? ChannelTable.Mode.DIRECT : channels.mode(resolved);

        if (handle == null) return;

        // 🧩 Point: end/validate
        if (!lock.isHeldByCurrentThread()) {
            misuse(active == null
                    ? "end without an open trace block"
                    : "end from a thread that does not hold the open trace block", category);
            return;
        }
        if (handle != active) {
            misuse("end with a sink that is not the active trace block's sink", category);
            return;
        }

        // 🧩 Point: end/suffix-and-release
        try {
            try {
                handle.flush();
            } catch (RuntimeException e) {
                DIAG.warn("flush of trace sink for category {} failed: {}", category, e.toString());
            }
            emitBoundary(handle, mode, SinkCommand.END, suffix, category);
        } finally {
            active = null;
            activeCategory = -1;
            lock.unlock();
        }
    }
    // [/🧩 Section: end]

    // 🧩 Section: emission
    private static void emitBoundary(TraceSink sink, ChannelTable.Mode mode, SinkCommand command,
                                     @Nullable String text, int category) {
        try {
            switch (mode) {
                case DIRECT -> {
                    if (text != null) {
                        sink.puts(text);
                        sink.puts(NEWLINE);
                    }
                }
                case CALLBACK -> sink.control(command, text);
            }
        } catch (RuntimeException e) {
            // sink output is best-effort; the lock protocol must carry on
            DIAG.warn("trace sink for category {} failed on {}: {}", category, command, e.toString());
        }
    }
    // [/🧩 Section: emission]

    // 🧩 Section: misuse
    private void misuse(String what, int category) {
        long n = misuseCount.incrementAndGet();
        DIAG.error("trace protocol misuse #{}: {} (category {}, thread {})",
                n, what, category, Thread.currentThread().getName());
        if (strictMisuse) {
            throw TraceMisuseException.forCategory(what, category);
        }
    }
    // [/🧩 Section: misuse]

    // 🧩 Section: introspection
    public boolean isOpen() {
        return active != null;
    }

    public @Nullable TraceSink activeSink() {
        return active;
    }

    /**
     * @return resolved category of the open block, or -1 when idle
     */
    public int activeCategory() {
        return activeCategory;
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public long misuseCount() {
        return misuseCount.get();
    }
    // [/🧩 Section: introspection]
}
