/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/internal/CallbackAdapterSink.java
 description: TraceSink that forwards body writes and BEGIN/END control events to an application TraceCallback.
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
import tech.robd.jtrace.TraceCallback;
import tech.robd.jtrace.TracePhase;
import tech.robd.jtrace.TraceSink;
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sink that adapts a {@link TraceCallback} to the {@link TraceSink} capability set.
 *
 * <ul>
 *   <li>{@link #write} calls back with {@link TracePhase#DURING}; a returned count of 0 or less is a failed write.</li>
 *   <li>{@link #control} maps {@code BEGIN}/{@code END} to the matching phase, passing the prefix or
 *       suffix bytes, ignores the callback's count and returns 1. Anything else is unsupported.</li>
 *   <li>{@link #close()} drops the owned {@link CallbackContext}; the callback is never invoked again.</li>
 * </ul>
 *
 * <p>An exception escaping the callback is logged and treated as a failed call.</p>
 */
public final class CallbackAdapterSink implements TraceSink {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CallbackAdapterSink.class);
    // [/🧩 Section: diagnostics]

    private static final byte[] EMPTY = new byte[0];

    /**
     * Callback registration owned by one adapter.
     */
    public record CallbackContext(TraceCallback callback, int category, @Nullable Object userData) {
        public CallbackContext {
            Objects.requireNonNull(callback, "callback");
        }
    }

    // 🧩 Section: state
    private final AtomicReference<@Nullable CallbackContext> context;
    // [/🧩 Section: state]

    public CallbackAdapterSink(CallbackContext context) {
        this.context = new AtomicReference<>(Objects.requireNonNull(context, "context"));
    }

    // 🧩 Section: io
    @Override
    public long write(byte[] buf, int off, int len) {
        Objects.checkFromIndexSize(off, len, buf.length);
        CallbackContext ctx = context.get();
        if (ctx == null) return EOF;

        byte[] chunk = (off == 0 && len == buf.length) ? buf : Arrays.copyOfRange(buf, off, off + len);
        long cnt = invoke(ctx, chunk, len, TracePhase.DURING);
        return cnt > 0 ? cnt : EOF;
    }

    @Override
    public long control(SinkCommand command, @Nullable String arg) {
        CallbackContext ctx = context.get();
        if (ctx == null) return CTRL_UNSUPPORTED;

        TracePhase phase;
        switch (command) {
            case BEGIN -> phase = TracePhase.BEGIN;
            case END -> phase = TracePhase.END;
            default -> {
                return CTRL_UNSUPPORTED;
            }
        }
        byte[] text = arg == null ? EMPTY : arg.getBytes(StandardCharsets.UTF_8);
        // callbacks usually answer 0 here; the count carries no meaning for BEGIN/END
        invoke(ctx, text, text.length, phase);
        return 1;
    }

    @Override
    public void close() {
        CallbackContext old = context.getAndSet(null);
        if (old != null) {
            DIAG.debug("callback sink for category {} torn down", old.category());
        }
    }

    public boolean isClosed() {
        return context.get() == null;
    }

    /**
     * @return the category the wrapped callback was registered for, or -1 after teardown
     */
    public int category() {
        CallbackContext ctx = context.get();
        return ctx == null ? -1 : ctx.category();
    }
    // [/🧩 Section: io]

    private static long invoke(CallbackContext ctx, byte[] buf, int len, TracePhase phase) {
        try {
            return ctx.callback().onTrace(buf, len, ctx.category(), phase, ctx.userData());
        } catch (RuntimeException e) {
            DIAG.warn("trace callback for category {} failed in {}: {}", ctx.category(), phase, e.toString());
            return 0;
        }
    }
}
