/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/StreamTraceSink.java
 description: Direct trace sink over an OutputStream, with an ownership flag deciding whether close() closes the stream.
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

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Direct sink that forwards trace bytes to an {@link OutputStream}.
 *
 * <p>I/O errors are logged and reported as {@link #EOF}; they never propagate to the traced code.
 * The first failure is logged at WARN, later ones at DEBUG only.</p>
 */
public final class StreamTraceSink implements TraceSink {

    private static final Diagnostics DIAG = Diagnostics.of(StreamTraceSink.class);

    // 🧩 Section: state
    private final OutputStream out;
    private final boolean closeStream;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean failureReported = new AtomicBoolean(false);
    // [/🧩 Section: state]

    // 🧩 Section: construction

    /**
     * @param out         destination stream
     * @param closeStream whether {@link #close()} also closes {@code out}
     */
    public StreamTraceSink(OutputStream out, boolean closeStream) {
        this.out = Objects.requireNonNull(out, "out");
        this.closeStream = closeStream;
    }

    /**
     * Sink owning {@code out}: closing the sink closes the stream.
     */
    public static StreamTraceSink owning(OutputStream out) {
        return new StreamTraceSink(out, true);
    }

    /**
     * Sink over {@code System.err} that leaves the stream open on close.
     */
    public static StreamTraceSink stderr() {
        return new StreamTraceSink(System.err, false);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: io
    @Override
    public long write(byte[] buf, int off, int len) {
        Objects.checkFromIndexSize(off, len, buf.length);
        if (closed.get()) return EOF;
        try {
            out.write(buf, off, len);
            return len;
        } catch (IOException e) {
            reportFailure("write", e);
            return EOF;
        }
    }

    @Override
    public long control(SinkCommand command, @Nullable String arg) {
        if (command != SinkCommand.FLUSH) return CTRL_UNSUPPORTED;
        if (closed.get()) return 0;
        try {
            out.flush();
            return 1;
        } catch (IOException e) {
            reportFailure("flush", e);
            return 0;
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            out.flush();
            if (closeStream) out.close();
        } catch (IOException e) {
            reportFailure("close", e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
    // [/🧩 Section: io]

    private void reportFailure(String op, IOException e) {
        if (failureReported.compareAndSet(false, true)) {
            DIAG.warn("trace sink {} failed, further output may be dropped: {}", op, e.toString());
        } else {
            DIAG.debug("trace sink {} failed again: {}", op, e.toString());
        }
    }
}
