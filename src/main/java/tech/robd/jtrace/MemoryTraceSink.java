/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/MemoryTraceSink.java
 description: Direct trace sink accumulating bytes in memory; contents remain readable after close.
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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * In-memory direct sink. Useful for capturing trace output in tests or for handing a
 * complete trace to the application after the fact.
 *
 * <p>Once closed (typically because the facility replaced or cleared the channel) the sink rejects
 * writes with {@link #EOF} but still answers {@link #contents()}.</p>
 */
public final class MemoryTraceSink implements TraceSink {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean closed;

    @Override
    public synchronized long write(byte[] buf, int off, int len) {
        Objects.checkFromIndexSize(off, len, buf.length);
        if (closed) return EOF;
        buffer.write(buf, off, len);
        return len;
    }

    @Override
    public long control(SinkCommand command, @Nullable String arg) {
        // nothing is buffered beyond the byte array itself
        return command == SinkCommand.FLUSH ? 1 : CTRL_UNSUPPORTED;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * @return everything written so far, decoded as UTF-8
     */
    public synchronized String contents() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    public synchronized int size() {
        return buffer.size();
    }

    /**
     * Drop accumulated bytes; the sink stays open or closed as it was.
     */
    public synchronized void reset() {
        buffer.reset();
    }
}
