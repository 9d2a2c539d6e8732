/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/StreamTraceSinkTest.java
 description: Direct sinks: stream forwarding, close ownership flag, I/O failures reported as EOF, memory sink behavior after close.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class StreamTraceSinkTest {

    private static final class TrackingStream extends ByteArrayOutputStream {
        final AtomicBoolean closed = new AtomicBoolean(false);
        final AtomicInteger flushes = new AtomicInteger();

        @Override
        public void flush() {
            flushes.incrementAndGet();
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    private static final class BrokenStream extends OutputStream {
        @Override
        public void write(int b) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            throw new IOException("disk full");
        }

        @Override
        public void flush() throws IOException {
            throw new IOException("disk full");
        }
    }

    @Test
    void writesAndFlushesThrough() {
        TrackingStream out = new TrackingStream();
        StreamTraceSink sink = StreamTraceSink.owning(out);

        assertEquals(5, sink.puts("hello"));
        assertEquals(3, sink.write("xabcx".getBytes(StandardCharsets.UTF_8), 1, 3));
        assertEquals(1, sink.control(TraceSink.SinkCommand.FLUSH, null));
        assertEquals(TraceSink.CTRL_UNSUPPORTED, sink.control(TraceSink.SinkCommand.BEGIN, "p"));

        assertEquals("helloabc", out.toString(StandardCharsets.UTF_8));
        assertEquals(1, out.flushes.get());
    }

    @Test
        // Owning sinks close the stream; non-owning ones only flush it. Both reject writes afterwards.
    void closeHonoursOwnership() {
        TrackingStream owned = new TrackingStream();
        TrackingStream borrowed = new TrackingStream();
        StreamTraceSink a = StreamTraceSink.owning(owned);
        StreamTraceSink b = new StreamTraceSink(borrowed, false);

        a.close();
        a.close();
        b.close();

        assertTrue(owned.closed.get());
        assertFalse(borrowed.closed.get());
        assertEquals(1, borrowed.flushes.get());
        assertTrue(a.isClosed());
        assertEquals(TraceSink.EOF, a.puts("late"));
        assertEquals(TraceSink.EOF, b.puts("late"));
    }

    @Test
        // I/O failures never escape; they are reported as EOF / 0.
    void ioFailureIsReportedNotThrown() {
        StreamTraceSink sink = StreamTraceSink.owning(new BrokenStream());

        assertEquals(TraceSink.EOF, sink.puts("x"));
        assertEquals(TraceSink.EOF, sink.write(new byte[4], 0, 4));
        assertEquals(0, sink.control(TraceSink.SinkCommand.FLUSH, null));
        assertDoesNotThrow(sink::flush);
        assertDoesNotThrow(sink::close);
    }

    @Test
    void rejectsBadRange() {
        StreamTraceSink sink = StreamTraceSink.owning(new TrackingStream());
        assertThrows(IndexOutOfBoundsException.class, () -> sink.write(new byte[2], 1, 5));
        assertThrows(NullPointerException.class, () -> new StreamTraceSink(null, true));
    }

    @Test
    void stderrSinkDoesNotCloseSystemErr() {
        StreamTraceSink sink = StreamTraceSink.stderr();
        sink.close();
        assertTrue(sink.isClosed());
        assertFalse(System.err.checkError());
    }

    @Test
        // Memory sink keeps its contents after close but refuses new bytes.
    void memorySinkKeepsContents() {
        MemoryTraceSink sink = new MemoryTraceSink();
        sink.puts("héllo");
        assertEquals("héllo", sink.contents());
        assertEquals(6, sink.size());

        sink.close();
        assertEquals(TraceSink.EOF, sink.puts("more"));
        assertEquals("héllo", sink.contents());

        sink.reset();
        assertEquals(0, sink.size());
        assertEquals(1, sink.control(TraceSink.SinkCommand.FLUSH, null));
        assertEquals(TraceSink.CTRL_UNSUPPORTED, sink.control(TraceSink.SinkCommand.END, null));
    }
}
