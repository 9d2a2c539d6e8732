/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/internal/CallbackAdapterSinkTest.java
 description: Callback adapter: DURING writes and failure marker, BEGIN/END control with prefix/suffix bytes, unsupported commands, teardown.
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
package tech.robd.jtrace.internal;

import org.junit.jupiter.api.Test;
import tech.robd.jtrace.CategoryRegistry;
import tech.robd.jtrace.TracePhase;
import tech.robd.jtrace.TraceSink;
import tech.robd.jtrace.TraceSink.SinkCommand;
import tech.robd.jtrace.tools.RecordingCallback;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CallbackAdapterSinkTest {

    private static CallbackAdapterSink adapter(RecordingCallback cb, Object userData) {
        return new CallbackAdapterSink(new CallbackAdapterSink.CallbackContext(cb, CategoryRegistry.TLS, userData));
    }

    @Test
        // write() forwards the exact slice with phase DURING, the registered category and user data.
    void writeForwardsSliceAsDuring() {
        RecordingCallback cb = new RecordingCallback();
        Object token = new Object();
        CallbackAdapterSink sink = adapter(cb, token);

        byte[] buf = "xxhelloyy".getBytes(StandardCharsets.UTF_8);
        assertEquals(5, sink.write(buf, 2, 5));

        List<RecordingCallback.Call> calls = cb.calls();
        assertEquals(1, calls.size());
        RecordingCallback.Call call = calls.get(0);
        assertEquals(TracePhase.DURING, call.phase());
        assertEquals("hello", call.text());
        assertEquals(5, call.length());
        assertEquals(CategoryRegistry.TLS, call.category());
        assertSame(token, call.userData());
    }

    @Test
        // A callback answering 0 marks the write as failed; puts() reports the EOF marker.
    void zeroCountIsFailure() {
        RecordingCallback cb = new RecordingCallback().acceptNothing();
        CallbackAdapterSink sink = adapter(cb, null);

        assertEquals(TraceSink.EOF, sink.write(new byte[]{1, 2}, 0, 2));
        assertEquals(TraceSink.EOF, sink.puts("abc"));
        assertEquals(2, cb.calls().size());
    }

    @Test
        // Negative counts other than EOF are failures too, never "bytes accepted".
    void negativeCountIsFailure() {
        CallbackAdapterSink sink = new CallbackAdapterSink(new CallbackAdapterSink.CallbackContext(
                (buf, len, cat, phase, data) -> -5, CategoryRegistry.ANY, null));

        assertEquals(TraceSink.EOF, sink.write(new byte[]{1, 2, 3}, 0, 3));
        assertEquals(TraceSink.EOF, sink.puts("abc"));
    }

    @Test
        // An oversized count from the callback is clamped to the bytes actually offered.
    void oversizedCountIsClamped() {
        CallbackAdapterSink sink = new CallbackAdapterSink(new CallbackAdapterSink.CallbackContext(
                (buf, len, cat, phase, data) -> 1L << 32, CategoryRegistry.ANY, null));

        assertEquals(1L << 32, sink.write(new byte[]{1}, 0, 1));
        assertEquals(3, sink.puts("abc"));
    }

    @Test
    void putsReturnsAcceptedCount() {
        RecordingCallback cb = new RecordingCallback();
        CallbackAdapterSink sink = adapter(cb, null);

        assertEquals(5, sink.puts("hello"));
        assertEquals("hello", cb.body());
    }

    @Test
        // BEGIN/END carry the prefix/suffix text; a null argument arrives as an empty buffer. Result is always 1.
    void controlBeginEndInvokesCallback() {
        RecordingCallback cb = new RecordingCallback();
        CallbackAdapterSink sink = adapter(cb, null);

        assertEquals(1, sink.control(SinkCommand.BEGIN, "[TRACE]"));
        assertEquals(1, sink.control(SinkCommand.END, null));

        List<RecordingCallback.Call> calls = cb.calls();
        assertEquals(List.of(TracePhase.BEGIN, TracePhase.END), cb.phases());
        assertEquals("[TRACE]", calls.get(0).text());
        assertEquals(7, calls.get(0).length());
        assertEquals("", calls.get(1).text());
        assertEquals(0, calls.get(1).length());
    }

    @Test
    void flushIsUnsupported() {
        RecordingCallback cb = new RecordingCallback();
        CallbackAdapterSink sink = adapter(cb, null);

        assertEquals(TraceSink.CTRL_UNSUPPORTED, sink.control(SinkCommand.FLUSH, null));
        sink.flush();
        assertTrue(cb.calls().isEmpty());
    }

    @Test
        // Teardown is idempotent and silences the callback for good.
    void closeReleasesContext() {
        RecordingCallback cb = new RecordingCallback();
        CallbackAdapterSink sink = adapter(cb, null);
        assertEquals(CategoryRegistry.TLS, sink.category());

        sink.close();
        sink.close();

        assertTrue(sink.isClosed());
        assertEquals(-1, sink.category());
        assertEquals(TraceSink.EOF, sink.puts("late"));
        assertEquals(TraceSink.CTRL_UNSUPPORTED, sink.control(SinkCommand.BEGIN, "p"));
        assertTrue(cb.calls().isEmpty());
    }

    @Test
        // An exception from application code is contained: the write fails, control still reports 1.
    void throwingCallbackIsContained() {
        CallbackAdapterSink sink = new CallbackAdapterSink(new CallbackAdapterSink.CallbackContext(
                (buf, len, cat, phase, data) -> {
                    throw new IllegalStateException("boom");
                }, CategoryRegistry.ANY, null));

        assertEquals(TraceSink.EOF, sink.puts("x"));
        assertEquals(1, sink.control(SinkCommand.BEGIN, "p"));
    }

    @Test
    void contextRequiresCallback() {
        assertThrows(NullPointerException.class,
                () -> new CallbackAdapterSink.CallbackContext(null, CategoryRegistry.ANY, null));
    }
}
