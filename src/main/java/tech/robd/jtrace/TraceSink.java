/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceSink.java
 description: Capability set shared by direct sinks and the callback adapter: write, puts, control, flush, teardown.
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

import java.nio.charset.StandardCharsets;

/**
 * Destination for trace bytes.
 *
 * <p>A sink handed to {@link TraceFacility#setSink(int, TraceSink)} becomes owned by the facility:
 * it is closed when replaced, when cleared, or at shutdown. Write failures are reported through
 * return values only; implementations must not throw from {@link #write}, {@link #control} or
 * {@link #close()} for I/O problems.</p>
 *
 * <p>Between {@link TraceFacility#begin(int)} and {@link TraceFacility#end(int, TraceSink)} callers
 * write the trace body straight to the returned sink.</p>
 */
public interface TraceSink extends AutoCloseable {

    /**
     * Returned by {@link #write} and {@link #puts} when the sink did not accept the data.
     */
    int EOF = -1;

    /**
     * Returned by {@link #control} for commands the sink does not handle.
     */
    long CTRL_UNSUPPORTED = -2;

    /**
     * Control commands understood by sinks.
     */
    enum SinkCommand {
        /** Start of a trace block; argument is the channel prefix (may be null). */
        BEGIN,
        /** End of a trace block; argument is the channel suffix (may be null). */
        END,
        /** Push buffered bytes towards the destination. */
        FLUSH
    }

    /**
     * @param buf source bytes
     * @param off offset into {@code buf}
     * @param len number of bytes
     * @return bytes accepted, or {@link #EOF}
     */
    long write(byte[] buf, int off, int len);

    /**
     * Write {@code text} as UTF-8.
     *
     * @return bytes accepted (never more than the encoded length), or {@link #EOF}
     */
    default int puts(CharSequence text) {
        byte[] bytes = text.toString().getBytes(StandardCharsets.UTF_8);
        long n = write(bytes, 0, bytes.length);
        return n < 0 ? EOF : (int) Math.min(n, bytes.length);
    }

    /**
     * @return a command-specific result, or {@link #CTRL_UNSUPPORTED}
     */
    long control(SinkCommand command, @Nullable String arg);

    default void flush() {
        control(SinkCommand.FLUSH, null);
    }

    /**
     * Release the sink. Idempotent.
     */
    @Override
    void close();
}
