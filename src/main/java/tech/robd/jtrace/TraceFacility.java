/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/TraceFacility.java
 description: Entry point of the trace facility. Owns the channel table and the trace session, exposes
              configuration, begin/end, scoped blocks and the init/shutdown lifecycle.
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
import tech.robd.jtrace.internal.ChannelTable;
import tech.robd.jtrace.internal.TraceSession;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Category-scoped diagnostic tracing for the host library.
 *
 * <p>The application decides where each category's output goes: a direct {@link TraceSink}, or a
 * {@link TraceCallback} wrapped in an internal sink. Categories without their own channel fall back
 * to {@link CategoryRegistry#ANY}. Trace call sites bracket each message:</p>
 *
 * <pre>{@code
 * TraceSink out = trace.begin(CategoryRegistry.INIT);
 * if (out != null) {
 *     try {
 *         out.puts("loaded " + n + " providers");
 *     } finally {
 *         trace.end(CategoryRegistry.INIT, out);
 *     }
 * }
 * }</pre>
 *
 * <p>or use {@link #open(int)} / {@link #trace(int, Consumer)} for the scoped form.</p>
 *
 * <h3>Threading</h3>
 * <ul>
 *   <li>Trace blocks are fully serialized across all threads and categories: prefix, body and suffix
 *       of one block never interleave with another block.</li>
 *   <li>Configuration ({@code setSink}, {@code setCallback}, {@code setPrefix}, {@code setSuffix}) is
 *       <em>not</em> synchronized with emission. Configure during setup, before tracing threads run,
 *       or during teardown after they stop.</li>
 *   <li>{@link #shutdown()} must run once with no begin/end or configuration calls in flight.</li>
 * </ul>
 */
public final class TraceFacility implements AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(TraceFacility.class);

    // 🧩 Section: state
    private final ChannelTable channels;
    private final TraceSession session;
    private final TraceSettings settings;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    // [/🧩 Section: state]

    private TraceFacility(ChannelTable channels, TraceSettings settings) {
        this.channels = channels;
        this.settings = settings;
        this.session = new TraceSession(channels, settings.strictMisuse());
    }

    // 🧩 Section: lifecycle

    /**
     * Initialise with settings read from system properties.
     */
    public static TraceFacility init() {
        return init(TraceSettings.fromSystemProperties());
    }

    /**
     * Initialise with explicit settings.
     *
     * @throws IllegalStateException if the facility could not be set up
     */
    public static TraceFacility init(TraceSettings settings) {
        return init(settings, new ChannelTable());
    }

    static TraceFacility init(TraceSettings settings, ChannelTable channels) {
        Objects.requireNonNull(settings, "settings");
        TraceFacility facility;
        try {
            facility = new TraceFacility(channels, settings);
        } catch (RuntimeException e) {
            throw new IllegalStateException("trace facility could not be initialised", e);
        }
        for (int category : settings.stderrCategories()) {
            facility.setSink(category, StreamTraceSink.stderr());
        }
        DIAG.debug("trace facility initialised: {}", settings);
        return facility;
    }

    /**
     * Clear every channel, closing all sinks and dropping prefix/suffix text. Runs once; later calls
     * do nothing. Afterwards {@link #begin(int)} returns {@code null} and configuration fails.
     */
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        if (session.isOpen()) {
            DIAG.warn("trace facility shut down while a trace block is open (category {})",
                    session.activeCategory());
        }
        channels.clearAll();
        DIAG.debug("trace facility shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public TraceSettings settings() {
        return settings;
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: configuration

    /**
     * Route {@code category} to {@code sink}, which the facility now owns. The previous sink of the
     * category is closed. {@code null} clears the channel.
     *
     * @return {@code false} for an out-of-range category or after shutdown
     */
    public boolean setSink(int category, @Nullable TraceSink sink) {
        if (shutdown.get()) return false;
        return channels.setSink(category, sink);
    }

    /**
     * Route {@code category} to {@code callback}. The previous sink of the category is closed.
     * {@code null} clears the channel.
     *
     * @return {@code false} for an out-of-range category, after shutdown, or when the callback sink
     * could not be built (the category is then left disabled)
     */
    public boolean setCallback(int category, @Nullable TraceCallback callback, @Nullable Object userData) {
        if (shutdown.get()) return false;
        return channels.setCallback(category, callback, userData);
    }

    public boolean setPrefix(int category, @Nullable CharSequence prefix) {
        if (shutdown.get()) return false;
        return channels.setPrefix(category, prefix);
    }

    public boolean setSuffix(int category, @Nullable CharSequence suffix) {
        if (shutdown.get()) return false;
        return channels.setSuffix(category, suffix);
    }
    // [/🧩 Section: configuration]

    // 🧩 Section: emission

    /**
     * @return whether a trace block for {@code category} would produce output
     */
    public boolean enabled(int category) {
        return channels.enabled(category);
    }

    /**
     * Open a trace block. Blocks while another thread has one open.
     *
     * @return the sink to write to, or {@code null} if tracing is disabled for the category;
     * on {@code null} skip both the body and {@link #end(int, TraceSink)}
     */
    public @Nullable TraceSink begin(int category) {
        return session.begin(category);
    }

    /**
     * Close the block opened by {@link #begin(int)}, emitting the suffix and releasing the lock.
     */
    public void end(int category, @Nullable TraceSink sink) {
        session.end(category, sink);
    }

    /**
     * Scoped variant of {@link #begin(int)}; closing the block calls {@link #end(int, TraceSink)}.
     */
    public TraceBlock open(int category) {
        return new TraceBlock(this, category, session.begin(category));
    }

    /**
     * Run {@code body} inside a trace block, only when tracing is enabled for {@code category}.
     *
     * @return {@code true} if the body ran
     */
    public boolean trace(int category, Consumer<? super TraceSink> body) {
        Objects.requireNonNull(body, "body");
        try (TraceBlock block = open(category)) {
            TraceSink sink = block.sink();
            if (sink == null) return false;
            body.accept(sink);
            return true;
        }
    }
    // [/🧩 Section: emission]

    // 🧩 Section: registry
    public @Nullable String nameOf(int category) {
        return CategoryRegistry.nameOf(category);
    }

    public int idOf(@Nullable String name) {
        return CategoryRegistry.idOf(name);
    }
    // [/🧩 Section: registry]

    // 🧩 Section: introspection
    public boolean isBlockOpen() {
        return session.isOpen();
    }

    /**
     * @return number of begin/end protocol violations seen so far
     */
    public long misuseCount() {
        return session.misuseCount();
    }
    // [/🧩 Section: introspection]
}
