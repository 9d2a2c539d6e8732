/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/internal/ChannelTable.java
 description: Per-category channel configuration (sink, mode, prefix, suffix) with ANY fallback resolution.
              Owns its sinks: replacement and clearing close the previous sink first.
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
import tech.robd.jtrace.CategoryRegistry;
import tech.robd.jtrace.TraceCallback;
import tech.robd.jtrace.TraceSink;
import tech.robd.jtrace.diagnostics.Diagnostics;

import java.util.Objects;
import java.util.function.Function;

/**
 * One channel per trace category.
 *
 * <p>Each channel exclusively owns its sink and its prefix/suffix text. Setting a new sink always
 * closes the previous one before the new one is stored, so a category never has two live sinks.</p>
 *
 * <p><strong>Threading:</strong> mutators are meant for single-threaded setup and teardown. They are
 * not serialized with trace emission; reconfiguring a category while a trace block on it is open
 * gives no ordering guarantee. Fields are volatile so readers see whole references only.</p>
 */
public final class ChannelTable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ChannelTable.class);
    // [/🧩 Section: diagnostics]

    /**
     * How the channel's sink is driven at block boundaries.
     */
    public enum Mode {
        /** Prefix/suffix written as text followed by a newline. */
        DIRECT,
        /** Prefix/suffix delivered via {@code control(BEGIN|END, text)}. */
        CALLBACK
    }

    private static final class Channel {
        volatile Mode mode = Mode.DIRECT;
        volatile @Nullable TraceSink sink;
        volatile @Nullable String prefix;
        volatile @Nullable String suffix;
    }

    // 🧩 Section: state
    private final Channel[] channels = new Channel[CategoryRegistry.COUNT];
    private final Function<CallbackAdapterSink.CallbackContext, ? extends TraceSink> adapterFactory;
    // [/🧩 Section: state]

    public ChannelTable() {
        this(CallbackAdapterSink::new);
    }

    /**
     * @param adapterFactory builds the sink wrapping a registered callback
     */
    public ChannelTable(Function<CallbackAdapterSink.CallbackContext, ? extends TraceSink> adapterFactory) {
        this.adapterFactory = Objects.requireNonNull(adapterFactory, "adapterFactory");
        for (int i = 0; i < channels.length; i++) channels[i] = new Channel();
    }

    // 🧩 Section: sinks

    /**
     * Install a direct sink, closing the previous one. {@code null} clears the channel.
     *
     * @return {@code false} only for an out-of-range category (nothing changes)
     */
    public boolean setSink(int category, @Nullable TraceSink sink) {
        if (!CategoryRegistry.isValid(category)) return false;
        Channel ch = channels[category];
        if (sink != null && ch.sink == sink) {
            // already owned here; closing it would leave a dead sink installed
            ch.mode = Mode.DIRECT;
            return true;
        }
        release(ch, category);
        if (sink == null) return true;

        ch.mode = Mode.DIRECT;
        ch.sink = sink;
        DIAG.debug("category {} -> direct sink {}", category, sink.getClass().getSimpleName());
        return true;
    }

    /**
     * Install a callback, closing the previous sink. {@code null} clears the channel.
     *
     * <p>If the adapter cannot be built the call returns {@code false} and the category stays
     * cleared: the previous sink has already been released and is not restored.</p>
     */
    public boolean setCallback(int category, @Nullable TraceCallback callback, @Nullable Object userData) {
        if (!CategoryRegistry.isValid(category)) return false;
        Channel ch = channels[category];
        release(ch, category);
        if (callback == null) return true;

        TraceSink adapter = null;
        try {
            adapter = adapterFactory.apply(new CallbackAdapterSink.CallbackContext(callback, category, userData));
            if (adapter == null) {
                DIAG.warn("no callback sink produced for category {}; channel left disabled", category);
                return false;
            }
        } catch (RuntimeException e) {
            DIAG.warn("could not build callback sink for category {}: {}", category, e.toString());
            return false;
        }

        ch.mode = Mode.CALLBACK;
        ch.sink = adapter;
        DIAG.debug("category {} -> callback sink", category);
        return true;
    }

    private static void release(Channel ch, int category) {
        TraceSink prev = ch.sink;
        if (prev == null) return;
        ch.sink = null;
        try {
            prev.close();
        } catch (RuntimeException e) {
            DIAG.warn("closing sink of category {} failed: {}", category, e.toString());
        }
    }
    // [/🧩 Section: sinks]

    // 🧩 Section: text

    /**
     * Replace the prefix emitted at block start. {@code null} clears it.
     */
    public boolean setPrefix(int category, @Nullable CharSequence prefix) {
        if (!CategoryRegistry.isValid(category)) return false;
        Channel ch = channels[category];
        ch.prefix = null;
        if (prefix != null) ch.prefix = prefix.toString();
        return true;
    }

    /**
     * Replace the suffix emitted at block end. {@code null} clears it.
     */
    public boolean setSuffix(int category, @Nullable CharSequence suffix) {
        if (!CategoryRegistry.isValid(category)) return false;
        Channel ch = channels[category];
        ch.suffix = null;
        if (suffix != null) ch.suffix = suffix.toString();
        return true;
    }
    // [/🧩 Section: text]

    // 🧩 Section: resolution

    /**
     * @return {@code category} if it has a sink, {@link CategoryRegistry#ANY} if it does not,
     * or -1 when out of range
     */
    public int resolve(int category) {
        if (!CategoryRegistry.isValid(category)) return -1;
        if (channels[category].sink != null) return category;
        return CategoryRegistry.ANY;
    }

    public boolean enabled(int category) {
        int resolved = resolve(category);
        return resolved >= 0 && channels[resolved].sink != null;
    }

    public @Nullable TraceSink sink(int category) {
        return CategoryRegistry.isValid(category) ? channels[category].sink : null;
    }

    public Mode mode(int category) {
        return CategoryRegistry.isValid(category) ? channels[category].mode : Mode.DIRECT;
    }

    public @Nullable String prefix(int category) {
        return CategoryRegistry.isValid(category) ? channels[category].prefix : null;
    }

    public @Nullable String suffix(int category) {
        return CategoryRegistry.isValid(category) ? channels[category].suffix : null;
    }
    // [/🧩 Section: resolution]

    /**
     * Close every sink and drop all prefix/suffix text.
     */
    public void clearAll() {
        for (int c = 0; c < channels.length; c++) {
            setSink(c, null);
            setPrefix(c, null);
            setSuffix(c, null);
        }
    }
}
