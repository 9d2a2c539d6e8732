/*
 [File Info]
 path: src/main/java/tech/robd/jtrace/CategoryRegistry.java
 description: Static name <-> id table for trace categories. Pure lookup, no mutable state.
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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Registry of trace categories.
 *
 * <p>Category ids are dense integers in {@code [0, COUNT)}. {@link #ANY} is reserved: a category
 * without its own channel falls back to whatever is configured for {@code ANY}.
 * Name lookups are case-insensitive.</p>
 */
public final class CategoryRegistry {

    // 🧩 Section: ids
    public static final int ANY = 0;
    public static final int TRACE = 1;
    public static final int INIT = 2;
    public static final int CONF = 3;
    public static final int TLS = 4;
    public static final int STORE = 5;
    public static final int DECODER = 6;
    public static final int ENCODER = 7;

    /**
     * Number of category slots; valid ids are {@code 0 .. COUNT - 1}.
     */
    public static final int COUNT = 8;
    // [/🧩 Section: ids]

    private record Entry(String name, int id) {
    }

    private static final Entry[] TABLE = {
            new Entry("ANY", ANY),
            new Entry("TRACE", TRACE),
            new Entry("INIT", INIT),
            new Entry("CONF", CONF),
            new Entry("TLS", TLS),
            new Entry("STORE", STORE),
            new Entry("DECODER", DECODER),
            new Entry("ENCODER", ENCODER),
    };

    private CategoryRegistry() {
    }

    // 🧩 Section: lookup

    /**
     * @param id category id
     * @return the registered name, or {@code null} if no category has that id
     */
    public static @Nullable String nameOf(int id) {
        for (Entry e : TABLE) {
            if (e.id() == id) return e.name();
        }
        return null;
    }

    /**
     * @param name category name, any case
     * @return the category id, or {@code -1} if the name is unknown
     */
    public static int idOf(@Nullable String name) {
        if (name == null) return -1;
        for (Entry e : TABLE) {
            if (e.name().equalsIgnoreCase(name)) return e.id();
        }
        return -1;
    }

    public static boolean isValid(int id) {
        return id >= 0 && id < COUNT;
    }

    /**
     * @return registered names in id order
     */
    public static List<String> names() {
        List<String> out = new ArrayList<>(TABLE.length);
        for (Entry e : TABLE) out.add(e.name());
        return Collections.unmodifiableList(out);
    }
    // [/🧩 Section: lookup]
}
