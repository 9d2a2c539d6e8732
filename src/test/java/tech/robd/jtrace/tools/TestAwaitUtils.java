/*
 [File Info]
 path: src/test/java/tech/robd/jtrace/tools/TestAwaitUtils.java
 description: Deterministic wait helpers for concurrent tests: latch await, condition polling, thread join.
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
package tech.robd.jtrace.tools;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a boolean condition until true or timeout (fails the test on timeout).
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, long stepMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(stepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while polling: " + msg);
            }
        }
        fail(msg);
    }

    /**
     * Await a CountDownLatch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Wait for a thread to reach the given state (e.g. WAITING on the trace lock).
     */
    public static void awaitState(Thread t, Thread.State state, long timeoutMs) {
        awaitTrue(() -> t.getState() == state, timeoutMs, 2,
                "thread " + t.getName() + " did not reach " + state + " (was " + t.getState() + ")");
    }

    /**
     * Join a thread or fail if it is still alive after the timeout.
     */
    public static void join(Thread t, long timeoutMs) {
        try {
            t.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while joining " + t.getName());
        }
        assertTrue(!t.isAlive(), "thread " + t.getName() + " still alive after " + timeoutMs + "ms");
    }
}
