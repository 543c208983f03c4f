/**
 * Copyright Proctor Authors.
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
package io.proctor.test.common;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import org.junit.Assert;

/**
 * Additional assertions that are not part of JUnit's Assert.
 */
public class AssertExtensions {
    /**
     * Asserts that the given code throws an exception that matches the given tester. CompletionExceptions and
     * ExecutionExceptions are unwrapped before testing.
     *
     * @param message  The message to include in the Assert calls.
     * @param runnable The code to run.
     * @param tester   A predicate that indicates whether the exception (if thrown) is as expected.
     */
    public static void assertThrows(String message, RunnableWithException runnable, Predicate<Throwable> tester) {
        try {
            runnable.run();
            Assert.fail(message + " No exception has been thrown.");
        } catch (Exception ex) {
            Throwable real = getRealException(ex);
            if (!tester.test(real)) {
                Assert.fail(message + " Exception thrown was of unexpected type: " + real);
            }
        }
    }

    /**
     * Asserts that the given future fails with an exception that matches the given tester.
     *
     * @param message The message to include in the Assert calls.
     * @param future  The future to wait on.
     * @param tester  A predicate that indicates whether the exception (if thrown) is as expected.
     * @param <T>     The type of the future's result.
     */
    public static <T> void assertThrows(String message, CompletableFuture<T> future, Predicate<Throwable> tester) {
        assertThrows(message, (RunnableWithException) future::join, tester);
    }

    /**
     * Waits until the given condition becomes true, checking it periodically, or fails once the timeout expires.
     *
     * @param message   The message to include in the Assert calls.
     * @param condition The condition to evaluate.
     * @param timeout   The maximum amount of time to wait.
     * @throws InterruptedException If interrupted while waiting.
     */
    public static void assertEventually(String message, BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assert.fail(message + " Condition not met within " + timeout.toMillis() + "ms.");
            }

            Thread.sleep(10);
        }
    }

    public static void assertLessThanOrEqual(String message, long smaller, long larger) {
        Assert.assertTrue(String.format("%s Expected: less than or equal to %d. Actual: %d.", message, larger, smaller), smaller <= larger);
    }

    public static void assertGreaterThanOrEqual(String message, long larger, long smaller) {
        Assert.assertTrue(String.format("%s Expected: greater than or equal to %d. Actual: %d.", message, smaller, larger), larger >= smaller);
    }

    private static Throwable getRealException(Throwable ex) {
        if ((ex instanceof CompletionException || ex instanceof ExecutionException) && ex.getCause() != null) {
            return getRealException(ex.getCause());
        }

        return ex;
    }

    public interface RunnableWithException {
        void run() throws Exception;
    }
}
