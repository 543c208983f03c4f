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
package io.proctor.common.concurrent;

import io.proctor.test.common.AssertExtensions;
import io.proctor.test.common.IntentionalException;
import io.proctor.test.common.ThreadPooledTestSuite;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.val;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

/**
 * Unit tests for the Futures class.
 */
public class FuturesTests extends ThreadPooledTestSuite {
    @Rule
    public Timeout globalTimeout = Timeout.seconds(10);

    @Override
    protected int getThreadPoolSize() {
        return 2;
    }

    /**
     * Tests await(), isSuccessful() and getException().
     */
    @Test
    public void testCompletion() {
        val success = CompletableFuture.completedFuture(1);
        Assert.assertTrue(Futures.await(success));
        Assert.assertNull(Futures.getException(success));

        val failed = Futures.<Integer>failedFuture(new IntentionalException());
        Assert.assertFalse(Futures.await(failed));
        Assert.assertFalse(Futures.isSuccessful(failed));
        Assert.assertTrue("Unexpected exception.", Futures.getException(failed) instanceof IntentionalException);

        val incomplete = new CompletableFuture<Integer>();
        Assert.assertFalse(Futures.isSuccessful(incomplete));
        Assert.assertNull(Futures.getException(incomplete));
    }

    /**
     * Verifies that await() returns, rather than throws, when the future is cancelled while being waited on.
     */
    @Test
    public void testAwaitCancelled() throws Exception {
        val cancelled = new CompletableFuture<Integer>();
        cancelled.cancel(true);
        Assert.assertFalse(Futures.await(cancelled));
        Assert.assertTrue(Futures.getException(cancelled) instanceof CancellationException);

        val pending = new CompletableFuture<Integer>();
        val waiter = CompletableFuture.supplyAsync(() -> Futures.await(pending), executorService());
        Thread.sleep(20);
        pending.cancel(true);
        Assert.assertFalse("await() did not report the cancellation.", waiter.get(5, TimeUnit.SECONDS));
    }

    /**
     * Tests allOf().
     */
    @Test
    public void testAllOf() {
        List<CompletableFuture<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            futures.add(new CompletableFuture<>());
        }

        val all = Futures.allOf(futures);
        for (int i = 0; i < 4; i++) {
            futures.get(i).complete(i);
            Assert.assertFalse("allOf completed before all futures did.", all.isDone());
        }

        futures.get(4).completeExceptionally(new IntentionalException());
        AssertExtensions.assertThrows("allOf did not fail.", all, ex -> ex instanceof IntentionalException);
    }

    /**
     * Tests runInterruptibly() with tasks that complete, fail, or are interrupted by an external cancellation.
     */
    @Test
    public void testRunInterruptibly() throws Exception {
        ExecutorService executor = executorService();
        Futures.runInterruptibly(() -> { }, executor).join();
        AssertExtensions.assertThrows("Task failure not propagated.",
                Futures.runInterruptibly(() -> {
                    throw new IntentionalException();
                }, executor),
                ex -> ex instanceof IntentionalException);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        val running = Futures.runInterruptibly(() -> {
            started.countDown();
            try {
                Thread.sleep(Duration.ofMinutes(1).toMillis());
            } catch (InterruptedException ex) {
                interrupted.countDown();
            }
        }, executor);
        started.await();
        running.cancel(true);
        Assert.assertTrue("Task was not interrupted.", interrupted.await(5, TimeUnit.SECONDS));
    }

    /**
     * Verifies that a rejected task results in a failed future.
     */
    @Test
    public void testRunInterruptiblyRejected() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        AssertExtensions.assertThrows("Rejection not reported.",
                Futures.runInterruptibly(() -> { }, executor),
                ex -> ex instanceof java.util.concurrent.RejectedExecutionException);
    }

    /**
     * Tests futureWithTimeout() when the timeout expires and when the future completes in time.
     */
    @Test
    public void testFutureWithTimeout() {
        val neverCompletes = new CompletableFuture<Integer>();
        val timedOut = Futures.futureWithTimeout(() -> neverCompletes, Duration.ofMillis(20),
                () -> new TimeoutException("tag"), executorService());
        Assert.assertSame(neverCompletes, timedOut);
        AssertExtensions.assertThrows("Future did not time out.", timedOut,
                ex -> ex instanceof TimeoutException && "tag".equals(ex.getMessage()));

        val completes = new CompletableFuture<Integer>();
        val inTime = Futures.futureWithTimeout(() -> completes, Duration.ofMinutes(1),
                IntentionalException::new, executorService());
        completes.complete(5);
        Assert.assertEquals(5, (int) inTime.join());
    }
}
