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

import com.google.common.base.Preconditions;
import io.proctor.common.Exceptions;
import io.proctor.common.function.RunnableWithException;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Extensions to Future and CompletableFuture.
 */
public final class Futures {

    //region Completion

    /**
     * Waits for the provided future to be complete, and returns true if it was successful, false otherwise.
     *
     * @param f   The future to wait for.
     * @param <T> The Type of the future's result.
     * @return True if the provided CompletableFuture is complete and successful.
     */
    public static <T> boolean await(CompletableFuture<T> f) {
        Exceptions.handleInterrupted(() -> {
            try {
                f.get();
            } catch (ExecutionException | CancellationException e) {
                // Not handled here; inspect the future instead.
            }
        });
        return isSuccessful(f);
    }

    /**
     * Returns true if the future is done and successful.
     *
     * @param f   The future to inspect.
     * @param <T> The Type of the future's result.
     * @return True if the given CompletableFuture has completed successfully.
     */
    public static <T> boolean isSuccessful(CompletableFuture<T> f) {
        return f.isDone() && !f.isCompletedExceptionally() && !f.isCancelled();
    }

    /**
     * If the future has failed returns the exception that caused it. Otherwise returns null.
     *
     * @param <T>    The Type of the future's result.
     * @param future The future to inspect.
     * @return null or the exception that caused the Future to fail.
     */
    public static <T> Throwable getException(CompletableFuture<T> future) {
        try {
            future.getNow(null);
            return null;
        } catch (Exception e) {
            return Exceptions.unwrap(e);
        }
    }

    /**
     * Creates a new CompletableFuture that is failed with the given exception.
     *
     * @param exception The exception to fail the CompletableFuture.
     * @param <T>       The Type of the future's result.
     * @return A CompletableFuture that fails with the given exception.
     */
    public static <T> CompletableFuture<T> failedFuture(Throwable exception) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(exception);
        return result;
    }

    /**
     * Similar implementation to CompletableFuture.allOf(vararg) but that works on a Collection.
     *
     * @param futures A Collection of CompletableFutures to wait on.
     * @param <T>     The type of the results items.
     * @return A new CompletableFuture that is completed when all of the given CompletableFutures complete.
     */
    public static <T> CompletableFuture<Void> allOf(Collection<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[futures.size()]));
    }

    //endregion

    //region Execution

    /**
     * Executes the given task on the given ExecutorService and returns a CompletableFuture that tracks it. Unlike
     * {@link CompletableFuture#runAsync}, completing or cancelling the returned future before the task finishes
     * (for example through a timeout or a {@link CancellationToken}) interrupts the thread running the task.
     *
     * @param task     The task to execute.
     * @param executor The ExecutorService to execute the task on.
     * @return A CompletableFuture that completes when the task completes, or fails with the exception thrown by the task.
     */
    public static CompletableFuture<Void> runInterruptibly(RunnableWithException task, ExecutorService executor) {
        Preconditions.checkNotNull(task, "task");
        CompletableFuture<Void> result = new CompletableFuture<>();
        AtomicBoolean finished = new AtomicBoolean(false);
        Future<?> running;
        try {
            running = executor.submit(() -> {
                try {
                    task.run();
                    finished.set(true);
                    result.complete(null);
                } catch (Throwable ex) {
                    finished.set(true);
                    result.completeExceptionally(ex);
                    if (Exceptions.mustRethrow(ex)) {
                        throw Exceptions.sneakyThrow(ex);
                    }
                }
            });
        } catch (RejectedExecutionException ex) {
            return failedFuture(ex);
        }

        result.whenComplete((r, ex) -> {
            if (ex != null && !finished.get()) {
                // Completed externally while the task was still running.
                running.cancel(true);
            }
        });
        return result;
    }

    //endregion

    //region Time-based Futures

    /**
     * Creates a new CompletableFuture that either holds the result of future from the futureSupplier
     * or will fail with an exception produced by timeoutException after the given amount of time.
     *
     * @param futureSupplier   Supplier of the future.
     * @param timeout          The timeout for the future.
     * @param timeoutException Supplier of the exception to fail the future with when the timeout expires.
     * @param executorService  An ExecutorService that will be used to invoke the timeout on.
     * @param <T>              The Type argument for the CompletableFuture to create.
     * @return The same future returned by futureSupplier.
     */
    public static <T> CompletableFuture<T> futureWithTimeout(Supplier<CompletableFuture<T>> futureSupplier, Duration timeout,
                                                             Supplier<? extends Throwable> timeoutException,
                                                             ScheduledExecutorService executorService) {
        CompletableFuture<T> future = futureSupplier.get();
        if (future.isDone()) {
            return future;
        }

        ScheduledFuture<Boolean> sf = executorService.schedule(() -> future.completeExceptionally(timeoutException.get()),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        future.whenComplete((r, ex) -> sf.cancel(true));
        return future;
    }

    //endregion
}
