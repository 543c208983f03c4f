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
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Helper methods for ExecutorService.
 */
@Slf4j
public final class ExecutorServiceHelpers {

    //region Factory Methods

    /**
     * Creates and returns a thread factory that will create daemon threads with the given name prefix.
     *
     * @param groupName the name of the threads
     * @return a thread factory
     */
    public static ThreadFactory getThreadFactory(String groupName) {
        Exceptions.checkNotNullOrEmpty(groupName, "groupName");
        return new ThreadFactory() {
            final AtomicInteger threadCount = new AtomicInteger();

            @Override
            public String toString() {
                return groupName;
            }

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, groupName + "-" + threadCount.incrementAndGet());
                thread.setUncaughtExceptionHandler(new LogUncaughtExceptions());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    /**
     * Creates a new ScheduledExecutorService that will use daemon threads with appropriate names. Cancelled
     * tasks are removed from the work queue right away and delayed tasks do not run after shutdown.
     *
     * @param size     The number of threads in the threadpool
     * @param poolName The name of the pool (this will be printed in logs)
     * @return A new executor service.
     */
    public static ScheduledExecutorService newScheduledThreadPool(int size, String poolName) {
        Preconditions.checkArgument(size > 0, "size must be a positive integer.");
        ScheduledThreadPoolExecutor result = new ScheduledThreadPoolExecutor(size, getThreadFactory(poolName));
        result.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        result.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        result.setRemoveOnCancelPolicy(true);
        return result;
    }

    /**
     * Creates a new ExecutorService with exactly the given number of named daemon threads and an unbounded queue.
     *
     * @param size     The number of threads in the threadpool
     * @param poolName The name of the pool (this will be printed in logs)
     * @return A new executor service.
     */
    public static ExecutorService newFixedThreadPool(int size, String poolName) {
        Preconditions.checkArgument(size > 0, "size must be a positive integer.");
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                getThreadFactory(poolName));
    }

    /**
     * Operates like Executors.cachedThreadPool but with a custom thread timeout and pool name.
     *
     * @param maxThreadCount The maximum number of threads to allow in the pool.
     * @param threadTimeout  the number of milliseconds that a thread should sit idle before shutting down.
     * @param poolName       The name of the threadpool.
     * @return A new threadPool
     */
    public static ExecutorService getShrinkingExecutor(int maxThreadCount, int threadTimeout, String poolName) {
        Preconditions.checkArgument(maxThreadCount > 0, "maxThreadCount must be a positive integer.");
        return new ThreadPoolExecutor(0, maxThreadCount, threadTimeout, TimeUnit.MILLISECONDS, new SynchronousQueue<>(),
                getThreadFactory(poolName));
    }

    //endregion

    //region Execution and Shutdown

    /**
     * Executes the given task on the given Executor.
     *
     * @param task             The RunnableWithException to execute.
     * @param exceptionHandler A Consumer that will be invoked in case the task threw an Exception. This is not invoked if
     *                         the executor could not execute the given task.
     * @param runFinally       A Runnable that is guaranteed to be invoked at the end of this execution. If the executor
     *                         did accept the task, it will be invoked after the task is complete (or ended in failure).
     *                         If the executor did not accept the task, it will be executed when this method returns.
     * @param executor         An Executor to execute the task on.
     */
    public static void execute(RunnableWithException task, Consumer<Throwable> exceptionHandler, Runnable runFinally, Executor executor) {
        Preconditions.checkNotNull(task, "task");
        Preconditions.checkNotNull(exceptionHandler, "exceptionHandler");
        Preconditions.checkNotNull(runFinally, "runFinally");

        boolean scheduledSuccess = false;
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (Throwable ex) {
                    if (!Exceptions.mustRethrow(ex)) {
                        // The executor would ignore a rethrown exception; hand it over instead.
                        exceptionHandler.accept(ex);
                    }
                } finally {
                    runFinally.run();
                }
            });

            scheduledSuccess = true;
        } finally {
            if (!scheduledSuccess) {
                runFinally.run();
            }
        }
    }

    /**
     * Shuts down the given ExecutorServices in two phases, using a timeout of 5 seconds.
     *
     * @param pools The ExecutorServices to shut down.
     * @see #shutdown(Duration, ExecutorService...)
     */
    public static void shutdown(ExecutorService... pools) {
        shutdown(Duration.ofSeconds(5), pools);
    }

    /**
     * Shuts down the given ExecutorServices in two phases:
     * 1. Prevents new tasks from being submitted.
     * 2. Awaits for currently running tasks to terminate. If they don't terminate within the given timeout, they will be
     * forcibly cancelled.
     *
     * @param timeout Grace period that will be given to tasks to complete.
     * @param pools   The ExecutorServices to shut down.
     */
    public static void shutdown(Duration timeout, ExecutorService... pools) {
        for (ExecutorService pool : pools) {
            pool.shutdown();
        }

        // All pools shut down in parallel, so later ones only get what is left of the grace period.
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        for (ExecutorService pool : pools) {
            try {
                if (!pool.awaitTermination(remainingMillis(deadlineNanos), TimeUnit.MILLISECONDS)) {
                    pool.shutdownNow();
                    if (!pool.awaitTermination(remainingMillis(deadlineNanos), TimeUnit.MILLISECONDS)) {
                        List<Runnable> remainingTasks = pool.shutdownNow();
                        log.warn("One or more threads from pool " + pool
                                + " did not shutdown properly. Waiting tasks: " + remainingTasks);
                    }
                }
            } catch (InterruptedException ie) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    //endregion

    private static final class LogUncaughtExceptions implements Thread.UncaughtExceptionHandler {
        @Override
        public void uncaughtException(Thread t, Throwable e) {
            log.error("Exception thrown out of root of thread: " + t.getName(), e);
        }
    }
}
