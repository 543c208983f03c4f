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
package io.proctor.common.function;

import com.google.common.base.Preconditions;
import io.proctor.common.Exceptions;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Helpers for invoking user-supplied callbacks (listeners, handlers) whose failures must not reach the caller.
 * Fatal errors (see {@link Exceptions#mustRethrow}) are always rethrown.
 */
@Slf4j
public final class Callbacks {
    private Callbacks() {
    }

    /**
     * Invokes the given Consumer with the given argument, and catches any exceptions that it may throw.
     *
     * @param consumer       The consumer to invoke.
     * @param argument       The argument to pass to the consumer.
     * @param failureHandler An optional callback to invoke if the consumer threw any exceptions. Failures of this
     *                       handler are logged.
     * @param <T>            The type of the argument.
     * @throws NullPointerException If the consumer is null.
     */
    public static <T> void invokeSafely(Consumer<T> consumer, T argument, Consumer<Throwable> failureHandler) {
        Preconditions.checkNotNull(consumer, "consumer");
        invokeSafely(() -> consumer.accept(argument), failureHandler);
    }

    /**
     * Invokes the given RunnableWithException and catches any exceptions that it may throw.
     *
     * @param runnable       The runnable to invoke.
     * @param failureHandler An optional callback to invoke if the runnable threw any exceptions. Failures of this
     *                       handler are logged.
     * @throws NullPointerException If the runnable is null.
     */
    public static void invokeSafely(RunnableWithException runnable, Consumer<Throwable> failureHandler) {
        Preconditions.checkNotNull(runnable, "runnable");
        Throwable failure = capture(runnable);
        if (failure == null || failureHandler == null) {
            return;
        }

        Throwable handlerFailure = capture(() -> failureHandler.accept(failure));
        if (handlerFailure != null) {
            handlerFailure.addSuppressed(failure);
            log.error("Failure handler {} failed.", failureHandler, handlerFailure);
        }
    }

    private static Throwable capture(RunnableWithException runnable) {
        try {
            runnable.run();
            return null;
        } catch (Throwable ex) {
            if (Exceptions.mustRethrow(ex)) {
                throw Exceptions.sneakyThrow(ex);
            }

            return ex;
        }
    }
}
