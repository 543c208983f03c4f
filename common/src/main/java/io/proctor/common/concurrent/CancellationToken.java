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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.concurrent.CompletableFuture;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Represents a token that can be passed around to various components to indicate when in-flight work should be
 * cancelled. Futures registered with the token are cancelled (with interruption) when cancellation is requested, and
 * so is any future registered afterwards.
 */
@Slf4j
@ThreadSafe
public class CancellationToken {
    /**
     * A CancellationToken that can be used as a placeholder for "no token to pass". This token instance cannot be cancelled.
     */
    public static final CancellationToken NONE = new NonCancellableToken();
    @GuardedBy("futures")
    private final Collection<CompletableFuture<?>> futures;
    @GuardedBy("futures")
    private boolean cancellationRequested;

    /**
     * Creates a new instance of the CancellationToken class.
     */
    public CancellationToken() {
        this.futures = new HashSet<>();
    }

    /**
     * Gets a value indicating whether cancellation has been requested on this token.
     *
     * @return True if requestCancellation() has been invoked.
     */
    public boolean isCancellationRequested() {
        synchronized (this.futures) {
            return this.cancellationRequested;
        }
    }

    /**
     * Registers the given Future to the token. If cancellation has already been requested, the future is cancelled
     * right away.
     *
     * @param future The Future to register.
     * @param <T>    Return type of the future.
     */
    public <T> void register(CompletableFuture<T> future) {
        Preconditions.checkNotNull(future, "future");
        if (future.isDone()) {
            return;
        }

        boolean autoCancel = false;
        synchronized (this.futures) {
            if (this.cancellationRequested) {
                autoCancel = true;
            } else {
                this.futures.add(future);
            }
        }

        if (autoCancel) {
            future.cancel(true);
            return;
        }

        future.whenComplete((r, ex) -> {
            synchronized (this.futures) {
                this.futures.remove(future);
            }
        });
    }

    /**
     * Cancels all registered futures. Subsequent invocations have no effect.
     */
    public void requestCancellation() {
        Collection<CompletableFuture<?>> toCancel;
        synchronized (this.futures) {
            if (this.cancellationRequested) {
                return;
            }

            this.cancellationRequested = true;
            toCancel = new ArrayList<>(this.futures);
            this.futures.clear();
        }

        log.debug("Cancellation requested; cancelling {} registered future(s).", toCancel.size());
        toCancel.forEach(f -> f.cancel(true));
    }

    @VisibleForTesting
    int getRegisteredCount() {
        synchronized (this.futures) {
            return this.futures.size();
        }
    }

    @Override
    public String toString() {
        synchronized (this.futures) {
            return "Cancelled = " + this.cancellationRequested;
        }
    }

    private static final class NonCancellableToken extends CancellationToken {
        @Override
        public <T> void register(CompletableFuture<T> future) {
            // This method intentionally left blank. No point in registering anything.
        }

        @Override
        public void requestCancellation() {
            // This method intentionally left blank. No point in requesting any cancellation.
        }
    }
}
