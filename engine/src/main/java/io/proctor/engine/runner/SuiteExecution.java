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
package io.proctor.engine.runner;

import com.google.common.base.Preconditions;
import io.proctor.common.Exceptions;
import io.proctor.common.concurrent.Futures;
import io.proctor.engine.fixtures.SharedFixtureCache;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.HookContext;
import io.proctor.engine.registry.HookDescriptor;
import io.proctor.engine.registry.HookKind;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.results.SuiteError;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Run-time state of one suite during one run: the before_all/after_all barrier, the suite's fixture cache, the
 * lock that keeps hooks of the suite from interleaving, and the slot that serializes tests of a serial suite.
 */
@Slf4j
@ThreadSafe
public class SuiteExecution {
    //region Members

    @Getter
    private final SuiteDescriptor suite;
    @Getter
    private final SharedFixtureCache fixtureCache;
    private final Object hookLock = new Object();
    private final Semaphore serialSlot;
    private final AtomicInteger remaining;
    private final AtomicBoolean setupStarted = new AtomicBoolean(false);
    private final CompletableFuture<Void> setup = new CompletableFuture<>();

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the SuiteExecution class.
     *
     * @param suite            The suite.
     * @param plannedTestCount The number of planned tests of the suite, skipped ones included. The suite is finished
     *                         once this many tests have reported {@link #testFinished()}.
     */
    public SuiteExecution(SuiteDescriptor suite, int plannedTestCount) {
        Preconditions.checkArgument(plannedTestCount > 0, "plannedTestCount must be a positive number.");
        this.suite = suite;
        this.fixtureCache = new SharedFixtureCache(FixtureScope.SUITE, suite.getName());
        this.serialSlot = suite.isSerial() ? new Semaphore(1) : null;
        this.remaining = new AtomicInteger(plannedTestCount);
    }

    //endregion

    //region Lifecycle

    /**
     * Makes sure the before_all hooks of the suite have run. The first caller runs them (after invoking onStart);
     * every other caller blocks until they complete.
     *
     * @param onStart Invoked by the first caller, before the hooks run.
     * @return The failure of the before_all hooks, or null if they succeeded.
     */
    public Throwable ensureSetUp(Runnable onStart) {
        if (this.setupStarted.compareAndSet(false, true)) {
            onStart.run();
            Throwable failure = runHooks(HookKind.BEFORE_ALL, null);
            if (failure == null) {
                this.setup.complete(null);
            } else {
                this.setup.completeExceptionally(failure);
            }
        }

        Futures.await(this.setup);
        return Futures.getException(this.setup);
    }

    /**
     * Gets a value indicating whether the before_all hooks of the suite have been started.
     *
     * @return True if started.
     */
    public boolean isStarted() {
        return this.setupStarted.get();
    }

    /**
     * Attempts to acquire the right to run a test of this suite. Never blocks.
     *
     * @return True if acquired: always for parallel suites, and for serial suites when no other test of the suite
     * holds the slot.
     */
    public boolean tryAcquireSlot() {
        return this.serialSlot == null || this.serialSlot.tryAcquire();
    }

    /**
     * Releases the right acquired by {@link #tryAcquireSlot()}.
     */
    public void releaseSlot() {
        if (this.serialSlot != null) {
            this.serialSlot.release();
        }
    }

    /**
     * Records that one planned test of this suite has finished, whatever its outcome.
     *
     * @return True if that was the last planned test of the suite; the caller must then invoke {@link #tearDown()}.
     */
    public boolean testFinished() {
        int left = this.remaining.decrementAndGet();
        Preconditions.checkState(left >= 0, "Suite '%s' had more finished tests than planned ones.", getName());
        return left == 0;
    }

    /**
     * Runs the after_all hooks (if the suite was started) and then releases the suite's fixtures.
     *
     * @return The suite-level errors of this run: a before_all failure, after_all failures and fixture teardown
     * failures, in that order.
     */
    public List<SuiteError> tearDown() {
        List<SuiteError> errors = new ArrayList<>();
        if (isStarted()) {
            Throwable setupFailure = Futures.getException(this.setup);
            if (setupFailure != null) {
                errors.add(new SuiteError(getName(), SuiteError.Phase.BEFORE_ALL, setupFailure));
            }

            Throwable failure = runHooks(HookKind.AFTER_ALL, null);
            if (failure != null) {
                errors.add(new SuiteError(getName(), SuiteError.Phase.AFTER_ALL, failure));
            }
        }

        this.fixtureCache.release().forEach(ex -> errors.add(new SuiteError(getName(), SuiteError.Phase.FIXTURE_TEARDOWN, ex)));
        return errors;
    }

    //endregion

    //region Hooks

    /**
     * Runs the hooks of the given kind, in registration order, without interleaving with any other hooks of this
     * suite. Setup hooks stop at the first failure; teardown hooks all run, and later failures are attached to the
     * first one as suppressed exceptions.
     *
     * @param kind     The kind of hooks to run.
     * @param testName The test being wrapped, for BEFORE_EACH and AFTER_EACH hooks.
     * @return The first failure, or null if all hooks succeeded.
     */
    public Throwable runHooks(HookKind kind, String testName) {
        List<HookDescriptor> hooks = this.suite.getHooks(kind);
        if (hooks.isEmpty()) {
            return null;
        }

        HookContext context = new HookContext(getName(), kind, testName);
        Throwable failure = null;
        synchronized (this.hookLock) {
            for (HookDescriptor hook : hooks) {
                try {
                    hook.getAction().run(context);
                } catch (Throwable ex) {
                    if (Exceptions.mustRethrow(ex)) {
                        throw Exceptions.sneakyThrow(ex);
                    }

                    log.warn("Suite '{}': {} hook '{}' failed{}.", getName(), kind, hook.getName(),
                            testName == null ? "" : " for test '" + testName + "'", ex);
                    if (failure == null) {
                        failure = ex;
                    } else {
                        failure.addSuppressed(ex);
                    }

                    if (!kind.isTeardown()) {
                        break;
                    }
                }
            }
        }

        return failure;
    }

    //endregion

    public String getName() {
        return this.suite.getName();
    }

    @Override
    public String toString() {
        return String.format("SuiteExecution[%s, remaining=%d, started=%s]", getName(), this.remaining.get(), isStarted());
    }
}
