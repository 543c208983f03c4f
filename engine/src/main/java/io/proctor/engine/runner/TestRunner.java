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
import io.proctor.common.Timer;
import io.proctor.common.concurrent.CancellationToken;
import io.proctor.common.concurrent.Futures;
import io.proctor.engine.fixtures.FixtureResolver;
import io.proctor.engine.fixtures.TestFixtureScope;
import io.proctor.engine.plan.PlannedTest;
import io.proctor.engine.plan.SkipReasons;
import io.proctor.engine.registry.FixtureValues;
import io.proctor.engine.registry.HookKind;
import io.proctor.engine.registry.TestContext;
import io.proctor.engine.registry.TestDescriptor;
import io.proctor.engine.results.AttemptRecord;
import io.proctor.engine.results.RunListener;
import io.proctor.engine.results.TestOutcome;
import io.proctor.engine.results.TestStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one planned test: before_each hooks, fixture resolution, the body (bounded by its timeout and retried
 * according to its retry count), after_each hooks and fixture release. See {@link TestState} for the states a
 * test goes through.
 * <p>
 * Bodies run on the attempt executor so that a timed out or aborted attempt can be interrupted without
 * affecting the calling worker.
 */
@Slf4j
public class TestRunner {
    //region Members

    private final FixtureResolver fixtureResolver;
    private final ExecutorService attemptExecutor;
    private final ScheduledExecutorService timeoutExecutor;
    private final CancellationToken cancellationToken;
    private final Duration defaultTimeout;
    private final RunListener listener;
    private final BiConsumer<PlannedTest, TestState> transitionListener;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the TestRunner class.
     *
     * @param fixtureResolver    Resolves the fixtures of every attempt.
     * @param attemptExecutor    Executor to run test bodies on.
     * @param timeoutExecutor    Executor to schedule attempt timeouts on.
     * @param cancellationToken  Run-level cancellation. In-flight attempts are cancelled when it is requested.
     * @param defaultTimeout     Time limit for tests that do not declare one. Null means unbounded.
     * @param listener           Receives retry events.
     * @param transitionListener Optional. Invoked on every state transition.
     */
    @Builder
    private TestRunner(@NonNull FixtureResolver fixtureResolver, @NonNull ExecutorService attemptExecutor,
                       @NonNull ScheduledExecutorService timeoutExecutor, CancellationToken cancellationToken,
                       Duration defaultTimeout, RunListener listener, BiConsumer<PlannedTest, TestState> transitionListener) {
        this.fixtureResolver = fixtureResolver;
        this.attemptExecutor = attemptExecutor;
        this.timeoutExecutor = timeoutExecutor;
        this.cancellationToken = cancellationToken == null ? CancellationToken.NONE : cancellationToken;
        this.defaultTimeout = defaultTimeout;
        this.listener = listener == null ? new RunListener() { } : listener;
        this.transitionListener = transitionListener;
    }

    //endregion

    /**
     * Executes the given test.
     *
     * @param test  The test to execute. Must not be pre-skipped.
     * @param suite The run-time state of the test's suite. Its before_all hooks must have succeeded.
     * @return The final outcome of the test.
     */
    public TestOutcome run(PlannedTest test, SuiteExecution suite) {
        Preconditions.checkArgument(test.getSkipReason() == null, "Test '%s' is pre-skipped.", test.getFullName());
        Preconditions.checkArgument(test.getSuiteName().equals(suite.getName()), "Test '%s' does not belong to suite '%s'.",
                test.getFullName(), suite.getName());
        return new Execution(test, suite).run();
    }

    /**
     * One execution of one test. Not thread-safe; confined to the calling worker.
     */
    private class Execution {
        private final PlannedTest planned;
        private final TestDescriptor test;
        private final SuiteExecution suite;
        private final String fullName;
        private final Timer timer = new Timer();
        private final List<AttemptRecord> history = new ArrayList<>();
        private TestState state = TestState.PENDING;
        private TestFixtureScope scope;
        private Throwable setupFailure;
        private Throwable teardownFailure;
        private boolean aborted;

        Execution(PlannedTest planned, SuiteExecution suite) {
            this.planned = planned;
            this.test = planned.getTest();
            this.suite = suite;
            this.fullName = planned.getFullName();
        }

        TestOutcome run() {
            transition(TestState.SETUP);
            this.setupFailure = this.suite.runHooks(HookKind.BEFORE_EACH, this.planned.getTestName());
            if (this.setupFailure == null) {
                transition(TestState.RUNNING);
                runAttempts();
            }

            transition(TestState.TEARDOWN);
            Throwable afterEachFailure = this.suite.runHooks(HookKind.AFTER_EACH, this.planned.getTestName());
            if (afterEachFailure != null) {
                addTeardownFailure(afterEachFailure);
            }

            releaseScope();
            transition(TestState.DONE);
            TestOutcome outcome = buildOutcome();
            log.info("{}: {} after {} attempt(s) in {}.", this.fullName, outcome.getStatus(), outcome.getAttempts(), this.timer);
            return outcome;
        }

        private void runAttempts() {
            while (true) {
                if (cancellationToken.isCancellationRequested()) {
                    this.aborted = true;
                    return;
                }

                this.scope = new TestFixtureScope(this.fullName);
                FixtureValues fixtures;
                try {
                    fixtures = fixtureResolver.resolve(this.planned.getSuite(), this.test, this.suite.getFixtureCache(), this.scope);
                } catch (Exception ex) {
                    log.warn("{}: fixture resolution failed.", this.fullName, ex);
                    this.setupFailure = ex;
                    return;
                }

                AttemptRecord attempt = invoke(fixtures, this.history.size() + 1);
                this.history.add(attempt);
                if (attempt.getStatus() == TestStatus.SKIPPED) {
                    this.aborted = true;
                    return;
                }

                transition(attempt.getStatus() == TestStatus.PASSED
                        ? TestState.PASSED
                        : attempt.getStatus() == TestStatus.TIMED_OUT ? TestState.TIMED_OUT : TestState.FAILED);
                if (attempt.getStatus() == TestStatus.PASSED || this.history.size() > this.planned.getRetries()) {
                    return;
                }

                transition(TestState.RETRYING);
                log.info("{}: attempt {} {} ({}); retrying.", this.fullName, attempt.getAttempt(), attempt.getStatus(),
                        Exceptions.describe(attempt.getFailure()));
                listener.onAttemptRetried(this.planned, attempt);
                releaseScope();
                transition(TestState.RUNNING);
            }
        }

        private AttemptRecord invoke(FixtureValues fixtures, int attemptNumber) {
            TestContext context = new TestContext(this.planned.getSuiteName(), this.planned.getTestName(), attemptNumber, fixtures,
                    this.planned.getParameters());
            Duration timeout = this.planned.getTimeout() != null ? this.planned.getTimeout() : defaultTimeout;
            Timer attemptTimer = new Timer();
            CompletableFuture<Void> result = Futures.runInterruptibly(() -> this.test.getBody().run(context), attemptExecutor);
            if (timeout != null) {
                Futures.futureWithTimeout(() -> result, timeout,
                        () -> new AttemptTimeoutException(this.fullName, attemptNumber, timeout), timeoutExecutor);
            }

            cancellationToken.register(result);
            Futures.await(result);

            Throwable failure = Futures.getException(result);
            TestStatus status;
            if (failure == null) {
                status = TestStatus.PASSED;
            } else if (failure instanceof AttemptTimeoutException) {
                status = TestStatus.TIMED_OUT;
            } else if (failure instanceof CancellationException && cancellationToken.isCancellationRequested()) {
                status = TestStatus.SKIPPED;
            } else {
                status = TestStatus.FAILED;
            }

            log.debug("{}: attempt {} {} in {}.", this.fullName, attemptNumber, status, attemptTimer);
            return new AttemptRecord(attemptNumber, status, attemptTimer.getElapsed(), failure);
        }

        private void releaseScope() {
            if (this.scope != null) {
                this.scope.release().forEach(this::addTeardownFailure);
                this.scope = null;
            }
        }

        private void addTeardownFailure(Throwable ex) {
            if (this.teardownFailure == null) {
                this.teardownFailure = ex;
            } else if (this.teardownFailure != ex) {
                this.teardownFailure.addSuppressed(ex);
            }
        }

        private TestOutcome buildOutcome() {
            TestOutcome.TestOutcomeBuilder builder = TestOutcome.builder()
                    .index(this.planned.getIndex())
                    .suiteName(this.planned.getSuiteName())
                    .testName(this.planned.getTestName())
                    .elapsed(this.timer.getElapsed())
                    .attempts(this.history.size())
                    .history(this.history);
            if (this.aborted) {
                return builder.status(TestStatus.SKIPPED)
                              .reason(SkipReasons.RUN_ABORTED)
                              .teardownFailure(this.teardownFailure)
                              .build();
            } else if (this.setupFailure != null) {
                return builder.status(TestStatus.SETUP_FAILED)
                              .reason("setup failed: " + Exceptions.describe(this.setupFailure))
                              .failure(this.setupFailure)
                              .teardownFailure(this.teardownFailure)
                              .build();
            }

            AttemptRecord last = this.history.get(this.history.size() - 1);
            if (last.getStatus() == TestStatus.PASSED) {
                if (this.teardownFailure != null) {
                    return builder.status(TestStatus.TEARDOWN_FAILED)
                                  .reason("teardown failed: " + Exceptions.describe(this.teardownFailure))
                                  .failure(this.teardownFailure)
                                  .build();
                }

                return builder.status(TestStatus.PASSED).build();
            }

            return builder.status(last.getStatus())
                          .reason(Exceptions.describe(last.getFailure()))
                          .failure(last.getFailure())
                          .teardownFailure(this.teardownFailure)
                          .build();
        }

        private void transition(TestState next) {
            Preconditions.checkState(this.state.canTransitionTo(next), "%s: illegal transition %s -> %s.", this.fullName, this.state, next);
            log.debug("{}: {} -> {}.", this.fullName, this.state, next);
            this.state = next;
            if (transitionListener != null) {
                transitionListener.accept(this.planned, next);
            }
        }
    }
}
