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
package io.proctor.engine;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.proctor.common.Exceptions;
import io.proctor.common.LoggerHelpers;
import io.proctor.common.Timer;
import io.proctor.common.concurrent.CancellationToken;
import io.proctor.common.concurrent.ExecutorServiceHelpers;
import io.proctor.common.concurrent.Futures;
import io.proctor.engine.fixtures.FixtureResolver;
import io.proctor.engine.fixtures.SharedFixtureCache;
import io.proctor.engine.plan.ExecutionPlan;
import io.proctor.engine.plan.ExecutionPlanner;
import io.proctor.engine.plan.PlannedTest;
import io.proctor.engine.plan.SkipReasons;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.Registry;
import io.proctor.engine.results.ResultAggregator;
import io.proctor.engine.results.RunListener;
import io.proctor.engine.results.RunListeners;
import io.proctor.engine.results.RunSummary;
import io.proctor.engine.results.TestOutcome;
import io.proctor.engine.runner.SuiteExecution;
import io.proctor.engine.runner.TestRunner;
import io.proctor.engine.runner.TestState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the engine. Plans a run from a {@link Registry} and an {@link EngineConfig}, executes it on a
 * bounded pool of workers and reports the results to registered {@link RunListener}s.
 * <p>
 * Each worker pulls the next {@link PlannedTest} that can start from a shared queue; tests of a serial suite whose
 * slot is taken are passed over until it is released. The first worker to reach a suite runs its
 * before_all hooks while the others wait; the worker that finishes the last planned test of a suite runs its
 * after_all hooks and releases its fixtures. SESSION-scoped fixtures are released once all workers are done.
 * An instance can be run only once.
 */
@Slf4j
@ThreadSafe
public class TestEngine {
    //region Members

    private static final Duration ATTEMPT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);
    private final Registry registry;
    private final EngineConfig config;
    private final RunListeners listeners = new RunListeners();
    private final CancellationToken cancellationToken = new CancellationToken();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile BiConsumer<PlannedTest, TestState> transitionListener;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the TestEngine class.
     *
     * @param registry The Registry to run. It is frozen when the run starts.
     * @param config   The EngineConfig for the run.
     */
    public TestEngine(@NonNull Registry registry, @NonNull EngineConfig config) {
        this.registry = registry;
        this.config = config;
    }

    //endregion

    //region Operations

    /**
     * Registers a listener for the result stream of the run.
     *
     * @param listener The listener.
     */
    public void addListener(RunListener listener) {
        this.listeners.add(listener);
    }

    @VisibleForTesting
    void setTransitionListener(BiConsumer<PlannedTest, TestState> transitionListener) {
        this.transitionListener = transitionListener;
    }

    /**
     * Requests the run to stop. Attempts in flight are cancelled, and those tests and every test that has not
     * started yet are reported SKIPPED with reason "run aborted". Teardown of started tests and suites still runs.
     * Has no effect if already requested.
     */
    public void abort() {
        if (!this.cancellationToken.isCancellationRequested()) {
            log.info("Run abort requested.");
            this.cancellationToken.requestCancellation();
        }
    }

    public boolean isAborted() {
        return this.cancellationToken.isCancellationRequested();
    }

    /**
     * Executes the run.
     *
     * @return The RunSummary of the run.
     * @throws io.proctor.engine.fixtures.FixtureGraphException If the fixture graph is invalid. No test is executed.
     * @throws IllegalStateException                            If this instance has already been run.
     */
    public RunSummary run() {
        Preconditions.checkState(this.started.compareAndSet(false, true), "TestEngine instances can only be run once.");
        long traceId = LoggerHelpers.traceEnterWithContext(log, "engine", "run", this.config);
        this.registry.freeze();
        ExecutionPlan plan = new ExecutionPlanner(this.config).plan(this.registry);
        Timer timer = new Timer();
        Run run = new Run(plan);
        this.listeners.onRunStarted(plan);
        run.execute();

        RunSummary summary = run.aggregator.summarize(plan, isAborted(), timer.getElapsed());
        log.info("Run finished in {}: {} test(s), {}, verdict {}.", timer, summary.getTotal(), summary.getCounts(),
                summary.isSuccessful() ? "PASS" : "FAIL");
        this.listeners.onRunFinished(summary);
        LoggerHelpers.traceLeave(log, "engine", "run", traceId, summary.isSuccessful());
        return summary;
    }

    //endregion

    //region Run

    /**
     * State of a single run.
     */
    private class Run {
        private final ExecutionPlan plan;
        private final ResultAggregator aggregator;
        private final Map<String, SuiteExecution> suites = new HashMap<>();
        private final SharedFixtureCache sessionFixtures = new SharedFixtureCache(FixtureScope.SESSION, "run");
        private final Object queueLock = new Object();
        @GuardedBy("queueLock")
        private final LinkedList<PlannedTest> pending;
        private final AtomicBoolean failFastTriggered = new AtomicBoolean(false);

        Run(ExecutionPlan plan) {
            this.plan = plan;
            this.aggregator = new ResultAggregator(config.isTeardownFailuresFailRun());
            for (String suiteName : plan.getSuiteNames()) {
                List<PlannedTest> tests = plan.getTests(suiteName);
                this.suites.put(suiteName, new SuiteExecution(tests.get(0).getSuite(), tests.size()));
            }

            this.pending = new LinkedList<>(plan.getTests());
        }

        void execute() {
            if (this.plan.size() == 0) {
                return;
            }

            int workerCount = Math.min(config.getWorkerCount(), this.plan.size());
            ExecutorService workerPool = ExecutorServiceHelpers.newFixedThreadPool(workerCount, "proctor-worker");
            ExecutorService attemptPool = ExecutorServiceHelpers.getShrinkingExecutor(Integer.MAX_VALUE, 1000, "proctor-attempt");
            ScheduledExecutorService timeoutPool = ExecutorServiceHelpers.newScheduledThreadPool(1, "proctor-timeout");
            try {
                TestRunner runner = TestRunner.builder()
                        .fixtureResolver(new FixtureResolver(this.plan.getFixtureGraph(), this.sessionFixtures))
                        .attemptExecutor(attemptPool)
                        .timeoutExecutor(timeoutPool)
                        .cancellationToken(cancellationToken)
                        .defaultTimeout(config.getDefaultTimeout())
                        .listener(listeners)
                        .transitionListener(transitionListener)
                        .build();

                List<CompletableFuture<Void>> workers = new ArrayList<>();
                for (int i = 0; i < workerCount; i++) {
                    CompletableFuture<Void> done = new CompletableFuture<>();
                    workers.add(done);
                    ExecutorServiceHelpers.execute(
                            () -> drain(runner),
                            done::completeExceptionally,
                            () -> done.complete(null),
                            workerPool);
                }

                Futures.allOf(workers).join();
            } finally {
                ExecutorServiceHelpers.shutdown(workerPool, timeoutPool);
                ExecutorServiceHelpers.shutdown(ATTEMPT_SHUTDOWN_TIMEOUT, attemptPool);
                this.sessionFixtures.release().forEach(this.aggregator::recordSessionError);
            }
        }

        private void drain(TestRunner runner) {
            PlannedTest test;
            while ((test = nextTest()) != null) {
                execute(test, runner);
            }
        }

        /**
         * Removes and returns the first pending test that can start now: a pre-skipped test, a test of a parallel
         * suite, or a test of a serial suite whose slot is free (the slot is then held by the caller). Waits while
         * only tests of busy serial suites are pending.
         *
         * @return The test, or null if there are no more pending tests.
         */
        private PlannedTest nextTest() {
            synchronized (this.queueLock) {
                while (!this.pending.isEmpty()) {
                    Iterator<PlannedTest> iterator = this.pending.iterator();
                    while (iterator.hasNext()) {
                        PlannedTest test = iterator.next();
                        if (test.getSkipReason() != null || this.suites.get(test.getSuiteName()).tryAcquireSlot()) {
                            iterator.remove();
                            return test;
                        }
                    }

                    Exceptions.handleInterrupted(this.queueLock::wait);
                }

                return null;
            }
        }

        private void releaseSlot(SuiteExecution suite) {
            suite.releaseSlot();
            synchronized (this.queueLock) {
                this.queueLock.notifyAll();
            }
        }

        private void execute(PlannedTest test, TestRunner runner) {
            SuiteExecution suite = this.suites.get(test.getSuiteName());
            TestOutcome outcome;
            try {
                outcome = preSkip(test);
                if (outcome == null) {
                    Throwable setupFailure = suite.ensureSetUp(() -> listeners.onSuiteStarted(suite.getName()));
                    if (setupFailure != null) {
                        outcome = TestOutcome.skipped(test, SkipReasons.SUITE_SETUP_FAILED, setupFailure);
                    } else {
                        listeners.onTestStarted(test);
                        outcome = runner.run(test, suite);
                    }
                }
            } finally {
                if (test.getSkipReason() == null) {
                    releaseSlot(suite);
                }
            }

            if (this.aggregator.accept(outcome) && config.isFailFast() && this.failFastTriggered.compareAndSet(false, true)) {
                log.info("{} failed the run ({}); skipping tests that have not started.", outcome.getFullName(), outcome.getStatus());
            }

            listeners.onTestFinished(outcome);
            if (suite.testFinished()) {
                finishSuite(suite);
            }
        }

        private TestOutcome preSkip(PlannedTest test) {
            if (test.getSkipReason() != null) {
                return TestOutcome.skipped(test, test.getSkipReason(), null);
            } else if (isAborted()) {
                return TestOutcome.skipped(test, SkipReasons.RUN_ABORTED, null);
            } else if (this.failFastTriggered.get()) {
                return TestOutcome.skipped(test, SkipReasons.FAIL_FAST, null);
            }

            return null;
        }

        private void finishSuite(SuiteExecution suite) {
            boolean wasStarted = suite.isStarted();
            suite.tearDown().forEach(this.aggregator::recordSuiteError);
            if (wasStarted) {
                listeners.onSuiteFinished(suite.getName());
            }

            log.debug("Suite '{}' finished.", suite.getName());
        }
    }

    //endregion
}
