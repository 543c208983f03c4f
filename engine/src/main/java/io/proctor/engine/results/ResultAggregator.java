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
package io.proctor.engine.results;

import com.google.common.base.Preconditions;
import io.proctor.engine.plan.ExecutionPlan;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects test outcomes and suite-level errors, in any order and from any thread, into a RunSummary whose
 * counts and ordering do not depend on completion order.
 * <p>
 * The run fails if any outcome is FAILED, TIMED_OUT or SETUP_FAILED, or TEARDOWN_FAILED when so configured.
 * SKIPPED outcomes, suite-level errors and session-level errors never affect the verdict.
 */
@Slf4j
@ThreadSafe
public class ResultAggregator {
    private final boolean teardownFailuresFailRun;
    @GuardedBy("outcomes")
    private final List<TestOutcome> outcomes = new ArrayList<>();
    @GuardedBy("outcomes")
    private final List<SuiteError> suiteErrors = new ArrayList<>();
    @GuardedBy("outcomes")
    private final List<Throwable> sessionErrors = new ArrayList<>();
    @GuardedBy("outcomes")
    private boolean failing;

    /**
     * Creates a new instance of the ResultAggregator class.
     *
     * @param teardownFailuresFailRun Whether TEARDOWN_FAILED outcomes fail the run.
     */
    public ResultAggregator(boolean teardownFailuresFailRun) {
        this.teardownFailuresFailRun = teardownFailuresFailRun;
    }

    /**
     * Records the final outcome of a test.
     *
     * @param outcome The outcome.
     * @return True if this outcome fails the run.
     */
    public boolean accept(TestOutcome outcome) {
        Preconditions.checkNotNull(outcome, "outcome");
        boolean fails = outcome.getStatus().failsRun(this.teardownFailuresFailRun);
        synchronized (this.outcomes) {
            this.outcomes.add(outcome);
            this.failing |= fails;
        }

        return fails;
    }

    /**
     * Records a failure that belongs to a suite rather than to a test.
     *
     * @param error The error.
     */
    public void recordSuiteError(SuiteError error) {
        Preconditions.checkNotNull(error, "error");
        log.warn("Suite '{}': {} failed: {}.", error.getSuiteName(), error.getPhase(), error.getReason());
        synchronized (this.outcomes) {
            this.suiteErrors.add(error);
        }
    }

    /**
     * Records a failure to release a SESSION-scoped fixture.
     *
     * @param error The failure.
     */
    public void recordSessionError(Throwable error) {
        Preconditions.checkNotNull(error, "error");
        log.warn("Session fixture teardown failed.", error);
        synchronized (this.outcomes) {
            this.sessionErrors.add(error);
        }
    }

    /**
     * Gets a value indicating whether any outcome recorded so far fails the run.
     *
     * @return True if the run is already failing.
     */
    public boolean isFailing() {
        synchronized (this.outcomes) {
            return this.failing;
        }
    }

    /**
     * Creates the RunSummary of everything recorded so far.
     *
     * @param plan    The plan that was executed. Defines the order of outcomes and suites.
     * @param aborted Whether the run was aborted.
     * @param elapsed Duration of the run.
     * @return The RunSummary.
     */
    public RunSummary summarize(ExecutionPlan plan, boolean aborted, Duration elapsed) {
        List<TestOutcome> sorted;
        List<SuiteError> errors;
        List<Throwable> session;
        boolean failed;
        synchronized (this.outcomes) {
            sorted = new ArrayList<>(this.outcomes);
            errors = new ArrayList<>(this.suiteErrors);
            session = new ArrayList<>(this.sessionErrors);
            failed = this.failing;
        }

        List<String> suiteOrder = plan.getSuiteNames();
        sorted.sort(Comparator.comparingInt(TestOutcome::getIndex));
        errors.sort(Comparator.comparingInt((SuiteError e) -> suiteOrder.indexOf(e.getSuiteName()))
                              .thenComparing(SuiteError::getPhase));

        List<SuiteResult> suiteResults = new ArrayList<>();
        for (String suiteName : suiteOrder) {
            suiteResults.add(new SuiteResult(suiteName,
                    sorted.stream().filter(o -> o.getSuiteName().equals(suiteName)).collect(Collectors.toList()),
                    errors.stream().filter(e -> e.getSuiteName().equals(suiteName)).collect(Collectors.toList())));
        }

        return new RunSummary(sorted, suiteResults, errors, session, aborted, elapsed, !failed);
    }
}
