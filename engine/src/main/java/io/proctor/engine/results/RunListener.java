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

import io.proctor.engine.plan.ExecutionPlan;
import io.proctor.engine.plan.PlannedTest;

/**
 * Receives run events as they happen, in completion order. Callbacks may be invoked concurrently from several
 * worker threads. A callback that throws is logged and otherwise ignored.
 */
public interface RunListener {
    default void onRunStarted(ExecutionPlan plan) {
    }

    /**
     * Invoked before the before_all hooks of a suite run.
     *
     * @param suiteName The name of the suite.
     */
    default void onSuiteStarted(String suiteName) {
    }

    default void onTestStarted(PlannedTest test) {
    }

    /**
     * Invoked when an attempt failed or timed out and the test is about to be attempted again.
     *
     * @param test          The test.
     * @param failedAttempt The attempt that failed.
     */
    default void onAttemptRetried(PlannedTest test, AttemptRecord failedAttempt) {
    }

    default void onTestFinished(TestOutcome outcome) {
    }

    /**
     * Invoked after the after_all hooks of a suite ran and its fixtures were released.
     *
     * @param suiteName The name of the suite.
     */
    default void onSuiteFinished(String suiteName) {
    }

    default void onRunFinished(RunSummary summary) {
    }
}
