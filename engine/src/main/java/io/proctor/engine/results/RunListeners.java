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
import io.proctor.common.LoggerHelpers;
import io.proctor.common.function.Callbacks;
import io.proctor.engine.plan.ExecutionPlan;
import io.proctor.engine.plan.PlannedTest;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * A RunListener that forwards every event to a set of registered listeners, isolating each of them from the
 * failures of the others and from the run itself.
 */
@Slf4j
public class RunListeners implements RunListener {
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a listener.
     *
     * @param listener The listener to register.
     */
    public void add(RunListener listener) {
        Preconditions.checkNotNull(listener, "listener");
        this.listeners.add(listener);
    }

    @Override
    public void onRunStarted(ExecutionPlan plan) {
        notify("onRunStarted", l -> l.onRunStarted(plan));
    }

    @Override
    public void onSuiteStarted(String suiteName) {
        notify("onSuiteStarted", l -> l.onSuiteStarted(suiteName));
    }

    @Override
    public void onTestStarted(PlannedTest test) {
        notify("onTestStarted", l -> l.onTestStarted(test));
    }

    @Override
    public void onAttemptRetried(PlannedTest test, AttemptRecord failedAttempt) {
        notify("onAttemptRetried", l -> l.onAttemptRetried(test, failedAttempt));
    }

    @Override
    public void onTestFinished(TestOutcome outcome) {
        notify("onTestFinished", l -> l.onTestFinished(outcome));
    }

    @Override
    public void onSuiteFinished(String suiteName) {
        notify("onSuiteFinished", l -> l.onSuiteFinished(suiteName));
    }

    @Override
    public void onRunFinished(RunSummary summary) {
        notify("onRunFinished", l -> l.onRunFinished(summary));
    }

    private void notify(String event, Consumer<RunListener> callback) {
        for (RunListener listener : this.listeners) {
            Callbacks.invokeSafely(callback, listener,
                    ex -> log.error("RunListener {} failed on {}: {}.", listener, event, LoggerHelpers.exceptionSummary(log, ex)));
        }
    }
}
