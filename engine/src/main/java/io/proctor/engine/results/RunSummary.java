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

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Final, deterministic summary of a run.
 */
public class RunSummary {
    /**
     * All outcomes, in plan order.
     */
    @Getter
    private final List<TestOutcome> outcomes;
    /**
     * Per-suite results, in plan order.
     */
    @Getter
    private final List<SuiteResult> suiteResults;
    @Getter
    private final List<SuiteError> suiteErrors;
    /**
     * Teardown failures of SESSION-scoped fixtures, in release order.
     */
    @Getter
    private final List<Throwable> sessionErrors;
    /**
     * Number of tests whose body was invoked more than once.
     */
    @Getter
    private final int retriedCount;
    @Getter
    private final boolean aborted;
    @Getter
    private final Duration elapsed;
    /**
     * The verdict of the run: false if any outcome failed it.
     */
    @Getter
    private final boolean successful;
    private final Map<TestStatus, Integer> counts;

    RunSummary(List<TestOutcome> outcomes, List<SuiteResult> suiteResults, List<SuiteError> suiteErrors,
               List<Throwable> sessionErrors, boolean aborted, Duration elapsed, boolean successful) {
        this.outcomes = ImmutableList.copyOf(outcomes);
        this.suiteResults = ImmutableList.copyOf(suiteResults);
        this.suiteErrors = ImmutableList.copyOf(suiteErrors);
        this.sessionErrors = ImmutableList.copyOf(sessionErrors);
        this.aborted = aborted;
        this.elapsed = elapsed;
        this.successful = successful;
        this.retriedCount = (int) outcomes.stream().filter(TestOutcome::isRetried).count();
        Map<TestStatus, Integer> c = new EnumMap<>(TestStatus.class);
        for (TestStatus s : TestStatus.values()) {
            c.put(s, 0);
        }

        outcomes.forEach(o -> c.merge(o.getStatus(), 1, Integer::sum));
        this.counts = Collections.unmodifiableMap(c);
    }

    /**
     * Gets the number of outcomes with the given status.
     *
     * @param status The status.
     * @return The count.
     */
    public int getCount(TestStatus status) {
        return this.counts.get(status);
    }

    /**
     * Gets the number of outcomes per status, including statuses with no outcomes.
     *
     * @return An unmodifiable Map.
     */
    public Map<TestStatus, Integer> getCounts() {
        return this.counts;
    }

    public int getTotal() {
        return this.outcomes.size();
    }

    /**
     * Gets the outcome of the given test.
     *
     * @param suiteName The name of the suite.
     * @param testName  The name of the test.
     * @return The outcome, or null if the test was not part of the run.
     */
    public TestOutcome getOutcome(String suiteName, String testName) {
        return this.outcomes.stream()
                            .filter(o -> o.getSuiteName().equals(suiteName) && o.getTestName().equals(testName))
                            .findFirst()
                            .orElse(null);
    }

    @Override
    public String toString() {
        return String.format("RunSummary[%s, total=%d, retried=%d, suiteErrors=%d, aborted=%s, elapsed=%dms]: %s",
                this.successful ? "SUCCESS" : "FAILURE", getTotal(), this.retriedCount, this.suiteErrors.size(),
                this.aborted, this.elapsed.toMillis(), this.counts);
    }
}
