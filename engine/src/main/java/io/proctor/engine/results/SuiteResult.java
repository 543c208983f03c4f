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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Outcomes and suite-level errors of one suite.
 */
public class SuiteResult {
    @Getter
    private final String suiteName;
    @Getter
    private final List<TestOutcome> outcomes;
    @Getter
    private final List<SuiteError> errors;
    private final Map<TestStatus, Integer> counts;

    SuiteResult(String suiteName, List<TestOutcome> outcomes, List<SuiteError> errors) {
        this.suiteName = suiteName;
        this.outcomes = ImmutableList.copyOf(outcomes);
        this.errors = ImmutableList.copyOf(errors);
        this.counts = new EnumMap<>(TestStatus.class);
        outcomes.forEach(o -> this.counts.merge(o.getStatus(), 1, Integer::sum));
    }

    /**
     * Gets the number of outcomes with the given status.
     *
     * @param status The status.
     * @return The count.
     */
    public int getCount(TestStatus status) {
        return this.counts.getOrDefault(status, 0);
    }

    /**
     * Gets the percentage (0 to 100) of this suite's outcomes that passed.
     *
     * @return The success rate, or 0 if the suite has no outcomes.
     */
    public double getSuccessRate() {
        return this.outcomes.isEmpty() ? 0 : getCount(TestStatus.PASSED) * 100.0 / this.outcomes.size();
    }

    @Override
    public String toString() {
        return String.format("%s: %s, %d suite error(s)", this.suiteName, this.counts, this.errors.size());
    }
}
