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
package io.proctor.engine.plan;

import io.proctor.engine.registry.ParameterSet;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.registry.TestDescriptor;
import java.time.Duration;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * A test selected for a run, at a fixed position of the ExecutionPlan. A parameterized test is planned once per
 * parameter set. Attributes a test leaves unset are inherited from its suite.
 */
@Getter
@RequiredArgsConstructor
public class PlannedTest {
    /**
     * Zero-based position in the plan. Results are reported in this order.
     */
    private final int index;
    @NonNull
    private final SuiteDescriptor suite;
    @NonNull
    private final TestDescriptor test;
    /**
     * Tests sharing a group other than {@link ExecutionPlan#PARALLEL_GROUP} never run concurrently.
     */
    @NonNull
    private final String concurrencyGroup;
    /**
     * If set, the test is reported as SKIPPED with this reason and its body is never invoked.
     */
    private final String skipReason;
    /**
     * The parameter set this test runs with. Null if the test is not parameterized.
     */
    private final ParameterSet parameters;

    public String getSuiteName() {
        return this.suite.getName();
    }

    /**
     * Gets the name of this test, suffixed with the display name of its parameter set in brackets if it has one.
     *
     * @return The name.
     */
    public String getTestName() {
        return this.parameters == null ? this.test.getName() : this.test.getName() + "[" + this.parameters.getDisplayName() + "]";
    }

    public String getFullName() {
        return getSuiteName() + "::" + getTestName();
    }

    /**
     * Gets the number of retries of this test: its own if set, otherwise its suite's, otherwise 0.
     *
     * @return The number of retries.
     */
    public int getRetries() {
        if (this.test.getRetries() != null) {
            return this.test.getRetries();
        }

        return this.suite.getRetries() == null ? 0 : this.suite.getRetries();
    }

    /**
     * Gets the per-attempt time limit of this test: its own if set, otherwise its suite's.
     *
     * @return The time limit, or null if neither sets one.
     */
    public Duration getTimeout() {
        return this.test.getTimeout() != null ? this.test.getTimeout() : this.suite.getTimeout();
    }

    @Override
    public String toString() {
        return this.skipReason == null
                ? String.format("#%d %s", this.index, getFullName())
                : String.format("#%d %s (skip: %s)", this.index, getFullName(), this.skipReason);
    }
}
