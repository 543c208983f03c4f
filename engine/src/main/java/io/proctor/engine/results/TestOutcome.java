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

import io.proctor.engine.plan.PlannedTest;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Final result of one planned test.
 */
@Getter
@Builder
@ToString(of = {"suiteName", "testName", "status", "attempts", "reason"})
public class TestOutcome {
    /**
     * Position of the test in the ExecutionPlan.
     */
    private final int index;
    @NonNull
    private final String suiteName;
    @NonNull
    private final String testName;
    @NonNull
    private final TestStatus status;
    /**
     * Human-readable reason for any status other than PASSED.
     */
    private final String reason;
    /**
     * The failure that determined the status, if any.
     */
    private final Throwable failure;
    /**
     * A teardown failure (after_each hook or test fixture) that did not determine the status.
     */
    private final Throwable teardownFailure;
    @NonNull
    @Builder.Default
    private final Duration elapsed = Duration.ZERO;
    /**
     * Number of times the body was invoked.
     */
    private final int attempts;
    @Singular("attempt")
    private final List<AttemptRecord> history;

    /**
     * Creates an outcome for a test whose body was never invoked.
     *
     * @param test   The planned test.
     * @param reason The skip reason.
     * @param cause  What caused the skip, if anything.
     * @return A SKIPPED TestOutcome.
     */
    public static TestOutcome skipped(PlannedTest test, String reason, Throwable cause) {
        return TestOutcome.builder()
                          .index(test.getIndex())
                          .suiteName(test.getSuiteName())
                          .testName(test.getTestName())
                          .status(TestStatus.SKIPPED)
                          .reason(reason)
                          .failure(cause)
                          .build();
    }

    public String getFullName() {
        return this.suiteName + "::" + this.testName;
    }

    /**
     * Gets a value indicating whether the test needed more than one attempt.
     *
     * @return True if the body was invoked more than once.
     */
    public boolean isRetried() {
        return this.attempts > 1;
    }
}
