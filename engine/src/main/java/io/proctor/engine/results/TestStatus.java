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

/**
 * Final status of a test, or status of a single attempt.
 */
public enum TestStatus {
    PASSED,
    FAILED,
    SKIPPED,
    TIMED_OUT,
    /**
     * A before_each hook or a fixture producer failed; the body was not invoked (again).
     */
    SETUP_FAILED,
    /**
     * The test passed but an after_each hook or a fixture teardown failed.
     */
    TEARDOWN_FAILED;

    /**
     * Gets a value indicating whether an outcome with this status fails the run.
     *
     * @param teardownFailuresFailRun Whether TEARDOWN_FAILED counts as a failure.
     * @return True if this status fails the run.
     */
    public boolean failsRun(boolean teardownFailuresFailRun) {
        switch (this) {
            case FAILED:
            case TIMED_OUT:
            case SETUP_FAILED:
                return true;
            case TEARDOWN_FAILED:
                return teardownFailuresFailRun;
            default:
                return false;
        }
    }
}
