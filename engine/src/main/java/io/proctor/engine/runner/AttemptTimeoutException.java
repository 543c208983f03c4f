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

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fails an attempt whose body did not complete within its time limit.
 */
public class AttemptTimeoutException extends TimeoutException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance of the AttemptTimeoutException class.
     *
     * @param testName The full name of the test.
     * @param attempt  The attempt number.
     * @param timeout  The time limit that was exceeded.
     */
    public AttemptTimeoutException(String testName, int attempt, Duration timeout) {
        super(String.format("Attempt %d of '%s' did not complete within %dms.", attempt, testName, timeout.toMillis()));
    }
}
