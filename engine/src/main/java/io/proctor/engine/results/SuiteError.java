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

import io.proctor.common.Exceptions;
import lombok.Data;

/**
 * A failure that belongs to a suite rather than to any of its tests.
 */
@Data
public class SuiteError {
    private final String suiteName;
    private final Phase phase;
    private final Throwable cause;

    /**
     * Gets a one-line description of the cause.
     *
     * @return The description.
     */
    public String getReason() {
        return Exceptions.describe(this.cause);
    }

    /**
     * Where in the suite lifecycle the failure happened.
     */
    public enum Phase {
        BEFORE_ALL,
        AFTER_ALL,
        FIXTURE_TEARDOWN
    }
}
