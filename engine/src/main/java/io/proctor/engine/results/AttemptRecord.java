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

import java.time.Duration;
import lombok.Data;

/**
 * Result of a single invocation of a test body.
 */
@Data
public class AttemptRecord {
    /**
     * One-based attempt number.
     */
    private final int attempt;
    /**
     * PASSED, FAILED, TIMED_OUT, or SKIPPED if the attempt was cancelled by a run abort.
     */
    private final TestStatus status;
    private final Duration elapsed;
    /**
     * What the body threw, or the timeout/cancellation that ended it. Null if the attempt passed.
     */
    private final Throwable failure;
}
