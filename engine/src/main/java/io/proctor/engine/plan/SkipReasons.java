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

/**
 * Reasons reported on SKIPPED outcomes.
 */
public final class SkipReasons {
    public static final String IGNORED = "ignored";
    public static final String SUITE_SETUP_FAILED = "suite setup failed";
    public static final String FAIL_FAST = "fail fast";
    public static final String RUN_ABORTED = "run aborted";

    private SkipReasons() {
    }
}
