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
package io.proctor.engine.registry;

/**
 * Lifetime of a fixture instance.
 */
public enum FixtureScope {
    /**
     * One instance per run, shared by every test of every suite and released after all suites have finished.
     */
    SESSION,
    /**
     * One instance per suite, shared by every test of the suite and released after the suite's after_all hooks.
     */
    SUITE,
    /**
     * One instance per test attempt, released when the attempt ends.
     */
    TEST
}
