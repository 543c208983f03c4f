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
 * Lifecycle points a hook can be bound to.
 */
public enum HookKind {
    /**
     * Runs once per suite, before the first test of the suite.
     */
    BEFORE_ALL,
    /**
     * Runs once per suite, after every planned test of the suite has finished.
     */
    AFTER_ALL,
    /**
     * Runs before every test of the suite.
     */
    BEFORE_EACH,
    /**
     * Runs after every test of the suite, on every exit path.
     */
    AFTER_EACH;

    /**
     * Gets a value indicating whether hooks of this kind run after the work they wrap. Such hooks keep running
     * when one of them fails.
     *
     * @return True for AFTER_ALL and AFTER_EACH.
     */
    public boolean isTeardown() {
        return this == AFTER_ALL || this == AFTER_EACH;
    }
}
