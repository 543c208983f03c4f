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

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * What a {@link HookAction} sees while running.
 */
@Getter
@RequiredArgsConstructor
@ToString
public class HookContext {
    private final String suiteName;
    private final HookKind kind;
    /**
     * The test being wrapped, for BEFORE_EACH and AFTER_EACH hooks; null for suite-level hooks.
     */
    private final String testName;

    /**
     * Creates a HookContext for a suite-level (BEFORE_ALL or AFTER_ALL) hook.
     *
     * @param suiteName The name of the suite.
     * @param kind      The kind of hook.
     * @return A new HookContext.
     */
    public static HookContext forSuite(String suiteName, HookKind kind) {
        return new HookContext(suiteName, kind, null);
    }
}
