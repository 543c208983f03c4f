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

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Static description of a suite: its tests, hooks, the fixtures every test of it requires and the attributes every
 * test of it inherits (tags, ignored, only, retries and timeout). Never mutated during execution.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"name", "serial", "ignored", "only", "retries", "timeout", "category", "tags"})
public class SuiteDescriptor {
    @NonNull
    private final String name;
    @Singular
    private final List<TestDescriptor> tests;
    @Singular
    private final List<HookDescriptor> hooks;
    @Singular
    private final List<String> fixtures;
    @Singular
    private final Set<String> tags;
    /**
     * When set, tests of this suite never run concurrently with each other.
     */
    private final boolean serial;
    /**
     * When set, every test of this suite is ignored.
     */
    private final boolean ignored;
    /**
     * When set, every test of this suite is marked "only".
     */
    private final boolean only;
    /**
     * Retries for tests that do not declare their own. Null means 0.
     */
    private final Integer retries;
    /**
     * Per-attempt time limit for tests that do not declare their own. Null means the engine-wide default applies.
     */
    private final Duration timeout;
    /**
     * Optional category, matched by the category filters of a run.
     */
    private final String category;

    /**
     * Gets the hooks of the given kind, in registration order.
     *
     * @param kind The kind of hooks to get.
     * @return A List of hooks.
     */
    public List<HookDescriptor> getHooks(HookKind kind) {
        return this.hooks.stream().filter(h -> h.getKind() == kind).collect(Collectors.toList());
    }

    public static class SuiteDescriptorBuilder {
        /**
         * Adds a hook of the given kind.
         *
         * @param kind   The kind of hook.
         * @param name   The name of the hook.
         * @param action The code to run.
         * @return This builder.
         */
        public SuiteDescriptorBuilder withHook(HookKind kind, String name, HookAction action) {
            return hook(HookDescriptor.builder().kind(kind).name(name).action(action).build());
        }
    }
}
