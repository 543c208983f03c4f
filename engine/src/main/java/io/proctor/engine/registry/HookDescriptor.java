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

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Static description of a lifecycle hook bound to a suite.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"suiteName", "kind", "name"})
public class HookDescriptor {
    /**
     * Name of the owning suite. May be left unset when the hook is declared inside a {@link SuiteDescriptor}.
     */
    private final String suiteName;
    @NonNull
    private final HookKind kind;
    /**
     * Name of the hook, unique per suite and kind. Generated at registration when left unset.
     */
    private final String name;
    @NonNull
    private final HookAction action;
}
