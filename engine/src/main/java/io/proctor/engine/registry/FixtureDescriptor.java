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

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Static description of a fixture: how to produce its value, what it depends on and how long the value lives.
 * When no teardown is given and the produced value is {@link AutoCloseable}, the value is closed on release.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"name", "scope", "dependencies"})
public class FixtureDescriptor {
    @NonNull
    private final String name;
    @NonNull
    @Builder.Default
    private final FixtureScope scope = FixtureScope.TEST;
    @Singular("dependsOn")
    private final List<String> dependencies;
    @NonNull
    private final FixtureProducer producer;
    private final FixtureTeardown teardown;
}
