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
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

/**
 * Static description of a single test. Immutable once registered.
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"suiteName", "name", "ignored", "only", "retries", "timeout"})
public class TestDescriptor {
    /**
     * Name of the owning suite. May be left unset when the test is declared inside a {@link SuiteDescriptor};
     * the {@link Registry} fills it in.
     */
    private final String suiteName;
    @NonNull
    private final String name;
    @NonNull
    private final TestBody body;
    private final boolean ignored;
    private final boolean only;
    /**
     * Number of additional attempts after a failed or timed out one. Null means the suite's value applies.
     */
    private final Integer retries;
    /**
     * Per-attempt time limit. Null means the suite's value, then the engine-wide default, applies.
     */
    private final Duration timeout;
    @Singular
    private final Set<String> tags;
    @Singular
    private final List<String> fixtures;
    /**
     * If not empty, the test is parameterized: it is planned once per set, and each planned test sees its own set.
     */
    @Singular
    private final List<ParameterSet> parameterSets;

    /**
     * Gets the fully qualified name of this test, in the form "suite::test".
     *
     * @return The full name.
     */
    public String getFullName() {
        return this.suiteName + "::" + this.name;
    }
}
