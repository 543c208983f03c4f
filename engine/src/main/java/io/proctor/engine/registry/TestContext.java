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

import com.google.common.base.Preconditions;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * What a {@link TestBody} sees while running: its identity, the attempt number, the resolved fixtures and, for
 * parameterized tests, the arguments of the current parameter set.
 */
@Getter
@RequiredArgsConstructor
@ToString(exclude = "fixtures")
public class TestContext {
    private final String suiteName;
    /**
     * The name of the test, including the display name of its parameter set if it has one.
     */
    private final String testName;
    /**
     * One-based number of the current attempt.
     */
    private final int attempt;
    private final FixtureValues fixtures;
    /**
     * The parameter set of this test. Null if the test is not parameterized.
     */
    private final ParameterSet parameters;

    /**
     * Shorthand for {@code getFixtures().get(name, type)}.
     *
     * @param name The name of the fixture.
     * @param type The expected type of the value.
     * @param <T>  The expected type of the value.
     * @return The fixture value.
     */
    public <T> T fixture(String name, Class<T> type) {
        return this.fixtures.get(name, type);
    }

    /**
     * Gets the value of the given parameter of the current parameter set.
     *
     * @param name The name of the parameter.
     * @param type The expected type of the value.
     * @param <T>  The expected type of the value.
     * @return The parameter value.
     * @throws IllegalStateException    If the test is not parameterized.
     * @throws IllegalArgumentException If the parameter set has no such parameter.
     */
    public <T> T param(String name, Class<T> type) {
        Preconditions.checkState(this.parameters != null, "Test '%s::%s' is not parameterized.", this.suiteName, this.testName);
        return this.parameters.get(name, type);
    }
}
