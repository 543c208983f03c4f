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

import com.google.common.collect.ImmutableList;
import io.proctor.engine.fixtures.FixtureGraph;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * The filtered, ordered set of tests selected for one run, along with the validated fixture graph they use.
 * Built fresh for every run.
 */
public class ExecutionPlan {
    /**
     * Concurrency group of tests that may run alongside any other test.
     */
    public static final String PARALLEL_GROUP = "parallel";
    @Getter
    private final List<PlannedTest> tests;
    @Getter
    private final FixtureGraph fixtureGraph;

    /**
     * Creates a new instance of the ExecutionPlan class.
     *
     * @param tests        The planned tests, in plan order.
     * @param fixtureGraph The validated fixture graph.
     */
    public ExecutionPlan(List<PlannedTest> tests, FixtureGraph fixtureGraph) {
        this.tests = ImmutableList.copyOf(tests);
        this.fixtureGraph = fixtureGraph;
    }

    /**
     * Gets the names of the suites that have at least one planned test, in plan order.
     *
     * @return An immutable List of suite names.
     */
    public List<String> getSuiteNames() {
        return this.tests.stream().map(PlannedTest::getSuiteName).distinct().collect(ImmutableList.toImmutableList());
    }

    /**
     * Gets the planned tests of the given suite, in plan order.
     *
     * @param suiteName The name of the suite.
     * @return A List of planned tests.
     */
    public List<PlannedTest> getTests(String suiteName) {
        return this.tests.stream().filter(t -> t.getSuiteName().equals(suiteName)).collect(Collectors.toList());
    }

    public int size() {
        return this.tests.size();
    }

    @Override
    public String toString() {
        return String.format("ExecutionPlan[tests=%d, suites=%s]", this.tests.size(), getSuiteNames());
    }
}
