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

import com.google.common.base.Preconditions;
import io.proctor.common.LoggerHelpers;
import io.proctor.engine.EngineConfig;
import io.proctor.engine.fixtures.FixtureGraph;
import io.proctor.engine.registry.ParameterSet;
import io.proctor.engine.registry.Registry;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.registry.TestDescriptor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides which tests run, in which order and with which concurrency group.
 * <p>
 * A parameterized test is expanded into one planned test per parameter set, named "test[set]". Suites pass their
 * ignored and only markers on to all of their tests. Selection rules, applied in this order:
 * <ol>
 * <li>If any test is marked "only" (directly or through its suite), every test that is not is dropped (across all
 * suites).</li>
 * <li>Category filters, against the suite's category: a non-empty include set requires the suite to have one of
 * the included categories; an excluded category drops the suite's tests.</li>
 * <li>Tag filters, against the union of test and suite tags: a non-empty include set requires a match; any
 * exclude match drops the test.</li>
 * <li>Name filters, against "suite::test" (with the parameter set, if any): the name pattern must be found; the
 * exclude pattern must not.</li>
 * <li>Ignored tests that pass the filters above are planned as SKIPPED, unless ignored tests are explicitly
 * included.</li>
 * </ol>
 * Dropped tests produce no outcome at all. Plan order is suite registration order, then test registration order,
 * then parameter set order.
 */
@Slf4j
@RequiredArgsConstructor
public class ExecutionPlanner {
    @NonNull
    private final EngineConfig config;

    /**
     * Validates the fixture graph of the given Registry and builds the ExecutionPlan.
     *
     * @param registry The Registry to plan from. It must be frozen.
     * @return The ExecutionPlan.
     * @throws io.proctor.engine.fixtures.FixtureGraphException If the fixture graph is invalid. No test may run in
     *                                                          that case.
     */
    public ExecutionPlan plan(Registry registry) {
        Preconditions.checkState(registry.isFrozen(), "Registry must be frozen before planning.");
        long traceId = LoggerHelpers.traceEnterWithContext(log, "planner", "plan");
        FixtureGraph graph = FixtureGraph.build(registry);

        boolean onlyMode = registry.allSuites().stream()
                                   .anyMatch(suite -> suite.isOnly() || suite.getTests().stream().anyMatch(TestDescriptor::isOnly));
        List<PlannedTest> planned = new ArrayList<>();
        int dropped = 0;
        for (SuiteDescriptor suite : registry.allSuites()) {
            String group = suite.isSerial() ? suite.getName() : ExecutionPlan.PARALLEL_GROUP;
            for (TestDescriptor test : suite.getTests()) {
                List<ParameterSet> sets = test.getParameterSets().isEmpty()
                        ? Collections.singletonList(null)
                        : test.getParameterSets();
                for (ParameterSet parameters : sets) {
                    PlannedTest candidate = new PlannedTest(planned.size(), suite, test, group, null, parameters);
                    if (onlyMode && !(test.isOnly() || suite.isOnly())) {
                        dropped++;
                    } else if (!matchesCategory(suite) || !matchesTags(suite, test) || !matchesName(candidate)) {
                        dropped++;
                    } else if ((test.isIgnored() || suite.isIgnored()) && !this.config.isIncludeIgnored()) {
                        planned.add(new PlannedTest(planned.size(), suite, test, group, SkipReasons.IGNORED, parameters));
                    } else {
                        planned.add(candidate);
                    }
                }
            }
        }

        ExecutionPlan plan = new ExecutionPlan(planned, graph);
        log.info("Planned {} test(s) from {} suite(s); {} filtered out{}.", plan.size(), plan.getSuiteNames().size(), dropped,
                onlyMode ? " (only mode)" : "");
        LoggerHelpers.traceLeave(log, "planner", "plan", traceId, plan);
        return plan;
    }

    private boolean matchesCategory(SuiteDescriptor suite) {
        String category = suite.getCategory();
        if (!this.config.getIncludeCategories().isEmpty() && (category == null || !this.config.getIncludeCategories().contains(category))) {
            return false;
        }

        return category == null || !this.config.getExcludeCategories().contains(category);
    }

    private boolean matchesTags(SuiteDescriptor suite, TestDescriptor test) {
        Set<String> tags = new HashSet<>(test.getTags());
        tags.addAll(suite.getTags());
        if (!this.config.getIncludeTags().isEmpty() && this.config.getIncludeTags().stream().noneMatch(tags::contains)) {
            return false;
        }

        return this.config.getExcludeTags().stream().noneMatch(tags::contains);
    }

    private boolean matchesName(PlannedTest test) {
        String fullName = test.getFullName();
        if (this.config.getNamePattern() != null && !this.config.getNamePattern().matcher(fullName).find()) {
            return false;
        }

        return this.config.getExcludePattern() == null || !this.config.getExcludePattern().matcher(fullName).find();
    }
}
