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
package io.proctor.engine.fixtures;

import io.proctor.engine.registry.FixtureDescriptor;
import io.proctor.engine.registry.FixtureValues;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.registry.TestDescriptor;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the fixtures a test requires (its own and its suite's, plus everything they depend on) in
 * dependency order, reusing session- and suite-scoped values and producing test-scoped ones into the attempt's scope.
 */
@Slf4j
@RequiredArgsConstructor
public class FixtureResolver {
    @Getter
    @NonNull
    private final FixtureGraph graph;
    @Getter
    @NonNull
    private final SharedFixtureCache sessionFixtures;

    /**
     * Resolves the fixtures of the given test.
     *
     * @param suite         The suite of the test.
     * @param test          The test.
     * @param suiteFixtures The fixture cache of the suite, for SUITE-scoped fixtures.
     * @param testScope     The scope of the current attempt, for TEST-scoped fixtures.
     * @return The resolved values of every requested fixture and of their transitive dependencies.
     * @throws FixtureSetupException If a producer failed. Fixtures produced before the failure stay tracked by
     *                               their scope or cache and are released with it.
     */
    public FixtureValues resolve(SuiteDescriptor suite, TestDescriptor test, SharedFixtureCache suiteFixtures, TestFixtureScope testScope) {
        Set<String> requested = new LinkedHashSet<>(suite.getFixtures());
        requested.addAll(test.getFixtures());
        if (requested.isEmpty()) {
            return FixtureValues.EMPTY;
        }

        List<String> order = this.graph.resolutionOrder(requested);
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (String name : order) {
            FixtureDescriptor fixture = this.graph.get(name);
            FixtureValues upstream = upstreamOf(fixture, resolved);
            Object value;
            switch (fixture.getScope()) {
                case SESSION:
                    value = this.sessionFixtures.getOrCreate(fixture, upstream);
                    break;
                case SUITE:
                    value = suiteFixtures.getOrCreate(fixture, upstream);
                    break;
                default:
                    value = testScope.create(fixture, upstream);
                    break;
            }

            resolved.put(name, value);
        }

        log.trace("{}: resolved fixtures {}.", test.getFullName(), order);
        return new FixtureValues(resolved);
    }

    private FixtureValues upstreamOf(FixtureDescriptor fixture, Map<String, Object> resolved) {
        if (fixture.getDependencies().isEmpty()) {
            return FixtureValues.EMPTY;
        }

        Map<String, Object> upstream = new LinkedHashMap<>();
        fixture.getDependencies().forEach(d -> upstream.put(d, resolved.get(d)));
        return new FixtureValues(upstream);
    }
}
