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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.proctor.engine.registry.FixtureDescriptor;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.Registry;
import io.proctor.engine.registry.SuiteDescriptor;
import io.proctor.engine.registry.TestDescriptor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;
import lombok.extern.slf4j.Slf4j;

/**
 * Validated, acyclic fixture dependency graph, along with a deterministic topological order of all fixtures
 * (dependencies first, ties broken by registration order).
 */
@Slf4j
@Immutable
public final class FixtureGraph {
    //region Members

    private final Map<String, FixtureDescriptor> fixtures;
    private final List<String> topologicalOrder;

    //endregion

    //region Constructor

    private FixtureGraph(Map<String, FixtureDescriptor> fixtures, List<String> topologicalOrder) {
        this.fixtures = fixtures;
        this.topologicalOrder = ImmutableList.copyOf(topologicalOrder);
    }

    /**
     * Builds and validates the fixture graph for the given Registry.
     *
     * @param registry The Registry to inspect.
     * @return A new FixtureGraph.
     * @throws FixtureCycleException If the fixture dependencies contain a cycle.
     * @throws FixtureGraphException If a fixture depends on an undefined fixture, if a suite or test requires an
     *                               undefined fixture, or if a fixture depends on one with a shorter lifetime
     *                               (SESSION may only depend on SESSION, SUITE on SESSION or SUITE).
     */
    public static FixtureGraph build(Registry registry) {
        Preconditions.checkNotNull(registry, "registry");
        Map<String, FixtureDescriptor> fixtures = new LinkedHashMap<>();
        registry.allFixtures().forEach(f -> fixtures.put(f.getName(), f));

        for (FixtureDescriptor fixture : fixtures.values()) {
            for (String dependency : fixture.getDependencies()) {
                FixtureDescriptor target = fixtures.get(dependency);
                if (target == null) {
                    throw new FixtureGraphException(String.format("Fixture '%s' depends on undefined fixture '%s'.",
                            fixture.getName(), dependency));
                }

                if (isShorterLived(target.getScope(), fixture.getScope())) {
                    throw new FixtureGraphException(String.format("%s-scoped fixture '%s' cannot depend on %s-scoped fixture '%s'.",
                            fixture.getScope(), fixture.getName(), target.getScope(), dependency));
                }
            }
        }

        for (SuiteDescriptor suite : registry.allSuites()) {
            for (String name : suite.getFixtures()) {
                checkDefined(fixtures, name, "Suite '" + suite.getName() + "'");
            }

            for (TestDescriptor test : suite.getTests()) {
                for (String name : test.getFixtures()) {
                    checkDefined(fixtures, name, "Test '" + test.getFullName() + "'");
                }
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        List<String> order = new ArrayList<>(fixtures.size());
        for (String name : fixtures.keySet()) {
            visit(name, fixtures, marks, new ArrayList<>(), order);
        }

        log.debug("Fixture graph validated; order: {}.", order);
        return new FixtureGraph(fixtures, order);
    }

    //endregion

    //region Operations

    /**
     * Gets the given fixtures and everything they transitively depend on, in instantiation order (every fixture
     * comes after all of its dependencies).
     *
     * @param names The names of the requested fixtures.
     * @return An immutable List of fixture names.
     * @throws FixtureGraphException If any name does not match a fixture in this graph.
     */
    public List<String> resolutionOrder(Collection<String> names) {
        Set<String> closure = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        for (String name : names) {
            checkDefined(this.fixtures, name, "Request");
            pending.push(name);
        }

        while (!pending.isEmpty()) {
            String name = pending.pop();
            if (closure.add(name)) {
                this.fixtures.get(name).getDependencies().forEach(pending::push);
            }
        }

        return this.topologicalOrder.stream().filter(closure::contains).collect(ImmutableList.toImmutableList());
    }

    /**
     * Gets the fixture with the given name.
     *
     * @param name The name of the fixture.
     * @return The fixture.
     * @throws FixtureGraphException If no such fixture exists.
     */
    public FixtureDescriptor get(String name) {
        checkDefined(this.fixtures, name, "Request");
        return this.fixtures.get(name);
    }

    /**
     * Gets the names of all fixtures, in instantiation order.
     *
     * @return An immutable List of fixture names.
     */
    public List<String> getTopologicalOrder() {
        return this.topologicalOrder;
    }

    @Override
    public String toString() {
        return this.topologicalOrder.stream().collect(Collectors.joining(", ", "FixtureGraph[", "]"));
    }

    //endregion

    //region Helpers

    private static void visit(String name, Map<String, FixtureDescriptor> fixtures, Map<String, Mark> marks,
                              List<String> path, List<String> order) {
        Mark mark = marks.get(name);
        if (mark == Mark.VISITED) {
            return;
        } else if (mark == Mark.VISITING) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new FixtureCycleException(cycle);
        }

        marks.put(name, Mark.VISITING);
        path.add(name);
        for (String dependency : fixtures.get(name).getDependencies()) {
            visit(dependency, fixtures, marks, path, order);
        }

        path.remove(path.size() - 1);
        marks.put(name, Mark.VISITED);
        order.add(name);
    }

    private static boolean isShorterLived(FixtureScope dependencyScope, FixtureScope dependentScope) {
        // Scopes are declared from longest to shortest lifetime.
        return dependentScope.ordinal() < dependencyScope.ordinal();
    }

    private static void checkDefined(Map<String, FixtureDescriptor> fixtures, String name, String requester) {
        if (!fixtures.containsKey(name)) {
            throw new FixtureGraphException(String.format("%s requires undefined fixture '%s'.", requester, name));
        }
    }

    private enum Mark {
        VISITING,
        VISITED
    }

    //endregion
}
