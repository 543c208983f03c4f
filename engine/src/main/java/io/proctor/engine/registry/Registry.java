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
import com.google.common.collect.ImmutableList;
import io.proctor.common.Exceptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the static set of discovered suites, tests, fixtures and hooks.
 * <p>
 * Names live in separate namespaces: suites and fixtures are global, tests are per suite and hooks are per suite
 * and kind. The Registry is populated once, at startup, and then frozen; it is read-only afterwards.
 */
@Slf4j
@ThreadSafe
public class Registry {
    //region Members

    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<String, SuiteEntry> suites = new LinkedHashMap<>();
    @GuardedBy("lock")
    private final Map<String, FixtureDescriptor> fixtures = new LinkedHashMap<>();
    @GuardedBy("lock")
    private List<SuiteDescriptor> frozenSuites;

    //endregion

    //region Registration

    /**
     * Registers a suite, along with any tests and hooks declared inline on it.
     *
     * @param suite The suite to register.
     * @throws DuplicateNameException   If a suite with the same name exists, or if the inline tests or hooks collide.
     * @throws RegistryFrozenException  If the Registry is frozen.
     * @throws IllegalArgumentException If an inline test or hook names a different suite.
     */
    public void register(SuiteDescriptor suite) {
        Preconditions.checkNotNull(suite, "suite");
        Exceptions.checkNotNullOrEmpty(suite.getName(), "suite.name");
        synchronized (this.lock) {
            checkNotFrozen(suite);
            if (this.suites.containsKey(suite.getName())) {
                throw new DuplicateNameException("suite", suite.getName());
            }

            Exceptions.checkArgument(suite.getRetries() == null || suite.getRetries() >= 0, "suite.retries",
                    "Must be a non-negative number (suite '%s').", suite.getName());
            Exceptions.checkArgument(isPositive(suite.getTimeout()), "suite.timeout", "Must be a positive duration (suite '%s').", suite.getName());

            // Build the entry completely before publishing it, so a collision leaves nothing behind.
            SuiteEntry entry = new SuiteEntry(suite.toBuilder().clearTests().clearHooks().build());
            suite.getTests().forEach(entry::addTest);
            suite.getHooks().forEach(entry::addHook);
            this.suites.put(suite.getName(), entry);
        }

        log.debug("Registered suite '{}' ({} test(s), {} hook(s)).", suite.getName(), suite.getTests().size(), suite.getHooks().size());
    }

    /**
     * Registers a test into an already registered suite.
     *
     * @param test The test to register. Its suite name must be set.
     * @throws DuplicateNameException   If the suite already has a test with the same name.
     * @throws RegistryFrozenException  If the Registry is frozen.
     * @throws IllegalArgumentException If the suite is not registered.
     */
    public void register(TestDescriptor test) {
        Preconditions.checkNotNull(test, "test");
        Exceptions.checkNotNullOrEmpty(test.getSuiteName(), "test.suiteName");
        synchronized (this.lock) {
            checkNotFrozen(test);
            getEntry(test.getSuiteName()).addTest(test);
        }
    }

    /**
     * Registers a hook into an already registered suite.
     *
     * @param hook The hook to register. Its suite name must be set.
     * @throws DuplicateNameException   If the suite already has a hook of the same kind with the same name.
     * @throws RegistryFrozenException  If the Registry is frozen.
     * @throws IllegalArgumentException If the suite is not registered.
     */
    public void register(HookDescriptor hook) {
        Preconditions.checkNotNull(hook, "hook");
        Exceptions.checkNotNullOrEmpty(hook.getSuiteName(), "hook.suiteName");
        synchronized (this.lock) {
            checkNotFrozen(hook);
            getEntry(hook.getSuiteName()).addHook(hook);
        }
    }

    /**
     * Registers a fixture. Dependencies are not validated here; the fixture graph is validated when a run is planned.
     *
     * @param fixture The fixture to register.
     * @throws DuplicateNameException  If a fixture with the same name exists.
     * @throws RegistryFrozenException If the Registry is frozen.
     */
    public void register(FixtureDescriptor fixture) {
        Preconditions.checkNotNull(fixture, "fixture");
        Exceptions.checkNotNullOrEmpty(fixture.getName(), "fixture.name");
        synchronized (this.lock) {
            checkNotFrozen(fixture);
            if (this.fixtures.containsKey(fixture.getName())) {
                throw new DuplicateNameException("fixture", fixture.getName());
            }

            this.fixtures.put(fixture.getName(), fixture);
        }
    }

    /**
     * Ends discovery. Every subsequent registration fails with {@link RegistryFrozenException}. Invoking this more
     * than once has no further effect.
     */
    public void freeze() {
        synchronized (this.lock) {
            if (this.frozenSuites != null) {
                return;
            }

            this.frozenSuites = snapshotSuites();
            log.info("Registry frozen: {} suite(s), {} test(s), {} fixture(s).", this.frozenSuites.size(),
                    this.frozenSuites.stream().mapToInt(s -> s.getTests().size()).sum(), this.fixtures.size());
        }
    }

    /**
     * Gets a value indicating whether the Registry has been frozen.
     *
     * @return True if frozen.
     */
    public boolean isFrozen() {
        synchronized (this.lock) {
            return this.frozenSuites != null;
        }
    }

    //endregion

    //region Queries

    /**
     * Gets all suites, in registration order. Each suite lists its tests and hooks in registration order.
     *
     * @return An immutable List of suites.
     */
    public List<SuiteDescriptor> allSuites() {
        synchronized (this.lock) {
            return this.frozenSuites != null ? this.frozenSuites : snapshotSuites();
        }
    }

    /**
     * Gets all tests: suites in registration order, then tests in registration order.
     *
     * @return An immutable List of tests.
     */
    public List<TestDescriptor> allTests() {
        return allSuites().stream()
                          .flatMap(s -> s.getTests().stream())
                          .collect(ImmutableList.toImmutableList());
    }

    /**
     * Gets the suite with the given name.
     *
     * @param suiteName The name of the suite.
     * @return The suite, or null if no such suite is registered.
     */
    public SuiteDescriptor getSuite(String suiteName) {
        return allSuites().stream().filter(s -> s.getName().equals(suiteName)).findFirst().orElse(null);
    }

    /**
     * Gets the fixture with the given name.
     *
     * @param fixtureName The name of the fixture.
     * @return The fixture, or null if no such fixture is registered.
     */
    public FixtureDescriptor getFixture(String fixtureName) {
        synchronized (this.lock) {
            return this.fixtures.get(fixtureName);
        }
    }

    /**
     * Gets all fixtures, in registration order.
     *
     * @return An immutable List of fixtures.
     */
    public List<FixtureDescriptor> allFixtures() {
        synchronized (this.lock) {
            return ImmutableList.copyOf(this.fixtures.values());
        }
    }

    /**
     * Gets the fixtures required directly by the given suite or by any of its tests, in declaration order and
     * without duplicates. Names that do not match a registered fixture are skipped.
     *
     * @param suiteName The name of the suite.
     * @return An immutable List of fixtures.
     * @throws IllegalArgumentException If the suite is not registered.
     */
    public List<FixtureDescriptor> fixturesFor(String suiteName) {
        SuiteDescriptor suite = getSuite(suiteName);
        Preconditions.checkArgument(suite != null, "Unknown suite '%s'.", suiteName);
        Set<String> names = new LinkedHashSet<>(suite.getFixtures());
        suite.getTests().forEach(t -> names.addAll(t.getFixtures()));
        synchronized (this.lock) {
            return names.stream()
                        .map(this.fixtures::get)
                        .filter(f -> f != null)
                        .collect(ImmutableList.toImmutableList());
        }
    }

    /**
     * Gets the hooks of the given kind for the given suite, in registration order.
     *
     * @param suiteName The name of the suite.
     * @param kind      The kind of hooks.
     * @return A List of hooks.
     * @throws IllegalArgumentException If the suite is not registered.
     */
    public List<HookDescriptor> hooksFor(String suiteName, HookKind kind) {
        SuiteDescriptor suite = getSuite(suiteName);
        Preconditions.checkArgument(suite != null, "Unknown suite '%s'.", suiteName);
        return suite.getHooks(kind);
    }

    //endregion

    //region Helpers

    @GuardedBy("lock")
    private void checkNotFrozen(Object descriptor) {
        if (this.frozenSuites != null) {
            throw new RegistryFrozenException(descriptor);
        }
    }

    @GuardedBy("lock")
    private static boolean isPositive(Duration timeout) {
        return timeout == null || !timeout.isNegative() && !timeout.isZero();
    }

    private SuiteEntry getEntry(String suiteName) {
        SuiteEntry entry = this.suites.get(suiteName);
        if (entry == null) {
            throw new IllegalArgumentException(String.format("Unknown suite '%s'.", suiteName));
        }

        return entry;
    }

    @GuardedBy("lock")
    private List<SuiteDescriptor> snapshotSuites() {
        return this.suites.values().stream().map(SuiteEntry::toDescriptor).collect(ImmutableList.toImmutableList());
    }

    /**
     * Mutable registration state of one suite.
     */
    private static class SuiteEntry {
        private final SuiteDescriptor suite;
        private final Map<String, TestDescriptor> tests = new LinkedHashMap<>();
        private final Map<HookKind, Map<String, HookDescriptor>> hooks = new EnumMap<>(HookKind.class);
        private final List<HookDescriptor> hooksInOrder = new ArrayList<>();

        SuiteEntry(SuiteDescriptor suite) {
            this.suite = suite;
        }

        void addTest(TestDescriptor test) {
            String suiteName = this.suite.getName();
            Exceptions.checkNotNullOrEmpty(test.getName(), "test.name");
            Exceptions.checkArgument(test.getSuiteName() == null || test.getSuiteName().equals(suiteName), "test.suiteName",
                    "Test '%s' declares suite '%s' but is registered into suite '%s'.", test.getName(), test.getSuiteName(), suiteName);
            Exceptions.checkArgument(test.getRetries() == null || test.getRetries() >= 0, "test.retries",
                    "Must be a non-negative number (test '%s').", test.getName());
            Exceptions.checkArgument(isPositive(test.getTimeout()), "test.timeout", "Must be a positive duration (test '%s').", test.getName());
            Set<String> displayNames = new HashSet<>();
            for (ParameterSet set : test.getParameterSets()) {
                Exceptions.checkArgument(displayNames.add(set.getDisplayName()), "test.parameterSets",
                        "Duplicate parameter set '%s' (test '%s').", set.getDisplayName(), test.getName());
            }

            if (this.tests.containsKey(test.getName())) {
                throw new DuplicateNameException("test", suiteName + "::" + test.getName());
            }

            this.tests.put(test.getName(), test.getSuiteName() == null ? test.toBuilder().suiteName(suiteName).build() : test);
        }

        void addHook(HookDescriptor hook) {
            String suiteName = this.suite.getName();
            Exceptions.checkArgument(hook.getSuiteName() == null || hook.getSuiteName().equals(suiteName), "hook.suiteName",
                    "Hook declares suite '%s' but is registered into suite '%s'.", hook.getSuiteName(), suiteName);
            Map<String, HookDescriptor> ofKind = this.hooks.computeIfAbsent(hook.getKind(), k -> new LinkedHashMap<>());
            String name = hook.getName() != null
                    ? hook.getName()
                    : hook.getKind().name().toLowerCase(Locale.ROOT) + "#" + (ofKind.size() + 1);
            if (ofKind.containsKey(name)) {
                throw new DuplicateNameException(hook.getKind() + " hook", suiteName + "::" + name);
            }

            HookDescriptor adopted = hook.toBuilder().suiteName(suiteName).name(name).build();
            ofKind.put(name, adopted);
            this.hooksInOrder.add(adopted);
        }

        SuiteDescriptor toDescriptor() {
            return this.suite.toBuilder()
                             .clearTests()
                             .tests(this.tests.values())
                             .clearHooks()
                             .hooks(this.hooksInOrder)
                             .build();
        }
    }

    //endregion
}
