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
import io.proctor.common.Exceptions;
import io.proctor.engine.registry.FixtureDescriptor;
import io.proctor.engine.registry.FixtureScope;
import io.proctor.engine.registry.FixtureValues;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the TEST-scoped fixture instances of a single test attempt. Every attempt gets its own scope, which must
 * be released on every exit path.
 */
@Slf4j
@NotThreadSafe
public class TestFixtureScope {
    private final String testName;
    private final List<FixtureInstance> created = new ArrayList<>();
    private boolean released;

    /**
     * Creates a new instance of the TestFixtureScope class.
     *
     * @param testName The full name of the test owning this scope (for logging).
     */
    public TestFixtureScope(String testName) {
        this.testName = testName;
    }

    /**
     * Produces a new instance of the given fixture and tracks it for release.
     *
     * @param fixture  The fixture to produce. Must be TEST-scoped.
     * @param upstream The values of the fixture's dependencies.
     * @return The produced value.
     * @throws FixtureSetupException If the producer failed.
     */
    public Object create(FixtureDescriptor fixture, FixtureValues upstream) {
        Preconditions.checkArgument(fixture.getScope() == FixtureScope.TEST, "Fixture '%s' is not test-scoped.", fixture.getName());
        Preconditions.checkState(!this.released, "Fixture scope of '%s' has already been released.", this.testName);
        Object value;
        try {
            value = fixture.getProducer().produce(upstream);
        } catch (Throwable ex) {
            if (Exceptions.mustRethrow(ex)) {
                throw Exceptions.sneakyThrow(ex);
            }

            throw new FixtureSetupException(fixture.getName(), ex);
        }

        this.created.add(new FixtureInstance(fixture, value));
        return value;
    }

    /**
     * Releases every instance created in this scope, in reverse creation order. Releasing a scope more than once
     * has no further effect.
     *
     * @return The teardown failures, in release order. Empty if all succeeded.
     */
    public List<Throwable> release() {
        if (this.released) {
            return Collections.emptyList();
        }

        this.released = true;
        List<Throwable> failures = new ArrayList<>();
        for (int i = this.created.size() - 1; i >= 0; i--) {
            Throwable failure = this.created.get(i).release();
            if (failure != null) {
                failures.add(failure);
            }
        }

        log.trace("{}: released {} test fixture(s), {} failure(s).", this.testName, this.created.size(), failures.size());
        this.created.clear();
        return failures;
    }
}
