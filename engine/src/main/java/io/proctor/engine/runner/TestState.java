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
package io.proctor.engine.runner;

import com.google.common.collect.ImmutableSet;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * States a test goes through while the {@link TestRunner} executes it:
 * <pre>
 * PENDING -&gt; SETUP -&gt; RUNNING -&gt; (PASSED | FAILED | TIMED_OUT) -&gt; RETRYING -&gt; RUNNING ... -&gt; TEARDOWN -&gt; DONE
 * </pre>
 * SETUP and RUNNING may also go straight to TEARDOWN (setup failure or run abort).
 */
public enum TestState {
    PENDING,
    SETUP,
    RUNNING,
    PASSED,
    FAILED,
    TIMED_OUT,
    RETRYING,
    TEARDOWN,
    DONE;

    private static final Map<TestState, Set<TestState>> TRANSITIONS = new EnumMap<>(TestState.class);

    static {
        TRANSITIONS.put(PENDING, ImmutableSet.of(SETUP));
        TRANSITIONS.put(SETUP, ImmutableSet.of(RUNNING, TEARDOWN));
        TRANSITIONS.put(RUNNING, ImmutableSet.of(PASSED, FAILED, TIMED_OUT, TEARDOWN));
        TRANSITIONS.put(PASSED, ImmutableSet.of(TEARDOWN));
        TRANSITIONS.put(FAILED, ImmutableSet.of(RETRYING, TEARDOWN));
        TRANSITIONS.put(TIMED_OUT, ImmutableSet.of(RETRYING, TEARDOWN));
        TRANSITIONS.put(RETRYING, ImmutableSet.of(RUNNING));
        TRANSITIONS.put(TEARDOWN, ImmutableSet.of(DONE));
        TRANSITIONS.put(DONE, ImmutableSet.of());
    }

    /**
     * Gets a value indicating whether a test in this state may move to the given one.
     *
     * @param next The candidate next state.
     * @return True if the transition is allowed.
     */
    public boolean canTransitionTo(TestState next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
