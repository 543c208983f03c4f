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

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;

/**
 * Thrown when the fixture dependency graph contains a cycle.
 */
public class FixtureCycleException extends FixtureGraphException {
    private static final long serialVersionUID = 1L;
    /**
     * The fixtures on the cycle, in dependency order. The first and last elements are the same fixture.
     */
    @Getter
    private final List<String> cycle;

    /**
     * Creates a new instance of the FixtureCycleException class.
     *
     * @param cycle The fixtures on the cycle, starting and ending with the same fixture.
     */
    public FixtureCycleException(List<String> cycle) {
        super("Fixture dependency cycle detected: " + String.join(" -> ", cycle) + ".");
        this.cycle = ImmutableList.copyOf(cycle);
    }
}
