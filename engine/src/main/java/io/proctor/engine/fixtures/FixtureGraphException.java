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

/**
 * Thrown when the fixture dependency graph is structurally invalid: a dependency or requirement names an undefined
 * fixture, or a SUITE-scoped fixture depends on a TEST-scoped one. Raised before any test runs.
 */
public class FixtureGraphException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance of the FixtureGraphException class.
     *
     * @param message The message of the exception.
     */
    public FixtureGraphException(String message) {
        super(message);
    }
}
