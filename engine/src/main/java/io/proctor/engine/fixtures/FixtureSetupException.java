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

import lombok.Getter;

/**
 * Thrown when a fixture producer fails. The test that required the fixture is reported as SETUP_FAILED.
 */
public class FixtureSetupException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    @Getter
    private final String fixtureName;

    /**
     * Creates a new instance of the FixtureSetupException class.
     *
     * @param fixtureName The name of the fixture that could not be produced.
     * @param cause       The failure of the producer.
     */
    public FixtureSetupException(String fixtureName, Throwable cause) {
        super(String.format("Fixture '%s' could not be produced.", fixtureName), cause);
        this.fixtureName = fixtureName;
    }
}
