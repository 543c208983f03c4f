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

/**
 * Creates a fixture value.
 */
@FunctionalInterface
public interface FixtureProducer {
    /**
     * Produces the fixture value.
     *
     * @param upstream The already-resolved values of the fixtures this fixture depends on.
     * @return The fixture value.
     * @throws Exception If the fixture could not be produced. The test requiring it is reported as SETUP_FAILED.
     */
    Object produce(FixtureValues upstream) throws Exception;
}
