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

import io.proctor.common.Exceptions;
import io.proctor.engine.registry.FixtureDescriptor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * A produced fixture value, along with the descriptor that knows how to release it.
 */
@Slf4j
@RequiredArgsConstructor
class FixtureInstance {
    @Getter
    private final FixtureDescriptor descriptor;
    @Getter
    private final Object value;

    /**
     * Releases the value: invokes the fixture's teardown if it has one, otherwise closes the value if it is
     * AutoCloseable.
     *
     * @return The failure of the teardown, or null if it succeeded.
     */
    Throwable release() {
        try {
            if (this.descriptor.getTeardown() != null) {
                this.descriptor.getTeardown().teardown(this.value);
            } else if (this.value instanceof AutoCloseable) {
                ((AutoCloseable) this.value).close();
            }

            return null;
        } catch (Throwable ex) {
            if (Exceptions.mustRethrow(ex)) {
                throw Exceptions.sneakyThrow(ex);
            }

            log.warn("Teardown of fixture '{}' failed.", this.descriptor.getName(), ex);
            return ex;
        }
    }

    @Override
    public String toString() {
        return this.descriptor.getName();
    }
}
