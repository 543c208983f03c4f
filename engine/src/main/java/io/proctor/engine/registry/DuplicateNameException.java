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

import lombok.Getter;

/**
 * Thrown when a descriptor is registered under a name that is already taken within its namespace.
 */
public class DuplicateNameException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;
    @Getter
    private final String name;

    /**
     * Creates a new instance of the DuplicateNameException class.
     *
     * @param kind What the name identifies (suite, test, fixture or hook).
     * @param name The colliding name.
     */
    public DuplicateNameException(String kind, String name) {
        super(String.format("A %s named '%s' is already registered.", kind, name));
        this.name = name;
    }
}
