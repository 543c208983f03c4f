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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolved fixture values, looked up by fixture name.
 */
public final class FixtureValues {
    /**
     * A FixtureValues instance without any values.
     */
    public static final FixtureValues EMPTY = new FixtureValues(Collections.emptyMap());
    private final Map<String, Object> values;

    /**
     * Creates a new instance of the FixtureValues class.
     *
     * @param values The values, keyed by fixture name. A copy is made, preserving iteration order. Null values are allowed.
     */
    public FixtureValues(Map<String, Object> values) {
        Preconditions.checkNotNull(values, "values");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Gets the value of the given fixture.
     *
     * @param name The name of the fixture.
     * @param type The expected type of the value.
     * @param <T>  The expected type of the value.
     * @return The value, which may be null if the producer returned null.
     * @throws IllegalArgumentException If no fixture with the given name was resolved.
     * @throws ClassCastException       If the value is not an instance of type.
     */
    public <T> T get(String name, Class<T> type) {
        Preconditions.checkArgument(this.values.containsKey(name), "Fixture '%s' was not resolved; available: %s.", name, this.values.keySet());
        return type.cast(this.values.get(name));
    }

    /**
     * Gets a value indicating whether the given fixture was resolved.
     *
     * @param name The name of the fixture.
     * @return True if resolved.
     */
    public boolean contains(String name) {
        return this.values.containsKey(name);
    }

    /**
     * Gets the names of all resolved fixtures, in resolution order.
     *
     * @return An unmodifiable Set of names.
     */
    public Set<String> names() {
        return this.values.keySet();
    }

    @Override
    public String toString() {
        return this.values.keySet().toString();
    }
}
