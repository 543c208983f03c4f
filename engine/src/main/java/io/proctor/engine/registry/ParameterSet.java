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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;

/**
 * One named combination of arguments for a parameterized test. Each set of a test is planned as a separate test,
 * named "test[display name]".
 */
@Getter
@Builder
@EqualsAndHashCode
public class ParameterSet {
    /**
     * Optional name. When null, the display name is derived from the values.
     */
    private final String name;
    /**
     * Argument values by parameter name, in declaration order. Null values are allowed.
     */
    @Singular
    private final Map<String, Object> values;

    /**
     * Gets the name used to tell this set apart from the other sets of the same test: the name if set, otherwise
     * the values in the form "k1=v1, k2=v2".
     *
     * @return The display name.
     */
    public String getDisplayName() {
        if (this.name != null) {
            return this.name;
        }

        return this.values.entrySet().stream()
                          .map(e -> e.getKey() + "=" + e.getValue())
                          .collect(Collectors.joining(", "));
    }

    /**
     * Gets the value of the given parameter.
     *
     * @param name The name of the parameter.
     * @param type The expected type of the value.
     * @param <T>  The expected type of the value.
     * @return The value, which may be null.
     * @throws IllegalArgumentException If this set has no such parameter.
     * @throws ClassCastException       If the value is not an instance of type.
     */
    public <T> T get(String name, Class<T> type) {
        Preconditions.checkArgument(this.values.containsKey(name), "Parameter '%s' not found; available: %s.", name, this.values.keySet());
        return type.cast(this.values.get(name));
    }

    /**
     * Builds one unnamed ParameterSet per combination of the given parameter values. The last parameter varies
     * fastest; e.g. {a: [1, 2], b: [x, y]} yields (a=1, b=x), (a=1, b=y), (a=2, b=x), (a=2, b=y).
     *
     * @param parameters Candidate values by parameter name, iterated in the map's order.
     * @return The combinations. Empty if parameters is empty or if any parameter has no candidate values.
     */
    public static List<ParameterSet> cartesianProduct(Map<String, ? extends List<?>> parameters) {
        Preconditions.checkNotNull(parameters, "parameters");
        List<ParameterSet> result = new ArrayList<>();
        if (!parameters.isEmpty()) {
            combine(new ArrayList<>(parameters.entrySet()), 0, new LinkedHashMap<>(), result);
        }

        return Collections.unmodifiableList(result);
    }

    private static void combine(List<? extends Map.Entry<String, ? extends List<?>>> parameters, int index,
                                LinkedHashMap<String, Object> current, List<ParameterSet> result) {
        if (index == parameters.size()) {
            result.add(ParameterSet.builder().values(current).build());
            return;
        }

        Map.Entry<String, ? extends List<?>> parameter = parameters.get(index);
        for (Object value : parameter.getValue()) {
            current.put(parameter.getKey(), value);
            combine(parameters, index + 1, current, result);
        }

        current.remove(parameter.getKey());
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
