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
package io.proctor.common.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import io.proctor.common.Exceptions;
import java.time.Duration;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Wrapper for a java.util.Properties object, that sections it based on a namespace. Provides useful methods for
 * getting typed values out of it.
 */
public class TypedProperties {
    //region Members

    private static final String SEPARATOR = ".";
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
    private final String keyPrefix;
    private final Properties properties;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to wrap.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        Preconditions.checkNotNull(properties, "properties");
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.properties = properties;
        this.keyPrefix = namespace + SEPARATOR;
    }

    //endregion

    //region Getters

    /**
     * Gets the value of a String property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set.
     */
    public String get(Property<String> property) throws ConfigurationException {
        return tryGet(property, s -> s);
    }

    /**
     * Gets the value of an Integer property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set, or when the property cannot be parsed as an Integer.
     */
    public int getInt(Property<Integer> property) throws ConfigurationException {
        return tryGet(property, Integer::parseInt);
    }

    /**
     * Gets the value of a Long property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set, or when the property cannot be parsed as a Long.
     */
    public long getLong(Property<Long> property) throws ConfigurationException {
        return tryGet(property, Long::parseLong);
    }

    /**
     * Gets a boolean value. Accepts "true"/"false", "yes"/"no" and "1"/"0" (case insensitive).
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set, or when the property cannot be parsed as a Boolean.
     */
    public boolean getBoolean(Property<Boolean> property) throws ConfigurationException {
        return tryGet(property, this::parseBoolean);
    }

    /**
     * Gets the value of an Integer property only if it is greater than 0.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set, or when the property cannot be parsed as a positive Integer.
     */
    public int getPositiveInt(Property<Integer> property) {
        int value = getInt(property);
        if (value <= 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a positive integer.", property));
        }
        return value;
    }

    /**
     * Gets the value of a Long property only if it is greater than or equal to 0.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException When the property cannot be parsed as a non-negative Long.
     */
    public long getNonNegativeLong(Property<Long> property) {
        long value = getLong(property);
        if (value < 0) {
            throw new ConfigurationException(String.format("Property '%s' must be a non-negative long.", property));
        }
        return value;
    }

    /**
     * Gets a millisecond-valued Long property as a Duration. A value of 0 means "not set".
     *
     * @param property The Property to get.
     * @return The Duration, or null if the property value is 0.
     * @throws ConfigurationException When the property cannot be parsed as a non-negative Long.
     */
    public Duration getOptionalMillis(Property<Long> property) {
        long millis = getNonNegativeLong(property);
        return millis == 0 ? null : Duration.ofMillis(millis);
    }

    /**
     * Gets a comma-separated String property as a set of trimmed, non-empty values, in the order they were given.
     *
     * @param property The Property to get.
     * @return An immutable Set with the values. Empty if the property value is empty.
     * @throws ConfigurationException When the given property name does not exist within the current component and the property
     *                                does not have a default value set.
     */
    public Set<String> getStringSet(Property<String> property) {
        return tryGet(property, s -> ImmutableSet.copyOf(LIST_SPLITTER.split(s)));
    }

    /**
     * Gets a regular expression property.
     *
     * @param property The Property to get.
     * @return The compiled Pattern, or null if the property value is empty.
     * @throws ConfigurationException When the property value is not a valid regular expression.
     */
    public Pattern getPattern(Property<String> property) {
        return tryGet(property, s -> s.isEmpty() ? null : Pattern.compile(s));
    }

    private <T, V> T tryGet(Property<V> property, Function<String, T> converter) {
        String fullName = this.keyPrefix + property.getName();
        String propValue = this.properties.getProperty(fullName, null);
        if (propValue == null) {
            if (!property.hasDefaultValue()) {
                throw new MissingPropertyException(fullName);
            }

            propValue = property.getDefaultValue().toString();
        }

        try {
            return converter.apply(propValue.trim());
        } catch (IllegalArgumentException ex) {
            // Includes NumberFormatException and PatternSyntaxException.
            throw new InvalidPropertyValueException(fullName, propValue, ex);
        }
    }

    private boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equalsIgnoreCase("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equalsIgnoreCase("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format("String '%s' cannot be interpreted as a valid Boolean.", value));
        }
    }

    //endregion
}
