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
import io.proctor.common.Exceptions;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import lombok.Cleanup;
import lombok.extern.slf4j.Slf4j;

/**
 * A builder for a generic Property-based configuration.
 *
 * @param <T> Type of the configuration.
 */
@Slf4j
public class ConfigBuilder<T> {
    private final Properties properties;
    private final String namespace;
    private final ConfigConstructor<T> constructor;

    /**
     * Creates a new instance of the ConfigBuilder class.
     *
     * @param namespace   The configuration namespace to use.
     * @param constructor A Function that, given a TypedProperties object, returns a new instance of T using the given
     *                    property values.
     */
    public ConfigBuilder(String namespace, ConfigConstructor<T> constructor) {
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        Preconditions.checkNotNull(constructor, "constructor");
        this.properties = new Properties();
        this.namespace = namespace;
        this.constructor = constructor;
    }

    /**
     * Includes the given property and its value in the builder.
     *
     * @param property The property to set.
     * @param value    The value of the property. This must be of the same type as accepted by the Property.
     *                 In case a `null` value is sent, the value of the property will be set to empty string.
     * @param <V>      Type of the property.
     * @return This instance.
     */
    public <V> ConfigBuilder<T> with(Property<V> property, V value) {
        this.properties.setProperty(property.getFullName(this.namespace), value == null ? "" : value.toString());
        return this;
    }

    /**
     * Includes all the entries of the given java.util.Properties object that belong to this builder's namespace.
     * Entries already set on this builder are overwritten.
     *
     * @param source The Properties to include.
     * @return This instance.
     */
    public ConfigBuilder<T> include(Properties source) {
        Preconditions.checkNotNull(source, "source");
        String prefix = this.namespace + ".";
        for (String key : source.stringPropertyNames()) {
            if (key.startsWith(prefix)) {
                this.properties.setProperty(key, source.getProperty(key));
            }
        }

        return this;
    }

    /**
     * Loads the given .properties file and includes its entries that belong to this builder's namespace.
     *
     * @param propertiesFile Path to the file to load (UTF-8 encoded).
     * @return This instance.
     * @throws IOException If the file could not be read.
     */
    public ConfigBuilder<T> include(Path propertiesFile) throws IOException {
        Preconditions.checkNotNull(propertiesFile, "propertiesFile");
        Properties loaded = new Properties();
        @Cleanup
        Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8);
        loaded.load(reader);
        log.debug("Loaded {} properties from '{}'.", loaded.size(), propertiesFile);
        return include(loaded);
    }

    /**
     * Creates a new instance of the given Configuration class as defined by this builder with the information
     * contained herein.
     *
     * @return The newly created instance.
     * @throws ConfigurationException When a configuration issue has been detected. This can be:
     *                                MissingPropertyException (a required Property is missing from the given properties collection),
     *                                InvalidPropertyValueException (a Property has a value that is invalid for it).
     */
    public T build() throws ConfigurationException {
        return this.constructor.apply(new TypedProperties(this.properties, this.namespace));
    }

    @FunctionalInterface
    public interface ConfigConstructor<R> {
        R apply(TypedProperties properties) throws ConfigurationException;
    }
}
