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
package io.proctor.engine;

import io.proctor.common.util.ConfigBuilder;
import io.proctor.common.util.ConfigurationException;
import io.proctor.common.util.Property;
import io.proctor.common.util.TypedProperties;
import java.time.Duration;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.ToString;

/**
 * Configuration for a test run: selection filters, concurrency, timeouts and verdict policy.
 */
@ToString
public class EngineConfig {
    //region Config Names

    public static final Property<String> TAGS_INCLUDE = Property.named("tags.include", "");
    public static final Property<String> TAGS_EXCLUDE = Property.named("tags.exclude", "");
    public static final Property<String> CATEGORIES_INCLUDE = Property.named("categories.include", "");
    public static final Property<String> CATEGORIES_EXCLUDE = Property.named("categories.exclude", "");
    public static final Property<String> NAME_PATTERN = Property.named("name.pattern", "");
    public static final Property<String> NAME_EXCLUDE_PATTERN = Property.named("name.exclude.pattern", "");
    public static final Property<Integer> WORKER_COUNT = Property.named("worker.count", 4);
    public static final Property<Long> DEFAULT_TIMEOUT_MILLIS = Property.named("timeout.default.millis", 0L);
    public static final Property<Boolean> INCLUDE_IGNORED = Property.named("ignored.include", false);
    public static final Property<Boolean> FAIL_FAST = Property.named("failfast.enable", false);
    public static final Property<Boolean> TEARDOWN_FAILURES_FAIL_RUN = Property.named("teardown.failures.fail.run", false);
    public static final String COMPONENT_CODE = "proctor";

    //endregion

    //region Members

    /**
     * If non-empty, only tests carrying at least one of these tags (directly or through their suite) are run.
     */
    @Getter
    private final Set<String> includeTags;

    /**
     * Tests carrying any of these tags (directly or through their suite) are not run.
     */
    @Getter
    private final Set<String> excludeTags;

    /**
     * If non-empty, only tests of suites whose category is one of these are run.
     */
    @Getter
    private final Set<String> includeCategories;

    /**
     * Tests of suites whose category is one of these are not run.
     */
    @Getter
    private final Set<String> excludeCategories;

    /**
     * If set, only tests whose "suite::test" name contains a match are run.
     */
    @Getter
    private final Pattern namePattern;

    /**
     * If set, tests whose "suite::test" name contains a match are not run.
     */
    @Getter
    private final Pattern excludePattern;

    /**
     * Number of tests that may execute concurrently.
     */
    @Getter
    private final int workerCount;

    /**
     * Per-attempt time limit for tests that do not declare their own. Null means unbounded.
     */
    @Getter
    private final Duration defaultTimeout;

    /**
     * Whether ignored tests are run instead of being reported as skipped.
     */
    @Getter
    private final boolean includeIgnored;

    /**
     * Whether tests that have not started yet are skipped once any test fails the run.
     */
    @Getter
    private final boolean failFast;

    /**
     * Whether a TEARDOWN_FAILED outcome fails the run.
     */
    @Getter
    private final boolean teardownFailuresFailRun;

    //endregion

    //region Constructor

    /**
     * Creates a new instance of the EngineConfig class.
     *
     * @param properties The TypedProperties object to read Properties from.
     */
    private EngineConfig(TypedProperties properties) throws ConfigurationException {
        this.includeTags = properties.getStringSet(TAGS_INCLUDE);
        this.excludeTags = properties.getStringSet(TAGS_EXCLUDE);
        this.includeCategories = properties.getStringSet(CATEGORIES_INCLUDE);
        this.excludeCategories = properties.getStringSet(CATEGORIES_EXCLUDE);
        this.namePattern = properties.getPattern(NAME_PATTERN);
        this.excludePattern = properties.getPattern(NAME_EXCLUDE_PATTERN);
        this.workerCount = properties.getPositiveInt(WORKER_COUNT);
        this.defaultTimeout = properties.getOptionalMillis(DEFAULT_TIMEOUT_MILLIS);
        this.includeIgnored = properties.getBoolean(INCLUDE_IGNORED);
        this.failFast = properties.getBoolean(FAIL_FAST);
        this.teardownFailuresFailRun = properties.getBoolean(TEARDOWN_FAILURES_FAIL_RUN);
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class.
     *
     * @return A new Builder for this class.
     */
    public static ConfigBuilder<EngineConfig> builder() {
        return new ConfigBuilder<>(COMPONENT_CODE, EngineConfig::new);
    }

    //endregion
}
