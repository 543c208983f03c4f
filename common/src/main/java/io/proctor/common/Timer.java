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
package io.proctor.common;

import java.time.Duration;

/**
 * Measures elapsed time from the moment it was created, using the monotonic {@link System#nanoTime()} clock.
 */
public class Timer {
    private static final int NANOS_TO_MILLIS = 1000 * 1000;
    private final long startNanos;

    /**
     * Creates a new instance of the Timer class.
     */
    public Timer() {
        this.startNanos = System.nanoTime();
    }

    /**
     * Gets the elapsed time, in nanoseconds.
     *
     * @return Long indicating elapsed time, in nanoseconds.
     */
    public long getElapsedNanos() {
        return Math.max(0, System.nanoTime() - this.startNanos);
    }

    /**
     * Gets the elapsed time, in milliseconds.
     *
     * @return Long indicating elapsed time, in milliseconds.
     */
    public long getElapsedMillis() {
        return getElapsedNanos() / NANOS_TO_MILLIS;
    }

    /**
     * Gets the elapsed time.
     *
     * @return Duration indicating elapsed time.
     */
    public Duration getElapsed() {
        return Duration.ofNanos(getElapsedNanos());
    }

    @Override
    public String toString() {
        return getElapsedMillis() + "ms";
    }
}
