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

import org.slf4j.Logger;

/**
 * Helper methods for enter/leave tracing and compact exception logging.
 */
public final class LoggerHelpers {

    /**
     * Traces the fact that a method entry has occurred.
     *
     * @param log     The Logger to log to.
     * @param context Identifying context for the operation, such as the run or test being executed.
     * @param method  The name of the method.
     * @param args    The arguments to the method.
     * @return A generated identifier that can be used to correlate this traceEnter with its corresponding traceLeave.
     * This is usually generated from the current System time, and when used with traceLeave it can be used to log
     * elapsed call times. Returns 0 when trace logging is disabled.
     */
    public static long traceEnterWithContext(Logger log, String context, String method, Object... args) {
        if (!log.isTraceEnabled()) {
            return 0;
        }

        long time = System.nanoTime();
        log.trace("ENTER {}::{}@{} {}.", context, method, time, args);
        return time;
    }

    /**
     * Traces the fact that a method has exited normally.
     *
     * @param log          The Logger to log to.
     * @param context      Identifying context for the operation.
     * @param method       The name of the method.
     * @param traceEnterId The correlation Id obtained from a traceEnterWithContext call.
     * @param args         Additional arguments to log.
     */
    public static void traceLeave(Logger log, String context, String method, long traceEnterId, Object... args) {
        if (!log.isTraceEnabled()) {
            return;
        }

        long elapsedMicros = (System.nanoTime() - traceEnterId) / 1000;
        if (args.length == 0) {
            log.trace("LEAVE {}::{}@{} (elapsed={}us).", context, method, traceEnterId, elapsedMicros);
        } else {
            log.trace("LEAVE {}::{}@{} {} (elapsed={}us).", context, method, traceEnterId, args, elapsedMicros);
        }
    }

    /**
     * Returns either the given {@link Throwable} or its string representation, depending on whether debug
     * logging is enabled.
     *
     * @param log The Logger to query.
     * @param e   The exception to summarize.
     * @return The exception itself (full stack trace at debug level) or its toString() otherwise.
     */
    public static Object exceptionSummary(Logger log, Throwable e) {
        if (log.isDebugEnabled()) {
            return e;
        } else {
            return e.toString();
        }
    }
}
