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

import com.google.common.base.Preconditions;
import java.util.Collection;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import lombok.SneakyThrows;

/**
 * Helper methods that perform various checks and throw exceptions if certain conditions are met.
 */
public final class Exceptions {

    /**
     * Throws any throwable 'sneakily': the caller neither needs to catch it nor declare it.
     * <p>
     * Always use it as the argument of a {@code throw} statement; it never returns normally.
     *
     * @param t The throwable to throw without requiring you to catch its type.
     * @return A dummy RuntimeException; this method never returns normally.
     */
    @SneakyThrows
    public static RuntimeException sneakyThrow(Throwable t) {
        throw t;
    }

    /**
     * Determines if the given Throwable represents a fatal exception and cannot be handled.
     *
     * @param ex The Throwable to inspect.
     * @return True if a fatal error which must be rethrown, false otherwise (it can be handled in a catch block).
     */
    public static boolean mustRethrow(Throwable ex) {
        return ex instanceof VirtualMachineError;
    }

    /**
     * If the provided exception is a CompletionException or ExecutionException, returns its innermost cause.
     *
     * @param ex The exception to be unwrapped.
     * @return The cause or the exception provided.
     */
    public static Throwable unwrap(Throwable ex) {
        if (canInspectCause(ex)) {
            Throwable cause = ex.getCause();
            if (cause != null) {
                return unwrap(cause);
            }
        }

        return ex;
    }

    private static boolean canInspectCause(Throwable ex) {
        return ex instanceof CompletionException
                || ex instanceof ExecutionException;
    }

    @FunctionalInterface
    public interface InterruptibleRun<ExceptionT extends Exception> {
        void run() throws InterruptedException, ExceptionT;
    }

    /**
     * Eliminates boilerplate code of catching and re-interrupting the thread.
     *
     * @param run          A method that should be run handling interrupts automatically
     * @param <ExceptionT> The type of exception.
     * @throws ExceptionT If thrown by run.
     */
    @SneakyThrows(InterruptedException.class)
    public static <ExceptionT extends Exception> void handleInterrupted(InterruptibleRun<ExceptionT> run)
            throws ExceptionT {
        try {
            run.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * Throws a NullPointerException if the arg argument is null. Throws an IllegalArgumentException if the String arg
     * argument has a length of zero.
     *
     * @param arg     The argument to check.
     * @param argName The name of the argument (to be included in the exception message).
     * @return The arg.
     * @throws NullPointerException     If arg is null.
     * @throws IllegalArgumentException If arg is not null, but has a length of zero.
     */
    public static String checkNotNullOrEmpty(String arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(arg.length() > 0, argName, "Cannot be an empty string.");
        return arg;
    }

    /**
     * Throws a NullPointerException if the arg argument is null. Throws an IllegalArgumentException if the Collections arg
     * argument has a size of zero.
     *
     * @param <T>     The type of elements in the provided collection.
     * @param <V>     The actual type of the collection.
     * @param arg     The argument to check.
     * @param argName The name of the argument (to be included in the exception message).
     * @return The arg.
     * @throws NullPointerException     If arg is null.
     * @throws IllegalArgumentException If arg is not null, but is empty.
     */
    public static <T, V extends Collection<T>> V checkNotNullOrEmpty(V arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(!arg.isEmpty(), argName, "Cannot be an empty collection.");
        return arg;
    }

    /**
     * Throws an IllegalArgumentException if the validCondition argument is false.
     *
     * @param validCondition The result of the condition to validate.
     * @param argName        The name of the argument (to be included in the exception message).
     * @param message        The message to include in the exception. This should not include the name of the argument,
     *                       as that is already prefixed.
     * @param args           Format args for message. These must correspond to String.format() args.
     * @throws IllegalArgumentException If validCondition is false.
     */
    public static void checkArgument(boolean validCondition, String argName, String message, Object... args) throws IllegalArgumentException {
        if (!validCondition) {
            throw new IllegalArgumentException(badArgumentMessage(argName, message, args));
        }
    }

    /**
     * Gets a one-line description of the given failure, suitable for a failure reason: the unwrapped exception's
     * simple class name followed by its message, if any.
     *
     * @param ex The failure to describe.
     * @return The description, or null if ex is null.
     */
    public static String describe(Throwable ex) {
        if (ex == null) {
            return null;
        }

        Throwable real = unwrap(ex);
        String message = real.getMessage();
        return message == null || message.isEmpty()
                ? real.getClass().getSimpleName()
                : real.getClass().getSimpleName() + ": " + message;
    }

    private static String badArgumentMessage(String argName, String message, Object... args) {
        return argName + ": " + String.format(message, args);
    }
}
