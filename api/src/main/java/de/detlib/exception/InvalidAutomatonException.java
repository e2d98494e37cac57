/* Copyright (C) 2024 DetLib contributors
 * This file is part of DetLib.
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
package de.detlib.exception;

/**
 * Thrown when an automaton is assembled from a structurally inconsistent description, e.g. with an undeclared start
 * state or with the epsilon symbol among the declared input symbols.
 * <p>
 * The determinization and simulation components never throw this exception: they assume their input has passed the
 * checks of the automaton builders.
 */
public class InvalidAutomatonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructor.
     *
     * @param message
     *         describes the inconsistency
     */
    public InvalidAutomatonException(String message) {
        super(message);
    }

    /**
     * Constructor.
     *
     * @param message
     *         describes the inconsistency
     * @param cause
     *         the lower-level problem that revealed the inconsistency
     */
    public InvalidAutomatonException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates an exception whose message is built from a {@link String#format(String, Object...) format string}.
     *
     * @param format
     *         the message template
     * @param args
     *         the template arguments
     *
     * @return the exception, ready to be thrown
     */
    public static InvalidAutomatonException of(String format, Object... args) {
        return new InvalidAutomatonException(String.format(format, args));
    }
}
