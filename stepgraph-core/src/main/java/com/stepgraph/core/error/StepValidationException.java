package com.stepgraph.core.error;

import java.util.Map;

/**
 * Base class for fatal problems found in a STEP file or in a request against it.
 *
 * <p>Every subclass can describe itself as an ordered diagnostic map, which the CLI
 * prints as JSON when asked to.
 */
public abstract class StepValidationException extends Exception {

    protected StepValidationException(String message) {
        super(message);
    }

    /**
     * Returns a short machine-readable error type, e.g. {@code unexpected_token}.
     *
     * @return error type
     */
    public abstract String type();

    /**
     * Returns the structured form of this error.
     *
     * @return ordered map with at least {@code type} and {@code message}
     */
    public abstract Map<String, Object> toDiagnostic();
}
