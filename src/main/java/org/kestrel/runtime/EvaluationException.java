package org.kestrel.runtime;

/**
 * Thrown when an expression cannot be evaluated, e.g. because an identifier is unbound
 * or an operator is not defined for its operand types.
 */
public class EvaluationException extends RuntimeException {

    /**
     * @param message The error message.
     */
    public EvaluationException(String message) {
        super(message);
    }
}
