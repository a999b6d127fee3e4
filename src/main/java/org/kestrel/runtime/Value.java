package org.kestrel.runtime;

/**
 * A value produced by the {@link Evaluator}. Truth values are represented as the
 * integers 1 and 0.
 */
public sealed interface Value permits IntegerValue, FloatValue, StringValue, NullValue {

    /**
     * @return The type of this value.
     */
    Type type();

    /**
     * @return The human-readable rendering of this value.
     */
    String inspect();

    /**
     * Converts text given outside of source code, e.g. on the command line, into a value:
     * an integer if it is one, a float if it is one, otherwise a string.
     *
     * @param text The text to convert.
     * @return The value.
     */
    static Value parse(String text) {
        try {
            return new IntegerValue(Long.parseLong(text));
        } catch (NumberFormatException notAnInteger) {
            try {
                return new FloatValue(Double.parseDouble(text));
            } catch (NumberFormatException notAFloat) {
                return new StringValue(text);
            }
        }
    }
}
