package org.kestrel.runtime;

/**
 * A 64-bit floating-point value.
 *
 * @param value The number.
 */
public record FloatValue(double value) implements Value {

    @Override
    public Type type() {
        return Type.FLOAT;
    }

    @Override
    public String inspect() {
        return Double.toString(value);
    }
}
