package org.kestrel.runtime;

/**
 * A 64-bit integer value.
 *
 * @param value The integer.
 */
public record IntegerValue(long value) implements Value {

    public static final IntegerValue TRUE = new IntegerValue(1);
    public static final IntegerValue FALSE = new IntegerValue(0);

    /**
     * @param condition The truth value.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static IntegerValue of(boolean condition) {
        return condition ? TRUE : FALSE;
    }

    @Override
    public Type type() {
        return Type.INT;
    }

    @Override
    public String inspect() {
        return Long.toString(value);
    }
}
