package org.kestrel.runtime;

/**
 * The absence of a value, produced by {@code nil} and {@code void}.
 */
public record NullValue() implements Value {

    public static final NullValue INSTANCE = new NullValue();

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public String inspect() {
        return "null";
    }
}
