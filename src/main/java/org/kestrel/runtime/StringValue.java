package org.kestrel.runtime;

import java.util.Objects;

/**
 * A string value.
 *
 * @param value The text.
 */
public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Type type() {
        return Type.STRING;
    }

    @Override
    public String inspect() {
        return value;
    }
}
