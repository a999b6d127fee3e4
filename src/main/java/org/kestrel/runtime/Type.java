package org.kestrel.runtime;

/**
 * The primitive types of the language, as reported by {@code typeof}.
 */
public enum Type {
    INT("int"),
    STRING("string"),
    VOID("void"),
    FLOAT("float"),
    /** Fallback for names that have no known type. */
    UNKNOWN("unknown");

    private final String displayName;

    Type(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name of the type as written in source code.
     */
    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
