package org.kestrel.runtime;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps names to their types. Names that were never set have type {@link Type#UNKNOWN}.
 */
public class TypeEnvironment {

    private final Map<String, Type> types = new HashMap<>();

    /**
     * @param name The name to look up.
     * @return The type of the name, or {@link Type#UNKNOWN} if it is not known.
     */
    public Type get(String name) {
        return types.getOrDefault(name, Type.UNKNOWN);
    }

    /**
     * Sets or replaces the type of a name.
     * @param name The name.
     * @param type The type.
     */
    public void set(String name, Type type) {
        types.put(name, type);
    }

    /**
     * @return An unmodifiable view of all known names and their types.
     */
    public Map<String, Type> asMap() {
        return Collections.unmodifiableMap(types);
    }
}
