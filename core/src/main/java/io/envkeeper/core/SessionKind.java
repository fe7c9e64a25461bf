// file: src/main/java/io/envkeeper/core/SessionKind.java
package io.envkeeper.core;

import java.util.Locale;

/**
 * Kind of dynamic environment a session drives.
 * <p>
 * The kind selects the {@code EnvironmentDriver} registered for it at startup.
 * Wire form (JSON, CLI) is the lower-case name.
 */
public enum SessionKind {
    BROWSER,
    NOTEBOOK,
    OTHER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse the wire form ("browser", "notebook", "other"), case-insensitive.
     *
     * @throws IllegalArgumentException for null, blank or unknown names
     */
    public static SessionKind fromWire(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("session kind must not be empty");
        }
        for (SessionKind k : values()) {
            if (k.wireName().equalsIgnoreCase(s.trim())) {
                return k;
            }
        }
        throw new IllegalArgumentException("unknown session kind: " + s);
    }
}
