package com.example.flowcodegen.codegen;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns user-entered display names into snake_case program identifiers.
 * Collisions between different nodes are not detected.
 */
public final class IdentifierResolver {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern SEPARATOR_RUN = Pattern.compile("[\\s-]+");
    private static final String AGENT_PREFIX = "agent";

    private IdentifierResolver() {
    }

    /**
     * Resolves an agent identifier; blank names fall back to {@code agent_<positionalIndex + 1>}.
     */
    public static String resolve(String displayName, int positionalIndex) {
        return resolve(displayName, positionalIndex, AGENT_PREFIX);
    }

    public static String resolve(String displayName, int positionalIndex, String fallbackPrefix) {
        if (displayName == null || displayName.isBlank()) {
            return fallbackPrefix + "_" + (positionalIndex + 1);
        }
        return toSnakeCase(displayName);
    }

    public static String toSnakeCase(String value) {
        String separated = CAMEL_BOUNDARY.matcher(value).replaceAll("$1_$2");
        return SEPARATOR_RUN.matcher(separated).replaceAll("_").toLowerCase(Locale.ROOT);
    }
}
