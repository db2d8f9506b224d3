package com.hcltech.wgraph.common;

/**
 * Source of environment settings.
 * <p>
 * Code reads settings through this instead of {@link System#getenv(String)},
 * so tests can supply a map-backed environment.
 */
@FunctionalInterface
public interface IEnvGetter {
    /** Backed by {@link System#getenv(String)}. */
    IEnvGetter env = System::getenv;

    /** Returns the raw value, or {@code null} if unset. */
    String get(String name);

    /**
     * Returns the integer value, or {@code defaultValue} when unset or blank.
     * A value that is present but not an integer is an error, not a fallback.
     */
    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
