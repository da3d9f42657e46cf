/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.data.models;

import java.util.Locale;
import java.util.Optional;

/**
 * Deployment stage the running process belongs to.
 *
 * <p>
 * Exactly one environment is active per process. Flag definitions opt in per environment through their
 * {@code environments} map, keyed by {@link #value()}.
 */
public enum Environment {

    DEVELOPMENT("development"), STAGING("staging"), PRODUCTION("production");

    private final String value;

    Environment(String value) {
        this.value = value;
    }

    /**
     * @return lowercase wire name used in flag documents and API responses
     */
    public String value() {
        return value;
    }

    /**
     * Looks up an environment by wire name (case-insensitive, surrounding whitespace ignored).
     *
     * @param name
     *            wire name such as {@code "staging"}
     * @return the matching environment, or empty if the name is unknown or blank
     */
    public static Optional<Environment> fromValue(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Environment environment : values()) {
            if (environment.value.equals(normalized)) {
                return Optional.of(environment);
            }
        }
        return Optional.empty();
    }

    /**
     * Exact, case-sensitive lookup of a flag document key. {@code "Production"} or {@code " production"} match
     * nothing.
     *
     * @param key
     *            key from a flag's {@code environments} object
     * @return the environment whose wire name equals the key, or empty
     */
    public static Optional<Environment> fromDocumentKey(String key) {
        for (Environment environment : values()) {
            if (environment.value.equals(key)) {
                return Optional.of(environment);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the active environment from a configuration value. Unknown or missing values fall back to
     * {@link #DEVELOPMENT}.
     *
     * @param name
     *            configured environment name (may be null)
     * @return resolved environment, never null
     */
    public static Environment resolve(String name) {
        return fromValue(name).orElse(DEVELOPMENT);
    }
}
