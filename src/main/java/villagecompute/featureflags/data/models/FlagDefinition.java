/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.data.models;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable definition of a single feature flag.
 *
 * <p>
 * <b>Attributes:</b>
 * <ul>
 * <li>{@code enabled} - master switch; when false the flag is off everywhere</li>
 * <li>{@code environments} - per-environment opt-in; a missing entry means "not enabled there"</li>
 * <li>{@code userGroups} - allow-list of group labels; empty means no group restriction</li>
 * <li>{@code rolloutPercentage} - share of identified users (by stable bucket) who see the flag, always within
 * [0,100]</li>
 * <li>{@code description} - optional text for introspection, never used in evaluation</li>
 * </ul>
 *
 * <p>
 * Out-of-range rollout percentages are clamped here, so every definition that exists is valid. Collections are
 * copied into unmodifiable views; group order follows the source document.
 *
 * @param name
 *            unique flag identifier (e.g., "voice_agent")
 * @param description
 *            human-readable description (may be null)
 * @param enabled
 *            master switch
 * @param environments
 *            per-environment enablement
 * @param userGroups
 *            allowed group labels
 * @param rolloutPercentage
 *            rollout percentage, clamped to [0,100]
 */
public record FlagDefinition(String name, String description, boolean enabled, Map<Environment, Boolean> environments,
        Set<String> userGroups, int rolloutPercentage) {

    public static final int MIN_ROLLOUT = 0;
    public static final int FULL_ROLLOUT = 100;

    public FlagDefinition {
        Objects.requireNonNull(name, "name is required");

        EnumMap<Environment, Boolean> envCopy = new EnumMap<>(Environment.class);
        if (environments != null) {
            environments.forEach((env, on) -> {
                if (env != null && on != null) {
                    envCopy.put(env, on);
                }
            });
        }
        environments = Collections.unmodifiableMap(envCopy);

        LinkedHashSet<String> groupCopy = new LinkedHashSet<>();
        if (userGroups != null) {
            userGroups.stream().filter(Objects::nonNull).forEach(groupCopy::add);
        }
        userGroups = Collections.unmodifiableSet(groupCopy);

        rolloutPercentage = clampRollout(rolloutPercentage);
    }

    /**
     * Clamps a raw rollout percentage into [0,100].
     *
     * @param raw
     *            value from the source document
     * @return clamped value
     */
    public static int clampRollout(int raw) {
        return Math.max(MIN_ROLLOUT, Math.min(FULL_ROLLOUT, raw));
    }

    /**
     * @return true if the raw value would be altered by {@link #clampRollout(int)}
     */
    public static boolean isOutOfRange(int raw) {
        return raw < MIN_ROLLOUT || raw > FULL_ROLLOUT;
    }

    /**
     * Whether this flag is explicitly opted in for the given environment.
     */
    public boolean isEnabledIn(Environment environment) {
        return Boolean.TRUE.equals(environments.get(environment));
    }

    public boolean hasGroupRestriction() {
        return !userGroups.isEmpty();
    }

    /**
     * Checks the group allow-list. An unrestricted flag allows every group.
     *
     * @param group
     *            caller group label
     * @return true if the group passes the allow-list
     */
    public boolean allowsGroup(String group) {
        return !hasGroupRestriction() || userGroups.contains(group);
    }

    public boolean isFullRollout() {
        return rolloutPercentage >= FULL_ROLLOUT;
    }

    /**
     * Starts a builder for the given flag name. Defaults: disabled, no environments, no group restriction, 100%
     * rollout.
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder used by the config loader and tests.
     */
    public static final class Builder {

        private final String name;
        private String description;
        private boolean enabled;
        private final EnumMap<Environment, Boolean> environments = new EnumMap<>(Environment.class);
        private final LinkedHashSet<String> userGroups = new LinkedHashSet<>();
        private int rolloutPercentage = FULL_ROLLOUT;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder environment(Environment environment, boolean on) {
            this.environments.put(environment, on);
            return this;
        }

        /**
         * Opts the flag in for each listed environment.
         */
        public Builder enabledIn(Environment... environments) {
            for (Environment environment : environments) {
                this.environments.put(environment, true);
            }
            return this;
        }

        public Builder userGroups(Collection<String> groups) {
            this.userGroups.addAll(groups);
            return this;
        }

        public Builder userGroups(String... groups) {
            Collections.addAll(this.userGroups, groups);
            return this;
        }

        public Builder rolloutPercentage(int rolloutPercentage) {
            this.rolloutPercentage = rolloutPercentage;
            return this;
        }

        public FlagDefinition build() {
            return new FlagDefinition(name, description, enabled, environments, userGroups, rolloutPercentage);
        }
    }
}
