/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.data.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Complete, immutable mapping of flag name to {@link FlagDefinition}.
 *
 * <p>
 * A registry is built once per load cycle and never patched: reloading replaces the whole registry. Iteration follows
 * insertion (load) order so enabled-feature listings are reproducible.
 */
public final class FlagRegistry {

    private static final FlagRegistry EMPTY = new FlagRegistry(Map.of());

    private final Map<String, FlagDefinition> definitions;

    private FlagRegistry(Map<String, FlagDefinition> definitions) {
        this.definitions = definitions;
    }

    public static FlagRegistry empty() {
        return EMPTY;
    }

    /**
     * Builds a registry preserving the given order.
     *
     * @param definitions
     *            flag definitions, names must be unique
     * @return new registry
     * @throws IllegalArgumentException
     *             if two definitions share a name
     */
    public static FlagRegistry of(Collection<FlagDefinition> definitions) {
        if (definitions.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, FlagDefinition> byName = new LinkedHashMap<>();
        for (FlagDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate feature flag name: " + definition.name());
            }
        }
        return new FlagRegistry(Collections.unmodifiableMap(byName));
    }

    public static FlagRegistry of(FlagDefinition... definitions) {
        return of(List.of(definitions));
    }

    /**
     * Raw lookup. Missing names are not an error.
     *
     * @param name
     *            flag name (null yields empty)
     * @return the definition if present
     */
    public Optional<FlagDefinition> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean contains(String name) {
        return name != null && definitions.containsKey(name);
    }

    /**
     * @return flag names in load order
     */
    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }

    /**
     * @return definitions in load order
     */
    public List<FlagDefinition> definitions() {
        return List.copyOf(definitions.values());
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    @Override
    public String toString() {
        return "FlagRegistry" + definitions.keySet();
    }
}
