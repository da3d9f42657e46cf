/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import villagecompute.featureflags.data.models.FlagDefinition;

/**
 * API response type for feature flag definitions.
 *
 * <p>
 * Read-only view of a loaded {@link FlagDefinition} for introspection endpoints.
 *
 * @param flagKey
 *            unique feature flag identifier
 * @param description
 *            human-readable feature description
 * @param enabled
 *            master switch state
 * @param environments
 *            environment wire name to enablement (only environments present in the document)
 * @param userGroups
 *            allowed groups; empty means unrestricted
 * @param rolloutPercentage
 *            rollout percentage [0-100]
 */
@Schema(
        description = "Loaded feature flag definition")
public record FeatureFlagType(@Schema(
        description = "Unique feature flag identifier",
        example = "voice_agent",
        required = true) @JsonProperty("flag_key") String flagKey,

        @Schema(
                description = "Human-readable feature description",
                example = "Outbound AI voice calls",
                nullable = true) String description,

        @Schema(
                description = "Master switch state",
                example = "true",
                required = true) boolean enabled,

        @Schema(
                description = "Per-environment enablement",
                example = "{\"production\": true, \"staging\": true}",
                required = true) Map<String, Boolean> environments,

        @Schema(
                description = "Allowed user groups (empty for no restriction)",
                example = "[\"admin\", \"sales\"]",
                required = true) @JsonProperty("user_groups") List<String> userGroups,

        @Schema(
                description = "Rollout percentage (0-100)",
                example = "50",
                required = true) @JsonProperty("rollout_percentage") int rolloutPercentage) {

    /**
     * Converts a definition to its API representation.
     */
    public static FeatureFlagType from(FlagDefinition definition) {
        Map<String, Boolean> environments = new LinkedHashMap<>();
        definition.environments().forEach((env, on) -> environments.put(env.value(), on));
        return new FeatureFlagType(definition.name(), definition.description(), definition.enabled(), environments,
                List.copyOf(definition.userGroups()), definition.rolloutPercentage());
    }
}
