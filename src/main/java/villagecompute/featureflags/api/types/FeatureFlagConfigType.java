/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One flag entry of the configuration document, as written on disk.
 *
 * <p>
 * All fields are optional. Missing values take the evaluation defaults (disabled, no environments, no group
 * restriction, 100% rollout) when converted to a {@link villagecompute.featureflags.data.models.FlagDefinition}.
 *
 * @param enabled
 *            master switch
 * @param description
 *            human-readable description
 * @param environments
 *            environment wire name to enablement
 * @param userGroups
 *            allowed group labels
 * @param rolloutPercentage
 *            raw rollout percentage (may be out of range)
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FeatureFlagConfigType(Boolean enabled, String description, Map<String, Boolean> environments,
        @JsonProperty("user_groups") List<String> userGroups,
        @JsonProperty("rollout_percentage") Integer rolloutPercentage) {
}
