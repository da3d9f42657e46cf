/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API error body returned when a guarded endpoint is called without the required feature.
 *
 * @param error
 *            short error label
 * @param message
 *            human-readable explanation
 * @param feature
 *            the flag that was required
 * @param upgradeRequired
 *            always true; tells clients to offer an upgrade path
 */
@Schema(
        description = "Feature access denial")
public record FeatureDeniedResponseType(@Schema(
        description = "Error label",
        example = "Feature not available",
        required = true) String error,

        @Schema(
                description = "Human-readable explanation",
                example = "The voice_agent feature is not enabled for your account",
                required = true) String message,

        @Schema(
                description = "Required feature flag",
                example = "voice_agent",
                required = true) String feature,

        @Schema(
                description = "Whether an upgrade is required to use the feature",
                example = "true",
                required = true) @JsonProperty("upgrade_required") boolean upgradeRequired) {

    public static FeatureDeniedResponseType forFeature(String feature) {
        return new FeatureDeniedResponseType("Feature not available",
                "The " + feature + " feature is not enabled for your account", feature, true);
    }
}
