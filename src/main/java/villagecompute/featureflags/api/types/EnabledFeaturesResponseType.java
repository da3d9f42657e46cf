/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * API response type listing the flags enabled for a caller.
 *
 * @param environment
 *            active environment wire name
 * @param features
 *            enabled flag names in registry order
 * @param count
 *            number of enabled flags
 */
@Schema(
        description = "Feature flags enabled for a caller, in registry order")
public record EnabledFeaturesResponseType(@Schema(
        description = "Active environment",
        example = "production",
        required = true) String environment,

        @Schema(
                description = "Enabled flag names",
                example = "[\"apollo_leads\", \"voice_agent\"]",
                required = true) List<String> features,

        @Schema(
                description = "Number of enabled flags",
                example = "2",
                required = true) int count) {
}
