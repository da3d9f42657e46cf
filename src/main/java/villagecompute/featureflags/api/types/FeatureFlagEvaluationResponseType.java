/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import villagecompute.featureflags.services.FlagEvaluator.EvaluationResult;

/**
 * Single-flag decision returned by {@code GET /api/feature-flags/{key}/evaluation}.
 *
 * @param flagKey
 *            flag that was asked about, echoed even when it is not loaded
 * @param enabled
 *            decision for the caller
 * @param reason
 *            code of the gate that decided
 * @param rolloutPercentage
 *            configured rollout, 0 for flags that are not loaded
 */
@Schema(
        description = "Decision for one flag and the gate that produced it")
public record FeatureFlagEvaluationResponseType(@Schema(
        description = "Flag name from the request path",
        example = "voice_agent",
        required = true) @JsonProperty("flag_key") String flagKey,

        @Schema(
                description = "Whether the flag is enabled for this caller",
                example = "true",
                required = true) boolean enabled,

        @Schema(
                description = "Gate that decided the outcome",
                example = "cohort_enabled",
                enumeration = {
                        "flag_not_found", "master_disabled", "environment_disabled", "group_not_allowed",
                        "cohort_disabled", "cohort_enabled", "no_subject", "full_rollout"},
                required = true) String reason,

        @Schema(
                description = "Rollout percentage of the flag when it was evaluated",
                example = "50",
                required = true) @JsonProperty("rollout_percentage") int rolloutPercentage) {

    public static FeatureFlagEvaluationResponseType from(String flagKey, EvaluationResult result) {
        return new FeatureFlagEvaluationResponseType(flagKey, result.enabled(), result.reason().code(),
                result.rolloutPercentage());
    }
}
