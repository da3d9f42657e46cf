/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import villagecompute.featureflags.services.FlagReloadService.ReloadResult;

/**
 * API response type for a flag reload.
 *
 * @param flagCount
 *            flags in the new registry
 * @param environment
 *            active environment wire name
 * @param outcome
 *            load outcome (success, missing, malformed)
 * @param reloadedAt
 *            completion timestamp
 */
@Schema(
        description = "Result of reloading feature flags from the configuration source")
public record ReloadResponseType(@Schema(
        description = "Number of flags loaded",
        example = "5",
        required = true) @JsonProperty("flag_count") int flagCount,

        @Schema(
                description = "Active environment",
                example = "staging",
                required = true) String environment,

        @Schema(
                description = "Load outcome",
                example = "success",
                enumeration = {
                        "success", "missing", "malformed"},
                required = true) String outcome,

        @Schema(
                description = "Reload completion timestamp",
                example = "2026-01-24T12:30:00Z",
                required = true) @JsonProperty("reloaded_at") Instant reloadedAt) {

    public static ReloadResponseType from(ReloadResult result) {
        return new ReloadResponseType(result.flagCount(), result.environment(), result.outcome(),
                result.reloadedAt());
    }
}
