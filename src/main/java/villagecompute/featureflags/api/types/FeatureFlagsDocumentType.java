/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Root of the flag configuration document ({@code flags.json}).
 *
 * <p>
 * Flags live under a top-level {@code features} object keyed by flag name. Jackson binds JSON objects to
 * {@link java.util.LinkedHashMap}, so document order is preserved.
 *
 * @param features
 *            flag name to flag configuration (null when the document has no {@code features} key)
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FeatureFlagsDocumentType(Map<String, FeatureFlagConfigType> features) {
}
