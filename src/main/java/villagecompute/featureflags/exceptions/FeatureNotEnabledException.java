/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.exceptions;

/**
 * Exception thrown when a caller requires a feature that is not enabled for them.
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 403 Forbidden by
 * {@link FeatureNotEnabledExceptionMapper}.
 */
public class FeatureNotEnabledException extends RuntimeException {

    private final String flagKey;
    private final String reason;

    public FeatureNotEnabledException(String flagKey, String reason) {
        super("Feature '" + flagKey + "' is not enabled (" + reason + ")");
        this.flagKey = flagKey;
        this.reason = reason;
    }

    public String getFlagKey() {
        return flagKey;
    }

    /**
     * @return evaluation reason code for the denial
     */
    public String getReason() {
        return reason;
    }
}
