/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.filters;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import jakarta.ws.rs.NameBinding;

/**
 * JAX-RS name binding annotation for feature gating.
 *
 * <p>
 * Apply this annotation to REST resource methods (or classes) that must only be reachable when a feature flag is
 * enabled for the caller.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * &#64;POST
 * &#64;Path("/calls")
 * &#64;RequiresFeature("voice_agent")
 * public Response startCall(CallRequest request) {
 *     // Implementation
 * }
 * </pre>
 *
 * <p>
 * <b>Behavior:</b>
 * <ul>
 * <li>Caller group read from the {@code X-User-Group} header, user id from {@code X-User-Id}</li>
 * <li>Flag evaluated through {@link villagecompute.featureflags.services.FeatureGuard}</li>
 * <li>403 Forbidden with an upgrade hint when the flag is off</li>
 * </ul>
 *
 * @see FeatureGuardFilter for enforcement implementation
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface RequiresFeature {

    /**
     * The feature flag identifier (e.g., "voice_agent").
     *
     * @return flag name
     */
    String value();
}
