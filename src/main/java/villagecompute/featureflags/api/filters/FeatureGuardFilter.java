/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.filters;

import java.lang.reflect.Method;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.ResourceInfo;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import villagecompute.featureflags.api.types.FeatureDeniedResponseType;
import villagecompute.featureflags.observability.LoggingConfig;
import villagecompute.featureflags.services.FeatureGuard;
import villagecompute.featureflags.services.FeatureGuard.FeatureCheckResult;

/**
 * JAX-RS filter enforcing {@link RequiresFeature} on resource methods.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Resolve the required flag from the method annotation, falling back to the class annotation</li>
 * <li>Read caller identity from {@code X-User-Group} and {@code X-User-Id}</li>
 * <li>Check the flag through {@link FeatureGuard}</li>
 * <li>On denial: abort with 403 and a {@link FeatureDeniedResponseType} body</li>
 * <li>On success: tag MDC with the flag and continue</li>
 * </ol>
 *
 * <p>
 * <b>Priority:</b> Runs at {@code Priorities.AUTHORIZATION} to execute after authentication but before business
 * logic.
 */
@Provider
@RequiresFeature("")
@Priority(Priorities.AUTHORIZATION)
public class FeatureGuardFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(FeatureGuardFilter.class);

    public static final String GROUP_HEADER = "X-User-Group";
    public static final String USER_ID_HEADER = "X-User-Id";

    static final String CHECK_RESULT_PROPERTY = "villagecompute.featureGuard.result";

    @Inject
    FeatureGuard featureGuard;

    @Context
    ResourceInfo resourceInfo;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Method method = resourceInfo.getResourceMethod();
        if (method == null) {
            return;
        }

        RequiresFeature requiresFeature = method.getAnnotation(RequiresFeature.class);
        if (requiresFeature == null) {
            requiresFeature = resourceInfo.getResourceClass().getAnnotation(RequiresFeature.class);
        }

        if (requiresFeature == null || requiresFeature.value().isBlank()) {
            LOG.warnf("@RequiresFeature annotation missing or empty on method: %s", method.getName());
            return;
        }

        String flagKey = requiresFeature.value();
        String group = requestContext.getHeaderString(GROUP_HEADER);
        String userId = requestContext.getHeaderString(USER_ID_HEADER);

        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setCaller(group, userId);
        LoggingConfig.setRequestOrigin(requestContext.getUriInfo().getPath());

        FeatureCheckResult result = featureGuard.check(flagKey, group, userId);
        requestContext.setProperty(CHECK_RESULT_PROPERTY, result);

        if (!result.allowed()) {
            LOG.infof("Feature access denied: flag=%s group=%s reason=%s", flagKey, group, result.reason());
            requestContext.abortWith(Response.status(Response.Status.FORBIDDEN).type(MediaType.APPLICATION_JSON)
                    .entity(FeatureDeniedResponseType.forFeature(flagKey)).build());
            return;
        }

        LoggingConfig.setFeatureFlags(flagKey);
    }

    /**
     * Clears MDC context set by the request filter, for both allowed and aborted requests.
     */
    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        if (requestContext.getProperty(CHECK_RESULT_PROPERTY) instanceof FeatureCheckResult) {
            LoggingConfig.clearMDC();
        }
    }
}
