/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.rest;

import java.util.List;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import villagecompute.featureflags.api.types.EnabledFeaturesResponseType;
import villagecompute.featureflags.api.types.FeatureFlagEvaluationResponseType;
import villagecompute.featureflags.observability.LoggingConfig;
import villagecompute.featureflags.services.FlagEvaluator;
import villagecompute.featureflags.services.FlagEvaluator.EvaluationResult;
import villagecompute.featureflags.services.FlagEvaluator.Snapshot;

/**
 * Read-only REST endpoints for flag decisions.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/feature-flags/enabled} - flags enabled for a caller</li>
 * <li>{@code GET /api/feature-flags/{key}/evaluation} - single flag decision with reason</li>
 * </ul>
 *
 * <p>
 * Unknown flags are not an error: they evaluate to disabled with reason {@code flag_not_found}.
 */
@Path("/api/feature-flags")
@Produces(MediaType.APPLICATION_JSON)
public class FeatureFlagResource {

    private static final Logger LOG = Logger.getLogger(FeatureFlagResource.class);

    @Inject
    FlagEvaluator flagEvaluator;

    /**
     * Lists flags enabled for the caller in registry order.
     *
     * @param group
     *            caller group (optional)
     * @param userId
     *            caller user id (optional)
     * @return environment and enabled flag names
     */
    @GET
    @Path("/enabled")
    public Response enabledFeatures(@QueryParam("group") String group, @QueryParam("user_id") String userId) {
        try {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setCaller(group, userId);

            Snapshot snapshot = flagEvaluator.snapshot();
            List<String> features = snapshot.getEnabledFeatures(group, userId);
            LOG.debugf("Enabled features for group=%s: %s", group, features);
            return Response.ok(new EnabledFeaturesResponseType(snapshot.environment().value(), features,
                    features.size())).build();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Evaluates a single flag for the caller.
     *
     * @param key
     *            flag identifier
     * @param group
     *            caller group (optional)
     * @param userId
     *            caller user id (optional)
     * @return evaluation result with reason code
     */
    @GET
    @Path("/{key}/evaluation")
    public Response evaluate(@PathParam("key") String key, @QueryParam("group") String group,
            @QueryParam("user_id") String userId) {
        EvaluationResult result = flagEvaluator.evaluate(key, group, userId);
        return Response.ok(FeatureFlagEvaluationResponseType.from(key, result)).build();
    }
}
