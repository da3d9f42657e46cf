/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.rest.admin;

import java.util.List;
import java.util.Optional;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import villagecompute.featureflags.api.types.FeatureFlagType;
import villagecompute.featureflags.api.types.ReloadResponseType;
import villagecompute.featureflags.data.models.FlagDefinition;
import villagecompute.featureflags.services.FlagEvaluator;
import villagecompute.featureflags.services.FlagReloadService;
import villagecompute.featureflags.services.FlagReloadService.ReloadResult;

/**
 * Admin REST endpoints for feature flag introspection.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/api/feature-flags} - list loaded definitions in registry order</li>
 * <li>{@code GET /admin/api/feature-flags/{key}} - get a single definition</li>
 * <li>{@code POST /admin/api/feature-flags/reload} - re-read the configuration source</li>
 * </ul>
 *
 * <p>
 * Flags are defined only in the configuration document; there are no endpoints that create or modify them.
 */
@Path("/admin/api/feature-flags")
@RolesAllowed("super_admin")
@Produces(MediaType.APPLICATION_JSON)
public class FeatureFlagAdminResource {

    private static final Logger LOG = Logger.getLogger(FeatureFlagAdminResource.class);

    @Inject
    FlagEvaluator flagEvaluator;

    @Inject
    FlagReloadService reloadService;

    /**
     * Lists all loaded feature flags.
     *
     * @return list of definitions in registry order
     */
    @GET
    public Response listFlags() {
        List<FeatureFlagType> response = flagEvaluator.snapshot().registry().definitions().stream()
                .map(FeatureFlagType::from).toList();
        return Response.ok(response).build();
    }

    /**
     * Retrieves a single feature flag definition.
     *
     * @param key
     *            the flag identifier
     * @return flag definition or 404 if not loaded
     */
    @GET
    @Path("/{key}")
    public Response getFlag(@PathParam("key") String key) {
        Optional<FlagDefinition> flag = flagEvaluator.getFeatureDefinition(key);
        if (flag.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("Feature flag not found: " + key)).build();
        }
        return Response.ok(FeatureFlagType.from(flag.get())).build();
    }

    /**
     * Reloads flags from the configuration source.
     *
     * @return reload summary
     */
    @POST
    @Path("/reload")
    public Response reload() {
        try {
            ReloadResult result = reloadService.reloadFromSource("admin_api");
            LOG.infof("Feature flags reloaded via admin API: flags=%d outcome=%s", result.flagCount(),
                    result.outcome());
            return Response.ok(ReloadResponseType.from(result)).build();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to reload feature flags");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to reload feature flags")).build();
        }
    }

    /**
     * Simple error response record for API errors.
     */
    public record ErrorResponse(String error) {
    }
}
