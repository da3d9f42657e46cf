/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.api.filters;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import villagecompute.featureflags.services.FeatureGuard;

/**
 * Resource used only by {@link FeatureGuardFilterTest} to exercise {@link RequiresFeature} bindings.
 */
@Path("/test/guarded")
@Produces(MediaType.TEXT_PLAIN)
@RequiresFeature("apollo_leads")
public class GuardedTestResource {

    @Inject
    FeatureGuard featureGuard;

    @GET
    @Path("/voice")
    @RequiresFeature("voice_agent")
    public String voice() {
        return "voice";
    }

    @GET
    @Path("/legacy")
    @RequiresFeature("legacy_dashboard")
    public String legacy() {
        return "legacy";
    }

    @GET
    @Path("/leads")
    public String leads() {
        return "leads";
    }

    @GET
    @Path("/programmatic")
    public String programmatic(@HeaderParam(FeatureGuardFilter.GROUP_HEADER) String group) {
        featureGuard.require("voice_agent", group, null);
        return "programmatic";
    }
}
