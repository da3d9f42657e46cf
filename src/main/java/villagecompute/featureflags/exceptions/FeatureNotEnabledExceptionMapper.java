/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.exceptions;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import org.jboss.logging.Logger;

import villagecompute.featureflags.api.types.FeatureDeniedResponseType;

/**
 * Maps {@link FeatureNotEnabledException} thrown from resource code to 403 Forbidden.
 */
@Provider
public class FeatureNotEnabledExceptionMapper implements ExceptionMapper<FeatureNotEnabledException> {

    private static final Logger LOG = Logger.getLogger(FeatureNotEnabledExceptionMapper.class);

    @Override
    public Response toResponse(FeatureNotEnabledException exception) {
        LOG.debugf("Rejecting request: %s", exception.getMessage());
        return Response.status(Response.Status.FORBIDDEN).type(MediaType.APPLICATION_JSON)
                .entity(FeatureDeniedResponseType.forFeature(exception.getFlagKey())).build();
    }
}
