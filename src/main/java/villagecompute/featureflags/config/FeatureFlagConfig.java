/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.config;

import java.nio.file.Path;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.featureflags.data.models.Environment;
import villagecompute.featureflags.services.FlagConfigLoader;
import villagecompute.featureflags.services.FlagConfigLoader.LoadResult;
import villagecompute.featureflags.services.FlagEvaluator;

/**
 * Configuration for feature flag evaluation and producer of the process-wide {@link FlagEvaluator}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code feature-flags.config-path} - JSON flag document (default: configs/feature-flags/flags.json)</li>
 * <li>{@code feature-flags.environment} - active environment; development, staging or production (default:
 * development, overridable via FEATURE_FLAGS_ENVIRONMENT, then NODE_ENV)</li>
 * <li>{@code feature-flags.refresh-interval} - how often {@link villagecompute.featureflags.jobs.FlagRefreshJob}
 * checks the document for changes (default: off)</li>
 * </ul>
 *
 * <p>
 * <b>Usage:</b> Inject the evaluator wherever a flag check is needed:
 *
 * <pre>
 * &#64;Inject
 * FlagEvaluator flagEvaluator;
 * </pre>
 */
@ApplicationScoped
public class FeatureFlagConfig {

    private static final Logger LOG = Logger.getLogger(FeatureFlagConfig.class);

    @ConfigProperty(
            name = "feature-flags.config-path",
            defaultValue = "configs/feature-flags/flags.json")
    String configPath;

    @ConfigProperty(
            name = "feature-flags.environment",
            defaultValue = "development")
    String environmentName;

    @Inject
    FlagConfigLoader loader;

    /**
     * Produces the single evaluator, seeded from the configured document. A missing or malformed document leaves the
     * evaluator empty rather than failing startup.
     *
     * @return evaluator instance shared by all callers
     */
    @Produces
    @Singleton
    public FlagEvaluator flagEvaluator() {
        Environment environment = environment();
        LoadResult result = loader.load(configPath());
        if (!result.succeeded()) {
            LOG.warnf("Starting with no feature flags: config %s load outcome=%s", configPath,
                    result.outcome().tag());
        }
        LOG.infof("Feature flag evaluator ready: environment=%s flags=%d", environment.value(),
                result.registry().size());
        return new FlagEvaluator(result.registry(), environment);
    }

    /**
     * @return configured environment, falling back to development for unknown names
     */
    public Environment environment() {
        Environment environment = Environment.resolve(environmentName);
        if (Environment.fromValue(environmentName).isEmpty()) {
            LOG.debugf("Unrecognized feature-flags.environment '%s', using %s", environmentName, environment.value());
        }
        return environment;
    }

    public Path configPath() {
        return Path.of(configPath);
    }
}
