/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import java.time.Instant;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.featureflags.config.FeatureFlagConfig;
import villagecompute.featureflags.observability.LoggingConfig;
import villagecompute.featureflags.services.FlagConfigLoader.LoadResult;

/**
 * Re-reads the flag document and swaps it into the {@link FlagEvaluator}.
 *
 * <p>
 * The new registry is parsed completely before the swap, so file I/O never happens while the evaluator is switching
 * snapshots. A failed load swaps in an empty registry: every flag reads false until the next successful reload.
 *
 * <p>
 * Reloads run one at a time, so the admin API and the refresh job cannot load in one order and swap in the other.
 * Flag queries never wait on this lock.
 */
@ApplicationScoped
public class FlagReloadService {

    private static final Logger LOG = Logger.getLogger(FlagReloadService.class);

    @Inject
    Tracer tracer;

    @Inject
    FlagEvaluator flagEvaluator;

    @Inject
    FlagConfigLoader loader;

    @Inject
    FeatureFlagConfig config;

    /**
     * Reloads flags from the configured source.
     *
     * @param origin
     *            what triggered the reload (e.g., "admin_api", "refresh_job")
     * @return summary of the reload
     */
    public synchronized ReloadResult reloadFromSource(String origin) {
        Span span = tracer.spanBuilder("feature_flags.reload").setAttribute("origin", origin).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin(origin);

            LoadResult result = loader.load(config.configPath());
            flagEvaluator.reload(result.registry());

            span.setAttribute("flag_count", result.registry().size());
            span.setAttribute("outcome", result.outcome().tag());
            if (result.succeeded()) {
                LOG.infof("Feature flags reloaded from %s: flags=%d origin=%s", config.configPath(),
                        result.registry().size(), origin);
            } else {
                LOG.warnf("Feature flag reload from %s ended with outcome=%s; all flags now disabled",
                        config.configPath(), result.outcome().tag());
            }
            return new ReloadResult(result.registry().size(), flagEvaluator.currentEnvironment().value(),
                    result.outcome().tag(), Instant.now());
        } finally {
            LoggingConfig.clearMDC();
            span.end();
        }
    }

    /**
     * Reload summary.
     *
     * @param flagCount
     *            flags in the new registry
     * @param environment
     *            active environment wire name
     * @param outcome
     *            load outcome tag (success, missing, malformed)
     * @param reloadedAt
     *            completion time
     */
    public record ReloadResult(int flagCount, String environment, String outcome, Instant reloadedAt) {
    }
}
