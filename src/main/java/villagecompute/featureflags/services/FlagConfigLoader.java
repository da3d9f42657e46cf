/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.featureflags.api.types.FeatureFlagConfigType;
import villagecompute.featureflags.api.types.FeatureFlagsDocumentType;
import villagecompute.featureflags.data.models.Environment;
import villagecompute.featureflags.data.models.FlagDefinition;
import villagecompute.featureflags.data.models.FlagRegistry;

/**
 * Parses the flag configuration document into a {@link FlagRegistry}.
 *
 * <p>
 * <b>Document Format:</b>
 *
 * <pre>
 * {
 *   "features": {
 *     "voice_agent": {
 *       "enabled": true,
 *       "environments": {"production": true},
 *       "user_groups": ["sales"],
 *       "rollout_percentage": 100
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>
 * <b>Error Handling:</b> Loading never throws. A missing file or a malformed document is logged and yields an empty
 * registry, so every flag evaluates to false until a valid reload. Out-of-range rollout percentages are clamped to
 * [0,100] with a warning. Unknown environment names are ignored.
 *
 * <p>
 * <b>Metrics:</b> {@code feature_flags.loads} counter tagged {@code outcome=success|missing|malformed}.
 */
@ApplicationScoped
public class FlagConfigLoader {

    private static final Logger LOG = Logger.getLogger(FlagConfigLoader.class);

    static final String LOADS_METRIC = "feature_flags.loads";

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Loads flags from a file on disk.
     *
     * @param path
     *            configuration file
     * @return load result, never null
     */
    public LoadResult load(Path path) {
        Span span = tracer.spanBuilder("feature_flags.load").setAttribute("source", path.toString()).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            if (!Files.isRegularFile(path)) {
                LOG.warnf("Feature flags config not found at %s", path);
                span.addEvent("config.missing");
                return recordOutcome(LoadResult.missing(), span);
            }
            try (InputStream in = Files.newInputStream(path)) {
                return recordOutcome(read(in, path.toString()), span);
            } catch (IOException e) {
                LOG.errorf("Error reading feature flags config %s: %s", path, e.getMessage());
                return recordOutcome(LoadResult.malformed(), span);
            }
        } finally {
            span.end();
        }
    }

    /**
     * Loads flags from a stream. The parser consumes and closes the stream.
     *
     * @param in
     *            JSON document
     * @param sourceName
     *            name used in log messages
     * @return load result, never null
     */
    public LoadResult load(InputStream in, String sourceName) {
        Span span = tracer.spanBuilder("feature_flags.load").setAttribute("source", sourceName).startSpan();
        try (Scope ignored = span.makeCurrent()) {
            return recordOutcome(read(in, sourceName), span);
        } finally {
            span.end();
        }
    }

    /**
     * Parses a JSON document held in memory.
     *
     * @param json
     *            JSON document
     * @return parsed registry, empty if the document is malformed
     */
    public FlagRegistry parse(String json) {
        return load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline").registry();
    }

    private LoadResult read(InputStream in, String sourceName) {
        try {
            FeatureFlagsDocumentType document = objectMapper.readValue(in, FeatureFlagsDocumentType.class);
            return LoadResult.success(toRegistry(document, sourceName));
        } catch (JsonProcessingException e) {
            LOG.errorf("Error parsing feature flags config %s: %s", sourceName, e.getOriginalMessage());
            return LoadResult.malformed();
        } catch (IOException e) {
            LOG.errorf("Error reading feature flags config %s: %s", sourceName, e.getMessage());
            return LoadResult.malformed();
        }
    }

    private FlagRegistry toRegistry(FeatureFlagsDocumentType document, String sourceName) {
        if (document == null || document.features() == null) {
            LOG.warnf("Feature flags config %s has no features section", sourceName);
            return FlagRegistry.empty();
        }

        List<FlagDefinition> definitions = new ArrayList<>(document.features().size());
        for (Map.Entry<String, FeatureFlagConfigType> entry : document.features().entrySet()) {
            if (entry.getValue() == null) {
                LOG.warnf("Skipping feature flag %s with null configuration", entry.getKey());
                continue;
            }
            definitions.add(toDefinition(entry.getKey(), entry.getValue()));
        }
        return FlagRegistry.of(definitions);
    }

    FlagDefinition toDefinition(String name, FeatureFlagConfigType config) {
        FlagDefinition.Builder builder = FlagDefinition.builder(name).description(config.description())
                .enabled(Boolean.TRUE.equals(config.enabled()));

        if (config.environments() != null) {
            config.environments().forEach((envName, on) -> {
                Optional<Environment> environment = Environment.fromDocumentKey(envName);
                if (environment.isEmpty()) {
                    LOG.debugf("Ignoring unknown environment '%s' on feature flag %s", envName, name);
                } else if (on != null) {
                    builder.environment(environment.get(), on);
                }
            });
        }

        if (config.userGroups() != null) {
            // Labels are kept verbatim; a null entry becomes "" so the list stays a restriction no caller matches
            List<String> groups = new ArrayList<>(config.userGroups().size());
            for (String group : config.userGroups()) {
                if (group == null) {
                    LOG.warnf("Null entry in user_groups of feature flag %s matches no group", name);
                    groups.add("");
                } else {
                    groups.add(group);
                }
            }
            builder.userGroups(groups);
        }

        if (config.rolloutPercentage() != null) {
            int raw = config.rolloutPercentage();
            if (FlagDefinition.isOutOfRange(raw)) {
                LOG.warnf("Clamping rollout_percentage %d on feature flag %s to %d", raw, name,
                        FlagDefinition.clampRollout(raw));
            }
            builder.rolloutPercentage(raw);
        }
        return builder.build();
    }

    private LoadResult recordOutcome(LoadResult result, Span span) {
        span.setAttribute("outcome", result.outcome().tag());
        span.setAttribute("flag_count", result.registry().size());
        meterRegistry.counter(LOADS_METRIC, "outcome", result.outcome().tag()).increment();
        if (result.outcome() == Outcome.SUCCESS) {
            LOG.debugf("Loaded %d feature flags", result.registry().size());
        }
        return result;
    }

    /**
     * Load outcome category.
     */
    public enum Outcome {
        SUCCESS("success"), MISSING("missing"), MALFORMED("malformed");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }
    }

    /**
     * Registry produced by a load plus how the load went. Failed loads always carry an empty registry.
     *
     * @param registry
     *            loaded flags
     * @param outcome
     *            load outcome
     */
    public record LoadResult(FlagRegistry registry, Outcome outcome) {

        static LoadResult success(FlagRegistry registry) {
            return new LoadResult(registry, Outcome.SUCCESS);
        }

        static LoadResult missing() {
            return new LoadResult(FlagRegistry.empty(), Outcome.MISSING);
        }

        static LoadResult malformed() {
            return new LoadResult(FlagRegistry.empty(), Outcome.MALFORMED);
        }

        public boolean succeeded() {
            return outcome == Outcome.SUCCESS;
        }
    }
}
