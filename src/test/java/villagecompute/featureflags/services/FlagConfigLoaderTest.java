/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;

import villagecompute.featureflags.data.models.Environment;
import villagecompute.featureflags.data.models.FlagDefinition;
import villagecompute.featureflags.data.models.FlagRegistry;
import villagecompute.featureflags.services.FlagConfigLoader.LoadResult;
import villagecompute.featureflags.services.FlagConfigLoader.Outcome;

/**
 * Unit tests for {@link FlagConfigLoader} parsing, clamping and failure degradation.
 */
class FlagConfigLoaderTest {

    private static final String VALID_DOCUMENT = """
            {
              "features": {
                "voice_agent": {
                  "enabled": true,
                  "description": "Outbound AI voice agent calls",
                  "environments": {"production": true, "staging": false},
                  "user_groups": ["admin", "sales"],
                  "rollout_percentage": 25
                },
                "apollo_leads": {
                  "enabled": false
                },
                "linkedin_integration": {
                  "enabled": true,
                  "environments": {"development": true}
                }
              }
            }
            """;

    private FlagConfigLoader loader;
    private SimpleMeterRegistry meterRegistry;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        loader = new FlagConfigLoader();
        loader.objectMapper = new ObjectMapper();
        loader.tracer = TracerProvider.noop().get("test");
        loader.meterRegistry = meterRegistry;
    }

    @Test
    void testParsesDefinitionsInDocumentOrder() {
        FlagRegistry registry = loader.parse(VALID_DOCUMENT);

        assertEquals(List.of("voice_agent", "apollo_leads", "linkedin_integration"), registry.names());

        FlagDefinition voiceAgent = registry.find("voice_agent").orElseThrow();
        assertTrue(voiceAgent.enabled());
        assertEquals("Outbound AI voice agent calls", voiceAgent.description());
        assertTrue(voiceAgent.isEnabledIn(Environment.PRODUCTION));
        assertFalse(voiceAgent.isEnabledIn(Environment.STAGING));
        assertFalse(voiceAgent.isEnabledIn(Environment.DEVELOPMENT));
        assertEquals(List.of("admin", "sales"), List.copyOf(voiceAgent.userGroups()));
        assertEquals(25, voiceAgent.rolloutPercentage());
    }

    @Test
    void testMissingFieldsTakeDefaults() {
        FlagDefinition apollo = loader.parse(VALID_DOCUMENT).find("apollo_leads").orElseThrow();

        assertFalse(apollo.enabled());
        assertTrue(apollo.environments().isEmpty());
        assertTrue(apollo.userGroups().isEmpty());
        assertEquals(100, apollo.rolloutPercentage());
        assertNull(apollo.description());
    }

    @Test
    void testOutOfRangeRolloutIsClamped() {
        FlagRegistry registry = loader.parse("""
                {"features": {
                  "negative": {"enabled": true, "rollout_percentage": -15},
                  "huge": {"enabled": true, "rollout_percentage": 250}
                }}
                """);

        assertEquals(0, registry.find("negative").orElseThrow().rolloutPercentage());
        assertEquals(100, registry.find("huge").orElseThrow().rolloutPercentage());
    }

    @Test
    void testEnvironmentKeysMatchedExactly() {
        FlagDefinition flag = loader.parse("""
                {"features": {"f": {
                  "enabled": true,
                  "environments": {"qa": true, "Production": true, " staging": true, "development": true}
                }}}
                """).find("f").orElseThrow();

        assertFalse(flag.isEnabledIn(Environment.PRODUCTION));
        assertFalse(flag.isEnabledIn(Environment.STAGING));
        assertTrue(flag.isEnabledIn(Environment.DEVELOPMENT));
        assertEquals(1, flag.environments().size());
    }

    @Test
    void testDifferentlyCasedDuplicateDoesNotOverrideEnvironment() {
        FlagRegistry registry = loader.parse("""
                {"features": {"f": {"enabled": true, "environments": {"production": false, "PRODUCTION": true}}}}
                """);

        assertFalse(new FlagEvaluator(registry, Environment.PRODUCTION).isEnabled("f"));
    }

    @Test
    void testBlankOnlyAllowListStillRestrictsGroups() {
        FlagRegistry registry = loader.parse("""
                {"features": {
                  "blank": {"enabled": true, "environments": {"production": true}, "user_groups": [" "]},
                  "nulls": {"enabled": true, "environments": {"production": true}, "user_groups": [null]}
                }}
                """);
        FlagEvaluator evaluator = new FlagEvaluator(registry, Environment.PRODUCTION);

        assertFalse(evaluator.isEnabled("blank", "basic", null));
        assertFalse(evaluator.isEnabled("nulls", "basic", null));
        assertTrue(evaluator.isEnabled("blank", null, null));
        assertEquals(List.of(" "), List.copyOf(registry.find("blank").orElseThrow().userGroups()));
    }

    @Test
    void testGroupLabelsKeptVerbatim() {
        FlagDefinition flag = loader.parse("""
                {"features": {"f": {"enabled": true, "user_groups": ["sales", " Sales "]}}}
                """).find("f").orElseThrow();

        assertEquals(List.of("sales", " Sales "), List.copyOf(flag.userGroups()));
        assertTrue(flag.allowsGroup("sales"));
        assertFalse(flag.allowsGroup("Sales"));
    }

    @Test
    void testDocumentWithoutFeaturesYieldsEmptyRegistry() {
        assertTrue(loader.parse("{\"flags\": {}}").isEmpty());
        assertTrue(loader.parse("{}").isEmpty());
    }

    @Test
    void testMalformedJsonYieldsEmptyRegistry() {
        assertTrue(loader.parse("{\"features\": {\"broken\": ").isEmpty());
        assertEquals(1.0, meterRegistry.counter(FlagConfigLoader.LOADS_METRIC, "outcome", "malformed").count());
    }

    @Test
    void testStructuralMismatchYieldsEmptyRegistry() {
        assertTrue(loader.parse("[1, 2, 3]").isEmpty());
        assertTrue(loader.parse("{\"features\": {\"f\": {\"enabled\": \"maybe\"}}}").isEmpty());
        assertTrue(loader.parse("{\"features\": {\"f\": {\"user_groups\": {\"a\": 1}}}}").isEmpty());
        assertEquals(3.0, meterRegistry.counter(FlagConfigLoader.LOADS_METRIC, "outcome", "malformed").count());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("flags.json");
        Files.writeString(file, VALID_DOCUMENT, StandardCharsets.UTF_8);

        LoadResult result = loader.load(file);

        assertTrue(result.succeeded());
        assertEquals(3, result.registry().size());
        assertEquals(1.0, meterRegistry.counter(FlagConfigLoader.LOADS_METRIC, "outcome", "success").count());
    }

    @Test
    void testMissingFileYieldsEmptyRegistry() {
        LoadResult result = loader.load(tempDir.resolve("does-not-exist.json"));

        assertEquals(Outcome.MISSING, result.outcome());
        assertTrue(result.registry().isEmpty());
        assertEquals(1.0, meterRegistry.counter(FlagConfigLoader.LOADS_METRIC, "outcome", "missing").count());
    }

    @Test
    void testMalformedFileYieldsEmptyRegistry() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "not json at all", StandardCharsets.UTF_8);

        LoadResult result = loader.load(file);

        assertEquals(Outcome.MALFORMED, result.outcome());
        assertFalse(result.succeeded());
        assertTrue(result.registry().isEmpty());
    }

    @Test
    void testLoadedRegistryDrivesEvaluator() {
        FlagEvaluator evaluator = new FlagEvaluator(loader.parse(VALID_DOCUMENT), Environment.DEVELOPMENT);

        assertEquals(List.of("linkedin_integration"), evaluator.getEnabledFeatures("basic", "u1"));
    }
}
