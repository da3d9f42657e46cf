/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import villagecompute.featureflags.data.models.Environment;
import villagecompute.featureflags.data.models.FlagDefinition;
import villagecompute.featureflags.data.models.FlagRegistry;
import villagecompute.featureflags.exceptions.FeatureNotEnabledException;
import villagecompute.featureflags.services.FeatureGuard.FeatureCheckResult;

/**
 * Unit tests for {@link FeatureGuard}.
 */
class FeatureGuardTest {

    private FeatureGuard guard;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        FlagRegistry registry = FlagRegistry.of(
                FlagDefinition.builder("voice_agent").enabled(true).enabledIn(Environment.PRODUCTION)
                        .userGroups("sales").build(),
                FlagDefinition.builder("apollo_leads").enabled(true).enabledIn(Environment.PRODUCTION).build(),
                FlagDefinition.builder("legacy").enabled(false).enabledIn(Environment.PRODUCTION).build());

        meterRegistry = new SimpleMeterRegistry();
        guard = new FeatureGuard();
        guard.flagEvaluator = new FlagEvaluator(registry, Environment.PRODUCTION);
        guard.meterRegistry = meterRegistry;
    }

    @Test
    void testCheckAllowsAndDenies() {
        FeatureCheckResult allowed = guard.check("voice_agent", "sales", "u1");
        FeatureCheckResult denied = guard.check("voice_agent", "basic", "u1");

        assertTrue(allowed.allowed());
        assertEquals("voice_agent", allowed.flagKey());
        assertFalse(denied.allowed());
        assertEquals("group_not_allowed", denied.reason());
    }

    @Test
    void testCheckCountsOutcomes() {
        guard.check("apollo_leads", null, null);
        guard.check("apollo_leads", null, null);
        guard.check("legacy", null, null);

        assertEquals(2.0,
                meterRegistry.counter(FeatureGuard.CHECKS_METRIC, "flag", "apollo_leads", "outcome", "allowed")
                        .count());
        assertEquals(1.0,
                meterRegistry.counter(FeatureGuard.CHECKS_METRIC, "flag", "legacy", "outcome", "denied").count());
    }

    @Test
    void testCheckAnyReportsFirstEnabledFlag() {
        FeatureCheckResult result = guard.checkAny(List.of("legacy", "voice_agent", "apollo_leads"), "basic", null);

        assertTrue(result.allowed());
        assertEquals("apollo_leads", result.flagKey());
    }

    @Test
    void testCheckAnyDeniesWhenNoneEnabled() {
        FeatureCheckResult result = guard.checkAny(List.of("legacy", "missing"), null, null);

        assertFalse(result.allowed());
        assertEquals("missing", result.flagKey());
        assertEquals("flag_not_found", result.reason());
    }

    @Test
    void testCheckAllReportsFirstDenial() {
        FeatureCheckResult result = guard.checkAll(List.of("apollo_leads", "legacy", "voice_agent"), "sales", null);

        assertFalse(result.allowed());
        assertEquals("legacy", result.flagKey());
        assertEquals("master_disabled", result.reason());
        assertTrue(guard.checkAll(List.of("apollo_leads", "voice_agent"), "sales", null).allowed());
    }

    @Test
    void testEmptyFlagLists() {
        FeatureCheckResult any = guard.checkAny(List.of(), null, null);
        FeatureCheckResult all = guard.checkAll(List.of(), null, null);

        assertFalse(any.allowed());
        assertTrue(all.allowed());
        assertNull(any.flagKey());
        assertEquals("no_flags", all.reason());
    }

    @Test
    void testIfEnabledRunsOnlyWhenAllowed() {
        AtomicInteger calls = new AtomicInteger();

        Optional<String> allowed = guard.ifEnabled("apollo_leads", null, null, () -> {
            calls.incrementAndGet();
            return "searched";
        });
        Optional<String> denied = guard.ifEnabled("legacy", null, null, () -> {
            calls.incrementAndGet();
            return "never";
        });

        assertEquals(Optional.of("searched"), allowed);
        assertTrue(denied.isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    void testRequireThrowsOnDenial() {
        assertDoesNotThrow(() -> guard.require("voice_agent", "sales", null));

        FeatureNotEnabledException e = assertThrows(FeatureNotEnabledException.class,
                () -> guard.require("voice_agent", "basic", null));
        assertEquals("voice_agent", e.getFlagKey());
        assertEquals("group_not_allowed", e.getReason());
    }

    @Test
    void testRequireRejectsNullFlag() {
        assertThrows(NullPointerException.class, () -> guard.require(null, null, null));
    }
}
