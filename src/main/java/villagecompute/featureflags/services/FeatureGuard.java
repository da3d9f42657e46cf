/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import io.micrometer.core.instrument.MeterRegistry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.featureflags.exceptions.FeatureNotEnabledException;
import villagecompute.featureflags.services.FlagEvaluator.EvaluationResult;
import villagecompute.featureflags.services.FlagEvaluator.Snapshot;

/**
 * Explicit feature gating at call sites.
 *
 * <p>
 * Guards return an allow/deny {@link FeatureCheckResult} instead of throwing, so the caller decides whether a denial
 * is an error ({@link #require}) or a silent no-op ({@link #ifEnabled}).
 *
 * <p>
 * <b>Variants:</b>
 * <ul>
 * <li>{@link #check} - single flag</li>
 * <li>{@link #checkAny} - any one of several flags (OR)</li>
 * <li>{@link #checkAll} - every one of several flags (AND)</li>
 * </ul>
 * Multi-flag checks evaluate against one snapshot so a concurrent reload cannot split the decision.
 *
 * <p>
 * <b>Metrics:</b> {@code feature_flags.guard.checks} counter tagged by flag and outcome.
 */
@ApplicationScoped
public class FeatureGuard {

    private static final Logger LOG = Logger.getLogger(FeatureGuard.class);

    static final String CHECKS_METRIC = "feature_flags.guard.checks";
    static final String NO_FLAGS = "no_flags";

    @Inject
    FlagEvaluator flagEvaluator;

    @Inject
    MeterRegistry meterRegistry;

    /**
     * Checks a single flag for the caller.
     *
     * @param flagKey
     *            flag identifier
     * @param group
     *            caller group (nullable)
     * @param userId
     *            caller user id (nullable)
     * @return allow/deny result
     */
    public FeatureCheckResult check(String flagKey, String group, String userId) {
        return check(flagEvaluator.snapshot(), flagKey, group, userId);
    }

    /**
     * Allows the caller if any of the flags is enabled. Reports the first enabled flag, or the last denial.
     */
    public FeatureCheckResult checkAny(List<String> flagKeys, String group, String userId) {
        if (flagKeys.isEmpty()) {
            return new FeatureCheckResult(null, false, NO_FLAGS);
        }
        Snapshot snapshot = flagEvaluator.snapshot();
        FeatureCheckResult last = null;
        for (String flagKey : flagKeys) {
            last = check(snapshot, flagKey, group, userId);
            if (last.allowed()) {
                return last;
            }
        }
        return last;
    }

    /**
     * Allows the caller only if every flag is enabled. Reports the first denial.
     */
    public FeatureCheckResult checkAll(List<String> flagKeys, String group, String userId) {
        if (flagKeys.isEmpty()) {
            return new FeatureCheckResult(null, true, NO_FLAGS);
        }
        Snapshot snapshot = flagEvaluator.snapshot();
        FeatureCheckResult last = null;
        for (String flagKey : flagKeys) {
            last = check(snapshot, flagKey, group, userId);
            if (!last.allowed()) {
                return last;
            }
        }
        return last;
    }

    /**
     * Runs the action only when the flag is enabled.
     *
     * @param flagKey
     *            flag identifier
     * @param group
     *            caller group (nullable)
     * @param userId
     *            caller user id (nullable)
     * @param action
     *            work to run when allowed
     * @return the action's result, or empty when denied
     */
    public <T> Optional<T> ifEnabled(String flagKey, String group, String userId, Supplier<T> action) {
        if (!check(flagKey, group, userId).allowed()) {
            return Optional.empty();
        }
        return Optional.ofNullable(action.get());
    }

    /**
     * Fails when the flag is not enabled.
     *
     * @throws FeatureNotEnabledException
     *             if the flag is off for the caller
     */
    public void require(String flagKey, String group, String userId) {
        Objects.requireNonNull(flagKey, "flagKey is required");
        FeatureCheckResult result = check(flagKey, group, userId);
        if (!result.allowed()) {
            throw new FeatureNotEnabledException(flagKey, result.reason());
        }
    }

    private FeatureCheckResult check(Snapshot snapshot, String flagKey, String group, String userId) {
        EvaluationResult evaluation = snapshot.evaluate(flagKey, group, userId);
        String outcome = evaluation.enabled() ? "allowed" : "denied";
        meterRegistry.counter(CHECKS_METRIC, "flag", String.valueOf(flagKey), "outcome", outcome).increment();
        LOG.debugf("Feature check %s: flag=%s group=%s reason=%s", outcome, flagKey, group,
                evaluation.reason().code());
        return new FeatureCheckResult(flagKey, evaluation.enabled(), evaluation.reason().code());
    }

    /**
     * Guard decision.
     *
     * @param flagKey
     *            flag that decided the outcome (null when no flags were given)
     * @param allowed
     *            whether the caller may proceed
     * @param reason
     *            evaluation reason code
     */
    public record FeatureCheckResult(String flagKey, boolean allowed, String reason) {
    }
}
