/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import villagecompute.featureflags.data.models.Environment;
import villagecompute.featureflags.data.models.FlagDefinition;
import villagecompute.featureflags.data.models.FlagRegistry;

/**
 * Central feature flag evaluator.
 *
 * <p>
 * Holds the current {@link FlagRegistry} and active {@link Environment} as a single immutable {@link Snapshot}. One
 * instance is built at startup by {@link villagecompute.featureflags.config.FeatureFlagConfig} and injected wherever
 * flag checks are needed; tests construct isolated instances directly.
 *
 * <p>
 * <b>Evaluation Order</b> (each gate short-circuits to false):
 * <ol>
 * <li>Flag missing from the registry</li>
 * <li>Master switch off</li>
 * <li>Not opted in for the current environment</li>
 * <li>Group given, allow-list non-empty, group not listed</li>
 * <li>Rollout below 100%, user id given, user's bucket at or above the percentage</li>
 * </ol>
 * Otherwise the flag is enabled. A missing group skips the group gate and a missing user id skips the rollout gate.
 *
 * <p>
 * <b>Thread Safety:</b> Queries read the snapshot reference once and evaluate against it without locking. Reloads
 * swap the reference atomically and are serialized against each other.
 *
 * @see RolloutHasher for bucket assignment
 */
public class FlagEvaluator {

    private static final Logger LOG = Logger.getLogger(FlagEvaluator.class);

    private final AtomicReference<Snapshot> current;
    private final Object reloadLock = new Object();

    public FlagEvaluator(FlagRegistry registry, Environment environment) {
        this.current = new AtomicReference<>(new Snapshot(registry, environment));
    }

    /**
     * Creates an evaluator with no flags; every query answers false until a reload.
     */
    public static FlagEvaluator empty(Environment environment) {
        return new FlagEvaluator(FlagRegistry.empty(), environment);
    }

    /**
     * Captures the current registry and environment. The returned snapshot never observes later reloads.
     */
    public Snapshot snapshot() {
        return current.get();
    }

    public boolean isEnabled(String flagName) {
        return snapshot().isEnabled(flagName, null, null);
    }

    /**
     * Checks whether a flag is active for the caller.
     *
     * @param flagName
     *            flag identifier
     * @param group
     *            caller group label (null or empty when unknown)
     * @param userId
     *            stable user identifier (null or empty when anonymous)
     * @return true if every gate passes
     */
    public boolean isEnabled(String flagName, String group, String userId) {
        return snapshot().isEnabled(flagName, group, userId);
    }

    /**
     * Evaluates a flag and reports which gate decided the outcome.
     */
    public EvaluationResult evaluate(String flagName, String group, String userId) {
        return snapshot().evaluate(flagName, group, userId);
    }

    /**
     * Lists every flag enabled for the caller, in registry order.
     */
    public List<String> getEnabledFeatures(String group, String userId) {
        return snapshot().getEnabledFeatures(group, userId);
    }

    /**
     * Raw definition lookup with no evaluation.
     */
    public Optional<FlagDefinition> getFeatureDefinition(String flagName) {
        return snapshot().registry().find(flagName);
    }

    public Environment currentEnvironment() {
        return snapshot().environment();
    }

    public int flagCount() {
        return snapshot().registry().size();
    }

    /**
     * Replaces the registry, keeping the current environment.
     *
     * @param newRegistry
     *            fully built registry
     */
    public void reload(FlagRegistry newRegistry) {
        reload(newRegistry, null);
    }

    /**
     * Replaces the registry and, when given, the environment. Queries already in flight finish against the snapshot
     * they started with.
     *
     * @param newRegistry
     *            fully built registry
     * @param newEnvironment
     *            new environment, or null to keep the current one
     */
    public void reload(FlagRegistry newRegistry, Environment newEnvironment) {
        Objects.requireNonNull(newRegistry, "newRegistry is required");
        synchronized (reloadLock) {
            Snapshot previous = current.get();
            Environment environment = newEnvironment != null ? newEnvironment : previous.environment();
            current.set(new Snapshot(newRegistry, environment));
            LOG.debugf("Feature flags reloaded: flags=%d (was %d) environment=%s", newRegistry.size(),
                    previous.registry().size(), environment.value());
        }
    }

    /**
     * Consistent view of the registry and environment at one point in time.
     *
     * @param registry
     *            flag definitions
     * @param environment
     *            active environment
     */
    public record Snapshot(FlagRegistry registry, Environment environment) {

        public Snapshot {
            Objects.requireNonNull(registry, "registry is required");
            Objects.requireNonNull(environment, "environment is required");
        }

        public boolean isEnabled(String flagName, String group, String userId) {
            return evaluate(flagName, group, userId).enabled();
        }

        public EvaluationResult evaluate(String flagName, String group, String userId) {
            Optional<FlagDefinition> flagOpt = registry.find(flagName);
            if (flagOpt.isEmpty()) {
                return EvaluationResult.disabled(Reason.FLAG_NOT_FOUND, 0);
            }

            FlagDefinition flag = flagOpt.get();
            int rollout = flag.rolloutPercentage();

            if (!flag.enabled()) {
                return EvaluationResult.disabled(Reason.MASTER_DISABLED, rollout);
            }

            if (!flag.isEnabledIn(environment)) {
                return EvaluationResult.disabled(Reason.ENVIRONMENT_DISABLED, rollout);
            }

            if (isPresent(group) && !flag.allowsGroup(group)) {
                return EvaluationResult.disabled(Reason.GROUP_NOT_ALLOWED, rollout);
            }

            if (flag.isFullRollout()) {
                return EvaluationResult.enabled(Reason.FULL_ROLLOUT, rollout);
            }

            if (!isPresent(userId)) {
                // No identity, so the rollout gate cannot exclude the caller
                return EvaluationResult.enabled(Reason.NO_SUBJECT, rollout);
            }

            if (RolloutHasher.bucket(userId) >= rollout) {
                return EvaluationResult.disabled(Reason.COHORT_DISABLED, rollout);
            }
            return EvaluationResult.enabled(Reason.COHORT_ENABLED, rollout);
        }

        public List<String> getEnabledFeatures(String group, String userId) {
            List<String> enabled = new ArrayList<>();
            for (String name : registry.names()) {
                if (isEnabled(name, group, userId)) {
                    enabled.add(name);
                }
            }
            return enabled;
        }

        private static boolean isPresent(String value) {
            return value != null && !value.isEmpty();
        }
    }

    /**
     * Gate that decided an evaluation.
     */
    public enum Reason {
        FLAG_NOT_FOUND("flag_not_found"), MASTER_DISABLED("master_disabled"), ENVIRONMENT_DISABLED(
                "environment_disabled"), GROUP_NOT_ALLOWED("group_not_allowed"), COHORT_DISABLED(
                        "cohort_disabled"), COHORT_ENABLED("cohort_enabled"), NO_SUBJECT(
                                "no_subject"), FULL_ROLLOUT("full_rollout");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        /**
         * @return snake_case reason code exposed in API responses
         */
        public String code() {
            return code;
        }
    }

    /**
     * Evaluation result record containing flag state and metadata.
     *
     * @param enabled
     *            whether the flag is enabled for the caller
     * @param reason
     *            gate that decided the outcome
     * @param rolloutPercentage
     *            snapshot of rollout percentage at evaluation time (0 for unknown flags)
     */
    public record EvaluationResult(boolean enabled, Reason reason, int rolloutPercentage) {

        static EvaluationResult enabled(Reason reason, int rolloutPercentage) {
            return new EvaluationResult(true, reason, rolloutPercentage);
        }

        static EvaluationResult disabled(Reason reason, int rolloutPercentage) {
            return new EvaluationResult(false, reason, rolloutPercentage);
        }
    }
}
