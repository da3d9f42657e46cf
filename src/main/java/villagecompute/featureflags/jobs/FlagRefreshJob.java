/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.jobs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

import io.quarkus.scheduler.Scheduled;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.featureflags.config.FeatureFlagConfig;
import villagecompute.featureflags.services.FlagReloadService;
import villagecompute.featureflags.services.FlagReloadService.ReloadResult;

/**
 * Background job that reloads feature flags when the configuration document changes.
 *
 * <h3>Job Schedule:</h3>
 * <ul>
 * <li>Interval: {@code feature-flags.refresh-interval} (default: off, so the job never runs)</li>
 * <li>Change detection: file modification time, compared with the previous run</li>
 * </ul>
 *
 * <p>
 * The first run only records the modification time, since the evaluator already loaded the document at startup. A
 * document that disappears counts as a change; the reload then leaves the evaluator empty.
 */
@ApplicationScoped
public class FlagRefreshJob {

    private static final Logger LOG = Logger.getLogger(FlagRefreshJob.class);

    static final String ORIGIN = "FlagRefreshJob";

    @Inject
    FlagReloadService reloadService;

    @Inject
    FeatureFlagConfig config;

    private boolean initialized;
    private FileTime lastModified;

    /**
     * Checks the configuration document and reloads when it changed.
     */
    @Scheduled(
            every = "${feature-flags.refresh-interval:off}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void refresh() {
        refreshIfChanged();
    }

    /**
     * @return true if a reload happened
     */
    synchronized boolean refreshIfChanged() {
        Path path = config.configPath();
        FileTime current = readModifiedTime(path);

        if (!initialized) {
            initialized = true;
            lastModified = current;
            LOG.debugf("FlagRefreshJob watching %s", path);
            return false;
        }

        if (Objects.equals(current, lastModified)) {
            return false;
        }

        lastModified = current;
        ReloadResult result = reloadService.reloadFromSource(ORIGIN);
        LOG.infof("Feature flag document %s changed, reloaded: flags=%d outcome=%s", path, result.flagCount(),
                result.outcome());
        return true;
    }

    private FileTime readModifiedTime(Path path) {
        if (!Files.exists(path)) {
            return null;
        }
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            LOG.warnf("Unable to read modification time of %s: %s", path, e.getMessage());
            return null;
        }
    }
}
