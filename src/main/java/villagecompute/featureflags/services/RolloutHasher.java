/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.featureflags.services;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Stable rollout bucket assignment.
 *
 * <p>
 * <b>Algorithm:</b>
 * <ol>
 * <li>Compute MD5 over the UTF-8 bytes of the user id</li>
 * <li>Read the first 4 digest bytes big-endian as an unsigned 32-bit integer</li>
 * <li>Return (value mod 100), a bucket in [0-99]</li>
 * </ol>
 *
 * <p>
 * The bucket depends on the user id alone, so a user sits in the same bucket for every flag and on every machine.
 * Changing this algorithm reshuffles every user's rollout assignment.
 */
public final class RolloutHasher {

    public static final int BUCKETS = 100;

    private RolloutHasher() {
    }

    /**
     * Computes the rollout bucket for a user.
     *
     * @param userId
     *            stable user identifier
     * @return bucket in [0-99]
     */
    public static int bucket(String userId) {
        byte[] hash = md5().digest(userId.getBytes(StandardCharsets.UTF_8));

        // First 4 bytes as unsigned int (avoids Math.abs(Integer.MIN_VALUE))
        int hashInt = ((hash[0] & 0xFF) << 24) | ((hash[1] & 0xFF) << 16) | ((hash[2] & 0xFF) << 8)
                | (hash[3] & 0xFF);
        long unsignedValue = hashInt & 0xFFFFFFFFL;

        return (int) (unsignedValue % BUCKETS);
    }

    /**
     * Whether a user falls inside a rollout of the given percentage.
     *
     * @param userId
     *            stable user identifier
     * @param rolloutPercentage
     *            percentage in [0,100]
     * @return true if the user's bucket is below the threshold
     */
    public static boolean isInRollout(String userId, int rolloutPercentage) {
        return bucket(userId) < rolloutPercentage;
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to ship MD5
            throw new IllegalStateException("MD5 algorithm not available", e);
        }
    }
}
