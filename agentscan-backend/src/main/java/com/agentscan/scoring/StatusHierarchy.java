package com.agentscan.scoring;

import com.agentscan.model.DetectionStatus;

/**
 * Total order over the ranked detection statuses.
 *
 * <p>{@code confirmed > platform_enabled > eligible > not_detected}. {@code not_applicable} is
 * terminal and unranked; asking for its rank is a programming error.
 */
public final class StatusHierarchy {

    private StatusHierarchy() {
    }

    /**
     * Rank of a ranked status.
     *
     * @param status detection status
     * @return 4 for confirmed down to 1 for not_detected
     * @throws IllegalArgumentException for {@code null} or {@code not_applicable}
     */
    public static int rank(DetectionStatus status) {
        if (status == null || !status.isRanked()) {
            throw new IllegalArgumentException("Status has no rank: " + status);
        }
        return status.getRank();
    }

    public static boolean isDetected(DetectionStatus status) {
        return status != null && status.isDetected();
    }

    /**
     * Lattice join: the higher-ranked of two ranked statuses.
     */
    public static DetectionStatus max(DetectionStatus a, DetectionStatus b) {
        return rank(a) >= rank(b) ? a : b;
    }

    /**
     * Whether {@code candidate} may replace {@code current}: both ranked, candidate strictly higher,
     * and current not {@code confirmed}.
     */
    public static boolean canUpgrade(DetectionStatus current, DetectionStatus candidate) {
        if (current == null || candidate == null || !current.isRanked() || !candidate.isRanked()) {
            return false;
        }
        if (current == DetectionStatus.CONFIRMED) {
            return false;
        }
        return max(current, candidate) == candidate && candidate != current;
    }
}
