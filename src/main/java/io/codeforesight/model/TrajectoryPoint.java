package io.codeforesight.model;

import java.time.Instant;

/**
 * One historical observation of the risk load of a code base, supplied by the caller.
 *
 * @param timestamp When the observation was taken (may be null for ordinal histories)
 * @param riskLoad  Non-negative aggregate risk load of that run
 */
public record TrajectoryPoint(Instant timestamp, double riskLoad) {

    public TrajectoryPoint {
        if (Double.isNaN(riskLoad) || riskLoad < 0) {
            throw new IllegalArgumentException("riskLoad must be a non-negative number, got " + riskLoad);
        }
    }
}
