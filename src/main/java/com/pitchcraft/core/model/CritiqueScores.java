package com.pitchcraft.core.model;

import java.io.Serializable;

/**
 * The six criteria a pitch draft is scored on, each in [0, 10].
 */
public record CritiqueScores(
    double clarity,
    double problem,
    double solution,
    double uniqueness,
    double traction,
    double engagement
) implements Serializable {

    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 10.0;

    public static CritiqueScores lowest() {
        return new CritiqueScores(MIN_SCORE, MIN_SCORE, MIN_SCORE, MIN_SCORE, MIN_SCORE, MIN_SCORE);
    }

    public static CritiqueScores uniform(double score) {
        return new CritiqueScores(score, score, score, score, score, score);
    }

    /**
     * Unweighted mean of the six scores, rounded to one decimal.
     */
    public double overall() {
        double sum = clarity + problem + solution + uniqueness + traction + engagement;
        return Math.round(sum / 6.0 * 10.0) / 10.0;
    }
}
