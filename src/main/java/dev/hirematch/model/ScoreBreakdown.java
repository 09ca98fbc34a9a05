package dev.hirematch.model;

/**
 * Common shape of the per-factor score breakdowns.
 */
public interface ScoreBreakdown {

    /**
     * Weighted combination of the sub-scores, 0 to 100.
     */
    double totalScore();

    /**
     * Message describing an internal scoring failure, null when scoring succeeded.
     */
    String error();

    default boolean hasError() {
        return error() != null;
    }
}
