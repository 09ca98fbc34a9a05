package dev.hirematch.service;

/**
 * Raised inside a scoring step when its input is malformed.
 * Never escapes {@link ScoringService}: each entry point converts it into a zero-valued breakdown.
 */
public class ScoreComputationException extends RuntimeException {

    public ScoreComputationException(String message) {
        super(message);
    }

    public ScoreComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
