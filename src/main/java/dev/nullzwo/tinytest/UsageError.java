package dev.nullzwo.tinytest;

/**
 * Signals a violated lifecycle contract of {@link TestRunner}, e.g. closing a group that was never opened.
 * <p>
 * This is a defect in the calling code and not a test failure, so it is an {@link Error} and the run is over.
 */
public class UsageError extends Error {
    public UsageError(String message) {
        super(message);
    }
}
