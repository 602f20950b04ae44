package dev.nullzwo.tinytest;

/**
 * Handle on the currently running test, passed to a {@link TestBody}.
 */
public interface TestContext {
    String getName();

    boolean isInvertOutcome();

    /**
     * Records an assertion for this test.
     *
     * @return {@code expr}, unchanged
     */
    boolean check(boolean expr);
}
