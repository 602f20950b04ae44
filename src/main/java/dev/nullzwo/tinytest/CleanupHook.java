package dev.nullzwo.tinytest;

/**
 * Observer invoked after every completed test of the group (or run) it is registered on.
 * <p>
 * Hooks only see a {@link TestSnapshot} and can not change the outcome of the test.
 */
@FunctionalInterface
public interface CleanupHook {
    void cleanUp(TestSnapshot test);
}
