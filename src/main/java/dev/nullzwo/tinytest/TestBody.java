package dev.nullzwo.tinytest;

/**
 * The code of a single test. Returning {@code false} counts as a failed assertion, unless the test expects to fail.
 */
@FunctionalInterface
public interface TestBody {
    boolean run(TestContext test);
}
