package dev.nullzwo.tinytest;

/**
 * Reduces the assertions of the open test into its status.
 * <p>
 * An assertion passes when {@code expr XOR invertOutcome} holds. The status stays {@link TestStatus#PASS} only while
 * every assertion so far passed; the first failing one turns it into {@link TestStatus#FAIL} for good. For an inverted
 * test this means the first assertion already decides, later ones can not bring it back.
 */
final class AssertionEngine {
    private AssertionEngine() {
    }

    static TestStatus reduce(TestStatus current, boolean expr, boolean invertOutcome) {
        var isPass = expr ^ invertOutcome;
        return isPass && current == TestStatus.PASS ? TestStatus.PASS : TestStatus.FAIL;
    }

    static boolean check(TestCase test, boolean expr) {
        test.status = reduce(test.status, expr, test.invertOutcome);
        return expr;
    }
}
