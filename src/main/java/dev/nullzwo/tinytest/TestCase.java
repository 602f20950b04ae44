package dev.nullzwo.tinytest;

/**
 * The in-flight test of a {@link Group}. A frame keeps one instance and reuses it for every test it runs;
 * {@link TestStatus#NONE} marks it as not running.
 */
final class TestCase {
    String name;
    TestStatus status = TestStatus.NONE;
    boolean invertOutcome;
    long startNanos;

    boolean isOpen() {
        return status != TestStatus.NONE;
    }

    void start(String name, boolean invertOutcome, long startNanos) {
        this.name = name;
        this.invertOutcome = invertOutcome;
        this.startNanos = startNanos;
        this.status = TestStatus.PASS;
    }

    void reset() {
        status = TestStatus.NONE;
    }

    TestSnapshot snapshot(long durationMs) {
        return new TestSnapshot(name, status, invertOutcome, durationMs);
    }
}
