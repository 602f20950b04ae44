package dev.nullzwo.tinytest;

/**
 * Read-only view of a finished test, handed to {@link CleanupHook}s.
 */
public final class TestSnapshot {
    private final String name;
    private final TestStatus status;
    private final boolean invertOutcome;
    private final long durationMs;

    public TestSnapshot(String name, TestStatus status, boolean invertOutcome, long durationMs) {
        this.name = name;
        this.status = status;
        this.invertOutcome = invertOutcome;
        this.durationMs = durationMs;
    }

    public String getName() {
        return name;
    }

    public TestStatus getStatus() {
        return status;
    }

    public boolean isInvertOutcome() {
        return invertOutcome;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "TestSnapshot{" +
               "name='" + name + '\'' +
               ", status=" + status +
               ", invertOutcome=" + invertOutcome +
               ", durationMs=" + durationMs +
               '}';
    }
}
