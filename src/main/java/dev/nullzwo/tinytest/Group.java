package dev.nullzwo.tinytest;

/**
 * One nesting level of the {@link GroupStack}. Frames are reused in place, {@link #reset(String)} prepares a
 * frame for the next group pushed onto its slot.
 */
final class Group {
    String name;
    final TestCase test = new TestCase();
    Totals totals = Totals.EMPTY;
    CleanupHook cleanup;
    boolean cleanupOnlyForThis;

    void reset(String name) {
        this.name = name;
        this.totals = Totals.EMPTY;
        this.cleanup = null;
        this.cleanupOnlyForThis = false;
        test.reset();
    }

    void register(CleanupHook hook, boolean onlyForThis) {
        this.cleanup = hook;
        this.cleanupOnlyForThis = onlyForThis;
    }

    void countPass(long durationMs) {
        totals = totals.plus(new Totals(1, 0, 0, durationMs));
    }

    void countFail(long durationMs) {
        totals = totals.plus(new Totals(0, 1, 0, durationMs));
    }

    void countSkip() {
        totals = totals.plus(new Totals(0, 0, 1, 0));
    }

    void fold(Totals child) {
        totals = totals.plus(child);
    }
}
