package dev.nullzwo.tinytest;

import java.util.Objects;

/**
 * Pass, fail and skip counts plus the accumulated duration of a group or a whole run.
 */
public final class Totals {
    public static final Totals EMPTY = new Totals(0, 0, 0, 0);

    private final int pass;
    private final int fail;
    private final int skip;
    private final long durationMs;

    public Totals(int pass, int fail, int skip, long durationMs) {
        this.pass = pass;
        this.fail = fail;
        this.skip = skip;
        this.durationMs = durationMs;
    }

    public int getPass() {
        return pass;
    }

    public int getFail() {
        return fail;
    }

    public int getSkip() {
        return skip;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Totals plus(Totals other) {
        return new Totals(pass + other.pass, fail + other.fail, skip + other.skip, durationMs + other.durationMs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Totals)) {
            return false;
        }
        Totals totals = (Totals) o;
        return pass == totals.pass && fail == totals.fail && skip == totals.skip && durationMs == totals.durationMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pass, fail, skip, durationMs);
    }

    @Override
    public String toString() {
        return pass + " pass, " + fail + " fail, " + skip + " skip (" + durationMs + "ms)";
    }
}
