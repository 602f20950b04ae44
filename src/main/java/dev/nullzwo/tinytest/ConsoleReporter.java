package dev.nullzwo.tinytest;

import java.io.PrintStream;

/**
 * Prints a plain text protocol of a run.
 *
 * <pre>
 * &#64;&#64;&#64;&#64; Math
 * ---- Math ::&gt; adds
 *       # PASS (0ms)
 *
 * !!!! Math # DONE :: 1 pass, 0 fail, 0 skip (0ms) !!!!
 * </pre>
 */
public class ConsoleReporter implements ExecutionListener {
    public static final String GROUP_MARKER = "@@@@ ";
    public static final String TEST_MARKER = "---- ";
    public static final String TEST_SEPARATOR = " ::> ";
    public static final String RESULT_INDENT = "      # ";

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void groupOpened(String qualifiedName, boolean skipped) {
        out.println();
        out.println(GROUP_MARKER + qualifiedName + (skipped ? " # SKIP" : ""));
    }

    @Override
    public void testStarted(String groupName, String testName) {
        out.println(TEST_MARKER + groupName + TEST_SEPARATOR + testName);
    }

    @Override
    public void testSkipped(String groupName, String testName) {
        testStarted(groupName, testName);
        out.println(RESULT_INDENT + "SKIP (0ms)");
    }

    @Override
    public void testFinished(String groupName, String testName, TestStatus status, long durationMs) {
        out.println(RESULT_INDENT + (status == TestStatus.PASS ? "PASS" : "FAIL") + " (" + durationMs + "ms)");
    }

    @Override
    public void groupClosed(GroupSummary summary) {
        var totals = summary.getTotals();
        if (summary.isRoot()) {
            out.println();
            out.println("!!!! " + summary.getName() + " # DONE :: " + totals + " !!!!");
            out.println();
        } else {
            out.println("==== " + summary.getParentName().get() + TestRunner.GROUP_SEPARATOR + summary.getName() +
                        " # DONE (" + totals.getDurationMs() + "ms)");
        }
    }

    @Override
    public void processConcluded(Totals totals) {
        out.println("--- " + totals + " ---");
        out.println();
    }
}
