package dev.nullzwo.tinytest;

import java.util.List;

/**
 * Receives the events of a {@link TestRunner} in the order the lifecycle operations were called.
 * How the events are presented is up to the implementation.
 */
public interface ExecutionListener {

    default void groupOpened(String qualifiedName, boolean skipped) {
    }

    default void testStarted(String groupName, String testName) {
    }

    default void testSkipped(String groupName, String testName) {
    }

    default void testFinished(String groupName, String testName, TestStatus status, long durationMs) {
    }

    default void groupClosed(GroupSummary summary) {
    }

    default void processConcluded(Totals totals) {
    }

    static ExecutionListener composite(ExecutionListener... listeners) {
        var all = List.of(listeners);
        return new ExecutionListener() {
            @Override
            public void groupOpened(String qualifiedName, boolean skipped) {
                all.forEach(l -> l.groupOpened(qualifiedName, skipped));
            }

            @Override
            public void testStarted(String groupName, String testName) {
                all.forEach(l -> l.testStarted(groupName, testName));
            }

            @Override
            public void testSkipped(String groupName, String testName) {
                all.forEach(l -> l.testSkipped(groupName, testName));
            }

            @Override
            public void testFinished(String groupName, String testName, TestStatus status, long durationMs) {
                all.forEach(l -> l.testFinished(groupName, testName, status, durationMs));
            }

            @Override
            public void groupClosed(GroupSummary summary) {
                all.forEach(l -> l.groupClosed(summary));
            }

            @Override
            public void processConcluded(Totals totals) {
                all.forEach(l -> l.processConcluded(totals));
            }
        };
    }
}
