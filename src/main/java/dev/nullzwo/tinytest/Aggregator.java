package dev.nullzwo.tinytest;

/**
 * Folds the totals of a closed group into its parent, or into the run totals when the root group closes.
 */
final class Aggregator {
    private Totals processTotals = Totals.EMPTY;

    /**
     * @param closed the group just popped from {@code stack}
     */
    GroupSummary fold(Group closed, GroupStack stack) {
        if (stack.isEmpty()) {
            processTotals = processTotals.plus(closed.totals);
            return new GroupSummary(closed.name, null, closed.totals);
        }
        var parent = stack.top();
        parent.fold(closed.totals);
        return new GroupSummary(closed.name, parent.name, closed.totals);
    }

    Totals processTotals() {
        return processTotals;
    }
}
