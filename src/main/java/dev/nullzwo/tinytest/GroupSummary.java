package dev.nullzwo.tinytest;

import java.util.Optional;

/**
 * Totals of a group at the moment it was closed.
 */
public final class GroupSummary {
    private final String name;
    private final String parentName;
    private final Totals totals;

    GroupSummary(String name, String parentName, Totals totals) {
        this.name = name;
        this.parentName = parentName;
        this.totals = totals;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the enclosing group, empty for a root group
     */
    public Optional<String> getParentName() {
        return Optional.ofNullable(parentName);
    }

    public boolean isRoot() {
        return parentName == null;
    }

    public Totals getTotals() {
        return totals;
    }

    @Override
    public String toString() {
        return "GroupSummary{" +
               "name='" + name + '\'' +
               ", parentName='" + parentName + '\'' +
               ", totals=" + totals +
               '}';
    }
}
