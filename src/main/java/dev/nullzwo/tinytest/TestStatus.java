package dev.nullzwo.tinytest;

public enum TestStatus {
    /** no test is open */
    NONE,
    PASS,
    FAIL,
    /** only counted on the group, a skipped test is never opened */
    SKIP
}
