package dev.nullzwo.tinytest;

/**
 * Monotonic time source used to measure test durations.
 */
@FunctionalInterface
public interface Clock {
    Clock SYSTEM = System::nanoTime;

    long nanoTime();
}
