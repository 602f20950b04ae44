package dev.nullzwo.tinytest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Drives a run of nested groups and tests.
 * <p>
 * A run goes through {@link #init()}, any number of groups ({@link #openGroup(String, boolean)} /
 * {@link #closeGroup()}) with tests inside them ({@link #openTest(String, boolean, boolean)}, {@link #check(boolean)},
 * {@link #closeTest()}) and ends with {@link #conclude()}. Groups nest up to {@link #MAX_DEPTH} levels, only one test
 * can be open at a time and it always belongs to the innermost group.
 * <p>
 * Calling the operations out of order is a bug in the calling code and is answered with a {@link UsageError}; a
 * failing assertion on the other hand is just a failed test. Instances are not thread safe.
 */
public class TestRunner {
    public static final int MAX_DEPTH = 4;

    static final String GROUP_SEPARATOR = " :: ";

    private static final Logger LOG = LoggerFactory.getLogger(TestRunner.class);

    private final ExecutionListener listener;
    private final Clock clock;
    private final TestContext openTestContext = new OpenTestContext();

    private boolean initialized;
    private boolean concluded;
    private GroupStack stack;
    private final Aggregator aggregator = new Aggregator();
    private CleanupHook rootCleanup;

    public TestRunner() {
        this(new ConsoleReporter(System.out), Clock.SYSTEM);
    }

    public TestRunner(ExecutionListener listener) {
        this(listener, Clock.SYSTEM);
    }

    public TestRunner(ExecutionListener listener, Clock clock) {
        this.listener = listener;
        this.clock = clock;
    }

    public void init() {
        if (initialized) {
            throw usageError("Don't call init() twice");
        }
        initialized = true;
        stack = new GroupStack(MAX_DEPTH);
        LOG.debug("initialized with a maximum group depth of {}", MAX_DEPTH);
    }

    /**
     * Registers a hook which is called after every test of the current group and its nested groups, or of the whole
     * run when no group is open.
     *
     * @param onlyForThis do not call the hook for tests of nested groups; ignored for the run-wide hook
     */
    public void cleanUp(CleanupHook hook, boolean onlyForThis) {
        requireRunning();
        if (stack.isEmpty()) {
            rootCleanup = hook;
            return;
        }
        if (stack.hasOpenTest()) {
            throw usageError("Don't call cleanUp() while a test is running");
        }
        stack.top().register(hook, onlyForThis);
    }

    public void cleanUp(CleanupHook hook) {
        cleanUp(hook, false);
    }

    public void openGroup(String name, boolean skip) {
        requireRunning();
        if (stack.isFull()) {
            throw usageError("The group exceeds the allowed depth, the maximum depth is " + MAX_DEPTH);
        }
        if (stack.hasOpenTest()) {
            throw usageError("There is still a test running, unable to open group '" + name + "'");
        }

        var qualifiedName = stack.isEmpty() ? name : stack.top().name + GROUP_SEPARATOR + name;
        if (skip) {
            LOG.debug("skipping group '{}'", qualifiedName);
            listener.groupOpened(qualifiedName, true);
            return;
        }

        stack.push(name);
        LOG.debug("opened group '{}' at depth {}", qualifiedName, stack.size());
        listener.groupOpened(qualifiedName, false);
    }

    public void closeGroup() {
        requireRunning();
        if (stack.isEmpty()) {
            throw usageError("No group is open");
        }
        if (stack.hasOpenTest()) {
            throw usageError("There is still a test running, unable to close group '" + stack.top().name + "'");
        }

        var closed = stack.pop();
        var summary = aggregator.fold(closed, stack);
        LOG.debug("closed group '{}': {}", summary.getName(), summary.getTotals());
        listener.groupClosed(summary);
    }

    public void openTest(String name, boolean invertOutcome, boolean skip) {
        requireRunning();
        if (stack.isEmpty()) {
            throw usageError("No group is open, a test needs a group");
        }
        var group = stack.top();
        if (group.test.isOpen()) {
            throw usageError("There is a test running, can only run 1 test at a time");
        }

        if (skip) {
            group.countSkip();
            listener.testSkipped(group.name, name);
            return;
        }

        group.test.start(name, invertOutcome, clock.nanoTime());
        listener.testStarted(group.name, name);
    }

    /**
     * Records an assertion for the open test.
     *
     * @return {@code expr}, unchanged
     */
    public boolean check(boolean expr) {
        return AssertionEngine.check(requireOpenTest(), expr);
    }

    public void closeTest() {
        var test = requireOpenTest();
        var group = stack.top();

        var durationMs = TimeUnit.NANOSECONDS.toMillis(clock.nanoTime() - test.startNanos);
        var status = test.status;
        CleanupChain.run(stack, rootCleanup, test.snapshot(durationMs));

        test.reset();
        if (status == TestStatus.PASS) {
            group.countPass(durationMs);
        } else {
            group.countFail(durationMs);
        }
        listener.testFinished(group.name, test.name, status, durationMs);
    }

    /**
     * Ends the run.
     *
     * @return 1 when at least one test failed, 0 otherwise
     */
    public int conclude() {
        if (!initialized) {
            throw usageError("Run init() first");
        }
        if (concluded) {
            throw usageError("Don't call conclude() twice");
        }
        if (!stack.isEmpty()) {
            throw usageError("There is still a group open, call conclude() only when all groups have finished");
        }

        var totals = aggregator.processTotals();
        LOG.debug("concluded: {}", totals);
        listener.processConcluded(totals);
        concluded = true;
        stack = null;
        return totals.getFail() > 0 ? 1 : 0;
    }

    public Totals totals() {
        return aggregator.processTotals();
    }

    public boolean isConcluded() {
        return concluded;
    }

    public int depth() {
        return stack == null ? 0 : stack.size();
    }

    /**
     * Runs {@code body} as a test of the current group. The value it returns counts as a last assertion, unless the
     * test is expected to fail; there a {@code false} return alone does not fail the test.
     */
    public void test(String name, boolean invertOutcome, boolean skip, TestBody body) {
        openTest(name, invertOutcome, skip);
        if (skip) {
            return;
        }
        try {
            var result = body.run(openTestContext);
            check(result || invertOutcome);
        } catch (RuntimeException | AssertionError ex) {
            LOG.warn("test '{}' threw {}", name, ex.toString(), ex);
            // fails the test, inverted or not
            check(invertOutcome);
        }
        closeTest();
    }

    public void it(String name, TestBody body) {
        test(name, false, false, body);
    }

    public void itFail(String name, TestBody body) {
        test(name, true, false, body);
    }

    public void itSkip(String name) {
        test(name, false, true, t -> true);
    }

    public void describe(String name, Runnable block) {
        openGroup(name, false);
        block.run();
        closeGroup();
    }

    public void describeSkip(String name) {
        openGroup(name, true);
    }

    private void requireRunning() {
        if (!initialized) {
            throw usageError("Run init() first");
        }
        if (concluded) {
            throw usageError("The run is already concluded");
        }
    }

    private TestCase requireOpenTest() {
        requireRunning();
        if (stack.isEmpty()) {
            throw usageError("No group is open");
        }
        var test = stack.top().test;
        if (!test.isOpen()) {
            throw usageError("No test is running");
        }
        return test;
    }

    private static UsageError usageError(String message) {
        LOG.error(message);
        return new UsageError(message);
    }

    private class OpenTestContext implements TestContext {
        @Override
        public String getName() {
            return requireOpenTest().name;
        }

        @Override
        public boolean isInvertOutcome() {
            return requireOpenTest().invertOutcome;
        }

        @Override
        public boolean check(boolean expr) {
            return TestRunner.this.check(expr);
        }
    }
}
