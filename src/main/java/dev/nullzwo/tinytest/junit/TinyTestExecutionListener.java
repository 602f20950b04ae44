package dev.nullzwo.tinytest.junit;

import dev.nullzwo.tinytest.TestRunner;
import dev.nullzwo.tinytest.UsageError;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static org.junit.platform.engine.TestExecutionResult.Status.SUCCESSFUL;

/**
 * Replays a JUnit Platform run on a {@link TestRunner}: containers become groups, tests become tests.
 * <p>
 * The engine roots themselves are not tracked, so a test class is a root group and every {@code @Nested} class one
 * level deeper; plans nesting deeper than {@link TestRunner#MAX_DEPTH} are rejected by the runner. Only a successful
 * execution counts as a pass, aborted tests (failed assumptions) count as failures because they already started.
 * The listener needs sequential execution.
 * <p>
 * The launcher only logs exceptions thrown by listeners, so the first {@link UsageError} ends the replay: it is kept,
 * every later event is ignored, the run is not concluded and {@link #getExitCode()} rethrows it.
 */
public class TinyTestExecutionListener implements TestExecutionListener {
    private static final Logger LOG = LoggerFactory.getLogger(TinyTestExecutionListener.class);

    private final TestRunner runner;
    private int exitCode = -1;
    private UsageError failure;

    public TinyTestExecutionListener() {
        this(new TestRunner());
    }

    public TinyTestExecutionListener(TestRunner runner) {
        this.runner = runner;
    }

    @Override
    public void testPlanExecutionStarted(TestPlan testPlan) {
        replay(runner::init);
    }

    @Override
    public void testPlanExecutionFinished(TestPlan testPlan) {
        if (failure != null) {
            throw failure;
        }
        replay(() -> exitCode = runner.conclude());
    }

    @Override
    public void executionStarted(TestIdentifier testIdentifier) {
        if (isEngine(testIdentifier)) {
            return;
        }
        replay(() -> {
            if (testIdentifier.isContainer()) {
                runner.openGroup(toDisplayName(testIdentifier), false);
            } else {
                runner.openTest(toDisplayName(testIdentifier), false, false);
            }
        });
    }

    @Override
    public void executionSkipped(TestIdentifier testIdentifier, String reason) {
        if (isEngine(testIdentifier)) {
            return;
        }
        LOG.debug("'{}' skipped: {}", testIdentifier.getDisplayName(), reason);
        replay(() -> {
            if (testIdentifier.isContainer()) {
                runner.openGroup(toDisplayName(testIdentifier), true);
            } else {
                runner.openTest(toDisplayName(testIdentifier), false, true);
            }
        });
    }

    @Override
    public void executionFinished(TestIdentifier testIdentifier, TestExecutionResult testExecutionResult) {
        if (isEngine(testIdentifier)) {
            return;
        }
        replay(() -> {
            if (testIdentifier.isContainer()) {
                if (testExecutionResult.getStatus() != SUCCESSFUL) {
                    LOG.warn("container '{}' finished with {}", testIdentifier.getDisplayName(),
                             testExecutionResult.getStatus(), testExecutionResult.getThrowable().orElse(null));
                }
                runner.closeGroup();
            } else {
                runner.check(testExecutionResult.getStatus() == SUCCESSFUL);
                runner.closeTest();
            }
        });
    }

    /**
     * @return the value {@link TestRunner#conclude()} returned, -1 while the plan has not finished
     * @throws UsageError the error which ended the replay, if any
     */
    public int getExitCode() {
        if (failure != null) {
            throw failure;
        }
        return exitCode;
    }

    public Optional<UsageError> getFailure() {
        return Optional.ofNullable(failure);
    }

    private void replay(Runnable step) {
        if (failure != null) {
            return;
        }
        try {
            step.run();
        } catch (UsageError ex) {
            failure = ex;
            throw ex;
        }
    }

    public TestRunner getRunner() {
        return runner;
    }

    private static boolean isEngine(TestIdentifier testIdentifier) {
        return testIdentifier.getParentId().isEmpty();
    }

    /**
     * Turns method names without display name, like {@code addsTwoNumbers()}, into {@code adds two numbers}.
     */
    static String toDisplayName(TestIdentifier tid) {
        var disp = tid.getDisplayName();
        if (!disp.endsWith("()")) {
            return disp;
        }

        var b = new StringBuilder();
        for (char c : disp.toCharArray()) {
            if ('A' <= c && c <= 'Z') {
                b.append(' ').append(Character.toLowerCase(c));
            } else if (Character.isLetterOrDigit(c)) {
                b.append(c);
            }
        }
        return b.toString();
    }
}
