package dev.nullzwo.tinytest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the cleanup hooks for a finished test, innermost group first, the run-wide hook last.
 * <p>
 * A hook registered as "only for this group" is left out when the test ran in one of the group's nested groups.
 */
final class CleanupChain {
    private static final Logger LOG = LoggerFactory.getLogger(CleanupChain.class);

    private CleanupChain() {
    }

    static void run(GroupStack stack, CleanupHook rootHook, TestSnapshot test) {
        for (int depth = 0; depth < stack.size(); depth++) {
            var group = stack.fromTop(depth);
            if (group.cleanup != null && !(depth != 0 && group.cleanupOnlyForThis)) {
                invoke(group.cleanup, test, group.name);
            }
        }
        if (rootHook != null) {
            invoke(rootHook, test, "<root>");
        }
    }

    private static void invoke(CleanupHook hook, TestSnapshot test, String owner) {
        try {
            hook.cleanUp(test);
        } catch (RuntimeException ex) {
            // hooks are observers, the test result stands
            LOG.warn("cleanup hook of {} failed after test '{}'", owner, test.getName(), ex);
        }
    }
}
