package ai.flowrisk.cfg;

import org.jetbrains.annotations.Nullable;

/**
 * A loop or switch that break (and, for loops, continue) may target. Targets are {@link CfgArena#DEAD} while the
 * construct itself is unreachable.
 */
record BreakableContext(int breakTarget, int continueTarget, boolean acceptsContinue, @Nullable String label) {
    static BreakableContext loop(int breakTarget, int continueTarget, @Nullable String label) {
        return new BreakableContext(breakTarget, continueTarget, true, label);
    }

    static BreakableContext switchContext(int breakTarget, @Nullable String label) {
        return new BreakableContext(breakTarget, CfgArena.DEAD, false, label);
    }
}
