package org.contagio.runtime;

/**
 * Terminal states of a {@link Trial}.
 */
public enum TrialOutcome {
    FIXATED_ADAPTIVE,
    FIXATED_LEGACY,
    TIMED_OUT,
    /** The caller's stopping predicate fired. */
    STOPPED,
    /** A strategy, payoff or invariant error aborted the trial. */
    FAILED;

    public boolean isFixation() {
        return this == FIXATED_ADAPTIVE || this == FIXATED_LEGACY;
    }
}
