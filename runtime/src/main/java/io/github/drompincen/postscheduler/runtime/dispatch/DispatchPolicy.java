package io.github.drompincen.postscheduler.runtime.dispatch;

/**
 * Whether a send is subject to the per-destination minimum interval.
 * Sends requested interactively for a single moment are {@link #PACED}; recovered and
 * recurring sends are {@link #UNPACED}.
 */
public enum DispatchPolicy {
    PACED,
    UNPACED
}
