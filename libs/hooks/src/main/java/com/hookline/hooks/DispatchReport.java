package com.hookline.hooks;

import com.hookline.eventmodel.EventEnvelope;

import java.util.List;

/**
 * Outcome of one {@link HookDispatcher#dispatch} call.
 *
 * @param envelope the parsed delivery handed to every hook
 * @param invoked names of the hooks that ran, in order, including failed ones
 * @param failures hooks that threw
 * @param debugOverride true if only debug hooks were considered
 */
public record DispatchReport(
        EventEnvelope envelope, List<String> invoked, List<HandlerFailure> failures, boolean debugOverride) {

    public DispatchReport {
        invoked = List.copyOf(invoked);
        failures = List.copyOf(failures);
    }

    public String eventName() {
        return envelope.eventName();
    }

    /** True if no hook threw. */
    public boolean succeeded() {
        return failures.isEmpty();
    }

    public int invokedCount() {
        return invoked.size();
    }
}
