package com.hookline.hooks;

/**
 * One registered hook. Immutable once registered.
 *
 * @param name label used in logs, spans and {@link DispatchReport}s
 * @param eventName wire event name the hook listens to
 * @param actions accepted payload actions
 * @param repositories accepted repository full names
 * @param debug when any debug hook exists for an event, only debug hooks run for it
 * @param handler the callback
 */
public record HookRegistration(
        String name,
        String eventName,
        MatchFilter actions,
        MatchFilter repositories,
        boolean debug,
        WebhookHandler handler) {

    public HookRegistration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName must not be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        if (actions == null) {
            actions = MatchFilter.any();
        }
        if (repositories == null) {
            repositories = MatchFilter.any();
        }
    }
}
