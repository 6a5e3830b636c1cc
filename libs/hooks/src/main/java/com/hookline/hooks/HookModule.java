package com.hookline.hooks;

/**
 * A bundle of hooks installed together, the unit {@link HookRegistry#install} tracks.
 *
 * <pre>{@code
 * public class TriageHooks implements HookModule {
 *     public void register(HookRegistry registry) {
 *         registry.on(EventType.ISSUES).actions(EventAction.OPENED).handle(this::label);
 *     }
 * }
 * }</pre>
 */
public interface HookModule {

    void register(HookRegistry registry);

    /** Identity used to install a module at most once per registry epoch. */
    default String moduleName() {
        return getClass().getName();
    }
}
