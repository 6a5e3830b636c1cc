/**
 * Hook registration and dispatch.
 *
 * <p>Applications register {@link com.hookline.hooks.WebhookHandler}s against an event name,
 * optionally narrowed by action and repository, usually from a {@link com.hookline.hooks.HookModule}.
 * {@link com.hookline.hooks.HookDispatcher} parses each incoming payload and runs the matching
 * handlers in registration order. A failing handler is logged and does not stop the others.
 * {@link com.hookline.hooks.Hookline} bundles the pieces for callers that do not use Spring.
 */
package com.hookline.hooks;
