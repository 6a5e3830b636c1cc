package com.hookline.hooks;

import com.hookline.eventmodel.EventEnvelope;

/**
 * Callback run for a matching webhook delivery.
 *
 * <p>Exceptions thrown here are logged and reported by the dispatcher; they never stop other
 * handlers.
 */
@FunctionalInterface
public interface WebhookHandler {

    void handle(EventEnvelope event) throws Exception;
}
