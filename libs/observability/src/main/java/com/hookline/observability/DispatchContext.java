package com.hookline.observability;

/**
 * Identifies the webhook delivery being dispatched on the current thread.
 *
 * <p>Every field except {@code eventName} is optional: {@code push} has no action, an unknown event
 * may carry no repository, and callers outside an HTTP request have no delivery id. The event name
 * is taken as received, so a missing {@code X-GitHub-Event} header shows up as an empty name.
 *
 * @param eventName wire event name (e.g. "pull_request"), never null
 * @param action payload action, or null
 * @param repository repository full name, or null
 * @param deliveryId the {@code X-GitHub-Delivery} id, or null
 */
public record DispatchContext(String eventName, String action, String repository, String deliveryId) {

    /** MDC key for the event name. */
    public static final String MDC_EVENT_NAME = "eventName";

    /** MDC key for the payload action. */
    public static final String MDC_EVENT_ACTION = "eventAction";

    /** MDC key for the repository full name. */
    public static final String MDC_REPOSITORY = "repository";

    /** MDC key for the delivery id. */
    public static final String MDC_DELIVERY_ID = "deliveryId";

    public DispatchContext {
        if (eventName == null) {
            throw new IllegalArgumentException("eventName must not be null");
        }
    }

    public static DispatchContext of(String eventName) {
        return new DispatchContext(eventName, null, null, null);
    }

    public DispatchContext withDeliveryId(String id) {
        return new DispatchContext(eventName, action, repository, id);
    }
}
