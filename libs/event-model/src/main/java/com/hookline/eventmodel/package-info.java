/**
 * GitHub webhook events: the bundled descriptor catalog, the parser that turns deliveries into
 * {@link com.hookline.eventmodel.EventEnvelope}s, and typed views in
 * {@link com.hookline.eventmodel.view}.
 */
package com.hookline.eventmodel;
