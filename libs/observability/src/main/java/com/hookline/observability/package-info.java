/**
 * Logging context, Micrometer metrics and OpenTelemetry spans for webhook dispatch.
 */
package com.hookline.observability;
