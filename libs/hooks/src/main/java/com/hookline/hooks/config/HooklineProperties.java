package com.hookline.hooks.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code hookline.*} prefix.
 *
 * <pre>
 * hookline:
 *   enabled: true
 *   service-name: triage-bot
 *   metrics-enabled: true
 *   tracing-enabled: false
 *   descriptor-resources:
 *     - descriptors/enterprise-events.json
 *   events:
 *     deployment_review: DeploymentReviewEvent
 * </pre>
 *
 * @param enabled whether the auto-configuration contributes any beans (default true)
 * @param serviceName value of the {@code service} tag on dispatch metrics
 * @param metricsEnabled record dispatch metrics when a MeterRegistry bean exists (default true)
 * @param tracingEnabled trace handlers when an OpenTelemetry bean exists (default true)
 * @param descriptorResources extra classpath descriptor documents loaded alongside the bundled ones
 * @param events extra event names mapped to descriptor names, added to the event table
 */
@ConfigurationProperties(prefix = "hookline")
@Validated
public record HooklineProperties(
        Boolean enabled,
        @NotBlank String serviceName,
        Boolean metricsEnabled,
        Boolean tracingEnabled,
        List<String> descriptorResources,
        Map<String, String> events) {

    public static final String DEFAULT_SERVICE_NAME = "hookline";

    /** Defaults apply before Bean Validation runs, so only an explicitly blank name is rejected. */
    public HooklineProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (serviceName == null) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        if (metricsEnabled == null) {
            metricsEnabled = true;
        }
        if (tracingEnabled == null) {
            tracingEnabled = true;
        }
        descriptorResources = descriptorResources == null ? List.of() : List.copyOf(descriptorResources);
        events = events == null ? Map.of() : Map.copyOf(events);
    }
}
