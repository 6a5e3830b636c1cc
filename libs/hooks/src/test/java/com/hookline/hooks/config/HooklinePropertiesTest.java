package com.hookline.hooks.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HooklineProperties")
class HooklinePropertiesTest {

    @Test
    @DisplayName("applies defaults for missing values")
    void defaults() {
        var props = new HooklineProperties(null, null, null, null, null, null);

        assertThat(props.enabled()).isTrue();
        assertThat(props.serviceName()).isEqualTo(HooklineProperties.DEFAULT_SERVICE_NAME);
        assertThat(props.metricsEnabled()).isTrue();
        assertThat(props.tracingEnabled()).isTrue();
        assertThat(props.descriptorResources()).isEmpty();
        assertThat(props.events()).isEmpty();
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicit() {
        var props = new HooklineProperties(false, "triage-bot", false, false,
                List.of("descriptors/extra.json"), Map.of("custom", "CustomEvent"));

        assertThat(props.enabled()).isFalse();
        assertThat(props.serviceName()).isEqualTo("triage-bot");
        assertThat(props.metricsEnabled()).isFalse();
        assertThat(props.tracingEnabled()).isFalse();
        assertThat(props.descriptorResources()).containsExactly("descriptors/extra.json");
        assertThat(props.events()).containsEntry("custom", "CustomEvent");
    }
}
