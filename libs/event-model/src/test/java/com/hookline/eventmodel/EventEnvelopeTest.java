package com.hookline.eventmodel;

import static com.hookline.eventmodel.testing.TestPayloadFactory.DEFAULT_REPOSITORY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hookline.eventmodel.testing.TestPayloadFactory;
import com.hookline.eventmodel.view.Label;
import com.hookline.eventmodel.view.RecordViews;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventEnvelope")
class EventEnvelopeTest {

    private final EventFactory factory = EventFactory.github();

    @Test
    @DisplayName("common fields are exposed as records")
    void commonFields() {
        var envelope = factory.parse("label", TestPayloadFactory.labelEvent("created", DEFAULT_REPOSITORY));

        assertThat(envelope.sender()).hasValueSatisfying(s -> assertThat(s.getString("login")).isEqualTo("octocat"));
        assertThat(envelope.repository()).isPresent();
        assertThat(envelope.organization()).isEmpty();
        assertThat(envelope.enterprise()).isEmpty();
        assertThat(envelope.installation()).isEmpty();
        assertThat(envelope.repositoryFullName()).contains(DEFAULT_REPOSITORY);
    }

    @Test
    @DisplayName("push has no action")
    void noAction() {
        var envelope = factory.parse("push", TestPayloadFactory.pushEvent(DEFAULT_REPOSITORY));

        assertThat(envelope.action()).isEmpty();
    }

    @Test
    @DisplayName("views wrap nested records")
    void views() {
        var envelope = factory.parse("label", TestPayloadFactory.labelEvent("created", DEFAULT_REPOSITORY));

        assertThat(envelope.senderView()).hasValueSatisfying(u -> assertThat(u.login()).isEqualTo("octocat"));
        assertThat(envelope.repositoryView()).hasValueSatisfying(r -> assertThat(r.fullName()).isEqualTo(DEFAULT_REPOSITORY));
        assertThat(envelope.view("label", Label.class)).hasValueSatisfying(l -> assertThat(l.name()).isEqualTo("bug"));
        assertThat(envelope.view("organization", Label.class)).isEmpty();
    }

    @Test
    @DisplayName("three-argument constructor uses default views")
    void defaultViews() {
        var parsed = factory.parse("label", TestPayloadFactory.labelEvent("created", DEFAULT_REPOSITORY));

        var envelope = new EventEnvelope("label", parsed.record(), false);

        assertThat(envelope.views()).isSameAs(RecordViews.defaults());
        assertThat(envelope).isEqualTo(parsed);
    }

    @Test
    @DisplayName("requires a record")
    void requiresRecord() {
        assertThatThrownBy(() -> new EventEnvelope("label", null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
