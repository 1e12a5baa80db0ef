package com.caseflow.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.RawPayload;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.TrackResponse;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventSerializer")
class EventSerializerTest {

    private static final Instant AT = Instant.parse("2025-03-01T10:15:30.123Z");

    @Test
    @DisplayName("writes the type as its canonical string and the role as its value")
    void writesCanonicalStrings() {
        var event =
                new DomainEvent(
                        "e-1", "case-1", CaseEventType.BASIS_RESPONDED, AT, "client-7", ActorRole.CLIENT,
                        new TrackResponse(Decision.APPROVED, "ok", null, null));

        String json = EventSerializer.serialize(event);

        assertThat(json)
                .contains("\"eventType\":\"BasisResponded\"")
                .contains("\"actorRole\":\"BH\"")
                .contains("\"occurredAt\":\"2025-03-01T10:15:30.123Z\"");
    }

    @Test
    @DisplayName("reads the payload into the record declared by the event type")
    void readsTypedPayload() {
        var review =
                new StageReview(
                        List.of(new ItemDecision("m-1", Decision.REJECTED, "no")),
                        Decision.REJECTED, true, null);
        var event =
                new DomainEvent(
                        "e-2", "app-1", ExemptionEventType.ADVISOR_REVIEWED, AT, "adv", ActorRole.ADVISOR,
                        review);

        DomainEvent read = EventSerializer.deserialize(EventSerializer.serialize(event));

        assertThat(read).isEqualTo(event);
        assertThat(read.payloadAs(StageReview.class).itemDecisions()).hasSize(1);
    }

    @Test
    @DisplayName("keeps BigDecimal amounts exact")
    void keepsAmounts() {
        var event =
                new DomainEvent(
                        "e-3", "case-1", CaseEventType.COMPENSATION_RESPONDED, AT, "c", ActorRole.CLIENT,
                        new TrackResponse(Decision.PARTIALLY_APPROVED, null, new BigDecimal("125000.50"), null));

        var read = EventSerializer.deserialize(EventSerializer.serialize(event));

        assertThat(read.payloadAs(TrackResponse.class).approvedAmount())
                .isEqualByComparingTo("125000.50");
    }

    @Test
    @DisplayName("reads an unknown event type with its raw payload")
    void readsUnknownType() {
        String json =
                """
                {"eventId":"e-9","aggregateId":"case-1","eventType":"InvoiceSent",
                 "occurredAt":"2025-03-01T10:15:30Z","actorId":"x","actorRole":"TE",
                 "payload":{"invoice":"F-1"}}
                """;

        DomainEvent read = EventSerializer.deserialize(json);

        assertThat(read.eventType()).isEqualTo(new UnknownEventType("InvoiceSent"));
        assertThat(read.knownType()).isEmpty();
        assertThat(read.payloadAs(RawPayload.class).content().get("invoice").asText()).isEqualTo("F-1");
        assertThat(EventSerializer.serialize(read)).contains("\"invoice\":\"F-1\"");
    }

    @Test
    @DisplayName("malformed JSON fails with EventSerializationException")
    void malformedJson() {
        assertThatThrownBy(() -> EventSerializer.deserialize("{not json"))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
        assertThat(EventSerializer.tryDeserialize("[]")).isEmpty();
    }
}
