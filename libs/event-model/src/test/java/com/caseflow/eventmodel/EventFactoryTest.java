package com.caseflow.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.caseflow.eventmodel.payload.BasisClaim;
import com.caseflow.eventmodel.payload.CaseClosed;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventFactory")
class EventFactoryTest {

    @Test
    @DisplayName("generates distinct ids and stamps the clock's instant")
    void generatesIdsAndTimestamp() {
        var clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

        var first =
                EventFactory.create(
                        "case-1", CaseEventType.CASE_CLOSED, "c", ActorRole.CLIENT, new CaseClosed("done"), clock);
        var second =
                EventFactory.create(
                        "case-1", CaseEventType.CASE_CLOSED, "c", ActorRole.CLIENT, new CaseClosed("done"), clock);

        assertThat(first.eventId()).isNotEqualTo(second.eventId());
        assertThat(first.occurredAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("createAsAllowedRole uses the role the type allows")
    void usesAllowedRole() {
        var event =
                EventFactory.createAsAllowedRole(
                        "case-1", CaseEventType.BASIS_SUBMITTED, "te-1",
                        new BasisClaim("ENDRING", null, "desc", null, null));

        assertThat(event.actorRole()).isEqualTo(ActorRole.CONTRACTOR);
    }

    @Test
    @DisplayName("payloadAs rejects the wrong payload type")
    void payloadAsRejectsWrongType() {
        var event =
                EventFactory.createAsAllowedRole(
                        "case-1", CaseEventType.CASE_CLOSED, "c", new CaseClosed("x"));

        assertThatThrownBy(() -> event.payloadAs(BasisClaim.class))
                .isInstanceOf(IllegalStateException.class);
    }
}
