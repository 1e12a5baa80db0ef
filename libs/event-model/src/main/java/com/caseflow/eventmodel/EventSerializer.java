package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.EventPayload;
import com.caseflow.eventmodel.payload.RawPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import java.util.Optional;

/**
 * JSON serialization and deserialization for {@link DomainEvent}.
 *
 * <p>The event type is written as its canonical string and drives which payload record the
 * {@code payload} object is read into. A type string this build does not know is read as an
 * {@link UnknownEventType} with a {@link RawPayload}, so logs written by a newer writer still load.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    /**
     * Serializes an event to a JSON string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serialize(DomainEvent event) {
        try {
            return MAPPER.writeValueAsString(toTree(event));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize event: " + event.eventId(), e);
        }
    }

    /**
     * Deserializes a JSON string to an event.
     *
     * @throws EventSerializationException if the JSON is malformed or does not match the payload
     *     type declared by the event type
     */
    public static DomainEvent deserialize(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to deserialize event", e);
        }
    }

    /** Safely deserializes, returning empty on failure. */
    public static Optional<DomainEvent> tryDeserialize(String json) {
        try {
            return Optional.of(deserialize(json));
        } catch (EventSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper (for advanced use). */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    private static ObjectNode toTree(DomainEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("eventId", event.eventId());
        node.put("aggregateId", event.aggregateId());
        node.put("eventType", event.eventType().value());
        node.set("occurredAt", MAPPER.valueToTree(event.occurredAt()));
        node.put("actorId", event.actorId());
        node.put("actorRole", event.actorRole() == null ? null : event.actorRole().value());
        if (event.payload() instanceof RawPayload raw) {
            node.set("payload", raw.content());
        } else {
            node.set("payload", MAPPER.valueToTree(event.payload()));
        }
        return node;
    }

    private static DomainEvent fromTree(JsonNode node) throws JsonProcessingException {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("event JSON must be an object");
        }
        EventType type = EventTypes.resolve(text(node, "eventType"));
        JsonNode payloadNode = node.path("payload");
        EventPayload payload =
                type instanceof KnownEventType known
                        ? MAPPER.treeToValue(payloadNode, known.payloadType())
                        : new RawPayload(payloadNode.deepCopy());
        String role = text(node, "actorRole");
        return new DomainEvent(
                text(node, "eventId"),
                text(node, "aggregateId"),
                type,
                MAPPER.treeToValue(node.get("occurredAt"), Instant.class),
                text(node, "actorId"),
                role == null
                        ? null
                        : ActorRole.fromString(role)
                                .orElseThrow(
                                        () -> new IllegalArgumentException("Unknown actorRole: " + role)),
                payload);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /** Exception thrown when event serialization/deserialization fails. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
