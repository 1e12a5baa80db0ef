package com.caseflow.eventmodel.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Opaque payload of an event whose type this build does not know.
 *
 * @param content the payload exactly as read from the log
 */
public record RawPayload(JsonNode content) implements EventPayload {}
