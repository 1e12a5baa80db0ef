package com.caseflow.eventstore.metadata;

/** Thrown when metadata is created for an aggregate that already has it. */
public class MetadataExistsException extends RuntimeException {

    private final String aggregateId;

    public MetadataExistsException(String aggregateId) {
        super("Metadata already exists for " + aggregateId);
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
