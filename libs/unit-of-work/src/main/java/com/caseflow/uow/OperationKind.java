package com.caseflow.uow;

/** Kinds of operations a unit of work queues or records. */
public enum OperationKind {
    METADATA_CREATE,
    METADATA_UPDATE,
    METADATA_DELETE,
    /** Appended events cannot be removed from an append-only log. */
    EVENT_APPEND
}
