package com.caseflow.uow;

/** Thrown when a unit of work is used or finalized after it was already committed or rolled back. */
public class UnitOfWorkStateException extends IllegalStateException {

    public UnitOfWorkStateException(String message) {
        super(message);
    }
}
