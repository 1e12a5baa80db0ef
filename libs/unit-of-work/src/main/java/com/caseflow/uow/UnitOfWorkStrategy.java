package com.caseflow.uow;

/** How a unit of work makes its writes atomic. */
public enum UnitOfWorkStrategy {
    /** Queue writes and flush them on commit. */
    BUFFERED,
    /** Write immediately and undo on rollback. */
    COMPENSATING
}
