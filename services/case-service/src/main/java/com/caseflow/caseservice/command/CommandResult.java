package com.caseflow.caseservice.command;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.projection.AggregateState;
import com.caseflow.rules.Rule;
import java.util.List;

/** Outcome of {@link CaseCommandService#submit(SubmitCommand)}. */
public sealed interface CommandResult {

    /** Short outcome name used as a metric tag. */
    String outcome();

    /**
     * The event was appended.
     *
     * @param newVersion the aggregate's version after the append
     * @param event the appended event
     * @param state the state after the event
     */
    record Accepted(long newVersion, DomainEvent event, AggregateState state) implements CommandResult {
        @Override
        public String outcome() {
            return "accepted";
        }

        public <S extends AggregateState> S stateAs(Class<S> type) {
            return type.cast(state);
        }
    }

    /** A business rule denied the event. */
    record Rejected(Rule rule, String message) implements CommandResult {
        @Override
        public String outcome() {
            return "rejected";
        }
    }

    /** The aggregate moved on since the submitter read it; re-read and retry. */
    record Conflict(long expectedVersion, long actualVersion) implements CommandResult {
        @Override
        public String outcome() {
            return "conflict";
        }
    }

    /** The event is structurally invalid. */
    record Invalid(List<String> errors) implements CommandResult {
        public Invalid {
            errors = List.copyOf(errors);
        }

        @Override
        public String outcome() {
            return "invalid";
        }
    }
}
