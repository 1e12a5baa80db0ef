package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.ApplicationDetails;
import com.caseflow.eventmodel.payload.BasisClaim;
import com.caseflow.eventmodel.payload.CaseCreated;
import com.caseflow.eventmodel.payload.ChangeOrderIssued;
import com.caseflow.eventmodel.payload.CompensationClaim;
import com.caseflow.eventmodel.payload.DeadlineClaim;
import com.caseflow.eventmodel.payload.DeadlineNoticeType;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.ItemDetails;
import com.caseflow.eventmodel.payload.ItemRemoval;
import com.caseflow.eventmodel.payload.StageReturn;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.TrackResponse;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Structural validation of {@link DomainEvent} instances: required envelope fields, a payload of
 * the type the event type declares, and payload fields that must be present or consistent
 * regardless of aggregate state.
 *
 * <p>State-dependent checks (ordering, locking, roles) belong to the business rules, not here.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the envelope and payload of an event, collecting every error found.
     *
     * @param event the event to validate
     * @return an {@link EventValidationResult} with any errors found
     */
    public static EventValidationResult validate(DomainEvent event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.aggregateId())) {
            errors.add("aggregateId must not be null or blank");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.actorId())) {
            errors.add("actorId must not be null or blank");
        }
        if (event.actorRole() == null) {
            errors.add("actorRole must not be null");
        }
        if (event.eventType() == null) {
            errors.add("eventType must not be null");
        } else if (!(event.eventType() instanceof KnownEventType known)) {
            errors.add("eventType '%s' is not a known event type".formatted(event.eventType().value()));
        } else if (event.payload() == null) {
            errors.add("payload must not be null");
        } else if (!known.payloadType().isInstance(event.payload())) {
            errors.add(
                    "payload of %s must be %s but was %s"
                            .formatted(
                                    known.value(),
                                    known.payloadType().getSimpleName(),
                                    event.payload().getClass().getSimpleName()));
        } else {
            validatePayload(event, errors);
        }

        return errors.isEmpty() ? EventValidationResult.ok() : EventValidationResult.fail(errors);
    }

    /**
     * Validates the event and throws if it is not well-formed.
     *
     * @throws InvalidEventException listing every error found
     */
    public static void requireValid(DomainEvent event) {
        EventValidationResult result = validate(event);
        if (!result.valid()) {
            throw new InvalidEventException(result.errors());
        }
    }

    private static void validatePayload(DomainEvent event, List<String> errors) {
        var payload = event.payload();
        if (payload instanceof CaseCreated created) {
            if (isBlank(created.title())) {
                errors.add("title must not be null or blank");
            }
        } else if (payload instanceof BasisClaim basis) {
            if (isBlank(basis.category())) {
                errors.add("category must not be null or blank");
            }
            if (isBlank(basis.description())) {
                errors.add("description must not be null or blank");
            }
        } else if (payload instanceof CompensationClaim compensation) {
            if (compensation.method() == null) {
                errors.add("method must not be null");
            }
            requireNonNegative(compensation.amount(), "amount", true, errors);
        } else if (payload instanceof DeadlineClaim deadline) {
            if (deadline.noticeType() == null) {
                errors.add("noticeType must not be null");
            } else if (deadline.noticeType() == DeadlineNoticeType.SPECIFIED && deadline.days() == null) {
                errors.add("days must be given for a specified deadline claim");
            }
            if (deadline.days() != null && deadline.days() < 0) {
                errors.add("days must be >= 0");
            }
        } else if (payload instanceof TrackResponse response) {
            if (response.result() == null) {
                errors.add("result must not be null");
            }
            requireNonNegative(response.approvedAmount(), "approvedAmount", false, errors);
            if (response.approvedDays() != null && response.approvedDays() < 0) {
                errors.add("approvedDays must be >= 0");
            }
        } else if (payload instanceof ChangeOrderIssued order) {
            if (isBlank(order.orderNumber())) {
                errors.add("orderNumber must not be null or blank");
            }
        } else if (payload instanceof ApplicationDetails details) {
            if (isBlank(details.projectId())) {
                errors.add("projectId must not be null or blank");
            }
            if (isBlank(details.applicantName())) {
                errors.add("applicantName must not be null or blank");
            }
            if (details.applicationType() == null) {
                errors.add("applicationType must not be null");
            }
            if (details.urgent() && isBlank(details.urgencyReason())) {
                errors.add("urgencyReason must be given for an urgent application");
            }
        } else if (payload instanceof ItemDetails item) {
            if (isBlank(item.itemId())) {
                errors.add("itemId must not be null or blank");
            }
            if (item.startDate() != null
                    && item.endDate() != null
                    && item.endDate().isBefore(item.startDate())) {
                errors.add("endDate must not be before startDate");
            }
        } else if (payload instanceof ItemRemoval removal) {
            if (isBlank(removal.itemId())) {
                errors.add("itemId must not be null or blank");
            }
        } else if (payload instanceof StageReview review) {
            if (review.recommendation() == null) {
                errors.add("recommendation must not be null");
            }
            validateItemDecisions(review.itemDecisions(), errors);
        } else if (payload instanceof StageReturn stageReturn) {
            if (isBlank(stageReturn.missingDocumentation())) {
                errors.add("missingDocumentation must not be null or blank");
            }
        } else if (payload instanceof FinalDecision decision) {
            if (decision.decision() == null) {
                errors.add("decision must not be null");
            } else if (decision.decision() == Decision.NEEDS_CLARIFICATION) {
                errors.add("a final decision cannot ask for clarification");
            }
            if (!decision.followsWorkingGroup() && isBlank(decision.rationale())) {
                errors.add("rationale must be given when not following the working group");
            }
            validateItemDecisions(decision.itemDecisions(), errors);
        }
    }

    private static void validateItemDecisions(List<ItemDecision> decisions, List<String> errors) {
        for (int i = 0; i < decisions.size(); i++) {
            ItemDecision decision = decisions.get(i);
            if (isBlank(decision.itemId())) {
                errors.add("itemDecisions[%d].itemId must not be null or blank".formatted(i));
            }
            if (decision.decision() == null) {
                errors.add("itemDecisions[%d].decision must not be null".formatted(i));
            }
        }
    }

    private static void requireNonNegative(
            BigDecimal value, String field, boolean required, List<String> errors) {
        if (value == null) {
            if (required) {
                errors.add(field + " must not be null");
            }
        } else if (value.signum() < 0) {
            errors.add(field + " must be >= 0");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
