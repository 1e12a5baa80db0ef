package com.caseflow.caseservice.command;

import com.caseflow.caseservice.domain.AggregateDefinition;
import com.caseflow.caseservice.domain.AggregateRegistry;
import com.caseflow.caseservice.notification.CommittedEvent;
import com.caseflow.caseservice.notification.NotificationDispatcher;
import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.EventFactory;
import com.caseflow.eventmodel.EventValidationResult;
import com.caseflow.eventmodel.EventValidator;
import com.caseflow.eventmodel.KnownEventType;
import com.caseflow.eventstore.ConcurrencyException;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.EventStream;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.observability.CorrelationContext;
import com.caseflow.observability.CorrelationContextHolder;
import com.caseflow.observability.MetricFactory;
import com.caseflow.projection.AggregateState;
import com.caseflow.rules.BusinessRuleValidator;
import com.caseflow.rules.ValidationResult;
import com.caseflow.uow.UnitOfWork;
import com.caseflow.uow.UnitOfWorkFactory;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts event submissions for cases and exemption applications.
 *
 * <p>A submission is checked in order: payload structure, version, business rules. Only then is
 * the event appended together with the metadata cache update in one unit of work. A lost race at
 * the append is reported as a conflict like a stale version; the service never retries.
 *
 * <p>An event that cannot belong in the log at all, such as a first event that does not create
 * the aggregate, raises {@link com.caseflow.projection.MalformedSequenceException}. Store
 * failures propagate too. Both are counted under the {@code error} outcome.
 */
@Service
public class CaseCommandService {

    private static final Logger log = LoggerFactory.getLogger(CaseCommandService.class);

    static final String COMMANDS_METRIC = "caseflow.commands";
    static final String DURATION_METRIC = "caseflow.commands.duration";
    static final String ERROR_OUTCOME = "error";

    private final EventStore eventStore;
    private final UnitOfWorkFactory unitOfWorkFactory;
    private final AggregateRegistry registry;
    private final NotificationDispatcher dispatcher;
    private final MetricFactory metrics;
    private final Clock clock;

    public CaseCommandService(
            EventStore eventStore,
            UnitOfWorkFactory unitOfWorkFactory,
            AggregateRegistry registry,
            NotificationDispatcher dispatcher,
            MetricFactory metrics,
            Clock clock) {
        this.eventStore = eventStore;
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
    }

    public CommandResult submit(SubmitCommand command) {
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());
        CorrelationContext context = new CorrelationContext(
                correlationId, command.aggregateId(), command.actorId(), UUID.randomUUID().toString());
        return CorrelationContextHolder.callWithContext(context, () -> timed(command));
    }

    private CommandResult timed(SubmitCommand command) {
        Timer.Sample sample = Timer.start(metrics.registry());
        String kind = command.eventType() instanceof KnownEventType known
                ? known.aggregateKind().value()
                : "unknown";
        String type = command.eventType() == null ? null : command.eventType().value();
        String outcome = ERROR_OUTCOME;
        try {
            CommandResult result = handle(command);
            outcome = result.outcome();
            log.info(
                    "Command {} on {} at version {}: {}",
                    type, command.aggregateId(), command.expectedVersion(), outcome);
            return result;
        } catch (RuntimeException e) {
            log.warn(
                    "Command {} on {} at version {} failed: {}",
                    type, command.aggregateId(), command.expectedVersion(), e.toString());
            throw e;
        } finally {
            sample.stop(metrics.timer(DURATION_METRIC, "Command handling time", "aggregate_kind", kind));
            metrics.counter(
                            COMMANDS_METRIC,
                            "Submitted commands by outcome",
                            "outcome", outcome,
                            "aggregate_kind", kind)
                    .increment();
        }
    }

    private CommandResult handle(SubmitCommand command) {
        if (!(command.eventType() instanceof KnownEventType type)) {
            String name = command.eventType() == null ? null : command.eventType().value();
            return new CommandResult.Invalid(List.of("unknown event type: " + name));
        }
        DomainEvent candidate = EventFactory.create(
                command.aggregateId(), type, command.actorId(), command.actorRole(), command.payload(), clock);
        EventValidationResult structure = EventValidator.validate(candidate);
        if (!structure.valid()) {
            return new CommandResult.Invalid(structure.errors());
        }

        EventStream stream = eventStore.get(command.aggregateId());
        if (stream.version() != command.expectedVersion()) {
            return new CommandResult.Conflict(command.expectedVersion(), stream.version());
        }
        AggregateKind kind = AggregateRegistry.kindOf(stream.events()).orElse(type.aggregateKind());
        return decide(registry.forKind(kind), candidate, stream, command.expectedVersion());
    }

    private <S extends AggregateState> CommandResult decide(
            AggregateDefinition<S> definition, DomainEvent candidate, EventStream stream, long expectedVersion) {
        S current = null;
        ValidationResult verdict;
        if (stream.isEmpty()) {
            verdict = BusinessRuleValidator.validateCreation(candidate);
        } else {
            current = definition.projector().computeState(stream.events());
            verdict = definition.validate(candidate, current);
        }
        if (!verdict.allowed()) {
            return new CommandResult.Rejected(verdict.violatedRule(), verdict.message());
        }

        S next = current == null
                ? definition.projector().computeState(List.of(candidate))
                : definition.projector().apply(current, candidate);
        long newVersion;
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            newVersion = uow.events().append(candidate.aggregateId(), candidate, expectedVersion);
            CaseMetadata metadata = definition.describe(next);
            if (!uow.metadata().updateCache(
                    metadata.aggregateId(), metadata.title(), metadata.status(), metadata.lastEventAt())) {
                uow.metadata().create(metadata);
            }
            uow.commit();
        } catch (ConcurrencyException e) {
            log.info("Lost append race on {}: expected {}, found {}",
                    e.aggregateId(), e.expectedVersion(), e.actualVersion());
            return new CommandResult.Conflict(e.expectedVersion(), e.actualVersion());
        }

        dispatcher.dispatch(new CommittedEvent(candidate, newVersion, definition.kind()));
        return new CommandResult.Accepted(newVersion, candidate, next);
    }
}
