package com.caseflow.caseservice.query;

import com.caseflow.caseservice.domain.AggregateDefinition;
import com.caseflow.caseservice.domain.AggregateRegistry;
import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.ExemptionEventType;
import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.TrackResponse;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.EventStream;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import com.caseflow.projection.AggregateState;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Read side: logs, projected states, timelines and listings. Never writes to the log. */
@Service
public class CaseQueryService {

    private static final Logger log = LoggerFactory.getLogger(CaseQueryService.class);

    private final EventStore eventStore;
    private final CaseMetadataRepository metadataRepository;
    private final AggregateRegistry registry;

    public CaseQueryService(
            EventStore eventStore, CaseMetadataRepository metadataRepository, AggregateRegistry registry) {
        this.eventStore = eventStore;
        this.metadataRepository = metadataRepository;
        this.registry = registry;
    }

    public EventStream events(String aggregateId) {
        return eventStore.get(aggregateId);
    }

    /** Current state, empty for an aggregate without events. */
    public Optional<AggregateState> state(String aggregateId) {
        EventStream stream = eventStore.get(aggregateId);
        if (stream.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(project(stream.events()));
    }

    /** Current state as the expected type, empty if absent or of another kind. */
    public <S extends AggregateState> Optional<S> state(String aggregateId, Class<S> type) {
        return state(aggregateId).filter(type::isInstance).map(type::cast);
    }

    public List<TimelineEntry> timeline(String aggregateId) {
        List<DomainEvent> events = eventStore.get(aggregateId).events();
        List<TimelineEntry> entries = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            DomainEvent event = events.get(i);
            Track track = event.eventType() instanceof CaseEventType type ? type.track().orElse(null) : null;
            entries.add(new TimelineEntry(
                    i + 1,
                    event.eventId(),
                    event.occurredAt(),
                    event.eventType().value(),
                    event.actorId(),
                    event.actorRole(),
                    track,
                    summarize(event)));
        }
        return entries;
    }

    /** Cached metadata of every aggregate, newest first. */
    public List<CaseMetadata> list() {
        return metadataRepository.listAll();
    }

    public List<CaseMetadata> listByProject(String projectId) {
        return metadataRepository.listByProject(projectId);
    }

    /**
     * Recomputes an aggregate's metadata from its log and stores it.
     *
     * @return the rebuilt metadata, empty if the aggregate has no events
     */
    public Optional<CaseMetadata> rebuildMetadata(String aggregateId) {
        EventStream stream = eventStore.get(aggregateId);
        if (stream.isEmpty()) {
            return Optional.empty();
        }
        CaseMetadata metadata = describe(stream.events());
        metadataRepository.save(metadata);
        log.info("Rebuilt metadata of {} at version {}", aggregateId, stream.version());
        return Optional.of(metadata);
    }

    /** Rebuilds the metadata of every aggregate in the store; returns how many were rebuilt. */
    public int rebuildAllMetadata() {
        int rebuilt = 0;
        for (String aggregateId : eventStore.aggregateIds()) {
            if (rebuildMetadata(aggregateId).isPresent()) {
                rebuilt++;
            }
        }
        return rebuilt;
    }

    private AggregateState project(List<DomainEvent> events) {
        return definitionFor(events).projector().computeState(events);
    }

    private CaseMetadata describe(List<DomainEvent> events) {
        return describe(definitionFor(events), events);
    }

    private static <S extends AggregateState> CaseMetadata describe(
            AggregateDefinition<S> definition, List<DomainEvent> events) {
        return definition.describe(definition.projector().computeState(events));
    }

    private AggregateDefinition<?> definitionFor(List<DomainEvent> events) {
        return registry.forKind(AggregateRegistry.kindOf(events)
                .orElseThrow(() -> new IllegalStateException(
                        "Log of " + events.get(0).aggregateId() + " has no known event types")));
    }

    private static String summarize(DomainEvent event) {
        if (event.eventType() instanceof CaseEventType type) {
            return switch (type.kind()) {
                case CREATION -> "Case created";
                case SUBMISSION -> "Claim submitted";
                case UPDATE -> "Claim updated";
                case WITHDRAWAL -> "Claim withdrawn";
                case RESPONSE -> "Response: " + decisionName(event.payloadAs(TrackResponse.class).result());
                case CHANGE_ORDER -> "Change order issued";
                case CLOSURE -> "Case closed";
            };
        }
        if (event.eventType() instanceof ExemptionEventType type) {
            return switch (type.kind()) {
                case CREATION -> "Application created";
                case EDIT -> "Application updated";
                case ITEM_EDIT -> "Items changed";
                case SUBMISSION -> "Application submitted";
                case WITHDRAWAL -> "Application withdrawn";
                case REVIEW -> type == ExemptionEventType.OWNER_DECIDED
                        ? "Decision: " + decisionName(event.payloadAs(FinalDecision.class).decision())
                        : "Reviewed: " + decisionName(event.payloadAs(StageReview.class).recommendation());
                case RETURN -> "Returned for more documentation";
            };
        }
        return "Unrecognized event " + event.eventType().value();
    }

    private static String decisionName(Decision decision) {
        return decision == null ? "none" : decision.name().toLowerCase().replace('_', ' ');
    }
}
