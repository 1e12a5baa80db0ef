package com.caseflow.caseservice.domain;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.KnownEventType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Looks up the definition responsible for an aggregate kind. */
public final class AggregateRegistry {

    private final Map<AggregateKind, AggregateDefinition<?>> definitions = new EnumMap<>(AggregateKind.class);

    public AggregateRegistry(List<AggregateDefinition<?>> definitions) {
        for (AggregateDefinition<?> definition : definitions) {
            if (this.definitions.put(definition.kind(), definition) != null) {
                throw new IllegalArgumentException("Duplicate definition for " + definition.kind());
            }
        }
    }

    /** Registry with the change case and exemption definitions. */
    public static AggregateRegistry standard() {
        return new AggregateRegistry(List.of(new CaseAggregate(), new ExemptionAggregate()));
    }

    public AggregateDefinition<?> forKind(AggregateKind kind) {
        AggregateDefinition<?> definition = definitions.get(kind);
        if (definition == null) {
            throw new IllegalArgumentException("No definition for " + kind);
        }
        return definition;
    }

    /** The kind of the aggregate a log belongs to, taken from its first known event. */
    public static Optional<AggregateKind> kindOf(List<DomainEvent> log) {
        return log.stream()
                .map(DomainEvent::knownType)
                .flatMap(Optional::stream)
                .map(KnownEventType::aggregateKind)
                .findFirst();
    }
}
