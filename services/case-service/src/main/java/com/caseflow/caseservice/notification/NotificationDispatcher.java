package com.caseflow.caseservice.notification;

import com.caseflow.observability.CorrelationContextHolder;
import java.util.List;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands committed events to every sink on an executor, carrying the caller's correlation
 * context. Sink failures are logged and dropped.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationSink> sinks;
    private final Executor executor;

    public NotificationDispatcher(List<NotificationSink> sinks, Executor executor) {
        this.sinks = List.copyOf(sinks);
        this.executor = executor;
    }

    public void dispatch(CommittedEvent committed) {
        for (NotificationSink sink : sinks) {
            executor.execute(CorrelationContextHolder.wrap(() -> deliver(sink, committed)));
        }
    }

    private static void deliver(NotificationSink sink, CommittedEvent committed) {
        try {
            sink.onCommitted(committed);
        } catch (RuntimeException e) {
            log.error(
                    "Notification sink {} failed for event {}",
                    sink.getClass().getSimpleName(),
                    committed.event().eventId(),
                    e);
        }
    }
}
