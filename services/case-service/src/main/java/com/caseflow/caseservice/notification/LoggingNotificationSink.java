package com.caseflow.caseservice.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes one log line per committed event. */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void onCommitted(CommittedEvent committed) {
        log.info(
                "{} {} appended to {} {} at version {}",
                committed.event().eventType().value(),
                committed.event().eventId(),
                committed.aggregateKind().value(),
                committed.event().aggregateId(),
                committed.version());
    }
}
