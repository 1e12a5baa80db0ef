package com.caseflow.caseservice.notification;

/**
 * Receives events after they are committed. Called off the command thread; a failing sink never
 * affects the command that produced the event.
 */
public interface NotificationSink {

    void onCommitted(CommittedEvent committed);
}
