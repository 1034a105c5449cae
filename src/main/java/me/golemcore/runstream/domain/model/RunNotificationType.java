package me.golemcore.runstream.domain.model;

/**
 * Classification of an upstream run-stream notification.
 */
public enum RunNotificationType {
    RUN_CREATED,
    RUN_STATUS,
    MESSAGE_CREATED,
    MESSAGE_DELTA,
    MESSAGE_COMPLETED,
    REQUIRES_ACTION,
    RUN_TERMINAL,
    ERROR,
    DONE,
    IGNORED
}
