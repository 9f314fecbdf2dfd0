package com.vlrnotify.domain.model;

/**
 * Kind of a tracked event.
 */
public enum EventKind {
    /** Upcoming or live match with a scheduled start. */
    MATCH,
    /** Completed match with a final score. */
    RESULT
}
