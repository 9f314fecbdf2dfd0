package com.vlrnotify.domain.model;

/**
 * What a guild subscription filters on.
 */
public enum SubscriptionKind {
    TEAM,
    EVENT_GROUP
}
