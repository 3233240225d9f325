package com.example.mediahooks.model;

/**
 * How a webhook gets fired.
 */
public enum TriggerType {
    /** Fired by a named domain event published on the event bus. */
    EVENT,
    /** Fired by an external caller using the webhook id. */
    SCHEDULED
}
