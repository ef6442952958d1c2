package io.hearthwarrio.mobitium.core.event;

/**
 * Which of several matching events to use.
 */
public enum EventPosition {
    FIRST,
    LAST
}
