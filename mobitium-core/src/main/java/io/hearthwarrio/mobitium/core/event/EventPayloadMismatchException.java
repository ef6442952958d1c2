package io.hearthwarrio.mobitium.core.event;

/**
 * Thrown when a matching event was found but its payload does not yield an item name.
 */
public class EventPayloadMismatchException extends RuntimeException {

    public enum Reason {
        /** {@code event.data.items} is missing or not an array. */
        NO_ITEMS_ARRAY,
        /** No item contains every pattern property. */
        NO_MATCHING_ITEM,
        /** The matching item has no string {@code name}. */
        ITEM_WITHOUT_NAME
    }

    private final Reason reason;
    private final long sequenceNumber;

    public EventPayloadMismatchException(String message, Reason reason, long sequenceNumber) {
        super(message);
        this.reason = reason;
        this.sequenceNumber = sequenceNumber;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return number of the event whose payload was inspected
     */
    public long getSequenceNumber() {
        return sequenceNumber;
    }
}
