package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.event.EventPosition;
import io.hearthwarrio.mobitium.core.locator.Locator;

import java.util.Objects;

/**
 * What a click is aimed at.
 * <p>
 * Closed set of variants: {@link ElementTarget}, {@link TextTarget} and {@link EventTarget}. Consumers dispatch with
 * {@link #accept(Visitor)}.
 */
public abstract class ClickTarget {

    private ClickTarget() {
    }

    public static ClickTarget element(Locator locator) {
        return new ElementTarget(locator);
    }

    public static ClickTarget text(TextMatch match) {
        return new TextTarget(match);
    }

    public static ClickTarget event(String eventName, String pattern, EventPosition position) {
        return new EventTarget(eventName, pattern, position);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitElement(ElementTarget target);

        R visitText(TextTarget target);

        R visitEvent(EventTarget target);
    }

    public static final class ElementTarget extends ClickTarget {
        private final Locator locator;

        private ElementTarget(Locator locator) {
            this.locator = Objects.requireNonNull(locator, "locator must not be null");
        }

        public Locator getLocator() {
            return locator;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitElement(this);
        }

        @Override
        public String toString() {
            return locator.toString();
        }
    }

    public static final class TextTarget extends ClickTarget {
        private final TextMatch match;

        private TextTarget(TextMatch match) {
            this.match = Objects.requireNonNull(match, "match must not be null");
        }

        public TextMatch getMatch() {
            return match;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }

        @Override
        public String toString() {
            return match.toString();
        }
    }

    /**
     * Item of a telemetry event: the element is found by the {@code name} of the first matching entry in the event's
     * {@code event.data.items}.
     */
    public static final class EventTarget extends ClickTarget {
        private final String eventName;
        private final String pattern;
        private final EventPosition position;

        private EventTarget(String eventName, String pattern, EventPosition position) {
            this.eventName = Objects.requireNonNull(eventName, "eventName must not be null");
            this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
            this.position = position == null ? EventPosition.FIRST : position;
        }

        public String getEventName() {
            return eventName;
        }

        public String getPattern() {
            return pattern;
        }

        public EventPosition getPosition() {
            return position;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEvent(this);
        }

        @Override
        public String toString() {
            return "item of event '" + eventName + "' matching " + pattern + " (" + position + ")";
        }
    }
}
