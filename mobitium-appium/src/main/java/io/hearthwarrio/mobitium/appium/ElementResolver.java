package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.ActionOptions;
import io.hearthwarrio.mobitium.core.ElementNotFoundException;
import io.hearthwarrio.mobitium.core.Polling;
import io.hearthwarrio.mobitium.core.gesture.SwipeGeometry;
import io.hearthwarrio.mobitium.core.locator.Locator;
import io.hearthwarrio.mobitium.core.locator.Platform;
import io.hearthwarrio.mobitium.core.locator.Query;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns a {@link Locator} into one visible on-device element.
 * <p>
 * Per call:
 * <ol>
 *   <li>validate options (capacity, ordinal) before any device call</li>
 *   <li>optionally wait for the UI to settle ({@link ActionOptions#getPreDelay()})</li>
 *   <li>try every alternative of the active platform in declaration order; each is polled until it returns
 *       something or the search timeout elapses</li>
 *   <li>pick the requested ordinal; it must exist and be displayed</li>
 *   <li>if every alternative failed and the scroll budget allows, scroll once and go back to step 3</li>
 * </ol>
 * Transient protocol errors are retried within the search timeout and end up as the cause of the final
 * {@link ElementNotFoundException}.
 */
public final class ElementResolver {

    private final DeviceSession session;
    private final Platform platform;
    private final Polling polling;
    private final GesturePerformer gestures;
    private final UiStabilityWaiter uiStability;

    private ResolvedElementLogger logger;

    public ElementResolver(DeviceSession session, Platform platform, Polling polling, GesturePerformer gestures,
                           ResolvedElementLogger logger) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.polling = Objects.requireNonNull(polling, "polling must not be null");
        this.gestures = Objects.requireNonNull(gestures, "gestures must not be null");
        this.uiStability = new UiStabilityWaiter(session, polling);
        this.logger = logger;
    }

    public Platform getPlatform() {
        return platform;
    }

    public ElementResolver withLogger(ResolvedElementLogger logger) {
        this.logger = logger;
        return this;
    }

    public ResolvedElementLogger getLogger() {
        return logger;
    }

    public UiStabilityWaiter getUiStability() {
        return uiStability;
    }

    public DeviceElement resolve(Locator locator, ActionOptions options) {
        return resolve(locator, options, String.valueOf(locator));
    }

    /**
     * Resolves the locator.
     *
     * @param target description used in logs
     * @throws io.hearthwarrio.mobitium.core.MisconfigurationException if the options are invalid
     * @throws ElementNotFoundException if no alternative produced a visible element
     */
    public DeviceElement resolve(Locator locator, ActionOptions options, String target) {
        Objects.requireNonNull(locator, "locator must not be null");
        Objects.requireNonNull(options, "options must not be null");
        SwipeGeometry.requireValidCapacity(options.getScrollCapacity());

        List<Query> alternatives = locator.getAll(platform);
        if (alternatives == null || alternatives.isEmpty()) {
            throw new ElementNotFoundException(
                    "Elements not found: no locators for platform " + platform + " in " + locator,
                    Collections.emptyList(), Collections.emptyList(), 0, options.getSearchTimeout(), null);
        }

        uiStability.await(options.getPreDelay(), options.getPollInterval());

        int ordinal = options.effectiveOrdinal();
        List<Query> attempted = new ArrayList<>();
        List<Query> failed = new ArrayList<>();
        SearchState state = new SearchState();
        int scrolls = 0;

        while (true) {
            for (Query query : alternatives) {
                attempted.add(query);
                Optional<DeviceElement> element = tryQuery(query, ordinal, options, state);
                if (element.isPresent()) {
                    log(target, query, ordinal, scrolls, failed);
                    return element.get();
                }
                failed.add(query);
            }

            if (scrolls < options.getScrollCount()) {
                gestures.scroll(1, options.getScrollCapacity(), options.getScrollDirection());
                scrolls++;
            } else {
                throw new ElementNotFoundException(
                        describeFailure(options.getSearchTimeout(), scrolls, attempted, failed, state.reason),
                        attempted, failed, scrolls, options.getSearchTimeout(), state.cause);
            }
        }
    }

    private Optional<DeviceElement> tryQuery(Query query, int ordinal, ActionOptions options, SearchState state) {
        List<DeviceElement> found = findAll(query, options.getSearchTimeout(), options.getPollInterval(), state);
        if (found.isEmpty()) {
            if (state.reason == null) {
                state.reason = "no elements found by " + query;
            }
            return Optional.empty();
        }
        if (ordinal > found.size()) {
            state.reason = "Element " + ordinal + " out of range (found: " + found.size() + ")";
            return Optional.empty();
        }

        DeviceElement element = found.get(ordinal - 1);
        try {
            if (element.isDisplayed()) {
                return Optional.of(element);
            }
            state.reason = "Element found but not displayed";
        } catch (WebDriverException e) {
            state.record(e);
        }
        return Optional.empty();
    }

    private List<DeviceElement> findAll(Query query, Duration timeout, Duration pollInterval, SearchState state) {
        state.reason = null;
        state.cause = null;
        return polling.until(timeout, pollInterval, () -> {
            try {
                List<DeviceElement> found = session.findElements(query);
                if (found != null && !found.isEmpty()) {
                    return Optional.of(found);
                }
            } catch (WebDriverException e) {
                state.record(e);
            }
            return Optional.<List<DeviceElement>>empty();
        }).orElse(Collections.emptyList());
    }

    private void log(String target, Query query, int ordinal, int scrolls, List<Query> failed) {
        ResolvedElementLogger l = logger;
        if (l != null) {
            l.logResolvedElement(target, query, ordinal, scrolls, Collections.unmodifiableList(new ArrayList<>(failed)));
        }
    }

    private static String describeFailure(Duration timeout, int scrolls, List<Query> attempted, List<Query> failed,
                                          String reason) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Elements not found within ").append(timeout.toMillis()).append(" ms after ")
                .append(scrolls).append(" scrolls. ");
        if (!failed.isEmpty()) {
            sb.append("Failed locators: ").append(join(failed)).append(" of ").append(join(attempted));
        } else {
            sb.append("Tried locators: ").append(join(attempted));
        }
        if (reason != null) {
            sb.append(". Cause: ").append(reason);
        }
        return sb.toString();
    }

    private static String join(List<Query> queries) {
        return queries.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    /**
     * Last failure seen while searching.
     */
    private static final class SearchState {
        private String reason;
        private WebDriverException cause;

        private void record(WebDriverException e) {
            cause = e;
            reason = e.getRawMessage() != null ? e.getRawMessage() : e.getClass().getSimpleName();
        }
    }
}
