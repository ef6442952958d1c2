package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.MisconfigurationException;
import io.hearthwarrio.mobitium.core.locator.Locator;
import io.hearthwarrio.mobitium.core.locator.Queries;

/**
 * Target described by visible text: either an exact value or a substring, never both.
 */
public final class TextMatch {

    private final String exact;
    private final String contains;

    private TextMatch(String exact, String contains) {
        this.exact = exact;
        this.contains = contains;
    }

    public static TextMatch exact(String text) {
        return of(text, null);
    }

    public static TextMatch contains(String text) {
        return of(null, text);
    }

    /**
     * @throws MisconfigurationException unless exactly one of the arguments is a non-empty string
     */
    public static TextMatch of(String exact, String contains) {
        boolean hasExact = exact != null && !exact.isEmpty();
        boolean hasContains = contains != null && !contains.isEmpty();
        if (!hasExact && !hasContains) {
            throw new MisconfigurationException("Either 'text' or 'containsText' must be given");
        }
        if (hasExact && hasContains) {
            throw new MisconfigurationException("'text' and 'containsText' cannot be combined");
        }
        return new TextMatch(hasExact ? exact : null, hasContains ? contains : null);
    }

    public String getExact() {
        return exact;
    }

    public String getContains() {
        return contains;
    }

    public boolean isExact() {
        return exact != null;
    }

    /**
     * Same text query on both platforms.
     */
    public Locator toLocator() {
        return Locator.of(isExact() ? Queries.exactMatch(exact) : Queries.contains(contains));
    }

    @Override
    public String toString() {
        return isExact() ? "text '" + exact + "'" : "text containing '" + contains + "'";
    }
}
