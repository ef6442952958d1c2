package io.hearthwarrio.mobitium.core.locator;

import java.util.Objects;

/**
 * Factory methods for concrete {@link Query} values.
 * <p>
 * Every helper that embeds a caller-supplied string into XPath goes through {@link #xpathLiteral(String)},
 * so quotes in the searched text never break the expression.
 */
public final class Queries {

    private Queries() {
        // utility class
    }

    /**
     * Matches {@code @id} by substring, either the short id or the package-qualified one.
     */
    public static Query id(String appPackage, String id) {
        String v = xpathLiteral(id);
        String full = xpathLiteral(fullPackageId(appPackage, id));
        return xpath(".//*[contains(@id," + v + ") or contains(@id," + full + ")]");
    }

    /**
     * Matches Android {@code @resource-id} by substring, either the short id or the package-qualified one.
     */
    public static Query resourceId(String appPackage, String resourceId) {
        String v = xpathLiteral(resourceId);
        String full = xpathLiteral(fullPackageId(appPackage, resourceId));
        return xpath(".//*[contains(@resource-id," + v + ") or contains(@resource-id," + full + ")]");
    }

    public static Query text(String text) {
        return xpath(".//*[@text = " + xpathLiteral(text) + "]");
    }

    /**
     * Substring match over every attribute that carries visible or accessible text on either platform.
     */
    public static Query contains(String text) {
        String v = xpathLiteral(text);
        return xpath(".//*[contains(@text," + v + ") or contains(@id," + v + ") or contains(@resource-id," + v + ") or "
                + "contains(@content-desc," + v + ") or contains(@name," + v + ") or contains(@label," + v + ") or "
                + "contains(@value," + v + ")]");
    }

    /**
     * Exact match over the same attribute set as {@link #contains(String)}.
     */
    public static Query exactMatch(String text) {
        String v = xpathLiteral(text);
        return xpath(".//*[(@text=" + v + " or @id=" + v + " or @resource-id=" + v + " or @content-desc=" + v + " or "
                + "@name=" + v + " or @label=" + v + " or @value=" + v + ")]");
    }

    public static Query contentDesc(String contentDesc) {
        return xpath(".//*[contains(@content-desc," + xpathLiteral(contentDesc) + ")]");
    }

    public static Query value(String value) {
        return xpath(".//*[contains(@value," + xpathLiteral(value) + ")]");
    }

    public static Query name(String name) {
        return xpath(".//*[contains(@name," + xpathLiteral(name) + ")]");
    }

    public static Query label(String label) {
        return xpath(".//*[contains(@label," + xpathLiteral(label) + ")]");
    }

    public static Query xpath(String expression) {
        return new Query(QueryStrategy.XPATH, expression);
    }

    public static Query accessibilityId(String accessibilityId) {
        return new Query(QueryStrategy.ACCESSIBILITY_ID, accessibilityId);
    }

    public static Query androidUiAutomator(String expression) {
        return new Query(QueryStrategy.ANDROID_UIAUTOMATOR, expression);
    }

    public static Query iosClassChain(String expression) {
        return new Query(QueryStrategy.IOS_CLASS_CHAIN, expression);
    }

    public static Query iosPredicateString(String expression) {
        return new Query(QueryStrategy.IOS_PREDICATE_STRING, expression);
    }

    public static Query cssSelector(String selector) {
        return new Query(QueryStrategy.CSS_SELECTOR, selector);
    }

    /**
     * Encodes a string as an XPath 1.0 literal.
     * <p>
     * XPath 1.0 has no escape syntax, so a value holding both quote kinds is split on {@code '} and
     * re-joined with {@code concat(...)}.
     *
     * @param value raw value
     * @return XPath literal expression
     */
    public static String xpathLiteral(String value) {
        Objects.requireNonNull(value, "value must not be null");
        if (!value.contains("'")) {
            return "'" + value + "'";
        }
        if (!value.contains("\"")) {
            return "\"" + value + "\"";
        }

        String[] parts = value.split("'", -1);
        StringBuilder sb = new StringBuilder("concat(");
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append(", \"'\", ");
            }
            sb.append("'").append(parts[i]).append("'");
        }
        sb.append(")");
        return sb.toString();
    }

    private static String fullPackageId(String appPackage, String id) {
        Objects.requireNonNull(appPackage, "appPackage must not be null");
        return appPackage + ":id/" + id;
    }
}
