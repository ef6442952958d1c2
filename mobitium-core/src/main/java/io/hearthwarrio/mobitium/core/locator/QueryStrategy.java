package io.hearthwarrio.mobitium.core.locator;

/**
 * Element search strategies understood by the automation server.
 * <p>
 * {@link #using()} is the strategy name sent over the WebDriver protocol.
 */
public enum QueryStrategy {

    XPATH("xpath"),

    ACCESSIBILITY_ID("accessibility id"),

    ANDROID_UIAUTOMATOR("-android uiautomator"),

    IOS_CLASS_CHAIN("-ios class chain"),

    IOS_PREDICATE_STRING("-ios predicate string"),

    /**
     * Only meaningful inside a web context (for example the iOS deeplink fallback page).
     */
    CSS_SELECTOR("css selector");

    private final String using;

    QueryStrategy(String using) {
        this.using = using;
    }

    public String using() {
        return using;
    }
}
