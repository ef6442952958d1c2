package io.hearthwarrio.mobitium.core.locator;

/**
 * Target mobile platform of a session.
 */
public enum Platform {
    ANDROID,
    IOS
}
