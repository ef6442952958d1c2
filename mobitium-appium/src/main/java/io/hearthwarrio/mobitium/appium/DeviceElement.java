package io.hearthwarrio.mobitium.appium;

import io.hearthwarrio.mobitium.core.gesture.Bounds;

/**
 * Element handle returned by {@link DeviceSession#findElements}.
 */
public interface DeviceElement {

    void click();

    /**
     * Replaces the element value with {@code text}.
     */
    void setValue(String text);

    String getText();

    /**
     * @return attribute value, or {@code null} when absent
     */
    String getAttribute(String name);

    boolean isDisplayed();

    Bounds getBounds();
}
