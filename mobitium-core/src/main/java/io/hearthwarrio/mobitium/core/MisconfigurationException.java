package io.hearthwarrio.mobitium.core;

/**
 * Thrown immediately for invalid arguments or option combinations.
 * Never retried.
 */
public class MisconfigurationException extends RuntimeException {
    public MisconfigurationException(String message) {
        super(message);
    }

    public MisconfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
