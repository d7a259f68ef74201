package de.bsommerfeld.spellbook.core.error;

/**
 * Thrown on connect failures, timeouts, stalled transfers and non-2xx
 * responses. Never retried automatically.
 */
public class NetworkException extends SetupException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
