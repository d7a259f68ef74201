package de.bsommerfeld.spellbook.core.error;

/**
 * Base type for every failure the setup pipeline can surface. Subtypes
 * name the failure domain so callers can decide whether a failure is fatal
 * in their context (e.g. a {@link NetworkException} during a freshness
 * check is not, during a required download it is).
 */
public class SetupException extends Exception {

    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
