package de.bsommerfeld.spellbook.core.error;

/**
 * Thrown when remote metadata is reachable but lacks a field the freshness
 * protocol depends on (missing bulk type, missing {@code updated_at}).
 */
public class VersionCheckException extends SetupException {

    public VersionCheckException(String message) {
        super(message);
    }

    public VersionCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
