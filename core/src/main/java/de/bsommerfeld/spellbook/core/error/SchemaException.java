package de.bsommerfeld.spellbook.core.error;

/**
 * Thrown when DDL, a constraint or any other SQL step of a database build
 * fails.
 */
public class SchemaException extends SetupException {

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
