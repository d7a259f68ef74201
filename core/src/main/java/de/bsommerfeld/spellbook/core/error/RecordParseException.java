package de.bsommerfeld.spellbook.core.error;

/**
 * Thrown when a streamed source contains a record that cannot be bound to
 * its record type. Aborts the whole import pass.
 */
public class RecordParseException extends SetupException {

    private final long recordIndex;

    public RecordParseException(String message, long recordIndex, Throwable cause) {
        super(message + " (record #" + recordIndex + ")", cause);
        this.recordIndex = recordIndex;
    }

    /** Zero-based position of the offending record in its source array. */
    public long recordIndex() {
        return recordIndex;
    }
}
