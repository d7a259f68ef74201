package de.bsommerfeld.spellbook.db.imports;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.spellbook.core.error.RecordParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Streams a JSON array of records into a {@link BatchSink} without ever
 * materializing the whole document.
 *
 * <h3>Positioning</h3>
 * The record array is either the document root ({@code [ {...}, ... ]}) or
 * the value of a named field of a root object
 * ({@code {"data": [ {...}, ... ]}}). Other root fields are skipped
 * without binding.
 *
 * <h3>Binding</h3>
 * Each array element is bound into {@code T} on its own via
 * {@link ObjectMapper#readValue(JsonParser, Class)}, then mapped to the
 * row type {@code R}. At most one record and one batch are held at a time.
 *
 * <h3>Batching</h3>
 * Every {@code batchSize} rows are handed to the sink; a non-empty
 * remainder is flushed at end of stream. For {@code N} records this means
 * exactly {@code ceil(N / batchSize)} flushes, all full except the last.
 * The importer never commits; the caller owns the transaction.
 *
 * <h3>Failure</h3>
 * Malformed JSON, a record that does not bind, or a record the mapping
 * rejects aborts the whole pass with {@link RecordParseException}. Rows
 * flushed before the failure stay in the caller's open transaction, which
 * is expected to roll back.
 *
 * @param <T> record type bound from JSON
 * @param <R> row type handed to the sink
 */
public class StreamingImporter<T, R> {

    private static final Logger LOG = LoggerFactory.getLogger(StreamingImporter.class);

    private final ObjectMapper mapper;
    private final Class<T> recordType;
    private final Function<? super T, ? extends R> mapping;
    private final String arrayField;
    private final int batchSize;

    /**
     * @param recordType type each array element is bound to
     * @param mapping    per-record transform; may throw
     *                   {@link IllegalArgumentException} to reject a record
     * @param arrayField field holding the array when the root is an object,
     *                   e.g. {@code "data"}
     * @param batchSize  rows per flush, at least 1
     */
    public StreamingImporter(ObjectMapper mapper, Class<T> recordType, Function<? super T, ? extends R> mapping,
            String arrayField, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.mapper = mapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.recordType = recordType;
        this.mapping = mapping;
        this.arrayField = arrayField;
        this.batchSize = batchSize;
    }

    /** Importer for sources whose records need no transform. */
    public static <T> StreamingImporter<T, T> identity(ObjectMapper mapper, Class<T> recordType,
            String arrayField, int batchSize) {
        return new StreamingImporter<>(mapper, recordType, Function.identity(), arrayField, batchSize);
    }

    /**
     * Runs one import pass.
     *
     * @return number of records imported
     * @throws RecordParseException on malformed or rejected records
     * @throws SQLException         if the sink fails
     * @throws IOException          if reading the source fails
     */
    public long importFrom(InputStream source, BatchSink<R> sink, ImportListener listener)
            throws RecordParseException, SQLException, IOException {
        List<R> batch = new ArrayList<>(batchSize);
        long count = 0;

        try (JsonParser parser = mapper.getFactory().createParser(source)) {
            positionOnArray(parser);

            JsonToken token;
            while ((token = nextToken(parser, count)) != JsonToken.END_ARRAY) {
                if (token != JsonToken.START_OBJECT) {
                    throw new RecordParseException("Expected a record object but found " + token, count, null);
                }
                batch.add(bindAndMap(parser, count));
                count++;

                if (batch.size() >= batchSize) {
                    sink.flush(batch);
                    batch.clear();
                    listener.onFlush(count);
                }
            }

            if (!batch.isEmpty()) {
                sink.flush(batch);
                batch.clear();
                listener.onFlush(count);
            }
        }

        LOG.debug("Imported {} {} records", count, recordType.getSimpleName());
        return count;
    }

    private void positionOnArray(JsonParser parser) throws RecordParseException, IOException {
        JsonToken first = nextToken(parser, 0);
        if (first == JsonToken.START_ARRAY) {
            return;
        }
        if (first != JsonToken.START_OBJECT || arrayField == null) {
            throw new RecordParseException("Expected a record array at the document root but found " + first,
                    0, null);
        }

        JsonToken token;
        while ((token = nextToken(parser, 0)) == JsonToken.FIELD_NAME) {
            String field = parser.currentName();
            JsonToken value = nextToken(parser, 0);
            if (arrayField.equals(field)) {
                if (value != JsonToken.START_ARRAY) {
                    throw new RecordParseException("Field '" + arrayField + "' is not an array", 0, null);
                }
                return;
            }
            parser.skipChildren();
        }
        throw new RecordParseException("No '" + arrayField + "' array in document (stopped at " + token + ")",
                0, null);
    }

    private R bindAndMap(JsonParser parser, long index) throws RecordParseException, IOException {
        T record;
        try {
            record = mapper.readValue(parser, recordType);
        } catch (JsonProcessingException e) {
            throw new RecordParseException("Malformed " + recordType.getSimpleName() + ": "
                    + e.getOriginalMessage(), index, e);
        }

        try {
            return mapping.apply(record);
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new RecordParseException("Rejected " + recordType.getSimpleName() + ": " + e.getMessage(),
                    index, e);
        }
    }

    /** Advances the parser; syntax errors and truncated input become parse failures. */
    private static JsonToken nextToken(JsonParser parser, long index) throws RecordParseException, IOException {
        JsonToken token;
        try {
            token = parser.nextToken();
        } catch (JsonProcessingException e) {
            throw new RecordParseException("Malformed JSON: " + e.getOriginalMessage(), index, e);
        }
        if (token == null) {
            throw new RecordParseException("Unexpected end of input", index, null);
        }
        return token;
    }
}
