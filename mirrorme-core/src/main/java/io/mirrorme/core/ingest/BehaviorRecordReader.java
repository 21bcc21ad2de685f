package io.mirrorme.core.ingest;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.mirrorme.core.model.BehaviorRecord;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads behavior records from a JSON array. Timestamps are ISO-8601; values without an offset are taken as UTC.
 */
public final class BehaviorRecordReader {
    private static final Logger LOG = LoggerFactory.getLogger(BehaviorRecordReader.class);
    private static final TypeReference<List<BehaviorRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public BehaviorRecordReader() {
        SimpleModule timestamps = new SimpleModule("mirrorme-timestamps");
        timestamps.addDeserializer(Instant.class, new LenientInstantDeserializer());
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(timestamps);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public List<BehaviorRecord> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        try (InputStream in = Files.newInputStream(file)) {
            List<BehaviorRecord> records = read(in);
            LOG.debug("Read {} behavior records from {}", records.size(), file);
            return records;
        }
    }

    public List<BehaviorRecord> read(InputStream in) throws IOException {
        List<BehaviorRecord> records = mapper.readValue(in, RECORD_LIST);
        return records == null ? List.of() : List.copyOf(records);
    }

    static final class LenientInstantDeserializer extends StdDeserializer<Instant> {
        LenientInstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            if (parser.currentToken().isNumeric()) {
                return Instant.ofEpochMilli(parser.getLongValue());
            }
            String raw = parser.getValueAsString();
            if (raw == null || raw.isBlank()) {
                return null;
            }
            String text = raw.trim();
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException withoutOffset) {
                try {
                    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException e) {
                    return (Instant) context.handleWeirdStringValue(Instant.class, text, "not an ISO-8601 timestamp");
                }
            }
        }
    }
}
