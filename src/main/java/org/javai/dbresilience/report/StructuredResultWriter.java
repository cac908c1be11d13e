package org.javai.dbresilience.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Writes a {@link StructuredResult} as indented JSON.
 *
 * <p>If the payload cannot be serialized, a minimal failure document naming the serialization
 * error is written instead.
 */
public final class StructuredResultWriter {

    private static final Logger LOGGER = LogManager.getLogger(StructuredResultWriter.class);

    private final ObjectMapper mapper;

    public StructuredResultWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    StructuredResultWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(StructuredResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException | RuntimeException e) {
            LOGGER.error("Failed to serialize result: {}", e.getMessage());
            return minimal(e.getMessage());
        }
    }

    static String minimal(String error) {
        String text = error == null ? StructuredResult.FALLBACK_ERROR : error;
        return "{\n  \"success\" : false,\n  \"error\" : \""
                + new String(JsonStringEncoder.getInstance().quoteAsString(text))
                + "\"\n}";
    }
}
