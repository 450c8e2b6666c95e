package io.codegraph.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximates how many language-model tokens a query result costs once serialized.
 * <p>
 * The estimate is the compact JSON length divided by four, rounded up.
 */
public final class TokenEstimator {

    private static final Logger log = LoggerFactory.getLogger(TokenEstimator.class);

    static final int CHARS_PER_TOKEN = 4;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private TokenEstimator() {
    }

    public static int estimate(Object value) {
        String json;
        try {
            json = MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Falling back to toString for token estimate of {}", value.getClass().getSimpleName(), e);
            json = String.valueOf(value);
        }
        return forLength(json.length());
    }

    static int forLength(int chars) {
        return (chars + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
