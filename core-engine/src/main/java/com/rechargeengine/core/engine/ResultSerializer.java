package com.rechargeengine.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rechargeengine.core.model.CalculationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JSON codec for {@link CalculationResult}.
 *
 * <p>
 * Dates are written as ISO-8601 strings and properties in alphabetical order
 * (map entries by key), so serializing the same result twice yields the same
 * bytes. Unknown properties are ignored on read.
 * </p>
 *
 * @since 1.0.0
 */
public class ResultSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ResultSerializer.class);

    private final ObjectMapper mapper;

    public ResultSerializer() {
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    /**
     * @param result calculation result
     * @return compact JSON
     * @throws IllegalStateException if the result cannot be serialized
     */
    public String toJson(CalculationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize calculation result: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize calculation result", e);
        }
    }

    /**
     * @param result calculation result
     * @return UTF-8 encoded JSON
     */
    public byte[] toBytes(CalculationResult result) {
        return toJson(result).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @param json JSON produced by {@link #toJson(CalculationResult)}
     * @return the deserialized result
     * @throws IllegalArgumentException if the JSON is not a calculation result
     */
    public CalculationResult fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return mapper.readValue(json, CalculationResult.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Not a valid calculation result: " + e.getMessage(), e);
        }
    }
}
