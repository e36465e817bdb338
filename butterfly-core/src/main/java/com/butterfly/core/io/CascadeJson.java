package com.butterfly.core.io;

import com.butterfly.core.viz.CascadeVisualization;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for the cascade output and everything stored alongside it.
 * Timestamps are written as ISO-8601 strings.
 */
public final class CascadeJson {

    private static final ObjectMapper MAPPER = newMapper();

    private CascadeJson() {
    }

    /**
     * Create and configure a mapper. Callers that need extra settings get their own copy.
     */
    public static ObjectMapper newMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(CascadeVisualization visualization) throws JsonProcessingException {
        return MAPPER.writeValueAsString(visualization);
    }

    public static CascadeVisualization read(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, CascadeVisualization.class);
    }
}
