package com.hedgebot.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hedgebot.engine.trade.PhaseState;

import java.util.Map;

/**
 * JSON form of {@link PhaseState} and event payloads as stored in the database.
 */
public class PhaseStateCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public PhaseStateCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String write(PhaseState state) {
        if (state == null) {
            return null;
        }
        try {
            return mapper.writerFor(PhaseState.class).writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize phase state " + state.phase(), e);
        }
    }

    public PhaseState read(String json) {
        if (json == null || json.isBlank()) {
            return new PhaseState.Scheduled();
        }
        try {
            return mapper.readValue(json, PhaseState.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot parse phase state: " + e.getOriginalMessage(), e);
        }
    }

    public String writePayload(Map<String, Object> payload) {
        try {
            return mapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize event payload", e);
        }
    }

    public Map<String, Object> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot parse event payload", e);
        }
    }
}
