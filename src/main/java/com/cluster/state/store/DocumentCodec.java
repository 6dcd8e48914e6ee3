package com.cluster.state.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Converts typed document records to and from the map form kept by a
 * {@link DocumentStore}. Bookkeeping fields such as {@value Documents#REVNO}
 * are ignored when a record does not declare them.
 */
public class DocumentCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public DocumentCodec() {
        this(new ObjectMapper());
    }

    public DocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Map<String, Object> toDocument(Object value) {
        return Documents.normalizeDocument(objectMapper.convertValue(value, MAP_TYPE));
    }

    public <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return objectMapper.convertValue(document, type);
    }
}
