package com.hookline.recordmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson bridge between webhook bodies and the untyped maps {@link RecordValidator} consumes.
 *
 * <p>Numbers decode to {@code Integer}, {@code Long} or {@code BigInteger} by magnitude and to
 * {@code Double} when fractional, which is what {@link ScalarType} expects.
 */
public final class PayloadCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};
    private static final TypeReference<List<Object>> ARRAY = new TypeReference<>() {};

    private PayloadCodec() {
        // utility class
    }

    /**
     * Decodes a JSON object.
     *
     * @throws PayloadCodecException if the body is not valid JSON or not an object
     */
    public static Map<String, Object> readObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        try {
            return requireObject(MAPPER.readValue(json, OBJECT));
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to decode JSON object", e);
        }
    }

    /** Decodes a JSON object from a stream. The stream is not closed. */
    public static Map<String, Object> readObject(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        try {
            return requireObject(MAPPER.readValue(in, OBJECT));
        } catch (IOException e) {
            throw new PayloadCodecException("Failed to decode JSON object", e);
        }
    }

    /** Decodes a JSON array, e.g. a fixture holding several deliveries. */
    public static List<Object> readArray(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        try {
            List<Object> list = MAPPER.readValue(json, ARRAY);
            if (list == null) {
                throw new PayloadCodecException("Expected a JSON array but was null", null);
            }
            return list;
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to decode JSON array", e);
        }
    }

    /**
     * Encodes a record back to JSON using wire keys. Unrecognized fields are written after the
     * declared ones so nothing received is lost. Optional fields the payload did not carry are
     * left out rather than written with their default.
     */
    public static String write(ValidatedRecord record) {
        try {
            return MAPPER.writeValueAsString(toWire(record));
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Failed to encode " + record.descriptorName(), e);
        }
    }

    static Map<String, Object> toWire(ValidatedRecord record) {
        Map<String, Object> wire = new LinkedHashMap<>();
        for (FieldSpec field : record.descriptor().fields()) {
            if (record.isPresent(field.name())) {
                wire.put(field.wireAlias(), toWireValue(record.values().get(field.name())));
            }
        }
        wire.putAll(record.unrecognizedFields());
        return wire;
    }

    private static Object toWireValue(Object value) {
        if (value instanceof ValidatedRecord nested) {
            return toWire(nested);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(PayloadCodec::toWireValue).toList();
        }
        return value;
    }

    private static Map<String, Object> requireObject(Map<String, Object> map) {
        if (map == null) {
            throw new PayloadCodecException("Expected a JSON object but was null", null);
        }
        return map;
    }

    /**
     * Exception thrown when a payload cannot be decoded or encoded.
     */
    public static class PayloadCodecException extends RuntimeException {
        public PayloadCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
