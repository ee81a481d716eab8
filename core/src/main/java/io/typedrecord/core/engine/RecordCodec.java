package io.typedrecord.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedrecord.core.model.ValidationMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JSON conversion of records through their persisted form ({@link ValidatedRecord#toMap()}).
 *
 * <p>
 * Parsed numbers keep their JSON shape: integral literals become {@code Integer}/{@code Long},
 * decimals become {@code Double}. Objects become insertion-ordered maps, so a decoded record
 * sees fields in document order.
 *
 * <p>
 * Thread-safe.
 */
public final class RecordCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final TypeValidator validator;
    private final ObjectMapper mapper;

    public RecordCodec(TypeValidator validator) {
        this(validator, new ObjectMapper());
    }

    public RecordCodec(TypeValidator validator, ObjectMapper mapper) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /** Renders the record's persisted form, side-channel data included. */
    public JsonNode toJson(ValidatedRecord record) {
        return mapper.valueToTree(record.toMap());
    }

    public String toJsonString(ValidatedRecord record) {
        try {
            return mapper.writeValueAsString(record.toMap());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Record '" + record.schemaName() + "' is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a JSON object into plain field data.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public Map<String, Object> readData(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            Map<String, Object> data = mapper.readValue(json, MAP_TYPE);
            if (data == null) {
                throw new IllegalArgumentException("JSON document must be an object, got null");
            }
            return data;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON record data: " + e.getOriginalMessage(), e);
        }
    }

    /** Converts an object node into plain field data. */
    public Map<String, Object> readData(JsonNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!node.isObject()) {
            throw new IllegalArgumentException("JSON document must be an object, got " + node.getNodeType());
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    /**
     * Decodes a record of a registered type. The result may be {@code REJECTED}; inspect
     * {@link ValidatedRecord#state()} or use {@link ValidatedRecord#createOrThrow}.
     *
     * @throws IllegalArgumentException if the JSON is invalid or the schema is not registered
     */
    public ValidatedRecord readRecord(String json, String schemaName, ValidationMode mode) {
        return ValidatedRecord.create(validator, schemaName, readData(json), mode);
    }

    /** Decodes a record in the validator's default mode. */
    public ValidatedRecord readRecord(String json, String schemaName) {
        return readRecord(json, schemaName, validator.settings().defaultMode());
    }
}
