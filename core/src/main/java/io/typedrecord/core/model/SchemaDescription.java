package io.typedrecord.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Read-only snapshot of a record type's effective schema, for tooling and schema viewers.
 *
 * @param name        schema name
 * @param description free text, may be null
 * @param extendable  whether runtime extension is allowed
 * @param fields      effective fields in declaration order, base fields first
 */
public record SchemaDescription(String name, String description, boolean extendable, List<FieldDescription> fields) {

    public SchemaDescription {
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
    }

    /** Fields declared by the schema owner. */
    public List<FieldDescription> baseFields() {
        return fields.stream().filter(FieldDescription::isBaseField).toList();
    }

    /** Fields added by runtime extension. */
    public List<FieldDescription> extensionFields() {
        return fields.stream().filter(field -> !field.isBaseField()).toList();
    }

    /**
     * Renders the viewer document:
     *
     * <pre>
     * {
     *   "name": "Player", "description": "...", "is_extendable": true,
     *   "fields":      { "level": { "type": "int", "is_nullable": false, "is_array": false,
     *                               "element_type": null, "is_base_field": true }, ... },
     *   "base_schema": { ...base fields only, same shape... }
     * }
     * </pre>
     */
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("name", name);
        if (description != null) {
            root.put("description", description);
        } else {
            root.putNull("description");
        }
        root.put("is_extendable", extendable);
        ObjectNode all = root.putObject("fields");
        ObjectNode base = root.putObject("base_schema");
        for (FieldDescription field : fields) {
            all.set(field.name(), fieldJson(field));
            if (field.isBaseField()) {
                base.set(field.name(), fieldJson(field));
            }
        }
        return root;
    }

    private static ObjectNode fieldJson(FieldDescription field) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", field.descriptor());
        node.put("is_nullable", field.nullable());
        node.put("is_array", field.array());
        if (field.elementType() != null) {
            node.put("element_type", field.elementType());
        } else {
            node.putNull("element_type");
        }
        node.put("is_base_field", field.isBaseField());
        return node;
    }
}
