package io.typedrecord.core.engine;

import io.typedrecord.core.model.FieldDescription;
import io.typedrecord.core.model.FieldDescription.Origin;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.SchemaDescription;
import io.typedrecord.core.model.TypeDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@link SchemaDescription} snapshots of registered record types. A field redeclared by
 * an extension is reported with the extension's descriptor and {@link Origin#EXTENSION}.
 */
public final class SchemaIntrospector {

    private final SchemaRegistry registry;

    public SchemaIntrospector(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /** Describes the type registered under {@code name}. */
    public SchemaDescription describe(String name) {
        return describe(registry.require(name));
    }

    /** Describes every registered type, sorted by name. */
    public List<SchemaDescription> describeAll() {
        List<SchemaDescription> out = new ArrayList<>();
        for (String name : registry.names()) {
            registry.find(name).ifPresent(type -> out.add(describe(type)));
        }
        return out;
    }

    public static SchemaDescription describe(RecordType type) {
        Objects.requireNonNull(type, "type must not be null");
        Map<String, TypeDescriptor> extension = type.extensionSchema().fields();
        List<FieldDescription> fields = new ArrayList<>();
        for (Map.Entry<String, TypeDescriptor> entry : type.effectiveSchema().fields().entrySet()) {
            Origin origin = extension.containsKey(entry.getKey()) ? Origin.EXTENSION : Origin.BASE;
            fields.add(FieldDescription.of(entry.getKey(), entry.getValue(), origin));
        }
        return new SchemaDescription(type.name(), type.description(), type.extendable(), fields);
    }
}
