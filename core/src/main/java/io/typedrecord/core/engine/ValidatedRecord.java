package io.typedrecord.core.engine;

import io.typedrecord.core.error.ConstructionRejectedException;
import io.typedrecord.core.model.RecordState;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.Schema;
import io.typedrecord.core.model.TypeDescriptor;
import io.typedrecord.core.model.ValidationMode;
import io.typedrecord.core.model.ValidationResult;
import io.typedrecord.core.model.Violation;
import io.typedrecord.core.model.ViolationKind;
import io.typedrecord.core.spi.DiagnosticSink.Diagnostic;
import io.typedrecord.core.spi.DiagnosticSink.Severity;
import io.typedrecord.core.spi.RecordFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A key/value record bound to a {@link RecordType}. Every write is validated against the type's
 * effective schema through a {@link TypeValidator}.
 *
 * <p>
 * Mutation contract:
 * <ul>
 * <li>{@link ValidationMode#STRICT}: a write or merge that fails validation is reverted, so
 * the visible state is always the last valid one.</li>
 * <li>{@link ValidationMode#LOOSE}: a failing write is kept and reported as a warning; the
 * record becomes {@link RecordState#TAINTED} until a later write validates.</li>
 * </ul>
 * Initial data that fails validation is never committed: the record stays empty in state
 * {@link RecordState#REJECTED}. Use {@link #createOrThrow} to get an exception instead.
 *
 * <p>
 * Fields typed with a schema reference (or an array of them) hold nested records. Raw maps
 * written to such fields are wrapped through the registry's {@link RecordFactory}; a raw map
 * whose nested construction fails is stored as is and fails the outer check. Reads upgrade raw
 * maps lazily and silently, so wrapping is idempotent.
 *
 * <p>
 * Plain maps, lists and Java arrays are copied on the way in and on the way out; arrays are
 * stored as lists. Nested records are shared.
 *
 * <p>
 * The reserved field {@link Schema#NAMESPACE_FIELD} holds per-owner side-channel data that is
 * never validated and is excluded from {@link #keys()}.
 *
 * <p>
 * Not thread-safe. Callers sharing a record across threads must serialize {@link #set} and
 * {@link #update}: the snapshot, merge, validate and restore steps are not atomic.
 */
public class ValidatedRecord {

    private static final Logger LOG = LoggerFactory.getLogger(ValidatedRecord.class);

    private final TypeValidator validator;
    private final RecordType type;
    private final ValidationMode mode;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private RecordState state;
    private ValidationResult lastResult;

    /**
     * Creates a record in the validator's default mode.
     *
     * @param validator   validator (and through it the registry and diagnostic sink)
     * @param type        the record type providing the schema
     * @param initialData initial field values, copied; may be null for an empty record
     */
    public ValidatedRecord(TypeValidator validator, RecordType type, Map<String, ?> initialData) {
        this(validator, type, initialData, validator.settings().defaultMode());
    }

    /**
     * Creates a record, validating {@code initialData} against the effective schema. On failure
     * the record is left empty in state {@link RecordState#REJECTED}.
     *
     * @param validator   validator (and through it the registry and diagnostic sink)
     * @param type        the record type providing the schema
     * @param initialData initial field values, copied; may be null for an empty record
     * @param mode        enforcement mode
     */
    public ValidatedRecord(
            TypeValidator validator, RecordType type, Map<String, ?> initialData, ValidationMode mode) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");

        Map<String, Object> prepared = new LinkedHashMap<>();
        if (initialData != null) {
            initialData.forEach((key, value) -> prepared.put(key, copyContainers(value)));
        }

        Schema effective = type.effectiveSchema();
        if (!effective.isEmpty()) {
            wrapNested(prepared, effective);
            ValidationResult result =
                    validator.validateRecord(withoutNamespace(prepared), effective, mode, type.name());
            if (!result.valid()) {
                this.state = RecordState.REJECTED;
                this.lastResult = result;
                reportRejection(result);
                return;
            }
        }
        data.putAll(prepared);
        this.state = RecordState.VALID;
        this.lastResult = ValidationResult.success();
    }

    // --- Factories ---

    /** Creates a record in the validator's default mode. */
    public static ValidatedRecord create(TypeValidator validator, RecordType type, Map<String, ?> initialData) {
        return new ValidatedRecord(validator, type, initialData);
    }

    /** Creates a record; see {@link #ValidatedRecord(TypeValidator, RecordType, Map, ValidationMode)}. */
    public static ValidatedRecord create(
            TypeValidator validator, RecordType type, Map<String, ?> initialData, ValidationMode mode) {
        return new ValidatedRecord(validator, type, initialData, mode);
    }

    /**
     * Creates a record of a registered type through its registered factory.
     *
     * @throws IllegalArgumentException if no type is registered under {@code schemaName}
     */
    public static ValidatedRecord create(
            TypeValidator validator, String schemaName, Map<String, ?> initialData, ValidationMode mode) {
        RecordFactory factory = validator
                .registry()
                .factory(schemaName)
                .orElseThrow(() ->
                        new IllegalArgumentException("No record type registered for name: '" + schemaName + "'"));
        return factory.create(validator, stringKeyed(initialData), mode);
    }

    /**
     * Creates a record, throwing instead of returning an empty rejected record.
     *
     * @throws ConstructionRejectedException if the initial data fails validation
     */
    public static ValidatedRecord createOrThrow(
            TypeValidator validator, RecordType type, Map<String, ?> initialData, ValidationMode mode) {
        ValidatedRecord record = new ValidatedRecord(validator, type, initialData, mode);
        if (record.state() == RecordState.REJECTED) {
            throw new ConstructionRejectedException(type.name(), record.lastResult());
        }
        return record;
    }

    // --- Reads ---

    /** Returns the stored value, or {@code null} if absent. */
    public Object get(String field) {
        return get(field, null);
    }

    /**
     * Returns a copy of the stored value, or {@code defaultValue} if absent. No validation is
     * reported on read. A raw map stored in a nested-schema field is upgraded to a record and
     * stored back when the upgrade succeeds; otherwise it is left alone.
     */
    public Object get(String field, Object defaultValue) {
        if (!data.containsKey(field)) {
            return defaultValue;
        }
        Object value = data.get(field);
        TypeDescriptor descriptor = type.effectiveSchema().descriptor(field);
        if (descriptor != null) {
            Object upgraded = wrapValue(value, descriptor, true);
            if (upgraded != value) {
                data.put(field, upgraded);
                value = upgraded;
            }
        }
        return copyContainers(value);
    }

    /** True if {@code field} holds a value (possibly {@code null}). */
    public boolean has(String field) {
        return data.containsKey(field);
    }

    /** Field names in insertion order, without the side-channel field. */
    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>(data.keySet());
        keys.remove(Schema.NAMESPACE_FIELD);
        return Collections.unmodifiableSet(keys);
    }

    /** Number of fields, without the side-channel field. */
    public int size() {
        return data.containsKey(Schema.NAMESPACE_FIELD) ? data.size() - 1 : data.size();
    }

    // --- Writes ---

    /**
     * Stores a single field and re-validates the whole record.
     *
     * @param field field name, must not be the side-channel field
     * @param value the new value; raw maps for nested-schema fields are wrapped first
     * @return the validation result of the post-write state
     */
    public ValidationResult set(String field, Object value) {
        Objects.requireNonNull(field, "field must not be null");
        if (Schema.NAMESPACE_FIELD.equals(field)) {
            throw new IllegalArgumentException(
                    "'" + Schema.NAMESPACE_FIELD + "' is reserved, use setNamespacedData instead");
        }
        Schema effective = type.effectiveSchema();
        TypeDescriptor descriptor = effective.descriptor(field);
        Object stored = copyContainers(value);
        if (descriptor != null) {
            stored = wrapValue(stored, descriptor, false);
        }

        boolean existed = data.containsKey(field);
        Object previous = data.get(field);
        data.put(field, stored);

        if (effective.isEmpty()) {
            return ValidationResult.success();
        }
        ValidationResult result = validator.validateRecord(withoutNamespace(data), effective, mode, type.name());
        if (!result.valid() && mode == ValidationMode.STRICT) {
            if (existed) {
                data.put(field, previous);
            } else {
                data.remove(field);
            }
            LOG.debug("Rolled back set: schema={}, field={}, reason={}", type.name(), field, result.summary());
        }
        commit(result);
        return result;
    }

    /**
     * Merges {@code partialData} into the record (incoming keys win) and re-validates. In strict
     * mode a failing merge restores the complete pre-merge snapshot.
     *
     * @param partialData fields to merge; may include side-channel data under
     *                    {@link Schema#NAMESPACE_FIELD}
     * @return the validation result of the post-merge state
     */
    public ValidationResult update(Map<String, ?> partialData) {
        Objects.requireNonNull(partialData, "partialData must not be null");
        Map<String, Object> snapshot = new LinkedHashMap<>(data);
        Schema effective = type.effectiveSchema();

        partialData.forEach((field, value) -> {
            Object stored = copyContainers(value);
            TypeDescriptor descriptor = effective.descriptor(field);
            if (descriptor != null) {
                stored = wrapValue(stored, descriptor, false);
            }
            data.put(field, stored);
        });

        if (effective.isEmpty()) {
            return ValidationResult.success();
        }
        ValidationResult result = validator.validateRecord(withoutNamespace(data), effective, mode, type.name());
        if (!result.valid() && mode == ValidationMode.STRICT) {
            data.clear();
            data.putAll(snapshot);
            LOG.debug(
                    "Rolled back update: schema={}, keys={}, reason={}",
                    type.name(),
                    partialData.keySet(),
                    result.summary());
        }
        commit(result);
        return result;
    }

    /** Re-validates the current state without changing it. */
    public ValidationResult validate() {
        Schema effective = type.effectiveSchema();
        if (effective.isEmpty()) {
            return ValidationResult.success();
        }
        return validator.validateRecord(withoutNamespace(data), effective, mode, type.name());
    }

    private void commit(ValidationResult result) {
        lastResult = result;
        if (result.valid()) {
            state = RecordState.VALID;
        } else if (mode == ValidationMode.LOOSE) {
            state = RecordState.TAINTED;
        }
    }

    // --- Schema ---

    /**
     * Adds fields to the type's extension schema. Affects every record sharing this
     * {@link RecordType}.
     *
     * @throws IllegalStateException if the type is not extendable
     */
    public void extendSchema(Map<String, String> extraFields) {
        type.extend(extraFields);
    }

    /** Adds already-parsed fields to the type's extension schema. */
    public void extendSchema(Schema extraFields) {
        type.extend(extraFields);
    }

    public Schema effectiveSchema() {
        return type.effectiveSchema();
    }

    // --- Namespaced side-channel ---

    /** Stores {@code value} under {@code key} in {@code ownerId}'s namespace. Never validated. */
    public void setNamespacedData(String ownerId, String key, Object value) {
        requireOwner(ownerId);
        Objects.requireNonNull(key, "key must not be null");
        Map<String, Object> root = namespaceRoot();
        Map<String, Object> owned = ownerEntries(root.get(ownerId));
        owned.put(key, copyContainers(value));
        root.put(ownerId, owned);
        data.put(Schema.NAMESPACE_FIELD, root);
    }

    /** Returns a copy of {@code ownerId}'s value for {@code key}, or {@code defaultValue}. */
    public Object getNamespacedData(String ownerId, String key, Object defaultValue) {
        if (data.get(Schema.NAMESPACE_FIELD) instanceof Map<?, ?> root
                && root.get(ownerId) instanceof Map<?, ?> owned
                && owned.containsKey(key)) {
            return copyContainers(owned.get(key));
        }
        return defaultValue;
    }

    /** Returns a copy of {@code ownerId}'s value for {@code key}, or {@code null}. */
    public Object getNamespacedData(String ownerId, String key) {
        return getNamespacedData(ownerId, key, null);
    }

    /** True if {@code ownerId} has a namespace on this record. */
    public boolean hasNamespacedData(String ownerId) {
        return data.get(Schema.NAMESPACE_FIELD) instanceof Map<?, ?> root && root.get(ownerId) instanceof Map;
    }

    /** Copy of everything {@code ownerId} stored; empty if nothing. */
    public Map<String, Object> getAllNamespacedData(String ownerId) {
        if (!hasNamespacedData(ownerId)) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        ownerEntries(namespaceRoot().get(ownerId)).forEach((key, value) -> copy.put(key, copyContainers(value)));
        return Collections.unmodifiableMap(copy);
    }

    /** Removes {@code ownerId}'s namespace. The side-channel field disappears with its last owner. */
    public void clearNamespacedData(String ownerId) {
        if (!data.containsKey(Schema.NAMESPACE_FIELD)) {
            return;
        }
        Map<String, Object> root = namespaceRoot();
        root.remove(ownerId);
        if (root.isEmpty()) {
            data.remove(Schema.NAMESPACE_FIELD);
        } else {
            data.put(Schema.NAMESPACE_FIELD, root);
        }
    }

    /** Owners that currently hold side-channel data, in first-write order. */
    public List<String> listNamespaceOwners() {
        return List.copyOf(namespaceRoot().keySet());
    }

    /** String-keyed copy of the side-channel root; empty when absent or not a map. */
    private Map<String, Object> namespaceRoot() {
        Object root = data.get(Schema.NAMESPACE_FIELD);
        return root instanceof Map<?, ?> raw ? stringKeyed(raw) : new LinkedHashMap<>();
    }

    /** String-keyed copy of one owner's entries; empty when absent or not a map. */
    private static Map<String, Object> ownerEntries(Object owned) {
        return owned instanceof Map<?, ?> raw ? stringKeyed(raw) : new LinkedHashMap<>();
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isEmpty()) {
            throw new IllegalArgumentException("ownerId must not be null or empty");
        }
    }

    // --- Accessors ---

    public String schemaName() {
        return type.name();
    }

    public RecordType type() {
        return type;
    }

    public ValidationMode mode() {
        return mode;
    }

    public RecordState state() {
        return state;
    }

    /** True if a loose-mode write failed validation and was kept. */
    public boolean isTainted() {
        return state == RecordState.TAINTED;
    }

    /** Result of the construction or of the most recent write. */
    public ValidationResult lastResult() {
        return lastResult;
    }

    /**
     * Persisted form: a deep copy with nested records turned back into plain maps. Side-channel
     * data is included, so the map reconstructs an equal record.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        data.forEach((key, value) -> out.put(key, toPlain(value)));
        return out;
    }

    // --- Nested record wrapping ---

    private void wrapNested(Map<String, Object> target, Schema schema) {
        for (Map.Entry<String, Object> entry : target.entrySet()) {
            TypeDescriptor descriptor = schema.descriptor(entry.getKey());
            if (descriptor != null) {
                entry.setValue(wrapValue(entry.getValue(), descriptor, false));
            }
        }
    }

    /**
     * Converts raw maps (or sequences of them) into records of the referenced schema. Returns the
     * same instance when nothing needed converting. With {@code quietly} set, each nested
     * construction is first tried against a non-reporting validator and a map that would be
     * rejected is left as is without any diagnostic.
     */
    private Object wrapValue(Object value, TypeDescriptor descriptor, boolean quietly) {
        if (value == null) {
            return null;
        }
        if (descriptor instanceof TypeDescriptor.SchemaRef ref && value instanceof Map<?, ?> raw) {
            Optional<RecordFactory> factory = validator.registry().factory(ref.schemaName());
            if (factory.isEmpty()) {
                return value;
            }
            if (quietly
                    && factory.get().create(validator.quiet(), stringKeyed(raw), mode).state()
                            == RecordState.REJECTED) {
                return value;
            }
            ValidatedRecord nested = factory.get().create(validator, stringKeyed(raw), mode);
            return nested.state() == RecordState.REJECTED ? value : nested;
        }
        if (descriptor instanceof TypeDescriptor.ArrayOf array) {
            List<?> list = TypeValidator.asSequence(value);
            if (list == null) {
                return value;
            }
            List<Object> wrapped = null;
            for (int i = 0; i < list.size(); i++) {
                Object element = list.get(i);
                Object converted = wrapValue(element, array.element(), quietly);
                if (converted != element && wrapped == null) {
                    wrapped = new ArrayList<>(list.subList(0, i));
                }
                if (wrapped != null) {
                    wrapped.add(converted);
                }
            }
            return wrapped != null ? wrapped : value;
        }
        return value;
    }

    private void reportRejection(ValidationResult result) {
        Violation first = result.firstViolation();
        validator.report(new Diagnostic(
                Severity.ERROR,
                ViolationKind.CONSTRUCTION_REJECTED,
                first != null ? first.field() : null,
                first != null ? first.expected() : null,
                first != null ? first.actual() : null,
                type.name(),
                "Construction of '" + type.name() + "' rejected: " + result.summary()));
        LOG.debug("Construction rejected: schema={}, mode={}, reason={}", type.name(), mode, result.summary());
    }

    // --- Copy helpers ---

    private static Map<String, Object> withoutNamespace(Map<String, Object> source) {
        if (!source.containsKey(Schema.NAMESPACE_FIELD)) {
            return source;
        }
        Map<String, Object> view = new LinkedHashMap<>(source);
        view.remove(Schema.NAMESPACE_FIELD);
        return view;
    }

    private static Map<String, Object> stringKeyed(Map<?, ?> raw) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (raw != null) {
            raw.forEach((key, value) -> out.put(String.valueOf(key), value));
        }
        return out;
    }

    /**
     * Copies plain maps, lists and Java arrays recursively, turning arrays into lists. Records
     * and other values are shared.
     */
    private static Object copyContainers(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, inner) -> copy.put(key, copyContainers(inner)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(inner -> copy.add(copyContainers(inner)));
            return copy;
        }
        if (value != null && value.getClass().isArray()) {
            List<Object> copy = new ArrayList<>();
            TypeValidator.asSequence(value).forEach(inner -> copy.add(copyContainers(inner)));
            return copy;
        }
        return value;
    }

    private static Object toPlain(Object value) {
        if (value instanceof ValidatedRecord record) {
            return record.toMap();
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, inner) -> copy.put(key, toPlain(inner)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(inner -> copy.add(toPlain(inner)));
            return copy;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidatedRecord that)) return false;
        return type.name().equals(that.type.name()) && data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type.name(), data);
    }

    /** Prints the schema name and field names only, never values. */
    @Override
    public String toString() {
        return schemaName() + keys();
    }
}
