package io.typedrecord.core.engine;

import io.typedrecord.core.diagnostics.Slf4jDiagnosticSink;
import io.typedrecord.core.error.DescriptorParseException;
import io.typedrecord.core.model.Schema;
import io.typedrecord.core.model.TypeDescriptor;
import io.typedrecord.core.model.ValidationMode;
import io.typedrecord.core.model.ValidationResult;
import io.typedrecord.core.model.ValueKind;
import io.typedrecord.core.model.Violation;
import io.typedrecord.core.model.ViolationKind;
import io.typedrecord.core.spec.DescriptorParser;
import io.typedrecord.core.spi.DiagnosticSink;
import io.typedrecord.core.spi.DiagnosticSink.Diagnostic;
import io.typedrecord.core.spi.DiagnosticSink.Severity;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural type checker for values and whole records.
 *
 * <p>
 * {@link #check} matches one value against one descriptor: nullable descriptors accept
 * {@code null}, arrays are checked element by element, {@code Dictionary} accepts any mapping,
 * schema references accept records of the named schema, and primitives compare the value's
 * {@link ValueKind} name with the descriptor name (whole numbers are accepted where
 * {@code float} is expected, and the comparison falls back to case-insensitive).
 *
 * <p>
 * {@link #validateRecord} checks a data map against a {@link Schema} in schema declaration order
 * and stops at the first violation. {@link #validateRecordExhaustive} reports every violation in
 * the same order. Each violation is also reported to the {@link DiagnosticSink}.
 *
 * <p>
 * Thread-safe: stateless apart from the collaborators passed at construction, which must be
 * thread-safe themselves.
 */
public final class TypeValidator {

    private static final Logger LOG = LoggerFactory.getLogger(TypeValidator.class);
    private static final int MAX_EXCERPT_VALUE_LENGTH = 40;

    private final SchemaRegistry registry;
    private final DiagnosticSink diagnosticSink;
    private final ValidationSettings settings;

    /** Location of a structural mismatch inside a value. */
    private record Mismatch(String path, String expected, String actual) {}

    /**
     * Creates a validator reporting to SLF4J with default settings.
     *
     * @param registry registry used to resolve schema references
     */
    public TypeValidator(SchemaRegistry registry) {
        this(registry, new Slf4jDiagnosticSink(), ValidationSettings.DEFAULT);
    }

    /**
     * Creates a validator with a custom diagnostic sink and default settings.
     *
     * @param registry       registry used to resolve schema references
     * @param diagnosticSink receiver of validation diagnostics
     */
    public TypeValidator(SchemaRegistry registry, DiagnosticSink diagnosticSink) {
        this(registry, diagnosticSink, ValidationSettings.DEFAULT);
    }

    /**
     * Creates a validator with all collaborators.
     *
     * @param registry       registry used to resolve schema references
     * @param diagnosticSink receiver of validation diagnostics
     * @param settings       engine-wide settings
     */
    public TypeValidator(SchemaRegistry registry, DiagnosticSink diagnosticSink, ValidationSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.diagnosticSink = Objects.requireNonNull(diagnosticSink, "diagnosticSink must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public DiagnosticSink diagnosticSink() {
        return diagnosticSink;
    }

    public ValidationSettings settings() {
        return settings;
    }

    /** Same registry and settings, reporting nowhere. Used for trial constructions on read. */
    TypeValidator quiet() {
        if (diagnosticSink == DiagnosticSink.NOOP) {
            return this;
        }
        return new TypeValidator(registry, DiagnosticSink.NOOP, settings);
    }

    // --- Single-value checks ---

    /**
     * Checks a value against descriptor text. Never throws: a malformed descriptor is reported as
     * a warning diagnostic and fails the check for every input.
     *
     * @param value      the value, may be null
     * @param descriptor the descriptor text, e.g. {@code "Array<int>?"}
     * @return true if the value structurally matches
     */
    public boolean check(Object value, String descriptor) {
        TypeDescriptor parsed;
        try {
            parsed = DescriptorParser.parse(descriptor);
        } catch (DescriptorParseException e) {
            report(new Diagnostic(
                    Severity.WARNING,
                    ViolationKind.TYPE_MISMATCH,
                    null,
                    descriptor,
                    ValueKind.nameOf(value),
                    null,
                    e.getMessage()));
            return false;
        }
        return check(value, parsed);
    }

    /**
     * Checks a value against a parsed descriptor.
     *
     * @param value      the value, may be null
     * @param descriptor the descriptor
     * @return true if the value structurally matches
     */
    public boolean check(Object value, TypeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        return findMismatch(value, descriptor, "") == null;
    }

    private Mismatch findMismatch(Object value, TypeDescriptor descriptor, String path) {
        if (value == null) {
            return descriptor.nullable() ? null : new Mismatch(path, descriptor.text(), ValueKind.NIL.displayName());
        }
        if (descriptor instanceof TypeDescriptor.ArrayOf array) {
            List<?> elements = asSequence(value);
            if (elements == null) {
                return new Mismatch(path, descriptor.text(), ValueKind.nameOf(value));
            }
            for (int i = 0; i < elements.size(); i++) {
                Mismatch inner = findMismatch(elements.get(i), array.element(), path + "[" + i + "]");
                if (inner != null) {
                    return inner;
                }
            }
            return null;
        }
        if (descriptor instanceof TypeDescriptor.Dictionary) {
            return value instanceof Map ? null : new Mismatch(path, descriptor.text(), ValueKind.nameOf(value));
        }
        if (descriptor instanceof TypeDescriptor.Any) {
            return null;
        }
        if (descriptor instanceof TypeDescriptor.SchemaRef ref) {
            if (value instanceof ValidatedRecord record && ref.schemaName().equals(record.schemaName())) {
                return null;
            }
            if (!registry.contains(ref.schemaName())) {
                LOG.debug("Unresolved schema reference: {}", ref.schemaName());
            }
            return new Mismatch(path, descriptor.text(), ValueKind.nameOf(value));
        }
        TypeDescriptor.Primitive primitive = (TypeDescriptor.Primitive) descriptor;
        return matchesPrimitive(ValueKind.of(value), primitive.name())
                ? null
                : new Mismatch(path, descriptor.text(), ValueKind.nameOf(value));
    }

    private static boolean matchesPrimitive(ValueKind kind, String name) {
        String kindName = kind.displayName();
        if (kindName.equals(name)) {
            return true;
        }
        if (kind == ValueKind.INT && ValueKind.FLOAT.displayName().equalsIgnoreCase(name)) {
            return true;
        }
        return kindName.equalsIgnoreCase(name);
    }

    /** Returns the elements of a sequence value, or null if the value is not a sequence. */
    static List<?> asSequence(Object value) {
        if (ValueKind.of(value) != ValueKind.ARRAY) {
            return null;
        }
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        int length = Array.getLength(value);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(value, i));
        }
        return elements;
    }

    // --- Record validation ---

    /**
     * Validates a record's data against a schema, stopping at the first violation.
     *
     * @param data   field values
     * @param schema field descriptors
     * @param mode   STRICT rejects undeclared keys, LOOSE ignores them
     * @return the result, carrying at most one violation
     */
    public ValidationResult validateRecord(Map<String, ?> data, Schema schema, ValidationMode mode) {
        return validateRecord(data, schema, mode, null);
    }

    /**
     * Validates a record's data against a schema, stopping at the first violation.
     *
     * @param data         field values
     * @param schema       field descriptors
     * @param mode         STRICT rejects undeclared keys, LOOSE ignores them
     * @param contextLabel label attached to diagnostics (usually the schema name), may be null
     * @return the result, carrying at most one violation
     */
    public ValidationResult validateRecord(
            Map<String, ?> data, Schema schema, ValidationMode mode, String contextLabel) {
        return validate(data, schema, mode, contextLabel, true);
    }

    /**
     * Validates a record's data against a schema and collects every violation. The first
     * violation is the one {@link #validateRecord} would have returned.
     *
     * @param data         field values
     * @param schema       field descriptors
     * @param mode         STRICT rejects undeclared keys, LOOSE ignores them
     * @param contextLabel label attached to diagnostics, may be null
     * @return the result with all violations in discovery order
     */
    public ValidationResult validateRecordExhaustive(
            Map<String, ?> data, Schema schema, ValidationMode mode, String contextLabel) {
        return validate(data, schema, mode, contextLabel, false);
    }

    private ValidationResult validate(
            Map<String, ?> data, Schema schema, ValidationMode mode, String contextLabel, boolean stopAtFirst) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (!settings.enabled()) {
            return ValidationResult.success();
        }

        List<Violation> violations = collectViolations(data, schema, mode, stopAtFirst);
        if (violations.isEmpty()) {
            LOG.debug("Validation passed: context={}, mode={}, fields={}", contextLabel, mode, schema.size());
            return ValidationResult.success();
        }

        Severity severity = mode == ValidationMode.STRICT ? Severity.ERROR : Severity.WARNING;
        for (Violation violation : violations) {
            report(new Diagnostic(
                    severity,
                    violation.kind(),
                    violation.path(),
                    violation.expected(),
                    violation.actual(),
                    contextLabel,
                    violation.message()));
        }
        return ValidationResult.failure(violations);
    }

    private List<Violation> collectViolations(
            Map<String, ?> data, Schema schema, ValidationMode mode, boolean stopAtFirst) {
        List<Violation> violations = new ArrayList<>();
        if (schema.isEmpty()) {
            violations.add(Violation.emptySchema());
            return violations;
        }

        for (Map.Entry<String, TypeDescriptor> entry : schema.fields().entrySet()) {
            String field = entry.getKey();
            TypeDescriptor descriptor = entry.getValue();
            if (!data.containsKey(field)) {
                // An absent nullable field reads as null.
                if (descriptor.nullable()) {
                    continue;
                }
                violations.add(new Violation(
                        ViolationKind.MISSING_FIELD, field, field, descriptor.text(), null, excerpt(data, field)));
            } else {
                Mismatch mismatch = findMismatch(data.get(field), descriptor, field);
                if (mismatch == null) {
                    continue;
                }
                violations.add(new Violation(
                        ViolationKind.TYPE_MISMATCH,
                        field,
                        mismatch.path(),
                        mismatch.expected(),
                        mismatch.actual(),
                        excerpt(data, field)));
            }
            if (stopAtFirst) {
                return violations;
            }
        }

        if (mode == ValidationMode.STRICT) {
            for (Map.Entry<String, ?> entry : data.entrySet()) {
                if (schema.has(entry.getKey())) {
                    continue;
                }
                violations.add(new Violation(
                        ViolationKind.UNEXPECTED_FIELD,
                        entry.getKey(),
                        entry.getKey(),
                        null,
                        ValueKind.nameOf(entry.getValue()),
                        excerpt(data, entry.getKey())));
                if (stopAtFirst) {
                    return violations;
                }
            }
        }
        return violations;
    }

    /**
     * Renders up to {@code neighborExcerpt} fields on each side of {@code field} (in data order).
     * When the field itself is absent the leading fields of the data are used.
     */
    private Map<String, String> excerpt(Map<String, ?> data, String field) {
        int radius = settings.neighborExcerpt();
        Map<String, String> out = new LinkedHashMap<>();
        if (radius == 0 || data.isEmpty()) {
            return out;
        }
        List<String> keys = new ArrayList<>(data.keySet());
        int index = keys.indexOf(field);
        int from = index < 0 ? 0 : Math.max(0, index - radius);
        int to = (int) Math.min(keys.size(), index < 0 ? 2L * radius : (long) index + radius + 1);
        for (int i = from; i < to; i++) {
            String key = keys.get(i);
            if (!key.equals(field)) {
                out.put(key, abbreviate(String.valueOf(data.get(key))));
            }
        }
        return out;
    }

    private static String abbreviate(String text) {
        return text.length() <= MAX_EXCERPT_VALUE_LENGTH ? text : text.substring(0, MAX_EXCERPT_VALUE_LENGTH) + "...";
    }

    /** Reports to the sink; a failing sink is logged and ignored. */
    void report(Diagnostic diagnostic) {
        try {
            diagnosticSink.report(diagnostic);
        } catch (Exception e) {
            LOG.warn("DiagnosticSink.report failed", e);
        }
    }
}
