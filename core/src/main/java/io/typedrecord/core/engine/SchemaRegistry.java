package io.typedrecord.core.engine;

import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.spec.SchemaParser;
import io.typedrecord.core.spi.RecordFactory;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of named record types, used to resolve schema references in descriptors and to build
 * nested records. Populated at startup by whoever owns the schema set; the registry makes no
 * assumption about where definitions come from.
 *
 * <p>
 * Thread-safe. Registration and lookup can happen concurrently. Registering a name twice
 * replaces the earlier entry (last-write-wins).
 */
public final class SchemaRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final SchemaParser parser = new SchemaParser();

    /** A registered type and the factory used to construct its records. */
    public record Entry(RecordType type, RecordFactory factory) {
        public Entry {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(factory, "factory must not be null");
        }
    }

    /**
     * Registers a record type with the default factory ({@link RecordFactory#of}).
     *
     * @param type the record type to register
     * @return the registered type
     * @throws NullPointerException if type is null
     */
    public RecordType register(RecordType type) {
        Objects.requireNonNull(type, "type must not be null");
        return register(type, RecordFactory.of(type));
    }

    /**
     * Registers a record type with a custom factory, e.g. one producing a subclass of
     * {@link ValidatedRecord}.
     *
     * @param type    the record type
     * @param factory constructor for records of this type
     * @return the registered type
     * @throws NullPointerException if type or factory is null
     */
    public RecordType register(RecordType type, RecordFactory factory) {
        Entry previous = entries.put(type.name(), new Entry(type, factory));
        if (previous != null) {
            LOG.info("Replaced record type: name={}", type.name());
        } else {
            LOG.info(
                    "Registered record type: name={}, fields={}, extendable={}",
                    type.name(),
                    type.baseSchema().size(),
                    type.extendable());
        }
        return type;
    }

    /**
     * Parses a schema definition file and registers the resulting type.
     *
     * @param path path to a YAML or JSON schema definition
     * @return the registered type
     * @throws io.typedrecord.core.error.SchemaParseException if the document is invalid
     */
    public RecordType load(Path path) {
        return register(parser.parse(path));
    }

    /**
     * Parses schema definition content and registers the resulting type.
     *
     * @param content YAML or JSON document
     * @param source  label used in error messages (file name, resource name)
     * @return the registered type
     * @throws io.typedrecord.core.error.SchemaParseException if the document is invalid
     */
    public RecordType load(String content, String source) {
        return register(parser.parse(content, source));
    }

    /** Looks up a type by name. */
    public Optional<RecordType> find(String name) {
        Entry entry = name != null ? entries.get(name) : null;
        return Optional.ofNullable(entry).map(Entry::type);
    }

    /**
     * Looks up a type by name, throwing if not found.
     *
     * @throws IllegalArgumentException if no type is registered under {@code name}
     */
    public RecordType require(String name) {
        return find(name)
                .orElseThrow(() -> new IllegalArgumentException("No record type registered for name: '" + name + "'"));
    }

    /** Looks up the factory registered for {@code name}. */
    public Optional<RecordFactory> factory(String name) {
        Entry entry = name != null ? entries.get(name) : null;
        return Optional.ofNullable(entry).map(Entry::factory);
    }

    /** Returns {@code true} if a type is registered under {@code name}. */
    public boolean contains(String name) {
        return name != null && entries.containsKey(name);
    }

    /** Registered names, sorted. */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(entries.keySet()));
    }

    /** Returns the number of registered types. */
    public int size() {
        return entries.size();
    }
}
