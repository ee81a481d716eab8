package io.typedrecord.core.engine;

import static io.typedrecord.core.engine.TypeValidatorTest.data;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.typedrecord.core.error.SchemaParseException;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.Schema;
import io.typedrecord.core.model.ValidationMode;
import io.typedrecord.core.spi.RecordFactory;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("SchemaRegistry")
class SchemaRegistryTest {

    private SchemaRegistry registry;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger registryLogger;

    @BeforeEach
    void setUp() {
        registry = new SchemaRegistry();
        registryLogger = (Logger) LoggerFactory.getLogger(SchemaRegistry.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        registryLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        registryLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private static Path schema(String name) throws URISyntaxException {
        return Path.of(SchemaRegistryTest.class.getResource("/schemas/" + name).toURI());
    }

    @Test
    void registerAndLookup() {
        RecordType item = RecordType.of("Item", Schema.builder().field("id", "String").build());

        registry.register(item);

        assertThat(registry.find("Item")).contains(item);
        assertThat(registry.require("Item")).isSameAs(item);
        assertThat(registry.contains("Item")).isTrue();
        assertThat(registry.factory("Item")).isPresent();
        assertThat(registry.find("Nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void requireThrowsForUnknownName() {
        assertThatThrownBy(() -> registry.require("Ghost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No record type registered for name: 'Ghost'");
    }

    @Test
    void lastRegistrationWins() {
        registry.register(RecordType.of("Item", Schema.builder().field("id", "String").build()));
        RecordType replacement = RecordType.of("Item", Schema.builder().field("id", "int").build());

        registry.register(replacement);

        assertThat(registry.require("Item")).isSameAs(replacement);
        assertThat(registry.size()).isEqualTo(1);
        assertThat(logAppender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly(
                        "Registered record type: name=Item, fields=1, extendable=true",
                        "Replaced record type: name=Item");
        assertThat(logAppender.list).allMatch(e -> e.getLevel() == Level.INFO);
    }

    @Test
    void namesAreSorted() {
        registry.register(RecordType.of("Zed", Schema.builder().field("a", "int").build()));
        registry.register(RecordType.of("Alpha", Schema.builder().field("a", "int").build()));

        assertThat(registry.names()).containsExactly("Alpha", "Zed");
    }

    @Test
    void loadsDefinitionFiles() throws URISyntaxException {
        registry.load(schema("item.yaml"));
        registry.load(schema("player.yaml"));
        registry.load(schema("location.json"));

        assertThat(registry.names()).containsExactly("Item", "Location", "Player");
        assertThat(registry.require("Location").extendable()).isFalse();
    }

    @Test
    void loadsInlineContent() {
        RecordType type = registry.load("""
                name: Quest
                fields:
                  title: String
                """, "inline");

        assertThat(registry.require("Quest")).isSameAs(type);
    }

    @Test
    void loadFailureRegistersNothing() {
        assertThatThrownBy(() -> registry.load("name: Broken\n", "inline")).isInstanceOf(SchemaParseException.class);
        assertThat(registry.size()).isZero();
    }

    /** Record subclass produced by a custom factory. */
    static final class Item extends ValidatedRecord {
        Item(TypeValidator validator, RecordType type, Map<String, ?> data, ValidationMode mode) {
            super(validator, type, data, mode);
        }

        String id() {
            return (String) get("id");
        }
    }

    @Test
    @DisplayName("custom factories build nested records")
    void customFactoryIsUsedForNestedRecords() {
        RecordType itemType = RecordType.of("Item", Schema.builder().field("id", "String").build());
        RecordFactory factory = (validator, initialData, mode) -> new Item(validator, itemType, initialData, mode);
        registry.register(itemType, factory);
        RecordType holder = registry.register(RecordType.of("Holder", Schema.builder().field("item", "Item").build()));
        TypeValidator validator = new TypeValidator(registry);

        ValidatedRecord record =
                new ValidatedRecord(validator, holder, data("item", data("id", "gem")), ValidationMode.STRICT);

        assertThat(record.get("item")).isInstanceOf(Item.class);
        assertThat(((Item) record.get("item")).id()).isEqualTo("gem");
    }
}
