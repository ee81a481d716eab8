package io.typedrecord.core.engine;

import static io.typedrecord.core.engine.TypeValidatorTest.data;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedrecord.core.diagnostics.CollectingDiagnosticSink;
import io.typedrecord.core.model.RecordState;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.Schema;
import io.typedrecord.core.model.ValidationMode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RecordCodec")
class RecordCodecTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private TypeValidator validator;
    private RecordCodec codec;
    private RecordType player;

    @BeforeEach
    void setUp() {
        SchemaRegistry registry = new SchemaRegistry();
        registry.register(RecordType.of(
                "Item", Schema.builder().field("id", "String").field("quantity", "int").build()));
        player = registry.register(RecordType.of(
                "Player",
                Schema.builder()
                        .field("name", "String")
                        .field("health", "float")
                        .field("inventory", "Array<Item>")
                        .build()));
        validator = new TypeValidator(registry, new CollectingDiagnosticSink());
        codec = new RecordCodec(validator);
    }

    @Test
    void readsRecordWithNestedItems() {
        ValidatedRecord record = codec.readRecord("""
                {"name": "Hero", "health": 10, "inventory": [{"id": "potion", "quantity": 2}]}
                """, "Player", ValidationMode.STRICT);

        assertThat(record.state()).isEqualTo(RecordState.VALID);
        assertThat(record.get("health")).isEqualTo(10);
        assertThat((List<?>) record.get("inventory")).singleElement().isInstanceOf(ValidatedRecord.class);
    }

    @Test
    void decimalsBecomeFloatingPoint() {
        Map<String, Object> parsed = codec.readData("{\"a\": 1.5, \"b\": 2}");

        assertThat(parsed.get("a")).isEqualTo(1.5);
        assertThat(parsed.get("b")).isEqualTo(2);
        assertThat(validator.check(parsed.get("a"), "float")).isTrue();
        assertThat(validator.check(parsed.get("b"), "int")).isTrue();
    }

    @Test
    void writesPersistedForm() throws Exception {
        ValidatedRecord record = new ValidatedRecord(
                validator,
                player,
                data("name", "Hero", "health", 2.5, "inventory", List.of(data("id", "gem", "quantity", 1))),
                ValidationMode.STRICT);
        record.setNamespacedData("modA", "seen", true);

        JsonNode json = codec.toJson(record);

        assertThat(json).isEqualTo(JSON.readTree("""
                {"name": "Hero", "health": 2.5, "inventory": [{"id": "gem", "quantity": 1}],
                 "_mod_data": {"modA": {"seen": true}}}
                """));
    }

    @Test
    void jsonRoundTripReconstructsAnEqualRecord() {
        ValidatedRecord original = new ValidatedRecord(
                validator,
                player,
                data("name", "Hero", "health", 2.5, "inventory", List.of()),
                ValidationMode.STRICT);

        ValidatedRecord decoded = codec.readRecord(codec.toJsonString(original), "Player", ValidationMode.STRICT);

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void invalidDocumentIsRejectedNotThrown() {
        ValidatedRecord record = codec.readRecord("{\"name\": 5}", "Player");

        assertThat(record.state()).isEqualTo(RecordState.REJECTED);
    }

    @Test
    void malformedJsonThrows() {
        assertThatThrownBy(() -> codec.readData("{not json")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.readData(JSON.readTree("[1, 2]")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be an object");
    }

    @Test
    void unknownSchemaThrows() {
        assertThatThrownBy(() -> codec.readRecord("{}", "Ghost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'Ghost'");
    }
}
