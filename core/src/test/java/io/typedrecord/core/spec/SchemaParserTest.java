package io.typedrecord.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.typedrecord.core.error.DescriptorParseException;
import io.typedrecord.core.error.SchemaParseException;
import io.typedrecord.core.error.TypedRecordException;
import io.typedrecord.core.model.RecordType;
import io.typedrecord.core.model.TypeDescriptor;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SchemaParser")
class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser();

    @TempDir
    Path tempDir;

    private static Path resource(String name) {
        try {
            return Path.of(SchemaParserTest.class.getResource("/schemas/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("valid definitions")
    class Valid {

        @Test
        void parsesYamlFile() {
            RecordType type = parser.parse(resource("player.yaml"));

            assertThat(type.name()).isEqualTo("Player");
            assertThat(type.description()).isEqualTo("A playable character");
            assertThat(type.extendable()).isTrue();
            assertThat(type.baseSchema().fieldNames()).containsExactly("name", "level", "health", "inventory", "home");
            assertThat(type.baseSchema().descriptor("inventory"))
                    .isEqualTo(new TypeDescriptor.ArrayOf(new TypeDescriptor.SchemaRef("Item", false), false));
            assertThat(type.baseSchema().descriptor("home").nullable()).isTrue();
        }

        @Test
        void parsesJsonFile() {
            RecordType type = parser.parse(resource("location.json"));

            assertThat(type.name()).isEqualTo("Location");
            assertThat(type.extendable()).isFalse();
            assertThat(type.description()).isNull();
            assertThat(type.baseSchema().toDescriptorMap()).containsKeys("x", "y", "label");
        }

        @Test
        void extendableDefaultsToTrue() {
            RecordType type = parser.parse("""
                    name: Item
                    fields:
                      id: String
                    """, "inline");

            assertThat(type.extendable()).isTrue();
        }

        @Test
        void emptyFieldsBlockGivesEmptySchema() {
            RecordType type = parser.parse("""
                    name: Bag
                    fields: {}
                    """, "inline");

            assertThat(type.baseSchema().isEmpty()).isTrue();
        }

        @Test
        void parsesFileFromTempDir() throws IOException {
            Path file = tempDir.resolve("stats.yaml");
            Files.writeString(file, """
                    name: Stats
                    fields:
                      scores: Array<float>
                      meta: Dictionary?
                    """);

            RecordType type = parser.parse(file);

            assertThat(type.baseSchema().fieldNames()).containsExactly("scores", "meta");
        }
    }

    @Nested
    @DisplayName("invalid definitions")
    class Invalid {

        @Test
        void unknownRootKey() {
            assertThatThrownBy(() -> parser.parse(resource("unknown-key.yaml")))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Unknown key in schema definition: [version]")
                    .satisfies(e -> {
                        SchemaParseException ex = (SchemaParseException) e;
                        assertThat(ex.schemaName()).isEqualTo("Broken");
                        assertThat(ex.source()).endsWith("unknown-key.yaml");
                        assertThat(ex.phase()).isEqualTo(TypedRecordException.Phase.LOAD);
                    });
        }

        @Test
        void malformedDescriptorKeepsCause() {
            assertThatThrownBy(() -> parser.parse(resource("bad-descriptor.yaml")))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Invalid descriptor for field 'a'")
                    .hasCauseInstanceOf(DescriptorParseException.class);
        }

        @Test
        void missingFieldsBlock() {
            assertThatThrownBy(() -> parser.parse(resource("missing-fields.yaml")))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Invalid schema definition");
        }

        @Test
        void nonStringDescriptor() {
            assertThatThrownBy(() -> parser.parse("""
                    name: Broken
                    fields:
                      a: 12
                    """, "inline"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Invalid schema definition");
        }

        @Test
        void invalidName() {
            assertThatThrownBy(() -> parser.parse("""
                    name: "not a name"
                    fields:
                      a: int
                    """, "inline"))
                    .isInstanceOf(SchemaParseException.class);
        }

        @Test
        void reservedFieldName() {
            assertThatThrownBy(() -> parser.parse("""
                    name: Broken
                    fields:
                      _mod_data: Dictionary
                    """, "inline"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("reserved");
        }

        @Test
        void notAMapping() {
            assertThatThrownBy(() -> parser.parse("- a\n- b\n", "inline"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("must be a YAML mapping");
        }

        @Test
        void unreadableYaml() {
            assertThatThrownBy(() -> parser.parse("name: [unclosed", "inline"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Failed to parse YAML");
        }

        @Test
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageStartingWith("Failed to read or parse YAML");
        }
    }
}
