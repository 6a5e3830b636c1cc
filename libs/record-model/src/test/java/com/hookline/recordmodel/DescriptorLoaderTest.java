package com.hookline.recordmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DescriptorLoader")
class DescriptorLoaderTest {

    private static DescriptorCatalog load(String json) {
        return new DescriptorLoader().addJson("test.json", json).load();
    }

    @Nested
    @DisplayName("type expressions")
    class TypeExpressions {

        @Test
        @DisplayName("scalar labels map to scalar fields")
        void scalars() {
            FieldSpec spec = DescriptorLoader.parseType("t", "id", "integer");

            assertThat(spec.kind()).isEqualTo(FieldKind.SCALAR);
            assertThat(spec.scalarType()).isEqualTo(ScalarType.INTEGER);
            assertThat(spec.required()).isTrue();
            assertThat(spec.nullable()).isFalse();
        }

        @Test
        @DisplayName("question mark makes a field optional")
        void optional() {
            FieldSpec spec = DescriptorLoader.parseType("t", "sender", "User?");

            assertThat(spec.kind()).isEqualTo(FieldKind.RECORD);
            assertThat(spec.recordRef()).isEqualTo("User");
            assertThat(spec.required()).isFalse();
            assertThat(spec.nullable()).isTrue();
        }

        @Test
        @DisplayName("|null keeps a field required but nullable")
        void requiredNullable() {
            FieldSpec spec = DescriptorLoader.parseType("t", "merged_at", "string|null");

            assertThat(spec.required()).isTrue();
            assertThat(spec.nullable()).isTrue();
        }

        @Test
        @DisplayName("brackets declare lists of scalars or records")
        void lists() {
            assertThat(DescriptorLoader.parseType("t", "labels", "[Label]").kind()).isEqualTo(FieldKind.RECORD_LIST);
            assertThat(DescriptorLoader.parseType("t", "added", "[string]?").kind()).isEqualTo(FieldKind.SCALAR_LIST);
        }

        @Test
        @DisplayName("map declares an open map")
        void map() {
            assertThat(DescriptorLoader.parseType("t", "changes", "map?").kind()).isEqualTo(FieldKind.OPEN_MAP);
        }

        @Test
        @DisplayName("garbage type expression is rejected")
        void garbage() {
            assertThatThrownBy(() -> DescriptorLoader.parseType("t", "x", "not a type"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("not a type");
        }
    }

    @Nested
    @DisplayName("documents")
    class Documents {

        @Test
        @DisplayName("loads a classpath resource")
        void classpath() {
            DescriptorCatalog catalog = DescriptorLoader.fromClasspath("descriptors/sample.json");

            assertThat(catalog.names()).containsExactly("User", "Label", "Base", "LabelEvent");
        }

        @Test
        @DisplayName("object form carries alias and default")
        void objectForm() {
            DescriptorCatalog catalog = DescriptorLoader.fromClasspath("descriptors/sample.json");

            assertThat(catalog.require("LabelEvent").field("links").orElseThrow().wireAlias()).isEqualTo("_links");
            assertThat(catalog.require("Label").field("color").orElseThrow().defaultValue()).isEqualTo("ffffff");
        }

        @Test
        @DisplayName("extends puts parent fields first")
        void inheritance() {
            RecordDescriptor event = DescriptorLoader.fromClasspath("descriptors/sample.json").require("LabelEvent");

            assertThat(event.fields())
                    .extracting(FieldSpec::name)
                    .containsExactly("action", "sender", "label", "changes", "links");
        }

        @Test
        @DisplayName("child field replaces the parent's in place")
        void override() {
            DescriptorCatalog catalog =
                    load("""
                            {"P": {"fields": {"a": "string?", "b": "string?"}},
                             "C": {"extends": "P", "fields": {"a": "integer", "c": "boolean?"}}}
                            """);

            RecordDescriptor child = catalog.require("C");
            assertThat(child.fields()).extracting(FieldSpec::name).containsExactly("a", "b", "c");
            assertThat(child.field("a").orElseThrow().scalarType()).isEqualTo(ScalarType.INTEGER);
            assertThat(child.field("a").orElseThrow().required()).isTrue();
        }

        @Test
        @DisplayName("parents may live in another document")
        void crossDocument() {
            DescriptorCatalog catalog =
                    new DescriptorLoader()
                            .addJson("a.json", "{\"P\": {\"fields\": {\"a\": \"string\"}}}")
                            .add("b.json", new ByteArrayInputStream(
                                    "{\"C\": {\"extends\": \"P\"}}".getBytes(StandardCharsets.UTF_8)))
                            .load();

            assertThat(catalog.require("C").requiredFieldNames()).containsExactly("a");
        }

        @Test
        @DisplayName("loaded descriptors validate payloads")
        void validates() {
            DescriptorCatalog catalog = DescriptorLoader.fromClasspath("descriptors/sample.json");
            var validator = new RecordValidator(catalog);

            var result = validator.validate(
                    "LabelEvent",
                    java.util.Map.of("action", "created", "label", java.util.Map.of("name", "bug")));

            assertThat(result.valid()).isTrue();
            assertThat(result.record().getRecord("label").getString("color")).isEqualTo("ffffff");
        }
    }

    @Nested
    @DisplayName("malformed documents")
    class Malformed {

        @Test
        @DisplayName("missing resource")
        void missingResource() {
            assertThatThrownBy(() -> DescriptorLoader.fromClasspath("descriptors/nope.json"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("invalid JSON")
        void invalidJson() {
            assertThatThrownBy(() -> load("{not json"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("test.json");
        }

        @Test
        @DisplayName("unknown parent")
        void unknownParent() {
            assertThatThrownBy(() -> load("{\"C\": {\"extends\": \"Missing\"}}"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("Missing");
        }

        @Test
        @DisplayName("inheritance cycle")
        void cycle() {
            assertThatThrownBy(() -> load("{\"A\": {\"extends\": \"B\"}, \"B\": {\"extends\": \"A\"}}"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("cycle");
        }

        @Test
        @DisplayName("dangling record reference")
        void danglingReference() {
            assertThatThrownBy(() -> load("{\"A\": {\"fields\": {\"owner\": \"Ghost\"}}}"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("Ghost");
        }

        @Test
        @DisplayName("unknown keys in a definition")
        void unknownKey() {
            assertThatThrownBy(() -> load("{\"A\": {\"fieldz\": {}}}"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("fieldz");
        }

        @Test
        @DisplayName("duplicate descriptor across documents")
        void duplicate() {
            assertThatThrownBy(() -> new DescriptorLoader()
                            .addJson("a.json", "{\"A\": {}}")
                            .addJson("b.json", "{\"A\": {}}"))
                    .isInstanceOf(DescriptorFormatException.class)
                    .hasMessageContaining("already defined");
        }
    }
}
