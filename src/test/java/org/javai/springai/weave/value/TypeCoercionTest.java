package org.javai.springai.weave.value;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TypeCoercion")
class TypeCoercionTest {

	@Nested
	@DisplayName("parsing responses")
	class ParsingResponses {

		@Test
		@DisplayName("should keep the response as text without a target type")
		void shouldKeepTextWithoutTarget() {
			assertThat(TypeCoercion.parseResponse(" hello ", null)).isEqualTo(Value.text(" hello "));
		}

		@Test
		@DisplayName("should parse numbers with surrounding whitespace")
		void shouldParseNumber() {
			assertThat(TypeCoercion.parseResponse(" 42.5\n", TargetType.NUMBER)).isEqualTo(Value.number(42.5));
		}

		@Test
		@DisplayName("should reject a number written in words")
		void shouldRejectWordNumber() {
			assertThatThrownBy(() -> TypeCoercion.parseResponse("four", TargetType.NUMBER))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessageContaining("\"four\"")
					.satisfies(e -> assertThat(((TypeCoercionException) e).expectedType()).isEqualTo("number"));
		}

		@Test
		@DisplayName("should reject non-finite numbers")
		void shouldRejectNonFiniteNumbers() {
			assertThatThrownBy(() -> TypeCoercion.parseResponse("NaN", TargetType.NUMBER))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessageContaining("finite");
		}

		@Test
		@DisplayName("should accept booleans case-insensitively")
		void shouldParseBoolean() {
			assertThat(TypeCoercion.parseResponse("TRUE", TargetType.BOOLEAN)).isEqualTo(Value.bool(true));
			assertThat(TypeCoercion.parseResponse(" false ", TargetType.BOOLEAN)).isEqualTo(Value.bool(false));
			assertThatThrownBy(() -> TypeCoercion.parseResponse("yes", TargetType.BOOLEAN))
					.isInstanceOf(TypeCoercionException.class);
		}

		@Test
		@DisplayName("should parse json objects and reject json scalars")
		void shouldParseJson() {
			Value value = TypeCoercion.parseResponse("{\"city\":\"Paris\",\"pop\":2}", TargetType.JSON);

			assertThat(value).isInstanceOf(Value.Json.class);
			JsonNode node = ((Value.Json) value).node();
			assertThat(node.get("city").asText()).isEqualTo("Paris");

			assertThatThrownBy(() -> TypeCoercion.parseResponse("12", TargetType.JSON))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessageContaining("object or array");
		}

		@Test
		@DisplayName("should parse typed arrays element by element")
		void shouldParseTypedArrays() {
			Value value = TypeCoercion.parseResponse("[1, \"2\", 3]", TargetType.NUMBER_ARRAY);

			assertThat(value).isEqualTo(Value.array(List.of(Value.number(1), Value.number(2), Value.number(3))));
		}

		@Test
		@DisplayName("should reject an array with an element of the wrong type")
		void shouldRejectBadArrayElement() {
			assertThatThrownBy(() -> TypeCoercion.parseResponse("[true, 1]", TargetType.BOOLEAN_ARRAY))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessageContaining("number value to a variable of type boolean");
		}

		@Test
		@DisplayName("should reject a json object where an array is required")
		void shouldRejectObjectForArray() {
			assertThatThrownBy(() -> TypeCoercion.parseResponse("{\"a\":1}", TargetType.TEXT_ARRAY))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessageContaining("Expected array");
		}
	}

	@Nested
	@DisplayName("coercing declared variables")
	class CoercingDeclaredVariables {

		@Test
		@DisplayName("should pass values through when no type is declared")
		void shouldPassThroughUntyped() {
			Value value = Value.number(3);

			assertThat(TypeCoercion.coerce(value, (String) null)).isSameAs(value);
		}

		@Test
		@DisplayName("should let null through any declared type")
		void shouldAllowNull() {
			assertThat(TypeCoercion.coerce(Value.NULL, "number")).isEqualTo(Value.NULL);
		}

		@Test
		@DisplayName("should require a model reference for model variables")
		void shouldRequireModelReference() {
			assertThatThrownBy(() -> TypeCoercion.coerce(Value.text("gpt"), "model"))
					.isInstanceOf(TypeCoercionException.class)
					.hasMessage("Cannot assign a text value to a variable of type model");
		}

		@Test
		@DisplayName("should require text for prompt variables")
		void shouldRequireTextForPrompt() {
			assertThat(TypeCoercion.coerce(Value.text("Be brief"), "prompt")).isEqualTo(Value.text("Be brief"));
			assertThatThrownBy(() -> TypeCoercion.coerce(Value.number(1), "prompt"))
					.isInstanceOf(TypeCoercionException.class);
		}

		@Test
		@DisplayName("should not turn numbers into text")
		void shouldNotStringifyNumbers() {
			assertThatThrownBy(() -> TypeCoercion.coerce(Value.number(1), "text"))
					.isInstanceOf(TypeCoercionException.class);
		}

		@Test
		@DisplayName("should wrap an array value as json for json variables")
		void shouldWrapArrayAsJson() {
			Value value = TypeCoercion.coerce(Value.array(List.of(Value.text("a"))), "json");

			assertThat(value).isInstanceOf(Value.Json.class);
			assertThat(((Value.Json) value).node().toString()).isEqualTo("[\"a\"]");
		}

		@Test
		@DisplayName("should leave unknown annotations alone")
		void shouldIgnoreUnknownAnnotation() {
			Value value = Value.text("x");

			assertThat(TypeCoercion.coerce(value, "Customer")).isSameAs(value);
		}
	}
}
