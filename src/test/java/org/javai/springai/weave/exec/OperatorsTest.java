package org.javai.springai.weave.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.springai.weave.EngineFaultException;
import org.javai.springai.weave.ast.BinaryOperator;
import org.javai.springai.weave.ast.UnaryOperator;
import org.javai.springai.weave.value.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Operators")
class OperatorsTest {

	@Nested
	@DisplayName("binary")
	class Binary {

		@Test
		@DisplayName("should add numbers and concatenate text")
		void shouldAdd() {
			assertThat(Operators.binary(BinaryOperator.ADD, Value.number(2), Value.number(3))).isEqualTo(Value.number(5));
			assertThat(Operators.binary(BinaryOperator.ADD, Value.text("n="), Value.number(3))).isEqualTo(Value.text("n=3"));
		}

		@Test
		@DisplayName("should join arrays")
		void shouldJoinArrays() {
			Value joined = Operators.binary(BinaryOperator.ADD,
					Value.array(List.of(Value.number(1))), Value.array(List.of(Value.number(2))));

			assertThat(joined).isEqualTo(Value.array(List.of(Value.number(1), Value.number(2))));
		}

		@Test
		@DisplayName("should fail on division by zero")
		void shouldRejectDivisionByZero() {
			assertThatThrownBy(() -> Operators.binary(BinaryOperator.DIVIDE, Value.number(1), Value.number(0)))
					.isInstanceOf(EngineFaultException.class)
					.hasMessage("Division by zero");
		}

		@Test
		@DisplayName("should fail on arithmetic over text")
		void shouldRejectArithmeticOnText() {
			assertThatThrownBy(() -> Operators.binary(BinaryOperator.MULTIPLY, Value.text("a"), Value.number(2)))
					.isInstanceOf(EngineFaultException.class)
					.hasMessage("Operator '*' needs numbers, got text");
		}

		@Test
		@DisplayName("should compare json structurally")
		void shouldCompareJsonStructurally() {
			ObjectNode left = JsonNodeFactory.instance.objectNode().put("a", 1);
			ObjectNode right = JsonNodeFactory.instance.objectNode().put("a", 1);

			assertThat(Operators.binary(BinaryOperator.EQUAL, new Value.Json(left), new Value.Json(right)))
					.isEqualTo(Value.bool(true));
			assertThat(Operators.binary(BinaryOperator.NOT_EQUAL, Value.number(1), Value.text("1")))
					.isEqualTo(Value.bool(true));
		}

		@Test
		@DisplayName("should order numbers and text but not mixed values")
		void shouldOrderValues() {
			assertThat(Operators.binary(BinaryOperator.LESS, Value.number(1), Value.number(2))).isEqualTo(Value.bool(true));
			assertThat(Operators.binary(BinaryOperator.GREATER_EQUAL, Value.text("b"), Value.text("a")))
					.isEqualTo(Value.bool(true));
			assertThatThrownBy(() -> Operators.binary(BinaryOperator.LESS, Value.number(1), Value.text("2")))
					.isInstanceOf(EngineFaultException.class)
					.hasMessageContaining("cannot compare number and text");
		}
	}

	@Nested
	@DisplayName("unary")
	class Unary {

		@Test
		@DisplayName("should negate numbers only")
		void shouldNegate() {
			assertThat(Operators.unary(UnaryOperator.NEGATE, Value.number(4))).isEqualTo(Value.number(-4));
			assertThatThrownBy(() -> Operators.unary(UnaryOperator.NEGATE, Value.text("4")))
					.isInstanceOf(EngineFaultException.class);
		}

		@Test
		@DisplayName("should invert truthiness")
		void shouldNot() {
			assertThat(Operators.unary(UnaryOperator.NOT, Value.text(""))).isEqualTo(Value.bool(true));
			assertThat(Operators.unary(UnaryOperator.NOT, Value.number(7))).isEqualTo(Value.bool(false));
		}
	}

	@Nested
	@DisplayName("index and member access")
	class Access {

		@Test
		@DisplayName("should return null for an out-of-range array index")
		void shouldReturnNullOutOfRange() {
			Value array = Value.array(List.of(Value.text("a")));

			assertThat(Operators.index(array, Value.number(0))).isEqualTo(Value.text("a"));
			assertThat(Operators.index(array, Value.number(5))).isEqualTo(Value.NULL);
		}

		@Test
		@DisplayName("should reject fractional indexes")
		void shouldRejectFractionalIndex() {
			assertThatThrownBy(() -> Operators.index(Value.array(List.of()), Value.number(0.5)))
					.isInstanceOf(EngineFaultException.class)
					.hasMessage("Index must be an integer, got 0.5");
		}

		@Test
		@DisplayName("should read json properties by key and by member")
		void shouldReadJsonProperties() {
			Value json = new Value.Json(JsonNodeFactory.instance.objectNode().put("name", "Ada").put("age", 36));

			assertThat(Operators.index(json, Value.text("name"))).isEqualTo(Value.text("Ada"));
			assertThat(Operators.member(json, "age")).isEqualTo(Value.number(36));
			assertThat(Operators.member(json, "missing")).isEqualTo(Value.NULL);
		}

		@Test
		@DisplayName("should report length of arrays and text")
		void shouldReportLength() {
			assertThat(Operators.member(Value.text("abc"), "length")).isEqualTo(Value.number(3));
			assertThat(Operators.member(Value.array(List.of(Value.NULL, Value.NULL)), "length")).isEqualTo(Value.number(2));
			assertThatThrownBy(() -> Operators.member(Value.number(1), "length"))
					.isInstanceOf(EngineFaultException.class)
					.hasMessage("Cannot read property 'length' of a number value");
		}
	}
}
