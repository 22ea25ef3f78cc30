package org.javai.springai.weave.exec;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.javai.springai.weave.EngineFaultException;
import org.javai.springai.weave.ast.BinaryOperator;
import org.javai.springai.weave.ast.UnaryOperator;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;

/**
 * Operator semantics over {@link Value}. Short-circuit {@code and}/{@code or}
 * are handled by the step engine and never reach {@link #binary}.
 */
final class Operators {

	private Operators() {
	}

	static Value binary(BinaryOperator operator, Value left, Value right) {
		return switch (operator) {
			case ADD -> add(left, right);
			case SUBTRACT -> Value.number(number(left, operator) - number(right, operator));
			case MULTIPLY -> Value.number(number(left, operator) * number(right, operator));
			case DIVIDE -> {
				double divisor = number(right, operator);
				if (divisor == 0) {
					throw new EngineFaultException("Division by zero");
				}
				yield Value.number(number(left, operator) / divisor);
			}
			case MODULO -> {
				double divisor = number(right, operator);
				if (divisor == 0) {
					throw new EngineFaultException("Division by zero");
				}
				yield Value.number(number(left, operator) % divisor);
			}
			case EQUAL -> Value.bool(Values.areEqual(left, right));
			case NOT_EQUAL -> Value.bool(!Values.areEqual(left, right));
			case LESS -> Value.bool(compare(left, right, operator) < 0);
			case LESS_EQUAL -> Value.bool(compare(left, right, operator) <= 0);
			case GREATER -> Value.bool(compare(left, right, operator) > 0);
			case GREATER_EQUAL -> Value.bool(compare(left, right, operator) >= 0);
			case AND -> Value.bool(Values.isTruthy(left) && Values.isTruthy(right));
			case OR -> Value.bool(Values.isTruthy(left) || Values.isTruthy(right));
		};
	}

	static Value unary(UnaryOperator operator, Value operand) {
		return switch (operator) {
			case NOT -> Value.bool(!Values.isTruthy(operand));
			case NEGATE -> {
				if (!(operand instanceof Value.Num num)) {
					throw new EngineFaultException("Cannot negate a " + Values.typeName(operand) + " value");
				}
				yield Value.number(-num.value());
			}
		};
	}

	static Value index(Value target, Value index) {
		if (target instanceof Value.Array array) {
			int i = integerIndex(index);
			return i >= 0 && i < array.elements().size() ? array.elements().get(i) : Value.NULL;
		}
		if (target instanceof Value.Json json) {
			JsonNode node = json.node();
			if (node.isArray()) {
				return Values.fromJsonNode(node.get(integerIndex(index)));
			}
			if (index instanceof Value.Text key) {
				return Values.fromJsonNode(node.get(key.value()));
			}
			throw new EngineFaultException("JSON objects are indexed by text keys, got " + Values.typeName(index));
		}
		if (target instanceof Value.Text text) {
			int i = integerIndex(index);
			return i >= 0 && i < text.value().length() ? Value.text(String.valueOf(text.value().charAt(i))) : Value.NULL;
		}
		throw new EngineFaultException("Cannot index a " + Values.typeName(target) + " value");
	}

	static Value member(Value target, String property) {
		if (target instanceof Value.Json json) {
			JsonNode node = json.node();
			if (node.isArray() && "length".equals(property)) {
				return Value.number(node.size());
			}
			return Values.fromJsonNode(node.get(property));
		}
		if ("length".equals(property)) {
			if (target instanceof Value.Array array) {
				return Value.number(array.elements().size());
			}
			if (target instanceof Value.Text text) {
				return Value.number(text.value().length());
			}
		}
		throw new EngineFaultException("Cannot read property '" + property + "' of a " + Values.typeName(target) + " value");
	}

	private static Value add(Value left, Value right) {
		if (left instanceof Value.Num l && right instanceof Value.Num r) {
			return Value.number(l.value() + r.value());
		}
		if (left.kind() == Value.Kind.TEXT || right.kind() == Value.Kind.TEXT) {
			return Value.text(Values.render(left) + Values.render(right));
		}
		if (left instanceof Value.Array l && right instanceof Value.Array r) {
			List<Value> joined = new ArrayList<>(l.elements());
			joined.addAll(r.elements());
			return Value.array(joined);
		}
		throw new EngineFaultException("Cannot add " + Values.typeName(left) + " and " + Values.typeName(right));
	}

	private static double number(Value value, BinaryOperator operator) {
		if (value instanceof Value.Num num) {
			return num.value();
		}
		throw new EngineFaultException("Operator '" + operator.symbol() + "' needs numbers, got " + Values.typeName(value));
	}

	private static int compare(Value left, Value right, BinaryOperator operator) {
		if (left instanceof Value.Num l && right instanceof Value.Num r) {
			return Double.compare(l.value(), r.value());
		}
		if (left instanceof Value.Text l && right instanceof Value.Text r) {
			return l.value().compareTo(r.value());
		}
		throw new EngineFaultException("Operator '" + operator.symbol() + "' cannot compare "
				+ Values.typeName(left) + " and " + Values.typeName(right));
	}

	private static int integerIndex(Value index) {
		if (index instanceof Value.Num num && num.value() == Math.rint(num.value())) {
			return (int) num.value();
		}
		throw new EngineFaultException("Index must be an integer, got " + Values.render(index));
	}
}
