package org.javai.springai.weave.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Objects;

/**
 * Expression nodes of a validated program.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = Expression.Identifier.class, name = "Identifier"),
		@JsonSubTypes.Type(value = Expression.StringLiteral.class, name = "String"),
		@JsonSubTypes.Type(value = Expression.TemplateLiteral.class, name = "Template"),
		@JsonSubTypes.Type(value = Expression.NumberLiteral.class, name = "Number"),
		@JsonSubTypes.Type(value = Expression.BooleanLiteral.class, name = "Boolean"),
		@JsonSubTypes.Type(value = Expression.NullLiteral.class, name = "Null"),
		@JsonSubTypes.Type(value = Expression.ObjectLiteral.class, name = "Object"),
		@JsonSubTypes.Type(value = Expression.ArrayLiteral.class, name = "Array"),
		@JsonSubTypes.Type(value = Expression.Assignment.class, name = "Assignment"),
		@JsonSubTypes.Type(value = Expression.Binary.class, name = "Binary"),
		@JsonSubTypes.Type(value = Expression.Unary.class, name = "Unary"),
		@JsonSubTypes.Type(value = Expression.Index.class, name = "Index"),
		@JsonSubTypes.Type(value = Expression.Member.class, name = "Member"),
		@JsonSubTypes.Type(value = Expression.Call.class, name = "Call"),
		@JsonSubTypes.Type(value = Expression.Do.class, name = "Do"),
		@JsonSubTypes.Type(value = Expression.Ask.class, name = "Ask"),
		@JsonSubTypes.Type(value = Expression.Vibe.class, name = "Vibe"),
		@JsonSubTypes.Type(value = Expression.HostBlock.class, name = "HostBlock")
})
public sealed interface Expression {

	record Identifier(String name) implements Expression {
		public Identifier {
			Objects.requireNonNull(name, "name must not be null");
		}
	}

	record StringLiteral(String value) implements Expression {
		public StringLiteral {
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	/**
	 * A string whose {@code {name}} placeholders are replaced by the rendered
	 * values of the named variables when evaluated.
	 */
	record TemplateLiteral(String template) implements Expression {
		public TemplateLiteral {
			Objects.requireNonNull(template, "template must not be null");
		}
	}

	record NumberLiteral(double value) implements Expression {
	}

	record BooleanLiteral(boolean value) implements Expression {
	}

	record NullLiteral() implements Expression {
	}

	record ObjectLiteral(List<ObjectProperty> properties) implements Expression {
		public ObjectLiteral {
			properties = properties != null ? List.copyOf(properties) : List.of();
		}
	}

	record ArrayLiteral(List<Expression> elements) implements Expression {
		public ArrayLiteral {
			elements = elements != null ? List.copyOf(elements) : List.of();
		}
	}

	record Assignment(String target, Expression value) implements Expression {
		public Assignment {
			Objects.requireNonNull(target, "target must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}
	}

	record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
		public Binary {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}
	}

	record Unary(UnaryOperator operator, Expression operand) implements Expression {
		public Unary {
			Objects.requireNonNull(operator, "operator must not be null");
			Objects.requireNonNull(operand, "operand must not be null");
		}
	}

	record Index(Expression target, Expression index) implements Expression {
	}

	record Member(Expression target, String property) implements Expression {
	}

	record Call(Expression callee, List<Expression> arguments) implements Expression {
		public Call {
			Objects.requireNonNull(callee, "callee must not be null");
			arguments = arguments != null ? List.copyOf(arguments) : List.of();
		}
	}

	/**
	 * {@code do prompt model context}: a single AI request whose response is
	 * coerced to the declared type of the receiving variable. A {@code null}
	 * model means the engine default.
	 */
	record Do(Expression prompt, String model, ContextSpecifier context) implements Expression {
		public Do {
			Objects.requireNonNull(prompt, "prompt must not be null");
			context = context != null ? context : ContextSpecifier.defaultContext();
		}
	}

	/**
	 * {@code ask prompt}: solicits input from the user rather than a model.
	 */
	record Ask(Expression prompt, String model, ContextSpecifier context) implements Expression {
		public Ask {
			Objects.requireNonNull(prompt, "prompt must not be null");
			context = context != null ? context : ContextSpecifier.defaultContext();
		}
	}

	/**
	 * {@code vibe prompt}: asks the model for a function declaration, installs
	 * it and calls it with same-named values from the calling scope.
	 */
	record Vibe(Expression prompt, String model, ContextSpecifier context) implements Expression {
		public Vibe {
			Objects.requireNonNull(prompt, "prompt must not be null");
			context = context != null ? context : ContextSpecifier.defaultContext();
		}
	}

	/**
	 * Inline host-language code evaluated by the driver. {@code params} names
	 * the variables whose values are handed to the code.
	 */
	record HostBlock(List<String> params, String body) implements Expression {
		public HostBlock {
			Objects.requireNonNull(body, "body must not be null");
			params = params != null ? List.copyOf(params) : List.of();
		}
	}
}
