package org.javai.springai.weave.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import java.util.Objects;

/**
 * Statement nodes of a validated program.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = Statement.Let.class, name = "Let"),
		@JsonSubTypes.Type(value = Statement.Const.class, name = "Const"),
		@JsonSubTypes.Type(value = Statement.Model.class, name = "Model"),
		@JsonSubTypes.Type(value = Statement.FunctionDecl.class, name = "Function"),
		@JsonSubTypes.Type(value = Statement.Import.class, name = "Import"),
		@JsonSubTypes.Type(value = Statement.Export.class, name = "Export"),
		@JsonSubTypes.Type(value = Statement.Return.class, name = "Return"),
		@JsonSubTypes.Type(value = Statement.If.class, name = "If"),
		@JsonSubTypes.Type(value = Statement.While.class, name = "While"),
		@JsonSubTypes.Type(value = Statement.ForIn.class, name = "ForIn"),
		@JsonSubTypes.Type(value = Statement.Break.class, name = "Break"),
		@JsonSubTypes.Type(value = Statement.Continue.class, name = "Continue"),
		@JsonSubTypes.Type(value = Statement.Block.class, name = "Block"),
		@JsonSubTypes.Type(value = Statement.ExpressionStatement.class, name = "Expression")
})
public sealed interface Statement {

	/**
	 * {@code let name: type = initializer}; a missing initializer binds null.
	 */
	record Let(String name, String type, Expression initializer) implements Statement {
		public Let {
			Objects.requireNonNull(name, "name must not be null");
		}
	}

	record Const(String name, String type, Expression initializer) implements Statement {
		public Const {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(initializer, "a const needs an initializer");
		}
	}

	/**
	 * A model declaration. The bound value is a model reference typed
	 * {@code model}, which never appears in AI context.
	 */
	record Model(String name, String modelName, String provider, String url, String apiKeyEnv,
			Integer maxRetriesOnError, List<String> tools) implements Statement {
		public Model {
			Objects.requireNonNull(name, "name must not be null");
			tools = tools != null ? List.copyOf(tools) : List.of();
		}
	}

	record FunctionDecl(String name, List<Parameter> params, String returnType, List<Statement> body)
			implements Statement {
		public FunctionDecl {
			Objects.requireNonNull(name, "name must not be null");
			params = params != null ? List.copyOf(params) : List.of();
			body = body != null ? List.copyOf(body) : List.of();
		}
	}

	/**
	 * Imports names from a module. Imports are resolved by the module loader
	 * before execution; at run time the statement is a no-op.
	 */
	record Import(List<ImportSpecifier> specifiers, String source) implements Statement {
		public Import {
			Objects.requireNonNull(source, "source must not be null");
			specifiers = specifiers != null ? List.copyOf(specifiers) : List.of();
		}
	}

	/**
	 * Marks a declaration as visible to importing modules.
	 */
	record Export(Statement declaration) implements Statement {
		public Export {
			if (!(declaration instanceof Let || declaration instanceof Const
					|| declaration instanceof Model || declaration instanceof FunctionDecl)) {
				throw new IllegalArgumentException("only declarations can be exported");
			}
		}

		public String name() {
			if (declaration instanceof Let let) {
				return let.name();
			}
			if (declaration instanceof Const constant) {
				return constant.name();
			}
			if (declaration instanceof Model model) {
				return model.name();
			}
			return ((FunctionDecl) declaration).name();
		}
	}

	record Return(Expression value) implements Statement {
	}

	record If(Expression condition, List<Statement> thenBranch, List<Statement> elseBranch) implements Statement {
		public If {
			Objects.requireNonNull(condition, "condition must not be null");
			thenBranch = thenBranch != null ? List.copyOf(thenBranch) : List.of();
			elseBranch = elseBranch != null ? List.copyOf(elseBranch) : null;
		}
	}

	record While(Expression condition, List<Statement> body, ContextMode contextMode) implements Statement {
		public While {
			Objects.requireNonNull(condition, "condition must not be null");
			body = body != null ? List.copyOf(body) : List.of();
			contextMode = contextMode != null ? contextMode : ContextMode.verbose();
		}
	}

	record ForIn(String variable, Expression iterable, List<Statement> body, ContextMode contextMode)
			implements Statement {
		public ForIn {
			Objects.requireNonNull(variable, "variable must not be null");
			Objects.requireNonNull(iterable, "iterable must not be null");
			body = body != null ? List.copyOf(body) : List.of();
			contextMode = contextMode != null ? contextMode : ContextMode.verbose();
		}
	}

	record Break() implements Statement {
	}

	record Continue() implements Statement {
	}

	record Block(List<Statement> body) implements Statement {
		public Block {
			body = body != null ? List.copyOf(body) : List.of();
		}
	}

	record ExpressionStatement(Expression expression) implements Statement {
		public ExpressionStatement {
			Objects.requireNonNull(expression, "expression must not be null");
		}
	}
}
