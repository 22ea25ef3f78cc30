package org.javai.springai.weave.exec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;
import org.javai.springai.weave.ast.BinaryOperator;
import org.javai.springai.weave.ast.ContextMode;
import org.javai.springai.weave.ast.ContextSpecifier;
import org.javai.springai.weave.ast.Expression;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.ast.UnaryOperator;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.value.Value;

/**
 * One atomic unit of work on the instruction stack.
 *
 * <p>Instructions are plain data: they carry every operand they need, so an
 * expression evaluated halfway is an ordinary, serializable instruction stack
 * rather than a position on the host call stack. Intermediate operands live on
 * the state's value stack; the most recent result lives in
 * {@code lastResult}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
		@JsonSubTypes.Type(value = Instruction.ExecStatement.class, name = "exec_statement"),
		@JsonSubTypes.Type(value = Instruction.ExecExpression.class, name = "exec_expression"),
		@JsonSubTypes.Type(value = Instruction.ExecSequence.class, name = "exec_sequence"),
		@JsonSubTypes.Type(value = Instruction.DeclareVar.class, name = "declare_var"),
		@JsonSubTypes.Type(value = Instruction.AssignVar.class, name = "assign_var"),
		@JsonSubTypes.Type(value = Instruction.PushValue.class, name = "push_value"),
		@JsonSubTypes.Type(value = Instruction.BuildArray.class, name = "build_array"),
		@JsonSubTypes.Type(value = Instruction.BuildObject.class, name = "build_object"),
		@JsonSubTypes.Type(value = Instruction.ApplyBinary.class, name = "binary_op"),
		@JsonSubTypes.Type(value = Instruction.ShortCircuit.class, name = "short_circuit"),
		@JsonSubTypes.Type(value = Instruction.ToBoolean.class, name = "to_boolean"),
		@JsonSubTypes.Type(value = Instruction.ApplyUnary.class, name = "unary_op"),
		@JsonSubTypes.Type(value = Instruction.IndexAccess.class, name = "index_access"),
		@JsonSubTypes.Type(value = Instruction.MemberAccess.class, name = "member_access"),
		@JsonSubTypes.Type(value = Instruction.CallFunction.class, name = "call_function"),
		@JsonSubTypes.Type(value = Instruction.FunctionBoundary.class, name = "function_boundary"),
		@JsonSubTypes.Type(value = Instruction.Unwind.class, name = "unwind"),
		@JsonSubTypes.Type(value = Instruction.ExitBlock.class, name = "exit_block"),
		@JsonSubTypes.Type(value = Instruction.IfBranch.class, name = "if_branch"),
		@JsonSubTypes.Type(value = Instruction.ForInInit.class, name = "for_in_init"),
		@JsonSubTypes.Type(value = Instruction.ForInIterate.class, name = "for_in_iterate"),
		@JsonSubTypes.Type(value = Instruction.WhileIterate.class, name = "while_iterate"),
		@JsonSubTypes.Type(value = Instruction.WhileCheck.class, name = "while_check"),
		@JsonSubTypes.Type(value = Instruction.CallAi.class, name = "call_ai"),
		@JsonSubTypes.Type(value = Instruction.ApplySummary.class, name = "apply_summary")
})
public sealed interface Instruction {

	/**
	 * Decompose a statement into instructions.
	 */
	record ExecStatement(Statement statement) implements Instruction {
	}

	/**
	 * Evaluate an expression into {@code lastResult}.
	 */
	record ExecExpression(Expression expression) implements Instruction {
	}

	/**
	 * Run {@code statements} from {@code index} on, one statement at a time.
	 */
	record ExecSequence(List<Statement> statements, int index) implements Instruction {
		public ExecSequence {
			statements = List.copyOf(statements);
		}
	}

	/**
	 * Bind {@code lastResult} to a new variable in the current frame.
	 */
	record DeclareVar(String name, String type, @JsonProperty("isConst") boolean isConst) implements Instruction {
	}

	/**
	 * Assign {@code lastResult} to an existing variable.
	 */
	record AssignVar(String name) implements Instruction {
	}

	/**
	 * Move {@code lastResult} onto the value stack.
	 */
	record PushValue() implements Instruction {
	}

	record BuildArray(int count) implements Instruction {
	}

	record BuildObject(List<String> keys) implements Instruction {
		public BuildObject {
			keys = List.copyOf(keys);
		}
	}

	/**
	 * Left operand on the value stack, right operand in {@code lastResult}.
	 */
	record ApplyBinary(BinaryOperator operator) implements Instruction {
	}

	/**
	 * Left operand in {@code lastResult}; {@code right} is evaluated only when
	 * the left operand does not decide the result.
	 */
	record ShortCircuit(BinaryOperator operator, Expression right) implements Instruction {
	}

	record ToBoolean() implements Instruction {
	}

	record ApplyUnary(UnaryOperator operator) implements Instruction {
	}

	/**
	 * Target on the value stack, index in {@code lastResult}.
	 */
	record IndexAccess() implements Instruction {
	}

	record MemberAccess(String property) implements Instruction {
	}

	/**
	 * Callee and {@code argCount} arguments on the value stack, callee deepest.
	 */
	record CallFunction(int argCount) implements Instruction {
	}

	/**
	 * Marks the caller's continuation below a function body. Reached
	 * normally it ends a call without a return value; a return unwinds to it.
	 */
	record FunctionBoundary(String functionName) implements Instruction {
	}

	/**
	 * {@code return}, {@code break} or {@code continue}: discards instructions
	 * up to the nearest enclosing function or loop boundary.
	 */
	record Unwind(UnwindKind kind) implements Instruction {
	}

	/**
	 * Drops bindings introduced since block entry.
	 */
	record ExitBlock(List<String> savedKeys) implements Instruction {
		public ExitBlock {
			savedKeys = List.copyOf(savedKeys);
		}
	}

	/**
	 * Condition in {@code lastResult}.
	 */
	record IfBranch(List<Statement> thenBranch, List<Statement> elseBranch) implements Instruction {
	}

	/**
	 * Iterable in {@code lastResult}.
	 */
	record ForInInit(String variable, List<Statement> body, ContextMode contextMode) implements Instruction {
	}

	/**
	 * Loop boundary of a {@code for-in} loop, positioned at item {@code index}.
	 */
	record ForInIterate(String variable, List<Value> items, int index, List<Statement> body, ContextMode contextMode,
			List<String> savedKeys, int entryStart) implements Instruction {
		public ForInIterate {
			items = List.copyOf(items);
			savedKeys = List.copyOf(savedKeys);
		}

		ForInIterate next() {
			return new ForInIterate(variable, items, index + 1, body, contextMode, savedKeys, entryStart);
		}
	}

	/**
	 * Loop boundary of a {@code while} loop.
	 */
	record WhileIterate(Expression condition, List<Statement> body, ContextMode contextMode, List<String> savedKeys,
			int entryStart) implements Instruction {
		public WhileIterate {
			savedKeys = List.copyOf(savedKeys);
		}
	}

	/**
	 * Condition in {@code lastResult}; the loop's {@link WhileIterate} is
	 * directly below.
	 */
	record WhileCheck() implements Instruction {
	}

	/**
	 * Prompt in {@code lastResult}; suspends the state.
	 */
	record CallAi(AiOperation operation, String model, ContextSpecifier context) implements Instruction {
	}

	/**
	 * Summary text in {@code lastResult}; replaces the frame's entries from
	 * {@code entryStart} on.
	 */
	record ApplySummary(int entryStart) implements Instruction {
	}
}
