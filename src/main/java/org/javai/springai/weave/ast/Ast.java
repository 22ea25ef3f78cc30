package org.javai.springai.weave.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Terse factory for building program trees by hand, mainly for embedding
 * programs in host code and in tests.
 *
 * <pre>{@code
 * Program program = Ast.program(
 *     Ast.let("x", Ast.num(1)),
 *     Ast.expr(Ast.assign("x", Ast.binary(BinaryOperator.ADD, Ast.id("x"), Ast.num(1)))),
 *     Ast.expr(Ast.id("x")));
 * }</pre>
 */
public final class Ast {

	private Ast() {
	}

	public static Program program(Statement... statements) {
		return new Program(List.of(statements));
	}

	public static List<Statement> block(Statement... statements) {
		return List.of(statements);
	}

	// statements

	public static Statement.Let let(String name, Expression initializer) {
		return new Statement.Let(name, null, initializer);
	}

	public static Statement.Let let(String name, String type, Expression initializer) {
		return new Statement.Let(name, type, initializer);
	}

	public static Statement.Const constant(String name, Expression initializer) {
		return new Statement.Const(name, null, initializer);
	}

	public static Statement.Const constant(String name, String type, Expression initializer) {
		return new Statement.Const(name, type, initializer);
	}

	public static Statement.Model model(String name, String modelName, String provider) {
		return new Statement.Model(name, modelName, provider, null, null, null, List.of());
	}

	public static Statement.Model model(String name, String modelName, String provider, List<String> tools) {
		return new Statement.Model(name, modelName, provider, null, null, null, tools);
	}

	public static Statement.FunctionDecl function(String name, List<String> params, Statement... body) {
		List<Parameter> parameters = new ArrayList<>();
		for (String param : params) {
			parameters.add(new Parameter(param, null));
		}
		return new Statement.FunctionDecl(name, parameters, null, List.of(body));
	}

	public static Statement.Import importFrom(String source, String... names) {
		return new Statement.Import(Arrays.stream(names).map(n -> new ImportSpecifier(n, null)).toList(), source);
	}

	public static Statement.Export export(Statement declaration) {
		return new Statement.Export(declaration);
	}

	public static Statement.Return ret(Expression value) {
		return new Statement.Return(value);
	}

	public static Statement.If ifThen(Expression condition, List<Statement> thenBranch) {
		return new Statement.If(condition, thenBranch, null);
	}

	public static Statement.If ifThenElse(Expression condition, List<Statement> thenBranch, List<Statement> elseBranch) {
		return new Statement.If(condition, thenBranch, elseBranch);
	}

	public static Statement.While whileLoop(Expression condition, Statement... body) {
		return new Statement.While(condition, List.of(body), ContextMode.verbose());
	}

	public static Statement.While whileLoop(Expression condition, ContextMode mode, Statement... body) {
		return new Statement.While(condition, List.of(body), mode);
	}

	public static Statement.ForIn forIn(String variable, Expression iterable, Statement... body) {
		return new Statement.ForIn(variable, iterable, List.of(body), ContextMode.verbose());
	}

	public static Statement.ForIn forIn(String variable, Expression iterable, ContextMode mode, Statement... body) {
		return new Statement.ForIn(variable, iterable, List.of(body), mode);
	}

	public static Statement.Break breakLoop() {
		return new Statement.Break();
	}

	public static Statement.Continue continueLoop() {
		return new Statement.Continue();
	}

	public static Statement.Block scope(Statement... body) {
		return new Statement.Block(List.of(body));
	}

	public static Statement.ExpressionStatement expr(Expression expression) {
		return new Statement.ExpressionStatement(expression);
	}

	// expressions

	public static Expression.Identifier id(String name) {
		return new Expression.Identifier(name);
	}

	public static Expression.StringLiteral str(String value) {
		return new Expression.StringLiteral(value);
	}

	public static Expression.TemplateLiteral template(String template) {
		return new Expression.TemplateLiteral(template);
	}

	public static Expression.NumberLiteral num(double value) {
		return new Expression.NumberLiteral(value);
	}

	public static Expression.BooleanLiteral bool(boolean value) {
		return new Expression.BooleanLiteral(value);
	}

	public static Expression.NullLiteral nil() {
		return new Expression.NullLiteral();
	}

	public static Expression.ArrayLiteral array(Expression... elements) {
		return new Expression.ArrayLiteral(List.of(elements));
	}

	public static Expression.ObjectLiteral object(ObjectProperty... properties) {
		return new Expression.ObjectLiteral(List.of(properties));
	}

	public static ObjectProperty prop(String key, Expression value) {
		return new ObjectProperty(key, value);
	}

	public static Expression.Assignment assign(String target, Expression value) {
		return new Expression.Assignment(target, value);
	}

	public static Expression.Binary binary(BinaryOperator operator, Expression left, Expression right) {
		return new Expression.Binary(operator, left, right);
	}

	public static Expression.Unary not(Expression operand) {
		return new Expression.Unary(UnaryOperator.NOT, operand);
	}

	public static Expression.Unary negate(Expression operand) {
		return new Expression.Unary(UnaryOperator.NEGATE, operand);
	}

	public static Expression.Index index(Expression target, Expression index) {
		return new Expression.Index(target, index);
	}

	public static Expression.Member member(Expression target, String property) {
		return new Expression.Member(target, property);
	}

	public static Expression.Call call(String callee, Expression... arguments) {
		return new Expression.Call(id(callee), List.of(arguments));
	}

	public static Expression.Do doAi(String prompt, String model) {
		return new Expression.Do(str(prompt), model, ContextSpecifier.defaultContext());
	}

	public static Expression.Do doAi(Expression prompt, String model, ContextSpecifier context) {
		return new Expression.Do(prompt, model, context);
	}

	public static Expression.Ask ask(String prompt) {
		return new Expression.Ask(str(prompt), null, ContextSpecifier.defaultContext());
	}

	public static Expression.Vibe vibe(String prompt, String model) {
		return new Expression.Vibe(str(prompt), model, ContextSpecifier.defaultContext());
	}

	public static Expression.HostBlock host(List<String> params, String body) {
		return new Expression.HostBlock(params, body);
	}
}
