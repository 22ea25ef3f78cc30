package org.javai.springai.weave.exec;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.springai.weave.EngineConfig;
import org.javai.springai.weave.EngineFaultException;
import org.javai.springai.weave.FunctionRedefinitionException;
import org.javai.springai.weave.InvalidResumeStateException;
import org.javai.springai.weave.UndefinedVariableException;
import org.javai.springai.weave.WeaveException;
import org.javai.springai.weave.ai.AiOutcome;
import org.javai.springai.weave.ai.ModelConfig;
import org.javai.springai.weave.ast.ContextMode;
import org.javai.springai.weave.ast.Expression;
import org.javai.springai.weave.ast.Parameter;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.context.ContextAssembler;
import org.javai.springai.weave.module.ModuleEntry;
import org.javai.springai.weave.module.ModuleKind;
import org.javai.springai.weave.state.AiInteraction;
import org.javai.springai.weave.state.AiOperation;
import org.javai.springai.weave.state.ErrorInfo;
import org.javai.springai.weave.state.Frame;
import org.javai.springai.weave.state.FrameEntry;
import org.javai.springai.weave.state.FunctionEntry;
import org.javai.springai.weave.state.FunctionOrigin;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.state.RuntimeStatus;
import org.javai.springai.weave.tool.Tool;
import org.javai.springai.weave.tool.ToolCall;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.value.TargetType;
import org.javai.springai.weave.value.TypeCoercion;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The instruction-stack interpreter.
 *
 * <p>{@link #step} executes exactly one instruction. Statements and
 * expressions are decomposed lazily into instructions, so recursion in the
 * program becomes growth of the instruction stack rather than of the host call
 * stack. AI, user, tool and host operations never perform I/O here: they
 * suspend the state with a {@link PendingRequest}, and the matching
 * {@code resumeWith*} method continues it once a driver has the answer.</p>
 *
 * <p>{@code return}, {@code break} and {@code continue} are
 * {@link Instruction.Unwind} markers that discard instructions down to the
 * nearest function or loop boundary; no host exceptions are used for control
 * flow.</p>
 */
public class StepEngine {

	private static final Logger logger = LoggerFactory.getLogger(StepEngine.class);

	private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

	private final EngineConfig config;
	private final ToolRegistry tools;
	private final FragmentParser fragmentParser;

	/**
	 * @param config model registry, default model and compress prompt
	 * @param tools tools callable directly from programs
	 * @param fragmentParser parses the functions {@code vibe} gets back from the model
	 */
	public StepEngine(EngineConfig config, ToolRegistry tools, FragmentParser fragmentParser) {
		this.config = config;
		this.tools = tools;
		this.fragmentParser = fragmentParser;
	}

	/**
	 * Executes one instruction. A state that is not running is returned
	 * unchanged; a running state with an empty instruction stack completes.
	 *
	 * @param state the state to advance in place
	 * @return {@code state}
	 * @throws WeaveException after recording it on the state, which is then {@code ERROR}
	 */
	public RuntimeState step(RuntimeState state) {
		if (state.status() != RuntimeStatus.RUNNING) {
			return state;
		}
		Instruction instruction = state.popInstruction();
		if (instruction == null) {
			state.complete();
			logger.info("Run completed with result {}", Values.render(state.lastResult()));
			return state;
		}
		if (logger.isTraceEnabled()) {
			logger.trace("Executing {} (stack depth {})", instruction.getClass().getSimpleName(),
					state.instructionStack().size());
		}
		guarded(state, () -> execute(state, instruction));
		return state;
	}

	/**
	 * Steps until the state leaves {@code RUNNING}.
	 *
	 * @param state the state to advance in place
	 * @return {@code state}, now completed, failed or awaiting a request
	 */
	public RuntimeState runUntilPause(RuntimeState state) {
		while (state.status() == RuntimeStatus.RUNNING) {
			step(state);
		}
		return state;
	}

	// resume

	/**
	 * Resumes a state suspended on {@code do}, {@code vibe} or a compress
	 * summary. The response is coerced to the pending target type and the
	 * exchange is logged.
	 *
	 * @param state a state with status {@code AWAITING_AI}
	 * @param outcome the model's answer with its usage and tool rounds
	 * @return {@code state}, running again
	 * @throws InvalidResumeStateException if the state is not awaiting an AI response
	 */
	public RuntimeState resumeWithAIResponse(RuntimeState state, AiOutcome outcome) {
		PendingRequest.PendingAi pending = expectAi(state, RuntimeStatus.AWAITING_AI);
		guarded(state, () -> {
			switch (pending.operation()) {
				case DO -> {
					Value value = TypeCoercion.parseResponse(outcome.content(), pending.targetType());
					state.resume();
					state.setLastResult(value);
					state.appendEntry(new FrameEntry.PromptEntry(AiOperation.DO, pending.prompt(), outcome.content()));
				}
				case COMPRESS -> {
					state.resume();
					state.setLastResult(Value.text(outcome.content().trim()));
				}
				case VIBE -> {
					Statement.FunctionDecl generated = fragmentParser.parseFunction(outcome.content());
					installGenerated(state, generated);
					List<Value> args = new ArrayList<>();
					for (Parameter param : generated.params()) {
						args.add(state.findVariable(param.name()).orElse(Value.NULL));
					}
					state.resume();
					state.appendEntry(new FrameEntry.PromptEntry(AiOperation.VIBE, pending.prompt(), outcome.content()));
					enterFunction(state, generated, null, args);
				}
				case ASK -> throw new IllegalStateException("ask requests are resumed with user input");
			}
			record(state, pending, outcome);
		});
		return state;
	}

	/**
	 * Resumes a state suspended on {@code ask}.
	 *
	 * @param state a state with status {@code AWAITING_USER}
	 * @param input what the user typed, coerced to the pending target type
	 * @return {@code state}, running again
	 */
	public RuntimeState resumeWithUserInput(RuntimeState state, String input) {
		PendingRequest.PendingAi pending = expectAi(state, RuntimeStatus.AWAITING_USER);
		guarded(state, () -> {
			Value value = TypeCoercion.parseResponse(input, pending.targetType());
			state.resume();
			state.setLastResult(value);
			state.appendEntry(new FrameEntry.PromptEntry(AiOperation.ASK, pending.prompt(), input));
			record(state, pending, AiOutcome.of(input));
		});
		return state;
	}

	/**
	 * Resumes a direct tool call. Results are matched to calls by id; a failed
	 * result binds {@code {"error": message}} instead of aborting the run.
	 *
	 * @param state a state with status {@code AWAITING_TOOL_EVAL}
	 * @param results one result per pending call, in any order
	 * @return {@code state}, running again
	 * @throws InvalidResumeStateException if the state is not awaiting tools or a call has no result
	 */
	public RuntimeState resumeWithToolResults(RuntimeState state, List<ToolResult> results) {
		if (state.status() != RuntimeStatus.AWAITING_TOOL_EVAL) {
			throw new InvalidResumeStateException(RuntimeStatus.AWAITING_TOOL_EVAL, state.status());
		}
		PendingRequest.PendingToolEval pending = (PendingRequest.PendingToolEval) state.pendingRequest();
		List<Value> values = new ArrayList<>();
		for (ToolCall call : pending.toolCalls()) {
			ToolResult result = results.stream()
					.filter(r -> r.callId().equals(call.id()))
					.findFirst()
					.orElseThrow(() -> new InvalidResumeStateException(
							"No result supplied for tool call '" + call.id() + "'", state.status()));
			values.add(result.failed() ? errorValue(result.error()) : result.value());
		}
		state.resume();
		state.setLastResult(values.size() == 1 ? values.get(0) : Value.array(values));
		return state;
	}

	/**
	 * @param state a state with status {@code AWAITING_HOST_EVAL}
	 * @param result the value the host block or host function produced
	 * @return {@code state}, running again
	 */
	public RuntimeState resumeWithHostResult(RuntimeState state, Value result) {
		if (state.status() != RuntimeStatus.AWAITING_HOST_EVAL) {
			throw new InvalidResumeStateException(RuntimeStatus.AWAITING_HOST_EVAL, state.status());
		}
		state.resume();
		state.setLastResult(result);
		return state;
	}

	private PendingRequest.PendingAi expectAi(RuntimeState state, RuntimeStatus expected) {
		if (state.status() != expected || !(state.pendingRequest() instanceof PendingRequest.PendingAi pending)) {
			throw new InvalidResumeStateException(expected, state.status());
		}
		return pending;
	}

	private void record(RuntimeState state, PendingRequest.PendingAi pending, AiOutcome outcome) {
		state.recordInteraction(new AiInteraction(pending.operation(), pending.prompt(),
				pending.model() != null ? pending.model().name() : null, pending.targetType(), outcome.content(),
				outcome.usage(), outcome.toolRounds(), outcome.durationMillis()));
	}

	private void guarded(RuntimeState state, Runnable action) {
		try {
			action.run();
		}
		catch (WeaveException e) {
			state.fail(new ErrorInfo(e.errorType(), e.getMessage()));
			logger.debug("Run failed with {}: {}", e.errorType(), e.getMessage());
			throw e;
		}
		catch (RuntimeException e) {
			state.fail(new ErrorInfo("Internal", e.getMessage()));
			throw e;
		}
	}

	// dispatch

	private void execute(RuntimeState state, Instruction instruction) {
		if (instruction instanceof Instruction.ExecStatement exec) {
			executeStatement(state, exec.statement());
		}
		else if (instruction instanceof Instruction.ExecExpression exec) {
			evaluate(state, exec.expression());
		}
		else if (instruction instanceof Instruction.ExecSequence sequence) {
			executeSequence(state, sequence);
		}
		else if (instruction instanceof Instruction.DeclareVar declare) {
			state.setLastResult(state.declareVariable(declare.name(), state.lastResult(), declare.type(), declare.isConst()));
		}
		else if (instruction instanceof Instruction.AssignVar assign) {
			state.setLastResult(state.assign(assign.name(), state.lastResult()));
		}
		else if (instruction instanceof Instruction.PushValue) {
			state.pushValue(state.lastResult());
		}
		else if (instruction instanceof Instruction.BuildArray build) {
			state.setLastResult(Value.array(state.popValues(build.count())));
		}
		else if (instruction instanceof Instruction.BuildObject build) {
			buildObject(state, build.keys());
		}
		else if (instruction instanceof Instruction.ApplyBinary binary) {
			Value left = state.popValue();
			state.setLastResult(Operators.binary(binary.operator(), left, state.lastResult()));
		}
		else if (instruction instanceof Instruction.ShortCircuit shortCircuit) {
			shortCircuit(state, shortCircuit);
		}
		else if (instruction instanceof Instruction.ToBoolean) {
			state.setLastResult(Value.bool(Values.isTruthy(state.lastResult())));
		}
		else if (instruction instanceof Instruction.ApplyUnary unary) {
			state.setLastResult(Operators.unary(unary.operator(), state.lastResult()));
		}
		else if (instruction instanceof Instruction.IndexAccess) {
			Value target = state.popValue();
			state.setLastResult(Operators.index(target, state.lastResult()));
		}
		else if (instruction instanceof Instruction.MemberAccess member) {
			state.setLastResult(Operators.member(state.lastResult(), member.property()));
		}
		else if (instruction instanceof Instruction.CallFunction call) {
			List<Value> args = state.popValues(call.argCount());
			invoke(state, state.popValue(), args);
		}
		else if (instruction instanceof Instruction.FunctionBoundary) {
			state.popFrame();
			state.setLastResult(Value.NULL);
		}
		else if (instruction instanceof Instruction.Unwind unwind) {
			unwind(state, unwind.kind());
		}
		else if (instruction instanceof Instruction.ExitBlock exit) {
			state.exitBlock(exit.savedKeys());
		}
		else if (instruction instanceof Instruction.IfBranch branch) {
			List<Statement> chosen = Values.isTruthy(state.lastResult()) ? branch.thenBranch() : branch.elseBranch();
			enterBlock(state, chosen);
		}
		else if (instruction instanceof Instruction.ForInInit init) {
			startForIn(state, init);
		}
		else if (instruction instanceof Instruction.ForInIterate loop) {
			iterate(state, loop);
		}
		else if (instruction instanceof Instruction.WhileIterate loop) {
			state.exitBlock(loop.savedKeys());
			endIteration(state, loop.contextMode(), loop.entryStart());
			state.pushInstruction(loop);
			state.pushInstructions(new Instruction.ExecExpression(loop.condition()), new Instruction.WhileCheck());
		}
		else if (instruction instanceof Instruction.WhileCheck) {
			checkWhile(state);
		}
		else if (instruction instanceof Instruction.CallAi callAi) {
			callAi(state, callAi);
		}
		else if (instruction instanceof Instruction.ApplySummary summary) {
			state.replaceEntries(summary.entryStart(), new FrameEntry.SummaryEntry(Values.render(state.lastResult())));
			state.setLastResult(Value.NULL);
		}
	}

	// statements

	private void executeSequence(RuntimeState state, Instruction.ExecSequence sequence) {
		List<Statement> statements = sequence.statements();
		int index = sequence.index();
		if (index >= statements.size()) {
			return;
		}
		if (index + 1 < statements.size()) {
			state.pushInstruction(new Instruction.ExecSequence(statements, index + 1));
		}
		state.pushInstruction(new Instruction.ExecStatement(statements.get(index)));
	}

	private void executeStatement(RuntimeState state, Statement statement) {
		if (statement instanceof Statement.Let let) {
			declare(state, let.name(), let.type(), false, let.initializer());
		}
		else if (statement instanceof Statement.Const constant) {
			declare(state, constant.name(), constant.type(), true, constant.initializer());
		}
		else if (statement instanceof Statement.Model model) {
			Value.ModelRef ref = new Value.ModelRef(model.name(), model.modelName(), model.provider(), model.url(),
					model.apiKeyEnv(), model.maxRetriesOnError(), model.tools());
			state.setLastResult(state.declareVariable(model.name(), ref, "model", true));
		}
		else if (statement instanceof Statement.FunctionDecl function) {
			if (!state.functions().containsKey(function.name())) {
				state.defineFunction(new FunctionEntry(function, FunctionOrigin.PROGRAM));
			}
		}
		else if (statement instanceof Statement.Export export) {
			state.pushInstruction(new Instruction.ExecStatement(export.declaration()));
		}
		else if (statement instanceof Statement.Return ret) {
			if (ret.value() == null) {
				state.setLastResult(Value.NULL);
				state.pushInstruction(new Instruction.Unwind(UnwindKind.RETURN));
			}
			else {
				state.pushInstructions(new Instruction.ExecExpression(ret.value()), new Instruction.Unwind(UnwindKind.RETURN));
			}
		}
		else if (statement instanceof Statement.If ifStatement) {
			state.pushInstructions(new Instruction.ExecExpression(ifStatement.condition()),
					new Instruction.IfBranch(ifStatement.thenBranch(), ifStatement.elseBranch()));
		}
		else if (statement instanceof Statement.While whileLoop) {
			state.pushInstruction(new Instruction.WhileIterate(whileLoop.condition(), whileLoop.body(),
					whileLoop.contextMode(), List.copyOf(state.currentLocalNames()), entryCount(state)));
		}
		else if (statement instanceof Statement.ForIn forIn) {
			state.pushInstructions(new Instruction.ExecExpression(forIn.iterable()),
					new Instruction.ForInInit(forIn.variable(), forIn.body(), forIn.contextMode()));
		}
		else if (statement instanceof Statement.Break) {
			state.pushInstruction(new Instruction.Unwind(UnwindKind.BREAK));
		}
		else if (statement instanceof Statement.Continue) {
			state.pushInstruction(new Instruction.Unwind(UnwindKind.CONTINUE));
		}
		else if (statement instanceof Statement.Block block) {
			enterBlock(state, block.body());
		}
		else if (statement instanceof Statement.ExpressionStatement expression) {
			state.pushInstruction(new Instruction.ExecExpression(expression.expression()));
		}
		// imports are resolved by the module loader before execution
	}

	private void declare(RuntimeState state, String name, String type, boolean isConst, Expression initializer) {
		Instruction.DeclareVar declare = new Instruction.DeclareVar(name, type, isConst);
		if (initializer == null) {
			state.setLastResult(Value.NULL);
			state.pushInstruction(declare);
		}
		else {
			state.pushInstructions(new Instruction.ExecExpression(initializer), declare);
		}
	}

	private void enterBlock(RuntimeState state, List<Statement> body) {
		if (body == null || body.isEmpty()) {
			return;
		}
		state.pushInstructions(new Instruction.ExecSequence(body, 0),
				new Instruction.ExitBlock(List.copyOf(state.currentLocalNames())));
	}

	private static int entryCount(RuntimeState state) {
		return state.currentFrame().orderedEntries().size();
	}

	// loops

	private void startForIn(RuntimeState state, Instruction.ForInInit init) {
		Value iterable = state.lastResult();
		List<Value> items;
		if (iterable instanceof Value.Array array) {
			items = array.elements();
		}
		else if (iterable instanceof Value.Json json && json.node().isArray()) {
			items = Values.elementsOf(json.node());
		}
		else {
			throw new EngineFaultException("Cannot iterate over a " + Values.typeName(iterable) + " value");
		}
		state.pushInstruction(new Instruction.ForInIterate(init.variable(), items, 0, init.body(), init.contextMode(),
				List.copyOf(state.currentLocalNames()), entryCount(state)));
	}

	private void iterate(RuntimeState state, Instruction.ForInIterate loop) {
		state.exitBlock(loop.savedKeys());
		endIteration(state, loop.contextMode(), loop.entryStart());
		if (loop.index() >= loop.items().size()) {
			finishLoop(state, loop.contextMode(), loop.entryStart());
			return;
		}
		state.pushInstruction(loop.next());
		state.setLastResult(loop.items().get(loop.index()));
		state.pushInstructions(new Instruction.DeclareVar(loop.variable(), null, false),
				new Instruction.ExecSequence(loop.body(), 0));
	}

	private void checkWhile(RuntimeState state) {
		Instruction below = state.popInstruction();
		if (!(below instanceof Instruction.WhileIterate loop)) {
			throw new IllegalStateException("while condition evaluated outside of its loop");
		}
		if (Values.isTruthy(state.lastResult())) {
			state.pushInstructions(new Instruction.ExecSequence(loop.body(), 0), loop);
		}
		else {
			finishLoop(state, loop.contextMode(), loop.entryStart());
		}
	}

	/**
	 * A forgetting loop keeps no entries across iterations; every boundary,
	 * including the one a {@code continue} lands on, discards what the last
	 * iteration recorded.
	 */
	private static void endIteration(RuntimeState state, ContextMode mode, int entryStart) {
		if (mode.mode() == ContextMode.Mode.FORGET) {
			state.forgetEntries(entryStart);
		}
	}

	/**
	 * Applies the loop's context mode to the entries it accumulated.
	 */
	private void finishLoop(RuntimeState state, ContextMode mode, int entryStart) {
		switch (mode.mode()) {
			case VERBOSE -> {
			}
			case FORGET -> state.forgetEntries(entryStart);
			case COMPRESS -> {
				List<FrameEntry> entries = state.currentFrame().orderedEntries();
				if (entryStart >= entries.size()) {
					return;
				}
				String rendered = ContextAssembler.renderEntries(entries.subList(entryStart, entries.size()));
				String prompt = mode.compressPrompt() != null ? mode.compressPrompt() : config.compressPrompt();
				ModelConfig model = resolveModel(state, mode.compressModel());
				state.pushInstruction(new Instruction.ApplySummary(entryStart));
				suspend(state, new PendingRequest.PendingAi(AiOperation.COMPRESS, prompt, model, null, rendered, List.of()));
			}
		}
	}

	private void unwind(RuntimeState state, UnwindKind kind) {
		while (true) {
			Instruction next = state.popInstruction();
			if (next == null) {
				if (kind == UnwindKind.RETURN) {
					return;
				}
				throw new EngineFaultException(keyword(kind) + " outside of a loop");
			}
			if (next instanceof Instruction.FunctionBoundary) {
				if (kind != UnwindKind.RETURN) {
					throw new EngineFaultException(keyword(kind) + " outside of a loop");
				}
				state.popFrame();
				return;
			}
			if (kind == UnwindKind.RETURN) {
				continue;
			}
			if (next instanceof Instruction.ExitBlock exit) {
				state.exitBlock(exit.savedKeys());
			}
			else if (next instanceof Instruction.ForInIterate loop) {
				leaveLoop(state, kind, loop, loop.savedKeys(), loop.contextMode(), loop.entryStart());
				return;
			}
			else if (next instanceof Instruction.WhileIterate loop) {
				leaveLoop(state, kind, loop, loop.savedKeys(), loop.contextMode(), loop.entryStart());
				return;
			}
		}
	}

	private void leaveLoop(RuntimeState state, UnwindKind kind, Instruction boundary, List<String> savedKeys,
			ContextMode mode, int entryStart) {
		if (kind == UnwindKind.CONTINUE) {
			state.pushInstruction(boundary);
			return;
		}
		state.exitBlock(savedKeys);
		finishLoop(state, mode, entryStart);
	}

	private static String keyword(UnwindKind kind) {
		return kind.name().toLowerCase();
	}

	// expressions

	private void evaluate(RuntimeState state, Expression expression) {
		if (expression instanceof Expression.Identifier identifier) {
			state.setLastResult(lookup(state, identifier.name()));
		}
		else if (expression instanceof Expression.StringLiteral literal) {
			state.setLastResult(Value.text(literal.value()));
		}
		else if (expression instanceof Expression.TemplateLiteral template) {
			state.setLastResult(Value.text(interpolate(state, template.template())));
		}
		else if (expression instanceof Expression.NumberLiteral literal) {
			state.setLastResult(Value.number(literal.value()));
		}
		else if (expression instanceof Expression.BooleanLiteral literal) {
			state.setLastResult(Value.bool(literal.value()));
		}
		else if (expression instanceof Expression.NullLiteral) {
			state.setLastResult(Value.NULL);
		}
		else if (expression instanceof Expression.ObjectLiteral object) {
			List<Instruction> sequence = new ArrayList<>();
			List<String> keys = new ArrayList<>();
			object.properties().forEach(property -> {
				keys.add(property.key());
				sequence.add(new Instruction.ExecExpression(property.value()));
				sequence.add(new Instruction.PushValue());
			});
			sequence.add(new Instruction.BuildObject(keys));
			state.pushInstructions(sequence.toArray(Instruction[]::new));
		}
		else if (expression instanceof Expression.ArrayLiteral array) {
			List<Instruction> sequence = new ArrayList<>();
			for (Expression element : array.elements()) {
				sequence.add(new Instruction.ExecExpression(element));
				sequence.add(new Instruction.PushValue());
			}
			sequence.add(new Instruction.BuildArray(array.elements().size()));
			state.pushInstructions(sequence.toArray(Instruction[]::new));
		}
		else if (expression instanceof Expression.Assignment assignment) {
			state.pushInstructions(new Instruction.ExecExpression(assignment.value()),
					new Instruction.AssignVar(assignment.target()));
		}
		else if (expression instanceof Expression.Binary binary) {
			if (binary.operator().isShortCircuit()) {
				state.pushInstructions(new Instruction.ExecExpression(binary.left()),
						new Instruction.ShortCircuit(binary.operator(), binary.right()));
			}
			else {
				state.pushInstructions(new Instruction.ExecExpression(binary.left()), new Instruction.PushValue(),
						new Instruction.ExecExpression(binary.right()), new Instruction.ApplyBinary(binary.operator()));
			}
		}
		else if (expression instanceof Expression.Unary unary) {
			state.pushInstructions(new Instruction.ExecExpression(unary.operand()),
					new Instruction.ApplyUnary(unary.operator()));
		}
		else if (expression instanceof Expression.Index index) {
			state.pushInstructions(new Instruction.ExecExpression(index.target()), new Instruction.PushValue(),
					new Instruction.ExecExpression(index.index()), new Instruction.IndexAccess());
		}
		else if (expression instanceof Expression.Member member) {
			state.pushInstructions(new Instruction.ExecExpression(member.target()),
					new Instruction.MemberAccess(member.property()));
		}
		else if (expression instanceof Expression.Call call) {
			List<Instruction> sequence = new ArrayList<>();
			sequence.add(new Instruction.ExecExpression(call.callee()));
			sequence.add(new Instruction.PushValue());
			for (Expression argument : call.arguments()) {
				sequence.add(new Instruction.ExecExpression(argument));
				sequence.add(new Instruction.PushValue());
			}
			sequence.add(new Instruction.CallFunction(call.arguments().size()));
			state.pushInstructions(sequence.toArray(Instruction[]::new));
		}
		else if (expression instanceof Expression.Do doExpression) {
			state.pushInstructions(new Instruction.ExecExpression(doExpression.prompt()),
					new Instruction.CallAi(AiOperation.DO, doExpression.model(), doExpression.context()));
		}
		else if (expression instanceof Expression.Ask ask) {
			state.pushInstructions(new Instruction.ExecExpression(ask.prompt()),
					new Instruction.CallAi(AiOperation.ASK, ask.model(), ask.context()));
		}
		else if (expression instanceof Expression.Vibe vibe) {
			state.pushInstructions(new Instruction.ExecExpression(vibe.prompt()),
					new Instruction.CallAi(AiOperation.VIBE, vibe.model(), vibe.context()));
		}
		else if (expression instanceof Expression.HostBlock host) {
			List<Value> args = new ArrayList<>();
			for (String param : host.params()) {
				args.add(state.getVariable(param));
			}
			suspend(state, new PendingRequest.PendingHostEval(host.params(), host.body(), args));
		}
	}

	private Value lookup(RuntimeState state, String name) {
		return state.findVariable(name).orElseGet(() -> {
			if (tools.contains(name)) {
				return new Value.ToolRef(name);
			}
			throw new UndefinedVariableException(name);
		});
	}

	/**
	 * Replaces {@code {name}} placeholders with rendered values. Placeholders
	 * naming nothing are left as written.
	 */
	private String interpolate(RuntimeState state, String template) {
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			String replacement = state.findVariable(matcher.group(1)).map(Values::render).orElse(matcher.group());
			matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	private void buildObject(RuntimeState state, List<String> keys) {
		List<Value> values = state.popValues(keys.size());
		ObjectNode object = JsonNodeFactory.instance.objectNode();
		for (int i = 0; i < keys.size(); i++) {
			object.set(keys.get(i), Values.toJsonNode(values.get(i)));
		}
		state.setLastResult(new Value.Json(object));
	}

	private void shortCircuit(RuntimeState state, Instruction.ShortCircuit shortCircuit) {
		boolean left = Values.isTruthy(state.lastResult());
		switch (shortCircuit.operator()) {
			case AND -> {
				if (!left) {
					state.setLastResult(Value.bool(false));
					return;
				}
			}
			case OR -> {
				if (left) {
					state.setLastResult(Value.bool(true));
					return;
				}
			}
			default -> throw new IllegalStateException("not a short-circuit operator: " + shortCircuit.operator());
		}
		state.pushInstructions(new Instruction.ExecExpression(shortCircuit.right()), new Instruction.ToBoolean());
	}

	// calls

	private void invoke(RuntimeState state, Value callee, List<Value> args) {
		if (callee instanceof Value.FunctionRef ref) {
			ModuleEntry module = ref.modulePath() != null ? state.moduleTable().get(ref.modulePath()) : null;
			if (module != null && module.kind() == ModuleKind.HOST) {
				suspend(state, new PendingRequest.PendingHostCall(ref.modulePath(), ref.name(), args));
				return;
			}
			FunctionEntry function = state.lookupFunction(ref);
			if (function == null) {
				throw new UndefinedVariableException(ref.name());
			}
			enterFunction(state, function.declaration(), ref.modulePath(), args);
		}
		else if (callee instanceof Value.ToolRef tool) {
			ToolCall call = new ToolCall(state.nextCallId(), tool.name(), toolArguments(tool.name(), args));
			suspend(state, new PendingRequest.PendingToolEval(List.of(call)));
		}
		else {
			throw new EngineFaultException("'" + Values.render(callee) + "' is not a function");
		}
	}

	private void enterFunction(RuntimeState state, Statement.FunctionDecl function, String modulePath, List<Value> args) {
		state.pushInstruction(new Instruction.FunctionBoundary(function.name()));
		state.pushFrame(new Frame(function.name(), modulePath));
		List<Parameter> params = function.params();
		for (int i = 0; i < params.size(); i++) {
			Value arg = i < args.size() ? args.get(i) : Value.NULL;
			state.declareVariable(params.get(i).name(), arg, params.get(i).type(), false);
		}
		if (!function.body().isEmpty()) {
			state.pushInstruction(new Instruction.ExecSequence(function.body(), 0));
		}
	}

	/**
	 * Matches positional arguments of a direct tool call to the tool's
	 * declared parameter names. A single JSON object is passed through as the
	 * argument object when the tool does not take exactly one parameter.
	 */
	private ObjectNode toolArguments(String toolName, List<Value> args) {
		List<String> names = tools.find(toolName).map(Tool::schema).map(s -> s.parameterNames()).orElse(List.of());
		if (args.size() == 1 && args.get(0) instanceof Value.Json json && json.node().isObject() && names.size() != 1) {
			return (ObjectNode) json.node().deepCopy();
		}
		if (args.size() > names.size()) {
			throw new EngineFaultException("Tool '" + toolName + "' takes " + names.size() + " arguments, got " + args.size());
		}
		ObjectNode arguments = JsonNodeFactory.instance.objectNode();
		for (int i = 0; i < args.size(); i++) {
			arguments.set(names.get(i), Values.toJsonNode(args.get(i)));
		}
		return arguments;
	}

	private void installGenerated(RuntimeState state, Statement.FunctionDecl generated) {
		FunctionEntry existing = state.functions().get(generated.name());
		if (existing != null) {
			boolean allowed = switch (config.redefinitionPolicy()) {
				case REJECT -> false;
				case OVERWRITE -> true;
				case OVERWRITE_GENERATED -> existing.origin() == FunctionOrigin.GENERATED;
			};
			if (!allowed) {
				throw new FunctionRedefinitionException(generated.name(), config.redefinitionPolicy());
			}
			logger.info("Generated function '{}' replaces an existing {} function", generated.name(), existing.origin());
		}
		state.defineFunction(new FunctionEntry(generated, FunctionOrigin.GENERATED));
	}

	private static Value errorValue(String message) {
		ObjectNode error = JsonNodeFactory.instance.objectNode();
		error.put("error", message);
		return new Value.Json(error);
	}

	// AI

	private void callAi(RuntimeState state, Instruction.CallAi callAi) {
		String prompt = Values.render(state.lastResult());
		ModelConfig model = resolveModel(state, callAi.model());
		TargetType targetType = callAi.operation() == AiOperation.VIBE ? null : destinationType(state);
		String contextText = ContextAssembler.build(state, callAi.context());
		List<String> toolNames = callAi.operation() == AiOperation.ASK ? List.of() : model.tools();
		suspend(state, new PendingRequest.PendingAi(callAi.operation(), prompt, model, targetType, contextText, toolNames));
	}

	/**
	 * The declared type of the variable the pending result flows into, read
	 * off the instruction that will consume it.
	 */
	private static TargetType destinationType(RuntimeState state) {
		Instruction next = state.peekInstruction();
		if (next instanceof Instruction.DeclareVar declare) {
			return TargetType.fromAnnotation(declare.type());
		}
		if (next instanceof Instruction.AssignVar assign) {
			return state.findBinding(assign.name())
					.map(variable -> TargetType.fromAnnotation(variable.typeAnnotation()))
					.orElse(null);
		}
		return null;
	}

	private ModelConfig resolveModel(RuntimeState state, String name) {
		if (name == null || "default".equals(name)) {
			return state.findVariable("default")
					.filter(value -> value instanceof Value.ModelRef)
					.map(value -> ModelConfig.from((Value.ModelRef) value))
					.orElse(config.defaultModel());
		}
		Value value = state.getVariable(name);
		if (!(value instanceof Value.ModelRef ref)) {
			throw new EngineFaultException("'" + name + "' is not a model");
		}
		return ModelConfig.from(ref);
	}

	private void suspend(RuntimeState state, PendingRequest request) {
		state.suspend(request);
		logger.info("Run suspended: {} ({})", state.status(), describe(request));
	}

	private static String describe(PendingRequest request) {
		if (request instanceof PendingRequest.PendingAi ai) {
			return ai.operation().keyword() + (ai.targetType() != null ? " -> " + ai.targetType().annotation() : "");
		}
		if (request instanceof PendingRequest.PendingToolEval toolEval) {
			return toolEval.toolCalls().size() + " tool call(s)";
		}
		if (request instanceof PendingRequest.PendingHostCall hostCall) {
			return hostCall.modulePath() + "#" + hostCall.exportName();
		}
		return "host block";
	}
}
