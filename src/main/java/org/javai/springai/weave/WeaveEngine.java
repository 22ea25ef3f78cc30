package org.javai.springai.weave;

import java.util.List;
import java.util.Objects;
import org.javai.springai.weave.ai.AiOutcome;
import org.javai.springai.weave.ast.Program;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.exec.FragmentParser;
import org.javai.springai.weave.exec.Instruction;
import org.javai.springai.weave.exec.JsonFragmentParser;
import org.javai.springai.weave.exec.StepEngine;
import org.javai.springai.weave.module.LoadedProgram;
import org.javai.springai.weave.module.ModuleLoader;
import org.javai.springai.weave.state.AiInteraction;
import org.javai.springai.weave.state.FunctionEntry;
import org.javai.springai.weave.state.FunctionOrigin;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.tool.ToolRegistry;
import org.javai.springai.weave.tool.ToolResult;
import org.javai.springai.weave.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for drivers.
 *
 * <p>An engine owns its configuration, tool registry and module loader; it
 * holds no per-run state, so one engine can advance any number of
 * independent {@link RuntimeState}s, one at a time each.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * WeaveEngine engine = WeaveEngine.builder()
 *         .config(EngineConfig.defaults())
 *         .tools(ToolRegistry.builder().toolObjects(new WeatherTools()).build())
 *         .build();
 *
 * RuntimeState state = engine.runUntilPause(engine.newState(program));
 * if (state.status() == RuntimeStatus.AWAITING_AI) {
 *     state = engine.resumeWithAIResponse(state, "4");
 * }
 * }</pre>
 */
public class WeaveEngine {

	private static final Logger logger = LoggerFactory.getLogger(WeaveEngine.class);

	public static final String DEFAULT_ENTRY_PATH = "/main";

	private final EngineConfig config;
	private final ToolRegistry tools;
	private final ModuleLoader moduleLoader;
	private final StepEngine stepEngine;

	private WeaveEngine(EngineConfig config, ToolRegistry tools, ModuleLoader moduleLoader,
			FragmentParser fragmentParser) {
		this.config = config;
		this.tools = tools;
		this.moduleLoader = moduleLoader;
		this.stepEngine = new StepEngine(config, tools, fragmentParser);
	}

	public static Builder builder() {
		return new Builder();
	}

	public EngineConfig config() {
		return config;
	}

	public ToolRegistry tools() {
		return tools;
	}

	public ModuleLoader moduleLoader() {
		return moduleLoader;
	}

	/**
	 * Creates a running state for a program without imports.
	 *
	 * @throws IllegalStateException if the program imports modules; use {@link #load}
	 */
	public RuntimeState newState(Program program) {
		boolean hasImports = program.statements().stream().anyMatch(s -> s instanceof Statement.Import);
		if (hasImports) {
			throw new IllegalStateException("Program has imports; load it with a module loader");
		}
		return initialState(program, DEFAULT_ENTRY_PATH);
	}

	/**
	 * Resolves the program's imports, then creates a running state. Module
	 * faults surface here, before any statement executes.
	 *
	 * @param entryPath resolved path of the program, the base of its relative imports
	 */
	public RuntimeState load(Program program, String entryPath) {
		if (moduleLoader == null) {
			throw new IllegalStateException("No module loader configured");
		}
		LoadedProgram loaded = moduleLoader.loadEntry(program, entryPath);
		RuntimeState state = initialState(program, entryPath);
		state.attachModules(loaded.moduleTable());
		state.bindImports(loaded.bindings());
		logger.debug("Prepared '{}' with {} module(s) and {} import(s)", entryPath, loaded.moduleTable().size(),
				loaded.bindings().size());
		return state;
	}

	private RuntimeState initialState(Program program, String entryPath) {
		RuntimeState state = new RuntimeState(entryPath);
		// functions are hoisted so calls may precede declarations
		for (Statement statement : program.statements()) {
			Statement declaration = statement instanceof Statement.Export export ? export.declaration() : statement;
			if (declaration instanceof Statement.FunctionDecl function) {
				state.defineFunction(new FunctionEntry(function, FunctionOrigin.PROGRAM));
			}
		}
		if (!program.statements().isEmpty()) {
			state.pushInstruction(new Instruction.ExecSequence(program.statements(), 0));
		}
		return state;
	}

	public RuntimeState step(RuntimeState state) {
		return stepEngine.step(state);
	}

	public RuntimeState runUntilPause(RuntimeState state) {
		return stepEngine.runUntilPause(state);
	}

	public RuntimeState resumeWithAIResponse(RuntimeState state, String response) {
		return stepEngine.resumeWithAIResponse(state, AiOutcome.of(response));
	}

	/**
	 * Resumes with the final outcome of an AI request, including usage and
	 * tool rounds for the interaction log.
	 */
	public RuntimeState resumeWithAIResponse(RuntimeState state, AiOutcome outcome) {
		return stepEngine.resumeWithAIResponse(state, outcome);
	}

	public RuntimeState resumeWithUserInput(RuntimeState state, String input) {
		return stepEngine.resumeWithUserInput(state, input);
	}

	public RuntimeState resumeWithToolResults(RuntimeState state, List<ToolResult> results) {
		return stepEngine.resumeWithToolResults(state, results);
	}

	public RuntimeState resumeWithHostResult(RuntimeState state, Value result) {
		return stepEngine.resumeWithHostResult(state, result);
	}

	/**
	 * Reads a variable visible from the state's current frame.
	 *
	 * @throws UndefinedVariableException if nothing is bound to {@code name}
	 */
	public Value getValue(RuntimeState state, String name) {
		return state.getVariable(name);
	}

	public List<AiInteraction> getAIInteractions(RuntimeState state) {
		return state.aiInteractionLog();
	}

	public static class Builder {
		private EngineConfig config = EngineConfig.defaults();
		private ToolRegistry tools = ToolRegistry.empty();
		private ModuleLoader moduleLoader;
		private FragmentParser fragmentParser;

		private Builder() {
		}

		public Builder config(EngineConfig config) {
			this.config = config;
			return this;
		}

		public Builder tools(ToolRegistry tools) {
			this.tools = tools;
			return this;
		}

		public Builder moduleLoader(ModuleLoader moduleLoader) {
			this.moduleLoader = moduleLoader;
			return this;
		}

		/**
		 * Parser for code returned by {@code vibe} requests. Defaults to
		 * {@link JsonFragmentParser}.
		 */
		public Builder fragmentParser(FragmentParser fragmentParser) {
			this.fragmentParser = fragmentParser;
			return this;
		}

		public WeaveEngine build() {
			Objects.requireNonNull(config, "config must not be null");
			Objects.requireNonNull(tools, "tools must not be null");
			return new WeaveEngine(config, tools, moduleLoader,
					fragmentParser != null ? fragmentParser : new JsonFragmentParser());
		}
	}
}
