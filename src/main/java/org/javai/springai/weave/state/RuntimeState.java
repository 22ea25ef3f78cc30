package org.javai.springai.weave.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.weave.ConstReassignmentException;
import org.javai.springai.weave.DuplicateDeclarationException;
import org.javai.springai.weave.UndefinedVariableException;
import org.javai.springai.weave.exec.Instruction;
import org.javai.springai.weave.module.ModuleEntry;
import org.javai.springai.weave.module.ModuleKind;
import org.javai.springai.weave.module.ModuleTable;
import org.javai.springai.weave.value.TypeCoercion;
import org.javai.springai.weave.value.Value;

/**
 * The complete state of one program run.
 *
 * <p>Everything the engine needs to continue a run lives here as data: the
 * call stack of {@link Frame}s, the instruction stack, the value stack of
 * partially evaluated operands, the pending request of a suspended run and
 * the AI interaction log. A state is advanced by exactly one engine at a time
 * and can be serialized whenever it is not {@link RuntimeStatus#RUNNING}
 * mid-instruction.</p>
 *
 * <p>Invariant: {@link #pendingRequest()} is non-null exactly when
 * {@link #status()} is one of the {@code AWAITING_*} values.</p>
 */
public class RuntimeState {

	public static final String MAIN_FRAME = "main";

	private RuntimeStatus status;
	private final List<Frame> callStack;
	private final List<Instruction> instructionStack;
	private final List<Value> valueStack;
	private PendingRequest pendingRequest;
	private Value lastResult;
	private ErrorInfo error;
	private final LinkedHashMap<String, FunctionEntry> functions;
	private final LinkedHashMap<String, ImportBinding> imports;
	private ModuleTable moduleTable;
	private final List<AiInteraction> aiInteractionLog;
	private long callCounter;
	private final String entryPath;

	/**
	 * Creates a fresh, running state with an empty main frame.
	 *
	 * @param entryPath path of the entry module, used to resolve relative imports; may be {@code null}
	 */
	public RuntimeState(String entryPath) {
		this(RuntimeStatus.RUNNING, List.of(new Frame(MAIN_FRAME, null)), List.of(), List.of(), null, Value.NULL, null,
				Map.of(), Map.of(), new ModuleTable(), List.of(), 0, entryPath);
	}

	/**
	 * Restores a state from its parts, as read back by a serializer. Frames
	 * and collections are copied.
	 *
	 * @param status the run status
	 * @param callStack frames, outermost first; must contain at least the main frame
	 * @param instructionStack instructions, bottom first
	 * @param valueStack partially evaluated operands, bottom first
	 * @param pendingRequest the request being waited on; set exactly when {@code status} is awaiting
	 * @param lastResult result of the last evaluated expression, {@code null} meaning {@link Value#NULL}
	 * @param error the fault of an {@code ERROR} state, otherwise {@code null}
	 * @param functions declared functions by name
	 * @param imports imported names of the entry module
	 * @param moduleTable loaded modules, {@code null} meaning none
	 * @param aiInteractionLog completed AI and user interactions, oldest first
	 * @param callCounter number of call ids handed out so far
	 * @param entryPath path of the entry module
	 * @throws IllegalArgumentException if the call stack is empty or the pending request does not match the status
	 */
	public RuntimeState(RuntimeStatus status, List<Frame> callStack, List<Instruction> instructionStack,
			List<Value> valueStack, PendingRequest pendingRequest, Value lastResult, ErrorInfo error,
			Map<String, FunctionEntry> functions, Map<String, ImportBinding> imports, ModuleTable moduleTable,
			List<AiInteraction> aiInteractionLog, long callCounter, String entryPath) {
		if (callStack.isEmpty()) {
			throw new IllegalArgumentException("callStack must contain at least the main frame");
		}
		if ((pendingRequest != null) != status.isAwaiting()) {
			throw new IllegalArgumentException("pendingRequest must be set exactly when the status is awaiting, status=" + status);
		}
		this.status = status;
		this.callStack = new ArrayList<>();
		for (Frame frame : callStack) {
			this.callStack.add(frame.copy());
		}
		this.instructionStack = new ArrayList<>(instructionStack);
		this.valueStack = new ArrayList<>(valueStack);
		this.pendingRequest = pendingRequest;
		this.lastResult = lastResult != null ? lastResult : Value.NULL;
		this.error = error;
		this.functions = new LinkedHashMap<>(functions);
		this.imports = new LinkedHashMap<>(imports);
		this.moduleTable = moduleTable != null ? moduleTable : new ModuleTable();
		this.aiInteractionLog = new ArrayList<>(aiInteractionLog);
		this.callCounter = callCounter;
		this.entryPath = entryPath;
	}

	// status

	public RuntimeStatus status() {
		return status;
	}

	public PendingRequest pendingRequest() {
		return pendingRequest;
	}

	public ErrorInfo error() {
		return error;
	}

	/**
	 * Parks the run on {@code request}; the status becomes the request's awaiting status.
	 *
	 * @param request what the run is waiting for
	 */
	public void suspend(PendingRequest request) {
		this.pendingRequest = request;
		this.status = request.awaitingStatus();
	}

	/**
	 * Clears the pending request and returns the state to {@code RUNNING}.
	 */
	public void resume() {
		this.pendingRequest = null;
		this.status = RuntimeStatus.RUNNING;
	}

	public void complete() {
		this.pendingRequest = null;
		this.status = RuntimeStatus.COMPLETED;
	}

	/**
	 * @param errorInfo the fault that stopped the run
	 */
	public void fail(ErrorInfo errorInfo) {
		this.pendingRequest = null;
		this.error = errorInfo;
		this.status = RuntimeStatus.ERROR;
	}

	// frames

	public List<Frame> callStack() {
		return Collections.unmodifiableList(callStack);
	}

	/**
	 * @return the innermost frame, the main frame when no function is running
	 */
	public Frame currentFrame() {
		return callStack.get(callStack.size() - 1);
	}

	/**
	 * Enters a function call.
	 *
	 * @param frame the callee's frame, holding its bound parameters
	 */
	public void pushFrame(Frame frame) {
		callStack.add(frame);
	}

	/**
	 * Leaves a function call.
	 *
	 * @return the frame that was removed
	 * @throws IllegalStateException if only the main frame is left
	 */
	public Frame popFrame() {
		if (callStack.size() == 1) {
			throw new IllegalStateException("Cannot pop the main frame");
		}
		return callStack.remove(callStack.size() - 1);
	}

	/**
	 * Declares a variable in the current frame, coercing {@code value} to the
	 * declared type first.
	 *
	 * @param name the variable name
	 * @param value the initial value
	 * @param type the declared type annotation, or {@code null} for untyped
	 * @param isConst whether later assignment is rejected
	 * @return the value actually bound
	 * @throws DuplicateDeclarationException if the name is already bound in the current frame
	 */
	public Value declareVariable(String name, Value value, String type, boolean isConst) {
		Frame frame = currentFrame();
		if (frame.has(name)) {
			throw new DuplicateDeclarationException(name, frame.name());
		}
		Value coerced = TypeCoercion.coerce(value, type);
		frame.put(name, new Variable(coerced, type, isConst));
		frame.append(new FrameEntry.VariableEntry(name, coerced, type, isConst));
		return coerced;
	}

	/**
	 * Assigns to the innermost binding of {@code name}, coercing to its
	 * declared type. The frame owning the binding records the new value.
	 *
	 * @param name the variable name
	 * @param value the value to assign
	 * @return the value actually bound
	 * @throws ConstReassignmentException if the binding is {@code const}
	 * @throws UndefinedVariableException if no frame binds {@code name}
	 */
	public Value assign(String name, Value value) {
		for (int i = callStack.size() - 1; i >= 0; i--) {
			Frame frame = callStack.get(i);
			Variable variable = frame.get(name);
			if (variable == null) {
				continue;
			}
			if (variable.isConst()) {
				throw new ConstReassignmentException(name);
			}
			Value coerced = TypeCoercion.coerce(value, variable.typeAnnotation());
			frame.put(name, variable.withValue(coerced));
			frame.append(new FrameEntry.VariableEntry(name, coerced, variable.typeAnnotation(), false));
			return coerced;
		}
		throw new UndefinedVariableException(name);
	}

	/**
	 * Looks up the variable binding of {@code name}, innermost frame first.
	 *
	 * @param name the variable name
	 * @return the binding, empty when no frame declares {@code name}
	 */
	public Optional<Variable> findBinding(String name) {
		for (int i = callStack.size() - 1; i >= 0; i--) {
			Variable variable = callStack.get(i).get(name);
			if (variable != null) {
				return Optional.of(variable);
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolves {@code name}: frames innermost to outermost, then the functions,
	 * top-level values and imports visible from the current frame's module.
	 */
	public Optional<Value> findVariable(String name) {
		Optional<Variable> binding = findBinding(name);
		if (binding.isPresent()) {
			return Optional.of(binding.get().value());
		}
		String modulePath = currentFrame().modulePath();
		if (modulePath != null) {
			ModuleEntry module = moduleTable.get(modulePath);
			if (module != null) {
				if (module.functions().containsKey(name)) {
					return Optional.of(new Value.FunctionRef(name, modulePath));
				}
				if (module.values().containsKey(name)) {
					return Optional.of(module.values().get(name));
				}
				ImportBinding imported = module.imports().get(name);
				if (imported != null) {
					return resolveImport(imported);
				}
			}
			return Optional.empty();
		}
		if (functions.containsKey(name)) {
			return Optional.of(new Value.FunctionRef(name, null));
		}
		ImportBinding imported = imports.get(name);
		return imported != null ? resolveImport(imported) : Optional.empty();
	}

	/**
	 * Like {@link #findVariable(String)}, for names that must resolve.
	 *
	 * @param name the name to resolve
	 * @return the value
	 * @throws UndefinedVariableException if nothing visible is called {@code name}
	 */
	public Value getVariable(String name) {
		return findVariable(name).orElseThrow(() -> new UndefinedVariableException(name));
	}

	private Optional<Value> resolveImport(ImportBinding binding) {
		ModuleEntry module = moduleTable.get(binding.modulePath());
		if (module == null) {
			return Optional.empty();
		}
		if (binding.kind() == ModuleKind.HOST || module.functions().containsKey(binding.exportName())) {
			return Optional.of(new Value.FunctionRef(binding.exportName(), binding.modulePath()));
		}
		return Optional.ofNullable(module.values().get(binding.exportName()));
	}

	/**
	 * Finds the function a reference points at, in the entry program's table
	 * or in the defining module's.
	 */
	public FunctionEntry lookupFunction(Value.FunctionRef ref) {
		if (ref.modulePath() == null) {
			return functions.get(ref.name());
		}
		ModuleEntry module = moduleTable.get(ref.modulePath());
		return module != null ? module.functions().get(ref.name()) : null;
	}

	/**
	 * Removes bindings of the current frame that were not present at block
	 * entry.
	 *
	 * @param savedKeys the frame's local names when the block was entered
	 */
	public void exitBlock(List<String> savedKeys) {
		currentFrame().retainLocals(new LinkedHashSet<>(savedKeys));
	}

	public Set<String> currentLocalNames() {
		return new LinkedHashSet<>(currentFrame().locals().keySet());
	}

	public void appendEntry(FrameEntry entry) {
		currentFrame().append(entry);
	}

	/**
	 * Replaces the current frame's entries from {@code start} on with
	 * {@code replacement}, or just drops them when it is {@code null}.
	 *
	 * @param start index of the first entry to replace
	 * @param replacement the entry standing in for the dropped ones, or {@code null}
	 */
	public void replaceEntries(int start, FrameEntry replacement) {
		currentFrame().replaceEntriesFrom(start, replacement);
	}

	/**
	 * Drops the current frame's entries from {@code start} on, then records one
	 * fresh snapshot for each surviving binding that was reassigned in the
	 * dropped range, so the frame's history still ends on its current value.
	 *
	 * @param start index of the first entry to drop
	 */
	public void forgetEntries(int start) {
		Frame frame = currentFrame();
		List<FrameEntry> entries = frame.orderedEntries();
		Set<String> reassigned = new LinkedHashSet<>();
		for (int i = start; i < entries.size(); i++) {
			if (entries.get(i) instanceof FrameEntry.VariableEntry entry && frame.has(entry.name())) {
				reassigned.add(entry.name());
			}
		}
		frame.replaceEntriesFrom(start, null);
		for (String name : reassigned) {
			Variable variable = frame.get(name);
			frame.append(new FrameEntry.VariableEntry(name, variable.value(), variable.typeAnnotation(), variable.isConst()));
		}
	}

	// instruction and value stacks

	public List<Instruction> instructionStack() {
		return Collections.unmodifiableList(instructionStack);
	}

	/**
	 * @param instruction the instruction to execute next
	 */
	public void pushInstruction(Instruction instruction) {
		instructionStack.add(instruction);
	}

	/**
	 * Pushes instructions so that they execute in the given order.
	 *
	 * @param inExecutionOrder instructions, the first to run first
	 */
	public void pushInstructions(Instruction... inExecutionOrder) {
		for (int i = inExecutionOrder.length - 1; i >= 0; i--) {
			instructionStack.add(inExecutionOrder[i]);
		}
	}

	/**
	 * @return the next instruction, removed from the stack, or {@code null} when the stack is empty
	 */
	public Instruction popInstruction() {
		return instructionStack.isEmpty() ? null : instructionStack.remove(instructionStack.size() - 1);
	}

	public Instruction peekInstruction() {
		return instructionStack.isEmpty() ? null : instructionStack.get(instructionStack.size() - 1);
	}

	public List<Value> valueStack() {
		return Collections.unmodifiableList(valueStack);
	}

	public void pushValue(Value value) {
		valueStack.add(value);
	}

	/**
	 * @return the most recently pushed operand
	 * @throws IllegalStateException if the value stack is empty
	 */
	public Value popValue() {
		if (valueStack.isEmpty()) {
			throw new IllegalStateException("Value stack underflow");
		}
		return valueStack.remove(valueStack.size() - 1);
	}

	/**
	 * Pops {@code count} values, returned in the order they were pushed.
	 *
	 * @param count number of operands to pop
	 * @return the operands, oldest first
	 * @throws IllegalStateException if fewer than {@code count} values are stacked
	 */
	public List<Value> popValues(int count) {
		if (valueStack.size() < count) {
			throw new IllegalStateException("Value stack underflow");
		}
		List<Value> tail = valueStack.subList(valueStack.size() - count, valueStack.size());
		List<Value> values = new ArrayList<>(tail);
		tail.clear();
		return values;
	}

	public Value lastResult() {
		return lastResult;
	}

	/**
	 * @param value the result of the expression just evaluated; {@code null} is stored as {@link Value#NULL}
	 */
	public void setLastResult(Value value) {
		this.lastResult = value != null ? value : Value.NULL;
	}

	// program-level tables

	public Map<String, FunctionEntry> functions() {
		return Collections.unmodifiableMap(functions);
	}

	public void defineFunction(FunctionEntry entry) {
		functions.put(entry.name(), entry);
	}

	public Map<String, ImportBinding> imports() {
		return Collections.unmodifiableMap(imports);
	}

	public void bindImports(Map<String, ImportBinding> bindings) {
		imports.putAll(bindings);
	}

	public ModuleTable moduleTable() {
		return moduleTable;
	}

	public void attachModules(ModuleTable table) {
		this.moduleTable = table;
	}

	public List<AiInteraction> aiInteractionLog() {
		return Collections.unmodifiableList(aiInteractionLog);
	}

	public void recordInteraction(AiInteraction interaction) {
		aiInteractionLog.add(interaction);
	}

	public long callCounter() {
		return callCounter;
	}

	/**
	 * Next deterministic tool-call id, {@code call-1}, {@code call-2}, ...
	 *
	 * @return the id, unique within this run
	 */
	public String nextCallId() {
		callCounter++;
		return "call-" + callCounter;
	}

	public String entryPath() {
		return entryPath;
	}

	@Override
	public String toString() {
		return "RuntimeState[status=" + status + ", frames=" + callStack.size() + ", instructions="
				+ instructionStack.size() + ", lastResult=" + lastResult + "]";
	}
}
