package org.javai.springai.weave.context;

import java.util.ArrayList;
import java.util.List;
import org.javai.springai.weave.ast.ContextSpecifier;
import org.javai.springai.weave.state.Frame;
import org.javai.springai.weave.state.FrameEntry;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;

/**
 * Renders live frames as prompt text.
 *
 * <p>The output format is part of what the model sees, so it is a stable
 * contract:</p>
 * <pre>
 *   main (entry)
 *     - city (text): Paris
 *     --&gt; do: "How many people live in {city}?"
 *     &lt;-- 2100000
 *     helper (current scope)
 *       - n (number): 3
 *       [summary] iterated over three files
 * </pre>
 * <p>Each frame is indented by two spaces per depth; its entries one level
 * further. Frames with no visible entries are omitted. Entries of
 * {@code model}- or {@code prompt}-typed variables are never rendered.</p>
 */
public final class ContextAssembler {

	private ContextAssembler() {
	}

	/**
	 * Renders the innermost frame only.
	 */
	public static String buildLocalContext(RuntimeState state) {
		List<Frame> frames = state.callStack();
		int depth = frames.size() - 1;
		List<String> lines = new ArrayList<>();
		renderFrame(frames.get(depth), depth, depth, lines);
		return String.join("\n", lines);
	}

	/**
	 * Renders every frame, outermost first, entries in execution order.
	 */
	public static String buildGlobalContext(RuntimeState state) {
		List<Frame> frames = state.callStack();
		int maxDepth = frames.size() - 1;
		List<String> lines = new ArrayList<>();
		for (int depth = 0; depth < frames.size(); depth++) {
			renderFrame(frames.get(depth), depth, maxDepth, lines);
		}
		return String.join("\n", lines);
	}

	/**
	 * Context text for a request, as chosen by its specifier. A variable
	 * specifier renders that variable's value.
	 */
	public static String build(RuntimeState state, ContextSpecifier specifier) {
		return switch (specifier.kind()) {
			case DEFAULT -> buildGlobalContext(state);
			case LOCAL -> buildLocalContext(state);
			case VARIABLE -> Values.render(state.getVariable(specifier.variable()));
		};
	}

	/**
	 * Renders a run of entries without frame headers, one line per entry.
	 */
	public static String renderEntries(List<FrameEntry> entries) {
		List<String> lines = new ArrayList<>();
		for (FrameEntry entry : entries) {
			if (isVisible(entry)) {
				renderEntry(entry, "", lines);
			}
		}
		return String.join("\n", lines);
	}

	private static void renderFrame(Frame frame, int depth, int maxDepth, List<String> lines) {
		List<FrameEntry> visible = frame.orderedEntries().stream().filter(ContextAssembler::isVisible).toList();
		if (visible.isEmpty()) {
			return;
		}
		String indent = "  " + "  ".repeat(depth);
		lines.add(indent + frame.name() + " " + label(depth, maxDepth));
		for (FrameEntry entry : visible) {
			renderEntry(entry, indent + "  ", lines);
		}
	}

	private static String label(int depth, int maxDepth) {
		if (depth == maxDepth) {
			return "(current scope)";
		}
		if (depth == 0) {
			return "(entry)";
		}
		return "(depth " + depth + ")";
	}

	private static void renderEntry(FrameEntry entry, String indent, List<String> lines) {
		if (entry instanceof FrameEntry.VariableEntry variable) {
			String type = variable.type() != null ? " (" + variable.type() + ")" : "";
			lines.add(indent + "- " + variable.name() + type + ": " + Values.render(variable.value()));
		}
		else if (entry instanceof FrameEntry.PromptEntry prompt) {
			lines.add(indent + "--> " + prompt.operation().keyword() + ": \"" + prompt.prompt() + "\"");
			if (prompt.response() != null) {
				lines.add(indent + "<-- " + prompt.response());
			}
		}
		else if (entry instanceof FrameEntry.SummaryEntry summary) {
			lines.add(indent + "[summary] " + summary.text());
		}
	}

	static boolean isVisible(FrameEntry entry) {
		if (entry instanceof FrameEntry.VariableEntry variable) {
			return !"model".equals(variable.type()) && !"prompt".equals(variable.type())
					&& variable.value().kind() != Value.Kind.MODEL;
		}
		return true;
	}
}
