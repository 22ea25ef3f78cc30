package org.javai.springai.weave.run;

import java.util.List;
import org.javai.springai.weave.value.Value;

/**
 * Evaluates inline host-code blocks. The engine never interprets host code;
 * it suspends with the block's parameters and source and a driver supplies
 * the result.
 */
@FunctionalInterface
public interface HostEvaluator {

	/**
	 * @param params parameter names of the block
	 * @param body the block's source text
	 * @param args argument values, positionally matching {@code params}
	 */
	Value evaluate(List<String> params, String body, List<Value> args);

	/**
	 * An evaluator for programs that must not contain host blocks.
	 */
	static HostEvaluator unsupported() {
		return (params, body, args) -> {
			throw new UnsupportedOperationException("Host code evaluation is not configured");
		};
	}
}
