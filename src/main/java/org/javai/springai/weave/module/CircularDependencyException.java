package org.javai.springai.weave.module;

import java.util.List;
import org.javai.springai.weave.WeaveException;

/**
 * An import chain leads back to a module that is still being loaded.
 */
public class CircularDependencyException extends WeaveException {

	private final List<String> cycle;

	public CircularDependencyException(List<String> cycle) {
		super("Circular dependency detected: " + String.join(" -> ", cycle));
		this.cycle = List.copyOf(cycle);
	}

	/**
	 * The module paths of the cycle in import order; the first path repeats at the end.
	 */
	public List<String> cycle() {
		return cycle;
	}

	@Override
	public String errorType() {
		return "CircularDependency";
	}
}
