package org.javai.springai.weave;

/**
 * Root of every fault raised by the engine, the module loader, the AI protocol
 * and the state serializer.
 *
 * <p>Subclasses carry a stable {@link #errorType()} that is recorded on a
 * {@link org.javai.springai.weave.state.RuntimeState} when a run aborts, so the
 * fault survives serialization as data.</p>
 */
public abstract class WeaveException extends RuntimeException {

	protected WeaveException(String message) {
		super(message);
	}

	protected WeaveException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * Short, stable name of the fault category (e.g. {@code ConstReassignment}).
	 */
	public abstract String errorType();
}
