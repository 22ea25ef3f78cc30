package org.javai.springai.weave.serialize;

import org.javai.springai.weave.WeaveException;
import org.javai.springai.weave.state.RuntimeState;

/**
 * Converts a {@link RuntimeState} to and from a durable blob so a suspended
 * run can be resumed by another process.
 *
 * <p>The blob is versioned. A blob whose version cannot be brought to the
 * current version fails closed with {@link DeserializationVersionException};
 * a blob that was modified after serialization fails with
 * {@link IntegrityException}.</p>
 */
public interface RuntimeStateSerializer {

	/**
	 * @throws UnsupportedValueException if the state holds a value with no durable encoding
	 */
	byte[] serialize(RuntimeState state);

	RuntimeState deserialize(byte[] blob);

	/**
	 * Pretty-printed JSON view of a blob, for debugging.
	 */
	String toReadableJson(byte[] blob);

	/**
	 * The state holds a value that has no durable encoding, such as an opaque
	 * host object or a non-finite number.
	 */
	class UnsupportedValueException extends WeaveException {
		public UnsupportedValueException(String message) {
			super(message);
		}

		@Override
		public String errorType() {
			return "UnsupportedValue";
		}
	}

	/**
	 * The blob's schema version is unknown or has no migration path.
	 */
	class DeserializationVersionException extends WeaveException {
		private final int blobVersion;

		public DeserializationVersionException(int blobVersion, String message) {
			super(message);
			this.blobVersion = blobVersion;
		}

		public DeserializationVersionException(int blobVersion, String message, Throwable cause) {
			super(message, cause);
			this.blobVersion = blobVersion;
		}

		public int blobVersion() {
			return blobVersion;
		}

		@Override
		public String errorType() {
			return "DeserializationVersion";
		}
	}

	/**
	 * The blob is malformed or was tampered with.
	 */
	class IntegrityException extends WeaveException {
		public IntegrityException(String message) {
			super(message);
		}

		public IntegrityException(String message, Throwable cause) {
			super(message, cause);
		}

		@Override
		public String errorType() {
			return "Integrity";
		}
	}
}
