package org.javai.springai.weave.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import org.javai.springai.weave.value.Value;

/**
 * A binding in a frame. Variables are replaced, never mutated, so a failed
 * assignment cannot leave a partially written binding behind.
 */
public record Variable(Value value, String typeAnnotation, @JsonProperty("isConst") boolean isConst) {

	public Variable {
		Objects.requireNonNull(value, "value must not be null");
	}

	public Variable withValue(Value newValue) {
		return new Variable(newValue, typeAnnotation, isConst);
	}
}
