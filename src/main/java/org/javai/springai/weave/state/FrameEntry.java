package org.javai.springai.weave.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.javai.springai.weave.value.Value;

/**
 * One event in a frame's execution-ordered history, the material the context
 * assembler renders for the model.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
		@JsonSubTypes.Type(value = FrameEntry.VariableEntry.class, name = "variable"),
		@JsonSubTypes.Type(value = FrameEntry.PromptEntry.class, name = "prompt"),
		@JsonSubTypes.Type(value = FrameEntry.SummaryEntry.class, name = "summary")
})
public sealed interface FrameEntry {

	/**
	 * Snapshot of a variable at declaration or assignment time.
	 */
	record VariableEntry(String name, Value value, String type, @JsonProperty("isConst") boolean isConst) implements FrameEntry {
	}

	/**
	 * A completed {@code do}, {@code ask} or {@code vibe} exchange.
	 */
	record PromptEntry(AiOperation operation, String prompt, String response) implements FrameEntry {
	}

	/**
	 * Model-written summary standing in for the entries of a compressed loop.
	 */
	record SummaryEntry(String text) implements FrameEntry {
	}
}
