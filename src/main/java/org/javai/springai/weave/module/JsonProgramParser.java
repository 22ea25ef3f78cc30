package org.javai.springai.weave.module;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.springai.weave.ast.Program;
import org.javai.springai.weave.serialize.WeaveJson;

/**
 * Reads programs stored as JSON ASTs.
 */
public class JsonProgramParser implements ProgramParser {

	private final ObjectMapper mapper;

	public JsonProgramParser() {
		this(WeaveJson.mapper());
	}

	public JsonProgramParser(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	@Override
	public Program parse(String source, String path) {
		try {
			return mapper.readValue(source, Program.class);
		}
		catch (JsonProcessingException e) {
			throw new ModuleLoadException(path, "Failed to parse module '" + path + "': " + e.getOriginalMessage(), e);
		}
	}
}
