package org.javai.springai.weave.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.springai.weave.GeneratedCodeSyntaxException;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.serialize.WeaveJson;

/**
 * Reads a function declaration written as a JSON syntax tree, the form used
 * when the model is asked to emit the tree directly. Markdown code fences
 * around the JSON are tolerated.
 */
public class JsonFragmentParser implements FragmentParser {

	private final ObjectMapper mapper = WeaveJson.mapper();

	@Override
	public Statement.FunctionDecl parseFunction(String source) {
		String json = stripCodeFence(source);
		Statement statement;
		try {
			statement = mapper.readValue(json, Statement.class);
		}
		catch (JsonProcessingException | RuntimeException e) {
			throw new GeneratedCodeSyntaxException("Generated code is not a valid function declaration: "
					+ e.getMessage(), source, e);
		}
		if (!(statement instanceof Statement.FunctionDecl function)) {
			throw new GeneratedCodeSyntaxException("Generated code must declare exactly one function", source);
		}
		return function;
	}

	static String stripCodeFence(String source) {
		String trimmed = source.trim();
		if (!trimmed.startsWith("```")) {
			return trimmed;
		}
		int firstNewline = trimmed.indexOf('\n');
		int closing = trimmed.lastIndexOf("```");
		if (firstNewline < 0 || closing <= firstNewline) {
			return trimmed;
		}
		return trimmed.substring(firstNewline + 1, closing).trim();
	}
}
