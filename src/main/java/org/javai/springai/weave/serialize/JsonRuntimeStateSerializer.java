package org.javai.springai.weave.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.javai.springai.weave.WeaveException;
import org.javai.springai.weave.exec.Instruction;
import org.javai.springai.weave.module.ModuleEntry;
import org.javai.springai.weave.module.ModuleKind;
import org.javai.springai.weave.module.ModuleLoader;
import org.javai.springai.weave.module.ModuleTable;
import org.javai.springai.weave.state.AiInteraction;
import org.javai.springai.weave.state.ErrorInfo;
import org.javai.springai.weave.state.Frame;
import org.javai.springai.weave.state.FrameEntry;
import org.javai.springai.weave.state.FunctionEntry;
import org.javai.springai.weave.state.FunctionOrigin;
import org.javai.springai.weave.state.ImportBinding;
import org.javai.springai.weave.state.PendingRequest;
import org.javai.springai.weave.state.RuntimeState;
import org.javai.springai.weave.state.RuntimeStatus;
import org.javai.springai.weave.state.Variable;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.value.Value;

/**
 * JSON implementation of {@link RuntimeStateSerializer}.
 *
 * <p>The blob format is:</p>
 * <ul>
 *   <li>4 bytes: magic number "WVST"</li>
 *   <li>2 bytes: schema version</li>
 *   <li>32 bytes: SHA-256 hash of the compressed data</li>
 *   <li>remaining: gzip-compressed JSON</li>
 * </ul>
 *
 * <p>Modules are recorded by resolved path and kind only. Deserializing a
 * state that references modules reloads them through the configured
 * {@link ModuleLoader}, so module contents are never embedded in the blob.</p>
 *
 * <h2>Schema migrations</h2>
 * <pre>{@code
 * var registry = new DefaultRuntimeStateMigrationRegistry(2)
 *     .register(new V1ToV2Migration());
 * var serializer = new JsonRuntimeStateSerializer(registry, moduleLoader);
 * }</pre>
 */
public class JsonRuntimeStateSerializer implements RuntimeStateSerializer {

	private static final byte[] MAGIC = "WVST".getBytes(StandardCharsets.UTF_8);
	private static final int HASH_LENGTH = 32;
	private static final int HEADER_LENGTH = 4 + 2 + HASH_LENGTH;

	/** Schema version of new blobs when no migration registry is configured */
	public static final int CURRENT_SCHEMA_VERSION = 1;

	private final ObjectMapper mapper;
	private final RuntimeStateMigrationRegistry migrationRegistry;
	private final ModuleLoader moduleLoader;
	private final int schemaVersion;

	public JsonRuntimeStateSerializer() {
		this(null, null);
	}

	/**
	 * @param migrationRegistry migrations for older blobs, may be {@code null}
	 * @param moduleLoader reloads the modules a state references, may be {@code null} for programs without imports
	 */
	public JsonRuntimeStateSerializer(RuntimeStateMigrationRegistry migrationRegistry, ModuleLoader moduleLoader) {
		this.mapper = WeaveJson.mapper();
		this.migrationRegistry = migrationRegistry;
		this.moduleLoader = moduleLoader;
		this.schemaVersion = migrationRegistry != null ? migrationRegistry.currentVersion() : CURRENT_SCHEMA_VERSION;
	}

	public int schemaVersion() {
		return schemaVersion;
	}

	@Override
	public byte[] serialize(RuntimeState state) {
		ObjectNode json = stateToJson(state);
		try {
			byte[] compressed = compress(mapper.writeValueAsBytes(json));
			byte[] hash = computeHash(compressed);

			ByteArrayOutputStream bos = new ByteArrayOutputStream();
			bos.write(MAGIC);
			bos.write((schemaVersion >> 8) & 0xFF);
			bos.write(schemaVersion & 0xFF);
			bos.write(hash);
			bos.write(compressed);
			return bos.toByteArray();
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to serialize runtime state", e);
		}
	}

	@Override
	public RuntimeState deserialize(byte[] blob) {
		if (blob == null || blob.length < HEADER_LENGTH) {
			throw new IntegrityException("Blob is too short or null");
		}
		for (int i = 0; i < MAGIC.length; i++) {
			if (blob[i] != MAGIC[i]) {
				throw new IntegrityException("Invalid blob magic number");
			}
		}

		int blobVersion = ((blob[4] & 0xFF) << 8) | (blob[5] & 0xFF);
		if (blobVersion < 1 || blobVersion > schemaVersion) {
			throw new DeserializationVersionException(blobVersion,
					"Unsupported blob version " + blobVersion + "; current version is " + schemaVersion);
		}

		byte[] storedHash = Arrays.copyOfRange(blob, 6, HEADER_LENGTH);
		byte[] compressed = Arrays.copyOfRange(blob, HEADER_LENGTH, blob.length);
		if (!Arrays.equals(storedHash, computeHash(compressed))) {
			throw new IntegrityException("Blob integrity check failed - data may have been tampered with");
		}

		ObjectNode json;
		try {
			json = (ObjectNode) mapper.readTree(decompress(compressed));
		}
		catch (IOException | ClassCastException e) {
			throw new IntegrityException("Blob does not contain a state document", e);
		}

		if (blobVersion < schemaVersion) {
			if (migrationRegistry == null) {
				throw new DeserializationVersionException(blobVersion,
						"Blob version " + blobVersion + " requires migration but no registry configured");
			}
			migrationRegistry.migrateToCurrentVersion(json, blobVersion);
		}

		try {
			return jsonToState(json);
		}
		catch (WeaveException e) {
			throw e;
		}
		catch (JsonProcessingException | RuntimeException e) {
			throw new IntegrityException("Failed to read runtime state: " + e.getMessage(), e);
		}
	}

	@Override
	public String toReadableJson(byte[] blob) {
		if (blob == null || blob.length < HEADER_LENGTH) {
			return "{}";
		}
		try {
			byte[] compressed = Arrays.copyOfRange(blob, HEADER_LENGTH, blob.length);
			JsonNode parsed = mapper.readTree(decompress(compressed));
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(parsed);
		}
		catch (IOException e) {
			ObjectNode error = mapper.createObjectNode();
			error.put("error", String.valueOf(e.getMessage()));
			return error.toString();
		}
	}

	// writing

	private ObjectNode stateToJson(RuntimeState state) {
		ObjectNode json = mapper.createObjectNode();
		json.put("status", state.status().name());
		json.put("entryPath", state.entryPath());
		json.put("callCounter", state.callCounter());

		ArrayNode frames = json.putArray("callStack");
		for (Frame frame : state.callStack()) {
			frames.add(frameToJson(frame));
		}

		ArrayNode instructions = json.putArray("instructionStack");
		for (Instruction instruction : state.instructionStack()) {
			instructions.add(toTree(instruction));
		}

		ArrayNode values = json.putArray("valueStack");
		for (Value value : state.valueStack()) {
			values.add(WeaveJson.encode(value));
		}

		json.set("lastResult", WeaveJson.encode(state.lastResult()));
		json.set("pendingRequest", state.pendingRequest() != null ? toTree(state.pendingRequest()) : null);
		if (state.error() != null) {
			ObjectNode error = json.putObject("error");
			error.put("type", state.error().type());
			error.put("message", state.error().message());
		}

		ArrayNode functions = json.putArray("functions");
		for (FunctionEntry function : state.functions().values()) {
			ObjectNode f = functions.addObject();
			f.put("origin", function.origin().name());
			f.set("declaration", toTree(function.declaration()));
		}

		ArrayNode imports = json.putArray("imports");
		for (ImportBinding binding : state.imports().values()) {
			imports.add(toTree(binding));
		}

		ArrayNode modules = json.putArray("modules");
		for (ModuleEntry module : state.moduleTable().entries()) {
			ObjectNode m = modules.addObject();
			m.put("path", module.path());
			m.put("kind", module.kind().name());
		}

		ArrayNode log = json.putArray("aiInteractionLog");
		for (AiInteraction interaction : state.aiInteractionLog()) {
			log.add(toTree(interaction));
		}
		return json;
	}

	private ObjectNode frameToJson(Frame frame) {
		ObjectNode json = mapper.createObjectNode();
		json.put("name", frame.name());
		json.put("modulePath", frame.modulePath());
		ArrayNode locals = json.putArray("locals");
		frame.locals().forEach((name, variable) -> {
			ObjectNode v = locals.addObject();
			v.put("name", name);
			v.set("value", WeaveJson.encode(variable.value()));
			v.put("type", variable.typeAnnotation());
			v.put("isConst", variable.isConst());
		});
		ArrayNode entries = json.putArray("orderedEntries");
		for (FrameEntry entry : frame.orderedEntries()) {
			entries.add(toTree(entry));
		}
		return json;
	}

	/**
	 * Values nested in records are encoded by the value serializer; an
	 * unsupported value surfaces as {@link UnsupportedValueException}.
	 */
	private JsonNode toTree(Object object) {
		try {
			return mapper.valueToTree(object);
		}
		catch (IllegalArgumentException e) {
			Throwable cause = e.getCause();
			while (cause != null) {
				if (cause instanceof UnsupportedValueException unsupported) {
					throw unsupported;
				}
				cause = cause.getCause();
			}
			throw e;
		}
	}

	// reading

	private RuntimeState jsonToState(ObjectNode json) throws JsonProcessingException {
		RuntimeStatus status = RuntimeStatus.valueOf(json.get("status").asText());
		String entryPath = textOrNull(json, "entryPath");
		long callCounter = json.path("callCounter").asLong();

		List<Frame> frames = new ArrayList<>();
		for (JsonNode f : json.path("callStack")) {
			frames.add(jsonToFrame(f));
		}

		List<Instruction> instructions = new ArrayList<>();
		for (JsonNode i : json.path("instructionStack")) {
			instructions.add(mapper.treeToValue(i, Instruction.class));
		}

		List<Value> values = new ArrayList<>();
		for (JsonNode v : json.path("valueStack")) {
			values.add(WeaveJson.decode(v));
		}

		Value lastResult = json.hasNonNull("lastResult") ? WeaveJson.decode(json.get("lastResult")) : Value.NULL;
		PendingRequest pending = json.hasNonNull("pendingRequest")
				? mapper.treeToValue(json.get("pendingRequest"), PendingRequest.class)
				: null;
		ErrorInfo error = json.hasNonNull("error")
				? new ErrorInfo(json.get("error").path("type").asText(), textOrNull(json.get("error"), "message"))
				: null;

		Map<String, FunctionEntry> functions = new LinkedHashMap<>();
		for (JsonNode f : json.path("functions")) {
			Statement.FunctionDecl declaration = mapper.treeToValue(f.get("declaration"), Statement.FunctionDecl.class);
			functions.put(declaration.name(),
					new FunctionEntry(declaration, FunctionOrigin.valueOf(f.path("origin").asText())));
		}

		Map<String, ImportBinding> imports = new LinkedHashMap<>();
		for (JsonNode i : json.path("imports")) {
			ImportBinding binding = mapper.treeToValue(i, ImportBinding.class);
			imports.put(binding.localName(), binding);
		}

		ModuleTable modules = reloadModules(json.path("modules"));

		List<AiInteraction> log = new ArrayList<>();
		for (JsonNode a : json.path("aiInteractionLog")) {
			log.add(mapper.treeToValue(a, AiInteraction.class));
		}

		return new RuntimeState(status, frames, instructions, values, pending, lastResult, error, functions, imports,
				modules, log, callCounter, entryPath);
	}

	private Frame jsonToFrame(JsonNode json) throws JsonProcessingException {
		Map<String, Variable> locals = new LinkedHashMap<>();
		for (JsonNode v : json.path("locals")) {
			locals.put(v.get("name").asText(), new Variable(WeaveJson.decode(v.get("value")), textOrNull(v, "type"),
					v.path("isConst").asBoolean()));
		}
		List<FrameEntry> entries = new ArrayList<>();
		for (JsonNode e : json.path("orderedEntries")) {
			entries.add(mapper.treeToValue(e, FrameEntry.class));
		}
		return new Frame(json.get("name").asText(), textOrNull(json, "modulePath"), locals, entries);
	}

	private ModuleTable reloadModules(JsonNode modules) {
		if (modules.isEmpty()) {
			return new ModuleTable();
		}
		if (moduleLoader == null) {
			throw new IllegalStateException("State references modules but no module loader is configured");
		}
		List<String> paths = new ArrayList<>();
		modules.forEach(m -> paths.add(m.get("path").asText()));
		ModuleTable table = moduleLoader.reload(paths);
		for (JsonNode m : modules) {
			ModuleEntry entry = table.get(m.get("path").asText());
			if (entry == null || entry.kind() != ModuleKind.valueOf(m.get("kind").asText())) {
				throw new IntegrityException("Module '" + m.get("path").asText() + "' no longer resolves to a "
						+ m.get("kind").asText() + " module");
			}
		}
		return table;
	}

	private static String textOrNull(JsonNode node, String field) {
		JsonNode child = node.get(field);
		return child != null && !child.isNull() ? child.asText() : null;
	}

	private static byte[] compress(byte[] data) throws IOException {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		try (GZIPOutputStream gzip = new GZIPOutputStream(bos)) {
			gzip.write(data);
		}
		return bos.toByteArray();
	}

	private static byte[] decompress(byte[] compressed) throws IOException {
		try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
			return gzip.readAllBytes();
		}
	}

	private static byte[] computeHash(byte[] data) {
		try {
			return MessageDigest.getInstance("SHA-256").digest(data);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}
}
