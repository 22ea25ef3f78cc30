package org.javai.springai.weave.module;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.javai.springai.weave.ast.Expression;
import org.javai.springai.weave.ast.ImportSpecifier;
import org.javai.springai.weave.ast.ObjectProperty;
import org.javai.springai.weave.ast.Program;
import org.javai.springai.weave.ast.Statement;
import org.javai.springai.weave.state.FunctionEntry;
import org.javai.springai.weave.state.FunctionOrigin;
import org.javai.springai.weave.state.ImportBinding;
import org.javai.springai.weave.value.TypeCoercion;
import org.javai.springai.weave.value.Value;
import org.javai.springai.weave.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a program's imports before it runs.
 *
 * <p>Loading descends the import graph depth first. Modules are cached in the
 * {@link ModuleTable} by resolved path, so a module imported along several
 * paths is parsed once. A path met again while it is still being loaded is a
 * cycle and fails the whole load with a {@link CircularDependencyException}.
 * Paths registered with the {@link HostModuleRegistry} resolve to host
 * modules; every other path is read from the {@link ModuleSource}.</p>
 *
 * <p>Module-level {@code let}/{@code const} initializers are evaluated at load
 * time and must be constant expressions.</p>
 */
public class ModuleLoader {

	private static final Logger logger = LoggerFactory.getLogger(ModuleLoader.class);

	private final ModuleSource source;
	private final HostModuleRegistry hostModules;

	public ModuleLoader(ModuleSource source) {
		this(source, HostModuleRegistry.empty());
	}

	public ModuleLoader(ModuleSource source, HostModuleRegistry hostModules) {
		this.source = source;
		this.hostModules = hostModules;
	}

	/**
	 * Loads every module the entry program imports, transitively.
	 *
	 * @param program the entry program
	 * @param entryPath resolved path of the entry program, the base for its relative imports
	 */
	public LoadedProgram loadEntry(Program program, String entryPath) {
		ModuleTable table = new ModuleTable();
		Set<String> loading = new LinkedHashSet<>();
		loading.add(entryPath);
		Map<String, ImportBinding> bindings = loadImports(program, entryPath, table, loading);
		logger.debug("Loaded {} module(s) for '{}'", table.size(), entryPath);
		return new LoadedProgram(table, bindings);
	}

	/**
	 * Rebuilds a module table from resolved paths, as recorded in a serialized state.
	 */
	public ModuleTable reload(Collection<String> paths) {
		ModuleTable table = new ModuleTable();
		for (String path : paths) {
			loadModule(path, table, new LinkedHashSet<>());
		}
		return table;
	}

	private ModuleEntry loadModule(String path, ModuleTable table, Set<String> loading) {
		ModuleEntry cached = table.get(path);
		if (cached != null) {
			logger.debug("Module '{}' already loaded", path);
			return cached;
		}
		Optional<Supplier<HostModule>> host = hostModules.find(path);
		if (host.isPresent()) {
			ModuleEntry entry = ModuleEntry.host(path, host.get());
			table.put(entry);
			return entry;
		}
		if (loading.contains(path)) {
			List<String> cycle = new ArrayList<>(loading);
			cycle = cycle.subList(cycle.indexOf(path), cycle.size());
			List<String> chain = new ArrayList<>(cycle);
			chain.add(path);
			throw new CircularDependencyException(chain);
		}
		Program program = source.load(path);
		Set<String> nested = new LinkedHashSet<>(loading);
		nested.add(path);
		Map<String, ImportBinding> imports = loadImports(program, path, table, nested);

		Map<String, FunctionEntry> functions = new LinkedHashMap<>();
		Map<String, Value> values = new LinkedHashMap<>();
		Set<String> exports = new LinkedHashSet<>();
		for (Statement statement : program.statements()) {
			Statement declaration = statement;
			if (statement instanceof Statement.Export export) {
				declaration = export.declaration();
				exports.add(export.name());
			}
			if (declaration instanceof Statement.FunctionDecl function) {
				functions.put(function.name(), new FunctionEntry(function, FunctionOrigin.MODULE));
			}
			else if (declaration instanceof Statement.Let let) {
				values.put(let.name(), TypeCoercion.coerce(constant(path, let.initializer()), let.type()));
			}
			else if (declaration instanceof Statement.Const constant) {
				values.put(constant.name(), TypeCoercion.coerce(constant(path, constant.initializer()), constant.type()));
			}
			else if (declaration instanceof Statement.Model model) {
				values.put(model.name(), new Value.ModelRef(model.name(), model.modelName(), model.provider(), model.url(),
						model.apiKeyEnv(), model.maxRetriesOnError(), model.tools()));
			}
		}
		ModuleEntry entry = ModuleEntry.language(path, functions, values, exports, imports);
		table.put(entry);
		logger.debug("Loaded module '{}' exporting {}", path, exports);
		return entry;
	}

	private Map<String, ImportBinding> loadImports(Program program, String importerPath, ModuleTable table,
			Set<String> loading) {
		Set<String> declared = declaredNames(program);
		Map<String, ImportBinding> bindings = new LinkedHashMap<>();
		for (Statement statement : program.statements()) {
			if (!(statement instanceof Statement.Import importStatement)) {
				continue;
			}
			String path = source.resolve(importerPath, importStatement.source());
			ModuleEntry module = loadModule(path, table, loading);
			for (ImportSpecifier specifier : importStatement.specifiers()) {
				if (!module.hasExport(specifier.name())) {
					throw new ExportNotFoundException(path, specifier.name());
				}
				ImportBinding binding = new ImportBinding(specifier.localName(), path, specifier.name(), module.kind());
				bind(bindings, declared, binding, importerPath);
			}
		}
		return bindings;
	}

	private static void bind(Map<String, ImportBinding> bindings, Set<String> declared, ImportBinding binding,
			String importerPath) {
		String name = binding.localName();
		if (declared.contains(name)) {
			throw new ImportConflictException(name,
					"'" + name + "' is imported into '" + importerPath + "' but also declared there");
		}
		ImportBinding existing = bindings.get(name);
		if (existing != null) {
			if (existing.sameTargetAs(binding)) {
				return;
			}
			throw new ImportConflictException(name, "'" + name + "' is already imported from '" + existing.modulePath() + "'");
		}
		bindings.put(name, binding);
	}

	private static Set<String> declaredNames(Program program) {
		Set<String> names = new LinkedHashSet<>();
		for (Statement statement : program.statements()) {
			Statement declaration = statement instanceof Statement.Export export ? export.declaration() : statement;
			if (declaration instanceof Statement.FunctionDecl function) {
				names.add(function.name());
			}
			else if (declaration instanceof Statement.Let let) {
				names.add(let.name());
			}
			else if (declaration instanceof Statement.Const constant) {
				names.add(constant.name());
			}
			else if (declaration instanceof Statement.Model model) {
				names.add(model.name());
			}
		}
		return names;
	}

	/**
	 * Evaluates a module-level initializer, which may only be built from literals.
	 */
	private static Value constant(String path, Expression expression) {
		if (expression == null || expression instanceof Expression.NullLiteral) {
			return Value.NULL;
		}
		if (expression instanceof Expression.StringLiteral literal) {
			return Value.text(literal.value());
		}
		if (expression instanceof Expression.TemplateLiteral template) {
			return Value.text(template.template());
		}
		if (expression instanceof Expression.NumberLiteral literal) {
			return Value.number(literal.value());
		}
		if (expression instanceof Expression.BooleanLiteral literal) {
			return Value.bool(literal.value());
		}
		if (expression instanceof Expression.ArrayLiteral array) {
			List<Value> elements = new ArrayList<>();
			for (Expression element : array.elements()) {
				elements.add(constant(path, element));
			}
			return Value.array(elements);
		}
		if (expression instanceof Expression.ObjectLiteral object) {
			Map<String, Object> fields = new LinkedHashMap<>();
			for (ObjectProperty property : object.properties()) {
				fields.put(property.key(), Values.toJsonNode(constant(path, property.value())));
			}
			return Values.fromJava(fields);
		}
		throw new ModuleLoadException(path, "Module-level initializers in '" + path + "' must be constant expressions");
	}
}
