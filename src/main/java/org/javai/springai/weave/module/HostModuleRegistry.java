package org.javai.springai.weave.module;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host modules available for import, by resolved path. Each module is
 * created at most once, when its exports are first needed.
 */
public final class HostModuleRegistry {

	private static final Logger logger = LoggerFactory.getLogger(HostModuleRegistry.class);

	private final Map<String, Supplier<HostModule>> modules;

	private HostModuleRegistry(Map<String, Supplier<HostModule>> modules) {
		this.modules = Map.copyOf(modules);
	}

	public static HostModuleRegistry empty() {
		return new HostModuleRegistry(Map.of());
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean contains(String path) {
		return modules.containsKey(path);
	}

	public Optional<Supplier<HostModule>> find(String path) {
		return Optional.ofNullable(modules.get(path));
	}

	public Set<String> paths() {
		return modules.keySet();
	}

	private static Supplier<HostModule> memoize(String path, Supplier<HostModule> factory) {
		return new Supplier<>() {
			private HostModule module;

			@Override
			public synchronized HostModule get() {
				if (module == null) {
					logger.debug("Evaluating host module '{}'", path);
					module = factory.get();
				}
				return module;
			}
		};
	}

	public static final class Builder {
		private final Map<String, Supplier<HostModule>> modules = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder module(String path, Supplier<HostModule> factory) {
			modules.put(path, memoize(path, factory));
			return this;
		}

		public Builder module(String path, HostModule module) {
			return module(path, () -> module);
		}

		public HostModuleRegistry build() {
			return new HostModuleRegistry(modules);
		}
	}
}
