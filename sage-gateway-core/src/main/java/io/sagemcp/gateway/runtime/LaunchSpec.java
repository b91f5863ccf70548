/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * How to launch an external connector process.
 *
 * @param runtimeType declared runtime family, or {@code null} to infer it from the
 * launcher
 * @param command launcher and arguments, unvalidated
 * @param environment extra environment variables for the process
 * @param workingDirectory working directory, or {@code null} for the gateway's
 * @param configuration connector configuration, exported as {@code CONFIG_<KEY>}
 */
public record LaunchSpec(@Nullable RuntimeType runtimeType, List<String> command, Map<String, String> environment,
		@Nullable Path workingDirectory, Map<String, Object> configuration) {

	public LaunchSpec {
		command = (command == null) ? List.of() : List.copyOf(command);
		environment = (environment == null) ? Map.of() : Map.copyOf(environment);
		configuration = (configuration == null) ? Map.of() : Map.copyOf(configuration);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private RuntimeType runtimeType;

		private final List<String> command = new ArrayList<>();

		private final Map<String, String> environment = new LinkedHashMap<>();

		private Path workingDirectory;

		private final Map<String, Object> configuration = new LinkedHashMap<>();

		public Builder runtimeType(RuntimeType runtimeType) {
			this.runtimeType = runtimeType;
			return this;
		}

		public Builder command(List<String> command) {
			this.command.clear();
			this.command.addAll(command);
			return this;
		}

		public Builder command(String... command) {
			return command(List.of(command));
		}

		/**
		 * Sets the command from its stored JSON-array form, e.g.
		 * {@code ["npx", "@modelcontextprotocol/server-github"]}.
		 * @throws LaunchCommandException if the JSON is not an array of strings
		 */
		public Builder commandJson(String commandJson) {
			return command(LaunchCommandResolver.parseCommand(commandJson));
		}

		public Builder environment(String name, String value) {
			this.environment.put(name, value);
			return this;
		}

		public Builder environment(Map<String, String> environment) {
			this.environment.putAll(environment);
			return this;
		}

		public Builder workingDirectory(Path workingDirectory) {
			this.workingDirectory = workingDirectory;
			return this;
		}

		public Builder configuration(String key, Object value) {
			this.configuration.put(key, value);
			return this;
		}

		public Builder configuration(Map<String, Object> configuration) {
			this.configuration.putAll(configuration);
			return this;
		}

		public LaunchSpec build() {
			return new LaunchSpec(this.runtimeType, this.command, this.environment, this.workingDirectory,
					this.configuration);
		}

	}

}
