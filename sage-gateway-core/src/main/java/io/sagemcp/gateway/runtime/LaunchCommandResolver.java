/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Turns a {@link ConnectorDescriptor} into a launch that can be handed to
 * {@link ProcessBuilder}: validates the executable, applies launcher conventions and
 * builds the process environment.
 */
public class LaunchCommandResolver {

	private static final Logger logger = LoggerFactory.getLogger(LaunchCommandResolver.class);

	private static final ObjectMapper COMMAND_MAPPER = new ObjectMapper();

	private final Path scratchDirectory;

	private final Map<String, String> ambientEnvironment;

	public LaunchCommandResolver(Path scratchDirectory) {
		this(scratchDirectory, System.getenv());
	}

	public LaunchCommandResolver(Path scratchDirectory, Map<String, String> ambientEnvironment) {
		Assert.notNull(scratchDirectory, "scratchDirectory must not be null");
		Assert.notNull(ambientEnvironment, "ambientEnvironment must not be null");
		this.scratchDirectory = scratchDirectory;
		this.ambientEnvironment = Map.copyOf(ambientEnvironment);
	}

	/**
	 * Parses the stored JSON-array form of a command.
	 * @throws LaunchCommandException if the JSON is malformed or not an array of strings
	 */
	public static List<String> parseCommand(String commandJson) {
		if (!Utils.hasText(commandJson)) {
			throw new LaunchCommandException("Runtime command is required for external MCP connectors");
		}
		try {
			return COMMAND_MAPPER.readValue(commandJson, new TypeReference<List<String>>() {
			});
		}
		catch (JsonProcessingException ex) {
			throw new LaunchCommandException("Invalid runtime command JSON: " + commandJson, ex);
		}
	}

	public ResolvedLaunch resolve(ConnectorDescriptor descriptor, @Nullable String oauthToken) {
		LaunchSpec spec = descriptor.launchSpec();
		List<String> command = validate(spec.command());
		String launcher = launcherName(command.get(0));

		Map<String, String> environment = new LinkedHashMap<>(this.ambientEnvironment);
		environment.putAll(spec.environment());

		if ("npx".equals(launcher) && !command.contains("-y") && !command.contains("--yes")) {
			command.add(1, "-y");
		}
		if ("uvx".equals(launcher) && !isUsableHome(this.ambientEnvironment.get("HOME"))) {
			environment.putAll(writableCacheEnvironment());
		}

		String token = (oauthToken != null) ? oauthToken : "";
		environment.put("OAUTH_TOKEN", token);
		environment.put("ACCESS_TOKEN", token);
		environment.put("TENANT_ID", descriptor.tenantId());
		environment.put("CONNECTOR_ID", descriptor.connectorId());
		environment.put("SAGEMCP_MODE", "hosted");
		spec.configuration()
			.forEach((key, value) -> environment.put("CONFIG_" + key.toUpperCase(Locale.ROOT), String.valueOf(value)));

		RuntimeType runtimeType = (spec.runtimeType() != null) ? spec.runtimeType() : RuntimeType.infer(command.get(0));
		logger.debug("Resolved launch for {}: {} ({})", descriptor.key(), command, runtimeType.value());
		return new ResolvedLaunch(command, environment, runtimeType, spec.workingDirectory());
	}

	private static List<String> validate(List<String> command) {
		if (command.isEmpty()) {
			throw new LaunchCommandException("Runtime command is required for external MCP connectors");
		}
		String executable = command.get(0);
		if (executable == null || executable.isBlank()) {
			throw new LaunchCommandException("Runtime command has a blank executable: " + command);
		}
		List<String> validated = new ArrayList<>(command.size());
		validated.add(executable.trim());
		for (int i = 1; i < command.size(); i++) {
			String argument = command.get(i);
			if (argument == null) {
				throw new LaunchCommandException("Runtime command has a null argument at position " + i);
			}
			validated.add(argument);
		}
		return validated;
	}

	private static String launcherName(String executable) {
		int slash = Math.max(executable.lastIndexOf('/'), executable.lastIndexOf('\\'));
		return executable.substring(slash + 1).toLowerCase(Locale.ROOT);
	}

	private static boolean isUsableHome(@Nullable String home) {
		if (!Utils.hasText(home)) {
			return false;
		}
		Path path = Path.of(home);
		return Files.isDirectory(path) && Files.isWritable(path);
	}

	private Map<String, String> writableCacheEnvironment() {
		Path home = this.scratchDirectory.resolve("home");
		Path cache = this.scratchDirectory.resolve("cache");
		Path uvCache = cache.resolve("uv");
		try {
			Files.createDirectories(home);
			Files.createDirectories(uvCache);
		}
		catch (IOException ex) {
			throw new LaunchCommandException("Cannot prepare scratch directory " + this.scratchDirectory, ex);
		}
		logger.info("Home directory unusable, redirecting uvx caches to {}", this.scratchDirectory);
		Map<String, String> overrides = new LinkedHashMap<>();
		overrides.put("HOME", home.toString());
		overrides.put("XDG_CACHE_HOME", cache.toString());
		overrides.put("UV_CACHE_DIR", uvCache.toString());
		return overrides;
	}

}
