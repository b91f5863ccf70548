/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * A validated launch: the exact argv, the full process environment and the effective
 * runtime family.
 */
public record ResolvedLaunch(List<String> command, Map<String, String> environment, RuntimeType runtimeType,
		@Nullable Path workingDirectory) {

	public ResolvedLaunch {
		command = List.copyOf(command);
		environment = Map.copyOf(environment);
	}

	public String executable() {
		return this.command.get(0);
	}

}
