/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.time.Instant;

import reactor.util.annotation.Nullable;

/**
 * Snapshot published after every process state transition and every health check.
 */
public record ProcessStatusUpdate(String tenantId, String connectorId, ProcessStatus status, @Nullable Long pid,
		@Nullable RuntimeType runtimeType, @Nullable String errorMessage, int restartCount,
		@Nullable Instant lastHealthCheck) {

}
