/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

/**
 * Receives process status for persistence outside the gateway core.
 */
@FunctionalInterface
public interface ProcessStatusListener {

	ProcessStatusListener NOOP = update -> {
	};

	void onStatusUpdate(ProcessStatusUpdate update);

}
