/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import io.sagemcp.gateway.spec.BackendUnavailableException;

/**
 * The process started but died during startup or never completed the MCP handshake.
 */
public class ConnectorInitializationException extends BackendUnavailableException {

	private static final long serialVersionUID = 1L;

	public ConnectorInitializationException(String message) {
		super(message);
	}

	public ConnectorInitializationException(String message, Throwable cause) {
		super(message, cause);
	}

}
