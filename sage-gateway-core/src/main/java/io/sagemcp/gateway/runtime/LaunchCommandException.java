/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import io.sagemcp.gateway.spec.BackendUnavailableException;

/**
 * A launch command that cannot be spawned: malformed, empty, or rejected by the OS.
 */
public class LaunchCommandException extends BackendUnavailableException {

	private static final long serialVersionUID = 1L;

	public LaunchCommandException(String message) {
		super(message);
	}

	public LaunchCommandException(String message, Throwable cause) {
		super(message, cause);
	}

}
