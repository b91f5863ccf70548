/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import io.sagemcp.gateway.spec.GatewayException;

/**
 * Connection or timeout failures persisted past the last retry.
 */
public class UpstreamTimeoutException extends GatewayException {

	private static final long serialVersionUID = 1L;

	public UpstreamTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}

}
