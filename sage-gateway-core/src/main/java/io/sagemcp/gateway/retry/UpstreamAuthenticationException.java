/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import io.sagemcp.gateway.spec.GatewayException;

/**
 * The upstream rejected the credentials (401/403). Never retried.
 */
public class UpstreamAuthenticationException extends GatewayException {

	private static final long serialVersionUID = 1L;

	private final int statusCode;

	public UpstreamAuthenticationException(int statusCode) {
		super("Authentication failed: HTTP " + statusCode);
		this.statusCode = statusCode;
	}

	public int getStatusCode() {
		return this.statusCode;
	}

}
