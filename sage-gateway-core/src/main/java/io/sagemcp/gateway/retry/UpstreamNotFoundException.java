/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

/**
 * The upstream answered 404. Never retried.
 */
public class UpstreamNotFoundException extends UpstreamApiException {

	private static final long serialVersionUID = 1L;

	public UpstreamNotFoundException() {
		super("Not found: HTTP 404", 404, null);
	}

}
