/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import io.sagemcp.gateway.spec.GatewayException;
import io.sagemcp.gateway.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * The upstream answered with an error status that was not retried or whose retries are
 * exhausted.
 */
public class UpstreamApiException extends GatewayException {

	private static final long serialVersionUID = 1L;

	static final int MAX_BODY_LENGTH = 500;

	private final int statusCode;

	private final String responseBody;

	public UpstreamApiException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = Utils.truncate(responseBody, MAX_BODY_LENGTH);
	}

	public int getStatusCode() {
		return this.statusCode;
	}

	public String getResponseBody() {
		return this.responseBody;
	}

}
