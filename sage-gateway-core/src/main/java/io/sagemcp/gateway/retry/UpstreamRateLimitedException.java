/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.util.Optional;

import io.sagemcp.gateway.spec.GatewayException;
import reactor.util.annotation.Nullable;

/**
 * The upstream kept answering 429 until retries were exhausted.
 */
public class UpstreamRateLimitedException extends GatewayException {

	private static final long serialVersionUID = 1L;

	@Nullable
	private final Double retryAfter;

	public UpstreamRateLimitedException(@Nullable Double retryAfter) {
		super("Rate limited: HTTP 429");
		this.retryAfter = retryAfter;
	}

	/**
	 * The last {@code Retry-After} value the upstream sent, in seconds.
	 */
	public Optional<Double> getRetryAfter() {
		return Optional.ofNullable(this.retryAfter);
	}

}
