/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.ratelimit;

/**
 * Outcome of one admission check.
 *
 * @param allowed whether the request may proceed
 * @param retryAfterSeconds seconds until the next token, {@code 0} when allowed
 */
public record RateLimitDecision(boolean allowed, double retryAfterSeconds) {

	static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0.0);

	/**
	 * Value for an HTTP {@code Retry-After} header: whole seconds, rounded up past the
	 * fractional wait.
	 */
	public long retryAfterHeaderSeconds() {
		return (long) Math.floor(this.retryAfterSeconds) + 1;
	}

}
