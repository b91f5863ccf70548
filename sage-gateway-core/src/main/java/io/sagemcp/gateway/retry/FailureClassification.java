/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

/**
 * How {@link RetryPolicy} treats a failed outward call.
 */
public enum FailureClassification {

	/** 429 and 500/502/503/504: retried until exhausted. */
	RETRYABLE_HTTP,

	/** 401 and 403: raised immediately. */
	AUTH,

	/** 404: raised immediately. */
	NOT_FOUND,

	/** Any other status: raised immediately as an API error. */
	OTHER_HTTP,

	/** Connect failure or timeout: retried until exhausted. */
	CONNECTION;

	public static FailureClassification ofStatus(int status) {
		return switch (status) {
			case 429, 500, 502, 503, 504 -> RETRYABLE_HTTP;
			case 401, 403 -> AUTH;
			case 404 -> NOT_FOUND;
			default -> OTHER_HTTP;
		};
	}

	public static FailureClassification of(UpstreamResult<?> failure) {
		if (failure instanceof UpstreamResult.HttpFailure<?> http) {
			return ofStatus(http.status());
		}
		if (failure instanceof UpstreamResult.ConnectionFailure<?>) {
			return CONNECTION;
		}
		throw new IllegalArgumentException("Not a failure: " + failure);
	}

	public boolean isRetryable() {
		return this == RETRYABLE_HTTP || this == CONNECTION;
	}

}
