/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.util.Optional;

import reactor.util.annotation.Nullable;

/**
 * Outcome of one outward call, as seen by {@link RetryPolicy}. Failures are values, so
 * the retry loop dispatches on a classification instead of catching client-specific
 * exception types.
 *
 * @param <T> the success value type
 */
public sealed interface UpstreamResult<T> {

	static <T> UpstreamResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> UpstreamResult<T> httpFailure(int status, @Nullable String retryAfterHeader, @Nullable String body) {
		return new HttpFailure<>(status, retryAfterHeader, body);
	}

	static <T> UpstreamResult<T> connectionFailure(Throwable cause) {
		return new ConnectionFailure<>(cause);
	}

	record Success<T>(T value) implements UpstreamResult<T> {
	}

	/**
	 * The upstream answered with a non-success status.
	 *
	 * @param status the HTTP status code
	 * @param retryAfterHeader raw {@code Retry-After} header value, if any
	 * @param body response body, if any
	 */
	record HttpFailure<T>(int status, @Nullable String retryAfterHeader,
			@Nullable String body) implements UpstreamResult<T> {

		/**
		 * The {@code Retry-After} value in seconds, when it is a non-negative number.
		 * HTTP-date values are not interpreted.
		 */
		public Optional<Double> retryAfterSeconds() {
			if (this.retryAfterHeader == null) {
				return Optional.empty();
			}
			try {
				double seconds = Double.parseDouble(this.retryAfterHeader.trim());
				return (seconds >= 0 && Double.isFinite(seconds)) ? Optional.of(seconds) : Optional.empty();
			}
			catch (NumberFormatException ex) {
				return Optional.empty();
			}
		}

	}

	/**
	 * No HTTP response at all: connect failure or timeout.
	 */
	record ConnectionFailure<T>(Throwable cause) implements UpstreamResult<T> {
	}

}
