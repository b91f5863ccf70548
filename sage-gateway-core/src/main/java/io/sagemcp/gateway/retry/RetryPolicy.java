/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Classification-driven retry for outward calls made by connectors.
 *
 * <p>
 * A call is attempted at most {@code maxRetries + 1} times. 429 and 500/502/503/504
 * responses and connection failures are retried; 401/403 and 404 are raised at once; any
 * other status is raised at once as an {@link UpstreamApiException}. The wait before a
 * retry honours a numeric {@code Retry-After} header (capped at {@code maxDelay}),
 * otherwise it is drawn uniformly from {@code [0, min(maxDelay, baseDelay * 2^attempt)]}.
 */
public class RetryPolicy {

	private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

	public static final int DEFAULT_MAX_RETRIES = 3;

	public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

	public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

	private final int maxRetries;

	private final Duration baseDelay;

	private final Duration maxDelay;

	private final Sleeper sleeper;

	private final Supplier<Random> random;

	public RetryPolicy() {
		this(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
	}

	public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
		this(maxRetries, baseDelay, maxDelay, Sleeper.REACTOR, ThreadLocalRandom::current);
	}

	public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, Sleeper sleeper,
			Supplier<Random> random) {
		Assert.isTrue(maxRetries >= 0, "maxRetries must not be negative");
		Assert.notNull(baseDelay, "baseDelay must not be null");
		Assert.notNull(maxDelay, "maxDelay must not be null");
		Assert.notNull(sleeper, "sleeper must not be null");
		Assert.notNull(random, "random must not be null");
		this.maxRetries = maxRetries;
		this.baseDelay = baseDelay;
		this.maxDelay = maxDelay;
		this.sleeper = sleeper;
		this.random = random;
	}

	/**
	 * Runs {@code call}, retrying according to this policy.
	 * @param call produces one attempt; subscribed once per attempt
	 * @return the success value, or the classified terminal error
	 */
	public <T> Mono<T> execute(Supplier<Mono<UpstreamResult<T>>> call) {
		Assert.notNull(call, "call must not be null");
		return attempt(call, 0);
	}

	private <T> Mono<T> attempt(Supplier<Mono<UpstreamResult<T>>> call, int attempt) {
		return Mono.defer(call).flatMap(result -> {
			if (result instanceof UpstreamResult.Success<T> success) {
				return Mono.justOrEmpty(success.value());
			}
			FailureClassification classification = FailureClassification.of(result);
			if (classification.isRetryable() && attempt < this.maxRetries) {
				Duration delay = computeDelay(attempt, result);
				logger.warn("Retryable {} (attempt {}/{}), waiting {} ms", describe(result), attempt + 1,
						this.maxRetries, delay.toMillis());
				return this.sleeper.sleep(delay).then(Mono.defer(() -> attempt(call, attempt + 1)));
			}
			return Mono.error(terminalError(result, classification));
		});
	}

	Duration computeDelay(int attempt, UpstreamResult<?> failure) {
		if (failure instanceof UpstreamResult.HttpFailure<?> http) {
			Optional<Double> retryAfter = http.retryAfterSeconds();
			if (retryAfter.isPresent()) {
				Duration requested = secondsToDuration(retryAfter.get());
				return requested.compareTo(this.maxDelay) > 0 ? this.maxDelay : requested;
			}
		}
		double exponential = toSeconds(this.baseDelay) * Math.pow(2, attempt);
		double ceiling = Math.min(toSeconds(this.maxDelay), exponential);
		return secondsToDuration(this.random.get().nextDouble() * ceiling);
	}

	private RuntimeException terminalError(UpstreamResult<?> failure, FailureClassification classification) {
		if (failure instanceof UpstreamResult.ConnectionFailure<?> connection) {
			return new UpstreamTimeoutException("Request failed after " + this.maxRetries + " retries: "
					+ connection.cause().getClass().getSimpleName(), connection.cause());
		}
		UpstreamResult.HttpFailure<?> http = (UpstreamResult.HttpFailure<?>) failure;
		return switch (classification) {
			case AUTH -> new UpstreamAuthenticationException(http.status());
			case NOT_FOUND -> new UpstreamNotFoundException();
			default -> (http.status() == 429) ? new UpstreamRateLimitedException(http.retryAfterSeconds().orElse(null))
					: new UpstreamApiException("API error: HTTP " + http.status(), http.status(), http.body());
		};
	}

	private static String describe(UpstreamResult<?> failure) {
		if (failure instanceof UpstreamResult.HttpFailure<?> http) {
			return "HTTP " + http.status();
		}
		return "connection error " + ((UpstreamResult.ConnectionFailure<?>) failure).cause().getClass().getSimpleName();
	}

	private static double toSeconds(Duration duration) {
		return duration.toNanos() / 1_000_000_000.0;
	}

	private static Duration secondsToDuration(double seconds) {
		return Duration.ofNanos((long) (seconds * 1_000_000_000L));
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

}
