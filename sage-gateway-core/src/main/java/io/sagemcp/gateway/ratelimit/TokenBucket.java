/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.ratelimit;

import java.util.function.DoubleSupplier;

import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;

/**
 * Token bucket with continuous refill. The token count stays within
 * {@code [0, capacity]}; every refill clamps at capacity.
 *
 * <p>
 * Not thread-safe on its own; {@link RateLimiter} serializes access.
 */
public class TokenBucket {

	private final double capacity;

	private final double refillRate;

	private final DoubleSupplier clock;

	private double tokens;

	private double lastRefill;

	public TokenBucket(double capacity, double refillRate) {
		this(capacity, refillRate, Utils::monotonicSeconds);
	}

	public TokenBucket(double capacity, double refillRate, DoubleSupplier clock) {
		Assert.isTrue(capacity > 0, "capacity must be positive");
		Assert.isTrue(refillRate > 0, "refillRate must be positive");
		Assert.notNull(clock, "clock must not be null");
		this.capacity = capacity;
		this.refillRate = refillRate;
		this.clock = clock;
		this.tokens = capacity;
		this.lastRefill = clock.getAsDouble();
	}

	/**
	 * Bucket sized for a requests-per-minute budget: capacity equals one minute's
	 * allowance, refilled at {@code rpm / 60} tokens per second.
	 */
	public static TokenBucket perMinute(int requestsPerMinute, DoubleSupplier clock) {
		Assert.isTrue(requestsPerMinute > 0, "requestsPerMinute must be positive");
		return new TokenBucket(requestsPerMinute, requestsPerMinute / 60.0, clock);
	}

	private void refill(double now) {
		double elapsed = now - this.lastRefill;
		if (elapsed > 0) {
			this.tokens = Math.min(this.capacity, this.tokens + elapsed * this.refillRate);
		}
		this.lastRefill = now;
	}

	public boolean tryConsume() {
		return tryConsume(this.clock.getAsDouble());
	}

	public boolean tryConsume(double now) {
		refill(now);
		if (this.tokens >= 1.0) {
			this.tokens -= 1.0;
			return true;
		}
		return false;
	}

	/**
	 * Seconds until one whole token is available; {@code 0} when one already is.
	 */
	public double timeUntilToken() {
		refill(this.clock.getAsDouble());
		if (this.tokens >= 1.0) {
			return 0.0;
		}
		return (1.0 - this.tokens) / this.refillRate;
	}

	public double getTokens() {
		return this.tokens;
	}

	public double getCapacity() {
		return this.capacity;
	}

	public double getRefillRate() {
		return this.refillRate;
	}

}
