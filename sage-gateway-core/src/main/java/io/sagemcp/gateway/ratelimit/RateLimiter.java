/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.ratelimit;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-tenant admission control. Buckets are created lazily at the default
 * requests-per-minute budget; {@link #setTenantLimit(String, int)} replaces a tenant's
 * bucket with a full one at the new rate.
 */
public class RateLimiter {

	private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

	private final int defaultRequestsPerMinute;

	private final DoubleSupplier clock;

	private final Map<String, TokenBucket> buckets = new HashMap<>();

	private final ReentrantLock lock = new ReentrantLock();

	public RateLimiter(int defaultRequestsPerMinute) {
		this(defaultRequestsPerMinute, Utils::monotonicSeconds);
	}

	public RateLimiter(int defaultRequestsPerMinute, DoubleSupplier clock) {
		Assert.isTrue(defaultRequestsPerMinute > 0, "defaultRequestsPerMinute must be positive");
		Assert.notNull(clock, "clock must not be null");
		this.defaultRequestsPerMinute = defaultRequestsPerMinute;
		this.clock = clock;
	}

	private TokenBucket bucketFor(String tenant) {
		return this.buckets.computeIfAbsent(tenant,
				t -> TokenBucket.perMinute(this.defaultRequestsPerMinute, this.clock));
	}

	public boolean tryConsume(String tenant) {
		return tryAcquire(tenant).allowed();
	}

	public RateLimitDecision tryAcquire(String tenant) {
		Assert.hasText(tenant, "tenant must not be empty");
		this.lock.lock();
		try {
			TokenBucket bucket = bucketFor(tenant);
			if (bucket.tryConsume()) {
				return RateLimitDecision.ALLOWED;
			}
			double retryAfter = bucket.timeUntilToken();
			logger.warn("Rate limit exceeded for tenant {}, retry after {}s", tenant, retryAfter);
			return new RateLimitDecision(false, retryAfter);
		}
		finally {
			this.lock.unlock();
		}
	}

	public double timeUntilToken(String tenant) {
		this.lock.lock();
		try {
			return bucketFor(tenant).timeUntilToken();
		}
		finally {
			this.lock.unlock();
		}
	}

	public void setTenantLimit(String tenant, int requestsPerMinute) {
		Assert.hasText(tenant, "tenant must not be empty");
		TokenBucket replacement = TokenBucket.perMinute(requestsPerMinute, this.clock);
		this.lock.lock();
		try {
			this.buckets.put(tenant, replacement);
		}
		finally {
			this.lock.unlock();
		}
		logger.info("Rate limit for tenant {} set to {} rpm", tenant, requestsPerMinute);
	}

	public int tenantCount() {
		this.lock.lock();
		try {
			return this.buckets.size();
		}
		finally {
			this.lock.unlock();
		}
	}

}
