/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.ratelimit;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RateLimiterTests {

	private final AtomicReference<Double> now = new AtomicReference<>(0.0);

	@Test
	void bucketsAreCreatedLazilyPerTenant() {
		RateLimiter limiter = new RateLimiter(60, this.now::get);
		assertThat(limiter.tenantCount()).isZero();

		limiter.tryConsume("acme");
		limiter.tryConsume("globex");
		limiter.tryConsume("acme");

		assertThat(limiter.tenantCount()).isEqualTo(2);
	}

	@Test
	void tenantsDoNotShareBudget() {
		RateLimiter limiter = new RateLimiter(2, this.now::get);

		assertThat(limiter.tryConsume("acme")).isTrue();
		assertThat(limiter.tryConsume("acme")).isTrue();
		assertThat(limiter.tryConsume("acme")).isFalse();

		assertThat(limiter.tryConsume("globex")).isTrue();
	}

	@Test
	void deniedDecisionCarriesRetryAfter() {
		RateLimiter limiter = new RateLimiter(1, this.now::get);
		limiter.tryConsume("acme");

		RateLimitDecision decision = limiter.tryAcquire("acme");

		assertThat(decision.allowed()).isFalse();
		assertThat(decision.retryAfterSeconds()).isCloseTo(60.0, within(1e-6));
		assertThat(decision.retryAfterHeaderSeconds()).isBetween(60L, 61L);
		assertThat(limiter.timeUntilToken("acme")).isCloseTo(60.0, within(1e-6));
	}

	@Test
	void allowedDecisionHasNoWait() {
		RateLimiter limiter = new RateLimiter(10, this.now::get);

		RateLimitDecision decision = limiter.tryAcquire("acme");

		assertThat(decision.allowed()).isTrue();
		assertThat(decision.retryAfterSeconds()).isZero();
	}

	@Test
	void tenantLimitReplacesBucketWithFullOne() {
		RateLimiter limiter = new RateLimiter(1, this.now::get);
		limiter.tryConsume("acme");
		assertThat(limiter.tryConsume("acme")).isFalse();

		limiter.setTenantLimit("acme", 3);

		assertThat(limiter.tryConsume("acme")).isTrue();
		assertThat(limiter.tryConsume("acme")).isTrue();
		assertThat(limiter.tryConsume("acme")).isTrue();
		assertThat(limiter.tryConsume("acme")).isFalse();
		assertThat(limiter.tryConsume("globex")).isTrue();
		assertThat(limiter.tryConsume("globex")).isFalse();
	}

	@Test
	void refillRestoresAdmission() {
		RateLimiter limiter = new RateLimiter(60, this.now::get);
		for (int i = 0; i < 60; i++) {
			limiter.tryConsume("acme");
		}
		assertThat(limiter.tryConsume("acme")).isFalse();

		this.now.set(1.0);

		assertThat(limiter.tryConsume("acme")).isTrue();
	}

}
