/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.time.Duration;

import reactor.core.publisher.Mono;

/**
 * Waits between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

	Sleeper REACTOR = delay -> Mono.delay(delay).then();

	Mono<Void> sleep(Duration delay);

}
