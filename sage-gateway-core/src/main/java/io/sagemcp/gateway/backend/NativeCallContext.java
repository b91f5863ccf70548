/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.Optional;

import io.sagemcp.gateway.retry.RetryPolicy;
import reactor.util.annotation.Nullable;

/**
 * What a native tool or resource handler knows about the call it serves.
 *
 * @param retryPolicy policy for the handler's outbound HTTP calls, e.g. through
 * {@link io.sagemcp.gateway.retry.HttpUpstream}
 */
public record NativeCallContext(String tenantId, String connectorId, @Nullable String userToken,
		RetryPolicy retryPolicy) {

	public Optional<String> token() {
		return Optional.ofNullable(this.userToken);
	}

}
