/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import reactor.util.annotation.Nullable;

/**
 * Creates an uninitialized backend for a (tenant, connector) key. Called by the server
 * pool on a cache miss.
 */
@FunctionalInterface
public interface BackendFactory {

	/**
	 * @throws io.sagemcp.gateway.spec.BackendUnavailableException if the connector cannot
	 * be resolved
	 */
	Backend create(String tenantId, String connectorId, @Nullable String userToken);

}
