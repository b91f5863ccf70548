/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.Optional;

/**
 * Resolves a tenant's connector to its definition. Implementations live outside the
 * gateway core, typically backed by tenant and connector storage.
 */
public interface ConnectorRegistry {

	/**
	 * @return the definition, or empty when the tenant or connector is unknown or inactive
	 */
	Optional<ConnectorDefinition> resolve(String tenantId, String connectorId);

}
