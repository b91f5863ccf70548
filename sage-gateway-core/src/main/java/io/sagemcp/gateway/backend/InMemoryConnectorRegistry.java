/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;

/**
 * {@link ConnectorRegistry} held in memory, for embedding and tests.
 */
public class InMemoryConnectorRegistry implements ConnectorRegistry {

	private final Map<String, ConnectorDefinition> definitions = new ConcurrentHashMap<>();

	public InMemoryConnectorRegistry register(String tenantId, String connectorId, ConnectorDefinition definition) {
		Assert.hasText(tenantId, "tenantId must not be empty");
		Assert.hasText(connectorId, "connectorId must not be empty");
		Assert.notNull(definition, "definition must not be null");
		this.definitions.put(Utils.connectorKey(tenantId, connectorId), definition);
		return this;
	}

	public void unregister(String tenantId, String connectorId) {
		this.definitions.remove(Utils.connectorKey(tenantId, connectorId));
	}

	@Override
	public Optional<ConnectorDefinition> resolve(String tenantId, String connectorId) {
		return Optional.ofNullable(this.definitions.get(Utils.connectorKey(tenantId, connectorId)));
	}

}
