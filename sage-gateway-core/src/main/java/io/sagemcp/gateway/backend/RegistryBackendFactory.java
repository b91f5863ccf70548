/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import io.sagemcp.gateway.retry.RetryPolicy;
import io.sagemcp.gateway.runtime.ConnectorDescriptor;
import io.sagemcp.gateway.runtime.ProcessManager;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Picks the backend variant from the connector's registry definition.
 */
public class RegistryBackendFactory implements BackendFactory {

	private static final Logger logger = LoggerFactory.getLogger(RegistryBackendFactory.class);

	private final ConnectorRegistry registry;

	private final ProcessManager processManager;

	private final RetryPolicy retryPolicy;

	public RegistryBackendFactory(ConnectorRegistry registry, ProcessManager processManager) {
		this(registry, processManager, new RetryPolicy());
	}

	/**
	 * @param retryPolicy handed to native backends that do not bring their own
	 */
	public RegistryBackendFactory(ConnectorRegistry registry, ProcessManager processManager,
			RetryPolicy retryPolicy) {
		Assert.notNull(registry, "registry must not be null");
		Assert.notNull(processManager, "processManager must not be null");
		Assert.notNull(retryPolicy, "retryPolicy must not be null");
		this.registry = registry;
		this.processManager = processManager;
		this.retryPolicy = retryPolicy;
	}

	@Override
	public Backend create(String tenantId, String connectorId, @Nullable String userToken) {
		ConnectorDefinition definition = this.registry.resolve(tenantId, connectorId)
			.orElseThrow(() -> new BackendUnavailableException(
					"Connector " + connectorId + " not found or inactive for tenant " + tenantId));
		logger.debug("Creating {} backend for {}:{}", definition.getClass().getSimpleName(), tenantId, connectorId);
		if (definition instanceof ConnectorDefinition.Native nativeDefinition) {
			NativeBackend backend = nativeDefinition.factory().create(tenantId, connectorId, userToken);
			backend.applyDefaultRetryPolicy(this.retryPolicy);
			return backend;
		}
		ConnectorDefinition.External external = (ConnectorDefinition.External) definition;
		return new SubprocessBackend(this.processManager,
				new ConnectorDescriptor(tenantId, connectorId, external.launchSpec()), userToken);
	}

}
