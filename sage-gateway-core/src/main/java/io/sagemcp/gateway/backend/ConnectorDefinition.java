/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import io.sagemcp.gateway.runtime.LaunchSpec;
import io.sagemcp.gateway.util.Assert;

/**
 * What a connector registry knows about one (tenant, connector) pair: either an
 * in-process implementation or how to launch an external process.
 */
public sealed interface ConnectorDefinition {

	/**
	 * Creates a native backend for a tenant's connector.
	 */
	@FunctionalInterface
	interface NativeFactory {

		NativeBackend create(String tenantId, String connectorId, String userToken);

	}

	record Native(NativeFactory factory) implements ConnectorDefinition {

		public Native {
			Assert.notNull(factory, "factory must not be null");
		}

	}

	record External(LaunchSpec launchSpec) implements ConnectorDefinition {

		public External {
			Assert.notNull(launchSpec, "launchSpec must not be null");
		}

	}

}
