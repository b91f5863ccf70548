/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;

/**
 * An external connector instance: the tenant that owns it and how to launch it.
 */
public record ConnectorDescriptor(String tenantId, String connectorId, LaunchSpec launchSpec) {

	public ConnectorDescriptor {
		Assert.hasText(tenantId, "tenantId must not be empty");
		Assert.hasText(connectorId, "connectorId must not be empty");
		Assert.notNull(launchSpec, "launchSpec must not be null");
	}

	public String key() {
		return Utils.connectorKey(this.tenantId, this.connectorId);
	}

}
