/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.servlet;

import java.util.Optional;

import io.sagemcp.gateway.util.Utils;

/**
 * The {@code /{tenant}/connectors/{connector}/mcp} part of an MCP endpoint path.
 */
record McpEndpointPath(String tenantId, String connectorId) {

	static Optional<McpEndpointPath> parse(String pathInfo) {
		if (pathInfo == null) {
			return Optional.empty();
		}
		String[] segments = pathInfo.split("/");
		// "", tenant, "connectors", connector, "mcp"
		if (segments.length != 5 || !segments[0].isEmpty() || !"connectors".equals(segments[2])
				|| !"mcp".equals(segments[4]) || !Utils.hasText(segments[1]) || !Utils.hasText(segments[3])) {
			return Optional.empty();
		}
		return Optional.of(new McpEndpointPath(segments[1], segments[3]));
	}

}
