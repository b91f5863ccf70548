/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.ratelimit;

import java.util.Optional;

import io.sagemcp.gateway.util.Utils;

/**
 * Attributes an MCP request path such as
 * {@code /api/v1/{tenant}/connectors/{connector}/mcp} to its tenant. Paths outside the
 * MCP endpoints are not attributed and bypass rate limiting.
 */
public final class TenantPathExtractor {

	private TenantPathExtractor() {
	}

	public static Optional<String> extractTenant(String path) {
		if (path == null || !path.contains("/connectors/") || !path.contains("/mcp")) {
			return Optional.empty();
		}
		String[] segments = path.split("/");
		for (int i = 0; i < segments.length - 1; i++) {
			if ("v1".equals(segments[i]) && Utils.hasText(segments[i + 1])) {
				return Optional.of(segments[i + 1]);
			}
		}
		return Optional.empty();
	}

}
