/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.spec;

import java.util.List;
import java.util.Optional;

/**
 * Protocol revisions the gateway speaks, ordered oldest to newest. Revisions are ISO 8601
 * date strings, so lexicographic order is chronological order.
 */
public final class ProtocolVersions {

	private ProtocolVersions() {
	}

	/**
	 * MCP protocol version for 2024-11-05.
	 */
	public static final String MCP_2024_11_05 = "2024-11-05";

	/**
	 * MCP protocol version for 2025-03-26.
	 */
	public static final String MCP_2025_03_26 = "2025-03-26";

	/**
	 * MCP protocol version for 2025-06-18.
	 */
	public static final String MCP_2025_06_18 = "2025-06-18";

	public static final List<String> SUPPORTED = List.of(MCP_2024_11_05, MCP_2025_03_26, MCP_2025_06_18);

	public static final String LATEST = MCP_2025_06_18;

	/**
	 * Picks the revision to answer an {@code initialize} with: the requested one when it
	 * is supported, otherwise the newest supported revision older than it.
	 * @param requested the client's requested revision
	 * @return the negotiated revision, or empty when the request predates every supported
	 * revision
	 */
	public static Optional<String> negotiate(String requested) {
		return negotiate(requested, SUPPORTED);
	}

	static Optional<String> negotiate(String requested, List<String> supported) {
		if (supported.contains(requested)) {
			return Optional.of(requested);
		}
		String best = null;
		for (String candidate : supported) {
			if (candidate.compareTo(requested) < 0 && (best == null || candidate.compareTo(best) > 0)) {
				best = candidate;
			}
		}
		return Optional.ofNullable(best);
	}

}
