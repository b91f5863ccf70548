/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

import java.util.List;

import io.sagemcp.gateway.spec.McpSchema;

/**
 * What the HTTP layer should write back for one inbound body.
 */
public sealed interface TransportReply permits TransportReply.Single, TransportReply.Batch, TransportReply.NoContent {

	NoContent NO_CONTENT = new NoContent();

	record Single(McpSchema.JSONRPCResponse response) implements TransportReply {
	}

	/**
	 * Responses for a batch, in request order. Empty only when the batch itself was
	 * empty.
	 */
	record Batch(List<McpSchema.JSONRPCResponse> responses) implements TransportReply {

		public Batch {
			responses = List.copyOf(responses);
		}

	}

	/**
	 * Only notifications or client responses were received; the caller answers with an
	 * empty-body success status.
	 */
	record NoContent() implements TransportReply {
	}

}
