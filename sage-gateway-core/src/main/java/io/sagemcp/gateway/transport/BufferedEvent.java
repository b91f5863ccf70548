/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

/**
 * A server-initiated event retained for replay.
 *
 * @param id strictly increasing per buffer, starting at 1
 * @param type the SSE event type
 * @param data the payload, serialized by the caller
 */
public record BufferedEvent(long id, String type, Object data) {
}
