/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.session;

/**
 * Notified after a session is removed, for releasing per-session resources such as event
 * buffers.
 */
@FunctionalInterface
public interface SessionListener {

	enum RemovalCause {

		EXPIRED, CLOSED, EVICTED, STALE_BACKEND, SHUTDOWN

	}

	void onSessionRemoved(SessionEntry session, RemovalCause cause);

}
