/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.session;

import java.lang.ref.WeakReference;
import java.util.Optional;

import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * One client-visible session. The backend is referenced weakly: the server pool owns it
 * and may evict it independently.
 */
public final class SessionEntry {

	private final String sessionId;

	private final String tenantId;

	private final String connectorId;

	private final WeakReference<Backend> backend;

	private final String negotiatedVersion;

	private final long createdAt;

	private final long sequence;

	private volatile long lastAccess;

	SessionEntry(String sessionId, String tenantId, String connectorId, Backend backend,
			@Nullable String negotiatedVersion, long createdAt, long sequence) {
		this.sessionId = sessionId;
		this.tenantId = tenantId;
		this.connectorId = connectorId;
		this.backend = new WeakReference<>(backend);
		this.negotiatedVersion = negotiatedVersion;
		this.createdAt = createdAt;
		this.sequence = sequence;
		this.lastAccess = createdAt;
	}

	public String getSessionId() {
		return this.sessionId;
	}

	public String getTenantId() {
		return this.tenantId;
	}

	public String getConnectorId() {
		return this.connectorId;
	}

	public String key() {
		return Utils.connectorKey(this.tenantId, this.connectorId);
	}

	/**
	 * The bound backend, unless it has been collected or closed.
	 */
	public Optional<Backend> backend() {
		Backend current = this.backend.get();
		return (current == null || current.isClosed()) ? Optional.empty() : Optional.of(current);
	}

	public Optional<String> negotiatedVersion() {
		return Optional.ofNullable(this.negotiatedVersion);
	}

	public long getCreatedAt() {
		return this.createdAt;
	}

	public long getLastAccess() {
		return this.lastAccess;
	}

	long getSequence() {
		return this.sequence;
	}

	void touch(long now) {
		this.lastAccess = now;
	}

	boolean isExpired(long now, long ttlMillis) {
		return now - this.lastAccess > ttlMillis;
	}

}
