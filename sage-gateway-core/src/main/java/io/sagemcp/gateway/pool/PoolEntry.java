/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.pool;

import io.sagemcp.gateway.backend.Backend;

/**
 * One cached backend. Mutated only under the owning pool's lock.
 */
public final class PoolEntry {

	private final String tenantId;

	private final String connectorId;

	private final Backend backend;

	private final long createdAt;

	private long lastAccess;

	private long hitCount;

	PoolEntry(String tenantId, String connectorId, Backend backend, long createdAt) {
		this.tenantId = tenantId;
		this.connectorId = connectorId;
		this.backend = backend;
		this.createdAt = createdAt;
		this.lastAccess = createdAt;
	}

	void touch(long now) {
		this.lastAccess = now;
		this.hitCount++;
	}

	boolean isExpired(long now, long ttlMillis) {
		return now - this.createdAt > ttlMillis;
	}

	public String getTenantId() {
		return this.tenantId;
	}

	public String getConnectorId() {
		return this.connectorId;
	}

	public Backend getBackend() {
		return this.backend;
	}

	public long getCreatedAt() {
		return this.createdAt;
	}

	public long getLastAccess() {
		return this.lastAccess;
	}

	public long getHitCount() {
		return this.hitCount;
	}

}
