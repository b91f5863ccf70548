/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.pool;

public record PoolStats(long hits, long misses, int size, int maxSize) {

	public double hitRate() {
		long total = this.hits + this.misses;
		return total == 0 ? 0.0 : (double) this.hits / total;
	}

}
