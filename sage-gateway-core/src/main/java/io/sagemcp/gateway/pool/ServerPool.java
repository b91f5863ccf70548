/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.backend.BackendFactory;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Cache of initialized backends keyed by {@code tenant:connector}.
 *
 * <p>
 * A lookup first drops an entry older than the time-to-live (measured from creation),
 * then either returns the cached backend, refreshing its last access and overlaying the
 * caller's user token, or creates and initializes a new one. The key is reserved under
 * the lock and initialization runs outside it, so concurrent first requests share one
 * initialization. A failed initialization is not cached and yields an empty result.
 * When the pool is full, the entry with the oldest last access is evicted at insertion
 * time.
 */
public class ServerPool {

	private static final Logger logger = LoggerFactory.getLogger(ServerPool.class);

	private final BackendFactory backendFactory;

	private final int maxSize;

	private final long ttlMillis;

	private final LongSupplier clock;

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<String, PoolEntry> entries = new LinkedHashMap<>();

	private final Map<String, Mono<Backend>> pending = new HashMap<>();

	private long hits;

	private long misses;

	private boolean shutdown;

	private volatile Disposable reaper;

	public ServerPool(BackendFactory backendFactory, int maxSize, Duration ttl) {
		this(backendFactory, maxSize, ttl, Utils::monotonicMillis);
	}

	public ServerPool(BackendFactory backendFactory, int maxSize, Duration ttl, LongSupplier clock) {
		Assert.notNull(backendFactory, "backendFactory must not be null");
		Assert.isTrue(maxSize > 0, "maxSize must be positive");
		Assert.notNull(ttl, "ttl must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.backendFactory = backendFactory;
		this.maxSize = maxSize;
		this.ttlMillis = ttl.toMillis();
		this.clock = clock;
	}

	/**
	 * Returns the cached backend for the key or creates one.
	 * @param tenantId the tenant slug
	 * @param connectorId the connector id
	 * @param userToken token to overlay on the backend, or {@code null} to keep the
	 * current one
	 * @return the backend; empty when a new backend failed to initialize; an
	 * {@link IllegalStateException} after {@link #shutdown()}
	 */
	public Mono<Backend> getOrCreate(String tenantId, String connectorId, @Nullable String userToken) {
		Assert.hasText(tenantId, "tenantId must not be empty");
		Assert.hasText(connectorId, "connectorId must not be empty");
		return Mono.defer(() -> {
			String key = Utils.connectorKey(tenantId, connectorId);
			List<Backend> released = new ArrayList<>();
			Backend hit = null;
			Mono<Backend> creation;
			this.lock.lock();
			try {
				if (this.shutdown) {
					return Mono.error(new IllegalStateException("Server pool is shut down"));
				}
				long now = this.clock.getAsLong();
				PoolEntry entry = this.entries.get(key);
				if (entry != null && (entry.isExpired(now, this.ttlMillis) || entry.getBackend().isClosed())) {
					this.entries.remove(key);
					released.add(entry.getBackend());
					logger.debug("Dropped stale pool entry {}", key);
					entry = null;
				}
				if (entry != null) {
					this.hits++;
					entry.touch(now);
					if (userToken != null) {
						entry.getBackend().setUserToken(userToken);
					}
					hit = entry.getBackend();
					creation = null;
					logger.debug("Pool hit for {} (hits: {})", key, entry.getHitCount());
				}
				else {
					this.misses++;
					creation = this.pending.get(key);
					if (creation == null) {
						creation = create(key, tenantId, connectorId, userToken);
						this.pending.put(key, creation);
					}
				}
			}
			finally {
				this.lock.unlock();
			}
			release(released);
			if (hit != null) {
				return Mono.just(hit);
			}
			return creation.doOnNext(backend -> {
				if (userToken != null) {
					backend.setUserToken(userToken);
				}
			});
		});
	}

	private Mono<Backend> create(String key, String tenantId, String connectorId, @Nullable String userToken) {
		AtomicReference<Mono<Backend>> self = new AtomicReference<>();
		Mono<Backend> creation = Mono.defer(() -> {
			Backend backend = this.backendFactory.create(tenantId, connectorId, userToken);
			return backend.initialize().thenReturn(backend).onErrorResume(ex -> {
				logger.warn("Pool miss: initialization failed for {}: {}", key, ex.getMessage());
				release(List.of(backend));
				return Mono.empty();
			});
		}).onErrorResume(ex -> {
			logger.warn("Pool miss: cannot create backend for {}: {}", key, ex.getMessage());
			return Mono.empty();
		}).flatMap(backend -> insert(key, tenantId, connectorId, backend)).doFinally(signal -> {
			this.lock.lock();
			try {
				this.pending.remove(key, self.get());
			}
			finally {
				this.lock.unlock();
			}
		}).cache();
		self.set(creation);
		return creation;
	}

	private Mono<Backend> insert(String key, String tenantId, String connectorId, Backend backend) {
		List<Backend> released = new ArrayList<>();
		this.lock.lock();
		try {
			if (this.shutdown) {
				released.add(backend);
				backend = null;
			}
			else {
				while (this.entries.size() >= this.maxSize) {
					released.add(evictLeastRecentlyUsed());
				}
				this.entries.put(key, new PoolEntry(tenantId, connectorId, backend, this.clock.getAsLong()));
				logger.debug("Pool miss: created new entry for {} (pool size: {})", key, this.entries.size());
			}
		}
		finally {
			this.lock.unlock();
		}
		release(released);
		return (backend != null) ? Mono.just(backend)
				: Mono.error(new IllegalStateException("Server pool is shut down"));
	}

	private Backend evictLeastRecentlyUsed() {
		String lruKey = null;
		long oldest = Long.MAX_VALUE;
		for (Map.Entry<String, PoolEntry> candidate : this.entries.entrySet()) {
			if (lruKey == null || candidate.getValue().getLastAccess() < oldest) {
				lruKey = candidate.getKey();
				oldest = candidate.getValue().getLastAccess();
			}
		}
		logger.debug("Evicted LRU entry: {}", lruKey);
		return this.entries.remove(lruKey).getBackend();
	}

	public void invalidate(String tenantId, String connectorId) {
		String key = Utils.connectorKey(tenantId, connectorId);
		PoolEntry removed;
		this.lock.lock();
		try {
			removed = this.entries.remove(key);
		}
		finally {
			this.lock.unlock();
		}
		if (removed != null) {
			logger.debug("Invalidated pool entry: {}", key);
			release(List.of(removed.getBackend()));
		}
	}

	public void invalidateTenant(String tenantId) {
		List<Backend> released = new ArrayList<>();
		this.lock.lock();
		try {
			Iterator<PoolEntry> iterator = this.entries.values().iterator();
			while (iterator.hasNext()) {
				PoolEntry entry = iterator.next();
				if (entry.getTenantId().equals(tenantId)) {
					iterator.remove();
					released.add(entry.getBackend());
				}
			}
		}
		finally {
			this.lock.unlock();
		}
		if (!released.isEmpty()) {
			logger.debug("Invalidated {} pool entries for tenant {}", released.size(), tenantId);
			release(released);
		}
	}

	/**
	 * Removes entries past their time-to-live.
	 * @return the number of entries removed
	 */
	public int reapExpired() {
		List<Backend> released = new ArrayList<>();
		this.lock.lock();
		try {
			long now = this.clock.getAsLong();
			Iterator<PoolEntry> iterator = this.entries.values().iterator();
			while (iterator.hasNext()) {
				PoolEntry entry = iterator.next();
				if (entry.isExpired(now, this.ttlMillis)) {
					iterator.remove();
					released.add(entry.getBackend());
				}
			}
		}
		finally {
			this.lock.unlock();
		}
		if (!released.isEmpty()) {
			logger.debug("Reaped {} expired pool entries", released.size());
			release(released);
		}
		return released.size();
	}

	/**
	 * Periodically removes expired entries. Lookups never depend on it.
	 */
	public synchronized void startReaper(Duration interval) {
		if (this.reaper != null) {
			return;
		}
		this.reaper = Flux.interval(interval).onBackpressureDrop().subscribe(tick -> {
			try {
				reapExpired();
			}
			catch (RuntimeException ex) {
				logger.error("Error in pool reaper", ex);
			}
		});
	}

	/**
	 * Releases every backend and refuses further lookups.
	 */
	public Mono<Void> shutdown() {
		return Mono.defer(() -> {
			List<Backend> released = new ArrayList<>();
			this.lock.lock();
			try {
				this.shutdown = true;
				this.entries.values().forEach(entry -> released.add(entry.getBackend()));
				this.entries.clear();
			}
			finally {
				this.lock.unlock();
			}
			Disposable currentReaper = this.reaper;
			if (currentReaper != null) {
				currentReaper.dispose();
			}
			logger.info("Server pool shut down, releasing {} backends", released.size());
			return Flux.fromIterable(released).flatMap(ServerPool::closeQuietly).then();
		});
	}

	private static void release(List<Backend> backends) {
		backends.forEach(backend -> closeQuietly(backend).subscribe());
	}

	private static Mono<Void> closeQuietly(Backend backend) {
		return backend.closeGracefully().onErrorResume(ex -> {
			logger.warn("Error closing backend {}", backend, ex);
			return Mono.empty();
		});
	}

	public boolean isShutdown() {
		this.lock.lock();
		try {
			return this.shutdown;
		}
		finally {
			this.lock.unlock();
		}
	}

	public int size() {
		this.lock.lock();
		try {
			return this.entries.size();
		}
		finally {
			this.lock.unlock();
		}
	}

	public Set<String> keys() {
		this.lock.lock();
		try {
			return Set.copyOf(this.entries.keySet());
		}
		finally {
			this.lock.unlock();
		}
	}

	public long getHits() {
		this.lock.lock();
		try {
			return this.hits;
		}
		finally {
			this.lock.unlock();
		}
	}

	public long getMisses() {
		this.lock.lock();
		try {
			return this.misses;
		}
		finally {
			this.lock.unlock();
		}
	}

	public PoolStats stats() {
		this.lock.lock();
		try {
			return new PoolStats(this.hits, this.misses, this.entries.size(), this.maxSize);
		}
		finally {
			this.lock.unlock();
		}
	}

}
