/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.session;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.session.SessionListener.RemovalCause;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.util.annotation.Nullable;

/**
 * Maps {@code Mcp-Session-Id} values to their tenant, connector, backend and negotiated
 * protocol version.
 *
 * <p>
 * Sessions expire lazily once idle for longer than the time-to-live. Each
 * {@code tenant:connector} key holds at most {@code maxSessionsPerKey} sessions; creating
 * one more evicts the key's oldest session by creation order.
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	private static final HexFormat HEX = HexFormat.of();

	private final long ttlMillis;

	private final int maxSessionsPerKey;

	private final LongSupplier clock;

	private final SecureRandom random;

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<String, SessionEntry> sessions = new LinkedHashMap<>();

	private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

	private long sequence;

	private boolean shutdown;

	private volatile Disposable reaper;

	public SessionManager(Duration ttl, int maxSessionsPerKey) {
		this(ttl, maxSessionsPerKey, Utils::monotonicMillis);
	}

	public SessionManager(Duration ttl, int maxSessionsPerKey, LongSupplier clock) {
		Assert.notNull(ttl, "ttl must not be null");
		Assert.isTrue(maxSessionsPerKey > 0, "maxSessionsPerKey must be positive");
		Assert.notNull(clock, "clock must not be null");
		this.ttlMillis = ttl.toMillis();
		this.maxSessionsPerKey = maxSessionsPerKey;
		this.clock = clock;
		this.random = new SecureRandom();
	}

	public void addListener(SessionListener listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	/**
	 * Registers a session after a successful {@code initialize}.
	 * @return the new 32-character hexadecimal session id
	 * @throws IllegalStateException after {@link #shutdown()}
	 */
	public String createSession(String tenantId, String connectorId, Backend backend,
			@Nullable String negotiatedVersion) {
		Assert.hasText(tenantId, "tenantId must not be empty");
		Assert.hasText(connectorId, "connectorId must not be empty");
		Assert.notNull(backend, "backend must not be null");
		List<Removal> removals = new ArrayList<>();
		String sessionId = newSessionId();
		this.lock.lock();
		try {
			if (this.shutdown) {
				throw new IllegalStateException("Session manager is shut down");
			}
			long now = this.clock.getAsLong();
			String key = Utils.connectorKey(tenantId, connectorId);
			List<SessionEntry> sameKey = new ArrayList<>();
			Iterator<SessionEntry> iterator = this.sessions.values().iterator();
			while (iterator.hasNext()) {
				SessionEntry entry = iterator.next();
				if (!entry.key().equals(key)) {
					continue;
				}
				if (entry.isExpired(now, this.ttlMillis)) {
					iterator.remove();
					removals.add(new Removal(entry, RemovalCause.EXPIRED));
				}
				else {
					sameKey.add(entry);
				}
			}
			sameKey.sort((a, b) -> Long.compare(a.getSequence(), b.getSequence()));
			int excess = sameKey.size() - this.maxSessionsPerKey + 1;
			for (int i = 0; i < excess; i++) {
				SessionEntry oldest = sameKey.get(i);
				this.sessions.remove(oldest.getSessionId());
				removals.add(new Removal(oldest, RemovalCause.EVICTED));
				logger.debug("Evicted oldest session {} for {}", oldest.getSessionId(), key);
			}
			this.sessions.put(sessionId, new SessionEntry(sessionId, tenantId, connectorId, backend,
					negotiatedVersion, now, this.sequence++));
			logger.debug("Created session {} for {}", sessionId, key);
		}
		finally {
			this.lock.unlock();
		}
		fire(removals);
		return sessionId;
	}

	private String newSessionId() {
		byte[] bytes = new byte[16];
		this.random.nextBytes(bytes);
		return HEX.formatHex(bytes);
	}

	/**
	 * Looks up a session and refreshes its last access. An expired session, or one whose
	 * backend has been released, is removed and reported as absent.
	 */
	public Optional<SessionEntry> getSession(@Nullable String sessionId) {
		if (sessionId == null) {
			return Optional.empty();
		}
		Removal removal = null;
		SessionEntry found = null;
		this.lock.lock();
		try {
			SessionEntry entry = this.sessions.get(sessionId);
			if (entry == null) {
				return Optional.empty();
			}
			long now = this.clock.getAsLong();
			if (entry.isExpired(now, this.ttlMillis)) {
				this.sessions.remove(sessionId);
				removal = new Removal(entry, RemovalCause.EXPIRED);
				logger.debug("Session {} expired", sessionId);
			}
			else if (entry.backend().isEmpty()) {
				this.sessions.remove(sessionId);
				removal = new Removal(entry, RemovalCause.STALE_BACKEND);
				logger.debug("Session {} lost its backend", sessionId);
			}
			else {
				entry.touch(now);
				found = entry;
			}
		}
		finally {
			this.lock.unlock();
		}
		if (removal != null) {
			fire(List.of(removal));
		}
		return Optional.ofNullable(found);
	}

	/**
	 * Removes a session.
	 * @return whether the session existed
	 */
	public boolean closeSession(@Nullable String sessionId) {
		if (sessionId == null) {
			return false;
		}
		SessionEntry removed;
		this.lock.lock();
		try {
			removed = this.sessions.remove(sessionId);
		}
		finally {
			this.lock.unlock();
		}
		if (removed == null) {
			return false;
		}
		logger.debug("Closed session {}", sessionId);
		fire(List.of(new Removal(removed, RemovalCause.CLOSED)));
		return true;
	}

	/**
	 * Number of live sessions; expired sessions are removed first and never counted.
	 */
	public int activeSessionCount() {
		reapExpired();
		this.lock.lock();
		try {
			return this.sessions.size();
		}
		finally {
			this.lock.unlock();
		}
	}

	public int sessionsFor(String tenantId, String connectorId) {
		String key = Utils.connectorKey(tenantId, connectorId);
		this.lock.lock();
		try {
			long now = this.clock.getAsLong();
			return (int) this.sessions.values()
				.stream()
				.filter(entry -> entry.key().equals(key) && !entry.isExpired(now, this.ttlMillis))
				.count();
		}
		finally {
			this.lock.unlock();
		}
	}

	public Set<String> activeSessionIds() {
		reapExpired();
		this.lock.lock();
		try {
			return Set.copyOf(this.sessions.keySet());
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * @return the number of expired sessions removed
	 */
	public int reapExpired() {
		List<Removal> removals = new ArrayList<>();
		this.lock.lock();
		try {
			long now = this.clock.getAsLong();
			Iterator<SessionEntry> iterator = this.sessions.values().iterator();
			while (iterator.hasNext()) {
				SessionEntry entry = iterator.next();
				if (entry.isExpired(now, this.ttlMillis)) {
					iterator.remove();
					removals.add(new Removal(entry, RemovalCause.EXPIRED));
				}
			}
		}
		finally {
			this.lock.unlock();
		}
		if (!removals.isEmpty()) {
			logger.debug("Reaped {} expired sessions", removals.size());
			fire(removals);
		}
		return removals.size();
	}

	public synchronized void startReaper(Duration interval) {
		if (this.reaper != null) {
			return;
		}
		this.reaper = Flux.interval(interval).onBackpressureDrop().subscribe(tick -> {
			try {
				reapExpired();
			}
			catch (RuntimeException ex) {
				logger.error("Error in session reaper", ex);
			}
		});
	}

	/**
	 * Drops every session and refuses new ones.
	 */
	public void shutdown() {
		List<Removal> removals = new ArrayList<>();
		this.lock.lock();
		try {
			this.shutdown = true;
			this.sessions.values().forEach(entry -> removals.add(new Removal(entry, RemovalCause.SHUTDOWN)));
			this.sessions.clear();
		}
		finally {
			this.lock.unlock();
		}
		Disposable currentReaper = this.reaper;
		if (currentReaper != null) {
			currentReaper.dispose();
		}
		logger.info("Session manager shut down, dropped {} sessions", removals.size());
		fire(removals);
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

	private void fire(List<Removal> removals) {
		for (Removal removal : removals) {
			for (SessionListener listener : this.listeners) {
				try {
					listener.onSessionRemoved(removal.entry(), removal.cause());
				}
				catch (RuntimeException ex) {
					logger.warn("Session listener failed for {}", removal.entry().getSessionId(), ex);
				}
			}
		}
	}

	private record Removal(SessionEntry entry, RemovalCause cause) {
	}

}
