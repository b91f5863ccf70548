/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event buffers keyed by session id.
 */
public class EventBufferManager {

	private static final Logger logger = LoggerFactory.getLogger(EventBufferManager.class);

	private final int capacity;

	private final Map<String, EventBuffer> buffers = new ConcurrentHashMap<>();

	public EventBufferManager(int capacity) {
		Assert.isTrue(capacity > 0, "capacity must be positive");
		this.capacity = capacity;
	}

	public EventBuffer getOrCreate(String sessionId) {
		Assert.hasText(sessionId, "sessionId must not be empty");
		return this.buffers.computeIfAbsent(sessionId, id -> new EventBuffer(this.capacity));
	}

	public Optional<EventBuffer> get(String sessionId) {
		return Optional.ofNullable(this.buffers.get(sessionId));
	}

	public void remove(String sessionId) {
		EventBuffer removed = this.buffers.remove(sessionId);
		if (removed != null) {
			removed.close();
			logger.debug("Removed event buffer for session {}", sessionId);
		}
	}

	/**
	 * Drops buffers whose session is no longer active.
	 */
	public void retainOnly(Collection<String> activeSessionIds) {
		Set<String> active = Set.copyOf(activeSessionIds);
		for (String sessionId : Set.copyOf(this.buffers.keySet())) {
			if (!active.contains(sessionId)) {
				remove(sessionId);
			}
		}
	}

	public int size() {
		return this.buffers.size();
	}

}
