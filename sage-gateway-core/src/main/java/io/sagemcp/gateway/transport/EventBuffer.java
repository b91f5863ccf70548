/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

import io.sagemcp.gateway.util.Assert;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Bounded buffer of server-initiated events for one session. Ids start at 1 and strictly
 * increase; once full, the oldest event is dropped. A reconnecting client replays every
 * retained event after its {@code Last-Event-ID}, then follows {@link #live()}.
 */
public class EventBuffer {

	private final int capacity;

	private final ReentrantLock lock = new ReentrantLock();

	private final Deque<BufferedEvent> events;

	private final Sinks.Many<BufferedEvent> sink = Sinks.many().multicast().directBestEffort();

	private long lastId;

	public EventBuffer(int capacity) {
		Assert.isTrue(capacity > 0, "capacity must be positive");
		this.capacity = capacity;
		this.events = new ArrayDeque<>(capacity);
	}

	/**
	 * @return the id assigned to the event
	 */
	public long append(String type, Object data) {
		Assert.hasText(type, "type must not be empty");
		this.lock.lock();
		try {
			BufferedEvent event = new BufferedEvent(++this.lastId, type, data);
			if (this.events.size() == this.capacity) {
				this.events.removeFirst();
			}
			this.events.addLast(event);
			// emitted under the lock so subscribers see ids in order
			this.sink.tryEmitNext(event);
			return event.id();
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Retained events with an id greater than {@code lastEventId}, oldest first.
	 */
	public List<BufferedEvent> replayFrom(long lastEventId) {
		this.lock.lock();
		try {
			List<BufferedEvent> replay = new ArrayList<>();
			for (BufferedEvent event : this.events) {
				if (event.id() > lastEventId) {
					replay.add(event);
				}
			}
			return replay;
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * @return the id of the newest event, or 0 when nothing was appended yet
	 */
	public long latestId() {
		this.lock.lock();
		try {
			return this.lastId;
		}
		finally {
			this.lock.unlock();
		}
	}

	public OptionalLong oldestId() {
		this.lock.lock();
		try {
			return this.events.isEmpty() ? OptionalLong.empty() : OptionalLong.of(this.events.peekFirst().id());
		}
		finally {
			this.lock.unlock();
		}
	}

	public int size() {
		this.lock.lock();
		try {
			return this.events.size();
		}
		finally {
			this.lock.unlock();
		}
	}

	public int capacity() {
		return this.capacity;
	}

	/**
	 * Events appended from now on. Completes when the buffer is closed.
	 */
	public Flux<BufferedEvent> live() {
		return this.sink.asFlux();
	}

	/**
	 * Replays retained events after {@code lastEventId}, then follows live events without
	 * gaps or duplicates.
	 */
	public Flux<BufferedEvent> stream(long lastEventId) {
		return Flux.defer(() -> {
			Sinks.Many<BufferedEvent> relay = Sinks.many().unicast().onBackpressureBuffer();
			Disposable subscription = live().subscribe(relay::tryEmitNext, relay::tryEmitError, relay::tryEmitComplete);
			List<BufferedEvent> replay = replayFrom(lastEventId);
			long replayedUpTo = replay.isEmpty() ? lastEventId : replay.get(replay.size() - 1).id();
			return Flux.fromIterable(replay)
				.concatWith(relay.asFlux().filter(event -> event.id() > replayedUpTo))
				.doFinally(signal -> subscription.dispose());
		});
	}

	public void close() {
		this.lock.lock();
		try {
			this.sink.tryEmitComplete();
		}
		finally {
			this.lock.unlock();
		}
	}

}
