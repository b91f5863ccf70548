/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * Supervises one {@link StdioConnector} per {@code tenant:connector} key. It is the only
 * component that starts or stops external processes.
 *
 * <p>
 * Connectors are created lazily; concurrent first requests for a key share one start.
 * A periodic health loop restarts unhealthy connectors up to {@code maxRestarts} times,
 * after which the key is marked {@link ProcessStatus#ERROR} and its process terminated.
 * Every transition is reported to the {@link ProcessStatusListener}.
 *
 * <p>
 * Notifications are published per key rather than per process: each connector started
 * for a key forwards into the same stream, which completes only when the key is
 * terminated.
 */
public class ProcessManager {

	private static final Logger logger = LoggerFactory.getLogger(ProcessManager.class);

	private static final Sinks.EmitFailureHandler RETRY_NON_SERIALIZED = (signalType,
			emitResult) -> emitResult == Sinks.EmitResult.FAIL_NON_SERIALIZED;

	private final LaunchCommandResolver resolver;

	private final ConnectorOptions options;

	private final ObjectMapper objectMapper;

	private final ProcessStatusListener statusListener;

	private final int maxRestarts;

	private final Duration healthCheckInterval;

	private final Clock clock;

	private final Map<String, ManagedConnector> processes = new ConcurrentHashMap<>();

	private final Map<String, Mono<StdioConnector>> starting = new ConcurrentHashMap<>();

	private final Map<String, Integer> restartCounts = new ConcurrentHashMap<>();

	private final Map<String, ProcessStatusUpdate> statuses = new ConcurrentHashMap<>();

	private final Map<String, Sinks.Many<McpSchema.JSONRPCNotification>> notificationSinks = new ConcurrentHashMap<>();

	private final Object lifecycleLock = new Object();

	private volatile Disposable healthLoop;

	private volatile boolean shutdown;

	public ProcessManager(LaunchCommandResolver resolver, ConnectorOptions options, ObjectMapper objectMapper,
			ProcessStatusListener statusListener, int maxRestarts, Duration healthCheckInterval) {
		this(resolver, options, objectMapper, statusListener, maxRestarts, healthCheckInterval, Clock.systemUTC());
	}

	ProcessManager(LaunchCommandResolver resolver, ConnectorOptions options, ObjectMapper objectMapper,
			ProcessStatusListener statusListener, int maxRestarts, Duration healthCheckInterval, Clock clock) {
		Assert.notNull(resolver, "resolver must not be null");
		Assert.notNull(options, "options must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(statusListener, "statusListener must not be null");
		Assert.isTrue(maxRestarts >= 0, "maxRestarts must not be negative");
		Assert.notNull(healthCheckInterval, "healthCheckInterval must not be null");
		this.resolver = resolver;
		this.options = options;
		this.objectMapper = objectMapper;
		this.statusListener = statusListener;
		this.maxRestarts = maxRestarts;
		this.healthCheckInterval = healthCheckInterval;
		this.clock = clock;
	}

	/**
	 * Returns the healthy connector for the descriptor's key, replacing an unhealthy one
	 * and starting a new one when none exists.
	 * @param descriptor the connector to run
	 * @param oauthToken token exported to a newly started process
	 * @return the running connector; fails with a {@link BackendUnavailableException}
	 * subtype when the process cannot be started
	 */
	public Mono<StdioConnector> getOrCreate(ConnectorDescriptor descriptor, @Nullable String oauthToken) {
		Assert.notNull(descriptor, "descriptor must not be null");
		return Mono.defer(() -> {
			if (this.shutdown) {
				return Mono.error(new BackendUnavailableException("Process manager is shut down"));
			}
			String key = descriptor.key();
			ManagedConnector existing = this.processes.get(key);
			if (existing != null) {
				if (existing.connector().isHealthy()) {
					return Mono.just(existing.connector());
				}
				logger.info("Connector {} is unhealthy, replacing it", key);
				return stopAndRemove(key).then(startShared(descriptor, oauthToken));
			}
			return startShared(descriptor, oauthToken);
		});
	}

	private Mono<StdioConnector> startShared(ConnectorDescriptor descriptor, @Nullable String oauthToken) {
		String key = descriptor.key();
		return this.starting.computeIfAbsent(key, k -> {
			AtomicReference<Mono<StdioConnector>> self = new AtomicReference<>();
			Mono<StdioConnector> shared = launch(descriptor, oauthToken)
				.doFinally(signal -> this.starting.remove(k, self.get()))
				.cache();
			self.set(shared);
			return shared;
		});
	}

	private Mono<StdioConnector> launch(ConnectorDescriptor descriptor, @Nullable String oauthToken) {
		String key = descriptor.key();
		return Mono.defer(() -> {
			if (this.shutdown) {
				return Mono.error(new BackendUnavailableException("Process manager is shut down"));
			}
			return Mono.fromCallable(() -> this.resolver.resolve(descriptor, oauthToken)).flatMap(launch -> {
				StdioConnector connector = new StdioConnector(key, launch, this.options, this.objectMapper);
				return connector.start().thenReturn(connector);
			}).doOnError(ex -> {
				logger.error("Failed to start connector {}: {}", key, ex.getMessage());
				publish(descriptor, ProcessStatus.ERROR, null, ex.getMessage(), null);
			});
		}).flatMap(connector -> register(descriptor, oauthToken, connector));
	}

	private Mono<StdioConnector> register(ConnectorDescriptor descriptor, @Nullable String oauthToken,
			StdioConnector connector) {
		String key = descriptor.key();
		boolean registered;
		synchronized (this.lifecycleLock) {
			registered = !this.shutdown;
			if (registered) {
				this.processes.put(key, new ManagedConnector(descriptor, oauthToken, connector));
			}
		}
		if (!registered) {
			logger.info("Connector {} finished starting after shutdown, stopping it", key);
			return connector.stop()
				.onErrorResume(ex -> {
					logger.warn("Error stopping connector {}", key, ex);
					return Mono.empty();
				})
				.then(Mono.fromRunnable(() -> publish(descriptor, ProcessStatus.STOPPED, null, null, null)))
				.then(Mono.error(new BackendUnavailableException("Process manager is shut down")));
		}
		Sinks.Many<McpSchema.JSONRPCNotification> sink = notificationSink(key);
		connector.notifications()
			.subscribe(notification -> sink.emitNext(notification, RETRY_NON_SERIALIZED),
					ex -> logger.warn("Notification forwarding for {} failed: {}", key, ex.getMessage()));
		publish(descriptor, ProcessStatus.RUNNING, connector, null, this.clock.instant());
		start();
		return Mono.just(connector);
	}

	private Sinks.Many<McpSchema.JSONRPCNotification> notificationSink(String key) {
		return this.notificationSinks.computeIfAbsent(key, k -> Sinks.many().multicast().directBestEffort());
	}

	/**
	 * Server-initiated notifications for a key, across process restarts. The stream
	 * completes when the key is terminated.
	 */
	public Flux<McpSchema.JSONRPCNotification> notifications(String tenantId, String connectorId) {
		String key = Utils.connectorKey(tenantId, connectorId);
		return Flux.defer(() -> notificationSink(key).asFlux());
	}

	private void completeNotifications(String key) {
		Sinks.Many<McpSchema.JSONRPCNotification> sink = this.notificationSinks.remove(key);
		if (sink != null) {
			sink.emitComplete(RETRY_NON_SERIALIZED);
		}
	}

	/**
	 * Stops the process for the key, if any, and reports {@link ProcessStatus#STOPPED}.
	 */
	public Mono<Void> terminate(String tenantId, String connectorId) {
		String key = Utils.connectorKey(tenantId, connectorId);
		return Mono.defer(() -> {
			ManagedConnector managed = this.processes.get(key);
			if (managed == null) {
				completeNotifications(key);
				return Mono.empty();
			}
			return stopAndRemove(key).doOnSuccess(v -> {
				completeNotifications(key);
				publish(managed.descriptor(), ProcessStatus.STOPPED, null, null, null);
			});
		});
	}

	private Mono<Void> stopAndRemove(String key) {
		ManagedConnector managed = this.processes.remove(key);
		if (managed == null) {
			return Mono.empty();
		}
		return managed.connector().stop().onErrorResume(ex -> {
			logger.warn("Error stopping connector {}", key, ex);
			return Mono.empty();
		});
	}

	/**
	 * Stops the health loop and every process, including those still starting. The
	 * manager refuses new work afterwards.
	 */
	public Mono<Void> terminateAll() {
		return Mono.defer(() -> {
			List<ManagedConnector> all;
			synchronized (this.lifecycleLock) {
				this.shutdown = true;
				all = new ArrayList<>(this.processes.values());
			}
			Disposable loop = this.healthLoop;
			if (loop != null) {
				loop.dispose();
			}
			List<Mono<StdioConnector>> inFlight = new ArrayList<>(this.starting.values());
			Mono<Void> running = Flux.fromIterable(all)
				.flatMap(managed -> terminate(managed.descriptor().tenantId(), managed.descriptor().connectorId()))
				.then();
			Mono<Void> pending = Flux.fromIterable(inFlight)
				.flatMap(start -> start.then().onErrorResume(ex -> Mono.empty()))
				.then();
			return Mono.when(running, pending).doFinally(signal -> {
				List<String> keys = new ArrayList<>(this.notificationSinks.keySet());
				keys.forEach(this::completeNotifications);
			});
		});
	}

	/**
	 * Starts the periodic health loop. Calling it again has no effect.
	 */
	public synchronized void start() {
		if (this.healthLoop != null || this.shutdown) {
			return;
		}
		this.healthLoop = Flux.interval(this.healthCheckInterval)
			.onBackpressureDrop()
			.concatMap(tick -> checkAll().onErrorResume(ex -> {
				logger.error("Error in health check loop", ex);
				return Mono.empty();
			}))
			.subscribe();
		logger.info("Process health loop started, interval {}", this.healthCheckInterval);
	}

	/**
	 * Runs one health pass over every managed connector.
	 */
	public Mono<Void> checkAll() {
		List<ManagedConnector> snapshot = new ArrayList<>(this.processes.values());
		return Flux.fromIterable(snapshot)
			.concatMap(managed -> managed.connector()
				.checkHealth()
				.flatMap(healthy -> healthy ? recordHealthy(managed) : recover(managed)))
			.then();
	}

	private Mono<Void> recordHealthy(ManagedConnector managed) {
		return Mono.fromRunnable(() -> publish(managed.descriptor(), ProcessStatus.RUNNING, managed.connector(), null,
				this.clock.instant()));
	}

	private Mono<Void> recover(ManagedConnector managed) {
		ConnectorDescriptor descriptor = managed.descriptor();
		String key = descriptor.key();
		if (this.processes.get(key) != managed) {
			return Mono.empty();
		}
		int restarts = this.restartCounts.getOrDefault(key, 0);
		if (restarts >= this.maxRestarts) {
			logger.error("Connector {} reached the restart limit ({})", key, this.maxRestarts);
			return stopAndRemove(key).doOnSuccess(v -> publish(descriptor, ProcessStatus.ERROR, null,
					"Max restart limit reached (" + this.maxRestarts + ")", null));
		}
		int attempt = restarts + 1;
		this.restartCounts.put(key, attempt);
		logger.warn("Restarting unhealthy connector {} (attempt {}/{})", key, attempt, this.maxRestarts);
		return stopAndRemove(key)
			.then(Mono.fromRunnable(() -> publish(descriptor, ProcessStatus.RESTARTING, null, null, null)))
			.then(startShared(descriptor, managed.oauthToken()))
			.then()
			.onErrorResume(ex -> {
				publish(descriptor, ProcessStatus.ERROR, null, "Restart failed: " + ex.getMessage(), null);
				return Mono.empty();
			});
	}

	private void publish(ConnectorDescriptor descriptor, ProcessStatus status, @Nullable StdioConnector connector,
			@Nullable String errorMessage, @Nullable Instant healthCheck) {
		String key = descriptor.key();
		ProcessStatusUpdate previous = this.statuses.get(key);
		Instant lastHealthCheck = (healthCheck != null) ? healthCheck
				: (previous != null ? previous.lastHealthCheck() : null);
		RuntimeType runtimeType = (connector != null) ? connector.getRuntimeType()
				: (previous != null ? previous.runtimeType() : descriptor.launchSpec().runtimeType());
		ProcessStatusUpdate update = new ProcessStatusUpdate(descriptor.tenantId(), descriptor.connectorId(), status,
				connector != null ? connector.pid().orElse(null) : null, runtimeType, errorMessage,
				this.restartCounts.getOrDefault(key, 0), lastHealthCheck);
		this.statuses.put(key, update);
		try {
			this.statusListener.onStatusUpdate(update);
		}
		catch (RuntimeException ex) {
			logger.warn("Process status listener failed for {}", key, ex);
		}
	}

	public Optional<ProcessStatusUpdate> status(String tenantId, String connectorId) {
		return Optional.ofNullable(this.statuses.get(Utils.connectorKey(tenantId, connectorId)));
	}

	public Optional<StdioConnector> get(String tenantId, String connectorId) {
		ManagedConnector managed = this.processes.get(Utils.connectorKey(tenantId, connectorId));
		return Optional.ofNullable(managed).map(ManagedConnector::connector);
	}

	public int size() {
		return this.processes.size();
	}

	public boolean isShutdown() {
		return this.shutdown;
	}

	private record ManagedConnector(ConnectorDescriptor descriptor, @Nullable String oauthToken,
			StdioConnector connector) {
	}

}
