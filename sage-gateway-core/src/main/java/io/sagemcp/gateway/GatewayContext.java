/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.backend.BackendFactory;
import io.sagemcp.gateway.backend.ConnectorRegistry;
import io.sagemcp.gateway.backend.InMemoryConnectorRegistry;
import io.sagemcp.gateway.backend.RegistryBackendFactory;
import io.sagemcp.gateway.config.GatewayProperties;
import io.sagemcp.gateway.pool.ServerPool;
import io.sagemcp.gateway.ratelimit.RateLimiter;
import io.sagemcp.gateway.retry.RetryPolicy;
import io.sagemcp.gateway.runtime.LaunchCommandResolver;
import io.sagemcp.gateway.runtime.ProcessManager;
import io.sagemcp.gateway.runtime.ProcessStatusListener;
import io.sagemcp.gateway.session.SessionEntry;
import io.sagemcp.gateway.session.SessionListener;
import io.sagemcp.gateway.session.SessionManager;
import io.sagemcp.gateway.transport.EventBuffer;
import io.sagemcp.gateway.transport.EventBufferManager;
import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Owns every runtime component and wires them together. Nothing in the gateway is a
 * global singleton; components reach each other only through this context.
 */
public class GatewayContext {

	private static final Logger logger = LoggerFactory.getLogger(GatewayContext.class);

	/** Event type used for backend notifications replayed over SSE. */
	public static final String NOTIFICATION_EVENT_TYPE = "message";

	private final GatewayProperties properties;

	private final ObjectMapper objectMapper;

	private final ConnectorRegistry registry;

	private final RateLimiter rateLimiter;

	private final RetryPolicy retryPolicy;

	private final ProcessManager processManager;

	private final ServerPool serverPool;

	private final SessionManager sessionManager;

	private final EventBufferManager eventBuffers;

	private final Map<String, Disposable> notificationRelays = new ConcurrentHashMap<>();

	private volatile boolean started;

	private GatewayContext(Builder builder) {
		this.properties = builder.properties;
		this.objectMapper = builder.objectMapper;
		this.registry = builder.registry;
		this.rateLimiter = new RateLimiter(this.properties.getDefaultRequestsPerMinute());
		this.properties.getTenantRateLimits().forEach(this.rateLimiter::setTenantLimit);
		this.retryPolicy = new RetryPolicy(this.properties.getMaxRetries(), this.properties.getRetryBaseDelay(),
				this.properties.getRetryMaxDelay());
		this.processManager = new ProcessManager(new LaunchCommandResolver(this.properties.getScratchDirectory()),
				this.properties.connectorOptions(), this.objectMapper, builder.statusListener,
				this.properties.getMaxRestarts(), this.properties.getProbeInterval());
		BackendFactory backendFactory = (builder.backendFactory != null) ? builder.backendFactory
				: new RegistryBackendFactory(this.registry, this.processManager, this.retryPolicy);
		this.serverPool = new ServerPool(backendFactory, this.properties.getPoolMaxSize(),
				this.properties.getPoolTtl());
		this.sessionManager = new SessionManager(this.properties.getSessionTtl(),
				this.properties.getMaxSessionsPerKey());
		this.eventBuffers = new EventBufferManager(this.properties.getEventBufferCapacity());
		this.sessionManager.addListener(this::onSessionRemoved);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Registers a session for a freshly initialized transport and relays the backend's
	 * notifications into the session's event buffer.
	 * @return the new session id
	 */
	public String openSession(String tenantId, String connectorId, Backend backend,
			@Nullable String negotiatedVersion) {
		String sessionId = this.sessionManager.createSession(tenantId, connectorId, backend, negotiatedVersion);
		EventBuffer buffer = this.eventBuffers.getOrCreate(sessionId);
		Disposable relay = backend.notifications()
			.subscribe(notification -> buffer.append(NOTIFICATION_EVENT_TYPE, notification),
					ex -> logger.warn("Notification relay for session {} failed: {}", sessionId, ex.getMessage()));
		this.notificationRelays.put(sessionId, relay);
		logger.info("Opened session {} for {}:{} (protocol {})", sessionId, tenantId, connectorId, negotiatedVersion);
		return sessionId;
	}

	private void onSessionRemoved(SessionEntry session, SessionListener.RemovalCause cause) {
		Disposable relay = this.notificationRelays.remove(session.getSessionId());
		if (relay != null) {
			relay.dispose();
		}
		this.eventBuffers.remove(session.getSessionId());
		logger.debug("Released session {} ({})", session.getSessionId(), cause);
	}

	/**
	 * Starts the session reaper and the process health loop.
	 */
	public synchronized void start() {
		if (this.started) {
			return;
		}
		this.started = true;
		Duration reapInterval = this.properties.getSessionReapInterval();
		this.sessionManager.startReaper(reapInterval);
		this.serverPool.startReaper(reapInterval);
		this.processManager.start();
		logger.info("Gateway started (pool max {}, session ttl {})", this.properties.getPoolMaxSize(),
				this.properties.getSessionTtl());
	}

	/**
	 * Drains sessions, then the pool, then external processes.
	 */
	public Mono<Void> shutdown() {
		return Mono.fromRunnable(this.sessionManager::shutdown)
			.then(this.serverPool.shutdown())
			.then(this.processManager.terminateAll())
			.doOnSuccess(v -> logger.info("Gateway shut down"));
	}

	public GatewayProperties getProperties() {
		return this.properties;
	}

	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	public ConnectorRegistry getRegistry() {
		return this.registry;
	}

	public RateLimiter getRateLimiter() {
		return this.rateLimiter;
	}

	/**
	 * Policy for outbound HTTP made by native connectors, passed to their handlers in
	 * {@link io.sagemcp.gateway.backend.NativeCallContext}.
	 */
	public RetryPolicy getRetryPolicy() {
		return this.retryPolicy;
	}

	public ProcessManager getProcessManager() {
		return this.processManager;
	}

	public ServerPool getServerPool() {
		return this.serverPool;
	}

	public SessionManager getSessionManager() {
		return this.sessionManager;
	}

	public EventBufferManager getEventBuffers() {
		return this.eventBuffers;
	}

	public static class Builder {

		private GatewayProperties properties = GatewayProperties.defaults();

		private ObjectMapper objectMapper = new ObjectMapper();

		private ConnectorRegistry registry = new InMemoryConnectorRegistry();

		private ProcessStatusListener statusListener = ProcessStatusListener.NOOP;

		private BackendFactory backendFactory;

		private Builder() {
		}

		public Builder properties(GatewayProperties properties) {
			Assert.notNull(properties, "properties must not be null");
			this.properties = properties;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder registry(ConnectorRegistry registry) {
			Assert.notNull(registry, "registry must not be null");
			this.registry = registry;
			return this;
		}

		public Builder statusListener(ProcessStatusListener statusListener) {
			Assert.notNull(statusListener, "statusListener must not be null");
			this.statusListener = statusListener;
			return this;
		}

		/**
		 * Replaces the registry-backed factory, e.g. with a stub in tests.
		 */
		public Builder backendFactory(BackendFactory backendFactory) {
			Assert.notNull(backendFactory, "backendFactory must not be null");
			this.backendFactory = backendFactory;
			return this;
		}

		public GatewayContext build() {
			return new GatewayContext(this);
		}

	}

}
