/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

import io.sagemcp.gateway.runtime.ConnectorOptions;
import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable gateway settings. Use {@link #builder()} in code, or {@link #load()} to read
 * {@code sage-gateway.properties} from the classpath with JVM system properties taking
 * precedence.
 */
public final class GatewayProperties {

	private static final Logger logger = LoggerFactory.getLogger(GatewayProperties.class);

	public static final String RESOURCE_NAME = "sage-gateway.properties";

	public static final String TENANT_RATE_LIMIT_PREFIX = "gateway.ratelimit.tenant.";

	private final int poolMaxSize;

	private final Duration poolTtl;

	private final Duration sessionTtl;

	private final int maxSessionsPerKey;

	private final Duration sessionReapInterval;

	private final Duration probeInterval;

	private final int failureThreshold;

	private final Duration requestTimeout;

	private final Duration handshakeTimeout;

	private final int maxRestarts;

	private final Path scratchDirectory;

	private final int defaultRequestsPerMinute;

	private final Map<String, Integer> tenantRateLimits;

	private final int maxRetries;

	private final Duration retryBaseDelay;

	private final Duration retryMaxDelay;

	private final int eventBufferCapacity;

	private final int serverPort;

	private GatewayProperties(Builder builder) {
		this.poolMaxSize = builder.poolMaxSize;
		this.poolTtl = builder.poolTtl;
		this.sessionTtl = builder.sessionTtl;
		this.maxSessionsPerKey = builder.maxSessionsPerKey;
		this.sessionReapInterval = builder.sessionReapInterval;
		this.probeInterval = builder.probeInterval;
		this.failureThreshold = builder.failureThreshold;
		this.requestTimeout = builder.requestTimeout;
		this.handshakeTimeout = builder.handshakeTimeout;
		this.maxRestarts = builder.maxRestarts;
		this.scratchDirectory = builder.scratchDirectory;
		this.defaultRequestsPerMinute = builder.defaultRequestsPerMinute;
		this.tenantRateLimits = Map.copyOf(builder.tenantRateLimits);
		this.maxRetries = builder.maxRetries;
		this.retryBaseDelay = builder.retryBaseDelay;
		this.retryMaxDelay = builder.retryMaxDelay;
		this.eventBufferCapacity = builder.eventBufferCapacity;
		this.serverPort = builder.serverPort;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static GatewayProperties defaults() {
		return builder().build();
	}

	/**
	 * Reads the classpath resource, if present, then applies system properties on top.
	 */
	public static GatewayProperties load() {
		Properties merged = new Properties();
		try (InputStream in = GatewayProperties.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
			if (in != null) {
				merged.load(in);
				logger.debug("Loaded {} from the classpath", RESOURCE_NAME);
			}
		}
		catch (IOException ex) {
			throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, ex);
		}
		System.getProperties().stringPropertyNames().forEach(name -> {
			if (name.startsWith("gateway.")) {
				merged.setProperty(name, System.getProperty(name));
			}
		});
		return fromProperties(merged);
	}

	/**
	 * Builds settings from {@code gateway.*} keys; absent keys keep their defaults.
	 * @throws IllegalArgumentException when a value is not a valid number
	 */
	public static GatewayProperties fromProperties(Properties properties) {
		Assert.notNull(properties, "properties must not be null");
		Builder builder = builder();
		PropertyReader reader = new PropertyReader(properties);
		reader.integer("gateway.pool.max-size", builder::poolMaxSize);
		reader.seconds("gateway.pool.ttl-seconds", builder::poolTtl);
		reader.seconds("gateway.session.ttl-seconds", builder::sessionTtl);
		reader.integer("gateway.session.max-sessions-per-key", builder::maxSessionsPerKey);
		reader.seconds("gateway.session.reap-interval-seconds", builder::sessionReapInterval);
		reader.seconds("gateway.process.probe-interval-seconds", builder::probeInterval);
		reader.integer("gateway.process.failure-threshold", builder::failureThreshold);
		reader.seconds("gateway.process.request-timeout-seconds", builder::requestTimeout);
		reader.seconds("gateway.process.handshake-timeout-seconds", builder::handshakeTimeout);
		reader.integer("gateway.process.max-restarts", builder::maxRestarts);
		String scratch = properties.getProperty("gateway.process.scratch-dir");
		if (scratch != null && !scratch.isBlank()) {
			builder.scratchDirectory(Path.of(scratch.trim()));
		}
		reader.integer("gateway.ratelimit.default-rpm", builder::defaultRequestsPerMinute);
		for (String name : properties.stringPropertyNames()) {
			if (name.startsWith(TENANT_RATE_LIMIT_PREFIX) && name.length() > TENANT_RATE_LIMIT_PREFIX.length()) {
				String tenant = name.substring(TENANT_RATE_LIMIT_PREFIX.length());
				reader.integer(name, rpm -> builder.tenantRateLimit(tenant, rpm));
			}
		}
		reader.integer("gateway.retry.max-retries", builder::maxRetries);
		reader.millis("gateway.retry.base-delay-ms", builder::retryBaseDelay);
		reader.millis("gateway.retry.max-delay-ms", builder::retryMaxDelay);
		reader.integer("gateway.events.buffer-capacity", builder::eventBufferCapacity);
		reader.integer("gateway.server.port", builder::serverPort);
		return builder.build();
	}

	/**
	 * Options applied to every subprocess connector.
	 */
	public ConnectorOptions connectorOptions() {
		ConnectorOptions defaults = ConnectorOptions.defaults();
		return new ConnectorOptions(this.requestTimeout, this.handshakeTimeout, this.probeInterval,
				this.failureThreshold, defaults.startupGrace(), defaults.shutdownGrace());
	}

	public int getPoolMaxSize() {
		return this.poolMaxSize;
	}

	public Duration getPoolTtl() {
		return this.poolTtl;
	}

	public Duration getSessionTtl() {
		return this.sessionTtl;
	}

	public int getMaxSessionsPerKey() {
		return this.maxSessionsPerKey;
	}

	public Duration getSessionReapInterval() {
		return this.sessionReapInterval;
	}

	public Duration getProbeInterval() {
		return this.probeInterval;
	}

	public int getFailureThreshold() {
		return this.failureThreshold;
	}

	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	public Duration getHandshakeTimeout() {
		return this.handshakeTimeout;
	}

	public int getMaxRestarts() {
		return this.maxRestarts;
	}

	public Path getScratchDirectory() {
		return this.scratchDirectory;
	}

	public int getDefaultRequestsPerMinute() {
		return this.defaultRequestsPerMinute;
	}

	public Map<String, Integer> getTenantRateLimits() {
		return this.tenantRateLimits;
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

	public Duration getRetryBaseDelay() {
		return this.retryBaseDelay;
	}

	public Duration getRetryMaxDelay() {
		return this.retryMaxDelay;
	}

	public int getEventBufferCapacity() {
		return this.eventBufferCapacity;
	}

	public int getServerPort() {
		return this.serverPort;
	}

	private record PropertyReader(Properties properties) {

		void integer(String key, IntConsumer target) {
			String value = this.properties.getProperty(key);
			if (value == null || value.isBlank()) {
				return;
			}
			try {
				target.accept(Integer.parseInt(value.trim()));
			}
			catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, ex);
			}
		}

		void seconds(String key, Consumer<Duration> target) {
			integer(key, value -> target.accept(Duration.ofSeconds(value)));
		}

		void millis(String key, Consumer<Duration> target) {
			integer(key, value -> target.accept(Duration.ofMillis(value)));
		}

	}

	public static class Builder {

		private int poolMaxSize = 5000;

		private Duration poolTtl = Duration.ofMinutes(30);

		private Duration sessionTtl = Duration.ofMinutes(30);

		private int maxSessionsPerKey = 10;

		private Duration sessionReapInterval = Duration.ofSeconds(60);

		private Duration probeInterval = Duration.ofSeconds(30);

		private int failureThreshold = 3;

		private Duration requestTimeout = Duration.ofSeconds(30);

		private Duration handshakeTimeout = Duration.ofSeconds(10);

		private int maxRestarts = 3;

		private Path scratchDirectory = Path.of(System.getProperty("java.io.tmpdir"), "sage-gateway");

		private int defaultRequestsPerMinute = 100;

		private final Map<String, Integer> tenantRateLimits = new LinkedHashMap<>();

		private int maxRetries = 3;

		private Duration retryBaseDelay = Duration.ofSeconds(1);

		private Duration retryMaxDelay = Duration.ofSeconds(30);

		private int eventBufferCapacity = 100;

		private int serverPort = 8000;

		private Builder() {
		}

		public Builder poolMaxSize(int poolMaxSize) {
			Assert.isTrue(poolMaxSize > 0, "poolMaxSize must be positive");
			this.poolMaxSize = poolMaxSize;
			return this;
		}

		public Builder poolTtl(Duration poolTtl) {
			Assert.notNull(poolTtl, "poolTtl must not be null");
			this.poolTtl = poolTtl;
			return this;
		}

		public Builder sessionTtl(Duration sessionTtl) {
			Assert.notNull(sessionTtl, "sessionTtl must not be null");
			this.sessionTtl = sessionTtl;
			return this;
		}

		public Builder maxSessionsPerKey(int maxSessionsPerKey) {
			Assert.isTrue(maxSessionsPerKey > 0, "maxSessionsPerKey must be positive");
			this.maxSessionsPerKey = maxSessionsPerKey;
			return this;
		}

		public Builder sessionReapInterval(Duration sessionReapInterval) {
			Assert.notNull(sessionReapInterval, "sessionReapInterval must not be null");
			this.sessionReapInterval = sessionReapInterval;
			return this;
		}

		public Builder probeInterval(Duration probeInterval) {
			Assert.notNull(probeInterval, "probeInterval must not be null");
			this.probeInterval = probeInterval;
			return this;
		}

		public Builder failureThreshold(int failureThreshold) {
			Assert.isTrue(failureThreshold > 0, "failureThreshold must be positive");
			this.failureThreshold = failureThreshold;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder handshakeTimeout(Duration handshakeTimeout) {
			Assert.notNull(handshakeTimeout, "handshakeTimeout must not be null");
			this.handshakeTimeout = handshakeTimeout;
			return this;
		}

		public Builder maxRestarts(int maxRestarts) {
			Assert.isTrue(maxRestarts >= 0, "maxRestarts must not be negative");
			this.maxRestarts = maxRestarts;
			return this;
		}

		public Builder scratchDirectory(Path scratchDirectory) {
			Assert.notNull(scratchDirectory, "scratchDirectory must not be null");
			this.scratchDirectory = scratchDirectory;
			return this;
		}

		public Builder defaultRequestsPerMinute(int defaultRequestsPerMinute) {
			Assert.isTrue(defaultRequestsPerMinute > 0, "defaultRequestsPerMinute must be positive");
			this.defaultRequestsPerMinute = defaultRequestsPerMinute;
			return this;
		}

		public Builder tenantRateLimit(String tenant, int requestsPerMinute) {
			Assert.hasText(tenant, "tenant must not be empty");
			Assert.isTrue(requestsPerMinute > 0, "requestsPerMinute must be positive");
			this.tenantRateLimits.put(tenant, requestsPerMinute);
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			Assert.isTrue(maxRetries >= 0, "maxRetries must not be negative");
			this.maxRetries = maxRetries;
			return this;
		}

		public Builder retryBaseDelay(Duration retryBaseDelay) {
			Assert.notNull(retryBaseDelay, "retryBaseDelay must not be null");
			this.retryBaseDelay = retryBaseDelay;
			return this;
		}

		public Builder retryMaxDelay(Duration retryMaxDelay) {
			Assert.notNull(retryMaxDelay, "retryMaxDelay must not be null");
			this.retryMaxDelay = retryMaxDelay;
			return this;
		}

		public Builder eventBufferCapacity(int eventBufferCapacity) {
			Assert.isTrue(eventBufferCapacity > 0, "eventBufferCapacity must be positive");
			this.eventBufferCapacity = eventBufferCapacity;
			return this;
		}

		public Builder serverPort(int serverPort) {
			Assert.isTrue(serverPort >= 0, "serverPort must not be negative");
			this.serverPort = serverPort;
			return this;
		}

		public GatewayProperties build() {
			return new GatewayProperties(this);
		}

	}

}
