/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.time.Duration;

import io.sagemcp.gateway.util.Assert;

/**
 * Timing and health settings applied to every {@link StdioConnector}.
 *
 * @param requestTimeout bound on each in-flight request
 * @param handshakeTimeout bound on one initialize attempt under one framing
 * @param probeInterval minimum spacing between two health probes
 * @param failureThreshold consecutive probe failures that make the connector unhealthy
 * @param startupGrace a process that exits within this window fails to start
 * @param shutdownGrace wait after SIGTERM before the process is killed
 */
public record ConnectorOptions(Duration requestTimeout, Duration handshakeTimeout, Duration probeInterval,
		int failureThreshold, Duration startupGrace, Duration shutdownGrace) {

	public ConnectorOptions {
		Assert.notNull(requestTimeout, "requestTimeout must not be null");
		Assert.notNull(handshakeTimeout, "handshakeTimeout must not be null");
		Assert.notNull(probeInterval, "probeInterval must not be null");
		Assert.isTrue(failureThreshold > 0, "failureThreshold must be positive");
		Assert.notNull(startupGrace, "startupGrace must not be null");
		Assert.notNull(shutdownGrace, "shutdownGrace must not be null");
	}

	public static ConnectorOptions defaults() {
		return new ConnectorOptions(Duration.ofSeconds(30), Duration.ofSeconds(10), Duration.ofSeconds(30), 3,
				Duration.ofMillis(200), Duration.ofSeconds(5));
	}

}
