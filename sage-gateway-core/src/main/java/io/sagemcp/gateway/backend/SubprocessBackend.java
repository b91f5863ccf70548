/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.Optional;

import io.sagemcp.gateway.runtime.ConnectorDescriptor;
import io.sagemcp.gateway.runtime.ProcessManager;
import io.sagemcp.gateway.runtime.StdioConnector;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.util.Assert;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Backend served by an external MCP server process. Every call goes through the
 * {@link ProcessManager}, so a process restarted by the health loop is picked up without
 * replacing the pool entry.
 */
public final class SubprocessBackend implements Backend {

	private final ProcessManager processManager;

	private final ConnectorDescriptor descriptor;

	private volatile String userToken;

	private volatile boolean closed;

	public SubprocessBackend(ProcessManager processManager, ConnectorDescriptor descriptor, String userToken) {
		Assert.notNull(processManager, "processManager must not be null");
		Assert.notNull(descriptor, "descriptor must not be null");
		this.processManager = processManager;
		this.descriptor = descriptor;
		this.userToken = userToken;
	}

	private Mono<StdioConnector> connector() {
		if (this.closed) {
			return Mono.error(new BackendUnavailableException("Backend " + this.descriptor.key() + " is closed"));
		}
		return this.processManager.getOrCreate(this.descriptor, this.userToken);
	}

	@Override
	public Mono<Void> initialize() {
		return Mono.defer(this::connector).then();
	}

	@Override
	public Mono<Object> send(String method, Object params) {
		return Mono.defer(this::connector).flatMap(connector -> connector.send(method, params));
	}

	@Override
	public Mono<Void> notify(String method, Object params) {
		return Mono.defer(this::connector).flatMap(connector -> connector.notify(method, params));
	}

	/**
	 * Notifications of whichever process currently serves this connector. The stream
	 * survives restarts and completes when the backend is closed.
	 */
	@Override
	public Flux<McpSchema.JSONRPCNotification> notifications() {
		return Flux.defer(() -> {
			if (this.closed) {
				return Flux.error(new BackendUnavailableException("Backend " + this.descriptor.key() + " is closed"));
			}
			return this.processManager.notifications(this.descriptor.tenantId(), this.descriptor.connectorId());
		});
	}

	/**
	 * Records the token for the next process launch; a running process keeps the
	 * environment it was started with.
	 */
	@Override
	public void setUserToken(String userToken) {
		this.userToken = userToken;
	}

	@Override
	public Optional<String> getUserToken() {
		return Optional.ofNullable(this.userToken);
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			this.closed = true;
			return this.processManager.terminate(this.descriptor.tenantId(), this.descriptor.connectorId());
		});
	}

	@Override
	public boolean isClosed() {
		return this.closed;
	}

	public ConnectorDescriptor getDescriptor() {
		return this.descriptor;
	}

	@Override
	public String toString() {
		return "SubprocessBackend[" + this.descriptor.key() + "]";
	}

}
