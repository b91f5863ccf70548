/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.Optional;

import io.sagemcp.gateway.spec.McpSchema;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * A connector handle the gateway dispatches JSON-RPC methods to. The set of variants is
 * closed: in-process connectors and supervised external processes. Which variant backs a
 * pool entry is decided once, when the entry is created.
 */
public sealed interface Backend permits NativeBackend, SubprocessBackend {

	/**
	 * Prepares the backend for calls. The pool caches a backend only after this completes.
	 */
	Mono<Void> initialize();

	/**
	 * Invokes {@code method} and resolves with its result. Protocol failures are raised as
	 * {@link io.sagemcp.gateway.spec.McpError}.
	 */
	Mono<Object> send(String method, Object params);

	Mono<Void> notify(String method, Object params);

	/**
	 * Notifications the backend initiates, such as list changes.
	 */
	Flux<McpSchema.JSONRPCNotification> notifications();

	/**
	 * Overlays the caller's OAuth token; a later token replaces an earlier one.
	 */
	void setUserToken(String userToken);

	Optional<String> getUserToken();

	Mono<Void> closeGracefully();

	boolean isClosed();

	default void close() {
		closeGracefully().subscribe();
	}

}
