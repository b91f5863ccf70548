/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway;

import java.util.Optional;

import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.session.SessionEntry;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.sagemcp.gateway.spec.ProtocolVersions;
import io.sagemcp.gateway.transport.BufferedEvent;
import io.sagemcp.gateway.transport.ProtocolTransport;
import io.sagemcp.gateway.transport.TransportReply;
import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Routes one inbound MCP exchange through the session manager, the server pool and a
 * protocol transport. Independent of any HTTP library; the servlet maps the outcome to
 * status codes and headers.
 *
 * <p>
 * Without a session id the transport starts uninitialized; a successful
 * {@code initialize} then opens a session. With a session id the transport resumes the
 * session's negotiated revision against the session's backend.
 */
public class GatewayDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(GatewayDispatcher.class);

	private final GatewayContext context;

	private final McpSchema.Implementation serverInfo;

	public GatewayDispatcher(GatewayContext context) {
		this(context, ProtocolTransport.DEFAULT_SERVER_INFO);
	}

	public GatewayDispatcher(GatewayContext context, McpSchema.Implementation serverInfo) {
		Assert.notNull(context, "context must not be null");
		Assert.notNull(serverInfo, "serverInfo must not be null");
		this.context = context;
		this.serverInfo = serverInfo;
	}

	/**
	 * Outcome of a POST.
	 *
	 * @param reply the transport's reply, absent when the session is unknown or expired
	 * @param sessionId the session the exchange ran in, if any
	 * @param sessionCreated whether this exchange opened the session
	 */
	public record PostResult(Optional<TransportReply> reply, Optional<String> sessionId, boolean sessionCreated) {

		static PostResult sessionExpired() {
			return new PostResult(Optional.empty(), Optional.empty(), false);
		}

		public boolean isSessionExpired() {
			return this.reply.isEmpty();
		}

	}

	/**
	 * Handles a JSON-RPC body for {@code tenant:connector}.
	 * @param sessionId the {@code Mcp-Session-Id} header, if sent
	 * @param userToken the caller's OAuth token, if sent
	 */
	public Mono<PostResult> handlePost(String tenantId, String connectorId, @Nullable String sessionId,
			@Nullable String userToken, String body) {
		Assert.hasText(tenantId, "tenantId must not be empty");
		Assert.hasText(connectorId, "connectorId must not be empty");
		Assert.notNull(body, "body must not be null");
		if (sessionId != null) {
			return Mono.defer(() -> handleInSession(tenantId, connectorId, sessionId, userToken, body));
		}
		return this.context.getServerPool()
			.getOrCreate(tenantId, connectorId, userToken)
			.flatMap(backend -> handleFresh(tenantId, connectorId, backend, body))
			.onErrorResume(IllegalStateException.class, ex -> {
				logger.warn("Cannot bind backend for {}:{}: {}", tenantId, connectorId, ex.getMessage());
				return Mono.empty();
			})
			.switchIfEmpty(Mono.fromSupplier(() -> rejectUnavailable(body)));
	}

	private Mono<PostResult> handleInSession(String tenantId, String connectorId, String sessionId,
			@Nullable String userToken, String body) {
		Optional<SessionEntry> found = this.context.getSessionManager()
			.getSession(sessionId)
			.filter(entry -> entry.getTenantId().equals(tenantId) && entry.getConnectorId().equals(connectorId));
		Optional<Backend> backend = found.flatMap(SessionEntry::backend);
		if (backend.isEmpty()) {
			logger.debug("Unknown or expired session {} for {}:{}", sessionId, tenantId, connectorId);
			return Mono.just(PostResult.sessionExpired());
		}
		if (userToken != null) {
			backend.get().setUserToken(userToken);
		}
		String version = found.get().negotiatedVersion().orElse(ProtocolVersions.LATEST);
		ProtocolTransport transport = ProtocolTransport.resume(backend.get(), this.context.getObjectMapper(),
				this.serverInfo, version);
		return transport.handle(body)
			.map(reply -> new PostResult(Optional.of(reply), Optional.of(sessionId), false));
	}

	private Mono<PostResult> handleFresh(String tenantId, String connectorId, Backend backend, String body) {
		ProtocolTransport transport = new ProtocolTransport(backend, this.context.getObjectMapper(), this.serverInfo);
		return transport.handle(body).map(reply -> {
			if (transport.getState() != ProtocolTransport.State.INITIALIZED) {
				return new PostResult(Optional.of(reply), Optional.empty(), false);
			}
			String created = this.context.openSession(tenantId, connectorId, backend,
					transport.getNegotiatedVersion().orElse(null));
			return new PostResult(Optional.of(reply), Optional.of(created), true);
		});
	}

	private PostResult rejectUnavailable(String body) {
		JSONRPCError error = new JSONRPCError(McpSchema.ErrorCodes.BACKEND_UNAVAILABLE, "Backend unavailable", null);
		TransportReply reply = ProtocolTransport.reject(body, this.context.getObjectMapper(), error);
		return new PostResult(Optional.of(reply), Optional.empty(), false);
	}

	/**
	 * Events for an SSE stream: retained events after {@code lastEventId}, then live
	 * ones.
	 * @return empty when the session is unknown, expired or bound to another connector
	 */
	public Optional<Flux<BufferedEvent>> eventStream(String tenantId, String connectorId, String sessionId,
			long lastEventId) {
		boolean valid = this.context.getSessionManager()
			.getSession(sessionId)
			.filter(entry -> entry.getTenantId().equals(tenantId) && entry.getConnectorId().equals(connectorId))
			.isPresent();
		if (!valid) {
			return Optional.empty();
		}
		return Optional.of(this.context.getEventBuffers().getOrCreate(sessionId).stream(lastEventId));
	}

	/**
	 * @return whether a session for {@code tenant:connector} was closed
	 */
	public boolean closeSession(String tenantId, String connectorId, String sessionId) {
		boolean owned = this.context.getSessionManager()
			.getSession(sessionId)
			.filter(entry -> entry.getTenantId().equals(tenantId) && entry.getConnectorId().equals(connectorId))
			.isPresent();
		return owned && this.context.getSessionManager().closeSession(sessionId);
	}

	public GatewayContext getContext() {
		return this.context;
	}

}
