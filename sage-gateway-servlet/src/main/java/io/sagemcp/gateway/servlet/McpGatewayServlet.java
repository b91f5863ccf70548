/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.servlet;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.GatewayDispatcher;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.sagemcp.gateway.transport.BufferedEvent;
import io.sagemcp.gateway.transport.TransportReply;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * Streamable HTTP endpoint for {@code /api/v1/{tenant}/connectors/{connector}/mcp}.
 *
 * <p>
 * {@code POST} carries JSON-RPC messages, {@code GET} opens an SSE stream of the
 * session's server-initiated events (resuming after {@code Last-Event-ID}), and
 * {@code DELETE} ends the session.
 */
public class McpGatewayServlet extends HttpServlet {

	private static final long serialVersionUID = 1L;

	private static final Logger logger = LoggerFactory.getLogger(McpGatewayServlet.class);

	public static final String MCP_SESSION_ID = "Mcp-Session-Id";

	public static final String LAST_EVENT_ID = "Last-Event-ID";

	public static final String USER_TOKEN_HEADER = "X-User-OAuth-Token";

	private static final String APPLICATION_JSON = "application/json";

	private static final String TEXT_EVENT_STREAM = "text/event-stream";

	private final transient GatewayDispatcher dispatcher;

	private final transient ObjectMapper objectMapper;

	public McpGatewayServlet(GatewayDispatcher dispatcher) {
		Assert.notNull(dispatcher, "dispatcher must not be null");
		this.dispatcher = dispatcher;
		this.objectMapper = dispatcher.getContext().getObjectMapper();
	}

	@Override
	protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		Optional<McpEndpointPath> path = McpEndpointPath.parse(req.getPathInfo());
		if (path.isEmpty()) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Not an MCP endpoint");
			return;
		}
		String body = new String(req.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
		String sessionId = req.getHeader(MCP_SESSION_ID);
		GatewayDispatcher.PostResult result = this.dispatcher
			.handlePost(path.get().tenantId(), path.get().connectorId(), Utils.hasText(sessionId) ? sessionId : null,
					userToken(req), body)
			.block();
		if (result == null || result.isSessionExpired()) {
			writeJson(resp, HttpServletResponse.SC_NOT_FOUND, McpSchema.JSONRPCResponse.failure(null,
					new JSONRPCError(McpSchema.ErrorCodes.SESSION_EXPIRED, "Session expired", null)));
			return;
		}
		result.sessionId().ifPresent(id -> resp.setHeader(MCP_SESSION_ID, id));
		TransportReply reply = result.reply().get();
		if (reply instanceof TransportReply.Single single) {
			writeJson(resp, HttpServletResponse.SC_OK, single.response());
		}
		else if (reply instanceof TransportReply.Batch batch) {
			writeJson(resp, HttpServletResponse.SC_OK, batch.responses());
		}
		else {
			resp.setStatus(HttpServletResponse.SC_ACCEPTED);
		}
	}

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		Optional<McpEndpointPath> path = McpEndpointPath.parse(req.getPathInfo());
		if (path.isEmpty()) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Not an MCP endpoint");
			return;
		}
		String accept = req.getHeader("Accept");
		if (accept == null || !accept.contains(TEXT_EVENT_STREAM)) {
			resp.sendError(HttpServletResponse.SC_NOT_ACCEPTABLE, "Accept must include text/event-stream");
			return;
		}
		String sessionId = req.getHeader(MCP_SESSION_ID);
		if (!Utils.hasText(sessionId)) {
			resp.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing " + MCP_SESSION_ID);
			return;
		}
		Optional<Flux<BufferedEvent>> events = this.dispatcher.eventStream(path.get().tenantId(),
				path.get().connectorId(), sessionId, lastEventId(req));
		if (events.isEmpty()) {
			writeJson(resp, HttpServletResponse.SC_NOT_FOUND, McpSchema.JSONRPCResponse.failure(null,
					new JSONRPCError(McpSchema.ErrorCodes.SESSION_EXPIRED, "Session expired", null)));
			return;
		}

		resp.setContentType(TEXT_EVENT_STREAM);
		resp.setCharacterEncoding("UTF-8");
		resp.setHeader("Cache-Control", "no-cache");
		resp.setHeader("Connection", "keep-alive");
		resp.flushBuffer();

		AsyncContext async = req.startAsync();
		async.setTimeout(0);
		PrintWriter writer = resp.getWriter();
		Disposable subscription = events.get().subscribe(event -> {
			try {
				sendEvent(writer, event);
			}
			catch (IOException ex) {
				throw new SseClientGoneException(ex);
			}
		}, ex -> {
			logger.debug("SSE stream for session {} ended: {}", sessionId, ex.getMessage());
			completeQuietly(async);
		}, () -> completeQuietly(async));
		async.addListener(new DisposingListener(subscription));
	}

	@Override
	protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
		Optional<McpEndpointPath> path = McpEndpointPath.parse(req.getPathInfo());
		String sessionId = req.getHeader(MCP_SESSION_ID);
		if (path.isEmpty() || !Utils.hasText(sessionId)
				|| !this.dispatcher.closeSession(path.get().tenantId(), path.get().connectorId(), sessionId)) {
			resp.sendError(HttpServletResponse.SC_NOT_FOUND, "Session not found");
			return;
		}
		resp.setStatus(HttpServletResponse.SC_NO_CONTENT);
	}

	static String userToken(HttpServletRequest req) {
		String token = req.getHeader(USER_TOKEN_HEADER);
		if (Utils.hasText(token)) {
			return token.trim();
		}
		String authorization = req.getHeader("Authorization");
		if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
			String bearer = authorization.substring(7).trim();
			return bearer.isEmpty() ? null : bearer;
		}
		return null;
	}

	private static long lastEventId(HttpServletRequest req) {
		String header = req.getHeader(LAST_EVENT_ID);
		if (!Utils.hasText(header)) {
			return 0L;
		}
		try {
			return Long.parseLong(header.trim());
		}
		catch (NumberFormatException ex) {
			logger.debug("Ignoring malformed {} header: {}", LAST_EVENT_ID, header);
			return 0L;
		}
	}

	private void writeJson(HttpServletResponse resp, int status, Object payload) throws IOException {
		resp.setStatus(status);
		resp.setContentType(APPLICATION_JSON);
		resp.setCharacterEncoding("UTF-8");
		PrintWriter writer = resp.getWriter();
		writer.write(this.objectMapper.writeValueAsString(payload));
		writer.flush();
	}

	private void sendEvent(PrintWriter writer, BufferedEvent event) throws IOException {
		writer.write("id: " + event.id() + "\n");
		writer.write("event: " + event.type() + "\n");
		writer.write("data: " + this.objectMapper.writeValueAsString(event.data()) + "\n\n");
		writer.flush();
		if (writer.checkError()) {
			throw new IOException("Client disconnected");
		}
	}

	private static void completeQuietly(AsyncContext async) {
		try {
			async.complete();
		}
		catch (IllegalStateException ex) {
			logger.debug("Async context already completed");
		}
	}

	private static final class SseClientGoneException extends RuntimeException {

		private static final long serialVersionUID = 1L;

		SseClientGoneException(IOException cause) {
			super(cause.getMessage(), cause);
		}

	}

	private record DisposingListener(Disposable subscription) implements AsyncListener {

		@Override
		public void onComplete(AsyncEvent event) {
			this.subscription.dispose();
		}

		@Override
		public void onTimeout(AsyncEvent event) {
			this.subscription.dispose();
		}

		@Override
		public void onError(AsyncEvent event) {
			this.subscription.dispose();
		}

		@Override
		public void onStartAsync(AsyncEvent event) {
		}

	}

}
