/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.backend.Backend;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.InvalidMessageException;
import io.sagemcp.gateway.spec.McpError;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse;
import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.sagemcp.gateway.spec.ProtocolVersions;
import io.sagemcp.gateway.spec.SessionExpiredException;
import io.sagemcp.gateway.spec.UnsupportedProtocolVersionException;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * JSON-RPC handler for one {@code tenant:connector} binding.
 *
 * <p>
 * Validates the envelope of every inbound message, negotiates the protocol revision on
 * {@code initialize} and dispatches everything else to the bound {@link Backend}.
 * Dispatch failures become JSON-RPC error responses; nothing is thrown to the caller.
 * Notifications and client responses produce no response.
 *
 * <p>
 * The transport moves from {@link State#UNINITIALIZED} to {@link State#INITIALIZED} on a
 * successful {@code initialize} and to the terminal {@link State#CLOSED} on
 * {@link #close()}. Before initialization only {@code initialize} and {@code ping} are
 * served.
 */
public class ProtocolTransport {

	private static final Logger logger = LoggerFactory.getLogger(ProtocolTransport.class);

	public static final McpSchema.Implementation DEFAULT_SERVER_INFO = new McpSchema.Implementation("sage-mcp",
			"0.1.0");

	public enum State {

		UNINITIALIZED, INITIALIZED, CLOSED

	}

	private final Backend backend;

	private final ObjectMapper objectMapper;

	private final McpSchema.Implementation serverInfo;

	private final ResultNormalizer normalizer;

	private volatile State state;

	private volatile String negotiatedVersion;

	public ProtocolTransport(Backend backend, ObjectMapper objectMapper) {
		this(backend, objectMapper, DEFAULT_SERVER_INFO);
	}

	public ProtocolTransport(Backend backend, ObjectMapper objectMapper, McpSchema.Implementation serverInfo) {
		this(backend, objectMapper, serverInfo, State.UNINITIALIZED, null);
	}

	private ProtocolTransport(Backend backend, ObjectMapper objectMapper, McpSchema.Implementation serverInfo,
			State state, @Nullable String negotiatedVersion) {
		Assert.notNull(backend, "backend must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(serverInfo, "serverInfo must not be null");
		this.backend = backend;
		this.objectMapper = objectMapper;
		this.serverInfo = serverInfo;
		this.normalizer = new ResultNormalizer(objectMapper);
		this.state = state;
		this.negotiatedVersion = negotiatedVersion;
	}

	/**
	 * Creates a transport for an existing session, already initialized with the
	 * session's negotiated revision.
	 */
	public static ProtocolTransport resume(Backend backend, ObjectMapper objectMapper,
			McpSchema.Implementation serverInfo, String negotiatedVersion) {
		Assert.hasText(negotiatedVersion, "negotiatedVersion must not be empty");
		return new ProtocolTransport(backend, objectMapper, serverInfo, State.INITIALIZED, negotiatedVersion);
	}

	/**
	 * Handles a raw request body. A body that is not JSON yields a {@code -32700} error
	 * with a {@code null} id.
	 */
	public Mono<TransportReply> handle(String body) {
		return Mono.defer(() -> {
			JsonNode message;
			try {
				message = this.objectMapper.readTree(body);
			}
			catch (JsonProcessingException ex) {
				logger.debug("Unparseable message: {}", ex.getOriginalMessage());
				return Mono.just(parseError());
			}
			if (message == null || message.isMissingNode()) {
				return Mono.just(parseError());
			}
			return handle(message);
		});
	}

	/**
	 * Handles one message or a batch.
	 */
	public Mono<TransportReply> handle(JsonNode message) {
		Assert.notNull(message, "message must not be null");
		if (message.isArray()) {
			if (message.isEmpty()) {
				return Mono.just(new TransportReply.Batch(List.of()));
			}
			List<JsonNode> items = new ArrayList<>(message.size());
			message.forEach(items::add);
			return Flux.fromIterable(items)
				.concatMap(this::handleMessage)
				.collectList()
				.<TransportReply>map(responses -> responses.isEmpty() ? TransportReply.NO_CONTENT
						: new TransportReply.Batch(responses));
		}
		return handleMessage(message).<TransportReply>map(TransportReply.Single::new)
			.defaultIfEmpty(TransportReply.NO_CONTENT);
	}

	/**
	 * Answers every request in {@code body} with {@code error}, for when no backend can
	 * be bound. Malformed messages still get {@code -32600} and notifications still
	 * produce no response.
	 */
	public static TransportReply reject(String body, ObjectMapper objectMapper, JSONRPCError error) {
		JsonNode message;
		try {
			message = objectMapper.readTree(body);
		}
		catch (JsonProcessingException ex) {
			return parseError();
		}
		if (message == null || message.isMissingNode()) {
			return parseError();
		}
		if (!message.isArray()) {
			JSONRPCResponse response = rejectOne(message, error);
			return (response != null) ? new TransportReply.Single(response) : TransportReply.NO_CONTENT;
		}
		if (message.isEmpty()) {
			return new TransportReply.Batch(List.of());
		}
		List<JSONRPCResponse> responses = new ArrayList<>();
		message.forEach(item -> {
			JSONRPCResponse response = rejectOne(item, error);
			if (response != null) {
				responses.add(response);
			}
		});
		return responses.isEmpty() ? TransportReply.NO_CONTENT : new TransportReply.Batch(responses);
	}

	@Nullable
	private static JSONRPCResponse rejectOne(JsonNode item, JSONRPCError error) {
		JSONRPCResponse invalid = envelopeError(item);
		if (invalid != null) {
			return invalid;
		}
		if (item.has("id") && item.has("method")) {
			return JSONRPCResponse.failure(idOf(item), error);
		}
		return null;
	}

	@Nullable
	private static Object idOf(JsonNode message) {
		JsonNode id = message.get("id");
		if (id == null) {
			return null;
		}
		return id.isNumber() ? id.numberValue() : id.asText();
	}

	private static TransportReply parseError() {
		return new TransportReply.Single(
				JSONRPCResponse.failure(null, new JSONRPCError(McpSchema.ErrorCodes.PARSE_ERROR, "Parse error", null)));
	}

	/**
	 * Checks the JSON-RPC envelope of one message.
	 * @return the {@code -32600} response for a malformed message, or {@code null} when
	 * it is a well-formed request, notification or client response
	 */
	@Nullable
	private static JSONRPCResponse envelopeError(JsonNode node) {
		if (!node.isObject()) {
			return invalidRequest(null, "Invalid Request: message must be an object");
		}
		JsonNode idNode = node.get("id");
		if (idNode != null && !idNode.isTextual() && !idNode.isNumber()) {
			return invalidRequest(null, "Invalid Request: id must be a string or a number");
		}
		Object id = idOf(node);
		JsonNode version = node.get("jsonrpc");
		if (version == null || !McpSchema.JSONRPC_VERSION.equals(version.textValue())) {
			return invalidRequest(id, "Invalid Request: jsonrpc must be \"2.0\"");
		}
		JsonNode methodNode = node.get("method");
		if (methodNode == null) {
			if (id != null && (node.has("result") || node.has("error"))) {
				return null;
			}
			return invalidRequest(id, "Invalid Request: missing method");
		}
		if (!methodNode.isTextual()) {
			return invalidRequest(id, "Invalid Request: method must be a string");
		}
		return null;
	}

	private static JSONRPCResponse invalidRequest(@Nullable Object id, String message) {
		return JSONRPCResponse.failure(id, new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST, message, null));
	}

	private Mono<JSONRPCResponse> handleMessage(JsonNode node) {
		JSONRPCResponse invalid = envelopeError(node);
		if (invalid != null) {
			return Mono.just(invalid);
		}
		Object id = idOf(node);
		JsonNode methodNode = node.get("method");
		if (methodNode == null) {
			logger.debug("Ignoring client response for id {}", id);
			return Mono.empty();
		}
		String method = methodNode.asText();
		Object params = node.hasNonNull("params") ? this.objectMapper.convertValue(node.get("params"), Object.class)
				: null;
		if (id == null) {
			return handleNotification(method, params).then(Mono.empty());
		}
		return handleRequest(id, method, params);
	}

	private Mono<JSONRPCResponse> handleRequest(Object id, String method, @Nullable Object params) {
		return Mono.defer(() -> dispatch(method, params))
			.map(result -> JSONRPCResponse.success(id, result))
			.onErrorResume(ex -> Mono.just(JSONRPCResponse.failure(id, toError(method, ex))));
	}

	private Mono<Object> dispatch(String method, @Nullable Object params) {
		State current = this.state;
		if (current == State.CLOSED) {
			return Mono.error(McpError.builder(McpSchema.ErrorCodes.TRANSPORT_CLOSED).message("Transport closed").build());
		}
		if (McpSchema.METHOD_INITIALIZE.equals(method)) {
			return Mono.<Object>just(initialize(params));
		}
		if (McpSchema.METHOD_PING.equals(method)) {
			return Mono.<Object>just(Map.of());
		}
		if (current != State.INITIALIZED) {
			return Mono.error(McpError.builder(McpSchema.ErrorCodes.SERVER_NOT_INITIALIZED)
				.message("Server not initialized")
				.build());
		}
		if (McpSchema.METHOD_AUTH_SET_USER_TOKEN.equals(method)) {
			return Mono.<Object>just(setUserToken(params));
		}
		return this.backend.send(method, params).map(this.normalizer::normalize);
	}

	private McpSchema.InitializeResult initialize(@Nullable Object params) {
		McpSchema.InitializeRequest request;
		try {
			request = (params != null) ? this.objectMapper.convertValue(params, McpSchema.InitializeRequest.class)
					: null;
		}
		catch (IllegalArgumentException ex) {
			throw McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Invalid initialize params: " + ex.getMessage())
				.build();
		}
		String requested = (request != null) ? request.protocolVersion() : null;
		String version = (requested == null) ? ProtocolVersions.LATEST
				: ProtocolVersions.negotiate(requested)
					.orElseThrow(() -> new UnsupportedProtocolVersionException(requested));
		if (this.state == State.CLOSED) {
			throw McpError.builder(McpSchema.ErrorCodes.TRANSPORT_CLOSED).message("Transport closed").build();
		}
		this.negotiatedVersion = version;
		this.state = State.INITIALIZED;
		logger.debug("Negotiated protocol version {} (requested {})", version, requested);
		return new McpSchema.InitializeResult(version, McpSchema.ServerCapabilities.gatewayDefaults(),
				this.serverInfo);
	}

	private Map<String, Object> setUserToken(@Nullable Object params) {
		Object token = (params instanceof Map<?, ?> map) ? map.get("token") : null;
		if (!(token instanceof String userToken) || !Utils.hasText(userToken)) {
			throw McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Missing required parameter: token")
				.build();
		}
		this.backend.setUserToken(userToken);
		return Map.of("status", "token_set");
	}

	private Mono<Void> handleNotification(String method, @Nullable Object params) {
		if (McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(method)) {
			logger.debug("Client finished initialization");
			return Mono.empty();
		}
		if (this.state != State.INITIALIZED) {
			logger.debug("Dropping notification {} in state {}", method, this.state);
			return Mono.empty();
		}
		return this.backend.notify(method, params).onErrorResume(ex -> {
			logger.warn("Forwarding notification {} failed: {}", method, ex.getMessage());
			return Mono.empty();
		});
	}

	private JSONRPCError toError(String method, Throwable ex) {
		if (ex instanceof McpError mcpError) {
			return mcpError.getJsonRpcError();
		}
		if (ex instanceof UnsupportedProtocolVersionException unsupported) {
			return new JSONRPCError(McpSchema.ErrorCodes.INVALID_PARAMS, "Unsupported protocolVersion",
					Map.of("supported", ProtocolVersions.SUPPORTED, "requested", unsupported.getRequestedVersion()));
		}
		if (ex instanceof BackendUnavailableException) {
			logger.warn("Backend unavailable for {}: {}", method, ex.getMessage());
			return new JSONRPCError(McpSchema.ErrorCodes.BACKEND_UNAVAILABLE, "Backend unavailable", null);
		}
		if (ex instanceof SessionExpiredException) {
			return new JSONRPCError(McpSchema.ErrorCodes.SESSION_EXPIRED, "Session expired", null);
		}
		if (ex instanceof InvalidMessageException) {
			return new JSONRPCError(McpSchema.ErrorCodes.INVALID_REQUEST, ex.getMessage(), null);
		}
		logger.error("Internal error handling {}", method, ex);
		return new JSONRPCError(McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error", null);
	}

	/**
	 * Moves to the terminal state. The backend stays open; the pool owns it.
	 */
	public void close() {
		this.state = State.CLOSED;
	}

	public State getState() {
		return this.state;
	}

	public Optional<String> getNegotiatedVersion() {
		return Optional.ofNullable(this.negotiatedVersion);
	}

	public Backend getBackend() {
		return this.backend;
	}

}
