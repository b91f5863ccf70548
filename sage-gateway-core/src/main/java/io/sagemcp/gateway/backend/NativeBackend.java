/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.retry.RetryPolicy;
import io.sagemcp.gateway.spec.McpError;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Backend whose tools and resources are implemented in the gateway's own process.
 *
 * <p>
 * A failing tool handler produces a {@code CallToolResult} flagged {@code isError}, so an
 * upstream outage reaches the client as tool output rather than a protocol error. Unknown
 * tools and methods fail with {@code -32601}, unknown resources with {@code -32002}.
 */
public final class NativeBackend implements Backend {

	private static final Logger logger = LoggerFactory.getLogger(NativeBackend.class);

	private static final RetryPolicy DEFAULT_RETRY_POLICY = new RetryPolicy();

	private final String tenantId;

	private final String connectorId;

	private final Map<String, ToolSpecification> tools;

	private final Map<String, ResourceSpecification> resources;

	private final Supplier<Mono<Void>> initializer;

	private final ObjectMapper objectMapper;

	private final Sinks.Many<McpSchema.JSONRPCNotification> notifications = Sinks.many()
		.multicast()
		.directBestEffort();

	private volatile String userToken;

	private volatile RetryPolicy retryPolicy;

	private volatile boolean closed;

	private NativeBackend(Builder builder) {
		this.tenantId = builder.tenantId;
		this.connectorId = builder.connectorId;
		this.tools = new LinkedHashMap<>(builder.tools);
		this.resources = new LinkedHashMap<>(builder.resources);
		this.initializer = builder.initializer;
		this.objectMapper = builder.objectMapper;
		this.userToken = builder.userToken;
		this.retryPolicy = builder.retryPolicy;
	}

	public static Builder builder(String tenantId, String connectorId) {
		return new Builder(tenantId, connectorId);
	}

	@Override
	public Mono<Void> initialize() {
		return Mono.defer(this.initializer);
	}

	@Override
	public Mono<Object> send(String method, Object params) {
		return Mono.<Object>defer(() -> {
			if (this.closed) {
				return Mono.error(new McpError(new McpSchema.JSONRPCResponse.JSONRPCError(
						McpSchema.ErrorCodes.TRANSPORT_CLOSED, "Backend closed", null)));
			}
			return switch (method) {
				case McpSchema.METHOD_PING -> Mono.<Object>just(Map.of());
				case McpSchema.METHOD_TOOLS_LIST -> Mono.<Object>just(listTools());
				case McpSchema.METHOD_TOOLS_CALL -> callTool(params);
				case McpSchema.METHOD_RESOURCES_LIST -> Mono.<Object>just(listResources());
				case McpSchema.METHOD_RESOURCES_READ -> readResource(params);
				default -> Mono.<Object>error(McpError.METHOD_NOT_FOUND.apply(method));
			};
		});
	}

	private McpSchema.ListToolsResult listTools() {
		List<McpSchema.Tool> list = new ArrayList<>();
		this.tools.values().forEach(spec -> list.add(spec.tool()));
		return new McpSchema.ListToolsResult(list);
	}

	private McpSchema.ListResourcesResult listResources() {
		List<McpSchema.Resource> list = new ArrayList<>();
		this.resources.values().forEach(spec -> list.add(spec.resource()));
		return new McpSchema.ListResourcesResult(list);
	}

	private Mono<Object> callTool(Object params) {
		McpSchema.CallToolRequest request = convertParams(params, McpSchema.CallToolRequest.class);
		if (request.name() == null) {
			return Mono.error(McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Missing required parameter: name")
				.build());
		}
		ToolSpecification spec = this.tools.get(request.name());
		if (spec == null) {
			return Mono.error(McpError.builder(McpSchema.ErrorCodes.METHOD_NOT_FOUND)
				.message("Unknown tool: " + request.name())
				.data(Map.of("tool", request.name()))
				.build());
		}
		return Mono.defer(() -> spec.callHandler().apply(context(), request))
			.<Object>map(result -> result)
			.onErrorResume(ex -> !(ex instanceof McpError), ex -> {
				logger.warn("Tool {} of {}:{} failed: {}", request.name(), this.tenantId, this.connectorId,
						ex.getMessage());
				return Mono.just(new McpSchema.CallToolResult(
						List.of(new McpSchema.TextContent("Error: " + ex.getMessage())), true));
			});
	}

	private Mono<Object> readResource(Object params) {
		McpSchema.ReadResourceRequest request = convertParams(params, McpSchema.ReadResourceRequest.class);
		if (request.uri() == null) {
			return Mono.error(McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Missing required parameter: uri")
				.build());
		}
		ResourceSpecification spec = this.resources.get(request.uri());
		if (spec == null) {
			return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(request.uri()));
		}
		return Mono.defer(() -> spec.readHandler().apply(context(), request)).<Object>map(result -> result);
	}

	private <T> T convertParams(Object params, Class<T> type) {
		try {
			return this.objectMapper.convertValue(params == null ? Map.of() : params, type);
		}
		catch (IllegalArgumentException ex) {
			throw McpError.builder(McpSchema.ErrorCodes.INVALID_PARAMS)
				.message("Invalid params: " + ex.getMessage())
				.build();
		}
	}

	private NativeCallContext context() {
		RetryPolicy policy = this.retryPolicy;
		return new NativeCallContext(this.tenantId, this.connectorId, this.userToken,
				(policy != null) ? policy : DEFAULT_RETRY_POLICY);
	}

	/**
	 * Supplies the gateway-wide retry policy unless the builder set one.
	 */
	void applyDefaultRetryPolicy(RetryPolicy retryPolicy) {
		Assert.notNull(retryPolicy, "retryPolicy must not be null");
		if (this.retryPolicy == null) {
			this.retryPolicy = retryPolicy;
		}
	}

	@Override
	public Mono<Void> notify(String method, Object params) {
		logger.debug("Notification {} for native connector {}:{}", method, this.tenantId, this.connectorId);
		return Mono.empty();
	}

	/**
	 * Publishes a server-initiated notification to sessions bound to this backend.
	 */
	public void publish(String method, Object params) {
		this.notifications
			.tryEmitNext(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
	}

	@Override
	public Flux<McpSchema.JSONRPCNotification> notifications() {
		return this.notifications.asFlux();
	}

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
		return Mono.fromRunnable(() -> {
			this.closed = true;
			this.notifications.tryEmitComplete();
		});
	}

	@Override
	public boolean isClosed() {
		return this.closed;
	}

	@Override
	public String toString() {
		return "NativeBackend[" + this.tenantId + ":" + this.connectorId + "]";
	}

	public static class Builder {

		private final String tenantId;

		private final String connectorId;

		private final Map<String, ToolSpecification> tools = new LinkedHashMap<>();

		private final Map<String, ResourceSpecification> resources = new LinkedHashMap<>();

		private Supplier<Mono<Void>> initializer = Mono::empty;

		private ObjectMapper objectMapper = new ObjectMapper();

		private String userToken;

		private RetryPolicy retryPolicy;

		private Builder(String tenantId, String connectorId) {
			Assert.hasText(tenantId, "tenantId must not be empty");
			Assert.hasText(connectorId, "connectorId must not be empty");
			this.tenantId = tenantId;
			this.connectorId = connectorId;
		}

		public Builder tool(ToolSpecification tool) {
			Assert.notNull(tool, "tool must not be null");
			this.tools.put(tool.tool().name(), tool);
			return this;
		}

		public Builder resource(ResourceSpecification resource) {
			Assert.notNull(resource, "resource must not be null");
			this.resources.put(resource.uri(), resource);
			return this;
		}

		/**
		 * Work done when the pool initializes the backend, e.g. validating credentials.
		 * A failure keeps the backend out of the pool.
		 */
		public Builder initializer(Supplier<Mono<Void>> initializer) {
			Assert.notNull(initializer, "initializer must not be null");
			this.initializer = initializer;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder userToken(String userToken) {
			this.userToken = userToken;
			return this;
		}

		public Builder retryPolicy(RetryPolicy retryPolicy) {
			Assert.notNull(retryPolicy, "retryPolicy must not be null");
			this.retryPolicy = retryPolicy;
			return this;
		}

		public NativeBackend build() {
			return new NativeBackend(this);
		}

	}

}
