/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.servlet;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.GatewayContext;
import io.sagemcp.gateway.backend.ConnectorDefinition;
import io.sagemcp.gateway.backend.InMemoryConnectorRegistry;
import io.sagemcp.gateway.backend.NativeBackend;
import io.sagemcp.gateway.backend.ToolSpecification;
import io.sagemcp.gateway.config.GatewayProperties;
import io.sagemcp.gateway.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Timeout(60)
class SageGatewayServerIntegrationTests {

	private static final String INITIALIZE = """
			{"jsonrpc":"2.0","id":1,"method":"initialize","params":{"protocolVersion":"2025-06-18",
			"capabilities":{},"clientInfo":{"name":"it-client","version":"1.0"}}}""";

	private final ObjectMapper objectMapper = new ObjectMapper();

	private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

	private final AtomicReference<NativeBackend> backend = new AtomicReference<>();

	private GatewayContext context;

	private SageGatewayServer server;

	@BeforeEach
	void setUp() throws Exception {
		InMemoryConnectorRegistry registry = new InMemoryConnectorRegistry();
		registry.register("acme", "github", new ConnectorDefinition.Native((tenantId, connectorId, userToken) -> {
			NativeBackend created = NativeBackend.builder(tenantId, connectorId)
				.userToken(userToken)
				.tool(ToolSpecification.builder()
					.tool(new McpSchema.Tool("echo", "Echoes its text argument", Map.of("type", "object")))
					.callHandler((call, request) -> Mono
						.just(McpSchema.CallToolResult.text(String.valueOf(request.arguments().get("text")))))
					.build())
				.build();
			this.backend.set(created);
			return created;
		}));
		GatewayProperties properties = GatewayProperties.builder()
			.defaultRequestsPerMinute(1000)
			.tenantRateLimit("throttled", 1)
			.build();
		this.context = GatewayContext.builder().properties(properties).registry(registry).build();
		this.server = new SageGatewayServer(this.context, 0);
		this.server.start();
	}

	@AfterEach
	void tearDown() {
		this.server.stop();
	}

	private URI endpoint(String tenant, String connector) {
		return URI.create("http://localhost:" + this.server.getPort() + "/api/v1/" + tenant + "/connectors/"
				+ connector + "/mcp");
	}

	private HttpResponse<String> post(String sessionId, String body) throws Exception {
		HttpRequest.Builder request = HttpRequest.newBuilder(endpoint("acme", "github"))
			.header("Content-Type", "application/json")
			.header("Accept", "application/json, text/event-stream")
			.POST(HttpRequest.BodyPublishers.ofString(body));
		if (sessionId != null) {
			request.header(McpGatewayServlet.MCP_SESSION_ID, sessionId);
		}
		return this.client.send(request.build(), HttpResponse.BodyHandlers.ofString());
	}

	private String initialize() throws Exception {
		HttpResponse<String> response = post(null, INITIALIZE);
		assertThat(response.statusCode()).isEqualTo(200);
		return response.headers().firstValue(McpGatewayServlet.MCP_SESSION_ID).orElseThrow();
	}

	@Test
	void initializeThenCallTool() throws Exception {
		HttpResponse<String> init = post(null, INITIALIZE);
		String sessionId = init.headers().firstValue(McpGatewayServlet.MCP_SESSION_ID).orElseThrow();

		HttpResponse<String> call = post(sessionId, """
				{"jsonrpc":"2.0","id":2,"method":"tools/call","params":{"name":"echo","arguments":{"text":"hi"}}}""");

		JsonNode initBody = this.objectMapper.readTree(init.body());
		assertThat(initBody.path("result").path("protocolVersion").asText()).isEqualTo("2025-06-18");
		assertThat(sessionId).matches("[0-9a-f]{32}");
		assertThat(call.statusCode()).isEqualTo(200);
		assertThat(this.objectMapper.readTree(call.body()).path("result").path("content").get(0).path("text").asText())
			.isEqualTo("hi");
	}

	@Test
	void notificationBatchIsAccepted() throws Exception {
		String sessionId = initialize();

		HttpResponse<String> response = post(sessionId, """
				[{"jsonrpc":"2.0","method":"notifications/initialized"},
				 {"jsonrpc":"2.0","method":"notifications/cancelled","params":{"requestId":1}}]""");

		assertThat(response.statusCode()).isEqualTo(202);
		assertThat(response.body()).isEmpty();
	}

	@Test
	void deletedSessionIsGone() throws Exception {
		String sessionId = initialize();
		HttpRequest delete = HttpRequest.newBuilder(endpoint("acme", "github"))
			.header(McpGatewayServlet.MCP_SESSION_ID, sessionId)
			.DELETE()
			.build();

		assertThat(this.client.send(delete, HttpResponse.BodyHandlers.discarding()).statusCode()).isEqualTo(204);

		HttpResponse<String> after = post(sessionId, "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"ping\"}");
		assertThat(after.statusCode()).isEqualTo(404);
		assertThat(this.objectMapper.readTree(after.body()).path("error").path("code").asInt())
			.isEqualTo(McpSchema.ErrorCodes.SESSION_EXPIRED);
	}

	@Test
	void unknownConnectorAnswersBackendUnavailable() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(endpoint("acme", "jira"))
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString("{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/list\"}"))
			.build();

		HttpResponse<String> response = this.client.send(request, HttpResponse.BodyHandlers.ofString());

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(this.objectMapper.readTree(response.body()).path("error").path("code").asInt())
			.isEqualTo(McpSchema.ErrorCodes.BACKEND_UNAVAILABLE);
	}

	@Test
	void tenantOverLimitGetsTooManyRequests() throws Exception {
		HttpRequest request = HttpRequest.newBuilder(endpoint("throttled", "github"))
			.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}"))
			.build();

		HttpResponse<String> first = this.client.send(request, HttpResponse.BodyHandlers.ofString());
		HttpResponse<String> second = this.client.send(request, HttpResponse.BodyHandlers.ofString());

		assertThat(first.statusCode()).isNotEqualTo(429);
		assertThat(second.statusCode()).isEqualTo(429);
		assertThat(second.headers().firstValue("Retry-After")).hasValueSatisfying(
				value -> assertThat(Long.parseLong(value)).isBetween(1L, 61L));
	}

	@Test
	void eventStreamReplaysAfterLastEventId() throws Exception {
		String sessionId = initialize();
		this.backend.get().publish("notifications/tools/list_changed", null);
		this.backend.get().publish("notifications/resources/list_changed", null);
		await().atMost(Duration.ofSeconds(5))
			.until(() -> this.context.getEventBuffers().get(sessionId).map(buffer -> buffer.latestId()).orElse(0L) == 2);

		HttpRequest request = HttpRequest.newBuilder(endpoint("acme", "github"))
			.header("Accept", "text/event-stream")
			.header(McpGatewayServlet.MCP_SESSION_ID, sessionId)
			.header(McpGatewayServlet.LAST_EVENT_ID, "1")
			.GET()
			.build();
		HttpResponse<Stream<String>> response = this.client.send(request, HttpResponse.BodyHandlers.ofLines());

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
				value -> assertThat(value).startsWith("text/event-stream"));
		try (Stream<String> lines = response.body()) {
			Iterator<String> iterator = lines.iterator();
			assertThat(iterator.next()).isEqualTo("id: 2");
			assertThat(iterator.next()).isEqualTo("event: message");
			String data = iterator.next();
			assertThat(data).startsWith("data: ");
			assertThat(this.objectMapper.readTree(data.substring("data: ".length())).path("method").asText())
				.isEqualTo("notifications/resources/list_changed");
		}
	}

}
