/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.runtime.fixtures.ContentLengthServer;
import io.sagemcp.gateway.runtime.fixtures.CrashingServer;
import io.sagemcp.gateway.runtime.fixtures.Fixtures;
import io.sagemcp.gateway.runtime.fixtures.JsonLinesServer;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.McpError;
import io.sagemcp.gateway.spec.McpSchema;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@Timeout(60)
class StdioConnectorTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(20);

	private final ObjectMapper objectMapper = new ObjectMapper();

	private StdioConnector connector;

	@AfterEach
	void tearDown() {
		if (this.connector != null) {
			this.connector.stop().block(TIMEOUT);
		}
	}

	private static ConnectorOptions options(Duration requestTimeout, Duration handshakeTimeout) {
		return new ConnectorOptions(requestTimeout, handshakeTimeout, Duration.ZERO, 2, Duration.ofMillis(50),
				Duration.ofSeconds(2));
	}

	private StdioConnector connector(Class<?> server, ConnectorOptions options) {
		ResolvedLaunch launch = new ResolvedLaunch(Fixtures.command(server), System.getenv(),
				RuntimeType.EXTERNAL_CUSTOM, null);
		this.connector = new StdioConnector("acme:" + server.getSimpleName(), launch, options, this.objectMapper);
		return this.connector;
	}

	private StdioConnector started(Class<?> server) {
		StdioConnector started = connector(server, options(Duration.ofSeconds(10), Duration.ofSeconds(15)));
		started.start().block(TIMEOUT);
		return started;
	}

	@Test
	void handshakeOverJsonLines() {
		StdioConnector stdio = started(JsonLinesServer.class);

		assertThat(stdio.isInitialized()).isTrue();
		assertThat(stdio.getFramingMode()).isEqualTo(FramingMode.JSON_LINES);
		assertThat(stdio.isProcessAlive()).isTrue();
		assertThat(stdio.pid()).isPresent();

		StepVerifier.create(stdio.send(McpSchema.METHOD_TOOLS_LIST, Map.of()))
			.assertNext(result -> assertThat(result).isEqualTo(Map.of("tools", List.of(Map.of("name", "echo")))))
			.verifyComplete();
	}

	@Test
	void fallsBackToContentLengthFraming() {
		StdioConnector stdio = connector(ContentLengthServer.class,
				options(Duration.ofSeconds(10), Duration.ofSeconds(3)));

		stdio.start().block(TIMEOUT);

		assertThat(stdio.isInitialized()).isTrue();
		assertThat(stdio.getFramingMode()).isEqualTo(FramingMode.CONTENT_LENGTH);
		StepVerifier.create(stdio.send("echo", Map.of("text", "framed")))
			.assertNext(result -> assertThat(result).isEqualTo(Map.of("text", "framed")))
			.verifyComplete();
		assertThat(stdio.pendingRequestCount()).isZero();
	}

	@Test
	void processThatDiesDuringStartupFailsInitialization() {
		StdioConnector stdio = connector(CrashingServer.class, options(Duration.ofSeconds(5), Duration.ofSeconds(5)));

		StepVerifier.create(stdio.start())
			.expectError(ConnectorInitializationException.class)
			.verify(TIMEOUT);

		assertThat(stdio.isProcessAlive()).isFalse();
		assertThat(stdio.isInitialized()).isFalse();
	}

	@Test
	void unspawnableCommandIsTypedError() {
		ResolvedLaunch launch = new ResolvedLaunch(List.of("/nonexistent/sage-mcp-server"), Map.of(),
				RuntimeType.EXTERNAL_CUSTOM, null);
		this.connector = new StdioConnector("acme:missing", launch, ConnectorOptions.defaults(), this.objectMapper);

		StepVerifier.create(this.connector.start()).expectError(LaunchCommandException.class).verify(TIMEOUT);
	}

	@Test
	void concurrentRequestsCompleteOutOfOrder() {
		StdioConnector stdio = started(JsonLinesServer.class);
		List<String> completions = new CopyOnWriteArrayList<>();

		Mono<Object> slow = stdio.send("sleep", Map.of("ms", 800)).doOnNext(r -> completions.add("slow"));
		Mono<Object> fast = stdio.send("echo", Map.of("n", 1)).doOnNext(r -> completions.add("fast"));

		StepVerifier.create(Mono.zip(slow, fast)).assertNext(results -> {
			assertThat(results.getT1()).isEqualTo(Map.of("slept", 800));
			assertThat(results.getT2()).isEqualTo(Map.of("n", 1));
		}).verifyComplete();

		assertThat(completions).containsExactly("fast", "slow");
		assertThat(stdio.pendingRequestCount()).isZero();
	}

	@Test
	void jsonRpcErrorIsRaisedAsMcpError() {
		StdioConnector stdio = started(JsonLinesServer.class);

		StepVerifier.create(stdio.send("no/such/method", Map.of()))
			.expectErrorSatisfies(ex -> assertThat(ex).isInstanceOfSatisfying(McpError.class,
					error -> assertThat(error.getJsonRpcError().code())
						.isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND)))
			.verify(TIMEOUT);
	}

	@Test
	void timedOutRequestLeavesNoPendingEntry() {
		StdioConnector stdio = connector(JsonLinesServer.class,
				options(Duration.ofMillis(500), Duration.ofSeconds(15)));
		stdio.start().block(TIMEOUT);

		StepVerifier.create(stdio.send("sleep", Map.of("ms", 5000)))
			.expectError(BackendUnavailableException.class)
			.verify(TIMEOUT);

		assertThat(stdio.pendingRequestCount()).isZero();
		assertThat(stdio.isProcessAlive()).isTrue();
	}

	@Test
	void stopFailsPendingRequests() {
		StdioConnector stdio = started(JsonLinesServer.class);
		List<Throwable> errors = new CopyOnWriteArrayList<>();
		Disposable pending = stdio.send("sleep", Map.of("ms", 8000)).subscribe(r -> {
		}, errors::add);
		await().atMost(TIMEOUT).until(() -> stdio.pendingRequestCount() == 1);

		stdio.stop().block(TIMEOUT);

		await().atMost(TIMEOUT).until(() -> !errors.isEmpty());
		assertThat(errors.get(0)).isInstanceOf(BackendUnavailableException.class);
		assertThat(stdio.pendingRequestCount()).isZero();
		assertThat(stdio.isProcessAlive()).isFalse();
		pending.dispose();
	}

	@Test
	void processExitFailsRequestAndMarksUnhealthy() {
		StdioConnector stdio = started(JsonLinesServer.class);

		StepVerifier.create(stdio.send("crash", Map.of()))
			.expectError(BackendUnavailableException.class)
			.verify(TIMEOUT);

		await().atMost(TIMEOUT).until(() -> !stdio.isProcessAlive());
		assertThat(stdio.isHealthy()).isFalse();
		StepVerifier.create(stdio.checkHealth()).expectNext(false).verifyComplete();
		await().atMost(TIMEOUT).until(() -> stdio.stderrTail().contains("ERROR: crashing on request"));
	}

	@Test
	void healthTurnsUnhealthyOnlyAtFailureThreshold() {
		StdioConnector stdio = started(JsonLinesServer.class);
		StepVerifier.create(stdio.checkHealth()).expectNext(true).verifyComplete();

		stdio.send("break", Map.of()).block(TIMEOUT);

		StepVerifier.create(stdio.checkHealth()).expectNext(true).verifyComplete();
		assertThat(stdio.getConsecutiveFailures()).isEqualTo(1);
		StepVerifier.create(stdio.checkHealth()).expectNext(false).verifyComplete();
		assertThat(stdio.getConsecutiveFailures()).isEqualTo(2);
		assertThat(stdio.isProcessAlive()).isTrue();
	}

	@Test
	void probesAreSpacedByProbeInterval() {
		long[] now = { 1_000 };
		ConnectorOptions options = new ConnectorOptions(Duration.ofSeconds(10), Duration.ofSeconds(15),
				Duration.ofSeconds(30), 1, Duration.ofMillis(50), Duration.ofSeconds(2));
		ResolvedLaunch launch = new ResolvedLaunch(Fixtures.command(JsonLinesServer.class), System.getenv(),
				RuntimeType.EXTERNAL_CUSTOM, null);
		this.connector = new StdioConnector("acme:spaced", launch, options, this.objectMapper, () -> now[0]);
		this.connector.start().block(TIMEOUT);

		StepVerifier.create(this.connector.checkHealth()).expectNext(true).verifyComplete();
		this.connector.send("break", Map.of()).block(TIMEOUT);

		now[0] += 10_000;
		StepVerifier.create(this.connector.checkHealth()).expectNext(true).verifyComplete();
		assertThat(this.connector.getConsecutiveFailures()).isZero();

		now[0] += 30_000;
		StepVerifier.create(this.connector.checkHealth()).expectNext(false).verifyComplete();
	}

	@Test
	void serverNotificationsArePublished() {
		StdioConnector stdio = started(JsonLinesServer.class);
		List<McpSchema.JSONRPCNotification> received = new CopyOnWriteArrayList<>();
		Disposable subscription = stdio.notifications().subscribe(received::add);

		stdio.send("emit", Map.of()).block(TIMEOUT);

		await().atMost(TIMEOUT).until(() -> !received.isEmpty());
		assertThat(received.get(0).method()).isEqualTo("notifications/message");
		assertThat(received.get(0).params()).isEqualTo(Map.of("level", "info", "data", "emitted"));
		subscription.dispose();
	}

	@Test
	void malformedAndUnmatchedFramesAreDropped() {
		StdioConnector stdio = connector(JsonLinesServer.class, ConnectorOptions.defaults());
		List<McpSchema.JSONRPCNotification> received = new CopyOnWriteArrayList<>();
		Disposable subscription = stdio.notifications().subscribe(received::add);

		stdio.handleFrame("not json".getBytes(StandardCharsets.UTF_8));
		stdio.handleFrame("[1,2,3]".getBytes(StandardCharsets.UTF_8));
		stdio.handleFrame("{\"jsonrpc\":\"2.0\",\"id\":\"99\",\"result\":{}}".getBytes(StandardCharsets.UTF_8));
		stdio.handleFrame("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/tools/list_changed\"}"
			.getBytes(StandardCharsets.UTF_8));

		assertThat(received).singleElement()
			.satisfies(notification -> assertThat(notification.method())
				.isEqualTo(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED));
		assertThat(stdio.pendingRequestCount()).isZero();
		subscription.dispose();
	}

}
