/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import io.sagemcp.gateway.spec.McpError;
import io.sagemcp.gateway.spec.McpSchema;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class NativeBackendTests {

	private static final McpSchema.Tool ECHO = new McpSchema.Tool("echo", "Echoes its text",
			Map.of("type", "object"));

	private static final McpSchema.Resource README = new McpSchema.Resource(URI.create("file:///readme.md"),
			"readme", null, "text/markdown");

	private final AtomicReference<NativeCallContext> lastContext = new AtomicReference<>();

	private NativeBackend backend() {
		return NativeBackend.builder("acme", "notes")
			.userToken("initial")
			.tool(ToolSpecification.builder().tool(ECHO).callHandler((context, request) -> {
				this.lastContext.set(context);
				return Mono.just(McpSchema.CallToolResult.text(String.valueOf(request.arguments().get("text"))));
			}).build())
			.tool(new ToolSpecification(new McpSchema.Tool("fail", null, null),
					(context, request) -> Mono.error(new IllegalStateException("upstream down"))))
			.resource(new ResourceSpecification(README,
					(context, request) -> Mono.just(new McpSchema.ReadResourceResult(
							List.of(new McpSchema.TextResourceContents(request.uri(), "text/markdown", "# Notes"))))))
			.build();
	}

	private static void assertErrorCode(Throwable ex, int code) {
		assertThat(ex).isInstanceOfSatisfying(McpError.class,
				error -> assertThat(error.getJsonRpcError().code()).isEqualTo(code));
	}

	@Test
	void listsRegisteredTools() {
		StepVerifier.create(backend().send(McpSchema.METHOD_TOOLS_LIST, null))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(McpSchema.ListToolsResult.class,
					tools -> assertThat(tools.tools()).extracting(McpSchema.Tool::name).containsExactly("echo", "fail")))
			.verifyComplete();
	}

	@Test
	void callsToolWithTokenInContext() {
		NativeBackend backend = backend();
		backend.setUserToken("later");

		StepVerifier
			.create(backend.send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", "echo", "arguments", Map.of("text", "hi"))))
			.assertNext(result -> assertThat(result).isEqualTo(McpSchema.CallToolResult.text("hi")))
			.verifyComplete();

		assertThat(this.lastContext.get()).satisfies(context -> {
			assertThat(context.tenantId()).isEqualTo("acme");
			assertThat(context.connectorId()).isEqualTo("notes");
			assertThat(context.token()).contains("later");
			assertThat(context.retryPolicy()).isNotNull();
		});
	}

	@Test
	void unknownToolIsMethodNotFound() {
		StepVerifier.create(backend().send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", "nope")))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.METHOD_NOT_FOUND))
			.verify();
	}

	@Test
	void missingToolNameIsInvalidParams() {
		StepVerifier.create(backend().send(McpSchema.METHOD_TOOLS_CALL, Map.of()))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.INVALID_PARAMS))
			.verify();
	}

	@Test
	void malformedParamsAreInvalidParams() {
		StepVerifier.create(backend().send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", List.of(1, 2))))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.INVALID_PARAMS))
			.verify();
	}

	@Test
	void failingToolBecomesErrorResult() {
		StepVerifier.create(backend().send(McpSchema.METHOD_TOOLS_CALL, Map.of("name", "fail")))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(McpSchema.CallToolResult.class, call -> {
				assertThat(call.isError()).isTrue();
				assertThat(call.content()).containsExactly(new McpSchema.TextContent("Error: upstream down"));
			}))
			.verifyComplete();
	}

	@Test
	void listsAndReadsResources() {
		NativeBackend backend = backend();

		StepVerifier.create(backend.send(McpSchema.METHOD_RESOURCES_LIST, Map.of()))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(McpSchema.ListResourcesResult.class,
					list -> assertThat(list.resources()).containsExactly(README)))
			.verifyComplete();

		StepVerifier.create(backend.send(McpSchema.METHOD_RESOURCES_READ, Map.of("uri", "file:///readme.md")))
			.assertNext(result -> assertThat(result).isInstanceOfSatisfying(McpSchema.ReadResourceResult.class,
					read -> assertThat(read.contents()).singleElement()
						.extracting(McpSchema.TextResourceContents::text)
						.isEqualTo("# Notes")))
			.verifyComplete();
	}

	@Test
	void unknownResourceIsResourceNotFound() {
		StepVerifier.create(backend().send(McpSchema.METHOD_RESOURCES_READ, Map.of("uri", "file:///missing")))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.RESOURCE_NOT_FOUND))
			.verify();
	}

	@Test
	void unknownMethodIsMethodNotFound() {
		StepVerifier.create(backend().send("prompts/list", Map.of()))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.METHOD_NOT_FOUND))
			.verify();
	}

	@Test
	void initializerFailureSurfaces() {
		NativeBackend backend = NativeBackend.builder("acme", "notes")
			.initializer(() -> Mono.error(new IllegalStateException("bad credentials")))
			.build();

		StepVerifier.create(backend.initialize()).expectErrorMessage("bad credentials").verify();
	}

	@Test
	void publishedNotificationsReachSubscribers() {
		NativeBackend backend = backend();

		StepVerifier.create(backend.notifications())
			.then(() -> backend.publish(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null))
			.assertNext(notification -> assertThat(notification.method())
				.isEqualTo(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED))
			.then(() -> backend.closeGracefully().block())
			.verifyComplete();
	}

	@Test
	void closedBackendRejectsCalls() {
		NativeBackend backend = backend();
		backend.closeGracefully().block();

		assertThat(backend.isClosed()).isTrue();
		StepVerifier.create(backend.send(McpSchema.METHOD_PING, null))
			.expectErrorSatisfies(ex -> assertErrorCode(ex, McpSchema.ErrorCodes.TRANSPORT_CLOSED))
			.verify();
	}

}
