/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.function.BiFunction;

import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A tool served in-process by a {@link NativeBackend}.
 *
 * @param tool the tool definition
 * @param callHandler invoked for {@code tools/call} with the tool's name
 */
public record ToolSpecification(McpSchema.Tool tool,
		BiFunction<NativeCallContext, McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler) {

	public ToolSpecification {
		Assert.notNull(tool, "tool must not be null");
		Assert.notNull(callHandler, "callHandler must not be null");
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {

		private McpSchema.Tool tool;

		private BiFunction<NativeCallContext, McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler;

		public Builder tool(McpSchema.Tool tool) {
			this.tool = tool;
			return this;
		}

		public Builder callHandler(
				BiFunction<NativeCallContext, McpSchema.CallToolRequest, Mono<McpSchema.CallToolResult>> callHandler) {
			this.callHandler = callHandler;
			return this;
		}

		public ToolSpecification build() {
			return new ToolSpecification(this.tool, this.callHandler);
		}

	}

}
