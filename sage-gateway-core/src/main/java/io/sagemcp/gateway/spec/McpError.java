/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.spec;

import java.util.Map;
import java.util.function.Function;

import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.sagemcp.gateway.util.Assert;

/**
 * A protocol-level failure that is reported to the client as a JSON-RPC error.
 */
public class McpError extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public static final Function<String, McpError> RESOURCE_NOT_FOUND = uri -> new McpError(
			new JSONRPCError(McpSchema.ErrorCodes.RESOURCE_NOT_FOUND, "Resource not found", Map.of("uri", uri)));

	public static final Function<String, McpError> METHOD_NOT_FOUND = method -> new McpError(
			new JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND, "Method not found", Map.of("method", method)));

	private final transient JSONRPCError jsonRpcError;

	public McpError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	@Override
	public String toString() {
		return super.toString() + " (code " + this.jsonRpcError.code() + ")";
	}

	public static Builder builder(int errorCode) {
		return new Builder(errorCode);
	}

	public static class Builder {

		private final int code;

		private String message;

		private Object data;

		private Builder(int code) {
			this.code = code;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder data(Object data) {
			this.data = data;
			return this;
		}

		public McpError build() {
			Assert.hasText(this.message, "message must not be empty");
			return new McpError(new JSONRPCError(this.code, this.message, this.data));
		}

	}

}
