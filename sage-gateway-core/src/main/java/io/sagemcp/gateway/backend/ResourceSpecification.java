/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.backend;

import java.util.function.BiFunction;

import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * A resource served in-process by a {@link NativeBackend}.
 *
 * @param resource the resource definition; its uri may be a {@link java.net.URI}
 * @param readHandler invoked for {@code resources/read} of the resource's uri
 */
public record ResourceSpecification(McpSchema.Resource resource,
		BiFunction<NativeCallContext, McpSchema.ReadResourceRequest, Mono<McpSchema.ReadResourceResult>> readHandler) {

	public ResourceSpecification {
		Assert.notNull(resource, "resource must not be null");
		Assert.notNull(resource.uri(), "resource uri must not be null");
		Assert.notNull(readHandler, "readHandler must not be null");
	}

	public String uri() {
		return this.resource.uri().toString();
	}

}
