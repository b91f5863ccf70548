/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import io.sagemcp.gateway.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Adapts {@link HttpClient} calls to {@link UpstreamResult} so native connectors can run
 * them under a {@link RetryPolicy}.
 */
public class HttpUpstream {

	private final HttpClient httpClient;

	private final RetryPolicy retryPolicy;

	public HttpUpstream(RetryPolicy retryPolicy) {
		this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), retryPolicy);
	}

	public HttpUpstream(HttpClient httpClient, RetryPolicy retryPolicy) {
		Assert.notNull(httpClient, "httpClient must not be null");
		Assert.notNull(retryPolicy, "retryPolicy must not be null");
		this.httpClient = httpClient;
		this.retryPolicy = retryPolicy;
	}

	/**
	 * Sends the request once and reports the outcome without raising for error statuses.
	 */
	public Mono<UpstreamResult<String>> sendOnce(HttpRequest request) {
		return Mono.fromFuture(() -> this.httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
			.map(HttpUpstream::toResult)
			.onErrorResume(IOException.class, ex -> Mono.just(UpstreamResult.connectionFailure(ex)));
	}

	/**
	 * Sends the request under the retry policy, yielding the body of a 2xx response.
	 */
	public Mono<String> send(HttpRequest request) {
		return this.retryPolicy.execute(() -> sendOnce(request));
	}

	static UpstreamResult<String> toResult(HttpResponse<String> response) {
		int status = response.statusCode();
		if (status >= 200 && status < 300) {
			return UpstreamResult.success(response.body());
		}
		String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
		return UpstreamResult.httpFailure(status, retryAfter, response.body());
	}

}
