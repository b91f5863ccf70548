/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.retry;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class HttpUpstreamTests {

	private final HttpRequest request = HttpRequest.newBuilder(URI.create("http://upstream.test/items")).build();

	@SuppressWarnings("unchecked")
	private static HttpResponse<String> response(int status, String body, Map<String, List<String>> headers) {
		HttpResponse<String> response = mock(HttpResponse.class);
		when(response.statusCode()).thenReturn(status);
		when(response.body()).thenReturn(body);
		when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
		return response;
	}

	@Test
	void successfulStatusBecomesSuccess() {
		UpstreamResult<String> result = HttpUpstream.toResult(response(200, "{\"ok\":true}", Map.of()));

		assertThat(result).isEqualTo(UpstreamResult.success("{\"ok\":true}"));
	}

	@Test
	void errorStatusCarriesRetryAfterAndBody() {
		UpstreamResult<String> result = HttpUpstream
			.toResult(response(429, "slow down", Map.of("Retry-After", List.of("12"))));

		assertThat(result).isInstanceOfSatisfying(UpstreamResult.HttpFailure.class, failure -> {
			assertThat(failure.status()).isEqualTo(429);
			assertThat(failure.retryAfterSeconds()).contains(12.0);
			assertThat(failure.body()).isEqualTo("slow down");
		});
	}

	@Test
	void ioErrorBecomesConnectionFailure() {
		HttpClient client = mock(HttpClient.class);
		doReturn(CompletableFuture.failedFuture(new ConnectException("refused"))).when(client)
			.sendAsync(any(), any());
		HttpUpstream upstream = new HttpUpstream(client, new RetryPolicy());

		StepVerifier.create(upstream.sendOnce(this.request))
			.assertNext(result -> assertThat(result).isInstanceOf(UpstreamResult.ConnectionFailure.class))
			.verifyComplete();
	}

	@Test
	void sendRetriesThroughPolicy() {
		HttpClient client = mock(HttpClient.class);
		doReturn(CompletableFuture.completedFuture(response(503, "", Map.of())),
				CompletableFuture.completedFuture(response(200, "done", Map.of())))
			.when(client)
			.sendAsync(any(), any());
		RetryPolicy policy = new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5), d -> Mono.empty(),
				Random::new);
		HttpUpstream upstream = new HttpUpstream(client, policy);

		StepVerifier.create(upstream.send(this.request)).expectNext("done").verifyComplete();

		verify(client, times(2)).sendAsync(any(), any());
	}

}
