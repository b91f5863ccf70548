/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.sagemcp.gateway.spec.BackendUnavailableException;
import io.sagemcp.gateway.spec.McpError;
import io.sagemcp.gateway.spec.McpSchema;
import io.sagemcp.gateway.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import io.sagemcp.gateway.spec.ProtocolVersions;
import io.sagemcp.gateway.util.Assert;
import io.sagemcp.gateway.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns one external MCP server process and speaks JSON-RPC to it over stdin/stdout.
 *
 * <p>
 * Requests are correlated by id through a table of pending sinks; every entry is removed
 * when its response arrives, when it times out, or when the process goes away. The
 * handshake is attempted with newline-delimited JSON first and repeated with
 * {@code Content-Length} framing when that fails. Stderr lines are logged at a level
 * chosen by {@link StderrClassifier}.
 */
public class StdioConnector {

	private static final Logger logger = LoggerFactory.getLogger(StdioConnector.class);

	static final int STDERR_TAIL_LINES = 50;

	private static final McpSchema.Implementation CLIENT_INFO = new McpSchema.Implementation("SageMCP", "1.0.0");

	private final String name;

	private final ResolvedLaunch launch;

	private final ConnectorOptions options;

	private final ObjectMapper objectMapper;

	private final LongSupplier clock;

	private final Map<String, MonoSink<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

	private final AtomicLong requestCounter = new AtomicLong();

	private final FrameDecoder decoder = new FrameDecoder();

	private final Deque<String> stderrTail = new ArrayDeque<>();

	private final Sinks.Many<McpSchema.JSONRPCNotification> notifications = Sinks.many()
		.multicast()
		.directBestEffort();

	private final AtomicInteger consecutiveFailures = new AtomicInteger();

	private final Object writeLock = new Object();

	private final Scheduler inboundScheduler;

	private final Scheduler errorScheduler;

	private final Scheduler outboundScheduler;

	private volatile Process process;

	private volatile FramingMode framingMode = FramingMode.JSON_LINES;

	private volatile boolean initialized;

	private volatile boolean closing;

	private volatile long lastProbeAt = Long.MIN_VALUE;

	public StdioConnector(String name, ResolvedLaunch launch, ConnectorOptions options, ObjectMapper objectMapper) {
		this(name, launch, options, objectMapper, Utils::monotonicMillis);
	}

	StdioConnector(String name, ResolvedLaunch launch, ConnectorOptions options, ObjectMapper objectMapper,
			LongSupplier clock) {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(launch, "launch must not be null");
		Assert.notNull(options, "options must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		Assert.notNull(clock, "clock must not be null");
		this.name = name;
		this.launch = launch;
		this.options = options;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "inbound");
		this.errorScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "error");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "outbound");
	}

	/**
	 * Spawns the process, waits out the startup grace period and performs the MCP
	 * handshake. A failed handshake stops the process before the error is propagated.
	 */
	public Mono<Void> start() {
		return Mono.fromRunnable(this::spawn)
			.subscribeOn(this.outboundScheduler)
			.then(Mono.delay(this.options.startupGrace()))
			.then(Mono.defer(() -> {
				Process current = this.process;
				if (!current.isAlive()) {
					String tail = String.join("\n", stderrTail());
					return Mono.error(new ConnectorInitializationException(
							"MCP server process " + this.name + " died with code " + current.exitValue()
									+ (tail.isEmpty() ? " (no stderr captured)" : "\nstderr:\n" + tail)));
				}
				return handshake();
			}))
			.onErrorResume(ex -> stop().then(Mono.error(ex)));
	}

	private void spawn() {
		ProcessBuilder builder = new ProcessBuilder(this.launch.command());
		builder.environment().clear();
		builder.environment().putAll(this.launch.environment());
		if (this.launch.workingDirectory() != null) {
			builder.directory(this.launch.workingDirectory().toFile());
		}
		try {
			this.process = builder.start();
		}
		catch (IOException ex) {
			throw new LaunchCommandException("Failed to start MCP server process " + this.launch.executable(), ex);
		}
		logger.info("Started MCP server process {} (pid {}, {})", this.name, this.process.pid(),
				this.launch.runtimeType().value());
		Process started = this.process;
		this.inboundScheduler.schedule(() -> readStdout(started.getInputStream()));
		this.errorScheduler.schedule(() -> readStderr(started.getErrorStream()));
	}

	private Mono<Void> handshake() {
		return initializeWith(FramingMode.JSON_LINES).onErrorResume(ex -> {
			if (!isProcessAlive()) {
				return Mono.error(ex);
			}
			logger.info("Handshake with {} failed using JSON lines ({}), retrying with Content-Length framing",
					this.name, ex.getMessage());
			return initializeWith(FramingMode.CONTENT_LENGTH);
		}).flatMap(result -> {
			this.initialized = true;
			logger.info("MCP session with {} initialized using {}", this.name, this.framingMode);
			return notify(McpSchema.METHOD_NOTIFICATION_INITIALIZED, Map.of());
		})
			.onErrorMap(ex -> !(ex instanceof ConnectorInitializationException),
					ex -> new ConnectorInitializationException(
							"Failed to initialize MCP session with " + this.name + ": " + ex.getMessage(), ex));
	}

	private Mono<JsonNode> initializeWith(FramingMode mode) {
		return Mono.defer(() -> {
			this.framingMode = mode;
			this.decoder.reset();
			McpSchema.InitializeRequest request = new McpSchema.InitializeRequest(ProtocolVersions.MCP_2024_11_05,
					Map.of("roots", Map.of("listChanged", true), "sampling", Map.of()), CLIENT_INFO);
			return request(McpSchema.METHOD_INITIALIZE, request, this.options.handshakeTimeout());
		});
	}

	/**
	 * Sends a request and resolves with the raw response envelope.
	 */
	Mono<JsonNode> request(String method, Object params, Duration timeout) {
		String id = String.valueOf(this.requestCounter.incrementAndGet());
		return Mono.<JsonNode>create(sink -> {
			if (this.closing) {
				sink.error(new BackendUnavailableException("Connector " + this.name + " is closed"));
				return;
			}
			this.pendingRequests.put(id, sink);
			try {
				write(new McpSchema.JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
			}
			catch (IOException ex) {
				this.pendingRequests.remove(id);
				sink.error(new BackendUnavailableException("Failed to write to MCP server " + this.name, ex));
			}
		})
			.subscribeOn(this.outboundScheduler)
			.timeout(timeout)
			.onErrorMap(TimeoutException.class,
					ex -> new BackendUnavailableException("MCP request timeout: " + method, ex))
			.onErrorMap(RejectedExecutionException.class,
					ex -> new BackendUnavailableException("Connector " + this.name + " is closed", ex))
			.doFinally(signal -> this.pendingRequests.remove(id));
	}

	/**
	 * Sends a request and resolves with its result converted to plain maps and lists.
	 * A JSON-RPC error from the process is raised as an {@link McpError}.
	 */
	public Mono<Object> send(String method, Object params) {
		return request(method, params, this.options.requestTimeout()).<Object>handle((response, sink) -> {
			JsonNode error = response.get("error");
			if (error != null && !error.isNull()) {
				sink.error(new McpError(this.objectMapper.convertValue(error, JSONRPCError.class)));
				return;
			}
			JsonNode result = response.get("result");
			sink.next(result == null || result.isNull() ? Map.of() : this.objectMapper.convertValue(result, Object.class));
		});
	}

	public Mono<Void> notify(String method, Object params) {
		return Mono.<Void>fromRunnable(() -> {
			try {
				write(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
			}
			catch (IOException ex) {
				throw new BackendUnavailableException("Failed to write to MCP server " + this.name, ex);
			}
		}).subscribeOn(this.outboundScheduler);
	}

	/**
	 * Server-initiated notifications read from the process.
	 */
	public Flux<McpSchema.JSONRPCNotification> notifications() {
		return this.notifications.asFlux();
	}

	private void write(McpSchema.JSONRPCMessage message) throws IOException {
		Process current = this.process;
		if (current == null) {
			throw new IOException("Process not started");
		}
		byte[] framed = this.framingMode.frame(this.objectMapper.writeValueAsBytes(message));
		synchronized (this.writeLock) {
			OutputStream stdin = current.getOutputStream();
			stdin.write(framed);
			stdin.flush();
		}
	}

	private void readStdout(InputStream stdout) {
		byte[] chunk = new byte[8192];
		try {
			int read;
			while ((read = stdout.read(chunk)) != -1) {
				this.decoder.append(chunk, 0, read);
				Optional<byte[]> frame;
				while ((frame = this.decoder.nextFrame()).isPresent()) {
					handleFrame(frame.get());
				}
			}
		}
		catch (IOException ex) {
			if (!this.closing) {
				logger.warn("Error reading stdout of {}", this.name, ex);
			}
		}
		finally {
			onStdoutClosed();
		}
	}

	void handleFrame(byte[] frame) {
		JsonNode message;
		try {
			message = this.objectMapper.readTree(frame);
		}
		catch (IOException ex) {
			logger.debug("Dropping non-JSON output from {}: {}", this.name,
					Utils.truncate(new String(frame, StandardCharsets.UTF_8), 200));
			return;
		}
		if (message == null || !message.isObject()) {
			logger.debug("Dropping non-object frame from {}", this.name);
			return;
		}
		JsonNode id = message.get("id");
		JsonNode method = message.get("method");
		boolean hasId = id != null && !id.isNull();
		if (hasId && method == null) {
			MonoSink<JsonNode> sink = this.pendingRequests.remove(id.asText());
			if (sink == null) {
				logger.debug("Dropping unmatched response {} from {}", id, this.name);
				return;
			}
			sink.success(message);
		}
		else if (method != null && !hasId) {
			Object params = message.has("params") ? this.objectMapper.convertValue(message.get("params"), Object.class)
					: null;
			this.notifications
				.tryEmitNext(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method.asText(), params));
		}
		else if (method != null) {
			answerServerRequest(id, method.asText());
		}
	}

	private void answerServerRequest(JsonNode id, String method) {
		Object requestId = id.isNumber() ? id.numberValue() : id.asText();
		McpSchema.JSONRPCResponse response = McpSchema.METHOD_PING.equals(method)
				? McpSchema.JSONRPCResponse.success(requestId, Map.of())
				: McpSchema.JSONRPCResponse.failure(requestId, new JSONRPCError(McpSchema.ErrorCodes.METHOD_NOT_FOUND,
						"Method not supported by gateway: " + method, null));
		notifyQuietly(response);
	}

	private void notifyQuietly(McpSchema.JSONRPCMessage message) {
		this.outboundScheduler.schedule(() -> {
			try {
				write(message);
			}
			catch (IOException ex) {
				logger.warn("Failed to answer request from {}", this.name, ex);
			}
		});
	}

	private void readStderr(InputStream stderr) {
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (line.isBlank()) {
					continue;
				}
				logger.atLevel(StderrClassifier.classify(line))
					.log("MCP stderr [{}] {}: {}", this.launch.runtimeType().value(), this.name, line);
				synchronized (this.stderrTail) {
					if (this.stderrTail.size() == STDERR_TAIL_LINES) {
						this.stderrTail.removeFirst();
					}
					this.stderrTail.addLast(line);
				}
			}
		}
		catch (IOException ex) {
			if (!this.closing) {
				logger.debug("Stderr of {} closed: {}", this.name, ex.getMessage());
			}
		}
	}

	private void onStdoutClosed() {
		if (!this.closing) {
			logger.warn("MCP server process {} closed its output", this.name);
		}
		failPending("MCP server process " + this.name + " exited");
	}

	private void failPending(String reason) {
		List<MonoSink<JsonNode>> sinks = new ArrayList<>(this.pendingRequests.values());
		this.pendingRequests.clear();
		sinks.forEach(sink -> sink.error(new BackendUnavailableException(reason)));
	}

	/**
	 * Probes liveness. A dead process is unhealthy at once; otherwise {@code resources/list}
	 * is tried, then {@code tools/list}, at most once per probe interval, and the
	 * connector turns unhealthy after {@code failureThreshold} consecutive failed probes.
	 * @return whether the connector is healthy after this check
	 */
	public Mono<Boolean> checkHealth() {
		return Mono.defer(() -> {
			if (!isProcessAlive()) {
				return Mono.just(false);
			}
			long now = this.clock.getAsLong();
			if (this.lastProbeAt != Long.MIN_VALUE && now - this.lastProbeAt < this.options.probeInterval().toMillis()) {
				return Mono.just(isHealthy());
			}
			this.lastProbeAt = now;
			return probe(McpSchema.METHOD_RESOURCES_LIST)
				.flatMap(ok -> ok ? Mono.just(true) : probe(McpSchema.METHOD_TOOLS_LIST))
				.map(ok -> {
					if (ok) {
						this.consecutiveFailures.set(0);
					}
					else {
						int failures = this.consecutiveFailures.incrementAndGet();
						logger.warn("Health probe of {} failed ({}/{})", this.name, failures,
								this.options.failureThreshold());
					}
					return isHealthy();
				});
		});
	}

	private Mono<Boolean> probe(String method) {
		return request(method, Map.of(), this.options.requestTimeout())
			.map(response -> !response.hasNonNull("error"))
			.onErrorResume(ex -> {
				logger.debug("Probe {} of {} failed: {}", method, this.name, ex.getMessage());
				return Mono.just(false);
			});
	}

	public boolean isHealthy() {
		return isProcessAlive() && this.consecutiveFailures.get() < this.options.failureThreshold();
	}

	public boolean isProcessAlive() {
		Process current = this.process;
		return current != null && current.isAlive();
	}

	/**
	 * Stops the process: SIGTERM, then a forcible kill after the shutdown grace. Every
	 * pending request fails with {@link BackendUnavailableException}.
	 */
	public Mono<Void> stop() {
		return Mono.<Void>fromRunnable(() -> {
			this.closing = true;
			this.initialized = false;
			failPending("Connector " + this.name + " stopped");
			Process current = this.process;
			if (current != null && current.isAlive()) {
				try {
					current.getOutputStream().close();
				}
				catch (IOException ex) {
					logger.debug("Closing stdin of {} failed: {}", this.name, ex.getMessage());
				}
				current.destroy();
				try {
					if (!current.waitFor(this.options.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
						logger.warn("MCP server process {} ignored SIGTERM, killing it", this.name);
						current.destroyForcibly().waitFor();
					}
				}
				catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					current.destroyForcibly();
				}
				logger.info("Stopped MCP server process {}", this.name);
			}
			this.notifications.tryEmitComplete();
		}).subscribeOn(Schedulers.boundedElastic()).doFinally(signal -> {
			this.inboundScheduler.dispose();
			this.errorScheduler.dispose();
			this.outboundScheduler.dispose();
		});
	}

	public String getName() {
		return this.name;
	}

	public RuntimeType getRuntimeType() {
		return this.launch.runtimeType();
	}

	public FramingMode getFramingMode() {
		return this.framingMode;
	}

	public boolean isInitialized() {
		return this.initialized;
	}

	public Optional<Long> pid() {
		Process current = this.process;
		return (current != null) ? Optional.of(current.pid()) : Optional.empty();
	}

	public int getConsecutiveFailures() {
		return this.consecutiveFailures.get();
	}

	public int pendingRequestCount() {
		return this.pendingRequests.size();
	}

	public List<String> stderrTail() {
		synchronized (this.stderrTail) {
			return List.copyOf(this.stderrTail);
		}
	}

}
