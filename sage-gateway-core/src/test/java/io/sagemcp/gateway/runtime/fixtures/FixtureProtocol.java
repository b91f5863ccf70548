/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime.fixtures;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Request handling shared by the fixture MCP servers. Replies are handed to a writer
 * that applies the server's framing.
 *
 * <p>
 * Methods: {@code initialize}, {@code tools/list}, {@code resources/list},
 * {@code echo} (returns its params), {@code sleep} (answers after {@code params.ms}
 * milliseconds on its own thread), {@code emit} (sends a notification, then answers),
 * {@code break} (every later probe method fails) and {@code crash} (exits with code 3
 * without answering).
 */
final class FixtureProtocol {

	static final ObjectMapper MAPPER = new ObjectMapper();

	private final Consumer<Object> writer;

	private final AtomicBoolean broken = new AtomicBoolean();

	FixtureProtocol(Consumer<Object> writer) {
		this.writer = writer;
	}

	void handle(String payload) throws Exception {
		JsonNode message = MAPPER.readTree(payload);
		JsonNode id = message.get("id");
		String method = message.path("method").asText();
		if (id == null || id.isNull()) {
			return;
		}
		switch (method) {
			case "initialize" -> reply(id, Map.of("protocolVersion", "2024-11-05", "capabilities",
					Map.of("tools", Map.of()), "serverInfo", Map.of("name", "fixture", "version", "1.0.0")));
			case "tools/list", "resources/list" -> {
				if (this.broken.get()) {
					error(id, -32603, "broken");
				}
				else {
					reply(id, Map.of(method.startsWith("tools") ? "tools" : "resources",
							List.of(Map.of("name", "echo"))));
				}
			}
			case "echo" -> reply(id, message.path("params"));
			case "sleep" -> {
				long millis = message.path("params").path("ms").asLong();
				Thread sleeper = new Thread(() -> {
					try {
						Thread.sleep(millis);
					}
					catch (InterruptedException ex) {
						Thread.currentThread().interrupt();
					}
					reply(id, Map.of("slept", millis));
				});
				sleeper.setDaemon(true);
				sleeper.start();
			}
			case "emit" -> {
				this.writer.accept(Map.of("jsonrpc", "2.0", "method", "notifications/message", "params",
						Map.of("level", "info", "data", "emitted")));
				reply(id, Map.of());
			}
			case "break" -> {
				this.broken.set(true);
				reply(id, Map.of());
			}
			case "crash" -> {
				System.err.println("ERROR: crashing on request");
				System.exit(3);
			}
			default -> error(id, -32601, "Method not found: " + method);
		}
	}

	private void reply(JsonNode id, Object result) {
		this.writer.accept(Map.of("jsonrpc", "2.0", "id", id, "result", result));
	}

	private void error(JsonNode id, int code, String message) {
		this.writer.accept(Map.of("jsonrpc", "2.0", "id", id, "error", Map.of("code", code, "message", message)));
	}

}
