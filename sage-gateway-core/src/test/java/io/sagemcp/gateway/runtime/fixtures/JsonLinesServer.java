/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime.fixtures;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * MCP server speaking newline-delimited JSON on stdin/stdout.
 */
public final class JsonLinesServer {

	private JsonLinesServer() {
	}

	public static void main(String[] args) throws Exception {
		PrintStream out = new PrintStream(System.out, false, StandardCharsets.UTF_8);
		FixtureProtocol protocol = new FixtureProtocol(message -> {
			try {
				String line = FixtureProtocol.MAPPER.writeValueAsString(message);
				synchronized (out) {
					out.print(line + "\n");
					out.flush();
				}
			}
			catch (JsonProcessingException ex) {
				throw new IllegalStateException(ex);
			}
		});
		System.err.println("INFO: json-lines fixture ready");
		out.print("this line is not json\n");
		out.flush();
		BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		String line;
		while ((line = in.readLine()) != null) {
			if (!line.isBlank()) {
				protocol.handle(line);
			}
		}
	}

}
