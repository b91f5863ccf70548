/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime.fixtures;

import java.nio.file.Path;
import java.util.List;

/**
 * Command lines that run a fixture server in a child JVM on the test classpath.
 */
public final class Fixtures {

	private Fixtures() {
	}

	public static String javaExecutable() {
		return Path.of(System.getProperty("java.home"), "bin", "java").toString();
	}

	public static List<String> command(Class<?> server) {
		return List.of(javaExecutable(), "-cp", System.getProperty("java.class.path"), server.getName());
	}

}
