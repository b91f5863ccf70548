/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.util.Locale;

/**
 * Runtime family of an external connector, as reported in process status.
 */
public enum RuntimeType {

	EXTERNAL_PYTHON("external_python"),

	EXTERNAL_NODEJS("external_nodejs"),

	EXTERNAL_GO("external_go"),

	EXTERNAL_CUSTOM("external_custom");

	private final String value;

	RuntimeType(String value) {
		this.value = value;
	}

	public String value() {
		return this.value;
	}

	/**
	 * Infers the runtime family from a launcher executable such as {@code npx} or
	 * {@code /usr/bin/python3}.
	 */
	public static RuntimeType infer(String executable) {
		String name = executable.trim();
		int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
		name = name.substring(slash + 1).toLowerCase(Locale.ROOT);
		if (name.endsWith(".exe") || name.endsWith(".cmd")) {
			name = name.substring(0, name.length() - 4);
		}
		return switch (name) {
			case "npx", "node", "npm", "bun" -> EXTERNAL_NODEJS;
			case "uvx", "uv", "python", "python3", "pip" -> EXTERNAL_PYTHON;
			case "go" -> EXTERNAL_GO;
			default -> EXTERNAL_CUSTOM;
		};
	}

}
