/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import org.slf4j.event.Level;

/**
 * Maps a subprocess stderr line to a log level by its conventional prefix. Unrecognised
 * lines are logged at {@link Level#DEBUG}.
 */
public final class StderrClassifier {

	private StderrClassifier() {
	}

	public static Level classify(String line) {
		String trimmed = line.stripLeading();
		if (trimmed.startsWith("[DEBUG]") || trimmed.startsWith("DEBUG:")) {
			return Level.DEBUG;
		}
		if (trimmed.startsWith("INFO:") || trimmed.startsWith("[INFO]")) {
			return Level.INFO;
		}
		if (trimmed.contains("ERROR")) {
			return Level.ERROR;
		}
		if (trimmed.contains("WARNING") || trimmed.startsWith("[WARN]")) {
			return Level.WARN;
		}
		return Level.DEBUG;
	}

}
