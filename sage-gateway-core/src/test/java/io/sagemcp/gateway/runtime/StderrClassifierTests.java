/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StderrClassifierTests {

	@Test
	void classifiesConventionalPrefixes() {
		assertThat(StderrClassifier.classify("[DEBUG] loading tools")).isEqualTo(Level.DEBUG);
		assertThat(StderrClassifier.classify("INFO: server ready")).isEqualTo(Level.INFO);
		assertThat(StderrClassifier.classify("WARNING: token expires soon")).isEqualTo(Level.WARN);
		assertThat(StderrClassifier.classify("ERROR: missing API key")).isEqualTo(Level.ERROR);
		assertThat(StderrClassifier.classify("2025-01-01 12:00:00 ERROR boom")).isEqualTo(Level.ERROR);
	}

	@Test
	void unrecognisedLinesStayQuiet() {
		assertThat(StderrClassifier.classify("Listening on stdio")).isEqualTo(Level.DEBUG);
		assertThat(StderrClassifier.classify("  npm notice new version available")).isEqualTo(Level.DEBUG);
	}

}
