/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

public enum ProcessStatus {

	RUNNING, STOPPED, ERROR, RESTARTING

}
