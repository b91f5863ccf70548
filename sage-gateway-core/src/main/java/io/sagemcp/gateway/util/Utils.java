/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.util;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Collection is {@code null} or empty. Otherwise,
	 * return {@code false}.
	 * @param collection the Collection to check
	 * @return whether the given Collection is empty
	 */
	public static boolean isEmpty(@Nullable Collection<?> collection) {
		return (collection == null || collection.isEmpty());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Monotonic clock reading in milliseconds. Only differences between two readings are
	 * meaningful.
	 * @return the current monotonic time in milliseconds
	 */
	public static long monotonicMillis() {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
	}

	/**
	 * Monotonic clock reading in fractional seconds.
	 * @return the current monotonic time in seconds
	 */
	public static double monotonicSeconds() {
		return System.nanoTime() / 1_000_000_000.0;
	}

	/**
	 * Composes the {@code tenant:connector} key used by the pool, the session manager
	 * and the process manager.
	 * @param tenantSlug the tenant slug
	 * @param connectorId the connector id
	 * @return the composite key
	 */
	public static String connectorKey(String tenantSlug, String connectorId) {
		return tenantSlug + ":" + connectorId;
	}

	/**
	 * Truncates a string to at most {@code maxLength} characters.
	 * @param value the value, may be {@code null}
	 * @param maxLength the maximum length
	 * @return the truncated value, or an empty string for {@code null}
	 */
	public static String truncate(@Nullable String value, int maxLength) {
		if (value == null) {
			return "";
		}
		return value.length() <= maxLength ? value : value.substring(0, maxLength);
	}

}
