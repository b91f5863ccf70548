/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.transport;

import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.sagemcp.gateway.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Rewrites a backend result into plain JSON-compatible values. Every {@link URI},
 * {@link URL} and {@link Path} becomes its string form, at any depth; records and other
 * beans are first converted to maps.
 */
final class ResultNormalizer {

	private final ObjectMapper objectMapper;

	ResultNormalizer(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		// Jackson writes Path as a file: URI by default
		this.objectMapper = objectMapper.copy()
			.registerModule(new SimpleModule("sage-path-as-string").addSerializer(Path.class,
					ToStringSerializer.instance));
	}

	@Nullable
	Object normalize(@Nullable Object value) {
		if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean
				|| value instanceof JsonNode) {
			return value;
		}
		if (value instanceof URI || value instanceof URL || value instanceof Path || value instanceof Character
				|| value instanceof Enum<?>) {
			return value.toString();
		}
		if (value instanceof Map<?, ?> map) {
			Map<String, Object> normalized = new LinkedHashMap<>();
			map.forEach((key, nested) -> normalized.put(String.valueOf(key), normalize(nested)));
			return normalized;
		}
		if (value instanceof Collection<?> collection) {
			List<Object> normalized = new ArrayList<>(collection.size());
			collection.forEach(nested -> normalized.add(normalize(nested)));
			return normalized;
		}
		if (value instanceof Object[] array) {
			return normalize(Arrays.asList(array));
		}
		// primitive arrays and beans go through Jackson
		return normalize(this.objectMapper.convertValue(value, Object.class));
	}

}
