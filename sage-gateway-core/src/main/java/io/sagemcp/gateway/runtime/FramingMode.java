/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.nio.charset.StandardCharsets;

/**
 * Wire framing used on a subprocess's standard input and output.
 */
public enum FramingMode {

	/**
	 * One JSON document per line.
	 */
	JSON_LINES {
		@Override
		public byte[] frame(byte[] payload) {
			byte[] framed = new byte[payload.length + 1];
			System.arraycopy(payload, 0, framed, 0, payload.length);
			framed[payload.length] = '\n';
			return framed;
		}
	},

	/**
	 * A {@code Content-Length: n} header, a blank line, then exactly {@code n} bytes.
	 */
	CONTENT_LENGTH {
		@Override
		public byte[] frame(byte[] payload) {
			byte[] header = ("Content-Length: " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
			byte[] framed = new byte[header.length + payload.length];
			System.arraycopy(header, 0, framed, 0, header.length);
			System.arraycopy(payload, 0, framed, header.length, payload.length);
			return framed;
		}
	};

	public abstract byte[] frame(byte[] payload);

}
