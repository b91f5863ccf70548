/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.sagemcp.gateway.runtime;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a subprocess's stdout byte stream into JSON payloads.
 *
 * <p>
 * Both framings are recognised frame by frame: a buffer that starts with a
 * {@code Content-Length} header is read as a length-prefixed frame (header terminated by
 * {@code \r\n\r\n} or {@code \n\n}); anything else is read as one JSON document per line.
 * Bytes of an incomplete frame stay buffered until more input arrives.
 *
 * <p>
 * Instances are thread-safe.
 */
public class FrameDecoder {

	private static final Logger logger = LoggerFactory.getLogger(FrameDecoder.class);

	private static final String CONTENT_LENGTH = "content-length:";

	private static final byte[] CRLF_TERMINATOR = { '\r', '\n', '\r', '\n' };

	private static final byte[] LF_TERMINATOR = { '\n', '\n' };

	private byte[] buffer = new byte[8192];

	private int length;

	public synchronized void append(byte[] data, int offset, int count) {
		if (this.length + count > this.buffer.length) {
			this.buffer = Arrays.copyOf(this.buffer, Math.max(this.buffer.length * 2, this.length + count));
		}
		System.arraycopy(data, offset, this.buffer, this.length, count);
		this.length += count;
	}

	public void append(byte[] data) {
		append(data, 0, data.length);
	}

	/**
	 * Removes and returns the next complete payload, if the buffer holds one.
	 */
	public synchronized Optional<byte[]> nextFrame() {
		while (true) {
			skipLeadingWhitespace();
			if (this.length == 0) {
				return Optional.empty();
			}
			if (startsWithContentLength()) {
				int headerEnd = indexOf(CRLF_TERMINATOR);
				int terminatorLength = CRLF_TERMINATOR.length;
				int lfEnd = indexOf(LF_TERMINATOR);
				if (lfEnd >= 0 && (headerEnd < 0 || lfEnd < headerEnd)) {
					headerEnd = lfEnd;
					terminatorLength = LF_TERMINATOR.length;
				}
				if (headerEnd < 0) {
					return Optional.empty();
				}
				int bodyStart = headerEnd + terminatorLength;
				int contentLength = parseContentLength(new String(this.buffer, 0, headerEnd, StandardCharsets.US_ASCII));
				if (contentLength < 0) {
					logger.warn("Dropping frame header without a valid Content-Length");
					consume(bodyStart);
					continue;
				}
				if (this.length - bodyStart < contentLength) {
					return Optional.empty();
				}
				byte[] frame = Arrays.copyOfRange(this.buffer, bodyStart, bodyStart + contentLength);
				consume(bodyStart + contentLength);
				return Optional.of(frame);
			}
			int newline = indexOf(new byte[] { '\n' });
			if (newline < 0) {
				return Optional.empty();
			}
			int end = (newline > 0 && this.buffer[newline - 1] == '\r') ? newline - 1 : newline;
			byte[] line = Arrays.copyOfRange(this.buffer, 0, end);
			consume(newline + 1);
			return Optional.of(line);
		}
	}

	/**
	 * Discards everything buffered, used when the framing is switched.
	 */
	public synchronized void reset() {
		this.length = 0;
	}

	public synchronized int bufferedBytes() {
		return this.length;
	}

	public synchronized byte[] buffered() {
		return Arrays.copyOf(this.buffer, this.length);
	}

	private static int parseContentLength(String header) {
		for (String line : header.split("\r?\n")) {
			String trimmed = line.trim();
			if (trimmed.toLowerCase(Locale.ROOT).startsWith(CONTENT_LENGTH)) {
				try {
					int value = Integer.parseInt(trimmed.substring(CONTENT_LENGTH.length()).trim());
					return value >= 0 ? value : -1;
				}
				catch (NumberFormatException ex) {
					return -1;
				}
			}
		}
		return -1;
	}

	private boolean startsWithContentLength() {
		if (this.length < CONTENT_LENGTH.length()) {
			return false;
		}
		for (int i = 0; i < CONTENT_LENGTH.length(); i++) {
			if (Character.toLowerCase((char) this.buffer[i]) != CONTENT_LENGTH.charAt(i)) {
				return false;
			}
		}
		return true;
	}

	private void skipLeadingWhitespace() {
		int start = 0;
		while (start < this.length && isWhitespace(this.buffer[start])) {
			start++;
		}
		if (start > 0) {
			consume(start);
		}
	}

	private static boolean isWhitespace(byte b) {
		return b == '\n' || b == '\r' || b == ' ' || b == '\t';
	}

	private int indexOf(byte[] pattern) {
		outer: for (int i = 0; i <= this.length - pattern.length; i++) {
			for (int j = 0; j < pattern.length; j++) {
				if (this.buffer[i + j] != pattern[j]) {
					continue outer;
				}
			}
			return i;
		}
		return -1;
	}

	private void consume(int count) {
		System.arraycopy(this.buffer, count, this.buffer, 0, this.length - count);
		this.length -= count;
	}

}
