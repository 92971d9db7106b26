/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import io.relaykit.util.Assert;

/**
 * Computes the fingerprint under which an outbound message is queued.
 */
public final class MessageHasher {

	private static final String ALGORITHM = "SHA-256";

	private MessageHasher() {
	}

	/**
	 * Returns the lowercase hex SHA-256 digest of the UTF-8 bytes of a message.
	 * @param message the message, must not be null
	 * @return the fingerprint
	 */
	public static String hash(String message) {
		Assert.notNull(message, "message must not be null");
		try {
			byte[] digest = MessageDigest.getInstance(ALGORITHM).digest(message.getBytes(StandardCharsets.UTF_8));
			return HexFormat.of().formatHex(digest);
		}
		catch (NoSuchAlgorithmException e) {
			// every JDK ships SHA-256
			throw new IllegalStateException(ALGORITHM + " is not available", e);
		}
	}

}
