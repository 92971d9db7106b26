/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.expirer;

/**
 * Payload of the {@code created}, {@code deleted} and {@code expired} events.
 *
 * @param topic the topic
 * @param expiration the expiration concerned
 */
public record ExpirerEvent(String topic, Expiration expiration) {
}
