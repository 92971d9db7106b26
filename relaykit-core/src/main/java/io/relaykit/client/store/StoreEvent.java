/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

/**
 * Payload of the {@code init} and {@code sync} events of a store.
 *
 * @param context the logging context of the store
 * @param storageKey the key the store persists under
 * @param size the number of entries held when the event fired
 */
public record StoreEvent(String context, String storageKey, int size) {
}
