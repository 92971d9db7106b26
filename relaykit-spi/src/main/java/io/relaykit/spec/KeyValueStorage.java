/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.spec;

import io.relaykit.json.TypeRef;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable key-value store the client persists its indexes to.
 * <p>
 * Values are whole snapshots: every write replaces what was stored under the key.
 */
public interface KeyValueStorage {

	/**
	 * Reads the value stored under a key.
	 * @param key the storage key
	 * @param type the type to read the value as
	 * @param <T> the value type
	 * @return the value, or an empty Mono when nothing is stored under the key
	 */
	<T> Mono<T> getItem(String key, TypeRef<T> type);

	/**
	 * Replaces the value stored under a key.
	 * @param key the storage key
	 * @param value the value to store
	 * @return a Mono completing once the value is durable
	 */
	Mono<Void> setItem(String key, Object value);

	Mono<Void> removeItem(String key);

	Flux<String> getKeys();

}
