/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.storage;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.relaykit.json.RelayJsonMapper;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.util.Assert;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link KeyValueStorage} keeping JSON text in memory. Values go through the
 * {@link RelayJsonMapper} on the way in and out, so a restore reads back exactly what a
 * durable store would.
 */
public class InMemoryKeyValueStorage implements KeyValueStorage {

	private final Map<String, String> entries = new ConcurrentHashMap<>();

	private final RelayJsonMapper jsonMapper;

	public InMemoryKeyValueStorage() {
		this(RelayJsonMapper.createDefault());
	}

	public InMemoryKeyValueStorage(RelayJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	@Override
	public <T> Mono<T> getItem(String key, TypeRef<T> type) {
		return Mono.fromCallable(() -> {
			String json = this.entries.get(key);
			return (json != null) ? this.jsonMapper.readValue(json, type) : null;
		});
	}

	@Override
	public Mono<Void> setItem(String key, Object value) {
		return Mono.fromCallable(() -> this.entries.put(key, this.jsonMapper.writeValueAsString(value))).then();
	}

	@Override
	public Mono<Void> removeItem(String key) {
		return Mono.fromRunnable(() -> this.entries.remove(key));
	}

	@Override
	public Flux<String> getKeys() {
		return Flux.defer(() -> Flux.fromIterable(List.copyOf(this.entries.keySet())));
	}

}
