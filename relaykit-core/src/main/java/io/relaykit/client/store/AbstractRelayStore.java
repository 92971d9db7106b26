/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.relaykit.client.RelayDefaults;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.Heartbeat;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Base class of the relay client stores: an in-memory index keyed by {@code K},
 * restored once through an {@link InitGate} and mirrored to a {@link KeyValueStorage}.
 * <p>
 * Every call to {@link #persist()} schedules a write of the whole index. Writes are
 * applied one at a time, each taking its snapshot when it runs, so the last write always
 * reflects the latest in-memory state. A {@code sync} event follows every successful
 * write.
 *
 * @param <K> the index key type
 * @param <V> the record type
 * @param <E> the events the store emits
 */
public abstract class AbstractRelayStore<K, V, E extends StoreEvents> implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(AbstractRelayStore.class);

	private final String name;

	private final String storagePrefix;

	private final String storageVersion;

	protected final KeyValueStorage storage;

	protected final Map<K, V> index = new ConcurrentHashMap<>();

	protected final InitGate<V> gate;

	protected final E events;

	private final Sinks.Many<Boolean> persistRequests = Sinks.many().unicast().onBackpressureBuffer();

	private volatile Disposable heartbeatSubscription;

	protected AbstractRelayStore(String name, String storagePrefix, String storageVersion, KeyValueStorage storage,
			E events) {
		Assert.hasText(name, "name must not be empty");
		Assert.notNull(storagePrefix, "storagePrefix must not be null");
		Assert.notNull(storageVersion, "storageVersion must not be null");
		Assert.notNull(storage, "storage must not be null");
		Assert.notNull(events, "events must not be null");
		this.name = name;
		this.storagePrefix = storagePrefix;
		this.storageVersion = storageVersion;
		this.storage = storage;
		this.events = events;
		this.gate = new InitGate<>(context());
		this.persistRequests.asFlux().concatMap(request -> writeSnapshot()).subscribe();
	}

	/**
	 * Returns the index key of a record.
	 * @param value the record
	 * @return its key
	 */
	protected abstract K keyOf(V value);

	/**
	 * Returns the type the persisted snapshot is read as.
	 * @return the snapshot type
	 */
	protected abstract TypeRef<List<V>> snapshotType();

	/**
	 * Invoked once the store is READY and before waiting callers resume.
	 */
	protected void onInitialized() {
	}

	/**
	 * Restores the index from storage. Only the first call restores; later calls complete
	 * once the first one has.
	 * @return a Mono completing when the store is READY
	 */
	public Mono<Void> init() {
		return this.gate.open(Mono.defer(() -> this.storage.getItem(storageKey(), snapshotType())),
				this.index::isEmpty, value -> this.index.put(keyOf(value), value), () -> {
					logger.trace("Initialized {}", context());
					onInitialized();
					this.events.init().emit(snapshotEvent());
				});
	}

	public String name() {
		return this.name;
	}

	public String context() {
		return RelayDefaults.CORE_CONTEXT + "/" + this.name;
	}

	public String storageKey() {
		return this.storagePrefix + this.storageVersion + "//" + this.name;
	}

	public int size() {
		return this.index.size();
	}

	public List<K> keys() {
		return List.copyOf(this.index.keySet());
	}

	public List<V> values() {
		return List.copyOf(this.index.values());
	}

	public E events() {
		return this.events;
	}

	public InitGate.State state() {
		return this.gate.state();
	}

	/**
	 * Subscribes a sweep to the heartbeat. Replaces any earlier subscription.
	 * @param heartbeat the heartbeat
	 * @param sweep the sweep to run on every pulse
	 */
	protected void watch(Heartbeat heartbeat, Runnable sweep) {
		Disposable previous = this.heartbeatSubscription;
		this.heartbeatSubscription = heartbeat.onPulse(sweep);
		if (previous != null) {
			previous.dispose();
		}
	}

	/**
	 * Logs an emitted event and writes the index.
	 * @param eventName the event name
	 * @param payload the event payload
	 */
	protected void onEvent(String eventName, Object payload) {
		logger.info("Emitting {} from {}", eventName, context());
		logger.debug("Event {}: {}", eventName, payload);
		persist();
	}

	/**
	 * Schedules a write of the whole index.
	 */
	protected synchronized void persist() {
		Sinks.EmitResult result = this.persistRequests.tryEmitNext(Boolean.TRUE);
		if (result.isFailure()) {
			logger.warn("Dropped a write of {}: {}", context(), result);
		}
	}

	private Mono<Void> writeSnapshot() {
		return Mono.defer(() -> {
			List<V> snapshot = values();
			return this.storage.setItem(storageKey(), snapshot)
				.then(Mono.fromRunnable(() -> this.events.sync().emit(new StoreEvent(context(), storageKey(),
						snapshot.size()))));
		}).onErrorResume(e -> {
			logger.error("Failed to persist {}", context(), e);
			return Mono.empty();
		}).then();
	}

	private StoreEvent snapshotEvent() {
		return new StoreEvent(context(), storageKey(), this.index.size());
	}

	/**
	 * Stops reacting to the heartbeat and stops accepting writes. Writes already
	 * scheduled still complete.
	 */
	@Override
	public void close() {
		Disposable subscription = this.heartbeatSubscription;
		if (subscription != null) {
			subscription.dispose();
		}
		synchronized (this) {
			this.persistRequests.tryEmitComplete();
		}
	}

}
