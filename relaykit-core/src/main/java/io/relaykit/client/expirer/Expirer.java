/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.expirer;

import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

import io.relaykit.client.RelayDefaults;
import io.relaykit.client.store.AbstractRelayStore;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.Heartbeat;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.spec.RelayError;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Tracks when topics expire and announces them once they have.
 * <p>
 * An expiration is checked against the clock when it is set and on every heartbeat
 * pulse. Expired entries are removed and reported through the {@code expired} event.
 */
public class Expirer extends AbstractRelayStore<String, Expiration, ExpirerEvents> {

	private static final Logger logger = LoggerFactory.getLogger(Expirer.class);

	private static final TypeRef<List<Expiration>> SNAPSHOT_TYPE = new TypeRef<>() {
	};

	private final Heartbeat heartbeat;

	private final LongSupplier currentTimeMillisSupplier;

	public Expirer(KeyValueStorage storage, Heartbeat heartbeat) {
		this(storage, heartbeat, RelayDefaults.SIGN_CLIENT_STORAGE_PREFIX, System::currentTimeMillis);
	}

	public Expirer(KeyValueStorage storage, Heartbeat heartbeat, String storagePrefix,
			LongSupplier currentTimeMillisSupplier) {
		super(RelayDefaults.EXPIRER_CONTEXT, storagePrefix, RelayDefaults.EXPIRER_STORAGE_VERSION, storage,
				new ExpirerEvents());
		Assert.notNull(heartbeat, "heartbeat must not be null");
		Assert.notNull(currentTimeMillisSupplier, "currentTimeMillisSupplier must not be null");
		this.heartbeat = heartbeat;
		this.currentTimeMillisSupplier = currentTimeMillisSupplier;
		this.events.created().on(event -> onEvent(this.events.created().name(), event));
		this.events.deleted().on(event -> onEvent(this.events.deleted().name(), event));
		this.events.expired().on(event -> onEvent(this.events.expired().name(), event));
	}

	public boolean has(String topic) {
		return find(topic).isPresent();
	}

	public Optional<Expiration> find(String topic) {
		if (topic == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(this.index.get(topic));
	}

	/**
	 * Sets the expiry of a topic, replacing any earlier one. An expiry already in the past
	 * expires the topic right away.
	 * @param topic the topic
	 * @param expiry the expiry as epoch seconds
	 * @throws RelayError with {@link RelayError.ErrorCodes#NOT_INITIALIZED} before
	 * {@link #init()} completed
	 */
	public void set(String topic, long expiry) {
		this.gate.checkReady();
		Assert.hasText(topic, "topic must not be empty");
		Expiration expiration = new Expiration(topic, expiry);
		this.index.put(topic, expiration);
		checkExpiry(expiration);
		this.events.created().emit(new ExpirerEvent(topic, expiration));
	}

	/**
	 * Returns the expiration of a topic.
	 * @param topic the topic
	 * @return the expiration
	 * @throws RelayError with {@link RelayError.ErrorCodes#NOT_INITIALIZED} before
	 * {@link #init()} completed, or {@link RelayError.ErrorCodes#NO_MATCHING_ID} when the
	 * topic has none
	 */
	public Expiration get(String topic) {
		this.gate.checkReady();
		return find(topic).orElseThrow(() -> RelayError.NO_MATCHING_ID.apply(name(), topic));
	}

	/**
	 * Removes the expiration of a topic and emits {@code deleted}. Does nothing when the
	 * topic has none.
	 * @param topic the topic
	 * @return a Mono completing once removed
	 */
	public Mono<Void> del(String topic) {
		return this.gate.awaitReady().then(Mono.fromRunnable(() -> {
			Expiration removed = (topic != null) ? this.index.remove(topic) : null;
			if (removed != null) {
				this.events.deleted().emit(new ExpirerEvent(topic, removed));
			}
		}));
	}

	@Override
	protected String keyOf(Expiration value) {
		return value.topic();
	}

	@Override
	protected TypeRef<List<Expiration>> snapshotType() {
		return SNAPSHOT_TYPE;
	}

	@Override
	protected void onInitialized() {
		watch(this.heartbeat, this::checkExpirations);
	}

	private void checkExpirations() {
		values().forEach(this::checkExpiry);
	}

	private void checkExpiry(Expiration expiration) {
		if (expiration.msToTimeout(this.currentTimeMillisSupplier.getAsLong()) <= 0) {
			expire(expiration);
		}
	}

	// Conditional removal: an expiration replaced in the meantime stays
	private void expire(Expiration expiration) {
		if (this.index.remove(expiration.topic(), expiration)) {
			logger.debug("Topic {} expired", expiration.topic());
			this.events.expired().emit(new ExpirerEvent(expiration.topic(), expiration));
		}
	}

}
