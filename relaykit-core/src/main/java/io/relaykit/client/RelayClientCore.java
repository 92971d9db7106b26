/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client;

import java.time.Duration;
import java.util.function.LongSupplier;

import io.relaykit.client.expirer.Expirer;
import io.relaykit.client.heartbeat.IntervalHeartbeat;
import io.relaykit.client.history.JsonRpcHistory;
import io.relaykit.client.publisher.Publisher;
import io.relaykit.client.storage.InMemoryKeyValueStorage;
import io.relaykit.spec.Heartbeat;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.spec.RelayTransport;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Owns the reliability layer of a relay client: one storage, one heartbeat and one
 * transport shared by the {@link Publisher}, the {@link JsonRpcHistory} and the
 * {@link Expirer}.
 *
 * <pre>{@code
 * RelayClientCore core = RelayClientCore.builder()
 *     .transport(transport)
 *     .storage(new FileKeyValueStorage(Path.of("relay-store.json")))
 *     .build();
 * core.start().block();
 * core.publisher().publish(topic, message).subscribe();
 * }</pre>
 */
public class RelayClientCore implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RelayClientCore.class);

	private final KeyValueStorage storage;

	private final Heartbeat heartbeat;

	// Only a heartbeat created by the builder is started and stopped here
	private final IntervalHeartbeat ownedHeartbeat;

	private final Publisher publisher;

	private final JsonRpcHistory history;

	private final Expirer expirer;

	RelayClientCore(Builder builder) {
		Assert.notNull(builder.transport, "transport must not be null");
		this.storage = (builder.storage != null) ? builder.storage : new InMemoryKeyValueStorage();
		if (builder.heartbeat != null) {
			this.heartbeat = builder.heartbeat;
			this.ownedHeartbeat = null;
		}
		else {
			this.ownedHeartbeat = new IntervalHeartbeat(builder.heartbeatInterval);
			this.heartbeat = this.ownedHeartbeat;
		}
		this.publisher = Publisher.builder()
			.transport(builder.transport)
			.heartbeat(this.heartbeat)
			.storage(this.storage)
			.defaultTtl(builder.publisherDefaultTtl)
			.build();
		this.history = new JsonRpcHistory(this.storage);
		this.expirer = new Expirer(this.storage, this.heartbeat, RelayDefaults.SIGN_CLIENT_STORAGE_PREFIX,
				builder.currentTimeMillisSupplier);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Restores the three stores and starts the heartbeat if this core created it.
	 * @return a Mono completing once every store is READY
	 */
	public Mono<Void> start() {
		return Mono.when(this.publisher.init(), this.history.init(), this.expirer.init())
			.doOnSubscribe(s -> logger.debug("Starting relay client core"))
			.then(Mono.fromRunnable(() -> {
				if (this.ownedHeartbeat != null) {
					this.ownedHeartbeat.start();
				}
				logger.info("Relay client core started: {} queued, {} records, {} expirations", this.publisher.size(),
						this.history.size(), this.expirer.size());
			}));
	}

	public Publisher publisher() {
		return this.publisher;
	}

	public JsonRpcHistory history() {
		return this.history;
	}

	public Expirer expirer() {
		return this.expirer;
	}

	public KeyValueStorage storage() {
		return this.storage;
	}

	public Heartbeat heartbeat() {
		return this.heartbeat;
	}

	@Override
	public void close() {
		this.publisher.close();
		this.history.close();
		this.expirer.close();
		if (this.ownedHeartbeat != null) {
			this.ownedHeartbeat.close();
		}
		logger.debug("Relay client core closed");
	}

	/**
	 * Builder for {@link RelayClientCore}. Only the transport is required.
	 */
	public static class Builder {

		private RelayTransport transport;

		private KeyValueStorage storage;

		private Heartbeat heartbeat;

		private Duration heartbeatInterval = RelayDefaults.HEARTBEAT_INTERVAL;

		private long publisherDefaultTtl = RelayDefaults.PUBLISHER_DEFAULT_TTL;

		private LongSupplier currentTimeMillisSupplier = System::currentTimeMillis;

		public Builder transport(RelayTransport transport) {
			this.transport = transport;
			return this;
		}

		/**
		 * Sets the storage. Defaults to an {@link InMemoryKeyValueStorage}.
		 * @param storage the storage
		 * @return this builder
		 */
		public Builder storage(KeyValueStorage storage) {
			this.storage = storage;
			return this;
		}

		/**
		 * Sets an externally managed heartbeat. Without one, the core creates an
		 * {@link IntervalHeartbeat} and starts and stops it itself.
		 * @param heartbeat the heartbeat
		 * @return this builder
		 */
		public Builder heartbeat(Heartbeat heartbeat) {
			this.heartbeat = heartbeat;
			return this;
		}

		public Builder heartbeatInterval(Duration heartbeatInterval) {
			this.heartbeatInterval = heartbeatInterval;
			return this;
		}

		public Builder publisherDefaultTtl(long publisherDefaultTtl) {
			this.publisherDefaultTtl = publisherDefaultTtl;
			return this;
		}

		public Builder clock(LongSupplier currentTimeMillisSupplier) {
			this.currentTimeMillisSupplier = currentTimeMillisSupplier;
			return this;
		}

		public RelayClientCore build() {
			return new RelayClientCore(this);
		}

	}

}
