/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.publisher;

import java.util.List;
import java.util.Map;

import io.relaykit.client.RelayDefaults;
import io.relaykit.client.store.AbstractRelayStore;
import io.relaykit.client.store.StoreEvents;
import io.relaykit.client.util.MessageHasher;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.Heartbeat;
import io.relaykit.spec.JsonRpcSchema.RequestArguments;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.spec.RelayProtocolApi;
import io.relaykit.spec.RelayProtocols;
import io.relaykit.spec.RelayTransport;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Publishes messages to the relay and keeps resubmitting them until the relay
 * acknowledges.
 * <p>
 * A message is queued under the fingerprint of its content before it is sent and leaves
 * the queue only when the relay acknowledged it. On every heartbeat pulse each queued
 * message is resubmitted independently, without backoff and without an attempt limit. The
 * queue is persisted so that unacknowledged messages survive a restart.
 *
 * <pre>{@code
 * Publisher publisher = Publisher.builder()
 *     .transport(transport)
 *     .heartbeat(heartbeat)
 *     .storage(storage)
 *     .build();
 * publisher.init().then(publisher.publish(topic, message)).block();
 * }</pre>
 */
public class Publisher extends AbstractRelayStore<String, PublishParams, StoreEvents> {

	private static final Logger logger = LoggerFactory.getLogger(Publisher.class);

	private static final TypeRef<List<PublishParams>> SNAPSHOT_TYPE = new TypeRef<>() {
	};

	private final RelayTransport transport;

	private final Heartbeat heartbeat;

	private final long defaultTtl;

	Publisher(RelayTransport transport, Heartbeat heartbeat, KeyValueStorage storage, String storagePrefix,
			long defaultTtl) {
		super(RelayDefaults.PUBLISHER_CONTEXT, storagePrefix, RelayDefaults.PUBLISHER_STORAGE_VERSION, storage,
				new StoreEvents());
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(heartbeat, "heartbeat must not be null");
		Assert.isTrue(defaultTtl > 0, "defaultTtl must be positive");
		this.transport = transport;
		this.heartbeat = heartbeat;
		this.defaultTtl = defaultTtl;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Publishes a message with the default options.
	 * @param topic the topic
	 * @param message the encoded message
	 * @return a Mono completing when the relay acknowledged the message
	 */
	public Mono<Void> publish(String topic, String message) {
		return publish(topic, message, null);
	}

	/**
	 * Publishes a message. The message stays queued, and is resubmitted on every pulse,
	 * until the relay acknowledges it; a failed first attempt still fails the returned
	 * Mono.
	 * @param topic the topic
	 * @param message the encoded message
	 * @param opts the options, may be null
	 * @return a Mono completing when the relay acknowledged the message
	 */
	public Mono<Void> publish(String topic, String message, PublishOptions opts) {
		return this.gate.awaitReady().then(Mono.defer(() -> {
			Assert.hasText(topic, "topic must not be empty");
			Assert.notNull(message, "message must not be null");
			logger.debug("Publishing Payload");
			logger.trace("publish topic={} message={} opts={}", topic, message, opts);
			PublishOptions resolved = PublishOptions.withDefaults(opts, this.defaultTtl);
			RelayProtocolApi api = RelayProtocols.getApi(resolved.relay().protocol());
			PublishParams params = new PublishParams(topic, message, resolved);
			String hash = MessageHasher.hash(message);
			this.index.put(hash, params);
			persist();
			return rpcPublish(api, params).then(Mono.fromRunnable(() -> {
				onPublish(hash);
				logger.debug("Successfully Published Payload");
			}));
		})).doOnError(e -> {
			logger.debug("Failed to Publish Payload");
			logger.error("Publishing on topic {} failed", topic, e);
		}).then();
	}

	@Override
	protected String keyOf(PublishParams value) {
		return MessageHasher.hash(value.message());
	}

	@Override
	protected TypeRef<List<PublishParams>> snapshotType() {
		return SNAPSHOT_TYPE;
	}

	@Override
	protected void onInitialized() {
		watch(this.heartbeat, this::checkQueue);
	}

	private Mono<Object> rpcPublish(RelayProtocolApi api, PublishParams params) {
		return Mono.defer(() -> {
			PublishOptions opts = params.opts();
			RequestArguments request = new RequestArguments(api.publish(),
					new PublishRequestParams(params.topic(), params.message(), opts.ttl(), opts.prompt()));
			logger.debug("Outgoing Relay Payload");
			logger.trace("Outgoing relay request: {}", request);
			return this.transport.request(request);
		});
	}

	private void onPublish(String hash) {
		if (this.index.remove(hash) != null) {
			logger.trace("Acknowledged {}", hash);
			persist();
		}
	}

	private void checkQueue() {
		Map<String, PublishParams> queued = Map.copyOf(this.index);
		if (!queued.isEmpty()) {
			logger.debug("Resubmitting {} queued messages", queued.size());
		}
		queued.forEach((hash, params) -> {
			PublishOptions opts = PublishOptions.withDefaults(params.opts(), this.defaultTtl);
			PublishParams resubmitted = new PublishParams(params.topic(), params.message(), opts);
			Mono.fromCallable(() -> RelayProtocols.getApi(opts.relay().protocol()))
				.flatMap(api -> rpcPublish(api, resubmitted))
				.then(Mono.fromRunnable(() -> onPublish(hash)))
				.subscribe(null, e -> logger.warn("Resubmission of {} failed, retrying on next pulse: {}", hash,
						e.getMessage()));
		});
	}

	/**
	 * Builder for {@link Publisher}.
	 */
	public static class Builder {

		private RelayTransport transport;

		private Heartbeat heartbeat;

		private KeyValueStorage storage;

		private String storagePrefix = RelayDefaults.CORE_STORAGE_PREFIX;

		private long defaultTtl = RelayDefaults.PUBLISHER_DEFAULT_TTL;

		public Builder transport(RelayTransport transport) {
			this.transport = transport;
			return this;
		}

		public Builder heartbeat(Heartbeat heartbeat) {
			this.heartbeat = heartbeat;
			return this;
		}

		public Builder storage(KeyValueStorage storage) {
			this.storage = storage;
			return this;
		}

		public Builder storagePrefix(String storagePrefix) {
			this.storagePrefix = storagePrefix;
			return this;
		}

		/**
		 * Sets the ttl used when a publish call gives none.
		 * @param defaultTtl ttl in seconds, must be positive
		 * @return this builder
		 */
		public Builder defaultTtl(long defaultTtl) {
			this.defaultTtl = defaultTtl;
			return this;
		}

		public Publisher build() {
			return new Publisher(this.transport, this.heartbeat, this.storage, this.storagePrefix, this.defaultTtl);
		}

	}

}
