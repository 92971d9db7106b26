/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.history;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import io.relaykit.client.RelayDefaults;
import io.relaykit.client.store.AbstractRelayStore;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.JsonRpcSchema;
import io.relaykit.spec.JsonRpcSchema.JSONRPCRequest;
import io.relaykit.spec.JsonRpcSchema.JSONRPCResponse;
import io.relaykit.spec.JsonRpcSchema.RequestArguments;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.spec.RelayError;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Ledger of the JSON-RPC requests exchanged on each topic, with their responses.
 * <p>
 * Records are keyed by correlation id. The first write of an id wins and a response is
 * recorded at most once. Every operation waits until the history has been restored from
 * storage.
 */
public class JsonRpcHistory extends AbstractRelayStore<Long, JsonRpcRecord, HistoryEvents> {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcHistory.class);

	private static final TypeRef<List<JsonRpcRecord>> SNAPSHOT_TYPE = new TypeRef<>() {
	};

	public JsonRpcHistory(KeyValueStorage storage) {
		this(storage, RelayDefaults.CLIENT_STORAGE_PREFIX);
	}

	public JsonRpcHistory(KeyValueStorage storage, String storagePrefix) {
		super(RelayDefaults.HISTORY_CONTEXT, storagePrefix, RelayDefaults.HISTORY_STORAGE_VERSION, storage,
				new HistoryEvents());
		this.events.created().on(record -> onEvent(this.events.created().name(), record));
		this.events.updated().on(record -> onEvent(this.events.updated().name(), record));
		this.events.deleted().on(record -> onEvent(this.events.deleted().name(), record));
	}

	/**
	 * Returns the requests that are still waiting for a response.
	 * @return one event per pending record, recomputed on every call
	 */
	public List<RequestEvent> pending() {
		List<RequestEvent> requests = new ArrayList<>();
		for (JsonRpcRecord record : values()) {
			if (!record.isPending()) {
				continue;
			}
			JSONRPCRequest request = JsonRpcSchema.formatJsonRpcRequest(record.request().method(),
					record.request().params(), record.id());
			requests.add(new RequestEvent(record.topic(), request, record.chainId()));
		}
		return requests;
	}

	public Mono<Void> set(String topic, JSONRPCRequest request) {
		return set(topic, request, null);
	}

	/**
	 * Records a request. Does nothing when a record with the same id exists.
	 * @param topic the topic the request travels on
	 * @param request the request
	 * @param chainId the chain the request targets, may be null
	 * @return a Mono completing once recorded
	 */
	public Mono<Void> set(String topic, JSONRPCRequest request, String chainId) {
		return this.gate.awaitReady().then(Mono.fromRunnable(() -> {
			Assert.hasText(topic, "topic must not be empty");
			Assert.notNull(request, "request must not be null");
			logger.debug("Setting JSON-RPC request history record");
			logger.trace("set topic={} request={} chainId={}", topic, request, chainId);
			JsonRpcRecord record = new JsonRpcRecord(request.id(), topic,
					new RequestArguments(request.method(), request.params()), null, chainId);
			if (this.index.putIfAbsent(record.id(), record) == null) {
				this.events.created().emit(record);
			}
		}));
	}

	/**
	 * Records the response to a request. Ignored when the id is unknown or the record
	 * already holds a response.
	 * @param response the response
	 * @return a Mono completing once recorded
	 */
	public Mono<Void> resolve(JSONRPCResponse response) {
		return this.gate.awaitReady().then(Mono.fromRunnable(() -> {
			Assert.notNull(response, "response must not be null");
			logger.debug("Updating JSON-RPC response history record");
			logger.trace("resolve response={}", response);
			AtomicReference<JsonRpcRecord> updated = new AtomicReference<>();
			this.index.computeIfPresent(response.id(), (id, record) -> {
				if (!record.isPending()) {
					return record;
				}
				JsonRpcRecord resolved = record.withResponse(RecordResponse.of(response));
				updated.set(resolved);
				return resolved;
			});
			if (updated.get() != null) {
				this.events.updated().emit(updated.get());
			}
		}));
	}

	/**
	 * Looks a record up.
	 * @param topic the topic the record must belong to
	 * @param id the correlation id
	 * @return the record, or an error of code {@link RelayError.ErrorCodes#NO_MATCHING_ID}
	 * when absent and {@link RelayError.ErrorCodes#MISMATCHED_TOPIC} when it belongs to
	 * another topic
	 */
	public Mono<JsonRpcRecord> get(String topic, long id) {
		return this.gate.awaitReady().then(Mono.fromCallable(() -> {
			logger.debug("Getting record");
			logger.trace("get topic={} id={}", topic, id);
			JsonRpcRecord record = getRecord(id);
			if (!record.topic().equals(topic)) {
				throw RelayError.MISMATCHED_TOPIC.apply(name(), id);
			}
			return record;
		}));
	}

	public Mono<Void> delete(String topic) {
		return delete(topic, null);
	}

	/**
	 * Deletes the records of a topic. Nothing matching is not an error.
	 * @param topic the topic
	 * @param id only delete this id, or every record of the topic when null
	 * @return a Mono completing once deleted
	 */
	public Mono<Void> delete(String topic, Long id) {
		return this.gate.awaitReady().then(Mono.fromRunnable(() -> {
			logger.debug("Deleting record");
			logger.trace("delete topic={} id={}", topic, id);
			for (JsonRpcRecord candidate : values()) {
				if (!candidate.topic().equals(topic) || (id != null && candidate.id() != id)) {
					continue;
				}
				AtomicReference<JsonRpcRecord> removed = new AtomicReference<>();
				this.index.computeIfPresent(candidate.id(), (key, record) -> {
					if (!record.topic().equals(topic)) {
						return record;
					}
					removed.set(record);
					return null;
				});
				if (removed.get() != null) {
					this.events.deleted().emit(removed.get());
				}
			}
		}));
	}

	public Mono<Boolean> exists(String topic, long id) {
		return this.gate.awaitReady().then(Mono.fromCallable(() -> {
			JsonRpcRecord record = this.index.get(id);
			return record != null && record.topic().equals(topic);
		}));
	}

	@Override
	protected Long keyOf(JsonRpcRecord value) {
		return value.id();
	}

	@Override
	protected TypeRef<List<JsonRpcRecord>> snapshotType() {
		return SNAPSHOT_TYPE;
	}

	private JsonRpcRecord getRecord(long id) {
		JsonRpcRecord record = this.index.get(id);
		if (record == null) {
			throw RelayError.NO_MATCHING_ID.apply(name(), id);
		}
		return record;
	}

}
