/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.history;

import io.relaykit.client.store.EventSignal;
import io.relaykit.client.store.StoreEvents;

/**
 * Events of the {@link JsonRpcHistory}.
 */
public class HistoryEvents extends StoreEvents {

	private final EventSignal<JsonRpcRecord> created = new EventSignal<>("created");

	private final EventSignal<JsonRpcRecord> updated = new EventSignal<>("updated");

	private final EventSignal<JsonRpcRecord> deleted = new EventSignal<>("deleted");

	public EventSignal<JsonRpcRecord> created() {
		return this.created;
	}

	public EventSignal<JsonRpcRecord> updated() {
		return this.updated;
	}

	public EventSignal<JsonRpcRecord> deleted() {
		return this.deleted;
	}

}
