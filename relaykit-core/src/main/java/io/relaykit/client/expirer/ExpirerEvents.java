/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.expirer;

import io.relaykit.client.store.EventSignal;
import io.relaykit.client.store.StoreEvents;

/**
 * Events of the {@link Expirer}. An entry leaves either through {@code deleted}
 * (explicit removal) or {@code expired} (timeout), never both.
 */
public class ExpirerEvents extends StoreEvents {

	private final EventSignal<ExpirerEvent> created = new EventSignal<>("created");

	private final EventSignal<ExpirerEvent> deleted = new EventSignal<>("deleted");

	private final EventSignal<ExpirerEvent> expired = new EventSignal<>("expired");

	public EventSignal<ExpirerEvent> created() {
		return this.created;
	}

	public EventSignal<ExpirerEvent> deleted() {
		return this.deleted;
	}

	public EventSignal<ExpirerEvent> expired() {
		return this.expired;
	}

}
