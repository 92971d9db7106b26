/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

/**
 * Events every persistent store emits. Components extend this with their own typed
 * events.
 */
public class StoreEvents {

	private final EventSignal<StoreEvent> sync = new EventSignal<>("sync");

	private final EventSignal<StoreEvent> init = new EventSignal<>("init");

	/**
	 * Fires after the index has been written to storage.
	 * @return the sync signal
	 */
	public EventSignal<StoreEvent> sync() {
		return this.sync;
	}

	/**
	 * Fires once, when restore has finished and the store accepts operations.
	 * @return the init signal
	 */
	public EventSignal<StoreEvent> init() {
		return this.init;
	}

}
