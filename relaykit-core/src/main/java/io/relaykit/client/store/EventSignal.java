/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named, typed event with a list of listeners.
 * <p>
 * Listeners are invoked synchronously on the emitting thread, in registration order. A
 * listener that throws is logged and does not prevent delivery to the remaining
 * listeners.
 *
 * @param <T> the payload type
 */
public final class EventSignal<T> {

	private static final Logger logger = LoggerFactory.getLogger(EventSignal.class);

	private final String name;

	private final List<Consumer<T>> listeners = new CopyOnWriteArrayList<>();

	public EventSignal(String name) {
		Assert.hasText(name, "name must not be empty");
		this.name = name;
	}

	public String name() {
		return this.name;
	}

	/**
	 * Registers a listener for every future emission.
	 * @param listener the listener
	 */
	public void on(Consumer<T> listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(listener);
	}

	/**
	 * Registers a listener for the next emission only.
	 * @param listener the listener
	 */
	public void once(Consumer<T> listener) {
		Assert.notNull(listener, "listener must not be null");
		this.listeners.add(new OnceListener<>(this, listener));
	}

	/**
	 * Removes a listener registered with {@link #on} or {@link #once}.
	 * @param listener the listener as it was registered
	 */
	public void off(Consumer<T> listener) {
		this.listeners.removeIf(l -> l == listener || (l instanceof OnceListener<T> once && once.delegate == listener));
	}

	public void emit(T payload) {
		for (Consumer<T> listener : this.listeners) {
			try {
				listener.accept(payload);
			}
			catch (Exception e) {
				logger.error("Listener of '{}' failed", this.name, e);
			}
		}
	}

	public int listenerCount() {
		return this.listeners.size();
	}

	private static final class OnceListener<T> implements Consumer<T> {

		private final EventSignal<T> signal;

		private final Consumer<T> delegate;

		private final AtomicBoolean fired = new AtomicBoolean(false);

		private OnceListener(EventSignal<T> signal, Consumer<T> delegate) {
			this.signal = signal;
			this.delegate = delegate;
		}

		@Override
		public void accept(T payload) {
			if (this.fired.compareAndSet(false, true)) {
				this.signal.listeners.remove(this);
				this.delegate.accept(payload);
			}
		}

	}

}
