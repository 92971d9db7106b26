/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import io.relaykit.spec.RelayError;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Restores a store's index once and holds back operations until that has happened.
 * <p>
 * The gate moves from {@link State#UNINITIALIZED} through {@link State#RESTORING} to
 * {@link State#READY}. Records read from storage are staged while restoring and merged
 * into the live index on the transition to READY, after which a one-shot readiness signal
 * fires. Asynchronous operations wait on {@link #awaitReady()}; synchronous ones call
 * {@link #checkReady()} and fail fast.
 * <p>
 * A failed restore is logged and the store becomes READY with what it already holds in
 * memory.
 *
 * @param <T> the record type being restored
 */
public final class InitGate<T> {

	private static final Logger logger = LoggerFactory.getLogger(InitGate.class);

	public enum State {

		UNINITIALIZED, RESTORING, READY

	}

	private final String context;

	private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);

	private final Sinks.Empty<Void> readySink = Sinks.empty();

	// Only touched by the single subscriber that won the UNINITIALIZED -> RESTORING race
	private final List<T> staged = new ArrayList<>();

	public InitGate(String context) {
		Assert.hasText(context, "context must not be empty");
		this.context = context;
	}

	public State state() {
		return this.state.get();
	}

	public boolean isReady() {
		return this.state.get() == State.READY;
	}

	/**
	 * Runs the restore on the first subscription; every later subscription only waits for
	 * readiness.
	 * @param restore reads the persisted records, may complete empty
	 * @param liveIndexEmpty tells whether the live index is still empty; a restore into a
	 * non-empty index is refused
	 * @param merge puts one restored record into the live index
	 * @param onReady invoked once, right after the state became READY
	 * @return a Mono completing when the gate is READY
	 */
	public Mono<Void> open(Mono<List<T>> restore, BooleanSupplier liveIndexEmpty, Consumer<T> merge,
			Runnable onReady) {
		return Mono.defer(() -> {
			if (!this.state.compareAndSet(State.UNINITIALIZED, State.RESTORING)) {
				return awaitReady();
			}
			logger.trace("Initializing {}", this.context);
			return restore.doOnNext(records -> stage(records, liveIndexEmpty)).onErrorResume(e -> {
				logger.debug("Failed to restore records for {}", this.context);
				logger.error("Restore of {} failed", this.context, e);
				this.staged.clear();
				return Mono.empty();
			}).then(Mono.fromRunnable(() -> ready(merge, onReady)));
		});
	}

	/**
	 * Completes when the gate is READY. Completes immediately once it is.
	 * @return a Mono completing on readiness
	 */
	public Mono<Void> awaitReady() {
		if (isReady()) {
			return Mono.empty();
		}
		return this.readySink.asMono();
	}

	/**
	 * Fails fast for operations that cannot wait.
	 * @throws RelayError with {@link RelayError.ErrorCodes#NOT_INITIALIZED} when the gate
	 * is not READY
	 */
	public void checkReady() {
		if (!isReady()) {
			throw RelayError.NOT_INITIALIZED.apply(this.context);
		}
	}

	private void stage(List<T> records, BooleanSupplier liveIndexEmpty) {
		if (records == null || records.isEmpty()) {
			return;
		}
		if (!liveIndexEmpty.getAsBoolean()) {
			throw RelayError.RESTORE_WILL_OVERRIDE.apply(this.context);
		}
		this.staged.addAll(records);
		logger.debug("Successfully restored {} records for {}", records.size(), this.context);
	}

	private void ready(Consumer<T> merge, Runnable onReady) {
		this.staged.forEach(merge);
		this.staged.clear();
		this.state.set(State.READY);
		try {
			onReady.run();
		}
		finally {
			this.readySink.tryEmitEmpty();
		}
	}

}
