/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.heartbeat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import io.relaykit.client.RelayDefaults;
import io.relaykit.spec.Heartbeat;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link Heartbeat} pulsing at a fixed interval once {@link #start() started}.
 * <p>
 * Each listener receives pulses on its own worker of the dispatch scheduler, so a slow
 * listener delays only its own next pulse. {@link #pulse()} fires a pulse by hand.
 */
public class IntervalHeartbeat implements Heartbeat, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(IntervalHeartbeat.class);

	private final Duration interval;

	private final Scheduler timerScheduler;

	private final Scheduler dispatchScheduler;

	private final Sinks.Many<Long> pulses = Sinks.many().multicast().directBestEffort();

	private final AtomicLong beats = new AtomicLong();

	private volatile Disposable ticker;

	public IntervalHeartbeat() {
		this(RelayDefaults.HEARTBEAT_INTERVAL);
	}

	/**
	 * Creates a heartbeat timed on {@link Schedulers#parallel()} that dispatches every
	 * listener on its own {@link Schedulers#boundedElastic()} worker.
	 * @param interval the pulse period, must be positive
	 */
	public IntervalHeartbeat(Duration interval) {
		this(interval, Schedulers.parallel(), Schedulers.boundedElastic());
	}

	/**
	 * Creates a heartbeat.
	 * @param interval the pulse period, must be positive
	 * @param timerScheduler the scheduler the period is timed on
	 * @param dispatchScheduler the scheduler listeners run on
	 */
	public IntervalHeartbeat(Duration interval, Scheduler timerScheduler, Scheduler dispatchScheduler) {
		Assert.notNull(interval, "interval must not be null");
		Assert.isTrue(!interval.isNegative() && !interval.isZero(), "interval must be positive");
		Assert.notNull(timerScheduler, "timerScheduler must not be null");
		Assert.notNull(dispatchScheduler, "dispatchScheduler must not be null");
		this.interval = interval;
		this.timerScheduler = timerScheduler;
		this.dispatchScheduler = dispatchScheduler;
	}

	public Duration interval() {
		return this.interval;
	}

	@Override
	public Disposable onPulse(Runnable listener) {
		Assert.notNull(listener, "listener must not be null");
		return this.pulses.asFlux().publishOn(this.dispatchScheduler).subscribe(beat -> {
			try {
				listener.run();
			}
			catch (Exception e) {
				logger.error("Heartbeat listener failed on pulse {}", beat, e);
			}
		});
	}

	public synchronized void start() {
		if (isRunning()) {
			return;
		}
		logger.debug("Starting heartbeat every {}", this.interval);
		this.ticker = Flux.interval(this.interval, this.interval, this.timerScheduler).subscribe(tick -> pulse());
	}

	public synchronized void stop() {
		Disposable current = this.ticker;
		if (current != null) {
			current.dispose();
			this.ticker = null;
			logger.debug("Stopped heartbeat after {} pulses", this.beats.get());
		}
	}

	public boolean isRunning() {
		Disposable current = this.ticker;
		return current != null && !current.isDisposed();
	}

	/**
	 * Fires a pulse to every listener now.
	 */
	public synchronized void pulse() {
		long beat = this.beats.incrementAndGet();
		logger.trace("Pulse {}", beat);
		this.pulses.tryEmitNext(beat);
	}

	public long beats() {
		return this.beats.get();
	}

	@Override
	public void close() {
		stop();
		this.pulses.tryEmitComplete();
	}

}
