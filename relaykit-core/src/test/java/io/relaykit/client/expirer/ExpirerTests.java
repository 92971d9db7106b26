/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.expirer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import io.relaykit.client.RelayDefaults;
import io.relaykit.client.heartbeat.IntervalHeartbeat;
import io.relaykit.client.storage.InMemoryKeyValueStorage;
import io.relaykit.json.RelayJsonMapper;
import io.relaykit.spec.RelayError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpirerTests {

	private static final long NOW_SECONDS = 1_700_000_000L;

	private final AtomicLong clock = new AtomicLong(NOW_SECONDS * 1000);

	private InMemoryKeyValueStorage storage;

	private IntervalHeartbeat heartbeat;

	private Expirer expirer;

	private final List<String> events = new CopyOnWriteArrayList<>();

	@BeforeEach
	void setUp() {
		storage = new InMemoryKeyValueStorage(RelayJsonMapper.createDefault());
		heartbeat = new IntervalHeartbeat(Duration.ofSeconds(5), Schedulers.immediate(), Schedulers.immediate());
		expirer = newExpirer(storage);
		record(expirer);
	}

	@AfterEach
	void tearDown() {
		expirer.close();
		heartbeat.close();
	}

	private Expirer newExpirer(InMemoryKeyValueStorage storage) {
		return new Expirer(storage, heartbeat, RelayDefaults.SIGN_CLIENT_STORAGE_PREFIX, clock::get);
	}

	private void record(Expirer target) {
		target.events().created().on(e -> events.add("created:" + e.topic()));
		target.events().deleted().on(e -> events.add("deleted:" + e.topic()));
		target.events().expired().on(e -> events.add("expired:" + e.topic()));
	}

	private void init() {
		StepVerifier.create(expirer.init()).verifyComplete();
	}

	@Test
	void synchronousOperationsRequireInit() {
		assertThatThrownBy(() -> expirer.set("t", NOW_SECONDS + 60)).isInstanceOfSatisfying(RelayError.class,
				e -> assertThat(e.getCode()).isEqualTo(RelayError.ErrorCodes.NOT_INITIALIZED));
		assertThatThrownBy(() -> expirer.get("t")).isInstanceOf(RelayError.class);
		assertThat(expirer.has("t")).isFalse();
	}

	@Test
	void futureExpiryIsKept() {
		init();

		expirer.set("t", NOW_SECONDS + 60);

		assertThat(expirer.has("t")).isTrue();
		assertThat(expirer.get("t")).isEqualTo(new Expiration("t", NOW_SECONDS + 60));
		assertThat(events).containsExactly("created:t");
	}

	@Test
	void pastExpiryExpiresImmediately() {
		init();

		expirer.set("t", NOW_SECONDS - 1);

		assertThat(expirer.has("t")).isFalse();
		assertThat(events).containsExactly("expired:t", "created:t");
	}

	@Test
	void expiryEqualToNowCountsAsExpired() {
		init();

		expirer.set("t", NOW_SECONDS);

		assertThat(expirer.has("t")).isFalse();
	}

	@Test
	void pulseExpiresEntriesOnceTheirTimeHasCome() {
		init();
		expirer.set("short", NOW_SECONDS + 10);
		expirer.set("long", NOW_SECONDS + 3600);

		heartbeat.pulse();
		assertThat(expirer.keys()).containsExactlyInAnyOrder("short", "long");

		clock.addAndGet(10_000);
		heartbeat.pulse();
		heartbeat.pulse();

		assertThat(expirer.keys()).containsExactly("long");
		assertThat(events).containsExactly("created:short", "created:long", "expired:short");
	}

	@Test
	void eagerAndPeriodicExpiryEndInTheSameState() {
		init();
		Expirer periodic = newExpirer(new InMemoryKeyValueStorage(RelayJsonMapper.createDefault()));
		List<ExpirerEvent> periodicExpired = new CopyOnWriteArrayList<>();
		List<ExpirerEvent> eagerExpired = new CopyOnWriteArrayList<>();
		periodic.events().expired().on(periodicExpired::add);
		expirer.events().expired().on(eagerExpired::add);
		periodic.init().block();

		periodic.set("t", NOW_SECONDS + 5);
		clock.addAndGet(5_000);
		expirer.set("t", NOW_SECONDS + 5);
		heartbeat.pulse();

		assertThat(periodic.values()).isEqualTo(expirer.values()).isEmpty();
		assertThat(periodicExpired).isEqualTo(eagerExpired).hasSize(1);
		periodic.close();
	}

	@Test
	void delEmitsDeletedNotExpired() {
		init();
		expirer.set("t", NOW_SECONDS + 60);

		StepVerifier.create(expirer.del("t")).verifyComplete();
		StepVerifier.create(expirer.del("t")).verifyComplete();

		assertThat(expirer.has("t")).isFalse();
		assertThat(events).containsExactly("created:t", "deleted:t");
	}

	@Test
	void delWaitsForInit() {
		StepVerifier.create(expirer.del("t"))
			.expectSubscription()
			.expectNoEvent(Duration.ofMillis(50))
			.then(() -> expirer.init().subscribe())
			.verifyComplete();
	}

	@Test
	void getUnknownTopicFailsWithNoMatchingId() {
		init();

		assertThatThrownBy(() -> expirer.get("missing")).isInstanceOfSatisfying(RelayError.class,
				e -> assertThat(e.getCode()).isEqualTo(RelayError.ErrorCodes.NO_MATCHING_ID));
	}

	@Test
	void settingATopicAgainReplacesItsExpiry() {
		init();
		expirer.set("t", NOW_SECONDS + 10);
		expirer.set("t", NOW_SECONDS + 100);

		clock.addAndGet(10_000);
		heartbeat.pulse();

		assertThat(expirer.get("t").expiry()).isEqualTo(NOW_SECONDS + 100);
	}

	@Test
	void expirationsSurviveRestartAndExpireAfterward() {
		init();
		expirer.set("a", NOW_SECONDS + 10);
		expirer.set("b", NOW_SECONDS + 1000);
		expirer.close();

		Expirer restarted = newExpirer(storage);
		List<String> expired = new CopyOnWriteArrayList<>();
		restarted.events().expired().on(e -> expired.add(e.topic()));
		StepVerifier.create(restarted.init()).verifyComplete();
		assertThat(restarted.values()).containsExactlyInAnyOrder(new Expiration("a", NOW_SECONDS + 10),
				new Expiration("b", NOW_SECONDS + 1000));

		clock.addAndGet(10_000);
		heartbeat.pulse();

		assertThat(expired).containsExactly("a");
		assertThat(restarted.keys()).containsExactly("b");
		restarted.close();
	}

	@Test
	void closedExpirerIgnoresPulses() {
		init();
		expirer.set("t", NOW_SECONDS + 1);
		expirer.close();

		clock.addAndGet(5_000);
		heartbeat.pulse();

		assertThat(expirer.has("t")).isTrue();
	}

}
