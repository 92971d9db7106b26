/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.store;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import io.relaykit.spec.RelayError;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InitGateTests {

	private final InitGate<String> gate = new InitGate<>("core/test");

	private final List<String> live = new CopyOnWriteArrayList<>();

	private final AtomicInteger readyCalls = new AtomicInteger();

	private Mono<Void> open(Mono<List<String>> restore) {
		return gate.open(restore, live::isEmpty, live::add, readyCalls::incrementAndGet);
	}

	@Test
	void restoredRecordsAreMergedOnReady() {
		StepVerifier.create(open(Mono.just(List.of("a", "b")))).verifyComplete();

		assertThat(gate.state()).isEqualTo(InitGate.State.READY);
		assertThat(live).containsExactly("a", "b");
		assertThat(readyCalls).hasValue(1);
	}

	@Test
	void emptyStorageStillBecomesReady() {
		StepVerifier.create(open(Mono.empty())).verifyComplete();

		assertThat(gate.isReady()).isTrue();
		assertThat(live).isEmpty();
	}

	@Test
	void checkReadyFailsUntilReady() {
		assertThatThrownBy(gate::checkReady).isInstanceOfSatisfying(RelayError.class,
				e -> assertThat(e.getCode()).isEqualTo(RelayError.ErrorCodes.NOT_INITIALIZED));

		open(Mono.empty()).block();

		gate.checkReady();
	}

	@Test
	void waitersResumeWhenRestoreFinishes() {
		Sinks.One<List<String>> storage = Sinks.one();
		Mono<Void> waiter = gate.awaitReady();

		open(storage.asMono()).subscribe();
		assertThat(gate.state()).isEqualTo(InitGate.State.RESTORING);

		StepVerifier.create(waiter)
			.expectSubscription()
			.then(() -> storage.tryEmitValue(List.of("x")))
			.verifyComplete();
		assertThat(live).containsExactly("x");
	}

	@Test
	void secondOpenDoesNotRestoreAgain() {
		AtomicInteger reads = new AtomicInteger();
		Mono<List<String>> restore = Mono.fromCallable(() -> {
			reads.incrementAndGet();
			return List.of("a");
		});

		open(restore).block();
		StepVerifier.create(open(restore)).verifyComplete();

		assertThat(reads).hasValue(1);
		assertThat(readyCalls).hasValue(1);
		assertThat(live).containsExactly("a");
	}

	@Test
	void restoreIntoNonEmptyIndexIsRefused() {
		live.add("already-here");

		StepVerifier.create(open(Mono.just(List.of("persisted")))).verifyComplete();

		assertThat(gate.isReady()).isTrue();
		assertThat(live).containsExactly("already-here");
	}

	@Test
	void storageFailureIsSwallowed() {
		StepVerifier.create(open(Mono.error(new IOException("disk gone")))).verifyComplete();

		assertThat(gate.isReady()).isTrue();
		assertThat(readyCalls).hasValue(1);
	}

}
