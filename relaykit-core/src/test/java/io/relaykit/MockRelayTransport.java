/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.relaykit.spec.JsonRpcSchema.RequestArguments;
import io.relaykit.spec.RelayTransport;
import reactor.core.publisher.Mono;

/**
 * A mock {@link RelayTransport} that records every request and acknowledges it, or
 * fails it while the relay is marked unavailable.
 */
public class MockRelayTransport implements RelayTransport {

	private final List<RequestArguments> sent = new CopyOnWriteArrayList<>();

	private final AtomicBoolean available = new AtomicBoolean(true);

	private volatile Consumer<RequestArguments> onRequest = request -> {
	};

	@Override
	public Mono<Object> request(RequestArguments request) {
		return Mono.defer(() -> {
			this.sent.add(request);
			this.onRequest.accept(request);
			if (!this.available.get()) {
				return Mono.error(new IllegalStateException("Relay unavailable"));
			}
			return Mono.just(Boolean.TRUE);
		});
	}

	public void setAvailable(boolean available) {
		this.available.set(available);
	}

	/**
	 * Runs a hook on every request, before it is answered.
	 * @param onRequest the hook
	 */
	public void setOnRequest(Consumer<RequestArguments> onRequest) {
		this.onRequest = onRequest;
	}

	public List<RequestArguments> getSentRequests() {
		return List.copyOf(this.sent);
	}

	public RequestArguments getLastSentRequest() {
		return this.sent.isEmpty() ? null : this.sent.get(this.sent.size() - 1);
	}

	public int getSentCount() {
		return this.sent.size();
	}

}
