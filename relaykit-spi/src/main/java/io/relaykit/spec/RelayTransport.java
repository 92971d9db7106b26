/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.spec;

import io.relaykit.spec.JsonRpcSchema.RequestArguments;
import reactor.core.publisher.Mono;

/**
 * Transport used to send requests to the relay.
 */
@FunctionalInterface
public interface RelayTransport {

	/**
	 * Sends a request to the relay.
	 * @param request the method and parameters
	 * @return a Mono emitting the relay's acknowledgement, or erroring when the relay
	 * did not accept the request
	 */
	Mono<Object> request(RequestArguments request);

}
