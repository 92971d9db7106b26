/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.publisher;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parameters of the relay's publish method. {@code prompt} is left out of the payload
 * when null.
 *
 * @param topic the topic
 * @param message the encoded message
 * @param ttl time to live in seconds
 * @param prompt whether the receiver should prompt its user
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public record PublishRequestParams( // @formatter:off
	@JsonProperty("topic") String topic,
	@JsonProperty("message") String message,
	@JsonProperty("ttl") long ttl,
	@JsonProperty("prompt") Boolean prompt) { // @formatter:on
}
