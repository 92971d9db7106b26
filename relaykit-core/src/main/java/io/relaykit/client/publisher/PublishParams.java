/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.publisher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message waiting for the relay's acknowledgement.
 *
 * @param topic the topic the message is published on
 * @param message the encoded message
 * @param opts the options the message was submitted with
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublishParams( // @formatter:off
	@JsonProperty("topic") String topic,
	@JsonProperty("message") String message,
	@JsonProperty("opts") PublishOptions opts) { // @formatter:on
}
