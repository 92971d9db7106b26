/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.expirer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Expiry of a topic.
 *
 * @param topic the topic
 * @param expiry the expiry as epoch seconds
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Expiration( // @formatter:off
	@JsonProperty("topic") String topic,
	@JsonProperty("expiry") long expiry) { // @formatter:on

	/**
	 * Milliseconds left until expiry; zero or less once expired.
	 * @param nowMillis the current time as epoch milliseconds
	 * @return the remaining time
	 */
	public long msToTimeout(long nowMillis) {
		return this.expiry * 1000 - nowMillis;
	}

}
