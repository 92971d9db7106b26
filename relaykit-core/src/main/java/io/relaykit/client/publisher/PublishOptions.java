/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.publisher;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaykit.spec.RelayProtocolOptions;
import io.relaykit.spec.RelayProtocols;

/**
 * Options of a publish call. Any member may be null, in which case the publisher's
 * default applies.
 *
 * @param ttl time to live of the message in seconds
 * @param relay the relay protocol to publish through
 * @param prompt whether the receiving wallet should prompt its user
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublishOptions( // @formatter:off
	@JsonProperty("ttl") Long ttl,
	@JsonProperty("relay") RelayProtocolOptions relay,
	@JsonProperty("prompt") Boolean prompt) { // @formatter:on

	public static PublishOptions ofTtl(long ttl) {
		return new PublishOptions(ttl, null, null);
	}

	/**
	 * Fills in missing members. A ttl of zero or less counts as missing.
	 * @param options the caller's options, may be null
	 * @param defaultTtl ttl used when none is given
	 * @return options with every member set
	 */
	static PublishOptions withDefaults(PublishOptions options, long defaultTtl) {
		if (options == null) {
			return new PublishOptions(defaultTtl, RelayProtocols.resolveOptions(null), false);
		}
		long ttl = (options.ttl() != null && options.ttl() > 0) ? options.ttl() : defaultTtl;
		boolean prompt = options.prompt() != null && options.prompt();
		return new PublishOptions(ttl, RelayProtocols.resolveOptions(options.relay()), prompt);
	}

}
