/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.history;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaykit.spec.JsonRpcSchema.RequestArguments;

/**
 * A request sent or received on a topic, with its response once known.
 *
 * @param id the JSON-RPC correlation id
 * @param topic the topic the request travelled on
 * @param request the method and parameters
 * @param response the response, null while pending
 * @param chainId the chain the request targets, may be null
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRecord( // @formatter:off
	@JsonProperty("id") long id,
	@JsonProperty("topic") String topic,
	@JsonProperty("request") RequestArguments request,
	@JsonProperty("response") RecordResponse response,
	@JsonProperty("chainId") String chainId) { // @formatter:on

	@JsonIgnore
	public boolean isPending() {
		return this.response == null;
	}

	JsonRpcRecord withResponse(RecordResponse response) {
		return new JsonRpcRecord(this.id, this.topic, this.request, response, this.chainId);
	}

}
