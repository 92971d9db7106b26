/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.relaykit.spec.JsonRpcSchema;
import io.relaykit.spec.JsonRpcSchema.JSONRPCResponse;
import io.relaykit.spec.JsonRpcSchema.JSONRPCResponse.JSONRPCError;

/**
 * The outcome recorded for a request: either a result or an error, never both.
 *
 * @param result the result of a successful call
 * @param error the error of a failed call
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordResponse( // @formatter:off
	@JsonProperty("result") Object result,
	@JsonProperty("error") JSONRPCError error) { // @formatter:on

	public static RecordResponse of(JSONRPCResponse response) {
		if (JsonRpcSchema.isJsonRpcError(response)) {
			return new RecordResponse(null, response.error());
		}
		return new RecordResponse(response.result(), null);
	}

	public boolean hasError() {
		return this.error != null;
	}

}
