/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.spec;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

import io.relaykit.spec.JsonRpcSchema.JSONRPCResponse.JSONRPCError;
import io.relaykit.util.Assert;

/**
 * Error raised by the relay client stores. Carries a {@link JSONRPCError} so that it can
 * be reported to a peer unchanged.
 */
public class RelayError extends RuntimeException {

	/**
	 * Error codes raised by the stores.
	 */
	public static final class ErrorCodes {

		ErrorCodes() {
			// Prevent instantiation
		}

		/**
		 * A synchronous operation ran before the store finished restoring.
		 */
		public static final int NOT_INITIALIZED = 1000;

		/**
		 * No record is stored under the requested id or topic.
		 */
		public static final int NO_MATCHING_ID = 1100;

		/**
		 * A record exists under the requested id but belongs to another topic.
		 */
		public static final int MISMATCHED_TOPIC = 1101;

		/**
		 * Persisted records would overwrite records already held in memory.
		 */
		public static final int RESTORE_WILL_OVERRIDE = 1200;

		/**
		 * The requested relay protocol has no known API.
		 */
		public static final int UNSUPPORTED_RELAY_PROTOCOL = 1300;

	}

	public static final Function<String, RelayError> NOT_INITIALIZED = context -> RelayError
		.builder(ErrorCodes.NOT_INITIALIZED)
		.message("Not initialized: " + context)
		.data(Map.of("context", context))
		.build();

	public static final BiFunction<String, Object, RelayError> NO_MATCHING_ID = (context, id) -> RelayError
		.builder(ErrorCodes.NO_MATCHING_ID)
		.message("No matching id: " + context + " " + id)
		.data(Map.of("context", context, "id", String.valueOf(id)))
		.build();

	public static final BiFunction<String, Object, RelayError> MISMATCHED_TOPIC = (context, id) -> RelayError
		.builder(ErrorCodes.MISMATCHED_TOPIC)
		.message("Mismatched topic: " + context + " " + id)
		.data(Map.of("context", context, "id", String.valueOf(id)))
		.build();

	public static final Function<String, RelayError> RESTORE_WILL_OVERRIDE = context -> RelayError
		.builder(ErrorCodes.RESTORE_WILL_OVERRIDE)
		.message("Restore will override: " + context)
		.data(Map.of("context", context))
		.build();

	public static final Function<String, RelayError> UNSUPPORTED_RELAY_PROTOCOL = protocol -> RelayError
		.builder(ErrorCodes.UNSUPPORTED_RELAY_PROTOCOL)
		.message("Relay protocol is not supported: " + protocol)
		.data(Map.of("protocol", String.valueOf(protocol)))
		.build();

	private final JSONRPCError jsonRpcError;

	public RelayError(JSONRPCError jsonRpcError) {
		super(jsonRpcError.message());
		this.jsonRpcError = jsonRpcError;
	}

	public JSONRPCError getJsonRpcError() {
		return this.jsonRpcError;
	}

	public int getCode() {
		return this.jsonRpcError.code();
	}

	@Override
	public String toString() {
		var message = super.toString();
		if (this.jsonRpcError == null || this.jsonRpcError.data() == null) {
			return message;
		}
		return message + "\n" + this.jsonRpcError.data();
	}

	public static Builder builder(int errorCode) {
		return new Builder(errorCode);
	}

	public static class Builder {

		private final int code;

		private String message;

		private Object data;

		private Builder(int code) {
			this.code = code;
		}

		public Builder message(String message) {
			this.message = message;
			return this;
		}

		public Builder data(Object data) {
			this.data = data;
			return this;
		}

		public RelayError build() {
			Assert.notNull(this.message, "message must not be null");
			return new RelayError(new JSONRPCError(this.code, this.message, this.data));
		}

	}

}
