/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client;

import java.time.Duration;

import io.relaykit.spec.RelayProtocols;

/**
 * Default values shared by the relay client stores and the heartbeat.
 */
public final class RelayDefaults {

	private RelayDefaults() {
	}

	/**
	 * Default heartbeat period (5 seconds).
	 */
	public static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(5);

	/**
	 * Default time to live of a published message in seconds (1 day).
	 */
	public static final long PUBLISHER_DEFAULT_TTL = Duration.ofDays(1).toSeconds();

	public static final String DEFAULT_RELAY_PROTOCOL = RelayProtocols.DEFAULT_PROTOCOL;

	// Logging context of all stores
	public static final String CORE_CONTEXT = "core";

	// ---------------------------
	// Storage layout
	// ---------------------------

	public static final String CORE_STORAGE_PREFIX = "relaykit@1:core:";

	public static final String CLIENT_STORAGE_PREFIX = "relaykit@1:client:";

	public static final String SIGN_CLIENT_STORAGE_PREFIX = "relaykit@1:sign-client:";

	public static final String PUBLISHER_CONTEXT = "publisher";

	public static final String PUBLISHER_STORAGE_VERSION = "0.3";

	public static final String HISTORY_CONTEXT = "history";

	public static final String HISTORY_STORAGE_VERSION = "0.3";

	public static final String EXPIRER_CONTEXT = "expirer";

	public static final String EXPIRER_STORAGE_VERSION = "0.3";

}
