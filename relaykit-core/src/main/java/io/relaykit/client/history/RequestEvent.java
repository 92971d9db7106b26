/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.history;

import io.relaykit.spec.JsonRpcSchema.JSONRPCRequest;

/**
 * A request still waiting for its response, as replayed after a restart.
 *
 * @param topic the topic
 * @param request the full JSON-RPC request
 * @param chainId the chain the request targets, may be null
 */
public record RequestEvent(String topic, JSONRPCRequest request, String chainId) {
}
