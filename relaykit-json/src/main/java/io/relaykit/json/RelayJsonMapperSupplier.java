/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.json;

import java.util.function.Supplier;

/**
 * Service provider contract for {@link RelayJsonMapper} implementations. Providers are
 * discovered through {@link java.util.ServiceLoader}.
 */
public interface RelayJsonMapperSupplier extends Supplier<RelayJsonMapper> {

}
