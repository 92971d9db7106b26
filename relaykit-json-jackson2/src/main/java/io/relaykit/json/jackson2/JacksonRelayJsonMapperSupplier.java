/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.relaykit.json.RelayJsonMapper;
import io.relaykit.json.RelayJsonMapperSupplier;

/**
 * A supplier of {@link RelayJsonMapper} instances that uses the Jackson library for JSON
 * serialization and deserialization.
 * <p>
 * Registered in {@code META-INF/services} so that {@link RelayJsonMapper#createDefault()}
 * resolves it when this module is on the classpath.
 */
public class JacksonRelayJsonMapperSupplier implements RelayJsonMapperSupplier {

	@Override
	public RelayJsonMapper get() {
		return new JacksonRelayJsonMapper(createMapper());
	}

	/**
	 * Creates the ObjectMapper used for persisted store snapshots.
	 * <p>
	 * The mapper does not call {@code setAccessible()} on constructors or fields and
	 * relies on the {@link ParameterNamesModule} (the build compiles with
	 * {@code -parameters}) for records without explicit {@code @JsonProperty} names.
	 * Unknown properties are tolerated so that a snapshot written by a newer release
	 * does not fail a restore.
	 * @return the configured ObjectMapper
	 */
	private static ObjectMapper createMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
