/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.relaykit.json.RelayJsonMapper;
import io.relaykit.json.TypeRef;

/**
 * Jackson 2 based implementation of {@link RelayJsonMapper}.
 */
public final class JacksonRelayJsonMapper implements RelayJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new JacksonRelayJsonMapper.
	 * @param objectMapper the Jackson ObjectMapper to delegate to
	 */
	public JacksonRelayJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper}.
	 * @return the ObjectMapper instance
	 */
	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, toJavaType(type));
	}

	@Override
	public <T> T readValue(byte[] content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, toJavaType(type));
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		return this.objectMapper.convertValue(fromValue, toJavaType(type));
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return this.objectMapper.writeValueAsBytes(value);
	}

	private JavaType toJavaType(TypeRef<?> type) {
		return this.objectMapper.getTypeFactory().constructType(type.getType());
	}

}
