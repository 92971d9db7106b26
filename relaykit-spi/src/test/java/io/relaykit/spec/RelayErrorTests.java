/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.spec;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayErrorTests {

	@Test
	void noMatchingIdCarriesContextAndId() {
		RelayError error = RelayError.NO_MATCHING_ID.apply("history", 42L);

		assertThat(error.getCode()).isEqualTo(RelayError.ErrorCodes.NO_MATCHING_ID);
		assertThat(error.getMessage()).isEqualTo("No matching id: history 42");
		assertThat(error.getJsonRpcError().data()).isEqualTo(Map.of("context", "history", "id", "42"));
	}

	@Test
	void notInitializedNamesContext() {
		RelayError error = RelayError.NOT_INITIALIZED.apply("expirer");

		assertThat(error.getCode()).isEqualTo(RelayError.ErrorCodes.NOT_INITIALIZED);
		assertThat(error).hasMessageContaining("expirer");
		assertThat(error.toString()).contains("context=expirer");
	}

	@Test
	void builderRequiresMessage() {
		assertThatThrownBy(() -> RelayError.builder(RelayError.ErrorCodes.MISMATCHED_TOPIC).build())
			.isInstanceOf(IllegalArgumentException.class);
	}

}
