package com.flamingo.ai.contractsplitter.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contractsplitter.exception.ChunkingConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkingStrategy Tests")
class ChunkingStrategyTest {

  @Test
  @DisplayName("should resolve names case-insensitively")
  void shouldResolveNames() {
    assertThat(ChunkingStrategy.fromValue("all_levels")).isEqualTo(ChunkingStrategy.ALL_LEVELS);
    assertThat(ChunkingStrategy.fromValue(" Finest_Granularity "))
        .isEqualTo(ChunkingStrategy.FINEST_GRANULARITY);
    assertThat(ChunkingStrategy.fromValue("parent_only")).isEqualTo(ChunkingStrategy.PARENT_ONLY);
  }

  @Test
  @DisplayName("should name the invalid value and the valid set")
  void shouldRejectUnknownValue() {
    assertThatThrownBy(() -> ChunkingStrategy.fromValue("by_page"))
        .isInstanceOf(ChunkingConfigurationException.class)
        .hasMessage(
            "Invalid chunking strategy 'by_page'. Valid values: "
                + "[finest_granularity, all_levels, parent_only]");
  }

  @Test
  @DisplayName("should reject null")
  void shouldRejectNull() {
    assertThatThrownBy(() -> ChunkingStrategy.fromValue(null))
        .isInstanceOf(ChunkingConfigurationException.class);
  }
}
