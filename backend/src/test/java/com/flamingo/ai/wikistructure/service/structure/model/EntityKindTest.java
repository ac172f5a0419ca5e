package com.flamingo.ai.wikistructure.service.structure.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.wikistructure.exception.UnsupportedEntityKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EntityKind Tests")
class EntityKindTest {

  @Test
  @DisplayName("should resolve kinds case-insensitively")
  void shouldResolveCaseInsensitively() {
    assertThat(EntityKind.fromName("student")).isEqualTo(EntityKind.STUDENT);
    assertThat(EntityKind.fromName(" School ")).isEqualTo(EntityKind.SCHOOL);
    assertThat(EntityKind.fromName("GAME")).isEqualTo(EntityKind.GAME);
  }

  @Test
  @DisplayName("should reject unknown and missing kinds")
  void shouldRejectUnknownKinds() {
    assertThatThrownBy(() -> EntityKind.fromName("weapon"))
        .isInstanceOf(UnsupportedEntityKindException.class)
        .hasMessageContaining("weapon");
    assertThatThrownBy(() -> EntityKind.fromName(null))
        .isInstanceOf(UnsupportedEntityKindException.class);
  }
}
