package com.flamingo.ai.wikistructure.service.structure.model;

import com.flamingo.ai.wikistructure.exception.UnsupportedEntityKindException;
import java.util.Arrays;
import java.util.Locale;

/** The kinds of wiki pages the structuring pipeline knows how to read. */
public enum EntityKind {
  GAME,
  SCHOOL,
  STUDENT;

  /**
   * Resolves a kind from a case-insensitive name such as {@code "student"}.
   *
   * @throws UnsupportedEntityKindException if no kind matches
   */
  public static EntityKind fromName(String name) {
    return Arrays.stream(values())
        .filter(kind -> name != null && kind.name().equals(name.trim().toUpperCase(Locale.ROOT)))
        .findFirst()
        .orElseThrow(() -> new UnsupportedEntityKindException(name));
  }
}
