package com.flamingo.ai.wikistructure.service.structure.model;

/** How list blocks contribute to flattened section content. */
public enum ListPolicy {
  /** All items joined by newlines into one entry. */
  JOINED,
  /** Each non-empty item becomes its own entry. */
  PER_ITEM
}
