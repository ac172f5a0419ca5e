package com.flamingo.ai.wikistructure.service.structure.model;

/** What happens to content that appears before the first heading of the level being grouped. */
public enum OrphanPolicy {
  /** Orphaned content is discarded. */
  DROP,
  /** Orphaned content is kept in an implicit section named by the configured preamble title. */
  PREAMBLE
}
