package com.flamingo.ai.wikistructure.service.structure.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of picking the newest snapshot per entity.
 *
 * @param latest entity name to the file name carrying its highest revision
 * @param rejected file names that do not follow {@code <name>_<revision>.<ext>}
 */
public record RevisionSelection(Map<String, String> latest, List<String> rejected) {

  public RevisionSelection {
    latest = Collections.unmodifiableMap(new LinkedHashMap<>(latest));
    rejected = List.copyOf(rejected);
  }
}
