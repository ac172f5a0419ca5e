package com.flamingo.ai.wikistructure.service.structure.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The structured record produced from one wiki page.
 *
 * <p>Values in {@code fields} are one of {@code List<ContentItem>}, {@code List<Section>}, {@link
 * Profile} or {@code Map<String, List<QuoteEntry>>}. Every canonical key of the entity kind is
 * present.
 *
 * @param name entity name, usually taken from the file name
 * @param kind entity kind
 * @param fields canonical field name to value, in assembly order
 */
public record EntityRecord(String name, EntityKind kind, Map<String, Object> fields) {

  public EntityRecord {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }
}
