package com.flamingo.ai.wikistructure.service.structure.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value profile read from the infobox table of a page.
 *
 * @param fields field name to value, in table order
 * @param relationKey the key under which related names were fused, or {@code null} if none
 * @param relationNames related names, empty when no relation row was found
 */
public record Profile(Map<String, String> fields, String relationKey, List<String> relationNames) {

  /** Suffix of the JSON entry that carries the related names as an array. */
  public static final String LIST_SUFFIX = "_list";

  public Profile {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    relationNames = List.copyOf(relationNames);
  }

  public static Profile empty() {
    return new Profile(Map.of(), null, List.of());
  }

  public boolean isEmpty() {
    return fields.isEmpty() && relationNames.isEmpty();
  }

  @JsonValue
  public Map<String, Object> toJson() {
    Map<String, Object> json = new LinkedHashMap<>(fields);
    if (relationKey != null) {
      json.put(relationKey + LIST_SUFFIX, relationNames);
    }
    return json;
  }
}
