package com.flamingo.ai.wikistructure.service.structure;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renames section titles to canonical field names and fills in absent fields.
 *
 * <p>Synonymous titles collapse onto one canonical key; when both values are lists they are
 * concatenated in encounter order, otherwise the later value wins. Titles missing from the field
 * map keep their own name.
 */
@Component
public class FieldCanonicalizer {

  /**
   * Canonicalizes structured section values.
   *
   * @param structured section title to shaped value, in page order
   * @param fieldMap title or synonym to canonical key
   * @param mapDefaults defaults for map-valued canonical keys; every other absent key defaults to
   *     an empty list
   * @return canonical key to value, containing every canonical key of {@code fieldMap}
   */
  public Map<String, Object> canonicalize(
      Map<String, Object> structured,
      Map<String, String> fieldMap,
      Map<String, Object> mapDefaults) {
    Map<String, Object> unified = new LinkedHashMap<>();
    structured.forEach(
        (title, value) -> {
          String key = fieldMap.getOrDefault(title, title);
          Object existing = unified.get(key);
          if (existing instanceof List<?> existingList && value instanceof List<?> addition) {
            List<Object> merged = new ArrayList<>(existingList);
            merged.addAll(addition);
            unified.put(key, merged);
          } else {
            unified.put(key, value);
          }
        });

    for (String key : new LinkedHashSet<>(fieldMap.values())) {
      unified.putIfAbsent(key, mapDefaults.getOrDefault(key, List.of()));
    }
    return unified;
  }
}
