package com.flamingo.ai.wikistructure.service.structure.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * A titled section of a wiki page, possibly with nested sub-sections.
 *
 * @param title trimmed heading text
 * @param content text of the section's own leaf blocks (paragraphs, lists, tables)
 * @param subsections sections under deeper headings, or {@code null} when there are none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Section(String title, List<ContentItem> content, List<Section> subsections) {

  public Section {
    content = List.copyOf(content);
    subsections = subsections == null ? null : List.copyOf(subsections);
  }
}
