package com.flamingo.ai.wikistructure.service.structure.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * One entry of a section's content: either bare text or a titled sub-block.
 *
 * <p>Bare text serializes as a JSON string, sub-blocks as {@code {"title": …, "content": […]}}.
 */
public sealed interface ContentItem {

  record TextItem(String text) implements ContentItem {

    @JsonValue
    @Override
    public String text() {
      return text;
    }
  }

  /**
   * Content grouped under a minor heading.
   *
   * @param title trimmed heading text
   * @param content text entries in document order
   */
  record SubBlock(String title, List<String> content) implements ContentItem {
    public SubBlock {
      content = List.copyOf(content);
    }
  }

  static TextItem text(String text) {
    return new TextItem(text);
  }
}
