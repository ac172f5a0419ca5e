package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.ListPolicy;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Text form of the leaf blocks that carry section content: paragraphs, lists and tables.
 *
 * <p>Paragraphs render as trimmed text, lists as their trimmed item texts, tables in the
 * pipe-delimited form of {@link TableLinearizer#toText}. Empty renderings are dropped.
 */
@Component
@RequiredArgsConstructor
public class LeafContentRenderer {

  private final TextFlattener textFlattener;
  private final TableLinearizer tableLinearizer;

  public boolean isLeaf(BlockNode node) {
    return node instanceof BlockNode.Paragraph
        || node instanceof BlockNode.ListBlock
        || node instanceof BlockNode.Table;
  }

  /**
   * Renders a leaf block.
   *
   * @param node any node; non-leaf nodes render to an empty list
   * @param listPolicy whether list items stay together or become separate entries
   * @return zero or more non-empty entries
   */
  public List<String> render(BlockNode node, ListPolicy listPolicy) {
    if (node instanceof BlockNode.Paragraph paragraph) {
      return nonEmpty(textFlattener.flattenTrimmed(paragraph));
    }
    if (node instanceof BlockNode.ListBlock list) {
      List<String> items = listItems(list);
      if (listPolicy == ListPolicy.PER_ITEM) {
        return items;
      }
      return nonEmpty(String.join("\n", items));
    }
    if (node instanceof BlockNode.Table table) {
      return nonEmpty(tableLinearizer.toText(table));
    }
    return List.of();
  }

  private List<String> listItems(BlockNode.ListBlock list) {
    return list.children().stream()
        .filter(BlockNode.ListItem.class::isInstance)
        .map(textFlattener::flattenTrimmed)
        .filter(text -> !text.isEmpty())
        .toList();
  }

  private static List<String> nonEmpty(String text) {
    return text.isEmpty() ? List.of() : List.of(text);
  }
}
