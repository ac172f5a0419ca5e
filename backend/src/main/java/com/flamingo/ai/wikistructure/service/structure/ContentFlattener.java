package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.ContentItem;
import com.flamingo.ai.wikistructure.service.structure.model.ListPolicy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Flattens the nodes of one section into bare text entries and one level of titled sub-blocks.
 *
 * <p>A heading at the minor level opens a sub-block that receives the following leaf content until
 * the next minor heading. Leaf content before the first minor heading is emitted as bare text.
 * Headings at any other level are ignored and never recursed into; use {@link LevelGrouper} when a
 * nested outline is needed.
 */
@Component
@RequiredArgsConstructor
public class ContentFlattener {

  private final TextFlattener textFlattener;
  private final LeafContentRenderer leafContentRenderer;

  public List<ContentItem> flattenContent(
      List<BlockNode> nodes, int minorLevel, ListPolicy listPolicy) {
    Objects.requireNonNull(nodes, "nodes");
    List<ContentItem> leading = new ArrayList<>();
    List<OpenBlock> blocks = new ArrayList<>();

    for (BlockNode node : nodes) {
      if (node instanceof BlockNode.Heading heading && heading.level() == minorLevel) {
        blocks.add(new OpenBlock(textFlattener.flattenTrimmed(heading)));
        continue;
      }
      List<String> texts = leafContentRenderer.render(node, listPolicy);
      if (blocks.isEmpty()) {
        texts.forEach(text -> leading.add(ContentItem.text(text)));
      } else {
        blocks.get(blocks.size() - 1).content.addAll(texts);
      }
    }

    // once a sub-block is open every later entry belongs to a sub-block
    List<ContentItem> result = new ArrayList<>(leading);
    blocks.forEach(block -> result.add(new ContentItem.SubBlock(block.title, block.content)));
    return result;
  }

  private static final class OpenBlock {
    private final String title;
    private final List<String> content = new ArrayList<>();

    private OpenBlock(String title) {
      this.title = title;
    }
  }
}
