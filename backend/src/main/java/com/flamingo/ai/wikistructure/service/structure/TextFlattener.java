package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import org.springframework.stereotype.Component;

/**
 * Reduces a {@link BlockNode} subtree to plain text in document order.
 *
 * <p>Text nodes contribute their raw content verbatim. Images contribute their title when it is
 * non-empty, otherwise their alt text. Every other node contributes the concatenation of its
 * children, so the function is total over the node variants and a childless non-text node yields
 * an empty string.
 */
@Component
public class TextFlattener {

  public String flatten(BlockNode node) {
    if (node instanceof BlockNode.Text text) {
      return text.raw();
    }
    if (node instanceof BlockNode.Image image && hasTitle(image)) {
      return image.title();
    }
    StringBuilder sb = new StringBuilder();
    collectChildren(node, sb);
    return sb.toString();
  }

  /** Flattens and trims; used wherever a heading or cell text is compared or stored. */
  public String flattenTrimmed(BlockNode node) {
    return flatten(node).trim();
  }

  private static boolean hasTitle(BlockNode.Image image) {
    return image.title() != null && !image.title().isEmpty();
  }

  private void collectChildren(BlockNode node, StringBuilder sb) {
    for (BlockNode child : node.children()) {
      sb.append(flatten(child));
    }
  }
}
