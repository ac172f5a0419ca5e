package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.ContentItem;
import com.flamingo.ai.wikistructure.service.structure.model.ListPolicy;
import com.flamingo.ai.wikistructure.service.structure.model.OrphanPolicy;
import com.flamingo.ai.wikistructure.service.structure.model.Section;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a nested outline from the nodes of one section.
 *
 * <p>Headings at the requested level open sections. A heading deeper than that level starts a run
 * that extends to the next heading at or above the level; the run is grouped recursively one
 * level down and attached as sub-sections of the open section. Leaf content (paragraphs, lists,
 * tables) belongs to the open section only, so every block appears exactly once in the outline.
 *
 * <p>Content seen before the first heading at the level has no section to go to; it is dropped or
 * collected in a preamble section according to {@link OrphanPolicy}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LevelGrouper {

  private final TextFlattener textFlattener;
  private final LeafContentRenderer leafContentRenderer;
  private final WikiConfig wikiConfig;

  public List<Section> groupByLevel(List<BlockNode> nodes, int level) {
    Objects.requireNonNull(nodes, "nodes");
    List<Section> result = new ArrayList<>();
    OpenSection current = null;

    int i = 0;
    while (i < nodes.size()) {
      BlockNode node = nodes.get(i);
      if (node instanceof BlockNode.Heading heading && heading.level() == level) {
        if (current != null) {
          result.add(current.seal());
        }
        current = new OpenSection(textFlattener.flattenTrimmed(heading));
        i++;
      } else if (node instanceof BlockNode.Heading heading && heading.level() > level) {
        int end = nextBoundary(nodes, i + 1, level);
        List<Section> nested = groupByLevel(nodes.subList(i, end), level + 1);
        if (!nested.isEmpty()) {
          current = current != null ? current : openPreamble(level);
          if (current != null) {
            current.subsections.addAll(nested);
          } else {
            log.debug("Dropping {} orphaned sub-sections below level {}", nested.size(), level);
          }
        }
        i = end;
      } else {
        List<String> texts = leafContentRenderer.render(node, ListPolicy.JOINED);
        if (!texts.isEmpty()) {
          current = current != null ? current : openPreamble(level);
          if (current != null) {
            for (String text : texts) {
              current.content.add(ContentItem.text(text));
            }
          } else {
            log.debug("Dropping orphaned content before the first level-{} heading", level);
          }
        }
        i++;
      }
    }
    if (current != null) {
      result.add(current.seal());
    }
    return result;
  }

  /** Index of the first heading at or above {@code level} from {@code start}, or the list size. */
  private static int nextBoundary(List<BlockNode> nodes, int start, int level) {
    for (int j = start; j < nodes.size(); j++) {
      if (nodes.get(j) instanceof BlockNode.Heading heading && heading.level() <= level) {
        return j;
      }
    }
    return nodes.size();
  }

  private OpenSection openPreamble(int level) {
    WikiConfig.Structuring settings = wikiConfig.getStructuring();
    if (settings.getOrphanPolicy() != OrphanPolicy.PREAMBLE) {
      return null;
    }
    log.debug("Opening preamble section for orphaned level-{} content", level);
    return new OpenSection(settings.getPreambleTitle());
  }

  private static final class OpenSection {
    private final String title;
    private final List<ContentItem> content = new ArrayList<>();
    private final List<Section> subsections = new ArrayList<>();

    private OpenSection(String title) {
      this.title = title;
    }

    private Section seal() {
      return new Section(title, content, subsections.isEmpty() ? null : subsections);
    }
  }
}
