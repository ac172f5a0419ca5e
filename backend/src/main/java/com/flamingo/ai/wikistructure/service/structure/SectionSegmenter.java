package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.OrphanPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits the top-level nodes of a page into named sections at the major heading level.
 *
 * <p>Only sections whose title is in the requested set collect nodes; the content of every other
 * section is skipped. Deeper headings are not interpreted here, they stay inline in the section's
 * node list for the shaping step.
 *
 * <p>When a title occurs twice the later section replaces the earlier one, while the entry keeps
 * the position of its first occurrence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SectionSegmenter {

  private final TextFlattener textFlattener;
  private final WikiConfig wikiConfig;

  /**
   * Segments a page.
   *
   * @param nodes top-level nodes of the page
   * @param targetTitles section titles to keep
   * @return kept section title to its nodes, in first-occurrence order
   */
  public Map<String, List<BlockNode>> segment(List<BlockNode> nodes, Set<String> targetTitles) {
    Objects.requireNonNull(nodes, "nodes");
    WikiConfig.Structuring settings = wikiConfig.getStructuring();
    boolean keepPreamble = settings.getOrphanPolicy() == OrphanPolicy.PREAMBLE;

    Map<String, List<BlockNode>> sections = new LinkedHashMap<>();
    String currentTitle = keepPreamble ? settings.getPreambleTitle() : null;
    boolean inPreamble = keepPreamble;
    boolean collecting = keepPreamble;
    List<BlockNode> current = new ArrayList<>();

    for (BlockNode node : nodes) {
      if (node instanceof BlockNode.Heading heading
          && heading.level() == settings.getMajorLevel()) {
        if (collecting && !(inPreamble && current.isEmpty())) {
          flush(sections, currentTitle, current);
        }
        currentTitle = textFlattener.flattenTrimmed(heading);
        inPreamble = false;
        collecting = targetTitles.contains(currentTitle);
        current = new ArrayList<>();
      } else if (collecting) {
        current.add(node);
      }
    }
    if (collecting && !(inPreamble && current.isEmpty())) {
      flush(sections, currentTitle, current);
    }

    log.debug("Segmented {} top-level nodes into sections {}", nodes.size(), sections.keySet());
    return sections;
  }

  private void flush(Map<String, List<BlockNode>> sections, String title, List<BlockNode> nodes) {
    if (sections.containsKey(title)) {
      log.debug("Section '{}' occurs more than once; keeping the later one", title);
    }
    sections.put(title, List.copyOf(nodes));
  }
}
