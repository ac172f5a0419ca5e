package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.QuoteEntry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Collects voice lines from a quotes section, grouped by the version heading above each table.
 *
 * <p>Tables before the first version heading have no version and are ignored. A repeated version
 * title starts over with an empty list.
 */
@Component
@RequiredArgsConstructor
public class QuoteCollector {

  private final TextFlattener textFlattener;
  private final TableLinearizer tableLinearizer;
  private final WikiConfig wikiConfig;

  public Map<String, List<QuoteEntry>> collect(List<BlockNode> sectionNodes) {
    Objects.requireNonNull(sectionNodes, "sectionNodes");
    WikiConfig.Quotes settings = wikiConfig.getQuotes();
    Map<String, List<QuoteEntry>> quotes = new LinkedHashMap<>();
    List<QuoteEntry> current = null;

    for (BlockNode node : sectionNodes) {
      if (node instanceof BlockNode.Heading heading
          && heading.level() == settings.getVersionLevel()) {
        current = new ArrayList<>();
        quotes.put(textFlattener.flattenTrimmed(heading), current);
      } else if (node instanceof BlockNode.Table table && current != null) {
        current.addAll(tableLinearizer.toRecords(table, settings.getOccasionHeader()));
      }
    }

    Map<String, List<QuoteEntry>> sealed = new LinkedHashMap<>();
    quotes.forEach((version, entries) -> sealed.put(version, List.copyOf(entries)));
    return sealed;
  }
}
