package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.EntityKind;
import com.flamingo.ai.wikistructure.service.structure.model.EntityRecord;
import com.flamingo.ai.wikistructure.service.structure.model.Profile;
import io.micrometer.core.annotation.Timed;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the block tree of one wiki page into an {@link EntityRecord}.
 *
 * <p>The page is segmented at the major heading level. Each kept section is shaped by one of three
 * strategies, chosen from the kind's settings: the quotes section is collected into voice lines,
 * nested sections become a recursive outline starting one level below the major level, and every
 * other section is flattened into text and sub-blocks. The infobox profile is read independently
 * from the whole page. Section titles are finally canonicalized so every field of the kind is
 * present.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityStructuringService {

  private final SectionSegmenter sectionSegmenter;
  private final LevelGrouper levelGrouper;
  private final ContentFlattener contentFlattener;
  private final ProfileTableExtractor profileTableExtractor;
  private final QuoteCollector quoteCollector;
  private final FieldCanonicalizer fieldCanonicalizer;
  private final WikiConfig wikiConfig;

  /**
   * Structures one page.
   *
   * @param kind entity kind selecting sections, shaping and field names
   * @param name entity name recorded on the result
   * @param nodes top-level nodes of the page
   * @return the assembled record
   * @throws NullPointerException if {@code nodes} is {@code null}
   */
  @Timed(value = "wiki.document.structure", description = "Time to structure one wiki page")
  public EntityRecord structure(EntityKind kind, String name, List<BlockNode> nodes) {
    Objects.requireNonNull(nodes, "nodes");
    WikiConfig.EntitySettings settings = wikiConfig.getEntities().forKind(kind);

    Set<String> targets = new LinkedHashSet<>(settings.getSections());
    if (settings.getQuoteSection() != null) {
      targets.add(settings.getQuoteSection());
    }
    Map<String, List<BlockNode>> sections = sectionSegmenter.segment(nodes, targets);

    int nestedLevel = wikiConfig.getStructuring().getMajorLevel() + 1;
    Map<String, Object> structured = new LinkedHashMap<>();
    sections.forEach(
        (title, sectionNodes) -> {
          if (title.equals(settings.getQuoteSection())) {
            structured.put(title, quoteCollector.collect(sectionNodes));
          } else if (settings.getNestedSections().contains(title)) {
            structured.put(title, levelGrouper.groupByLevel(sectionNodes, nestedLevel));
          } else {
            structured.put(
                title,
                contentFlattener.flattenContent(
                    sectionNodes, settings.getMinorLevel(), settings.getListPolicy()));
          }
        });

    if (settings.getProfileKey() != null) {
      structured.put(
          settings.getProfileKey(), profileTableExtractor.extract(nodes, settings.getProfile()));
    }

    Map<String, Object> fields =
        fieldCanonicalizer.canonicalize(structured, settings.getFieldMap(), mapDefaults(settings));
    log.debug(
        "Structured {} '{}': {} of {} sections found", kind, name, sections.size(), targets.size());
    return new EntityRecord(name, kind, fields);
  }

  private static Map<String, Object> mapDefaults(WikiConfig.EntitySettings settings) {
    Map<String, Object> defaults = new LinkedHashMap<>();
    if (settings.getProfileKey() != null) {
      defaults.put(settings.getProfileKey(), Profile.empty());
    }
    if (settings.getQuoteSection() != null) {
      defaults.put(settings.getQuoteSection(), Map.of());
    }
    return defaults;
  }
}
