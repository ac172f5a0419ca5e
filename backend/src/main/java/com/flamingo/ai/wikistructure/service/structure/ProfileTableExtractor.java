package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.Profile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the infobox of a page into a {@link Profile}.
 *
 * <p>The infobox is the first top-level table; later tables are never consulted. Each body row
 * contributes {@code first cell -> second cell}. Rows whose first cell is empty or repeats a header
 * label are skipped. The relation key, when the kind has one, is special: its value is not in the
 * second cell but in the first cell of the following row, as a list of linked names, so the two
 * rows are consumed together.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProfileTableExtractor {

  private static final String NAME_SEPARATOR = ",";

  private final TextFlattener textFlattener;

  public Profile extract(List<BlockNode> nodes, WikiConfig.ProfileTable settings) {
    Objects.requireNonNull(nodes, "nodes");
    Optional<BlockNode.Table> infobox =
        nodes.stream()
            .filter(BlockNode.Table.class::isInstance)
            .map(BlockNode.Table.class::cast)
            .findFirst();
    if (infobox.isEmpty()) {
      return Profile.empty();
    }

    Map<String, String> fields = new LinkedHashMap<>();
    List<String> relationNames = List.of();
    boolean relationFound = false;

    for (BlockNode section : infobox.get().children()) {
      if (!(section instanceof BlockNode.TableBody)) {
        continue;
      }
      List<BlockNode> rows = section.children();
      int i = 0;
      while (i < rows.size()) {
        BlockNode row = rows.get(i);
        if (!(row instanceof BlockNode.TableRow)) {
          i++;
          continue;
        }
        List<BlockNode> cells = row.children();
        String key = cells.isEmpty() ? "" : textFlattener.flattenTrimmed(cells.get(0));
        String value = cells.size() > 1 ? textFlattener.flattenTrimmed(cells.get(1)) : "";

        if (key.isEmpty() || settings.getHeaderLabels().contains(key)) {
          i++;
          continue;
        }
        if (key.equals(settings.getRelationKey()) && i + 1 < rows.size()) {
          List<BlockNode> valueCells = rows.get(i + 1).children();
          if (!valueCells.isEmpty()) {
            relationNames = relatedNames(valueCells.get(0));
            relationFound = true;
            fields.put(key, String.join(NAME_SEPARATOR, relationNames));
          } else {
            log.debug("Relation row '{}' is followed by an empty row; skipping both", key);
          }
          i += 2;
          continue;
        }
        if (!value.isEmpty()) {
          fields.put(key, value);
        }
        i++;
      }
    }
    return new Profile(fields, relationFound ? settings.getRelationKey() : null, relationNames);
  }

  /** Candidate names of a relation cell, without annotations such as {@code "C（注）"}. */
  List<String> relatedNames(BlockNode cell) {
    List<String> names = new ArrayList<>();
    collectNames(cell, names);
    return names.stream().filter(name -> !name.isEmpty() && !isAnnotation(name)).toList();
  }

  private void collectNames(BlockNode node, List<String> names) {
    if (node instanceof BlockNode.Link link) {
      for (BlockNode child : link.children()) {
        if (child instanceof BlockNode.Text text) {
          names.add(text.raw().trim());
        }
      }
    } else if (node instanceof BlockNode.Text text) {
      for (String token : text.raw().replace("、", NAME_SEPARATOR).split(NAME_SEPARATOR)) {
        String name = token.trim();
        if (!name.isEmpty()) {
          names.add(name);
        }
      }
    } else {
      for (BlockNode child : node.children()) {
        collectNames(child, names);
      }
    }
  }

  private static boolean isAnnotation(String name) {
    return name.contains("）") || name.contains(")") || name.contains("：") || name.contains(":");
  }
}
