package com.flamingo.ai.wikistructure.service.structure;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.QuoteEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Turns a table node into pipe-delimited text or into a list of voice-line records. */
@Component
@RequiredArgsConstructor
public class TableLinearizer {

  private final TextFlattener textFlattener;

  /**
   * Renders every head and body row as {@code "| a | b |"}, one line per row, in document order.
   *
   * @return the rows joined by newlines; empty when the table has no rows
   */
  public String toText(BlockNode.Table table) {
    List<String> lines = new ArrayList<>();
    for (BlockNode section : table.children()) {
      if (!(section instanceof BlockNode.TableHead) && !(section instanceof BlockNode.TableBody)) {
        continue;
      }
      for (BlockNode row : section.children()) {
        if (row instanceof BlockNode.TableRow) {
          lines.add(toLine(row));
        }
      }
    }
    return String.join("\n", lines);
  }

  /**
   * Reads body rows as {@code (occasion, line)} pairs from the first two cells.
   *
   * <p>A row is skipped when all of its cells are empty, when it has fewer than two cells, or when
   * its first cell repeats the header (either {@code occasionHeader} or the first header cell of
   * the table head).
   */
  public List<QuoteEntry> toRecords(BlockNode.Table table, String occasionHeader) {
    List<String> headers = headerTexts(table);
    String firstHeader = headers.isEmpty() ? null : headers.get(0);

    List<QuoteEntry> result = new ArrayList<>();
    for (BlockNode section : table.children()) {
      if (!(section instanceof BlockNode.TableBody)) {
        continue;
      }
      for (BlockNode row : section.children()) {
        if (!(row instanceof BlockNode.TableRow)) {
          continue;
        }
        List<String> cells = cellTexts(row);
        if (cells.stream().allMatch(String::isEmpty) || cells.size() < 2) {
          continue;
        }
        String first = cells.get(0);
        if (first.equals(occasionHeader) || (firstHeader != null && first.equals(firstHeader))) {
          continue;
        }
        result.add(new QuoteEntry(first, cells.get(1)));
      }
    }
    return result;
  }

  private List<String> headerTexts(BlockNode.Table table) {
    for (BlockNode section : table.children()) {
      if (section instanceof BlockNode.TableHead) {
        for (BlockNode row : section.children()) {
          if (row instanceof BlockNode.TableRow) {
            return cellTexts(row);
          }
        }
      }
    }
    return List.of();
  }

  private List<String> cellTexts(BlockNode row) {
    return row.children().stream().map(textFlattener::flattenTrimmed).toList();
  }

  private String toLine(BlockNode row) {
    return row.children().stream()
        .map(textFlattener::flattenTrimmed)
        .collect(Collectors.joining(" | ", "| ", " |"));
  }
}
