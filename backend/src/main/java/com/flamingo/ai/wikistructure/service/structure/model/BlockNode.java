package com.flamingo.ai.wikistructure.service.structure.model;

import java.util.Arrays;
import java.util.List;

/**
 * A node of the block tree a wiki page is parsed into.
 *
 * <p>The variant set is closed: structuring components match on the record type instead of reading
 * loosely-typed attributes. Constructs the parser does not model explicitly (code blocks, quotes,
 * line breaks, raw HTML) become {@link Generic} nodes so no content is lost from the tree.
 *
 * <p>Every variant except {@link Text} carries zero or more children in document order.
 */
public sealed interface BlockNode {

  /** Child nodes in document order; empty for leaves. */
  List<BlockNode> children();

  record Text(String raw) implements BlockNode {
    public Text {
      raw = raw == null ? "" : raw;
    }

    @Override
    public List<BlockNode> children() {
      return List.of();
    }
  }

  /**
   * A heading.
   *
   * @param level heading depth (1 = H1, 2 = H2, …, 6 = H6)
   * @param children inline content of the heading
   */
  record Heading(int level, List<BlockNode> children) implements BlockNode {
    public Heading {
      children = List.copyOf(children);
    }
  }

  record Paragraph(List<BlockNode> children) implements BlockNode {
    public Paragraph {
      children = List.copyOf(children);
    }
  }

  record Strong(List<BlockNode> children) implements BlockNode {
    public Strong {
      children = List.copyOf(children);
    }
  }

  record Emphasis(List<BlockNode> children) implements BlockNode {
    public Emphasis {
      children = List.copyOf(children);
    }
  }

  /**
   * A hyperlink. Only the link text (its children) is ever flattened.
   *
   * @param destination link target, may be {@code null}
   * @param children link text
   */
  record Link(String destination, List<BlockNode> children) implements BlockNode {
    public Link {
      children = List.copyOf(children);
    }
  }

  /**
   * An image.
   *
   * @param title optional title attribute; preferred over the alt text when non-empty
   * @param children alt text
   */
  record Image(String title, List<BlockNode> children) implements BlockNode {
    public Image {
      children = List.copyOf(children);
    }
  }

  /** A bullet or ordered list; children are {@link ListItem}s. */
  record ListBlock(List<BlockNode> children) implements BlockNode {
    public ListBlock {
      children = List.copyOf(children);
    }
  }

  record ListItem(List<BlockNode> children) implements BlockNode {
    public ListItem {
      children = List.copyOf(children);
    }
  }

  /** A table; children are {@link TableHead} and {@link TableBody} sections. */
  record Table(List<BlockNode> children) implements BlockNode {
    public Table {
      children = List.copyOf(children);
    }
  }

  record TableHead(List<BlockNode> children) implements BlockNode {
    public TableHead {
      children = List.copyOf(children);
    }
  }

  record TableBody(List<BlockNode> children) implements BlockNode {
    public TableBody {
      children = List.copyOf(children);
    }
  }

  record TableRow(List<BlockNode> children) implements BlockNode {
    public TableRow {
      children = List.copyOf(children);
    }
  }

  record TableCell(List<BlockNode> children) implements BlockNode {
    public TableCell {
      children = List.copyOf(children);
    }
  }

  /**
   * Any construct without a dedicated variant.
   *
   * @param kind parser-specific name of the construct, e.g. {@code "code_block"}
   * @param children nested content, possibly empty
   */
  record Generic(String kind, List<BlockNode> children) implements BlockNode {
    public Generic {
      children = List.copyOf(children);
    }
  }

  // ---- factories ----

  static Text text(String raw) {
    return new Text(raw);
  }

  static Heading heading(int level, BlockNode... children) {
    return new Heading(level, Arrays.asList(children));
  }

  static Heading heading(int level, String title) {
    return new Heading(level, List.of(text(title)));
  }

  static Paragraph paragraph(BlockNode... children) {
    return new Paragraph(Arrays.asList(children));
  }

  static Paragraph paragraph(String text) {
    return new Paragraph(List.of(text(text)));
  }

  static Strong strong(BlockNode... children) {
    return new Strong(Arrays.asList(children));
  }

  static Emphasis emphasis(BlockNode... children) {
    return new Emphasis(Arrays.asList(children));
  }

  static Link link(String text) {
    return new Link(null, List.of(text(text)));
  }

  static Image image(String title, BlockNode... children) {
    return new Image(title, Arrays.asList(children));
  }

  static ListBlock list(String... items) {
    return new ListBlock(
        Arrays.stream(items).map(item -> (BlockNode) new ListItem(List.of(text(item)))).toList());
  }

  static Table table(BlockNode... sections) {
    return new Table(Arrays.asList(sections));
  }

  static TableHead head(String... cells) {
    return new TableHead(List.<BlockNode>of(row(cells)));
  }

  static TableBody body(TableRow... rows) {
    return new TableBody(List.<BlockNode>of(rows));
  }

  static TableRow row(String... cells) {
    return new TableRow(
        Arrays.stream(cells).map(cell -> (BlockNode) new TableCell(List.of(text(cell)))).toList());
  }

  static TableRow rowOf(TableCell... cells) {
    return new TableRow(List.<BlockNode>of(cells));
  }

  static TableCell cell(BlockNode... children) {
    return new TableCell(Arrays.asList(children));
  }
}
