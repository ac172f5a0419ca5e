package com.flamingo.ai.wikistructure.service.structure.parsing;

import com.flamingo.ai.wikistructure.exception.DocumentProcessingException;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * {@link BlockTreeParser} for Markdown renderings of wiki pages, built on {@code commonmark-java}
 * with the GFM tables extension.
 *
 * <p>Mapping of commonmark nodes:
 *
 * <ul>
 *   <li>{@link Heading}, {@link Paragraph}, {@link StrongEmphasis}, {@link Emphasis}, {@link Link},
 *       {@link Image} → the matching {@link BlockNode} variant
 *   <li>{@link BulletList}, {@link OrderedList} → {@link BlockNode.ListBlock}; {@link ListItem} →
 *       {@link BlockNode.ListItem}
 *   <li>GFM {@link TableBlock} and its head, body, rows and cells → the table variants
 *   <li>{@link Text} and inline {@link Code} → {@link BlockNode.Text}
 *   <li>code blocks → {@link BlockNode.Generic} holding the literal as text
 *   <li>line breaks, raw HTML and anything else → {@link BlockNode.Generic} with converted children
 * </ul>
 *
 * <p>Line breaks carry no text, matching how wiki exports wrap CJK prose mid-sentence.
 */
@Component
@Slf4j
public class CommonmarkBlockTreeParser implements BlockTreeParser {

  private static final Parser PARSER =
      Parser.builder().extensions(List.of(TablesExtension.create())).build();

  @Override
  public List<BlockNode> parse(String markup) {
    Node document = PARSER.parse(markup == null ? "" : markup);
    return convertChildren(document);
  }

  @Override
  public List<BlockNode> parse(InputStream inputStream, String documentName) {
    try {
      String markup = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
      return parse(markup);
    } catch (IOException e) {
      log.error("CommonmarkBlockTreeParser failed for '{}': {}", documentName, e.getMessage());
      throw new DocumentProcessingException(
          documentName, "Failed to read Markdown: " + e.getMessage(), e);
    }
  }

  // ---- private helpers ----

  private List<BlockNode> convertChildren(Node parent) {
    List<BlockNode> children = new ArrayList<>();
    Node child = parent.getFirstChild();
    while (child != null) {
      children.add(convert(child));
      child = child.getNext();
    }
    return children;
  }

  private BlockNode convert(Node node) {
    if (node instanceof Text text) {
      return new BlockNode.Text(text.getLiteral());
    }
    if (node instanceof Code code) {
      return new BlockNode.Text(code.getLiteral());
    }
    if (node instanceof FencedCodeBlock codeBlock) {
      return codeBlock(codeBlock.getLiteral());
    }
    if (node instanceof IndentedCodeBlock codeBlock) {
      return codeBlock(codeBlock.getLiteral());
    }
    if (node instanceof SoftLineBreak) {
      return new BlockNode.Generic("softbreak", List.of());
    }
    if (node instanceof HardLineBreak) {
      return new BlockNode.Generic("linebreak", List.of());
    }

    List<BlockNode> children = convertChildren(node);
    if (node instanceof Heading heading) {
      return new BlockNode.Heading(heading.getLevel(), children);
    }
    if (node instanceof Paragraph) {
      return new BlockNode.Paragraph(children);
    }
    if (node instanceof StrongEmphasis) {
      return new BlockNode.Strong(children);
    }
    if (node instanceof Emphasis) {
      return new BlockNode.Emphasis(children);
    }
    if (node instanceof Link link) {
      return new BlockNode.Link(link.getDestination(), children);
    }
    if (node instanceof Image image) {
      return new BlockNode.Image(image.getTitle(), children);
    }
    if (node instanceof BulletList || node instanceof OrderedList) {
      return new BlockNode.ListBlock(children);
    }
    if (node instanceof ListItem) {
      return new BlockNode.ListItem(children);
    }
    if (node instanceof TableBlock) {
      return new BlockNode.Table(children);
    }
    if (node instanceof TableHead) {
      return new BlockNode.TableHead(children);
    }
    if (node instanceof TableBody) {
      return new BlockNode.TableBody(children);
    }
    if (node instanceof TableRow) {
      return new BlockNode.TableRow(children);
    }
    if (node instanceof TableCell) {
      return new BlockNode.TableCell(children);
    }
    return new BlockNode.Generic(kindOf(node), children);
  }

  private static BlockNode codeBlock(String literal) {
    return new BlockNode.Generic("code_block", List.of(new BlockNode.Text(literal)));
  }

  private static String kindOf(Node node) {
    return node.getClass().getSimpleName().toLowerCase(Locale.ROOT);
  }
}
