package com.flamingo.ai.wikistructure.service.structure.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.wikistructure.exception.DocumentProcessingException;
import com.flamingo.ai.wikistructure.service.structure.TextFlattener;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CommonmarkBlockTreeParser Tests")
class CommonmarkBlockTreeParserTest {

  private final CommonmarkBlockTreeParser parser = new CommonmarkBlockTreeParser();
  private final TextFlattener flattener = new TextFlattener();

  @Test
  @DisplayName("should map headings and inline formatting to block nodes")
  void shouldMapHeadingsAndInlines() {
    List<BlockNode> nodes = parser.parse("## 简介\n\n阿露是*便利屋*的**社长**，见[主页](/wiki/aru)。");

    assertThat(nodes).hasSize(2);
    assertThat(nodes.get(0)).isEqualTo(BlockNode.heading(2, "简介"));

    BlockNode.Paragraph paragraph = (BlockNode.Paragraph) nodes.get(1);
    assertThat(paragraph.children())
        .extracting(node -> node.getClass().getSimpleName())
        .containsExactly("Text", "Emphasis", "Text", "Strong", "Text", "Link", "Text");
    BlockNode.Link link = (BlockNode.Link) paragraph.children().get(5);
    assertThat(link.destination()).isEqualTo("/wiki/aru");
    assertThat(flattener.flatten(paragraph)).isEqualTo("阿露是便利屋的社长，见主页。");
  }

  @Test
  @DisplayName("should map GFM tables to head, body, row and cell nodes")
  void shouldMapTables() {
    List<BlockNode> nodes = parser.parse("| 场合 | 台词 |\n| --- | --- |\n| 日常 | 你好 |\n");

    assertThat(nodes).hasSize(1);
    BlockNode.Table table = (BlockNode.Table) nodes.get(0);
    assertThat(table.children()).hasSize(2);
    assertThat(table.children().get(0)).isInstanceOf(BlockNode.TableHead.class);
    assertThat(table.children().get(1)).isInstanceOf(BlockNode.TableBody.class);

    BlockNode bodyRow = table.children().get(1).children().get(0);
    assertThat(bodyRow).isInstanceOf(BlockNode.TableRow.class);
    assertThat(bodyRow.children())
        .allSatisfy(cell -> assertThat(cell).isInstanceOf(BlockNode.TableCell.class))
        .extracting(flattener::flattenTrimmed)
        .containsExactly("日常", "你好");
  }

  @Test
  @DisplayName("should map bullet and ordered lists to list nodes")
  void shouldMapLists() {
    List<BlockNode> nodes = parser.parse("- 甲\n- 乙\n\n1. 一\n2. 二\n");

    assertThat(nodes).hasSize(2).allMatch(BlockNode.ListBlock.class::isInstance);
    assertThat(nodes.get(0).children())
        .allSatisfy(item -> assertThat(item).isInstanceOf(BlockNode.ListItem.class))
        .extracting(flattener::flattenTrimmed)
        .containsExactly("甲", "乙");
  }

  @Test
  @DisplayName("should keep the image title and flatten line breaks to nothing")
  void shouldKeepImageTitle_andDropLineBreaks() {
    List<BlockNode> nodes = parser.parse("![立绘替代](aru.png \"陆八魔亚瑠\")\n第一行\n第二行");

    BlockNode paragraph = nodes.get(0);
    BlockNode.Image image = (BlockNode.Image) paragraph.children().get(0);
    assertThat(image.title()).isEqualTo("陆八魔亚瑠");
    assertThat(flattener.flatten(image)).isEqualTo("陆八魔亚瑠");
    assertThat(paragraph.children()).contains(new BlockNode.Generic("softbreak", List.of()));
    assertThat(flattener.flatten(paragraph)).isEqualTo("陆八魔亚瑠第一行第二行");
  }

  @Test
  @DisplayName("should keep code literals as text and other blocks as generic nodes")
  void shouldMapCodeAndOtherBlocks() {
    List<BlockNode> nodes = parser.parse("```\nrun()\n```\n\n> 引用 `code`\n");

    assertThat(nodes.get(0))
        .isEqualTo(new BlockNode.Generic("code_block", List.of(BlockNode.text("run()\n"))));
    assertThat(nodes.get(1)).isInstanceOf(BlockNode.Generic.class);
    assertThat(((BlockNode.Generic) nodes.get(1)).kind()).isEqualTo("blockquote");
    assertThat(flattener.flattenTrimmed(nodes.get(1))).isEqualTo("引用 code");
  }

  @Test
  @DisplayName("should parse a UTF-8 stream and treat missing markup as empty")
  void shouldParseStream_andTreatNullAsEmpty() {
    InputStream in = new ByteArrayInputStream("## 简介\n".getBytes(StandardCharsets.UTF_8));

    assertThat(parser.parse(in, "aru.md")).containsExactly(BlockNode.heading(2, "简介"));
    assertThat(parser.parse((String) null)).isEmpty();
  }

  @Test
  @DisplayName("should wrap read failures in DocumentProcessingException")
  void shouldWrapReadFailures() {
    InputStream broken =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("disk gone");
          }
        };

    assertThatThrownBy(() -> parser.parse(broken, "broken.md"))
        .isInstanceOfSatisfying(
            DocumentProcessingException.class,
            ex -> assertThat(ex.getDocumentName()).isEqualTo("broken.md"))
        .hasMessageContaining("disk gone")
        .hasCauseInstanceOf(IOException.class);
  }
}
