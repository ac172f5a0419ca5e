package com.flamingo.ai.wikistructure.service.structure;

import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.body;
import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.head;
import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.row;
import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.table;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.QuoteEntry;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableLinearizer Tests")
class TableLinearizerTest {

  private static final String OCCASION = "场合";

  private final TableLinearizer linearizer = new TableLinearizer(new TextFlattener());

  @Test
  @DisplayName("should render head and body rows as pipe-delimited lines")
  void shouldRenderRowsAsPipeDelimitedLines() {
    BlockNode.Table quotes =
        table(head("场合", "台词"), body(row("日常", "你好"), row(" 战斗 ", "上吧")));

    assertThat(linearizer.toText(quotes))
        .isEqualTo("| 场合 | 台词 |\n| 日常 | 你好 |\n| 战斗 | 上吧 |");
  }

  @Test
  @DisplayName("should render a table without rows as empty text")
  void shouldRenderEmptyTable_asEmptyText() {
    assertThat(linearizer.toText(table())).isEmpty();
  }

  @Test
  @DisplayName("should skip repeated header, blank and one-cell rows when reading records")
  void shouldSkipHeaderBlankAndShortRows() {
    BlockNode.Table quotes =
        table(
            head("版本", "内容"),
            body(row("场合", "台词"), row("", ""), row("孤单"), row("日常", "你好")));

    List<QuoteEntry> records = linearizer.toRecords(quotes, OCCASION);

    assertThat(records).containsExactly(new QuoteEntry("日常", "你好"));
  }

  @Test
  @DisplayName("should skip a body row repeating the first header cell of the table head")
  void shouldSkipRowRepeatingTableHead() {
    BlockNode.Table quotes =
        table(head("时机", "台词"), body(row("时机", "台词"), row("登录", "早上好，老师。")));

    assertThat(linearizer.toRecords(quotes, OCCASION))
        .containsExactly(new QuoteEntry("登录", "早上好，老师。"));
  }

  @Test
  @DisplayName("should read records from a table without head, ignoring extra cells")
  void shouldReadRecords_withoutHead() {
    BlockNode.Table quotes = table(body(row("日常", "你好", "备注"), row("战斗", "上吧")));

    assertThat(linearizer.toRecords(quotes, OCCASION))
        .containsExactly(new QuoteEntry("日常", "你好"), new QuoteEntry("战斗", "上吧"));
  }

  @Test
  @DisplayName("should not read records from the table head")
  void shouldNotReadRecordsFromHead() {
    assertThat(linearizer.toRecords(table(head("日常", "你好")), OCCASION)).isEmpty();
  }
}
