package com.flamingo.ai.wikistructure.service.structure;

import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.heading;
import static com.flamingo.ai.wikistructure.service.structure.model.BlockNode.paragraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.OrphanPolicy;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionSegmenter Tests")
class SectionSegmenterTest {

  private static final Set<String> TARGETS = Set.of("简介", "人物设定");

  private WikiConfig wikiConfig;
  private SectionSegmenter segmenter;

  @BeforeEach
  void setUp() {
    wikiConfig = new WikiConfig();
    segmenter = new SectionSegmenter(new TextFlattener(), wikiConfig);
  }

  @Test
  @DisplayName("should keep only target sections with deeper headings left inline")
  void shouldKeepTargetSections_withDeeperHeadingsInline() {
    BlockNode intro = paragraph("intro");
    BlockNode a = paragraph("a");
    BlockNode sub = heading(3, "外貌");
    BlockNode b = paragraph("b");
    BlockNode c = paragraph("c");
    List<BlockNode> nodes =
        List.of(
            intro,
            heading(2, "简介"),
            a,
            sub,
            b,
            heading(2, "其他"),
            paragraph("x"),
            heading(2, "人物设定"),
            c);

    Map<String, List<BlockNode>> sections = segmenter.segment(nodes, TARGETS);

    assertThat(sections).containsOnlyKeys("简介", "人物设定");
    assertThat(sections.get("简介")).containsExactly(a, sub, b);
    assertThat(sections.get("人物设定")).containsExactly(c);
  }

  @Test
  @DisplayName("should let a repeated title replace the earlier section while keeping its position")
  void shouldKeepLastOccurrence_ofRepeatedTitle() {
    BlockNode first = paragraph("first");
    BlockNode setting = paragraph("setting");
    BlockNode second = paragraph("second");
    List<BlockNode> nodes =
        List.of(
            heading(2, "简介"),
            first,
            heading(2, "人物设定"),
            setting,
            heading(2, "简介"),
            second);

    Map<String, List<BlockNode>> sections = segmenter.segment(nodes, TARGETS);

    assertThat(sections.keySet()).containsExactly("简介", "人物设定");
    assertThat(sections.get("简介")).containsExactly(second);
  }

  @Test
  @DisplayName("should keep an empty target section and match trimmed heading text")
  void shouldKeepEmptySection_andMatchTrimmedTitle() {
    List<BlockNode> nodes =
        List.of(heading(2, " 简介 "), heading(2, "人物设定"), paragraph("c"));

    Map<String, List<BlockNode>> sections = segmenter.segment(nodes, TARGETS);

    assertThat(sections.get("简介")).isEmpty();
    assertThat(sections.get("人物设定")).hasSize(1);
  }

  @Test
  @DisplayName("should return no sections when no target title occurs")
  void shouldReturnEmpty_whenNoTargetOccurs() {
    List<BlockNode> nodes = List.of(paragraph("p"), heading(2, "其他"), paragraph("x"));

    assertThat(segmenter.segment(nodes, TARGETS)).isEmpty();
    assertThat(segmenter.segment(List.of(), TARGETS)).isEmpty();
  }

  @Test
  @DisplayName("should drop content before the first major heading by default")
  void shouldDropOrphans_byDefault() {
    List<BlockNode> nodes = List.of(paragraph("orphan"), heading(2, "简介"), paragraph("a"));

    assertThat(segmenter.segment(nodes, TARGETS)).containsOnlyKeys("简介");
  }

  @Test
  @DisplayName("should collect content before the first major heading under the preamble policy")
  void shouldCollectPreamble_underPreamblePolicy() {
    wikiConfig.getStructuring().setOrphanPolicy(OrphanPolicy.PREAMBLE);
    BlockNode orphan = paragraph("orphan");
    List<BlockNode> nodes = List.of(orphan, heading(2, "简介"), paragraph("a"));

    Map<String, List<BlockNode>> sections = segmenter.segment(nodes, TARGETS);

    assertThat(sections.keySet()).containsExactly("序言", "简介");
    assertThat(sections.get("序言")).containsExactly(orphan);
  }

  @Test
  @DisplayName("should not emit an empty preamble")
  void shouldNotEmitEmptyPreamble() {
    wikiConfig.getStructuring().setOrphanPolicy(OrphanPolicy.PREAMBLE);
    List<BlockNode> nodes = List.of(heading(2, "简介"), paragraph("a"));

    assertThat(segmenter.segment(nodes, TARGETS)).containsOnlyKeys("简介");
  }

  @Test
  @DisplayName("should segment at the configured major level")
  void shouldSegmentAtConfiguredMajorLevel() {
    wikiConfig.getStructuring().setMajorLevel(1);
    BlockNode nested = heading(2, "人物设定");
    List<BlockNode> nodes = List.of(heading(1, "简介"), nested, paragraph("a"));

    Map<String, List<BlockNode>> sections = segmenter.segment(nodes, TARGETS);

    assertThat(sections).containsOnlyKeys("简介");
    assertThat(sections.get("简介")).hasSize(2).startsWith(nested);
  }

  @Test
  @DisplayName("should reject a missing node sequence")
  void shouldRejectNullNodes() {
    assertThatThrownBy(() -> segmenter.segment(null, TARGETS))
        .isInstanceOf(NullPointerException.class);
  }
}
