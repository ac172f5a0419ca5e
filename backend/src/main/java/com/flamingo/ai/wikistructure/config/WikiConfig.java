package com.flamingo.ai.wikistructure.config;

import com.flamingo.ai.wikistructure.service.structure.model.EntityKind;
import com.flamingo.ai.wikistructure.service.structure.model.ListPolicy;
import com.flamingo.ai.wikistructure.service.structure.model.OrphanPolicy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for wiki page structuring. */
@Configuration
@ConfigurationProperties(prefix = "wiki")
@Getter
@Setter
public class WikiConfig {

  private Structuring structuring = new Structuring();
  private Quotes quotes = new Quotes();
  private Entities entities = new Entities();
  private Batch batch = new Batch();
  private Executor executor = new Executor();

  @Getter
  @Setter
  public static class Structuring {
    /** Heading level that delimits the top-level sections of a page. */
    private int majorLevel = 2;

    private OrphanPolicy orphanPolicy = OrphanPolicy.DROP;

    /** Title of the implicit section that collects orphaned content under {@code PREAMBLE}. */
    private String preambleTitle = "序言";
  }

  /** Infobox reading rules of one entity kind. */
  @Getter
  @Setter
  public static class ProfileTable {
    /** First-cell texts marking a repeated header row inside the infobox body. */
    private List<String> headerLabels = new ArrayList<>();

    /**
     * Key whose value sits in the following row as a list of linked names; {@code null} when the
     * kind's infobox has no such row.
     */
    private String relationKey;
  }

  @Getter
  @Setter
  public static class Quotes {
    /** First-cell text of a header row repeated inside a quotes table body. */
    private String occasionHeader = "场合";

    /** Heading level of the version titles inside the quotes section. */
    private int versionLevel = 3;
  }

  @Getter
  @Setter
  public static class Entities {
    private EntitySettings game = EntitySettings.game();
    private EntitySettings school = EntitySettings.school();
    private EntitySettings student = EntitySettings.student();

    public EntitySettings forKind(EntityKind kind) {
      return switch (kind) {
        case GAME -> game;
        case SCHOOL -> school;
        case STUDENT -> student;
      };
    }
  }

  /** Per-kind section selection and field canonicalization. */
  @Getter
  @Setter
  public static class EntitySettings {
    /** Section titles of interest; everything else on the page is skipped. */
    private List<String> sections = new ArrayList<>();

    /** Sections shaped as a nested outline instead of flat sub-blocks. */
    private List<String> nestedSections = new ArrayList<>();

    /** Heading level that opens a sub-block inside a flat section. */
    private int minorLevel = 3;

    private ListPolicy listPolicy = ListPolicy.JOINED;

    /** Section title (or synonym) to canonical field name. */
    private Map<String, String> fieldMap = new LinkedHashMap<>();

    /** Field receiving the infobox profile; {@code null} when the kind has no infobox. */
    private String profileKey;

    private ProfileTable profile = new ProfileTable();

    /** Section holding voice-line tables; {@code null} when the kind has none. */
    private String quoteSection;

    /** Entity names the batch job never writes. */
    private List<String> excludedNames = new ArrayList<>();

    static EntitySettings game() {
      EntitySettings settings = new EntitySettings();
      settings.sections = new ArrayList<>(List.of("背景设定（世界观）", "游戏系统"));
      settings.nestedSections = new ArrayList<>(List.of("游戏系统"));
      settings.minorLevel = 4;
      settings.fieldMap.put("背景设定（世界观）", "背景设定（世界观）");
      settings.fieldMap.put("游戏系统", "游戏系统");
      return settings;
    }

    static EntitySettings school() {
      EntitySettings settings = new EntitySettings();
      settings.sections =
          new ArrayList<>(
              List.of(
                  "简介", "校内设施", "社团及学生", "学生", "历史", "概况", "学校设施", "社团、学生与其他势力"));
      settings.listPolicy = ListPolicy.PER_ITEM;
      settings.fieldMap.put("简介", "简介");
      settings.fieldMap.put("校内设施", "校内设施");
      settings.fieldMap.put("学校设施", "校内设施");
      settings.fieldMap.put("学生", "学生与社团");
      settings.fieldMap.put("社团及学生", "学生与社团");
      settings.fieldMap.put("社团、学生与其他势力", "学生与社团");
      settings.fieldMap.put("历史", "历史");
      settings.fieldMap.put("概况", "概况");
      settings.fieldMap.put("基本资料", "基本资料");
      settings.profileKey = "基本资料";
      settings.profile.headerLabels = new ArrayList<>(List.of("基本资料"));
      return settings;
    }

    static EntitySettings student() {
      EntitySettings settings = new EntitySettings();
      settings.sections = new ArrayList<>(List.of("简介", "人物设定", "人物经历", "角色相关"));
      for (String section : settings.sections) {
        settings.fieldMap.put(section, section);
      }
      settings.fieldMap.put("学生档案", "学生档案");
      settings.fieldMap.put("角色台词", "角色台词");
      settings.profileKey = "学生档案";
      settings.profile.headerLabels = new ArrayList<>(List.of("学生档案", "基本资料"));
      settings.profile.relationKey = "相关人物";
      settings.quoteSection = "角色台词";
      settings.excludedNames = new ArrayList<>(List.of("初音未来"));
      return settings;
    }
  }

  @Getter
  @Setter
  public static class Batch {
    /** Run the corpus job once at startup. */
    private boolean enabled = false;

    private EntityKind kind = EntityKind.STUDENT;
    private String inputDir = "data/students/markdown";
    private String outputDir = "data/students/json";
  }

  @Getter
  @Setter
  public static class Executor {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }
}
