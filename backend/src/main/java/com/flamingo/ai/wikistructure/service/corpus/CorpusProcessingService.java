package com.flamingo.ai.wikistructure.service.corpus;

import com.flamingo.ai.wikistructure.config.WikiConfig;
import com.flamingo.ai.wikistructure.exception.DocumentProcessingException;
import com.flamingo.ai.wikistructure.service.structure.EntityStructuringService;
import com.flamingo.ai.wikistructure.service.structure.RevisionSelector;
import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import com.flamingo.ai.wikistructure.service.structure.model.EntityKind;
import com.flamingo.ai.wikistructure.service.structure.model.EntityRecord;
import com.flamingo.ai.wikistructure.service.structure.model.RevisionSelection;
import com.flamingo.ai.wikistructure.service.structure.parsing.BlockTreeParser;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Structures a directory of revisioned wiki Markdown files: {@code <name>_<revision>.md}.
 *
 * <p>Only the newest revision of each entity is read. Documents are independent, so each one is
 * parsed, structured and written by its own task on the corpus executor. A document that fails is
 * logged and counted without affecting the others.
 */
@Service
@Slf4j
public class CorpusProcessingService {

  private static final String MARKDOWN_EXTENSION = ".md";

  private final RevisionSelector revisionSelector;
  private final BlockTreeParser blockTreeParser;
  private final EntityStructuringService entityStructuringService;
  private final EntityRecordWriter entityRecordWriter;
  private final WikiConfig wikiConfig;
  private final MeterRegistry meterRegistry;
  private final Executor executor;

  public CorpusProcessingService(
      RevisionSelector revisionSelector,
      BlockTreeParser blockTreeParser,
      EntityStructuringService entityStructuringService,
      EntityRecordWriter entityRecordWriter,
      WikiConfig wikiConfig,
      MeterRegistry meterRegistry,
      @Qualifier("corpusProcessingExecutor") Executor executor) {
    this.revisionSelector = revisionSelector;
    this.blockTreeParser = blockTreeParser;
    this.entityStructuringService = entityStructuringService;
    this.entityRecordWriter = entityRecordWriter;
    this.wikiConfig = wikiConfig;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
  }

  /**
   * Processes every latest-revision Markdown file of {@code inputDir}.
   *
   * @param kind how the documents are read
   * @param inputDir directory holding {@code <name>_<revision>.md} files
   * @param outputDir directory receiving {@code <name>.json} files
   * @return what was written, skipped and failed
   * @throws DocumentProcessingException if the input directory cannot be listed
   */
  public CorpusReport processDirectory(EntityKind kind, Path inputDir, Path outputDir) {
    RevisionSelection selection = revisionSelector.selectLatest(listMarkdownFiles(inputDir));
    if (selection.latest().isEmpty()) {
      log.warn("No revisioned Markdown files found in {}", inputDir);
    } else {
      log.info(
          "Processing {} {} documents from {} ({} file names rejected)",
          selection.latest().size(),
          kind,
          inputDir,
          selection.rejected().size());
    }

    List<String> excludedNames = wikiConfig.getEntities().forKind(kind).getExcludedNames();
    List<String> excluded = new ArrayList<>();
    Map<String, CompletableFuture<Boolean>> tasks = new LinkedHashMap<>();
    selection
        .latest()
        .forEach(
            (name, fileName) -> {
              if (excludedNames.contains(name)) {
                log.info("Skipping excluded {} '{}'", kind, name);
                excluded.add(name);
                recordOutcome(kind, "excluded");
                return;
              }
              tasks.put(name, submit(kind, name, inputDir.resolve(fileName), outputDir));
            });

    List<String> written = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    tasks.forEach(
        (name, task) -> {
          if (Boolean.TRUE.equals(task.join())) {
            written.add(name);
          } else {
            failed.add(name);
          }
        });

    log.info(
        "Corpus run for {} finished: {} written, {} excluded, {} failed",
        kind,
        written.size(),
        excluded.size(),
        failed.size());
    return new CorpusReport(kind, written, excluded, failed, selection.rejected());
  }

  private CompletableFuture<Boolean> submit(
      EntityKind kind, String name, Path source, Path outputDir) {
    try {
      return CompletableFuture.supplyAsync(
              () -> processDocument(kind, name, source, outputDir), executor)
          .exceptionally(ex -> handleFailure(kind, name, ex));
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(handleFailure(kind, name, e));
    }
  }

  private boolean processDocument(EntityKind kind, String name, Path source, Path outputDir) {
    log.info("Structuring {} '{}' from {}", kind, name, source.getFileName());
    List<BlockNode> nodes;
    try (InputStream in = Files.newInputStream(source)) {
      nodes = blockTreeParser.parse(in, source.getFileName().toString());
    } catch (IOException e) {
      throw new DocumentProcessingException(
          name, "Failed to open " + source + ": " + e.getMessage(), e);
    }
    EntityRecord record = entityStructuringService.structure(kind, name, nodes);
    Path target = entityRecordWriter.write(record, outputDir);
    log.debug("Wrote {} '{}' to {}", kind, name, target);
    recordOutcome(kind, "written");
    return true;
  }

  private boolean handleFailure(EntityKind kind, String name, Throwable ex) {
    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
    log.error("Failed to process {} '{}': {}", kind, name, cause.getMessage(), cause);
    recordOutcome(kind, "failed");
    return false;
  }

  private List<String> listMarkdownFiles(Path inputDir) {
    try (Stream<Path> files = Files.list(inputDir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(fileName -> fileName.endsWith(MARKDOWN_EXTENSION))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Failed to list input directory " + inputDir + ": " + e.getMessage(), e);
    }
  }

  private void recordOutcome(EntityKind kind, String status) {
    meterRegistry
        .counter("wiki_documents_processed_total", "kind", kind.name(), "status", status)
        .increment();
  }
}
