package com.flamingo.ai.wikistructure.config;

import com.flamingo.ai.wikistructure.service.corpus.CorpusProcessingService;
import com.flamingo.ai.wikistructure.service.corpus.CorpusReport;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Startup bean that structures one corpus directory when {@code wiki.batch.enabled=true}.
 *
 * <p>Typical invocation:
 *
 * <pre>
 * java -jar wiki-structure-backend.jar --wiki.batch.enabled=true --wiki.batch.kind=SCHOOL \
 *     --wiki.batch.input-dir=data/schools/markdown --wiki.batch.output-dir=data/schools/json
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "wiki.batch", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CorpusBatchRunner implements CommandLineRunner {

  private final CorpusProcessingService corpusProcessingService;
  private final WikiConfig wikiConfig;

  @Override
  public void run(String... args) {
    WikiConfig.Batch batch = wikiConfig.getBatch();
    log.info(
        "Starting {} corpus run: {} -> {}",
        batch.getKind(),
        batch.getInputDir(),
        batch.getOutputDir());

    CorpusReport report =
        corpusProcessingService.processDirectory(
            batch.getKind(), Path.of(batch.getInputDir()), Path.of(batch.getOutputDir()));

    report.rejected().forEach(fileName -> log.warn("Rejected file name: {}", fileName));
    report.failed().forEach(name -> log.warn("Failed entity: {}", name));
    log.info(
        "====== {} corpus summary: {} written, {} excluded, {} failed, {} rejected ======",
        report.kind(),
        report.written().size(),
        report.excluded().size(),
        report.failed().size(),
        report.rejected().size());
  }
}
