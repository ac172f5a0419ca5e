package com.flamingo.ai.wikistructure.service.corpus;

import com.flamingo.ai.wikistructure.service.structure.model.EntityKind;
import java.util.List;

/**
 * Outcome of one corpus run.
 *
 * @param kind entity kind the corpus was read as
 * @param written entity names whose record was written
 * @param excluded entity names skipped by configuration
 * @param failed entity names whose document could not be processed
 * @param rejected file names that do not carry a revision
 */
public record CorpusReport(
    EntityKind kind,
    List<String> written,
    List<String> excluded,
    List<String> failed,
    List<String> rejected) {

  public CorpusReport {
    written = List.copyOf(written);
    excluded = List.copyOf(excluded);
    failed = List.copyOf(failed);
    rejected = List.copyOf(rejected);
  }
}
