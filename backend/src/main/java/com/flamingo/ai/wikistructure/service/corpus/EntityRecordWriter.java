package com.flamingo.ai.wikistructure.service.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.wikistructure.exception.DocumentProcessingException;
import com.flamingo.ai.wikistructure.service.structure.model.EntityRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Writes the fields of an {@link EntityRecord} as pretty-printed JSON named after the entity. */
@Component
@RequiredArgsConstructor
public class EntityRecordWriter {

  private final ObjectMapper objectMapper;

  /**
   * Writes {@code <outputDir>/<record name>.json}, replacing any previous file.
   *
   * @return the written file
   */
  public Path write(EntityRecord record, Path outputDir) {
    Path target = outputDir.resolve(record.name() + ".json");
    try {
      Files.createDirectories(outputDir);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), record.fields());
      return target;
    } catch (IOException e) {
      throw new DocumentProcessingException(
          record.name(), "Failed to write " + target + ": " + e.getMessage(), e);
    }
  }
}
