package com.flamingo.ai.wikistructure.service.structure.parsing;

import com.flamingo.ai.wikistructure.service.structure.model.BlockNode;
import java.io.InputStream;
import java.util.List;

/**
 * Parses wiki page markup into the top-level {@link BlockNode} sequence the structuring components
 * work on.
 *
 * <p>Implementations must be stateless so a single instance can be shared across concurrent
 * document-processing threads.
 */
public interface BlockTreeParser {

  /**
   * Parses markup held in memory.
   *
   * @param markup page markup
   * @return top-level nodes in document order
   */
  List<BlockNode> parse(String markup);

  /**
   * Parses a UTF-8 byte stream.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param inputStream raw page bytes
   * @param documentName name used in error reports
   * @return top-level nodes in document order
   */
  List<BlockNode> parse(InputStream inputStream, String documentName);
}
