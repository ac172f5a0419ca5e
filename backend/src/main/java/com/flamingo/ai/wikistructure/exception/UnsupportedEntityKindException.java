package com.flamingo.ai.wikistructure.exception;

/** Exception thrown when a request names an entity kind the pipeline does not know. */
public class UnsupportedEntityKindException extends RuntimeException {

  private final String kind;

  public UnsupportedEntityKindException(String kind) {
    super("Unsupported entity kind: " + kind);
    this.kind = kind;
  }

  public String getKind() {
    return kind;
  }
}
