package com.flamingo.ai.wikistructure.service.structure.model;

/**
 * A voice line read from a quotes table.
 *
 * @param occasion when the line is spoken (first column)
 * @param line the line itself (second column)
 */
public record QuoteEntry(String occasion, String line) {}
