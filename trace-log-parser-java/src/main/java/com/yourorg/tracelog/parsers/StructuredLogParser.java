package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import java.util.List;

/**
 * A (predicate, handler) pair in the dispatch registry. Implement this to add your own analyses
 * and pass the instance through {@code ParseConfig.customParsers}.
 */
public interface StructuredLogParser {

  /** Name used in failure logs and per-handler failure counts. */
  String name();

  /**
   * The metadata this parser wants from {@code e}, or null to skip the record. Every parser whose
   * metadata is non-null runs; matches are not exclusive.
   */
  JsonNode metadata(Envelope e);

  /**
   * Turns one matched record into outputs. Throwing is allowed: the failure is logged, counted
   * under {@link #name()} and the pass moves on.
   *
   * @param payload continuation payload, empty when the record had none
   */
  List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload)
      throws Exception;
}
