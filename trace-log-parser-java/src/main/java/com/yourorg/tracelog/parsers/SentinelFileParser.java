package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import java.util.List;

/** Dumps the payload of records whose kind field is just a {@code {}} marker to {@code <kind>.txt}. */
public class SentinelFileParser implements StructuredLogParser {
  private final String kind;

  public SentinelFileParser(String kind) {
    this.kind = kind;
  }

  @Override
  public String name() {
    return kind;
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field(kind);
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    return FileOutputs.payload(kind + ".txt", lineno, compileId);
  }
}
