package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Json;
import java.util.List;

/** Backward-pass metrics records, written as {@code <kind>.json} next to the rest of the compile. */
public class MetricsJsonParser implements StructuredLogParser {
  private final String kind;

  public MetricsJsonParser(String kind) {
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
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload)
      throws Exception {
    ObjectNode out = Json.MAPPER.createObjectNode();
    out.put("compile_id", compileId != null ? compileId.toString() : "(unknown)");
    out.set("metrics", metadata);
    return FileOutputs.file(kind + ".json", lineno, compileId, Json.pretty(out));
  }
}
