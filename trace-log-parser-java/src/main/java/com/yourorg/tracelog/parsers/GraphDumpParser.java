package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Json;
import java.util.List;

public class GraphDumpParser implements StructuredLogParser {

  @Override
  public String name() {
    return "graph_dump";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("graph_dump");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    return FileOutputs.payload(Json.requireText(metadata, "name") + ".txt", lineno, compileId);
  }
}
