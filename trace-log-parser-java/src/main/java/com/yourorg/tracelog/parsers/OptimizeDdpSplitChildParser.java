package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Json;
import java.util.List;

public class OptimizeDdpSplitChildParser implements StructuredLogParser {

  @Override
  public String name() {
    return "optimize_ddp_split_child";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("optimize_ddp_split_child");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    String filename = "optimize_ddp_split_child_" + Json.requireText(metadata, "name") + ".txt";
    return FileOutputs.payload(filename, lineno, compileId);
  }
}
