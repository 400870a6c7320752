package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import java.util.List;

/** Like a sentinel dump; the metadata carries graph sizes which are not rendered yet. */
public class DynamoOutputGraphParser implements StructuredLogParser {

  @Override
  public String name() {
    return "dynamo_output_graph";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("dynamo_output_graph");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    return FileOutputs.payload("dynamo_output_graph.txt", lineno, compileId);
  }
}
