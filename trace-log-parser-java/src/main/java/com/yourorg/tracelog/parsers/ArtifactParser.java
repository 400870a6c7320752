package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Json;
import java.util.List;

/** Named artifacts: {@code string} payloads are kept as is, {@code json} ones are pretty-printed. */
public class ArtifactParser implements StructuredLogParser {

  @Override
  public String name() {
    return "artifact";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("artifact");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    String name = Json.requireText(metadata, "name");
    String encoding = Json.requireText(metadata, "encoding");
    switch (encoding) {
      case "string":
        return FileOutputs.payload(name + ".txt", lineno, compileId);
      case "json":
        return FileOutputs.reformatted(name + ".json", lineno, compileId, ArtifactParser::prettyJson);
      default:
        throw new IllegalArgumentException("Unsupported encoding: " + encoding);
    }
  }

  /** Pretty JSON, or the payload untouched when it does not parse. */
  static String prettyJson(String payload) throws Exception {
    JsonNode n;
    try {
      n = Json.MAPPER.readTree(payload);
    } catch (Exception notJson) {
      return payload;
    }
    return n == null ? payload : Json.pretty(n);
  }
}
