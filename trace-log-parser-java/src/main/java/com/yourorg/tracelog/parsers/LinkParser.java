package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Json;
import java.util.List;

/** External links, listed in the compile directory but never written. */
public class LinkParser implements StructuredLogParser {

  @Override
  public String name() {
    return "link_parser";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("link");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    return List.of(ParserOutput.link(Json.requireText(metadata, "name"), Json.requireText(metadata, "url")));
  }
}
