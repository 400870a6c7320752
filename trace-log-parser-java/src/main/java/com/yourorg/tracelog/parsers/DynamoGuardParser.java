package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Html;
import com.yourorg.tracelog.Json;
import java.util.*;

/**
 * Guard list of a compile. The payload is a JSON array of {@code {"code": ...}} objects; anything
 * else fails the handler and is counted as a guards JSON failure.
 */
public class DynamoGuardParser implements StructuredLogParser {
  public static final String NAME = "dynamo_guards";

  private final boolean plainText;

  public DynamoGuardParser(boolean plainText) {
    this.plainText = plainText;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field(NAME);
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload)
      throws Exception {
    JsonNode guards = Json.MAPPER.readTree(payload);
    if (guards == null || !guards.isArray()) {
      throw new IllegalArgumentException("guards payload is not a JSON array");
    }
    List<String> codes = new ArrayList<>();
    for (JsonNode g : guards) codes.add(Json.requireText(g, "code"));

    if (plainText) {
      return FileOutputs.file(NAME + ".txt", lineno, compileId, String.join("\n", codes));
    }
    StringBuilder html = new StringBuilder("<html><body>\n<h2>Guards</h2>\n<ul>\n");
    for (String c : codes) html.append("<li><code>").append(Html.escape(c)).append("</code></li>\n");
    html.append("</ul>\n</body></html>\n");
    return FileOutputs.file(NAME + ".html", lineno, compileId, html.toString());
  }
}
