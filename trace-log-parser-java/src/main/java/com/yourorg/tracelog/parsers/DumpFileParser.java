package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.CompileId;
import com.yourorg.tracelog.Envelope;
import com.yourorg.tracelog.Html;
import com.yourorg.tracelog.Json;
import java.util.List;
import java.util.regex.*;

/**
 * Source files dumped once per process. They go to {@code dump_file/} without a suffix, so that
 * {@code dump_file/eval_with_key_3.html#L12} stays a stable link.
 */
public class DumpFileParser implements StructuredLogParser {
  private static final Pattern EVAL_WITH_KEY = Pattern.compile("<eval_with_key>\\.(\\d+)");

  @Override
  public String name() {
    return "dump_file";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    return e.field("dump_file");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode metadata, Integer rank, CompileId compileId, String payload) {
    String name = Json.requireText(metadata, "name");
    String id = evalWithKeyId(name);
    String filename = id != null ? "eval_with_key_" + id + ".html" : name + ".html";
    return List.of(ParserOutput.globalFile("dump_file/" + filename, Html.anchorSource(payload)));
  }

  static String evalWithKeyId(String name) {
    Matcher m = EVAL_WITH_KEY.matcher(name);
    return m.find() ? m.group(1) : null;
  }
}
