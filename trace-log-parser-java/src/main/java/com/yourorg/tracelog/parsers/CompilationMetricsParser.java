package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yourorg.tracelog.*;
import java.util.*;

/**
 * Summary page of one compile. Runs after the registry, so it sees every artifact the compile
 * produced so far, and takes the specializations and fast guards recorded for the compile id.
 */
public class CompilationMetricsParser implements StructuredLogParser {
  public static final String NAME = "compilation_metrics";

  private final ParseContext ctx;

  public CompilationMetricsParser(ParseContext ctx) {
    this.ctx = ctx;
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
  public List<ParserOutput> parse(int lineno, JsonNode m, Integer rank, CompileId compileId, String payload)
      throws Exception {
    InternTable strings = ctx.internTable;
    ObjectNode out = Json.MAPPER.createObjectNode();
    out.put("compile_id", compileId != null ? compileId.toString() : "(unknown)");
    out.set("metrics", m);

    List<FrameSummary> stack = ctx.stackIndex.get(compileId);
    out.set("stack", renderFrames(stack != null ? stack : List.of(), strings));

    String coName = Json.textAt(m, "co_name");
    String coFilename = Json.textAt(m, "co_filename");
    Long coLine = Json.longAtOrNull(m, "co_firstlineno");
    if (coName != null && coFilename != null && coLine != null) {
      FrameSummary f = new FrameSummary();
      f.uninternedFilename = coFilename;
      f.line = coLine;
      f.name = coName;
      out.set("mini_stack", renderFrames(List.of(f), strings));
    } else {
      out.set("mini_stack", Json.MAPPER.createArrayNode());
    }

    ArrayNode specs = out.putArray("symbolic_shape_specializations");
    for (JsonNode spec : ctx.specializations.take(compileId)) {
      ObjectNode s = specs.addObject();
      s.put("symbol", textOrEmpty(spec, "symbol"));
      JsonNode sources = Json.present(spec, "sources");
      s.set("sources", sources != null ? sources : Json.MAPPER.createArrayNode());
      s.put("value", textOrEmpty(spec, "value"));
      s.set("user_stack", renderFrames(FrameSummary.listFrom(Json.present(spec, "user_stack")), strings));
      s.set("stack", renderFrames(FrameSummary.listFrom(Json.present(spec, "stack")), strings));
    }

    ArrayNode guards = out.putArray("guards_added_fast");
    for (JsonNode guard : ctx.guardsAddedFast.take(compileId)) {
      ObjectNode g = guards.addObject();
      g.put("expr", textOrEmpty(guard, "expr"));
      g.set("user_stack", renderFrames(FrameSummary.listFrom(Json.present(guard, "user_stack")), strings));
      g.set("stack", renderFrames(FrameSummary.listFrom(Json.present(guard, "stack")), strings));
    }

    // links on the page are relative to the compile directory
    ArrayNode files = out.putArray("output_files");
    for (OutputFile f : new ArrayList<>(ctx.directory.bucket(compileId))) {
      ObjectNode o = files.addObject();
      o.put("url", removeFirstSegment(f.url));
      o.put("name", removeFirstSegment(f.name));
      o.put("number", f.number);
      o.put("suffix", f.suffix);
      if (f.readableUrl != null) o.put("readable_url", removeFirstSegment(f.readableUrl));
      else o.putNull("readable_url");
    }

    return FileOutputs.file(NAME + ".json", lineno, compileId, Json.pretty(out));
  }

  static ArrayNode renderFrames(List<FrameSummary> frames, InternTable strings) {
    ArrayNode a = Json.MAPPER.createArrayNode();
    for (FrameSummary f : frames) a.add(f.render(strings));
    return a;
  }

  private static String textOrEmpty(JsonNode n, String f) {
    String s = Json.textAt(n, f);
    return s != null ? s : "";
  }

  static String removeFirstSegment(String url) {
    int i = url.indexOf('/');
    return i >= 0 ? url.substring(i + 1).replace("/", "") : "";
  }
}
