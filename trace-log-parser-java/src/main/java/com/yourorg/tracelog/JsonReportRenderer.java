package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.*;

/** Landing pages as pretty JSON documents. */
public class JsonReportRenderer implements ReportRenderer {

  @Override
  public String indexFileName() {
    return "index.json";
  }

  @Override
  public String renderRankIndex(ParseContext ctx) throws IOException {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.set("directory", ctx.directory.toJson());
    ArrayNode names = root.putArray("directory_names");
    for (var e : ctx.directory.entries()) {
      names.add(e.getKey() == null ? "(unknown)" : e.getKey().asDirectoryName());
    }
    ObjectNode stacks = root.putObject("stacks");
    for (var e : ctx.stackIndex.entrySet()) {
      String key = e.getKey() == null ? "(unknown)" : e.getKey().toString();
      ArrayNode frames = stacks.putArray(key);
      for (FrameSummary f : e.getValue()) frames.add(f.render(ctx.internTable));
    }
    root.set("stack_trie", ctx.stackTrie.toJson(ctx.metricsIndex));
    root.set("unknown_stack_trie", ctx.unknownStackTrie.toJson(ctx.metricsIndex));
    root.put("has_unknown_stack_trie", !ctx.unknownStackTrie.isEmpty());
    root.put("num_breaks", ctx.failures.size());
    root.put("has_chromium_events", ctx.chromiumEvents.size() > 0);
    root.set("stats", Json.MAPPER.valueToTree(ctx.stats));
    ArrayNode unknown = root.putArray("unknown_fields");
    for (String f : ctx.output.unknownFields) unknown.add(f);
    return Json.pretty(root);
  }

  @Override
  public String renderExportIndex(ParseContext ctx) throws IOException {
    ObjectNode root = Json.MAPPER.createObjectNode();
    root.set("directory", ctx.directory.toJson());
    root.set("failures", Json.MAPPER.valueToTree(ctx.exportFailures));
    root.put("num_failures", ctx.exportFailures.size());
    root.put("success", ctx.exportFailures.isEmpty());
    String exported = "";
    for (OutputFile f : ctx.directory.allFiles()) {
      if (f.url.contains("exported_program")) {
        exported = f.url;
        break;
      }
    }
    root.put("exported_program_url", exported);
    return Json.pretty(root);
  }

  @Override
  public String renderMultiRankIndex(MultiRankReport report) throws IOException {
    return Json.pretty(report);
  }

  @Override
  public String renderDiagnostics(Diagnostics diagnostics) throws IOException {
    return Json.pretty(diagnostics);
  }
}
