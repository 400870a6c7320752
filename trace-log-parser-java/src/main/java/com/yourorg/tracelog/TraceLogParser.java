package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yourorg.tracelog.parsers.*;
import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pass over a single rank's trace log. Every record goes through the glog grammar, the JSON
 * envelope and every matching handler; problems with a record are counted and the pass moves on.
 * Use a fresh instance per log.
 */
public class TraceLogParser {
  private static final Logger log = LoggerFactory.getLogger(TraceLogParser.class);

  static final String FAKE_KERNEL_HELP =
      "See the custom operator documentation on how to write a fake kernel for this operator.";

  private final ParseConfig config;
  private final ReportRenderer renderer;
  private ParseContext ctx;
  private ShortRawLog shortRaw;
  private List<StructuredLogParser> parsers;

  public TraceLogParser(ParseConfig config) {
    this(config, new JsonReportRenderer());
  }

  public TraceLogParser(ParseConfig config, ReportRenderer renderer) {
    this.config = config;
    this.renderer = renderer;
  }

  public ParseOutput parse(Path path) throws IOException, TraceLogException {
    if (!Files.isRegularFile(path)) {
      throw new TraceLogException(path + " is not a file");
    }
    // malformed UTF-8 is replaced, not fatal
    try (BufferedReader br = new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
      run(br);
    }
    return finish(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
  }

  /** Same as {@link #parse(Path)} without the raw.log copy. */
  public ParseOutput parse(BufferedReader br) throws IOException, TraceLogException {
    run(br);
    return finish(null);
  }

  private void run(BufferedReader br) throws IOException, TraceLogException {
    ctx = new ParseContext(config);
    shortRaw = new ShortRawLog(Year.now(ZoneOffset.UTC).getValue());
    parsers = new ArrayList<>(DefaultParsers.create(config));
    parsers.addAll(config.customParsers);
    StructuredLogParser metricsParser = new CompilationMetricsParser(ctx);
    ParseStats stats = ctx.stats;

    boolean rankFixed = false;
    Integer expectedRank = null;

    LogLineReader r = new LogLineReader(br);
    while (r.next()) {
      int lineno = r.lineno();
      GlogLine g = GlogLine.match(r.line());
      if (g == null) {
        log.warn("Failed to parse glog prefix on line {}", lineno);
        stats.failGlog++;
        continue;
      }

      ObjectNode raw = Json.readObject(g.payload);
      if (raw == null) {
        log.warn("Failed to parse metadata JSON on line {}: {}", lineno, g.payload);
        stats.failJson++;
        continue;
      }

      Envelope e;
      try {
        e = Envelope.decode(raw);
      } catch (IllegalArgumentException ex) {
        log.warn("Failed to parse metadata JSON on line {}: {}", lineno, ex.getMessage());
        stats.failJson++;
        shortRaw.append(raw, g, null, stats);
        continue;
      }

      countUnknownFields(e);

      if (e.isInternEntry()) {
        ctx.internTable.put(e.internId(), e.internString());
        continue;
      }

      String payload = "";
      if (e.hasPayload() != null) {
        payload = r.readContinuation();
        if (!PayloadDigest.matches(payload, e.hasPayload())) {
          log.debug("Payload digest mismatch on line {}", lineno);
          stats.failPayloadMd5++;
        }
      }

      if (rankFixed) {
        if (!Objects.equals(expectedRank, e.rank())) {
          stats.otherRank++;
          shortRaw.append(raw, g, null, stats);
          continue;
        }
      } else if (e.rank() != null) {
        // records before the rank is known are kept
        log.info("Detected rank: {}", e.rank());
        expectedRank = e.rank();
        rankFixed = true;
      }

      stats.ok++;

      CompileId cid = e.compileId();
      List<OutputFile> bucket = ctx.directory.bucket(cid);

      String payloadFilename = null;
      for (StructuredLogParser p : parsers) {
        String f = runParser(lineno, p, e, payload, bucket);
        if (f != null) payloadFilename = f;
      }

      JsonNode metrics = e.field(CompilationMetricsParser.NAME);
      if (metrics != null) {
        ctx.metricsIndex.computeIfAbsent(cid, k -> new ArrayList<>()).add(metrics);
        int before = ctx.outputCount();
        String f = runParser(lineno, metricsParser, e, payload, bucket);
        if (f != null) payloadFilename = f;
        String metricsUrl = cid != null && ctx.outputCount() > before
            ? cid.asDirectoryName() + "/compilation_metrics_" + before + ".json"
            : null;
        collectFailures(metrics, cid, metricsUrl);
      }

      if (config.export) {
        JsonNode guard = e.field("guard_added");
        if (guard != null && !"eval".equals(Json.textAt(guard, "prefix"))) {
          shortRaw.append(raw, g, null, stats);
          continue;
        }
        try {
          handleExportRecord(lineno, e, payload, bucket);
        } catch (IllegalArgumentException ex) {
          log.warn("Export record on line {} is malformed: {}", lineno, ex.getMessage());
          stats.parserFailed("export");
        }
      }

      boolean chromium = e.has("chromium_event");
      if (chromium) {
        JsonNode event;
        try {
          event = Json.MAPPER.readTree(payload);
        } catch (IOException ex) {
          throw new TraceLogException("Chromium event on line " + lineno + " is not JSON", ex);
        }
        if (event == null || event.isMissingNode()) {
          throw new TraceLogException("Chromium event on line " + lineno + " has no payload");
        }
        ctx.chromiumEvents.add(event);
      }

      indexRecord(e, cid);

      if (payloadFilename == null && e.hasPayload() != null && !payload.isEmpty() && !chromium) {
        payloadFilename = "payloads/" + e.hasPayload() + ".txt";
        ctx.output.add(payloadFilename, payload);
      }

      if (!chromium) {
        shortRaw.append(raw, g, payloadFilename, stats);
      }
    }
  }

  private void countUnknownFields(Envelope e) {
    List<String> fields = e.kindFields();
    boolean claimedByCustom = false;
    for (StructuredLogParser p : config.customParsers) {
      if (p.metadata(e) != null) claimedByCustom = true;
    }
    if (claimedByCustom) return;
    for (String k : fields) {
      if (Envelope.KNOWN_KINDS.contains(k)) continue;
      ctx.stats.unknown++;
      ctx.output.unknownFields.add(k);
      if (config.verbose) log.info("Unknown field {}", k);
    }
  }

  /**
   * Runs one handler on a record and applies its outputs. Returns the last payload file the handler
   * wrote, or null.
   */
  private String runParser(int lineno, StructuredLogParser p, Envelope e, String payload, List<OutputFile> bucket) {
    JsonNode md = p.metadata(e);
    if (md == null) return null;

    List<ParserOutput> results;
    try {
      results = p.parse(lineno, md, e.rank(), e.compileId(), payload);
    } catch (Exception ex) {
      if (DynamoGuardParser.NAME.equals(p.name())) {
        log.warn("Failed to parse guards json on line {}: {}", lineno, ex.getMessage());
        ctx.stats.failDynamoGuardsJson++;
      } else {
        log.warn("Parser {} failed on line {}: {}", p.name(), lineno, ex.toString());
        ctx.stats.parserFailed(p.name());
      }
      return null;
    }

    String payloadFilename = null;
    for (ParserOutput o : results) {
      switch (o.kind) {
        case FILE -> ctx.addFileOutput(ParseContext.addUniqueSuffix(o.path, ctx.outputCount()), o.content, bucket);
        case GLOBAL_FILE -> ctx.addFileOutput(o.path, o.content, bucket);
        case PAYLOAD_FILE -> {
          String f = ParseContext.addUniqueSuffix(o.path, ctx.outputCount());
          payloadFilename = f;
          ctx.addFileOutput(f, payload, bucket);
        }
        case PAYLOAD_REFORMAT_FILE -> {
          String f = ParseContext.addUniqueSuffix(o.path, ctx.outputCount());
          try {
            String formatted = o.formatter.format(payload);
            payloadFilename = f;
            ctx.addFileOutput(f, formatted, bucket);
          } catch (Exception ex) {
            log.warn("Failed to format payload for {}: {}", f, ex.getMessage());
            ctx.stats.parserFailed(p.name());
          }
        }
        case LINK -> bucket.add(new OutputFile(o.linkUrl, o.linkName, ctx.nextNumber(), "", null));
      }
    }
    return payloadFilename;
  }

  private void collectFailures(JsonNode m, CompileId cid, String metricsUrl) throws TraceLogException {
    String id = cid != null ? cid.toString() : "(unknown)";
    JsonNode restarts = Json.present(m, "restart_reasons");
    if (restarts != null) {
      for (JsonNode reason : restarts) {
        ctx.failures.add(new FailureEntry(id, metricsUrl, "restart", reason.asText()));
      }
    }
    String failType = Json.textAt(m, "fail_type");
    if (failType != null) {
      String reason = Json.textAt(m, "fail_reason");
      if (reason == null) {
        throw new TraceLogException("Fail reason not found for compile " + id);
      }
      String file = Json.textAt(m, "fail_user_frame_filename");
      Long line = Json.longAtOrNull(m, "fail_user_frame_lineno");
      String text = failType + ": " + reason + " (" + (file != null ? file : "N/A") + ":" + (line != null ? line : 0) + ")";
      ctx.failures.add(new FailureEntry(id, metricsUrl, "failure", text));
    }
  }

  private void handleExportRecord(int lineno, Envelope e, String payload, List<OutputFile> bucket) {
    JsonNode guard = e.field("guard_added");
    if (guard != null) {
      String reason = "When exporting, the following guard was evaluated: " + Json.requireText(guard, "expr")
          + ". This might have resulted in a constraint violation error.";
      handleGuard("Guard Evaluated", reason, lineno, e, payload, bucket);
    }

    JsonNode prov = e.field("propagate_real_tensors_provenance");
    if (prov != null) {
      String reason = "When exporting, we were unable to figure out if the expression "
          + Json.requireText(prov, "expr") + " always holds. As a result, it was specialized to evaluate to "
          + Json.requireText(prov, "result") + ", and asserts were inserted into the graph.";
      handleGuard("Data Dependent Error", reason, lineno, e, payload, bucket);
    }

    JsonNode missing = e.field("missing_fake_kernel");
    if (missing != null) {
      ctx.exportFailures.add(new ExportFailure("Missing Fake Kernel",
          "torch.ops." + Json.requireText(missing, "op") + " is missing a fake kernel implementation",
          FAKE_KERNEL_HELP));
    }

    JsonNode mismatched = e.field("mismatched_fake_kernel");
    if (mismatched != null) {
      ctx.exportFailures.add(new ExportFailure("Mismatched Fake Kernel",
          "torch.ops." + Json.requireText(mismatched, "op")
              + " has a fake kernel implementation, but it has incorrect behavior, based on the real kernel. "
              + "The reason for the mismatch is: " + Json.requireText(mismatched, "reason"),
          FAKE_KERNEL_HELP));
    }

    JsonNode created = e.field("expression_created");
    if (created != null) {
      SymExprInfo info = SymExprInfo.fromExpressionCreated(created);
      ctx.symExprs.put(info.resultId, info);
    }

    JsonNode unbacked = e.field("create_unbacked_symbol");
    if (unbacked != null) {
      SymExprInfo info = SymExprInfo.fromUnbackedSymbol(unbacked);
      ctx.symExprs.put(info.resultId, info);
    }
  }

  private void handleGuard(String failureType, String reason, int lineno, Envelope e, String payload,
                           List<OutputFile> bucket) {
    int before = ctx.outputCount();
    runParser(lineno, new SymbolicGuardParser(ctx), e, payload, bucket);
    String info;
    if (ctx.outputCount() > before) {
      String filename = "symbolic_guard_information_" + before + ".html";
      info = "See " + CompileId.directoryFor(e.compileId(), lineno) + "/" + filename + " for more information.";
    } else {
      info = "No symbolic guard information could be rendered for line " + lineno + ".";
    }
    ctx.exportFailures.add(new ExportFailure(failureType, reason, info));
  }

  /** Feeds the pass-wide indices later records look things up in. */
  private void indexRecord(Envelope e, CompileId cid) {
    JsonNode spec = e.field("symbolic_shape_specialization");
    if (spec != null) ctx.specializations.add(cid, spec);

    JsonNode fast = e.field("guard_added_fast");
    if (fast != null) ctx.guardsAddedFast.add(cid, fast);

    JsonNode start = e.field("dynamo_start");
    JsonNode stackJson = start != null ? Json.present(start, "stack") : null;
    if (stackJson != null) {
      try {
        List<FrameSummary> stack = FrameSummary.listFrom(stackJson);
        FrameSummary.removeConvertFrameSuffixes(stack, ctx.internTable);
        ctx.stackIndex.put(cid, stack);
        ctx.stackTrie.insert(stack, cid, ctx.internTable);
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring malformed dynamo_start stack for {}: {}", cid, ex.getMessage());
      }
    }

    JsonNode unknownStack = e.field("stack");
    if (unknownStack != null && unknownStack.isArray()) {
      try {
        ctx.unknownStackTrie.insert(FrameSummary.listFrom(unknownStack), null, ctx.internTable);
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring malformed stack record: {}", ex.getMessage());
      }
    }
  }

  private ParseOutput finish(String rawLog) throws IOException, TraceLogException {
    ParseOutput out = ctx.output;
    ParseStats stats = ctx.stats;

    if (config.export) {
      out.add("export_failures.json", Json.pretty(ctx.exportFailures));
      out.add(renderer.indexFileName(), renderer.renderExportIndex(ctx));
    } else {
      out.add("failures_and_restarts.json", Json.pretty(ctx.failures));
      out.add("chromium_events.json", Json.pretty(ctx.chromiumEvents));
      out.add("compile_directory.json", Json.pretty(ctx.directory.toJson()));
      out.add(renderer.indexFileName(), renderer.renderRankIndex(ctx));
      if (rawLog != null) out.add("raw.log", rawLog);
      out.add("raw.jsonl", shortRaw.render(ctx.internTable));
    }

    log.info("{}", stats);
    if (!out.unknownFields.isEmpty()) {
      log.warn("Unknown fields: {} (consider adding a parser for these)", out.unknownFields);
    }

    // other_rank counts here: a log configured properly only has one rank
    if (config.strict && stats.strictFailureTotal() > 0) {
      throw new TraceLogException("Something went wrong: " + stats);
    }
    if (config.strictCompileId && ctx.directory.hasUnknown()) {
      throw new TraceLogException("Some log entries did not have compile id");
    }
    if (config.inductorProvenance && !config.export) {
      InductorProvenance.addPages(ctx);
    }
    return out;
  }
}
