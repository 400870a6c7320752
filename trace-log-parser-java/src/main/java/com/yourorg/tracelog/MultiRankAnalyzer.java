package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.node.ArrayNode;
import java.io.IOException;
import java.nio.file.*;
import java.util.*;
import java.util.regex.*;
import java.util.stream.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a full pass per rank log into {@code rank_<n>/}, reads the results back and compares the
 * ranks: compile ids, cache hit/miss order, collective schedules, tensor metadata and estimated
 * runtimes.
 */
public class MultiRankAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(MultiRankAnalyzer.class);

  static final Pattern RANK_LOG = Pattern.compile("dedicated_log_torch_trace_rank_(\\d+)(_.*)?\\.log");

  private final ParseConfig config;
  private final ReportRenderer renderer;

  public MultiRankAnalyzer(ParseConfig config) {
    this(config, new JsonReportRenderer());
  }

  public MultiRankAnalyzer(ParseConfig config, ReportRenderer renderer) {
    this.config = config;
    this.renderer = renderer;
  }

  public MultiRankReport run(Path logDir, Path outDir, boolean overwrite) throws IOException, TraceLogException {
    if (!Files.isDirectory(logDir)) {
      throw new TraceLogException("Input path " + logDir + " must be a directory");
    }
    OutputWriter.setupOutputDirectory(outDir, overwrite);

    List<Map.Entry<Path, Integer>> logs = discoverRankLogs(logDir);
    if (logs.isEmpty()) {
      throw new TraceLogException("No rank log files found in directory " + logDir);
    }
    List<Integer> ranks = logs.stream().map(Map.Entry::getValue).distinct().sorted().collect(Collectors.toList());

    List<RankMetadata> metadata = new ArrayList<>();
    ArrayNode chromium = Json.MAPPER.createArrayNode();
    for (Map.Entry<Path, Integer> l : logs) {
      int rank = l.getValue();
      Path sub = RankArtifactReader.rankDir(outDir, rank);
      System.out.println("Processing rank " + rank + " -> " + sub);

      OutputWriter.setupOutputDirectory(sub, overwrite);
      ParseOutput out = new TraceLogParser(config, renderer).parse(l.getKey());
      OutputWriter.write(out, sub);

      metadata.add(RankArtifactReader.readRankMetadata(sub, rank));
      chromium.addAll(RankArtifactReader.readChromiumEventsWithPid(sub.resolve("chromium_events.json"), rank));
    }

    DivergenceGrouping compileIds = DivergenceGrouper.byCompileIds(metadata);
    DivergenceGrouping cache = DivergenceGrouper.byCacheSequence(metadata);

    if (chromium.size() > 0) {
      OutputWriter.writeString(outDir, "chromium_events.json", Json.pretty(chromium));
    }

    List<GraphRuntime> runtimes = RankArtifactReader.readRuntimeEstimations(outDir, ranks);
    if (!runtimes.isEmpty()) {
      Path p = OutputWriter.writeString(outDir, "runtime_estimations.json", Json.pretty(runtimes));
      System.out.println("Runtime estimations: " + p);
      OutputWriter.writeString(outDir, "chromium_trace_with_runtime.json",
          Json.pretty(RuntimeTraceBuilder.build(runtimes)));
    }
    RuntimeAnalysis analysis = RuntimeAnalyzer.analyze(runtimes);

    List<CollectiveSchedule> schedules = RankArtifactReader.readCollectiveSchedules(outDir, ranks);
    if (!schedules.isEmpty()) {
      Path p = OutputWriter.writeString(outDir, "collective_schedules.json", Json.pretty(schedules));
      System.out.println("Collective schedules: " + p);
    }
    DivergenceGrouping collective = DivergenceGrouper.byCollectiveSchedule(schedules, ranks);
    DivergenceGrouping tensorMeta =
        DivergenceGrouper.byTensorMeta(RankArtifactReader.readTensorMetaFingerprints(outDir, ranks));

    Diagnostics diagnostics = Diagnostics.from(compileIds, cache, collective, tensorMeta, analysis, !runtimes.isEmpty());
    if (diagnostics.anyDivergence()) {
      log.warn("Ranks diverge: compile ids={}, cache={}, collectives={}, tensor meta={}",
          diagnostics.divergence.compileIds, diagnostics.divergence.cache,
          diagnostics.divergence.collective, diagnostics.divergence.tensorMeta);
      for (DivergenceGroup g : diagnostics.cacheGroups) {
        log.info("Cache sequence '{}' on ranks {}", g.sequence, g.ranksLabel());
      }
      for (DivergenceGroup g : diagnostics.collectiveGroups) {
        log.info("Collective schedule '{}' on ranks {}", g.sequence, g.ranksLabel());
      }
    }

    MultiRankReport report = new MultiRankReport();
    report.ranks = ranks;
    for (int r : ranks) report.rankPages.add("rank_" + r + "/" + renderer.indexFileName());
    report.hasChromiumEvents = chromium.size() > 0;
    report.compileIdDivergence = compileIds.divergent;
    report.showDesyncWarning = diagnostics.anyDivergence();
    report.diagnostics = diagnostics;

    OutputWriter.writeString(outDir, "diagnostics.json", renderer.renderDiagnostics(diagnostics));
    OutputWriter.writeString(outDir, renderer.indexFileName(), renderer.renderMultiRankIndex(report));
    System.out.println("Multi-rank report generated under " + outDir);
    return report;
  }

  /** {@code dedicated_log_torch_trace_rank_<n>[_<anything>].log} files, by rank then name. */
  static List<Map.Entry<Path, Integer>> discoverRankLogs(Path dir) throws IOException {
    List<Map.Entry<Path, Integer>> out = new ArrayList<>();
    try (Stream<Path> s = Files.list(dir)) {
      for (Path p : s.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
        Integer rank = rankOf(p.getFileName().toString());
        if (rank != null) out.add(Map.entry(p, rank));
      }
    }
    out.sort(Map.Entry.comparingByValue());
    return out;
  }

  static Integer rankOf(String filename) {
    Matcher m = RANK_LOG.matcher(filename);
    if (!m.matches()) return null;
    try {
      return Integer.parseInt(m.group(1));
    } catch (NumberFormatException tooLarge) {
      return null;
    }
  }
}
