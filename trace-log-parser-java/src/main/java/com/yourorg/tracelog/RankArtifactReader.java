package com.yourorg.tracelog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.stream.*;

/**
 * Reads the per-rank outputs of a multi-rank run back from {@code <out>/rank_<n>/}. Directory
 * listings are sorted so repeated runs see files in the same order.
 */
public final class RankArtifactReader {

  public static final String COLLECTIVE_SCHEDULE_PREFIX = "inductor_collective_schedule";
  public static final String RUNTIME_AND_TENSOR_META_PREFIX = "inductor_runtime_and_tensor_meta";

  private RankArtifactReader() {}

  public static Path rankDir(Path outDir, int rank) {
    return outDir.resolve("rank_" + rank);
  }

  /**
   * Compile ids and cache sequence of one rank. Unknown buckets are not compile ids; artifacts
   * without a cache glyph do not take part in the sequence.
   */
  public static RankMetadata readRankMetadata(Path rankDir, int rank) throws IOException {
    RankMetadata md = new RankMetadata();
    md.rank = rank;
    Path file = rankDir.resolve("compile_directory.json");
    // export passes write no compile directory
    if (!Files.exists(file)) return md;
    String content = Files.readString(file, StandardCharsets.UTF_8);
    ObjectNode dir = Json.readObject(content);
    if (dir == null) return md;

    List<long[]> order = new ArrayList<>();
    List<String> suffixes = new ArrayList<>();
    dir.fields().forEachRemaining(e -> {
      String key = e.getKey();
      if (!key.equals(CompileDirectory.UNKNOWN_KEY) && !key.startsWith("unknown_")) {
        md.compileIds.add(key);
      }
      JsonNode artifacts = Json.present(e.getValue(), "artifacts");
      if (artifacts == null) return;
      for (JsonNode a : artifacts) {
        String suffix = Json.textAt(a, "suffix");
        Long number = Json.longAtOrNull(a, "number");
        if (suffix == null || suffix.isEmpty() || number == null) continue;
        order.add(new long[] {number, suffixes.size()});
        suffixes.add(suffix);
      }
    });
    order.sort(Comparator.comparingLong(x -> x[0]));
    StringBuilder seq = new StringBuilder();
    for (long[] o : order) seq.append(suffixes.get((int) o[1]));
    md.cacheSequence = seq.toString();
    return md;
  }

  /** Chromium events of one rank with {@code pid} set to the rank; unreadable files give nothing. */
  public static List<JsonNode> readChromiumEventsWithPid(Path path, int rank) throws IOException {
    List<JsonNode> out = new ArrayList<>();
    if (!Files.exists(path)) return out;
    JsonNode events;
    try {
      events = Json.MAPPER.readTree(Files.readString(path, StandardCharsets.UTF_8));
    } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
      return out;
    }
    if (events == null || !events.isArray()) return out;
    for (JsonNode ev : events) {
      if (ev.isObject()) ((ObjectNode) ev).put("pid", rank);
      out.add(ev);
    }
    return out;
  }

  public static List<GraphRuntime> readRuntimeEstimations(Path outDir, List<Integer> ranks) throws IOException {
    return readArtifacts(outDir, ranks, RUNTIME_AND_TENSOR_META_PREFIX, (content, rank, graph) -> {
      JsonNode ops = Json.MAPPER.readTree(content).get("ops");
      if (ops == null || !ops.isArray()) throw new IOException("no ops array");
      List<OpRuntime> list = Json.MAPPER.convertValue(ops, new TypeReference<List<OpRuntime>>() {});
      return list.isEmpty() ? null : new GraphRuntime(rank, graph, list);
    });
  }

  public static List<TensorMetaFingerprint> readTensorMetaFingerprints(Path outDir, List<Integer> ranks)
      throws IOException {
    return readArtifacts(outDir, ranks, RUNTIME_AND_TENSOR_META_PREFIX,
        (content, rank, graph) -> new TensorMetaFingerprint(rank, graph, Json.compact(Json.MAPPER.readTree(content))));
  }

  public static List<CollectiveSchedule> readCollectiveSchedules(Path outDir, List<Integer> ranks) throws IOException {
    return readArtifacts(outDir, ranks, COLLECTIVE_SCHEDULE_PREFIX, (content, rank, graph) -> {
      List<String> ops = Json.MAPPER.readValue(content, new TypeReference<List<String>>() {});
      return ops.isEmpty() ? null : new CollectiveSchedule(rank, graph, ops);
    });
  }

  @FunctionalInterface
  interface ContentParser<T> {
    /** Null skips the file. */
    T parse(String content, int rank, String graph) throws IOException;
  }

  /**
   * For every compile directory under every rank, parses the first {@code <prefix>*.json} file.
   * The graph id is the compile directory's name. Ranks without an output directory are skipped.
   */
  static <T> List<T> readArtifacts(Path outDir, List<Integer> ranks, String prefix, ContentParser<T> parser)
      throws IOException {
    List<T> results = new ArrayList<>();
    for (int rank : ranks) {
      Path rankDir = rankDir(outDir, rank);
      if (!Files.isDirectory(rankDir)) continue;
      for (Path compileDir : sortedList(rankDir, Files::isDirectory)) {
        Optional<Path> file = sortedList(compileDir, p -> {
          String name = p.getFileName().toString();
          return Files.isRegularFile(p) && name.endsWith(".json") && name.startsWith(prefix);
        }).stream().findFirst();
        if (file.isEmpty()) continue;

        String content = Files.readString(file.get(), StandardCharsets.UTF_8);
        String graph = compileDir.getFileName().toString();
        T r;
        try {
          r = parser.parse(content, rank, graph);
        } catch (IOException e) {
          throw new IOException("Reading " + prefix + " for rank " + rank + ": " + e.getMessage(), e);
        }
        if (r != null) results.add(r);
      }
    }
    return results;
  }

  private static List<Path> sortedList(Path dir, java.util.function.Predicate<Path> keep) throws IOException {
    try (Stream<Path> s = Files.list(dir)) {
      return s.filter(keep).sorted().collect(Collectors.toList());
    }
  }
}
