package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State owned by a single pass: the intern table, the cross-record indices, the output list and
 * the compile directory. Handlers that need earlier records get this object, never globals.
 */
public class ParseContext {
  private static final Logger log = LoggerFactory.getLogger(ParseContext.class);

  static final String STACK_TRACES_PREFIX = "inductor_provenance_tracking_kernel_stack_traces";

  public final ParseConfig config;
  public final ParseStats stats = new ParseStats();
  public final InternTable internTable = new InternTable();
  public final ParseOutput output = new ParseOutput();
  public final CompileDirectory directory = new CompileDirectory();

  public final Map<CompileId, List<FrameSummary>> stackIndex = new HashMap<>();
  public final CompileIdIndex<JsonNode> specializations = new CompileIdIndex<>();
  public final CompileIdIndex<JsonNode> guardsAddedFast = new CompileIdIndex<>();
  public final Map<Long, SymExprInfo> symExprs = new HashMap<>();

  /** dynamo_start stacks, by the compile they started. */
  public final StackTrie stackTrie = new StackTrie();
  /** Top-level {@code stack} records, logged outside any compile. */
  public final StackTrie unknownStackTrie = new StackTrie();
  /** Every compilation_metrics record, by compile id; the tries read outcomes from here. */
  public final Map<CompileId, List<JsonNode>> metricsIndex = new HashMap<>();

  public final ArrayNode chromiumEvents = Json.MAPPER.createArrayNode();
  public final List<FailureEntry> failures = new ArrayList<>();
  public final List<ExportFailure> exportFailures = new ArrayList<>();

  private int outputCount = 0;

  public ParseContext(ParseConfig config) {
    this.config = config;
    output.stats = stats;
    output.directory = directory;
  }

  /** Sequence number the next output will get. */
  public int outputCount() {
    return outputCount;
  }

  /** Hands out the current sequence number and moves past it. */
  public int nextNumber() {
    return outputCount++;
  }

  /**
   * Records a file in the global output and in {@code bucket}. Kernel stack trace dumps also get a
   * readable HTML page next to them, numbered just before the dump itself.
   */
  public OutputFile addFileOutput(String path, String content, List<OutputFile> bucket) {
    String readable = isStackTracesFile(path) ? addStackTracesHtml(path, content) : null;
    output.add(path, content);
    int number = nextNumber();
    OutputFile f = new OutputFile(path, path, number, CacheStatus.fromFilename(path).glyph, readable);
    bucket.add(f);
    return f;
  }

  /** {@code dir/stem.ext} becomes {@code dir/stem_<n>.ext}. */
  public static String addUniqueSuffix(String path, int n) {
    int slash = path.lastIndexOf('/');
    String dir = path.substring(0, slash + 1);
    String name = path.substring(slash + 1);
    if (name.isEmpty()) return path;
    int dot = name.lastIndexOf('.');
    if (dot <= 0) return dir + name + "_" + n;
    return dir + name.substring(0, dot) + "_" + n + name.substring(dot);
  }

  static boolean isStackTracesFile(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    return name.startsWith(STACK_TRACES_PREFIX) && name.endsWith(".json");
  }

  private String addStackTracesHtml(String jsonPath, String content) {
    JsonNode parsed;
    try {
      parsed = Json.MAPPER.readTree(content);
    } catch (Exception e) {
      log.warn("Stack traces file {} is not JSON, no readable page: {}", jsonPath, e.getMessage());
      return null;
    }
    StringBuilder html = new StringBuilder("<html><body>\n");
    if (parsed != null && parsed.isObject()) {
      parsed.fields().forEachRemaining(kernel -> {
        html.append("<h3>").append(Html.escape(kernel.getKey())).append("</h3>\n");
        for (JsonNode t : kernel.getValue()) {
          if (!t.isTextual()) continue;
          String decoded = t.asText().replace("\\n", "\n").replaceAll("\n+$", "");
          html.append(Html.pre(decoded)).append('\n');
        }
      });
    }
    html.append("</body></html>\n");

    int dot = jsonPath.lastIndexOf('.');
    String htmlPath = jsonPath.substring(0, dot) + "_readable.html";
    output.add(htmlPath, html.toString());
    nextNumber();
    return htmlPath;
  }
}
