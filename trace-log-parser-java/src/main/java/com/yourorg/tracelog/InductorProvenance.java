package com.yourorg.tracelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provenance pages: for every compile directory, the pre-grad graph, the post-grad graph and the
 * generated code side by side, plus the node mappings inductor logged turned into line numbers.
 */
public final class InductorProvenance {
  private static final Logger log = LoggerFactory.getLogger(InductorProvenance.class);

  static final List<String> PRE_GRAD = List.of("before_pre_grad_graph", "inductor_pre_grad_graph");
  static final List<String> POST_GRAD = List.of("after_post_grad_graph", "inductor_post_grad_graph");
  static final List<String> OUTPUT_CODE = List.of("inductor_output_code");
  static final List<String> AOT_CODE = List.of("inductor_aot_wrapper_code");
  static final List<String> NODE_MAPPINGS = List.of("inductor_provenance_tracking_node_mappings");

  private InductorProvenance() {}

  /** Appends {@code provenance_tracking_<dir>.html} for each compile directory of the pass. */
  public static void addPages(ParseContext ctx) throws JsonProcessingException {
    for (var e : ctx.directory.entries()) {
      if (e.getKey() == null) continue;
      String dir = e.getKey().asDirectoryName();
      String pre = fileContent(ctx.output, PRE_GRAD, dir);
      String post = fileContent(ctx.output, POST_GRAD, dir);
      String pyCode = fileContent(ctx.output, OUTPUT_CODE, dir);
      String cppCode = fileContent(ctx.output, AOT_CODE, dir);
      String mappings = fileContent(ctx.output, NODE_MAPPINGS, dir);

      ObjectNode lines = lineMappings(mappings, pre, post, pyCode, cppCode);
      ctx.output.add("provenance_tracking_" + dir + ".html", page(dir, pre, post, pyCode, cppCode, lines));
      log.debug("Provenance page for {}", dir);
    }
  }

  /**
   * Content of the newest output under {@code <dir>/<pattern>}, trying the patterns in order.
   * Empty when none matches.
   */
  static String fileContent(ParseOutput output, List<String> patterns, String dir) {
    for (String pattern : patterns) {
      String needle = dir + "/" + pattern;
      for (int i = output.files.size() - 1; i >= 0; i--) {
        ParseOutput.Entry f = output.files.get(i);
        if (f.path.contains(needle)) return f.content;
      }
    }
    return "";
  }

  /**
   * Turns the logged node mappings into line mappings between the four views. Keys and values are
   * 1-based line numbers; keys are strings. Mappings that are not JSON give an empty object.
   */
  public static ObjectNode lineMappings(String nodeMappings, String pre, String post, String pyCode,
                                        String cppCode) {
    ObjectNode out = Json.MAPPER.createObjectNode();
    JsonNode m = Json.readObject(nodeMappings);
    if (m == null) return out;

    JsonNode kernelToPost = objectAt(m, "cppCodeToPost");
    JsonNode postToKernel = objectAt(m, "postToCppCode");
    List<String> kernels = new ArrayList<>();
    if (kernelToPost != null) kernelToPost.fieldNames().forEachRemaining(kernels::add);

    Map<String, Integer> preLines = nodeLines(pre);
    Map<String, Integer> postLines = nodeLines(post);
    Map<String, List<Integer>> pyLines = pythonKernelLines(pyCode, kernels);
    Map<String, List<Integer>> cppLines = cppKernelLines(cppCode, kernels);

    out.set("preToPost", toJson(nodeToNode(objectAt(m, "preToPost"), preLines, postLines)));
    out.set("postToPre", toJson(nodeToNode(objectAt(m, "postToPre"), postLines, preLines)));
    out.set("pyCodeToPost", toJson(kernelToNode(kernelToPost, pyLines, postLines)));
    out.set("postToPyCode", toJson(nodeToKernel(postToKernel, postLines, pyLines)));
    out.set("cppCodeToPost", toJson(kernelToNode(kernelToPost, cppLines, postLines)));
    out.set("postToCppCode", toJson(nodeToKernel(postToKernel, postLines, cppLines)));
    return out;
  }

  private static JsonNode objectAt(JsonNode n, String f) {
    JsonNode x = Json.present(n, f);
    return x != null && x.isObject() ? x : null;
  }

  static boolean validLine(String line, String commentPrefix) {
    String s = line.trim();
    return !s.isEmpty() && !s.startsWith(commentPrefix);
  }

  /** {@code add_1: "f32[4]" = ...} names node {@code add_1}; comments and blank lines name nothing. */
  static String nodeName(String line) {
    String s = line.trim();
    if (!validLine(s, "#")) return null;
    String beforeEquals = s.split("=", -1)[0];
    String name = beforeEquals.split(":", -1)[0].trim();
    return name.isEmpty() ? null : name;
  }

  /** Node name to the 1-based line defining it; a later definition wins. */
  static Map<String, Integer> nodeLines(String graph) {
    Map<String, Integer> out = new HashMap<>();
    String[] lines = graph.lines().toArray(String[]::new);
    for (int i = 0; i < lines.length; i++) {
      String name = nodeName(lines[i]);
      if (name != null) out.put(name, i + 1);
    }
    return out;
  }

  private static List<String> withoutLeadingBlankLines(String text) {
    List<String> lines = text.lines().collect(Collectors.toList());
    while (!lines.isEmpty() && lines.get(0).isEmpty()) lines.remove(0);
    return lines;
  }

  private static String pureKernelName(String kernel) {
    int colon = kernel.indexOf(':');
    return colon >= 0 ? kernel.substring(0, colon) : kernel;
  }

  private static int firstLineMatching(List<String> lines, Predicate<String> p) {
    for (int i = 0; i < lines.size(); i++) {
      if (p.test(lines.get(i))) return i;
    }
    return 0;
  }

  /**
   * Kernel launch lines in python wrapper code, counted from the {@code # AOT ID:} header. A kernel
   * with a debug handle ({@code name:3}) maps to the first launch after the line naming that
   * handle; otherwise to every line after {@code def call(args)} mentioning the kernel.
   */
  static Map<String, List<Integer>> pythonKernelLines(String code, List<String> kernels) {
    List<String> lines = withoutLeadingBlankLines(code);
    int callLine = firstLineMatching(lines, l -> l.contains("def") && l.contains("call") && l.contains("(args)"));
    int firstLine = firstLineMatching(lines, l -> l.contains("# AOT ID:"));

    Map<String, List<Integer>> out = new LinkedHashMap<>();
    for (String kernel : kernels) {
      String pure = pureKernelName(kernel);
      boolean found = false;
      if (kernel.contains(":")) {
        for (int i = callLine; i < lines.size(); i++) {
          if (!lines.get(i).contains(kernel)) continue;
          for (int j = i + 1; j < lines.size(); j++) {
            if (lines.get(j).contains(pure)) {
              out.computeIfAbsent(kernel, k -> new ArrayList<>()).add(j + 1 - firstLine);
              found = true;
              break;
            }
          }
          break;
        }
      }
      if (!found) {
        for (int i = callLine; i < lines.size(); i++) {
          if (lines.get(i).contains(pure)) out.computeIfAbsent(kernel, k -> new ArrayList<>()).add(i + 1 - firstLine);
        }
      }
    }
    return out;
  }

  /**
   * Kernel launch lines in AOT C++ wrapper code, searched from {@code ::run_impl(} on. Same debug
   * handle rule as the python wrapper, skipping python defs and {@code static inline void} helpers.
   */
  static Map<String, List<Integer>> cppKernelLines(String code, List<String> kernels) {
    List<String> lines = withoutLeadingBlankLines(code);
    int runImpl = firstLineMatching(lines, l -> l.contains("::run_impl("));

    Map<String, List<Integer>> out = new LinkedHashMap<>();
    for (String kernel : kernels) {
      String pure = pureKernelName(kernel);
      boolean found = false;
      if (kernel.contains(":")) {
        for (int i = runImpl; i < lines.size() && !found; i++) {
          String l = lines.get(i);
          if (!validLine(l, "def") || !validLine(l, "static inline void") || !l.contains(kernel)) continue;
          for (int j = i + 1; j < lines.size(); j++) {
            if (lines.get(j).contains(pure)) {
              out.computeIfAbsent(kernel, k -> new ArrayList<>()).add(j + 1);
              found = true;
              break;
            }
          }
        }
      }
      if (!found) {
        for (int i = runImpl; i < lines.size(); i++) {
          if (lines.get(i).contains(pure)) out.computeIfAbsent(kernel, k -> new ArrayList<>()).add(i + 1);
        }
      }
    }
    return out;
  }

  private static Map<Integer, List<Integer>> nodeToNode(JsonNode mappings, Map<String, Integer> from,
                                                        Map<String, Integer> to) {
    Map<Integer, List<Integer>> out = new TreeMap<>();
    if (mappings == null) return out;
    mappings.fields().forEachRemaining(e -> {
      Integer source = from.get(e.getKey());
      if (source == null) return;
      List<Integer> targets = new ArrayList<>();
      for (JsonNode t : e.getValue()) {
        Integer line = t.isTextual() ? to.get(t.asText()) : null;
        if (line != null) targets.add(line);
      }
      if (!targets.isEmpty()) out.put(source, targets);
    });
    return out;
  }

  private static Map<Integer, List<Integer>> kernelToNode(JsonNode mappings, Map<String, List<Integer>> kernels,
                                                          Map<String, Integer> nodes) {
    Map<Integer, List<Integer>> out = new TreeMap<>();
    if (mappings == null) return out;
    mappings.fields().forEachRemaining(e -> {
      List<Integer> kernelLines = kernels.get(e.getKey());
      if (kernelLines == null) return;
      List<Integer> targets = new ArrayList<>();
      for (JsonNode t : e.getValue()) {
        Integer line = t.isTextual() ? nodes.get(t.asText()) : null;
        if (line != null) targets.add(line);
      }
      if (targets.isEmpty()) return;
      for (int k : kernelLines) out.put(k, targets);
    });
    return out;
  }

  private static Map<Integer, List<Integer>> nodeToKernel(JsonNode mappings, Map<String, Integer> nodes,
                                                          Map<String, List<Integer>> kernels) {
    Map<Integer, List<Integer>> out = new TreeMap<>();
    if (mappings == null) return out;
    mappings.fields().forEachRemaining(e -> {
      Integer source = nodes.get(e.getKey());
      if (source == null) return;
      List<Integer> targets = new ArrayList<>();
      for (JsonNode t : e.getValue()) {
        List<Integer> lines = t.isTextual() ? kernels.get(t.asText()) : null;
        if (lines != null) targets.addAll(lines);
      }
      if (!targets.isEmpty()) out.put(source, targets);
    });
    return out;
  }

  private static ObjectNode toJson(Map<Integer, List<Integer>> m) {
    ObjectNode o = Json.MAPPER.createObjectNode();
    for (var e : m.entrySet()) {
      ArrayNode a = o.putArray(String.valueOf(e.getKey()));
      for (int v : e.getValue()) a.add(v);
    }
    return o;
  }

  static String page(String dir, String pre, String post, String pyCode, String cppCode, ObjectNode lines)
      throws JsonProcessingException {
    StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
        .append("<title>Provenance Tracking ").append(Html.escape(dir)).append("</title>\n")
        .append("<style>\n.view pre span { display: block; }\n.view pre span.highlight { background-color: #ffff00; }\n")
        .append("</style>\n</head>\n<body>\n");
    html.append(view("pre", "Pre-grad graph", pre.lines().collect(Collectors.toList())));
    html.append(view("post", "Post-grad graph", post.lines().collect(Collectors.toList())));
    // python kernel lines count from the AOT ID header
    List<String> py = withoutLeadingBlankLines(pyCode);
    int header = firstLineMatching(py, l -> l.contains("# AOT ID:"));
    html.append(view("py", "Generated python code", py.subList(header, py.size())));
    html.append(view("cpp", "AOT wrapper code", withoutLeadingBlankLines(cppCode)));
    // "</" would end the script element early
    String mappings = Json.pretty(lines).replace("</", "<\\/");
    html.append("<script type=\"application/json\" id=\"line-mappings\">\n").append(mappings).append("\n</script>\n");
    html.append("</body></html>\n");
    return html.toString();
  }

  /** One view with a {@code <span id="<prefix>-L<n>">} per line, so mappings can address lines. */
  private static String view(String prefix, String title, List<String> lines) {
    StringBuilder sb = new StringBuilder();
    sb.append("<div class=\"view\" id=\"").append(prefix).append("\">\n<h3>").append(Html.escape(title)).append("</h3>\n<pre>");
    for (int i = 0; i < lines.size(); i++) {
      sb.append("<span id=\"").append(prefix).append("-L").append(i + 1).append("\">")
          .append(Html.escape(lines.get(i))).append("</span>");
    }
    sb.append("</pre>\n</div>\n");
    return sb.toString();
  }
}
