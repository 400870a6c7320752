package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;

/**
 * Prefix tree of stacks, outermost frame first. Nodes live in one list and point at their
 * children by index. A stack that ends at a node leaves the compile id it was logged with there;
 * a null id stands for a stack logged outside any compile.
 */
public class StackTrie {

  static final class Node {
    final String frame;
    final Map<String, Integer> children = new LinkedHashMap<>();
    final List<CompileId> compileIds = new ArrayList<>();

    Node(String frame) {
      this.frame = frame;
    }
  }

  private final List<Node> nodes = new ArrayList<>();

  public StackTrie() {
    nodes.add(new Node(null));
  }

  public void insert(List<FrameSummary> stack, CompileId cid, InternTable table) {
    int at = 0;
    for (FrameSummary f : stack) {
      String key = f.render(table);
      Integer child = nodes.get(at).children.get(key);
      if (child == null) {
        child = nodes.size();
        nodes.add(new Node(key));
        nodes.get(at).children.put(key, child);
      }
      at = child;
    }
    nodes.get(at).compileIds.add(cid);
  }

  public boolean isEmpty() {
    Node root = nodes.get(0);
    return root.children.isEmpty() && root.compileIds.isEmpty();
  }

  /** Distinct frames stored, root excluded. */
  public int frameCount() {
    return nodes.size() - 1;
  }

  /**
   * Nested {@code {frame, compile_ids, children}} objects from the root down. Each compile id is
   * annotated with the outcome its compilation metrics report.
   */
  public ObjectNode toJson(Map<CompileId, List<JsonNode>> metrics) {
    return render(0, metrics);
  }

  private ObjectNode render(int index, Map<CompileId, List<JsonNode>> metrics) {
    Node n = nodes.get(index);
    ObjectNode o = Json.MAPPER.createObjectNode();
    if (n.frame != null) o.put("frame", n.frame);
    ArrayNode ids = o.putArray("compile_ids");
    for (CompileId cid : n.compileIds) {
      ObjectNode id = ids.addObject();
      id.put("id", cid == null ? "(unknown)" : cid.toString());
      id.put("status", status(metrics.get(cid)));
    }
    ArrayNode children = o.putArray("children");
    for (int child : n.children.values()) children.add(render(child, metrics));
    return o;
  }

  /** {@code failed}, {@code restarted}, {@code ok}, or {@code missing} when no metrics were logged. */
  static String status(List<JsonNode> metrics) {
    if (metrics == null || metrics.isEmpty()) return "missing";
    boolean restarted = false;
    for (JsonNode m : metrics) {
      if (Json.textAt(m, "fail_type") != null) return "failed";
      JsonNode reasons = Json.present(m, "restart_reasons");
      if (reasons != null && reasons.size() > 0) restarted = true;
    }
    return restarted ? "restarted" : "ok";
  }
}
