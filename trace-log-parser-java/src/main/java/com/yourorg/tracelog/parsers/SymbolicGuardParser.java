package com.yourorg.tracelog.parsers;

import com.fasterxml.jackson.databind.JsonNode;
import com.yourorg.tracelog.*;
import java.util.*;

/**
 * Export-mode page for an evaluated guard or a data-dependent specialization: the guard, its
 * stacks and the tree of symbolic expressions that produced it.
 */
public class SymbolicGuardParser implements StructuredLogParser {
  public static final String FILENAME = "symbolic_guard_information.html";

  private final ParseContext ctx;

  public SymbolicGuardParser(ParseContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public String name() {
    return "guard_added";
  }

  @Override
  public JsonNode metadata(Envelope e) {
    JsonNode m = e.field("propagate_real_tensors_provenance");
    return m != null ? m : e.field("guard_added");
  }

  @Override
  public List<ParserOutput> parse(int lineno, JsonNode m, Integer rank, CompileId compileId, String payload)
      throws Exception {
    InternTable strings = ctx.internTable;
    Long root = Json.longAtOrNull(m, "expr_node_id");
    if (root == null) throw new IllegalArgumentException("missing expr_node_id");
    String expr = Json.requireText(m, "expr");

    StringBuilder html = new StringBuilder("<html><body>\n");
    html.append("<h2>Guard</h2>\n").append(Html.pre(expr)).append('\n');
    html.append(Html.stack(FrameSummary.listFrom(Json.present(m, "user_stack")), strings, "User Stack", true));
    html.append('\n');
    html.append(Html.stack(FrameSummary.listFrom(Json.present(m, "stack")), strings, "Framework Stack", false));
    html.append('\n');
    JsonNode locals = Json.present(m, "frame_locals");
    if (locals != null) {
      html.append("<h3>Locals</h3>\n").append(Html.pre(Json.pretty(locals))).append('\n');
    }
    html.append("<h3>Expression tree</h3>\n");
    html.append(renderExprTree(root, ctx.symExprs, strings));
    html.append("</body></html>\n");
    return FileOutputs.file(FILENAME, lineno, compileId, html.toString());
  }

  /**
   * Depth-first rendering from {@code root}. A node reached a second time, through a shared
   * argument or a cycle, is skipped. Ids missing from the arena are leaves.
   */
  public static String renderExprTree(long root, Map<Long, SymExprInfo> arena, InternTable strings) {
    StringBuilder out = new StringBuilder();
    Set<Long> visited = new HashSet<>();
    Deque<long[]> todo = new ArrayDeque<>();
    todo.push(new long[] {root, 0});
    while (!todo.isEmpty()) {
      long[] top = todo.pop();
      long id = top[0];
      int depth = (int) top[1];
      if (!visited.add(id)) continue;
      SymExprInfo info = arena.get(id);
      if (info == null) continue;

      out.append("<div style=\"margin-left: ").append(depth * 20).append("px;\">\n");
      out.append("<h3>").append(Html.escape(info.result)).append("</h3>\n");
      out.append("<p>Method: ").append(Html.escape(info.method)).append("</p>\n");
      out.append("<p>Arguments: ").append(Html.escape(String.join(", ", info.arguments))).append("</p>\n");
      out.append(Html.stack(info.userStack, strings, "User Stack", true)).append('\n');
      out.append(Html.stack(info.stack, strings, "Stack", false)).append('\n');
      out.append("</div>\n");

      // reversed so the first argument is rendered first
      for (int i = info.argumentIds.size() - 1; i >= 0; i--) {
        todo.push(new long[] {info.argumentIds.get(i), depth + 1});
      }
    }
    return out.toString();
  }
}
