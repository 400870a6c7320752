package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.*;

/** Node of the symbolic expression arena built from expression_created records in export mode. */
public class SymExprInfo {
  public long resultId;
  public String result;
  public String method;
  public List<String> arguments = new ArrayList<>();
  public List<Long> argumentIds = new ArrayList<>();
  public List<FrameSummary> userStack = new ArrayList<>();
  public List<FrameSummary> stack = new ArrayList<>();

  public static SymExprInfo fromExpressionCreated(JsonNode n) {
    SymExprInfo s = new SymExprInfo();
    s.resultId = requireId(n, "result_id");
    s.result = Json.textAt(n, "result");
    s.method = Json.textAt(n, "method");
    JsonNode args = Json.present(n, "arguments");
    if (args != null) for (JsonNode a : args) s.arguments.add(a.asText());
    JsonNode ids = Json.present(n, "argument_ids");
    if (ids != null) for (JsonNode a : ids) s.argumentIds.add(a.asLong());
    s.userStack = FrameSummary.listFrom(Json.present(n, "user_stack"));
    s.stack = FrameSummary.listFrom(Json.present(n, "stack"));
    return s;
  }

  public static SymExprInfo fromUnbackedSymbol(JsonNode n) {
    SymExprInfo s = new SymExprInfo();
    s.resultId = requireId(n, "node_id");
    s.result = Json.textAt(n, "symbol");
    s.userStack = FrameSummary.listFrom(Json.present(n, "user_stack"));
    s.stack = FrameSummary.listFrom(Json.present(n, "stack"));
    return s;
  }

  private static long requireId(JsonNode n, String f) {
    Long id = Json.longAtOrNull(n, f);
    if (id == null) throw new IllegalArgumentException("missing " + f);
    return id;
  }
}
