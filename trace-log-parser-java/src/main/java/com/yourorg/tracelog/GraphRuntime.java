package com.yourorg.tracelog;

import java.util.*;

/** Estimated per-op runtimes of one graph on one rank. */
public class GraphRuntime {
  public int rank;
  public String graph;
  public List<OpRuntime> ops = new ArrayList<>();

  public GraphRuntime() {}

  public GraphRuntime(int rank, String graph, List<OpRuntime> ops) {
    this.rank = rank;
    this.graph = graph;
    this.ops = ops;
  }

  public double totalNs() {
    double sum = 0;
    for (OpRuntime op : ops) sum += op.estimatedRuntimeNs;
    return sum;
  }
}
