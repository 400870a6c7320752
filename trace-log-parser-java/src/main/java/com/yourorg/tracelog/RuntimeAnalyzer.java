package com.yourorg.tracelog;

import java.util.*;

/**
 * Lines graphs up across ranks by position and reports, per position, the fastest and slowest
 * rank. Ranks reporting different graph counts cannot be lined up, so the result is then only
 * flagged as mismatched.
 */
public class RuntimeAnalyzer {

  /** Null when there is nothing to analyze. */
  public static RuntimeAnalysis analyze(List<GraphRuntime> runtimes) {
    if (runtimes.isEmpty()) return null;

    Map<Integer, List<GraphRuntime>> byRank = new TreeMap<>();
    for (GraphRuntime gr : runtimes) byRank.computeIfAbsent(gr.rank, k -> new ArrayList<>()).add(gr);

    RuntimeAnalysis a = new RuntimeAnalysis();
    int max = 0;
    int min = Integer.MAX_VALUE;
    for (List<GraphRuntime> l : byRank.values()) {
      max = Math.max(max, l.size());
      min = Math.min(min, l.size());
    }
    if (max != min) {
      a.hasMismatchedGraphCounts = true;
      return a;
    }

    for (int i = 0; i < max; i++) {
      double minRt = Double.POSITIVE_INFINITY;
      double maxRt = Double.NEGATIVE_INFINITY;
      int fastest = 0;
      int slowest = 0;
      String graphId = null;
      // ascending rank order; on equal totals the later rank takes both ends
      for (var e : byRank.entrySet()) {
        GraphRuntime gr = e.getValue().get(i);
        if (graphId == null) graphId = gr.graph;
        double rt = gr.totalNs();
        if (rt <= minRt) {
          minRt = rt;
          fastest = e.getKey();
        }
        if (rt >= maxRt) {
          maxRt = rt;
          slowest = e.getKey();
        }
      }

      GraphAnalysis g = new GraphAnalysis();
      g.graphIndex = i;
      g.graphId = graphId;
      g.deltaMs = nsToMs(maxRt - minRt);
      g.rankDetails.add(new RuntimeRankDetail(fastest, nsToMs(minRt)));
      g.rankDetails.add(new RuntimeRankDetail(slowest, nsToMs(maxRt)));
      a.graphs.add(g);
    }
    a.graphs.sort(Comparator.comparing(g -> g.graphId));
    return a;
  }

  /** Milliseconds rounded to three decimals. */
  static double nsToMs(double ns) {
    return Math.round(ns / 1e6 * 1000.0) / 1000.0;
  }
}
