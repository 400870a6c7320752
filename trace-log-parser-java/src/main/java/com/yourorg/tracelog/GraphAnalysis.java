package com.yourorg.tracelog;

import java.util.*;

/** Cross-rank spread of one graph's estimated runtime. */
public class GraphAnalysis {
  public int graphIndex;
  public String graphId;
  public double deltaMs;
  /** Fastest rank first, then slowest. */
  public List<RuntimeRankDetail> rankDetails = new ArrayList<>();
}
