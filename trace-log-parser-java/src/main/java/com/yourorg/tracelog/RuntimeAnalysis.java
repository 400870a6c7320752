package com.yourorg.tracelog;

import java.util.*;

public class RuntimeAnalysis {
  public List<GraphAnalysis> graphs = new ArrayList<>();
  public boolean hasMismatchedGraphCounts;
}
