package com.yourorg.tracelog;

import java.util.*;

/** Collective op names of one graph on one rank, in issue order. */
public class CollectiveSchedule {
  public int rank;
  public String graph;
  public List<String> ops = new ArrayList<>();

  public CollectiveSchedule() {}

  public CollectiveSchedule(int rank, String graph, List<String> ops) {
    this.rank = rank;
    this.graph = graph;
    this.ops = ops;
  }
}
