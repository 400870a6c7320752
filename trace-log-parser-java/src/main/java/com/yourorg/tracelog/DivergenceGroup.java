package com.yourorg.tracelog;

import java.util.*;

/** Ranks that share one signature value. Ranks are ascending. */
public class DivergenceGroup {
  public final String sequence;
  public final List<Integer> ranks;

  public DivergenceGroup(String sequence, List<Integer> ranks) {
    this.sequence = sequence;
    this.ranks = Collections.unmodifiableList(new ArrayList<>(ranks));
  }

  /** {@code "0, 1, 3"} */
  public String ranksLabel() {
    StringJoiner j = new StringJoiner(", ");
    for (int r : ranks) j.add(Integer.toString(r));
    return j.toString();
  }
}
