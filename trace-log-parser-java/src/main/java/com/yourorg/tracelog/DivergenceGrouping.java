package com.yourorg.tracelog;

import java.util.*;

public class DivergenceGrouping {
  public final List<DivergenceGroup> groups;
  /** More than one distinct signature. */
  public final boolean divergent;

  public DivergenceGrouping(List<DivergenceGroup> groups) {
    this.groups = Collections.unmodifiableList(groups);
    this.divergent = groups.size() > 1;
  }
}
