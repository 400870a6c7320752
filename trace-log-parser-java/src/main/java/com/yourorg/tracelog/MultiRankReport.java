package com.yourorg.tracelog;

import java.util.*;

/** Landing page model of a multi-rank run. */
public class MultiRankReport {
  public List<Integer> ranks = new ArrayList<>();
  public List<String> rankPages = new ArrayList<>();
  public boolean hasChromiumEvents;
  public boolean showDesyncWarning;
  public boolean compileIdDivergence;
  public Diagnostics diagnostics;
}
