package com.yourorg.tracelog;

import java.util.*;

/** What one rank's pass produced, as read back from its compile_directory.json. */
public class RankMetadata {
  public int rank;
  public SortedSet<String> compileIds = new TreeSet<>();
  /** Cache glyphs of the rank's artifacts, in sequence-number order. */
  public String cacheSequence = "";

  public String compileIdSignature() {
    return String.join(",", compileIds);
  }
}
