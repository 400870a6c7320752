package com.yourorg.tracelog;

import java.util.*;

/**
 * Per-compile-id list of records gathered earlier in the pass. A consumer takes the whole list,
 * so the same entries are never reported twice.
 */
public class CompileIdIndex<T> {

  private final Map<CompileId, List<T>> entries = new HashMap<>();

  public void add(CompileId cid, T value) {
    entries.computeIfAbsent(cid, k -> new ArrayList<>()).add(value);
  }

  /** Removes and returns the list for {@code cid}; empty when nothing was recorded. */
  public List<T> take(CompileId cid) {
    List<T> v = entries.remove(cid);
    return v != null ? v : new ArrayList<>();
  }
}
