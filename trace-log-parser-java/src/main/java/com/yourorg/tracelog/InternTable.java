package com.yourorg.tracelog;

import java.util.*;

/**
 * Append-only id to string table fed by {@code str} side-channel records. Scoped to one pass.
 */
public class InternTable {

  public static final String UNKNOWN = "(unknown)";

  private final Map<Integer, String> entries = new HashMap<>();

  public void put(int id, String value) {
    entries.put(id, value);
  }

  /** The interned string, or {@link #UNKNOWN} for an id never inserted. */
  public String lookup(Integer id) {
    if (id == null) return UNKNOWN;
    String s = entries.get(id);
    return s != null ? s : UNKNOWN;
  }

  /** Dense array of size max id + 1 with null holes, as written on the first raw.jsonl line. */
  public List<String> toStringTable() {
    int max = entries.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);
    List<String> table = new ArrayList<>(Collections.nCopies(max + 1, (String) null));
    for (var e : entries.entrySet()) table.set(e.getKey(), e.getValue());
    return table;
  }
}
