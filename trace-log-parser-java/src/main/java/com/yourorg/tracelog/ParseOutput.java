package com.yourorg.tracelog;

import java.util.*;

/**
 * Everything one pass produced: ordered (relative path, content) pairs plus the counters. Nothing
 * touches the disk until {@link OutputWriter} writes these out.
 */
public class ParseOutput {

  public static class Entry {
    public final String path;
    public final String content;

    public Entry(String path, String content) {
      this.path = path;
      this.content = content;
    }
  }

  public final List<Entry> files = new ArrayList<>();
  public ParseStats stats;
  public CompileDirectory directory;
  public Set<String> unknownFields = new TreeSet<>();

  public void add(String path, String content) {
    files.add(new Entry(path, content));
  }

  /** Last content written under each path. */
  public Map<String, String> asMap() {
    Map<String, String> m = new LinkedHashMap<>();
    for (Entry e : files) m.put(e.path, e.content);
    return m;
  }

  public List<String> paths() {
    List<String> out = new ArrayList<>();
    for (Entry e : files) out.add(e.path);
    return out;
  }
}
