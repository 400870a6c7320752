package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;

/**
 * Compile id to artifact list, in first-seen order. Records without a compile id share the
 * {@code null} bucket, written as {@code unknown}.
 */
public class CompileDirectory {

  public static final String UNKNOWN_KEY = "unknown";

  private final LinkedHashMap<CompileId, List<OutputFile>> buckets = new LinkedHashMap<>();

  /** The bucket for a normalized compile id, created on first touch. */
  public List<OutputFile> bucket(CompileId cid) {
    return buckets.computeIfAbsent(cid, k -> new ArrayList<>());
  }

  public boolean hasUnknown() {
    return buckets.containsKey(null);
  }

  public Set<Map.Entry<CompileId, List<OutputFile>>> entries() {
    return Collections.unmodifiableSet(buckets.entrySet());
  }

  /** Every artifact, bucket by bucket. */
  public List<OutputFile> allFiles() {
    List<OutputFile> out = new ArrayList<>();
    for (List<OutputFile> files : buckets.values()) out.addAll(files);
    return out;
  }

  /**
   * {@code {"[0/0]": {"artifacts": [{url, name, number, suffix, readable_url}]}}}. Names lose
   * their directory part since the url already carries it.
   */
  public ObjectNode toJson() {
    ObjectNode root = Json.MAPPER.createObjectNode();
    for (var e : buckets.entrySet()) {
      String key = e.getKey() == null ? UNKNOWN_KEY : e.getKey().toString();
      ArrayNode artifacts = Json.MAPPER.createArrayNode();
      for (OutputFile f : e.getValue()) {
        ObjectNode a = artifacts.addObject();
        a.put("url", f.url);
        a.put("name", f.name.substring(f.name.lastIndexOf('/') + 1));
        a.put("number", f.number);
        a.put("suffix", f.suffix);
        if (f.readableUrl != null) a.put("readable_url", f.readableUrl);
        else a.putNull("readable_url");
      }
      root.putObject(key).set("artifacts", artifacts);
    }
    return root;
  }
}
