package com.yourorg.tracelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * raw.jsonl: the envelopes without their payloads, one JSON object per line, each augmented with
 * the glog prefix fields. The first line holds the string table.
 */
public class ShortRawLog {
  private static final Logger log = LoggerFactory.getLogger(ShortRawLog.class);

  private final StringBuilder lines = new StringBuilder();
  private final int year;

  public ShortRawLog(int year) {
    this.year = year;
  }

  /**
   * Appends {@code envelope} plus timestamp, thread, pathname, lineno and, when given, the payload
   * filename. If the envelope already has any of those keys the whole line is dropped.
   */
  public void append(ObjectNode envelope, GlogLine g, String payloadFilename, ParseStats stats) {
    ObjectNode obj = envelope.deepCopy();
    Map<String, Object> extra = new LinkedHashMap<>();
    extra.put("timestamp", g.isoTimestamp(year));
    extra.put("thread", g.thread);
    extra.put("pathname", g.pathname);
    extra.put("lineno", g.line);
    if (payloadFilename != null) extra.put("payload_filename", payloadFilename);

    for (var e : extra.entrySet()) {
      if (obj.has(e.getKey())) {
        log.warn("Key conflict: '{}' already exists in JSON payload, skipping raw.jsonl conversion", e.getKey());
        stats.failKeyConflict++;
        return;
      }
      Object v = e.getValue();
      if (v instanceof Long) obj.put(e.getKey(), (Long) v);
      else obj.put(e.getKey(), (String) v);
    }

    try {
      lines.append(Json.compact(obj)).append('\n');
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize JSON for raw.jsonl: {}", ex.getMessage());
      stats.failJsonSerialization++;
    }
  }

  /** String table line followed by every appended line. */
  public String render(InternTable table) throws JsonProcessingException {
    ObjectNode head = Json.MAPPER.createObjectNode();
    var arr = head.putArray("string_table");
    for (String s : table.toStringTable()) {
      if (s == null) arr.addNull();
      else arr.add(s);
    }
    return Json.compact(head) + "\n" + lines;
  }
}
