package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.*;

/** One stack frame as logged; the filename usually arrives as an intern table id. */
public class FrameSummary {

  public Integer filename;
  public String uninternedFilename;
  public long line;
  public String name;
  public String loc;

  public static FrameSummary fromJson(JsonNode n) {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("frame is not an object: " + n);
    FrameSummary f = new FrameSummary();
    f.filename = Json.intAtOrNull(n, "filename");
    f.uninternedFilename = Json.textAt(n, "uninterned_filename");
    Long line = Json.longAtOrNull(n, "line");
    f.line = line != null ? line : 0L;
    f.name = Json.textAt(n, "name");
    f.loc = Json.textAt(n, "loc");
    return f;
  }

  /** Decodes a JSON array of frames; null or a non-array yields an empty stack. */
  public static List<FrameSummary> listFrom(JsonNode n) {
    List<FrameSummary> out = new ArrayList<>();
    if (n == null || !n.isArray()) return out;
    for (JsonNode f : n) out.add(fromJson(f));
    return out;
  }

  public String resolveFilename(InternTable table) {
    return uninternedFilename != null ? uninternedFilename : table.lookup(filename);
  }

  /** {@code torch/_dynamo/foo.py:12 in bar}, with the filename resolved and simplified. */
  public String render(InternTable table) {
    String s = simplifyFilename(resolveFilename(table)) + ":" + line + " in " + (name != null ? name : "");
    return loc != null ? s + "\n    " + loc : s;
  }

  static String simplifyFilename(String filename) {
    for (String marker : List.of("#link-tree/", "/site-packages/")) {
      int i = filename.indexOf(marker);
      if (i >= 0) return filename.substring(i + marker.length());
    }
    return filename;
  }

  private static final String[][][] CONVERT_FRAME_SUFFIXES = {
      {
          {"torch/_dynamo/convert_frame.py", "catch_errors"},
          {"torch/_dynamo/convert_frame.py", "_convert_frame"},
          {"torch/_dynamo/convert_frame.py", "_convert_frame_assert"},
      },
      {
          {"torch/_dynamo/convert_frame.py", "__call__"},
          {"torch/_dynamo/convert_frame.py", "__call__"},
          {"torch/_dynamo/convert_frame.py", "__call__"},
      },
  };

  /** Drops the dynamo wrapper frames that end every dynamo_start stack. */
  public static void removeConvertFrameSuffixes(List<FrameSummary> frames, InternTable table) {
    for (String[][] target : CONVERT_FRAME_SUFFIXES) {
      int len = frames.size();
      if (len < target.length) continue;
      boolean all = true;
      for (int i = 0; i < target.length; i++) {
        FrameSummary f = frames.get(len - target.length + i);
        if (!simplifyFilename(f.resolveFilename(table)).equals(target[i][0])
            || !target[i][1].equals(f.name)) {
          all = false;
          break;
        }
      }
      if (all) {
        frames.subList(len - target.length, len).clear();
      }
    }
  }
}
