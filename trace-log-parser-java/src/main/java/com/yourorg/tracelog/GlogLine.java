package com.yourorg.tracelog;

import java.util.regex.*;

/** Fixed glog prefix of a trace line: {@code V0612 08:40:39.123456 1234 path/to/file.py:42] {...}}. */
public final class GlogLine {

  private static final Pattern GLOG = Pattern.compile(
      "(?<level>[VIWEC])(?<month>\\d{2})(?<day>\\d{2}) "
          + "(?<hour>\\d{2}):(?<minute>\\d{2}):(?<second>\\d{2}).(?<micro>\\d{6}) "
          + "(?<thread>\\d+)\\s*"
          + "(?<pathname>[^:]+):(?<line>\\d+)\\] "
          + "(?<payload>.)");

  public char level;
  public int month;
  public int day;
  public int hour;
  public int minute;
  public int second;
  public int microsecond;
  public long thread;
  public String pathname;
  public long line;
  public String payload;

  /** Returns the decoded prefix, or null when the line does not follow the grammar. */
  public static GlogLine match(String text) {
    Matcher m = GLOG.matcher(text);
    if (!m.find()) return null;

    GlogLine g = new GlogLine();
    try {
      g.level = m.group("level").charAt(0);
      g.month = Integer.parseInt(m.group("month"));
      g.day = Integer.parseInt(m.group("day"));
      g.hour = Integer.parseInt(m.group("hour"));
      g.minute = Integer.parseInt(m.group("minute"));
      g.second = Integer.parseInt(m.group("second"));
      g.microsecond = Integer.parseInt(m.group("micro"));
      g.thread = Long.parseLong(m.group("thread"));
      g.line = Long.parseLong(m.group("line"));
    } catch (NumberFormatException overflow) {
      return null;
    }
    g.pathname = m.group("pathname");
    g.payload = text.substring(m.start("payload"));
    return g;
  }

  /** ISO-8601 with microseconds. glog has no year, so the caller supplies one. */
  public String isoTimestamp(int year) {
    return String.format("%04d-%02d-%02dT%02d:%02d:%02d.%06dZ",
        year, month, day, hour, minute, second, microsecond);
  }
}
