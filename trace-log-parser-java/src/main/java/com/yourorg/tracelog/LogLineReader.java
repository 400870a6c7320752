package com.yourorg.tracelog;

import java.io.*;

/**
 * Line source for one pass: skips blank lines, keeps 1-based physical line numbers and lets the
 * parser pull the tab-prefixed continuation block that follows a record.
 */
public class LogLineReader {

  private final BufferedReader br;
  private int physical = 0;

  private String peeked;
  private int peekedLineno;

  private String current;
  private int lineno;

  public LogLineReader(BufferedReader br) {
    this.br = br;
  }

  /** Advances to the next non-blank line; false at end of input. */
  public boolean next() throws IOException {
    if (!fill()) return false;
    lineno = peekedLineno;
    String text = peeked;
    peeked = null;
    current = text;
    return true;
  }

  public String line() { return current; }

  public int lineno() { return lineno; }

  /**
   * Consumes every immediately following line that starts with a tab and joins them, without the
   * tab, using newlines. No newline follows the last line, so a payload whose final line had no
   * EOL stays distinguishable from one that did.
   */
  public String readContinuation() throws IOException {
    StringBuilder payload = new StringBuilder();
    boolean first = true;
    while (fill() && peeked.startsWith("\t")) {
      if (!first) payload.append('\n');
      first = false;
      payload.append(peeked, 1, peeked.length());
      peeked = null;
    }
    return payload.toString();
  }

  private boolean fill() throws IOException {
    while (peeked == null) {
      String l = br.readLine();
      if (l == null) return false;
      physical++;
      if (l.isEmpty()) continue;
      peeked = l;
      peekedLineno = physical;
    }
    return true;
  }
}
