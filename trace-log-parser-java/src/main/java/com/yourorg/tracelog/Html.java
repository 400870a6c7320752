package com.yourorg.tracelog;

import java.util.List;

/** Minimal HTML helpers for the pages the handlers emit. */
public final class Html {

  private Html() {}

  public static String escape(String value) {
    if (value == null) {
      return "";
    }
    return value.replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;");
  }

  public static String pre(String text) {
    return "<pre>" + escape(text) + "</pre>";
  }

  /** Frames rendered one per line inside a collapsible block. */
  public static String stack(List<FrameSummary> frames, InternTable table, String caption, boolean open) {
    StringBuilder sb = new StringBuilder();
    sb.append(open ? "<details open>" : "<details>");
    sb.append("<summary>").append(escape(caption)).append("</summary>");
    StringBuilder body = new StringBuilder();
    for (FrameSummary f : frames) {
      if (body.length() > 0) body.append('\n');
      body.append(f.render(table));
    }
    sb.append(pre(body.toString()));
    sb.append("</details>");
    return sb.toString();
  }

  /**
   * Source page with one {@code <span id="L<n>">} per line, so {@code #L12} links land on line 12.
   */
  public static String anchorSource(String text) {
    StringBuilder html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"UTF-8\">\n")
        .append("<title>Source Code</title>\n<style>\n")
        .append("pre { counter-reset: line; }\n")
        .append("pre span { display: block; }\n")
        .append("pre span:before { counter-increment: line; content: counter(line); ")
        .append("display: inline-block; padding: 0 .5em; margin-right: .5em; color: #888; }\n")
        .append("pre span:target { background-color: #ffff00; }\n")
        .append("</style>\n</head>\n<body>\n<pre>");
    int n = 0;
    for (String line : text.lines().toArray(String[]::new)) {
      n++;
      html.append("<span id=\"L").append(n).append("\">").append(escape(line)).append("</span>");
    }
    html.append("</pre></body></html>");
    return html.toString();
  }
}
