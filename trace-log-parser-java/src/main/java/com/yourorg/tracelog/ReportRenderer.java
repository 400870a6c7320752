package com.yourorg.tracelog;

import java.io.IOException;

/** Turns pass and analysis results into landing pages. */
public interface ReportRenderer {

  /** Name of the landing page inside an output directory. */
  String indexFileName();

  String renderRankIndex(ParseContext ctx) throws IOException;

  String renderExportIndex(ParseContext ctx) throws IOException;

  String renderMultiRankIndex(MultiRankReport report) throws IOException;

  String renderDiagnostics(Diagnostics diagnostics) throws IOException;
}
