package com.yourorg.tracelog;

/** Row of failures_and_restarts.json. */
public class FailureEntry {
  public String compileId;
  /** Link to the compilation_metrics output of the same compile, null when there is no compile id. */
  public String metricsUrl;
  public String kind;
  public String reason;

  public FailureEntry() {}

  public FailureEntry(String compileId, String metricsUrl, String kind, String reason) {
    this.compileId = compileId;
    this.metricsUrl = metricsUrl;
    this.kind = kind;
    this.reason = reason;
  }
}
