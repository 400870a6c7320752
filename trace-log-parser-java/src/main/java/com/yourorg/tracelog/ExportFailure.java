package com.yourorg.tracelog;

/** Row of export_failures.json: why an export would not go through and where to look. */
public class ExportFailure {
  public String failureType;
  public String reason;
  public String additionalInfo;

  public ExportFailure() {}

  public ExportFailure(String failureType, String reason, String additionalInfo) {
    this.failureType = failureType;
    this.reason = reason;
    this.additionalInfo = additionalInfo;
  }
}
