package com.yourorg.tracelog;

/** A pass or analysis that cannot produce a trustworthy result. */
public class TraceLogException extends Exception {

  public TraceLogException(String message) {
    super(message);
  }

  public TraceLogException(String message, Throwable cause) {
    super(message, cause);
  }
}
