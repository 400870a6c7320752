package com.yourorg.tracelog.parsers;

/** Rewrites a raw payload before it is written, e.g. pretty-printing JSON. */
@FunctionalInterface
public interface PayloadFormatter {
  String format(String payload) throws Exception;
}
