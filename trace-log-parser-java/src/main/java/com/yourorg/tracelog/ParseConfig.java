package com.yourorg.tracelog;

import com.yourorg.tracelog.parsers.StructuredLogParser;
import java.util.*;

/** Options for one pass, filled from CLI flags or by library callers. */
public class ParseConfig {
  public boolean strict;
  public boolean strictCompileId;
  public boolean verbose;
  public boolean plainText;
  public boolean export;
  /** Also write a provenance_tracking_<dir>.html page linking graph nodes to generated code. */
  public boolean inductorProvenance;

  /** Extra parsers, run after the defaults for every record. */
  public List<StructuredLogParser> customParsers = new ArrayList<>();
}
