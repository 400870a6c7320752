package com.yourorg.tracelog;

import java.util.*;

/** Counters for one pass. Every per-record problem lands in exactly one of these. */
public class ParseStats {
  public long ok;
  public long otherRank;
  public long failGlog;
  public long failJson;
  public long failPayloadMd5;
  public long failDynamoGuardsJson;
  public long failParser;
  public long failKeyConflict;
  public long failJsonSerialization;
  public long unknown;

  /** Handler name to failure count, for handlers other than dynamo_guards. */
  public Map<String, Long> parserFailures = new TreeMap<>();

  public void parserFailed(String name) {
    failParser++;
    parserFailures.merge(name, 1L, Long::sum);
  }

  /** Sum that strict mode requires to be zero. */
  public long strictFailureTotal() {
    return failGlog + failJson + failPayloadMd5 + otherRank + failDynamoGuardsJson + failParser;
  }

  @Override
  public String toString() {
    return "Stats { ok: " + ok
        + ", other_rank: " + otherRank
        + ", fail_glog: " + failGlog
        + ", fail_json: " + failJson
        + ", fail_payload_md5: " + failPayloadMd5
        + ", fail_dynamo_guards_json: " + failDynamoGuardsJson
        + ", fail_parser: " + failParser
        + ", fail_key_conflict: " + failKeyConflict
        + ", fail_json_serialization: " + failJsonSerialization
        + ", unknown: " + unknown + " }";
  }
}
