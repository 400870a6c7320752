package com.yourorg.tracelog.parsers;

import com.yourorg.tracelog.ParseConfig;
import java.util.*;

/** The built-in registry. Order matters only for which payload file a record ends up pointing at. */
public final class DefaultParsers {

  static final List<String> SENTINEL_KINDS = List.of(
      "optimize_ddp_split_graph",
      "compiled_autograd_graph",
      "aot_forward_graph",
      "aot_backward_graph",
      "aot_inference_graph",
      "aot_joint_graph",
      "inductor_post_grad_graph",
      "inductor_pre_grad_graph",
      "dynamo_cpp_guards_str");

  private DefaultParsers() {}

  public static List<StructuredLogParser> create(ParseConfig config) {
    List<StructuredLogParser> out = new ArrayList<>();
    if (config.export) {
      out.add(new SentinelFileParser("exported_program"));
      return out;
    }
    for (String kind : SENTINEL_KINDS) out.add(new SentinelFileParser(kind));
    out.add(new GraphDumpParser());
    out.add(new DynamoOutputGraphParser());
    out.add(new DynamoGuardParser(config.plainText));
    // provenance pages count lines of the generated source, so it stays plain text there
    out.add(new InductorOutputCodeParser(config.plainText || config.inductorProvenance));
    out.add(new OptimizeDdpSplitChildParser());
    out.add(new MetricsJsonParser("aot_autograd_backward_compilation_metrics"));
    out.add(new MetricsJsonParser("bwd_compilation_metrics"));
    out.add(new LinkParser());
    out.add(new ArtifactParser());
    out.add(new DumpFileParser());
    return out;
  }
}
