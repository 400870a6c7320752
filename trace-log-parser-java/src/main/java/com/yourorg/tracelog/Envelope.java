package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.*;

/**
 * One decoded log record. The header fields are typed; every other top-level field is a "kind"
 * field exposed as a raw {@link JsonNode} so handlers can pick the ones they care about.
 */
public final class Envelope {

  public static final Set<String> HEADER_FIELDS = Set.of("rank", "compile_id", "has_payload", "str");

  /** Record kinds emitted by the compiler that this tool understands, handled or not. */
  public static final Set<String> KNOWN_KINDS = Set.of(
      "stack",
      "chromium_event",
      "dynamo_start",
      "dynamo_output_graph",
      "dynamo_guards",
      "dynamo_cpp_guards_str",
      "optimize_ddp_split_graph",
      "optimize_ddp_split_child",
      "compiled_autograd_graph",
      "aot_forward_graph",
      "aot_backward_graph",
      "aot_inference_graph",
      "aot_joint_graph",
      "inductor_pre_grad_graph",
      "inductor_post_grad_graph",
      "inductor_output_code",
      "compilation_metrics",
      "bwd_compilation_metrics",
      "aot_autograd_backward_compilation_metrics",
      "graph_dump",
      "link",
      "artifact",
      "dump_file",
      "symbolic_shape_specialization",
      "guard_added_fast",
      "guard_added",
      "propagate_real_tensors_provenance",
      "expression_created",
      "create_unbacked_symbol",
      "missing_fake_kernel",
      "mismatched_fake_kernel",
      "exported_program",
      "describe_storage",
      "describe_tensor",
      "describe_source");

  private final ObjectNode raw;
  private final Integer rank;
  private final CompileId compileId;
  private final String hasPayload;
  private final Integer internId;
  private final String internString;

  private Envelope(ObjectNode raw, Integer rank, CompileId compileId, String hasPayload,
                   Integer internId, String internString) {
    this.raw = raw;
    this.rank = rank;
    this.compileId = compileId;
    this.hasPayload = hasPayload;
    this.internId = internId;
    this.internString = internString;
  }

  /**
   * Decodes the header fields of {@code raw}. The compile id comes back already normalized.
   *
   * @throws IllegalArgumentException when a header field has the wrong shape
   */
  public static Envelope decode(ObjectNode raw) {
    Integer rank = null;
    JsonNode r = Json.present(raw, "rank");
    if (r != null) {
      if (!r.isIntegralNumber() || !r.canConvertToInt() || r.asInt() < 0) {
        throw new IllegalArgumentException("rank is not an unsigned integer: " + r);
      }
      rank = r.asInt();
    }

    JsonNode c = Json.present(raw, "compile_id");
    CompileId cid = c != null ? CompileId.fromJson(c).normalized() : null;

    String expect = null;
    JsonNode p = Json.present(raw, "has_payload");
    if (p != null) {
      if (!p.isTextual()) throw new IllegalArgumentException("has_payload is not a string: " + p);
      expect = p.asText();
    }

    Integer internId = null;
    String internString = null;
    JsonNode s = Json.present(raw, "str");
    if (s != null) {
      if (!s.isArray() || s.size() != 2 || !s.get(0).isTextual() || !s.get(1).isIntegralNumber()
          || !s.get(1).canConvertToInt() || s.get(1).asInt() < 0) {
        throw new IllegalArgumentException("str is not a [string, id] pair: " + s);
      }
      internString = s.get(0).asText();
      internId = s.get(1).asInt();
    }

    return new Envelope(raw, rank, cid, expect, internId, internString);
  }

  public ObjectNode raw() { return raw; }

  public Integer rank() { return rank; }

  /** Normalized compile id, or null when the record carries none. */
  public CompileId compileId() { return compileId; }

  /** Expected payload digest, or null when no continuation payload follows. */
  public String hasPayload() { return hasPayload; }

  public boolean isInternEntry() { return internId != null; }

  public Integer internId() { return internId; }

  public String internString() { return internString; }

  /** Value of a kind field, or null when absent or JSON null. */
  public JsonNode field(String name) {
    return Json.present(raw, name);
  }

  public boolean has(String name) {
    return field(name) != null;
  }

  /** Names of the populated non-header fields, in record order. */
  public List<String> kindFields() {
    List<String> out = new ArrayList<>();
    raw.fieldNames().forEachRemaining(k -> {
      if (!HEADER_FIELDS.contains(k) && has(k)) out.add(k);
    });
    return out;
  }
}
