package com.yourorg.tracelog;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Identifies one compilation attempt: optional compiled-autograd id, frame id, frame compile id
 * and attempt number. Used as the directory bucket key, so equality covers all four parts.
 */
public final class CompileId {

  public final Integer compiledAutogradId;
  public final Integer frameId;
  public final Integer frameCompileId;
  public final Integer attempt;

  public CompileId(Integer compiledAutogradId, Integer frameId, Integer frameCompileId, Integer attempt) {
    this.compiledAutogradId = compiledAutogradId;
    this.frameId = frameId;
    this.frameCompileId = frameCompileId;
    this.attempt = attempt;
  }

  /**
   * Decodes a {@code compile_id} object. Absent or null parts stay null; any other non-integer
   * part is rejected.
   */
  public static CompileId fromJson(JsonNode n) {
    if (n == null || !n.isObject()) {
      throw new IllegalArgumentException("compile_id is not an object: " + n);
    }
    return new CompileId(
        part(n, "compiled_autograd_id"),
        part(n, "frame_id"),
        part(n, "frame_compile_id"),
        part(n, "attempt"));
  }

  private static Integer part(JsonNode n, String f) {
    JsonNode x = Json.present(n, f);
    if (x == null) return null;
    if (!x.canConvertToInt() || !x.isIntegralNumber() || x.asInt() < 0) {
      throw new IllegalArgumentException("compile_id." + f + " is not an unsigned integer: " + x);
    }
    return x.asInt();
  }

  /**
   * Some runtime compile ids carry a frame compile id but no attempt; those collapse into attempt 0.
   * Applying this twice yields the same id.
   */
  public CompileId normalized() {
    if (frameCompileId != null && attempt == null) {
      return new CompileId(compiledAutogradId, frameId, frameCompileId, 0);
    }
    return this;
  }

  /** {@code -_0_0_0} style name of the per-compile output directory. */
  public String asDirectoryName() {
    return dash(compiledAutogradId) + "_" + dash(frameId) + "_" + dash(frameCompileId) + "_" + dash(attempt);
  }

  private static String dash(Integer x) {
    return x == null ? "-" : x.toString();
  }

  /** Directory for a record's files; records without a compile id get a per-line directory. */
  public static String directoryFor(CompileId cid, int lineno) {
    return cid == null ? "unknown_" + lineno : cid.asDirectoryName();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    if (compiledAutogradId != null) sb.append('!').append(compiledAutogradId).append('/');
    sb.append(dash(frameId)).append('/').append(dash(frameCompileId));
    if (attempt != null && attempt != 0) sb.append('_').append(attempt);
    return sb.append(']').toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CompileId)) return false;
    CompileId c = (CompileId) o;
    return Objects.equals(compiledAutogradId, c.compiledAutogradId)
        && Objects.equals(frameId, c.frameId)
        && Objects.equals(frameCompileId, c.frameCompileId)
        && Objects.equals(attempt, c.attempt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(compiledAutogradId, frameId, frameCompileId, attempt);
  }
}
