package com.yourorg.tracelog;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

public class CompileIdTest {

  private static CompileId parse(String json) throws Exception {
    JsonNode n = Json.MAPPER.readTree(TraceLines.j(json));
    return CompileId.fromJson(n);
  }

  @Test
  void missing_attempt_collapses_to_zero() throws Exception {
    CompileId c = parse("{'frame_id': 1, 'frame_compile_id': 2}").normalized();
    assertEquals(0, c.attempt);
    assertEquals(new CompileId(null, 1, 2, 0), c);
  }

  @Test
  void normalization_is_idempotent() throws Exception {
    CompileId once = parse("{'frame_id': 1, 'frame_compile_id': 2}").normalized();
    assertEquals(once, once.normalized());

    CompileId noFrameCompile = parse("{'frame_id': 1}");
    assertNull(noFrameCompile.normalized().attempt);
  }

  @Test
  void display_and_directory_names() {
    assertEquals("[0/0]", new CompileId(null, 0, 0, 0).toString());
    assertEquals("[0/1_2]", new CompileId(null, 0, 1, 2).toString());
    assertEquals("[!3/0/1]", new CompileId(3, 0, 1, 0).toString());
    assertEquals("[-/-]", new CompileId(null, null, null, null).toString());

    assertEquals("-_0_0_0", new CompileId(null, 0, 0, 0).asDirectoryName());
    assertEquals("3_0_1_-", new CompileId(3, 0, 1, null).asDirectoryName());
    assertEquals("unknown_17", CompileId.directoryFor(null, 17));
  }

  @Test
  void rejects_negative_and_non_integer_parts() {
    assertThrows(IllegalArgumentException.class, () -> parse("{'frame_id': -1}"));
    assertThrows(IllegalArgumentException.class, () -> parse("{'frame_id': 'x'}"));
    assertThrows(IllegalArgumentException.class, () -> parse("[1, 2]"));
  }

  @Test
  void null_parts_are_absent() throws Exception {
    CompileId c = parse("{'frame_id': 0, 'frame_compile_id': null, 'attempt': null}");
    assertEquals(new CompileId(null, 0, null, null), c.normalized());
  }
}
