package com.yourorg.tracelog;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.StringReader;
import org.junit.jupiter.api.Test;

public class LogLineReaderTest {

  private static LogLineReader reader(String text) {
    return new LogLineReader(new BufferedReader(new StringReader(text)));
  }

  @Test
  void blank_lines_are_skipped_but_counted() throws Exception {
    LogLineReader r = reader("a\n\n\nb\n");
    assertTrue(r.next());
    assertEquals("a", r.line());
    assertEquals(1, r.lineno());
    assertTrue(r.next());
    assertEquals("b", r.line());
    assertEquals(4, r.lineno());
    assertFalse(r.next());
  }

  @Test
  void continuation_lines_are_joined_without_trailing_newline() throws Exception {
    LogLineReader r = reader("head\n\tone\n\ttwo\nnext\n");
    assertTrue(r.next());
    assertEquals("one\ntwo", r.readContinuation());
    assertTrue(r.next());
    assertEquals("next", r.line());
    assertEquals(4, r.lineno());
  }

  @Test
  void trailing_empty_payload_line_keeps_its_newline() throws Exception {
    LogLineReader r = reader("head\n\tone\n\t\n");
    r.next();
    assertEquals("one\n", r.readContinuation());
  }

  @Test
  void no_continuation_gives_empty_payload() throws Exception {
    LogLineReader r = reader("head\nnext\n");
    r.next();
    assertEquals("", r.readContinuation());
    assertTrue(r.next());
    assertEquals("next", r.line());
  }

  @Test
  void the_caller_keeps_its_reader_open() throws Exception {
    BufferedReader br = new BufferedReader(new StringReader("head\n\tone\n"));
    LogLineReader r = new LogLineReader(br);
    while (r.next()) r.readContinuation();
    assertNull(br.readLine());
    assertFalse(java.io.Closeable.class.isAssignableFrom(LogLineReader.class));
  }

  @Test
  void digest_check() {
    String md5 = PayloadDigest.md5Hex("hello");
    assertEquals("5d41402abc4b2a76b9719d911017c592", md5);
    assertTrue(PayloadDigest.matches("hello", md5));
    assertFalse(PayloadDigest.matches("hello!", md5));
    assertFalse(PayloadDigest.matches("hello", "zz41402abc4b2a76b9719d911017c592"));
    assertFalse(PayloadDigest.matches("hello", "5d41"));
  }
}
