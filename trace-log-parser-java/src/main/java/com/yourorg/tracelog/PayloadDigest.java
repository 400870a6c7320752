package com.yourorg.tracelog;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

/** MD5 integrity check for continuation payloads. */
public final class PayloadDigest {

  private PayloadDigest() {}

  /**
   * True when the MD5 of {@code payload} equals the 16 bytes encoded by {@code expectedHex}.
   * An expectation that is not 32 hex digits never matches.
   */
  public static boolean matches(String payload, String expectedHex) {
    if (expectedHex == null || expectedHex.length() != 32) return false;
    byte[] expected;
    try {
      expected = Hex.decodeHex(expectedHex);
    } catch (DecoderException e) {
      return false;
    }
    byte[] actual = DigestUtils.md5(payload.getBytes(StandardCharsets.UTF_8));
    return Arrays.equals(expected, actual);
  }

  public static String md5Hex(String payload) {
    return DigestUtils.md5Hex(payload.getBytes(StandardCharsets.UTF_8));
  }
}
