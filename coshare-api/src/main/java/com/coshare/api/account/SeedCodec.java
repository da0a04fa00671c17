package com.coshare.api.account;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Seeds arrive as text: {@code 0x}-prefixed hex is decoded, anything else is taken as UTF-8.
 */
public final class SeedCodec {

  private SeedCodec() {}

  public static byte[] decode(String seed) {
    if (seed == null) throw new IllegalArgumentException("seed is required");
    if (seed.startsWith("0x") || seed.startsWith("0X")) {
      String hex = seed.substring(2);
      if (hex.length() % 2 != 0) {
        throw new IllegalArgumentException("Hex seed must have an even number of digits");
      }
      try {
        return HexFormat.of().parseHex(hex);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid hex seed: " + seed, e);
      }
    }
    return seed.getBytes(StandardCharsets.UTF_8);
  }
}
