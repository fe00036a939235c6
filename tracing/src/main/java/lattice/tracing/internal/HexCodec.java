/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package lattice.tracing.internal;

public final class HexCodec {

  /**
   * Parses a 1 to 16 character hex string with no prefix into an unsigned long. Unlike trace
   * identifiers in B3, both upper and lower case digits are accepted and zero is a valid result.
   *
   * @throws NumberFormatException if the input is empty, too long or contains a non-hex character
   */
  public static long hexToUnsignedLong(CharSequence hex) {
    int length = hex.length();
    if (length < 1 || length > 16) throw isntHexLong(hex);
    long result = 0;
    for (int i = 0; i < length; i++) {
      char c = hex.charAt(i);
      result <<= 4;
      if (c >= '0' && c <= '9') {
        result |= c - '0';
      } else if (c >= 'a' && c <= 'f') {
        result |= c - 'a' + 10;
      } else if (c >= 'A' && c <= 'F') {
        result |= c - 'A' + 10;
      } else {
        throw isntHexLong(hex);
      }
    }
    return result;
  }

  static NumberFormatException isntHexLong(CharSequence hex) {
    throw new NumberFormatException(hex + " should be a 1 to 16 character hex string with no prefix");
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static String toLowerHex(long v) {
    char[] data = new char[16];
    writeHexLong(data, 0, v);
    return new String(data);
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static void writeHexLong(char[] data, int pos, long v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 56L) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 48L) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 40L) & 0xff));
    writeHexByte(data, pos + 6, (byte) ((v >>> 32L) & 0xff));
    writeHexByte(data, pos + 8, (byte) ((v >>> 24L) & 0xff));
    writeHexByte(data, pos + 10, (byte) ((v >>> 16L) & 0xff));
    writeHexByte(data, pos + 12, (byte) ((v >>> 8L) & 0xff));
    writeHexByte(data, pos + 14, (byte) (v & 0xff));
  }

  static final char[] HEX_DIGITS =
    {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

  static void writeHexByte(char[] data, int pos, byte b) {
    data[pos + 0] = HEX_DIGITS[(b >> 4) & 0xf];
    data[pos + 1] = HEX_DIGITS[b & 0xf];
  }

  HexCodec() {
  }
}
