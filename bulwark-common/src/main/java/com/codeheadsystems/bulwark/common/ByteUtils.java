package com.codeheadsystems.bulwark.common;

import java.util.Arrays;

/**
 * Utility methods for octet string encoding and key byte hygiene.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to an octet string of specified length.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(int value, int length) {
    if (value < 0 || (length < 4 && value >= (1 << (8 * length)))) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] result = new byte[length];
    for (int i = length - 1; i >= 0; i--) {
      result[i] = (byte) (value & 0xFF);
      value >>= 8;
    }
    return result;
  }

  /**
   * Octet String to Integer Primitive (OS2IP) for big-endian prefixes of up to four bytes.
   *
   * @param data   the data
   * @param offset the offset of the first byte
   * @param length the number of bytes
   * @return the int
   */
  public static int OS2IP(byte[] data, int offset, int length) {
    if (length > 4 || offset < 0 || offset + length > data.length) {
      throw new IllegalArgumentException("Invalid length prefix range");
    }
    int value = 0;
    for (int i = 0; i < length; i++) {
      value = (value << 8) | (data[offset + i] & 0xFF);
    }
    return value;
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Overwrites the array with zeros. Null-safe.
   *
   * @param data the data
   */
  public static void zero(byte[] data) {
    if (data != null) {
      Arrays.fill(data, (byte) 0);
    }
  }

  /**
   * Constant-time comparison.
   *
   * @param a the a
   * @param b the b
   * @return true if equal
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return org.bouncycastle.util.Arrays.constantTimeAreEqual(a, b);
  }
}
