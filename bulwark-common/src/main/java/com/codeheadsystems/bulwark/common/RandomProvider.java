package com.codeheadsystems.bulwark.common;

import java.security.SecureRandom;
import org.bouncycastle.util.encoders.Hex;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Key generation, nonces and identifiers all draw from the same provider so that tests
 * can substitute a seeded source.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a provider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Length must be non-negative: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Random lowercase hex string of {@code byteCount * 2} characters.
   *
   * @param byteCount the number of random bytes
   * @return the hex string
   */
  public String randomHex(int byteCount) {
    return Hex.toHexString(randomBytes(byteCount));
  }
}
